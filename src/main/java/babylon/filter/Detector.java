package babylon.filter;

import com.github.pemistahl.lingua.api.Language;

/**
 * Maps a piece of text to its most likely language.
 *
 * Implementations must be deterministic for identical input and safe to call from
 * many worker threads at once; one instance is shared by every row of a run.
 */
public interface Detector {

    /**
     * @param text non-empty text
     * @return detected language, {@link Language#UNKNOWN} when undetermined
     */
    Language detect(String text);
}
