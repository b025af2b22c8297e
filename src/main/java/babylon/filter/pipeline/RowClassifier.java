package babylon.filter.pipeline;

import com.github.pemistahl.lingua.api.Language;

import babylon.filter.Detector;
import babylon.filter.ErrorCode;
import babylon.filter.FilterException;
import babylon.filter.TextCleaner;

/**
 * Decides whether one text value is in the target language.
 *
 * Null and empty values bypass detection and follow the keep-empty policy. With
 * cleaning enabled, detection sees the cleaned value and a kept row emits it.
 * Holds no mutable state; one instance is shared by all workers.
 */
public final class RowClassifier {

    private final Detector detector;
    private final Language target;
    private final boolean clean;
    private final boolean keepEmpty;

    public RowClassifier(final Detector detector, final Language target, final boolean clean, final boolean keepEmpty) {
        if (detector == null || target == null)
            throw new IllegalArgumentException("detector and target are required");
        this.detector = detector;
        this.target = target;
        this.clean = clean;
        this.keepEmpty = keepEmpty;
    }

    public RowClassifier(final Detector detector, final FilterConfig config) {
        this(detector, config.language(), config.clean(), config.keepEmpty());
    }

    /**
     * @throws FilterException DETECTION_FAILED when the detector raises
     */
    public Classification classify(final String text) throws FilterException {
        if (text == null || text.isEmpty())
            return Classification.empty(keepEmpty);

        final String input;
        if (clean) {
            input = TextCleaner.clean(text);
            if (input.isEmpty())
                return Classification.cleanedEmpty(keepEmpty, input);
        } else {
            input = text;
        }

        final Language detected;
        try {
            detected = detector.detect(input);
        } catch (RuntimeException ex) {
            throw new FilterException(ErrorCode.DETECTION_FAILED, abbreviate(input), ex);
        }
        return Classification.detected(target.equals(detected), detected, input, clean);
    }

    public Language target() {
        return target;
    }

    private static String abbreviate(final String s) {
        return s.length() <= 40 ? "'" + s + "'" : "'" + s.substring(0, 40) + "...'";
    }
}
