package babylon.filter;

import com.github.pemistahl.lingua.api.Language;
import com.github.pemistahl.lingua.api.LanguageDetector;
import com.github.pemistahl.lingua.api.LanguageDetectorBuilder;

/**
 * {@link Detector} backed by Lingua. The Lingua detector is thread-safe, so a single
 * instance serves all workers; language models are loaded lazily unless preloaded.
 */
public final class LinguaDetector implements Detector {

    private final LanguageDetector detector;

    private LinguaDetector(final LanguageDetector detector) {
        this.detector = detector;
    }

    /**
     * Detector over every language Lingua knows.
     *
     * @param preload load all language models up front instead of on first use
     */
    public static LinguaDetector all(final boolean preload) {
        final LanguageDetectorBuilder builder = LanguageDetectorBuilder.fromAllLanguages();
        return new LinguaDetector((preload ? builder.withPreloadedLanguageModels() : builder).build());
    }

    /**
     * Detector restricted to a few candidate languages. Needs at least two.
     */
    public static LinguaDetector of(final Language... languages) {
        return new LinguaDetector(LanguageDetectorBuilder.fromLanguages(languages).build());
    }

    @Override
    public Language detect(final String text) {
        return detector.detectLanguageOf(text);
    }
}
