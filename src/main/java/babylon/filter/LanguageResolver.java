package babylon.filter;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import com.github.pemistahl.lingua.api.Language;

/**
 * Resolves a user supplied language token (ISO code, English name or a localized
 * alias) to the detector's language.
 *
 * Matching trims the token and ignores case. The curated alias table is tried first,
 * then the English names of every language the detector supports.
 */
public final class LanguageResolver {

    private static final Map<String, Language> ALIASES;

    static {
        final Map<String, Language> m = new HashMap<>();
        alias(m, Language.UKRAINIAN, "uk", "ukr", "ukrainian", "українська");
        alias(m, Language.ENGLISH, "en", "eng", "english");
        alias(m, Language.RUSSIAN, "ru", "rus", "russian", "русский");
        alias(m, Language.POLISH, "pl", "polish");
        alias(m, Language.GERMAN, "de", "german");
        alias(m, Language.FRENCH, "fr", "french");
        alias(m, Language.SPANISH, "es", "spanish");
        ALIASES = Collections.unmodifiableMap(m);
    }

    private LanguageResolver() {
    }

    private static void alias(final Map<String, Language> m, final Language language, final String... tokens) {
        for (final String t : tokens)
            m.put(t, language);
    }

    /**
     * @param token e.g. "uk", "UKR", "Ukrainian", "українська", "Italian"
     * @return the matching language, never {@link Language#UNKNOWN}
     * @throws FilterException UNKNOWN_LANGUAGE when nothing matches
     */
    public static Language resolve(final String token) throws FilterException {
        if (token == null)
            throw new FilterException(ErrorCode.UNKNOWN_LANGUAGE, "'null'");
        final String code = token.trim().toLowerCase(Locale.ROOT);
        final Language alias = ALIASES.get(code);
        if (alias != null)
            return alias;
        for (final Language l : Language.values()) {
            if (l != Language.UNKNOWN && l.name().toLowerCase(Locale.ROOT).equals(code))
                return l;
        }
        throw new FilterException(ErrorCode.UNKNOWN_LANGUAGE, "'" + code + "'");
    }

    /**
     * English display name, e.g. {@code Ukrainian}.
     */
    public static String displayName(final Language language) {
        final String n = language.name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(n.charAt(0)) + n.substring(1);
    }
}
