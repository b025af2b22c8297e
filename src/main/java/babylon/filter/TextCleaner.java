package babylon.filter;

import java.util.regex.Pattern;

/**
 * Strips everything except letters, punctuation and single spaces from a text value.
 *
 * Works on code points, so surrogate pairs (emoji) are removed whole and multi-byte
 * letters are never split. Combining marks stay with their letters and go with
 * anything else. The result is stable under a second application.
 */
public final class TextCleaner {

    /**
     * Not a letter, mark, punctuation or whitespace, plus punctuation that is noise in
     * transcripts, each with the marks attached to it (emoji variation selectors, keycaps).
     * Marks are kept only after a letter.
     */
    private static final Pattern DROP = Pattern.compile(
            "[^\\p{L}\\p{M}\\p{P}\\s]\\p{M}*|[@#%&*()]\\p{M}*|(?<![\\p{L}\\p{M}])\\p{M}+",
            Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextCleaner() {
    }

    /**
     * @param text value to clean, may be null
     * @return cleaned value, null for null
     */
    public static String clean(final String text) {
        if (text == null || text.isEmpty())
            return text;
        final String kept = DROP.matcher(text).replaceAll("");
        return WHITESPACE.matcher(kept).replaceAll(" ").strip();
    }
}
