package babylon.filter.pipeline;

import com.github.pemistahl.lingua.api.Language;

/**
 * Keep/drop decision for one text value and the value to emit if kept.
 */
public final class Classification {

    static final Classification KEEP_EMPTY = new Classification(true, null, null, false);
    static final Classification DROP_EMPTY = new Classification(false, null, null, false);

    private final boolean keep;
    private final String text;
    private final Language detected;
    private final boolean replaced;

    private Classification(final boolean keep, final String text, final Language detected, final boolean replaced) {
        this.keep = keep;
        this.text = text;
        this.detected = detected;
        this.replaced = replaced;
    }

    /** the value was null or empty and followed the keep-empty policy */
    static Classification empty(final boolean keepEmpty) {
        return keepEmpty ? KEEP_EMPTY : DROP_EMPTY;
    }

    /** cleaning produced an empty value, which then followed the keep-empty policy */
    static Classification cleanedEmpty(final boolean keepEmpty, final String cleaned) {
        return new Classification(keepEmpty, cleaned, null, true);
    }

    static Classification detected(final boolean keep, final Language detected, final String text,
            final boolean replaced) {
        return new Classification(keep, text, detected, replaced);
    }

    public boolean keep() {
        return keep;
    }

    /**
     * Value to write for a kept row. Only meaningful when {@link #replaced()}.
     */
    public String text() {
        return text;
    }

    /**
     * @return detected language, null when no detection was attempted
     */
    public Language detected() {
        return detected;
    }

    /** whether the emitted value differs in origin from the input, i.e. it was cleaned */
    public boolean replaced() {
        return replaced;
    }

    @Override
    public String toString() {
        return (keep ? "keep" : "drop") + (detected != null ? " " + detected : "") + (replaced ? " '" + text + "'" : "");
    }
}
