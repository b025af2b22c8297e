package babylon.filter.pipeline;

/**
 * Per-row retain/drop decisions of one batch, in batch order.
 */
public final class SelectionMask {

    private final boolean[] bits;
    private final int selected;

    private SelectionMask(final boolean[] bits) {
        this.bits = bits;
        int n = 0;
        for (boolean b : bits) {
            if (b)
                n++;
        }
        this.selected = n;
    }

    public static SelectionMask of(final Classification[] results) {
        final boolean[] bits = new boolean[results.length];
        for (int i = 0; i < results.length; i++) {
            bits[i] = results[i].keep();
        }
        return new SelectionMask(bits);
    }

    public static SelectionMask of(final boolean... bits) {
        return new SelectionMask(bits.clone());
    }

    /** number of rows, equal to the batch size */
    public int size() {
        return bits.length;
    }

    public boolean get(final int i) {
        return bits[i];
    }

    /** number of retained rows */
    public int selected() {
        return selected;
    }
}
