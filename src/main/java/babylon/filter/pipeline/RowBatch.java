package babylon.filter.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import babylon.filter.Cursor;
import babylon.filter.Meta;
import babylon.filter.Row;

/**
 * Bounded, ordered slice of rows sharing one schema. Batches partition a file; their
 * boundaries never change which rows are selected.
 */
public final class RowBatch implements Iterable<Row> {

    private final Meta meta;
    private final List<Row> rows;
    private final int index;
    private final long offset;

    RowBatch(final Meta meta, final List<Row> rows, final int index, final long offset) {
        this.meta = meta;
        this.rows = Collections.unmodifiableList(rows);
        this.index = index;
        this.offset = offset;
    }

    public Meta meta() {
        return meta;
    }

    public int size() {
        return rows.size();
    }

    public Row get(final int i) {
        return rows.get(i);
    }

    /** position of this batch in its file, from 0 */
    public int index() {
        return index;
    }

    /** file position of the first row */
    public long offset() {
        return offset;
    }

    @Override
    public Iterator<Row> iterator() {
        return rows.iterator();
    }

    /**
     * Keep the rows the mask selects, in order. When {@code results} carry replacement
     * text, the value of {@code column} is overwritten in the kept rows; rows belong to
     * their batch so they are updated in place.
     *
     * @throws IllegalArgumentException if the mask does not cover this batch
     */
    public RowBatch select(final SelectionMask mask, final int column, final Classification[] results) {
        if (mask.size() != rows.size())
            throw new IllegalArgumentException("mask size " + mask.size() + " != batch size " + rows.size());
        final List<Row> kept = new ArrayList<>(mask.selected());
        for (int i = 0; i < rows.size(); i++) {
            if (!mask.get(i))
                continue;
            final Row r = rows.get(i);
            if (results != null && results[i].replaced())
                r.set(column, results[i].text());
            kept.add(r);
        }
        return new RowBatch(meta, kept, index, offset);
    }

    /**
     * Group a row cursor into batches of at most {@code batchSize} rows. Closing the
     * returned cursor closes {@code rows}.
     */
    public static Cursor<RowBatch> cursor(final Meta meta, final Cursor<Row> rows, final int batchSize) {
        if (batchSize < 1)
            throw new IllegalArgumentException("batchSize");
        return new Cursor<RowBatch>() {
            private int index = 0;
            private long offset = 0;
            private boolean finished = false;

            @Override
            public RowBatch next() throws Exception {
                if (finished)
                    return null;
                final List<Row> a = new ArrayList<>(Math.min(batchSize, 4096));
                Row r;
                while (a.size() < batchSize && (r = rows.next()) != null) {
                    a.add(r);
                }
                if (a.size() < batchSize)
                    finished = true;
                if (a.isEmpty())
                    return null;
                final RowBatch b = new RowBatch(meta, a, index++, offset);
                offset += a.size();
                return b;
            }

            @Override
            public void close() throws Exception {
                finished = true;
                rows.close();
            }
        };
    }
}
