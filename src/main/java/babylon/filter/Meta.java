/**
 *
 */
package babylon.filter;

import java.util.Arrays;

/**
 * Schema of a columnar file: its name and ordered column list.
 */
public final class Meta {
    private final String name;
    private Column[] columns = new Column[0];

    public Meta(final String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public Column[] columns() {
        return columns;
    }

    public Meta columns(final Column[] columns) {
        if (columns == null || columns.length == 0)
            throw new IllegalArgumentException("columns");
        for (int i = 0; i < columns.length; i++) {
            for (int j = i + 1; j < columns.length; j++) {
                if (columns[i].name().equals(columns[j].name()))
                    throw new IllegalArgumentException("Duplicate column : " + columns[i].name());
            }
        }
        this.columns = columns;
        return this;
    }

    /**
     * Position of a column, or -1 when there is none with this exact name.
     */
    public int index(final String column) {
        for (int i = 0; i < columns.length; i++) {
            if (columns[i].name().equals(column))
                return i;
        }
        return -1;
    }

    /**
     * Check that the designated column exists and holds text.
     *
     * @return position of the column
     * @throws FilterException COLUMN_NOT_FOUND or COLUMN_TYPE_MISMATCH
     */
    public int requireText(final String column) throws FilterException {
        final int i = index(column);
        if (i < 0)
            throw new FilterException(ErrorCode.COLUMN_NOT_FOUND, "'" + column + "' in " + name);
        if (!columns[i].isText())
            throw new FilterException(ErrorCode.COLUMN_TYPE_MISMATCH,
                    "'" + column + "' is " + Column.typename(columns[i].type()) + " in " + name);
        return i;
    }

    /**
     * Same column names, types and order. The file name is not compared.
     */
    public boolean sameColumns(final Meta other) {
        return other != null && Arrays.equals(columns, other.columns);
    }

    @Override
    public String toString() {
        final StringBuilder s = new StringBuilder(name).append(" (");
        for (int i = 0; i < columns.length; i++) {
            if (i > 0)
                s.append(", ");
            s.append(columns[i]);
        }
        return s.append(")").toString();
    }
}
