/**
 *
 */
package babylon.filter;

/**
 * Column definition of a columnar source
 *
 * Describes one top level field: its exact name (case is preserved, names are
 * matched verbatim), its data type and whether it accepts nulls.
 */
public final class Column {
    /** Null value type */
    public static final short TYPE_NULL = 0;
    /** 32-bit signed integer */
    public static final short TYPE_INT = 2;
    /** 64-bit signed integer */
    public static final short TYPE_INT64 = 8;
    /** 64-bit double precision floating point */
    public static final short TYPE_DOUBLE = 9;
    /** 32-bit single precision floating point */
    public static final short TYPE_FLOAT = 10;
    /** Variable-length UTF-8 string */
    public static final short TYPE_STRING = 11;
    /** Binary data */
    public static final short TYPE_BYTES = 13;
    /** Boolean */
    public static final short TYPE_BOOLEAN = 19;
    /** Anything else: nested records, lists, maps, enums, fixed */
    public static final short TYPE_OBJECT = 31;

    private final String name;
    private final short type;
    private final boolean nullable;

    /**
     * @param name     Column name, kept as written in the source
     * @param type     Data type constant
     * @param nullable Whether the column accepts null values
     */
    public Column(final String name, final short type, final boolean nullable) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("column name");
        this.name = name;
        this.type = type;
        this.nullable = nullable;
    }

    public String name() {
        return name;
    }

    /**
     * Get data type constant for this column
     *
     * @return Type constant (e.g., TYPE_STRING, TYPE_INT)
     */
    public short type() {
        return type;
    }

    public boolean nullable() {
        return nullable;
    }

    public boolean isText() {
        return type == TYPE_STRING;
    }

    public static String typename(final short type) {
        return switch (type) {
            case TYPE_NULL -> "NULL";
            case TYPE_INT -> "INT";
            case TYPE_INT64 -> "INT64";
            case TYPE_DOUBLE -> "DOUBLE";
            case TYPE_FLOAT -> "FLOAT";
            case TYPE_STRING -> "STRING";
            case TYPE_BYTES -> "BYTES";
            case TYPE_BOOLEAN -> "BOOLEAN";
            default -> "OBJECT";
        };
    }

    @Override
    public boolean equals(final Object o) {
        if (!(o instanceof Column c))
            return false;
        return name.equals(c.name) && type == c.type && nullable == c.nullable;
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + type;
    }

    @Override
    public String toString() {
        return name + " " + typename(type) + (nullable ? "" : " NOT NULL");
    }

    /**
     * Builder pattern for creating Column instances
     */
    public static final class Builder {
        private final String name;
        private final short type;
        private boolean nullable = true;

        public Builder(final String name, final short type) {
            this.name = name;
            this.type = type;
        }

        public Builder notnull(final boolean notnull) {
            this.nullable = !notnull;
            return this;
        }

        public Column create() {
            return new Column(name, type, nullable);
        }
    }
}
