/**
 * Row-level access to values read from a columnar source.
 */
package babylon.filter;

/**
 * A single record of a columnar file in schema order.
 *
 * Values are kept in the representation the reader produced them in so they can be
 * written back unchanged; only text columns are normalized to {@link String}.
 */
public interface Row {

	/**
	 * Creates a new Row from an object array in column order.
	 *
	 * @param meta  the schema the values belong to
	 * @param array values, at most one per column; missing trailing values are null
	 * @return new Row instance
	 */
	public static Row create(final Meta meta, final Object[] array) {
		final Column[] columns = meta.columns();
		final Object[] a = new Object[columns.length];
		final int n = Math.min(columns.length, array.length);
		for (int i = 0; i < n; i++) {
			a[i] = columns[i].isText() ? text(array[i]) : array[i];
		}
		return new RowImpl(meta, a);
	}

	/**
	 * Avro hands out {@code Utf8}; everything textual becomes a String.
	 */
	static String text(final Object v) {
		return v == null ? null : v.toString();
	}

	Meta meta();

	/**
	 * @return object array with column values in column order
	 */
	Object[] array();

	int size();

	Object get(final int i);

	/**
	 * @param column exact column name
	 * @throws IllegalArgumentException if there is no such column
	 */
	Object get(final String column);

	String getString(final int i);

	String getString(final String column);

	/**
	 * Replace one value in place. Text columns accept any CharSequence.
	 */
	void set(final int i, final Object v);

	String toString(final String delimiter);
}
