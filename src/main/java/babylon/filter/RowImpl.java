/**
 *
 */
package babylon.filter;

import java.util.Arrays;

/**
 *
 */
final class RowImpl implements Row {
	final Meta meta;
	final Object[] array;

	RowImpl(final Meta meta, final Object[] array) {
		if (array == null || array.length == 0)
			throw new IllegalArgumentException();
		this.meta = meta;
		this.array = array;
	}

	@Override
	public Meta meta() {
		return meta;
	}

	@Override
	public Object[] array() {
		return array;
	}

	@Override
	public int size() {
		return array.length;
	}

	@Override
	public Object get(final int i) {
		return array[i];
	}

	@Override
	public Object get(final String column) {
		return array[position(column)];
	}

	@Override
	public String getString(final int i) {
		return Row.text(array[i]);
	}

	@Override
	public String getString(final String column) {
		return Row.text(array[position(column)]);
	}

	@Override
	public void set(final int i, final Object v) {
		array[i] = meta.columns()[i].isText() ? Row.text(v) : v;
	}

	private int position(final String column) {
		final int i = meta.index(column);
		if (i < 0)
			throw new IllegalArgumentException("Column not found : " + column);
		return i;
	}

	@Override
	public int hashCode() {
		return Arrays.deepHashCode(array);
	}

	@Override
	public boolean equals(final Object o) {
		if (!(o instanceof Row r))
			return false;
		return Arrays.deepEquals(array, r.array());
	}

	@Override
	public String toString(final String delimiter) {
		final StringBuilder s = new StringBuilder();
		for (int i = 0; i < array.length; i++) {
			if (i > 0)
				s.append(delimiter);
			final Object v = array[i];
			s.append(v == null ? "\\N" : (v instanceof byte[] b) ? Arrays.toString(b) : v.toString());
		}
		return s.toString();
	}

	@Override
	public String toString() {
		return toString(", ");
	}
}
