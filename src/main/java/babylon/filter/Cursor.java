/**
 * Forward-only iteration over rows or row batches with resource management.
 */
package babylon.filter;

/**
 * Interface for iterating over a source in a forward-only manner.
 * Implements AutoCloseable so the underlying reader is released.
 *
 * <pre>{@code
 * try (ParquetFile in = ParquetFile.open(file); Cursor<Row> cursor = in.find()) {
 *     for (Row row; (row = cursor.next()) != null;) {
 *         System.out.println(row.toString("\t"));
 *     }
 * }
 * }</pre>
 *
 * @param <T> the type of objects returned by this cursor
 */
public interface Cursor<T> extends AutoCloseable {
	/**
	 * Advances the cursor to the next element.
	 *
	 * @return the next element, or null when there are no more
	 * @throws Exception if the underlying source cannot be read
	 */
	T next() throws Exception;
}
