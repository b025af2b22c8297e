/**
 *
 */
package babylon.filter;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.List;

/**
 * File helpers shared by the readers, writers and runners.
 */
public final class IO {

	private IO() {
	}

	/**
	 * Closes registered resources in reverse order of registration.
	 * The first failure is rethrown after every resource had its chance to close.
	 */
	public static final class Closer implements AutoCloseable {
		final List<AutoCloseable> a = new ArrayList<>();

		public Closer() {
		}

		public <T extends AutoCloseable> T register(final T object) {
			if (null != object)
				a.add(object);
			return object;
		}

		/**
		 * Registers a file to be deleted when the Closer is closed, unless it was
		 * released with {@link #keep(File)} first.
		 */
		public File deleteOnClose(final File file) {
			a.add(new TempFile(file));
			return file;
		}

		public void keep(final File file) {
			a.removeIf(o -> o instanceof TempFile t && t.file.equals(file));
		}

		@Override
		public void close() throws IOException {
			IOException first = null;
			for (int i = a.size() - 1; i >= 0; i--) {
				final AutoCloseable o = a.get(i);
				try {
					o.close();
				} catch (IOException ex) {
					if (first == null)
						first = ex;
				} catch (Exception ex) {
					if (first == null)
						first = new IOException(ex);
				}
			}
			a.clear();
			if (first != null)
				throw first;
		}

		private static final class TempFile implements AutoCloseable {
			private final File file;

			TempFile(final File file) {
				this.file = file;
			}

			@Override
			public void close() throws IOException {
				Files.deleteIfExists(file.toPath());
			}
		}
	}

	/**
	 * Temporary sibling used while a file is being written, e.g. {@code .out.parquet.inprogress}.
	 */
	public static File inprogress(final File target) {
		return new File(target.getAbsoluteFile().getParentFile(), "." + target.getName() + ".inprogress");
	}

	/**
	 * Move a finished file over its target, atomically where the filesystem allows it.
	 */
	public static void publish(final File source, final File target) throws IOException {
		try {
			Files.move(source.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		} catch (AtomicMoveNotSupportedException ex) {
			Files.move(source.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
		}
	}

	public static String readableBytesSize(final long bytes) {
		long v = bytes;
		if (v <= 0)
			return "0";

		final String[] units = new String[] { "B", "K", "M", "G", "T" };

		int digitGroups = (int) (Math.log10(v) / Math.log10(1024));
		return new DecimalFormat("#,##0.#").format(v / Math.pow(1024, digitGroups)) + "" + units[digitGroups];
	}

	public static final class StopWatch {
		private final long start;

		public StopWatch() {
			this.start = System.currentTimeMillis();
		}

		public long elapsed() {
			return System.currentTimeMillis() - start;
		}

		public static long ops(final long count, final long ms) {
			return Math.round(count / (Math.max(1, ms) / 1000.0d));
		}

		public String humanReadableTime() {
			return humanReadableTime(elapsed());
		}

		public static String humanReadableTime(final long ms) {
			long s = (ms / 1000L);
			if (s > 3600) {
				int hours = (int) (s / 3600);
				int mins = (int) (s - hours * 3600) / 60;
				if (mins > 0)
					return String.format("%dh%dm", hours, mins);
				return String.format("%dh", hours);
			} else if (s > 60) {
				int mins = (int) (s / 60);
				int secs = (int) (s - mins * 60);
				if (secs > 0)
					return String.format("%dm%ds", mins, secs);
				return String.format("%dm", mins);
			} else if (s > 1) {
				return String.format("%ds", s);
			}
			return String.format("%dms", ms);
		}
	}
}
