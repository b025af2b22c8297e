package babylon.filter.pipeline;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import babylon.filter.Cursor;
import babylon.filter.ErrorCode;
import babylon.filter.FilterException;
import babylon.filter.GenericFile;
import babylon.filter.IO;
import babylon.filter.Logger;
import babylon.filter.Meta;
import babylon.filter.Row;

/**
 * Read, classify, select and write loop for one source file.
 *
 * <pre>
 * OPENING -> STREAMING -> CLOSING -> DONE
 *     \___________\__________\_____> FAILED
 * </pre>
 *
 * Batches are classified on the shared worker pool and reassembled by row index, so
 * output order always equals input order. Output goes to a hidden sibling of the
 * destination and is moved into place only after the writer has been finalized; a
 * failed run leaves nothing behind.
 */
public final class BatchPipeline {

    public enum State {
        OPENING, STREAMING, CLOSING, DONE, FAILED
    }

    /** work items per worker and batch, evens out rows of uneven length */
    private static final int SLICES_PER_THREAD = 4;

    private final FileTask task;
    private final FilterConfig config;
    private final RowClassifier classifier;
    private final ExecutorService pool;
    private final Logger logger;

    private volatile State state = State.OPENING;
    private long rowsIn = 0;
    private long rowsOut = 0;
    private int batches = 0;

    public BatchPipeline(final FileTask task, final FilterConfig config, final RowClassifier classifier,
            final ExecutorService pool, final Logger logger) {
        this.task = task;
        this.config = config;
        this.classifier = classifier;
        this.pool = pool;
        this.logger = (logger != null ? logger : new Logger.NullLogger());
    }

    public State state() {
        return state;
    }

    /**
     * Filter the file, capturing any failure in the outcome.
     */
    public FileOutcome run() {
        final IO.StopWatch watch = new IO.StopWatch();
        try {
            process();
            return FileOutcome.done(task, rowsIn, rowsOut, watch.elapsed(), config.language(), config.clean());
        } catch (FilterException ex) {
            return fail(ex, watch);
        } catch (Exception ex) {
            return fail(FilterException.wrap(ex, ErrorCode.INTERNAL_ERROR, task.source()), watch);
        }
    }

    /**
     * Filter the file, throwing on failure.
     *
     * @throws FilterException classified by the state the pipeline failed in
     */
    public FileOutcome execute() throws FilterException {
        final FileOutcome outcome = run();
        if (!outcome.succeeded())
            throw outcome.exception();
        return outcome;
    }

    private FileOutcome fail(final FilterException ex, final IO.StopWatch watch) {
        final State at = state;
        state = State.FAILED;
        logger.log("[FAIL ] %s in %s: %s", task.source().getName(), at, ex.getMessage());
        return FileOutcome.failed(task, rowsIn, watch.elapsed(), config.language(), config.clean(), ex);
    }

    private void process() throws Exception {
        final File source = task.source();
        final File destination = task.destination();
        state = State.OPENING;
        if (destination.isDirectory())
            throw new FilterException(ErrorCode.OUTPUT_IS_DIRECTORY, destination);

        final IO.StopWatch watch = new IO.StopWatch();
        try (IO.Closer closer = new IO.Closer()) {
            final GenericFile in = closer.register(GenericFile.open(source, logger));
            final Meta meta = in.meta();
            final int column = meta.requireText(config.column());
            logger.log("[OPEN ] %s rows=%,d size=%s columns=%d, text column '%s' at %d", source.getName(),
                    in.rows(false), IO.readableBytesSize(in.fileSize()), meta.columns().length, config.column(), column);

            final File tmp = closer.deleteOnClose(IO.inprogress(destination));
            final GenericFile out = GenericFile.create(destination, tmp, in, config.compression(), logger);
            try (Cursor<RowBatch> cursor = RowBatch.cursor(meta, in.find(), config.batchSize())) {
                state = State.STREAMING;
                for (RowBatch batch; (batch = cursor.next()) != null;) {
                    stream(batch, column, out);
                }
            } catch (Exception ex) {
                try {
                    out.close();
                } catch (IOException suppressed) {
                    ex.addSuppressed(suppressed);
                }
                throw ex;
            }

            state = State.CLOSING;
            out.close();
            IO.publish(tmp, destination);
            closer.keep(tmp);
            logger.log("[DONE ] %s batches=%d in=%,d out=%,d, %s, %,d rows/s", destination.getName(), batches, rowsIn,
                    rowsOut, watch.humanReadableTime(), IO.StopWatch.ops(rowsIn, watch.elapsed()));
        }
        state = State.DONE;
    }

    private void stream(final RowBatch batch, final int column, final GenericFile out) throws IOException {
        final Classification[] results = classify(batch, column);
        final SelectionMask mask = SelectionMask.of(results);
        final RowBatch selected = batch.select(mask, column, config.clean() ? results : null);
        for (final Row r : selected) {
            out.write(r);
        }
        batches++;
        rowsIn += batch.size();
        rowsOut += selected.size();
        logger.log("[BATCH] %s #%d from row %,d rows=%,d kept=%,d", task.source().getName(), batch.index(),
                batch.offset(), batch.size(), selected.size());
    }

    /**
     * Scatter contiguous row slices over the pool; each slice writes its results at the
     * rows' own indexes, so completion order does not matter.
     */
    Classification[] classify(final RowBatch batch, final int column) throws FilterException {
        final int n = batch.size();
        final Classification[] results = new Classification[n];
        final int slices = Math.max(1, Math.min(n, config.threads() * SLICES_PER_THREAD));
        final int step = (n + slices - 1) / slices;

        final List<Callable<Void>> tasks = new ArrayList<>(slices);
        for (int from = 0; from < n; from += step) {
            final int lo = from;
            final int hi = Math.min(n, from + step);
            tasks.add(() -> {
                for (int i = lo; i < hi; i++) {
                    results[i] = classifier.classify(batch.get(i).getString(column));
                }
                return null;
            });
        }

        try {
            for (final Future<Void> f : pool.invokeAll(tasks)) {
                f.get();
            }
        } catch (ExecutionException ex) {
            throw FilterException.wrap(ex.getCause(), ErrorCode.DETECTION_FAILED,
                    task.source() + " batch " + batch.index());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new FilterException(ErrorCode.INTERNAL_ERROR, "interrupted", ex);
        }
        return results;
    }
}
