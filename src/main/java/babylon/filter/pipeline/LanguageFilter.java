package babylon.filter.pipeline;

import java.io.File;
import java.io.PrintStream;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import babylon.filter.Detector;
import babylon.filter.FilterException;
import babylon.filter.Logger;

/**
 * Entry point of a filtering run. Owns the worker pool and shares it, together with
 * the detector and the resolved configuration, with every file of the run.
 *
 * <pre>
 * try (LanguageFilter f = new LanguageFilter(config, LinguaDetector.all(false), logger)) {
 *     f.file(new File("in.parquet"), new File("out.parquet"));
 *     RunReport report = f.directory(new File("in"), new File("out"), System.out);
 * }
 * </pre>
 */
public final class LanguageFilter implements AutoCloseable {

    private final FilterConfig config;
    private final RowClassifier classifier;
    private final ExecutorService pool;
    private final Logger logger;

    public LanguageFilter(final FilterConfig config, final Detector detector, final Logger logger) {
        this.config = config;
        this.classifier = new RowClassifier(detector, config);
        this.logger = (logger != null ? logger : new Logger.NullLogger());
        this.pool = Executors.newFixedThreadPool(config.threads(), new WorkerThreadFactory());
        this.logger.log("[FILTER] %s", config);
    }

    public FilterConfig config() {
        return config;
    }

    BatchPipeline pipeline(final FileTask task) {
        return new BatchPipeline(task, config, classifier, pool, logger);
    }

    /**
     * Pipeline for a single file, to be {@link BatchPipeline#run() run} by the caller.
     */
    public BatchPipeline pipeline(final File source, final File destination) {
        return pipeline(new FileTask(source, destination));
    }

    /**
     * Filter a single file.
     *
     * @throws FilterException whatever made the file fail
     */
    public FileOutcome file(final File source, final File destination) throws FilterException {
        return pipeline(new FileTask(source, destination)).execute();
    }

    /**
     * Filter every supported file of a directory; per-file failures end up in the report.
     */
    public RunReport directory(final File sourceDir, final File destDir, final PrintStream out) throws FilterException {
        return new DirectoryRunner(this, out, logger).run(sourceDir, destDir);
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.error("[POOL ] workers still busy after 10s, interrupting");
                pool.shutdownNow();
            }
        } catch (InterruptedException ex) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOLS = new AtomicInteger();
        private final int pool = POOLS.incrementAndGet();
        private final AtomicInteger n = new AtomicInteger();

        @Override
        public Thread newThread(final Runnable r) {
            final Thread t = new Thread(r, "babylon-" + pool + "-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
