package babylon.filter.pipeline;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import babylon.filter.ErrorCode;
import babylon.filter.FilterException;
import babylon.filter.GenericFile;
import babylon.filter.Logger;

/**
 * Filters every supported file directly under a source directory into a mirrored
 * destination directory.
 *
 * Files run one after another, each with row-level parallelism on the shared pool.
 * A failing file is recorded and the run moves on to the next one; failures are left
 * to the caller to report from the {@link RunReport}.
 */
public final class DirectoryRunner {

    private final LanguageFilter filter;
    private final PrintStream out;
    private final Logger logger;

    /**
     * @param out receives the summary line of every finished file, may be null
     */
    public DirectoryRunner(final LanguageFilter filter, final PrintStream out, final Logger logger) {
        this.filter = filter;
        this.out = out;
        this.logger = (logger != null ? logger : new Logger.NullLogger());
    }

    /**
     * @throws FilterException OUTPUT_NOT_DIRECTORY, NO_INPUT_FILES, or STORAGE_READ_ERROR when
     *                         the source directory cannot be listed
     */
    public RunReport run(final File sourceDir, final File destDir) throws FilterException {
        final List<FileTask> tasks = plan(sourceDir, destDir);
        logger.log("[INPUT] dir=%s, matched files: %,d", sourceDir, tasks.size());

        final RunReport report = new RunReport();
        int i = 0;
        for (final FileTask task : tasks) {
            logger.log("[START] %d/%d %s", ++i, tasks.size(), task);
            final FileOutcome outcome = filter.pipeline(task).run();
            report.add(outcome);
            if (out != null && outcome.succeeded())
                out.println(outcome.summary());
        }
        logger.log("[TOTAL] %s", report.summary());
        return report;
    }

    /**
     * List eligible files (one level, sorted by name) and map them into {@code destDir},
     * creating it when absent.
     */
    public static List<FileTask> plan(final File sourceDir, final File destDir) throws FilterException {
        if (destDir.exists() && !destDir.isDirectory())
            throw new FilterException(ErrorCode.OUTPUT_NOT_DIRECTORY, destDir);
        if (!sourceDir.isDirectory())
            throw new FilterException(ErrorCode.STORAGE_READ_ERROR, "not a directory " + sourceDir);

        final List<File> files = new ArrayList<>();
        try (Stream<Path> s = Files.list(sourceDir.toPath())) {
            s.filter(Files::isRegularFile)
                    .map(Path::toFile)
                    .filter(GenericFile::supports)
                    .sorted(Comparator.comparing(File::getName))
                    .forEach(files::add);
        } catch (IOException ex) {
            throw new FilterException(ErrorCode.STORAGE_READ_ERROR, sourceDir, ex);
        }
        if (files.isEmpty())
            throw new FilterException(ErrorCode.NO_INPUT_FILES, sourceDir);

        try {
            Files.createDirectories(destDir.toPath());
        } catch (IOException ex) {
            throw new FilterException(ErrorCode.STORAGE_WRITE_ERROR, destDir, ex);
        }

        final List<FileTask> tasks = new ArrayList<>(files.size());
        for (final File f : files) {
            tasks.add(FileTask.mirror(f, destDir));
        }
        return tasks;
    }
}
