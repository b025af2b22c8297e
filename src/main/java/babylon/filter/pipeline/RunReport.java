package babylon.filter.pipeline;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import babylon.filter.ErrorCode;
import babylon.filter.FilterException;

/**
 * Per-file outcomes of a run, in discovery order.
 */
public final class RunReport {

    public enum Status {
        /** every file done */
        SUCCESS(0),
        /** some files failed, at least one done */
        PARTIAL(2),
        /** every file failed, or there was nothing to process */
        FAILED(1);

        private final int exitCode;

        Status(final int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final List<FileOutcome> files = new ArrayList<>();

    public RunReport add(final FileOutcome outcome) {
        files.add(outcome);
        return this;
    }

    public List<FileOutcome> files() {
        return Collections.unmodifiableList(files);
    }

    public int processed() {
        return files.size();
    }

    public int succeeded() {
        return (int) files.stream().filter(FileOutcome::succeeded).count();
    }

    public int failed() {
        return processed() - succeeded();
    }

    public long rowsIn() {
        return files.stream().mapToLong(FileOutcome::rowsIn).sum();
    }

    public long rowsOut() {
        return files.stream().mapToLong(FileOutcome::rowsOut).sum();
    }

    public Status status() {
        if (files.isEmpty() || succeeded() == 0)
            return Status.FAILED;
        return failed() == 0 ? Status.SUCCESS : Status.PARTIAL;
    }

    public int exitCode() {
        return status().exitCode();
    }

    public String summary() {
        return String.format("processed=%d succeeded=%d failed=%d rows: in=%d out=%d", processed(), succeeded(),
                failed(), rowsIn(), rowsOut());
    }

    public String toJson() {
        final Json j = new Json();
        j.status = status();
        j.processed = processed();
        j.succeeded = succeeded();
        j.failed = failed();
        j.files = files;
        return GSON.toJson(j);
    }

    /**
     * Write the JSON form of this report.
     */
    public void write(final File file) throws IOException {
        try (Writer w = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
            w.write(toJson());
        } catch (IOException ex) {
            throw new FilterException(ErrorCode.STORAGE_WRITE_ERROR, file, ex);
        }
    }

    @Override
    public String toString() {
        return summary();
    }

    @SuppressWarnings("unused")
    private static final class Json {
        Status status;
        int processed;
        int succeeded;
        int failed;
        List<FileOutcome> files;
    }
}
