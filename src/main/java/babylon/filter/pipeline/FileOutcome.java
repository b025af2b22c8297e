package babylon.filter.pipeline;

import com.github.pemistahl.lingua.api.Language;

import babylon.filter.ErrorCode;
import babylon.filter.FilterException;
import babylon.filter.LanguageResolver;

/**
 * Result of filtering one file. Failures are carried as values so a directory run
 * can record them and move on.
 */
public final class FileOutcome {

    public enum Status {
        DONE, FAILED
    }

    private final String source;
    private final String destination;
    private final Status status;
    private final long rowsIn;
    private final long rowsOut;
    private final long elapsed;
    private final String language;
    private final boolean cleaned;
    private final ErrorCode error;
    private final String kind;
    private final String message;
    private final transient FilterException exception;

    private FileOutcome(final FileTask task, final Status status, final long rowsIn, final long rowsOut,
            final long elapsed, final Language language, final boolean cleaned, final FilterException exception) {
        this.source = task.source().getPath();
        this.destination = task.destination().getPath();
        this.status = status;
        this.rowsIn = rowsIn;
        this.rowsOut = rowsOut;
        this.elapsed = elapsed;
        this.language = LanguageResolver.displayName(language);
        this.cleaned = cleaned;
        this.exception = exception;
        this.error = exception != null ? exception.getErrorCode() : null;
        this.kind = exception != null ? exception.getKind().label() : null;
        this.message = exception != null ? exception.getMessage() : null;
    }

    static FileOutcome done(final FileTask task, final long rowsIn, final long rowsOut, final long elapsed,
            final Language language, final boolean cleaned) {
        return new FileOutcome(task, Status.DONE, rowsIn, rowsOut, elapsed, language, cleaned, null);
    }

    static FileOutcome failed(final FileTask task, final long rowsIn, final long elapsed, final Language language,
            final boolean cleaned, final FilterException exception) {
        return new FileOutcome(task, Status.FAILED, rowsIn, 0L, elapsed, language, cleaned, exception);
    }

    public String source() {
        return source;
    }

    public String destination() {
        return destination;
    }

    public Status status() {
        return status;
    }

    public boolean succeeded() {
        return status == Status.DONE;
    }

    public long rowsIn() {
        return rowsIn;
    }

    public long rowsOut() {
        return rowsOut;
    }

    /** elapsed milliseconds */
    public long elapsed() {
        return elapsed;
    }

    /**
     * @return error code, null on success
     */
    public ErrorCode error() {
        return error;
    }

    /**
     * @return failure class, null on success
     */
    public ErrorCode.Kind kind() {
        return error != null ? error.getKind() : null;
    }

    public String message() {
        return message;
    }

    /**
     * @return the failure, null on success
     */
    public FilterException exception() {
        return exception;
    }

    /**
     * One line for the console.
     */
    public String summary() {
        if (succeeded())
            return String.format("✅ Filtered %d rows -> %d rows kept (lang = %s, cleaned = %s) [%s -> %s]",
                    rowsIn, rowsOut, language, cleaned, source, destination);
        return String.format("❌ %s: %s - %s", source, kind, message);
    }

    @Override
    public String toString() {
        return summary();
    }
}
