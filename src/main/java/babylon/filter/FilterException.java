/**
 *
 */
package babylon.filter;

import java.io.IOException;

/**
 * Filtering exception with error code classification.
 * This allows callers to tell a bad language token from a broken file.
 */
public class FilterException extends IOException {

    private final ErrorCode errorCode;
    private final Object context;

    public FilterException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.context = null;
    }

    public FilterException(ErrorCode errorCode, Object context) {
        super(errorCode.getMessage() + ": " + context);
        this.errorCode = errorCode;
        this.context = context;
    }

    public FilterException(ErrorCode errorCode, Object context, Throwable cause) {
        super(errorCode.getMessage() + ": " + context + describe(cause), cause);
        this.errorCode = errorCode;
        this.context = context;
    }

    private static String describe(final Throwable cause) {
        if (cause == null || cause.getMessage() == null)
            return "";
        return " (" + cause.getMessage() + ")";
    }

    /**
     * Wrap any failure raised while processing a file. Already classified
     * exceptions pass through unchanged.
     */
    public static FilterException wrap(final Throwable ex, final ErrorCode fallback, final Object context) {
        if (ex instanceof FilterException fe)
            return fe;
        return new FilterException(fallback, context, ex);
    }

    /**
     * Get the error code for this exception
     * @return the error code
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public ErrorCode.Kind getKind() {
        return errorCode.getKind();
    }

    /**
     * Get the context object associated with this exception (usually the offending path or token)
     * @return the context object, or null if not available
     */
    public Object getContext() {
        return context;
    }

    public boolean isErrorCode(ErrorCode code) {
        return this.errorCode == code;
    }

    @Override
    public String toString() {
        return "FilterException{" +
                "errorCode=" + errorCode +
                ", context=" + context +
                '}';
    }
}
