package babylon.filter;

/**
 * Logger interface for filtering runs
 *
 * Provides logging capabilities for tracking file processing and errors.
 */
public interface Logger {
    /**
     * Log informational message
     *
     * @param fmt  printf style format
     * @param args format arguments
     */
    void log(String fmt, Object... args);

    /**
     * Log error message
     *
     * @param fmt  printf style format
     * @param args format arguments
     */
    void error(String fmt, Object... args);

    /**
     * Null logger that discards log messages but prints errors
     */
    public static final class NullLogger implements Logger {
        @Override
        public void log(String fmt, Object... args) {
        }

        @Override
        public void error(String fmt, Object... args) {
            System.err.println(String.format(fmt, args));
        }
    }

    /**
     * java.util.logging backed logger; informational messages go out at FINE.
     */
    public static final class DefaultLogger implements Logger {
        private final java.util.logging.Logger LOGGER;

        public DefaultLogger(String name) {
            LOGGER = java.util.logging.Logger.getLogger(name);
        }

        @Override
        public void log(String fmt, Object... args) {
            if (LOGGER.isLoggable(java.util.logging.Level.FINE))
                LOGGER.log(java.util.logging.Level.FINE, String.format(fmt, args));
        }

        @Override
        public void error(String fmt, Object... args) {
            LOGGER.log(java.util.logging.Level.SEVERE, String.format(fmt, args));
        }
    }
}
