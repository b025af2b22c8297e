package babylon.filter.pipeline;

import com.github.pemistahl.lingua.api.Language;

import babylon.filter.ErrorCode;
import babylon.filter.FilterException;
import babylon.filter.LanguageResolver;
import babylon.filter.ParquetFile;

/**
 * Immutable settings of one filtering run. The language token is resolved once, in
 * {@link Builder#build()}, and the result is shared by every file of the run.
 *
 * <pre>
 * FilterConfig cfg = FilterConfig.builder()
 *     .column("transcription")
 *     .language("uk")
 *     .keepEmpty(true)
 *     .clean(true)
 *     .threads(8)
 *     .build();
 * </pre>
 */
public final class FilterConfig {

    public static final String DEFAULT_COLUMN = "transcription";
    public static final String DEFAULT_LANGUAGE = "uk";
    public static final int DEFAULT_BATCH_SIZE = 64 * 1024;

    private final String column;
    private final String token;
    private final Language language;
    private final boolean keepEmpty;
    private final boolean clean;
    private final int threads;
    private final int batchSize;
    private final String compression;

    private FilterConfig(final Builder b, final Language language) {
        this.column = b.column;
        this.token = b.language;
        this.language = language;
        this.keepEmpty = b.keepEmpty;
        this.clean = b.clean;
        this.threads = b.threads;
        this.batchSize = b.batchSize;
        this.compression = b.compression;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** designated text column */
    public String column() {
        return column;
    }

    /** language token as given by the user */
    public String token() {
        return token;
    }

    /** resolved target language */
    public Language language() {
        return language;
    }

    public boolean keepEmpty() {
        return keepEmpty;
    }

    public boolean clean() {
        return clean;
    }

    public int threads() {
        return threads;
    }

    public int batchSize() {
        return batchSize;
    }

    public String compression() {
        return compression;
    }

    @Override
    public String toString() {
        return String.format("column=%s, lang=%s, keepEmpty=%s, clean=%s, threads=%d, batchSize=%d, compression=%s",
                column, LanguageResolver.displayName(language), keepEmpty, clean, threads, batchSize, compression);
    }

    public static final class Builder {
        private String column = DEFAULT_COLUMN;
        private String language = DEFAULT_LANGUAGE;
        private boolean keepEmpty = false;
        private boolean clean = false;
        private int threads = Runtime.getRuntime().availableProcessors();
        private int batchSize = DEFAULT_BATCH_SIZE;
        private String compression = ParquetFile.DEFAULT_COMPRESSION;

        private Builder() {
        }

        public Builder column(final String column) {
            this.column = column;
            return this;
        }

        public Builder language(final String language) {
            this.language = language;
            return this;
        }

        public Builder keepEmpty(final boolean keepEmpty) {
            this.keepEmpty = keepEmpty;
            return this;
        }

        public Builder clean(final boolean clean) {
            this.clean = clean;
            return this;
        }

        public Builder threads(final int threads) {
            this.threads = threads;
            return this;
        }

        public Builder batchSize(final int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder compression(final String compression) {
            this.compression = compression;
            return this;
        }

        /**
         * @throws FilterException UNKNOWN_LANGUAGE for an unrecognized token,
         *                         INVALID_ARGUMENT for out of range settings
         */
        public FilterConfig build() throws FilterException {
            if (column == null || column.isEmpty())
                throw new FilterException(ErrorCode.INVALID_ARGUMENT, "column name must not be empty");
            if (threads < 1)
                throw new FilterException(ErrorCode.INVALID_ARGUMENT, "threads must be >= 1, got " + threads);
            if (batchSize < 1)
                throw new FilterException(ErrorCode.INVALID_ARGUMENT, "batch size must be >= 1, got " + batchSize);
            return new FilterConfig(this, LanguageResolver.resolve(language));
        }
    }
}
