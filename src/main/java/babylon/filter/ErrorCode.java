/**
 *
 */
package babylon.filter;

/**
 * Error codes for filtering runs.
 * Each code belongs to one {@link Kind}, the coarse failure class reported per file.
 */
public enum ErrorCode {
    // Language resolution (-1000 to -1999)
    UNKNOWN_LANGUAGE(-1000, Kind.RESOLUTION, "Unknown language"),

    // Schema errors (-2000 to -2999)
    COLUMN_NOT_FOUND(-2000, Kind.SCHEMA, "Column not found"),
    COLUMN_TYPE_MISMATCH(-2001, Kind.SCHEMA, "Target column is not String"),
    SCHEMA_UNREADABLE(-2002, Kind.SCHEMA, "Cannot read Parquet schema"),

    // Storage errors (-4000 to -4999)
    STORAGE_READ_ERROR(-4000, Kind.IO, "Storage read error"),
    STORAGE_WRITE_ERROR(-4001, Kind.IO, "Storage write error"),
    OUTPUT_IS_DIRECTORY(-4002, Kind.IO, "Output path points to a directory, provide a file path instead"),
    OUTPUT_NOT_DIRECTORY(-4003, Kind.IO, "Output path must be a directory when --input-dir is used"),
    NO_INPUT_FILES(-4004, Kind.IO, "No Parquet files found in input directory"),

    // Detection errors (-5000 to -5999)
    DETECTION_FAILED(-5000, Kind.DETECTION, "Language detection failed"),

    // General errors (-9000 to -9999)
    INVALID_ARGUMENT(-9000, Kind.USAGE, "Invalid argument"),
    INTERNAL_ERROR(-9002, Kind.IO, "Internal error");

    /**
     * Failure classes. A resolution or usage failure invalidates the whole run,
     * the others are fatal for one file only.
     */
    public enum Kind {
        RESOLUTION("resolution-error"),
        SCHEMA("schema-error"),
        IO("io-error"),
        DETECTION("detection-error"),
        USAGE("usage-error");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    private final int code;
    private final Kind kind;
    private final String message;

    ErrorCode(int code, Kind kind, String message) {
        this.code = code;
        this.kind = kind;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public Kind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }
}
