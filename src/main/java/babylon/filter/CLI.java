/**
 * babylonify command line interface
 * Filters Parquet rows by the detected language of a text column.
 */
package babylon.filter;

import java.io.File;
import java.io.PrintStream;
import java.time.format.DateTimeFormatter;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import babylon.filter.pipeline.FileOutcome;
import babylon.filter.pipeline.FilterConfig;
import babylon.filter.pipeline.LanguageFilter;
import babylon.filter.pipeline.RunReport;

public final class CLI {
    private static final String VERSION = ParquetFile.VERSION;

    /** parquet and hadoop log through slf4j-jdk14; keep references so the levels stick */
    private static final java.util.logging.Logger LIBRARIES = java.util.logging.Logger.getLogger("org.apache");
    private static final java.util.logging.Logger LOGGER = java.util.logging.Logger.getLogger("babylon");

    static {
        LOGGER.setUseParentHandlers(false);
        final ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.ALL);
        handler.setFormatter(new Formatter() {
            private final DateTimeFormatter df = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

            @Override
            public String format(LogRecord record) {
                String timestamp = java.time.LocalDateTime.now().format(df);
                String threadName = Thread.currentThread().getName();
                return String.format("%s [%s] %s%n", timestamp, threadName, record.getMessage());
            }
        });
        LOGGER.addHandler(handler);
        LOGGER.setLevel(Level.INFO);
    }

    public static void main(String[] args) {
        final int code = execute(System.out, System.err, args, null);
        if (code != 0)
            System.exit(code);
    }

    static final class Options {
        File input;
        File inputDir;
        File output;
        File report;
        String column = FilterConfig.DEFAULT_COLUMN;
        String lang = FilterConfig.DEFAULT_LANGUAGE;
        Integer threads;
        Integer batchSize;
        boolean keepEmpty = false;
        boolean clean = false;
        boolean log = false;
        boolean help = false;
        boolean version = false;

        static Options parse(final String[] args) {
            final Options o = new Options();
            for (int i = 0; i < args.length; i++) {
                final String s = args[i];
                switch (s) {
                    case "-h", "--help", "-help" -> o.help = true;
                    case "-V", "--version", "-version" -> o.version = true;
                    case "--log", "-log" -> o.log = true;
                    case "--keep-empty" -> o.keepEmpty = true;
                    case "--clean" -> o.clean = true;
                    case "-i", "--input" -> o.input = new File(value(args, ++i, s));
                    case "--input-dir" -> o.inputDir = new File(value(args, ++i, s));
                    case "-o", "--output" -> o.output = new File(value(args, ++i, s));
                    case "-c", "--column" -> o.column = value(args, ++i, s);
                    case "-l", "--lang" -> o.lang = value(args, ++i, s);
                    case "--threads" -> o.threads = number(value(args, ++i, s), s);
                    case "--batch-size" -> o.batchSize = number(value(args, ++i, s), s);
                    case "--report" -> o.report = new File(value(args, ++i, s));
                    default -> throw new IllegalArgumentException("Unknown option: " + s);
                }
            }
            if (o.help || o.version)
                return o;
            if ((o.input == null) == (o.inputDir == null))
                throw new IllegalArgumentException("Exactly one of --input or --input-dir must be specified");
            if (o.output == null)
                throw new IllegalArgumentException("--output must be specified");
            return o;
        }

        private static String value(final String[] args, final int i, final String option) {
            if (i >= args.length)
                throw new IllegalArgumentException(option + " requires an argument");
            return args[i];
        }

        private static int number(final String v, final String option) {
            try {
                return Integer.parseInt(v.trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(option + " expects a number, got '" + v + "'");
            }
        }

        FilterConfig config() throws FilterException {
            final FilterConfig.Builder b = FilterConfig.builder()
                    .column(column)
                    .language(lang)
                    .keepEmpty(keepEmpty)
                    .clean(clean);
            if (threads != null)
                b.threads(threads);
            if (batchSize != null)
                b.batchSize(batchSize);
            return b.build();
        }
    }

    /**
     * @param detector detector to use, null for Lingua over all languages
     * @return process exit code
     */
    static int execute(final PrintStream out, final PrintStream err, final String[] args, final Detector detector) {
        if (args.length == 0) {
            usage(out);
            return 0;
        }
        final Options o;
        try {
            o = Options.parse(args);
        } catch (IllegalArgumentException ex) {
            err.println("Error: " + ex.getMessage());
            err.println("Try '--help' for more information.");
            return 1;
        }
        if (o.help) {
            usage(out);
            return 0;
        }
        if (o.version) {
            out.println("babylonify version " + VERSION);
            return 0;
        }

        LIBRARIES.setLevel(o.log ? Level.INFO : Level.WARNING);
        LOGGER.setLevel(o.log ? Level.FINE : Level.INFO);
        final Logger logger = new Logger.DefaultLogger(LOGGER.getName());
        try {
            // resolve the language before any file is touched
            final FilterConfig config = o.config();
            final Detector d = detector != null ? detector : LinguaDetector.all(false);
            try (LanguageFilter filter = new LanguageFilter(config, d, logger)) {
                if (o.input != null) {
                    final FileOutcome outcome = filter.pipeline(o.input, o.output).run();
                    if (outcome.succeeded())
                        out.println(outcome.summary());
                    else
                        err.println(outcome.summary());
                    if (o.report != null)
                        new RunReport().add(outcome).write(o.report);
                    if (!outcome.succeeded() && o.log)
                        outcome.exception().printStackTrace(err);
                    return outcome.succeeded() ? 0 : 1;
                }

                final RunReport report = filter.directory(o.inputDir, o.output, out);
                for (final FileOutcome f : report.files()) {
                    if (!f.succeeded())
                        err.println(f.summary());
                }
                out.println(report.summary());
                if (o.report != null)
                    report.write(o.report);
                return report.exitCode();
            }
        } catch (FilterException e) {
            err.println("Error (" + e.getKind() + "): " + e.getMessage());
            if (o.log)
                e.printStackTrace(err);
            return 1;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            if (o.log)
                e.printStackTrace(err);
            return 1;
        }
    }

    private static void usage(final PrintStream out) {
        final String CMD = "babylonify";
        out.println("Usage: " + CMD + " (-i <file> | --input-dir <dir>) -o <path> [options]\n");
        out.println(" Filter Parquet rows by detected language (+ optional cleaning)\n");
        out.println(" options:");
        out.println(" \t-i, --input <file>    \tinput Parquet file");
        out.println(" \t--input-dir <dir>     \tinput directory with Parquet files");
        out.println(" \t-o, --output <path>   \toutput Parquet file (or directory when --input-dir is used)");
        out.println(" \t-c, --column <name>   \ttext column name (default: " + FilterConfig.DEFAULT_COLUMN + ")");
        out.println(" \t-l, --lang <lang>     \ttarget language, ISO 639-1 or name: uk, en, ru, Ukrainian, ... (default: "
                + FilterConfig.DEFAULT_LANGUAGE + ")");
        out.println(" \t--threads <n>         \tworker threads (default: available processors)");
        out.println(" \t--batch-size <n>      \trows per batch (default: " + FilterConfig.DEFAULT_BATCH_SIZE + ")");
        out.println(" \t--keep-empty          \tkeep empty/null text values");
        out.println(" \t--clean               \tremove everything except letters and punctuation");
        out.println(" \t--report <file.json>  \twrite a JSON run report");
        out.println(" \t--log                 \tenable detailed logging");
        out.println(" \t-V, --version         \tshow version information");
        out.println(" \t-h, --help            \tshow this help\n");
        out.println(" examples:");
        out.println("\t" + CMD + " -i data.parquet -o data_uk.parquet -l uk --clean");
        out.println("\t" + CMD + " --input-dir shards/ -o shards_en/ -l english --keep-empty --threads 8");
    }
}
