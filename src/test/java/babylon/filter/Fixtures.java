package babylon.filter;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.schema.MessageType;

import com.github.pemistahl.lingua.api.Language;

/**
 * Small Parquet files and a script based detector shared by the tests.
 */
public final class Fixtures {

    public static final Column[] TRANSCRIPTS = new Column[] {
            new Column.Builder("id", Column.TYPE_INT64).notnull(true).create(),
            new Column.Builder("transcription", Column.TYPE_STRING).create(),
            new Column.Builder("duration", Column.TYPE_DOUBLE).create()
    };

    private Fixtures() {
    }

    /**
     * Writes one row per text, ids counting from 0.
     */
    public static File transcripts(final File file, final String... texts) throws IOException {
        final Meta meta = new Meta(file.getName()).columns(TRANSCRIPTS);
        try (ParquetFile f = ParquetFile.create(file, TRANSCRIPTS, "zstd", null)) {
            for (int i = 0; i < texts.length; i++) {
                f.write(Row.create(meta, new Object[] { (long) i, texts[i], i * 0.5 }));
            }
        }
        return file;
    }

    public static File write(final File file, final Column[] columns, final List<Object[]> rows) throws IOException {
        final Meta meta = new Meta(file.getName()).columns(columns);
        try (ParquetFile f = ParquetFile.create(file, columns, "uncompressed", null)) {
            for (final Object[] r : rows) {
                f.write(Row.create(meta, r));
            }
        }
        return file;
    }

    /**
     * Writes rows through the example Group writer, so the file carries no Avro schema and keeps
     * whatever annotations the message type declares. Null values are left unset.
     */
    public static File writeGroups(final File file, final MessageType type, final List<Object[]> rows)
            throws IOException {
        final SimpleGroupFactory groups = new SimpleGroupFactory(type);
        try (ParquetWriter<Group> w = ExampleParquetWriter.builder(new ParquetFile.NioOutputFile(file))
                .withType(type)
                .build()) {
            for (final Object[] r : rows) {
                final Group g = groups.newGroup();
                for (int i = 0; i < r.length; i++) {
                    if (r[i] instanceof Integer)
                        g.add(i, (Integer) r[i]);
                    else if (r[i] instanceof Long)
                        g.add(i, (Long) r[i]);
                    else if (r[i] instanceof String)
                        g.add(i, (String) r[i]);
                    else if (r[i] != null)
                        throw new IllegalArgumentException("unsupported value " + r[i].getClass());
                }
                w.write(g);
            }
        }
        return file;
    }

    /** Parquet message type from the footer */
    public static MessageType layout(final File file) throws IOException {
        try (ParquetFileReader fr = ParquetFileReader.open(new ParquetFile.NioInputFile(file))) {
            return fr.getFooter().getFileMetaData().getSchema();
        }
    }

    public static List<Row> read(final File file) throws Exception {
        final List<Row> rows = new ArrayList<>();
        try (ParquetFile f = ParquetFile.open(file); Cursor<Row> cursor = f.find()) {
            for (Row r; (r = cursor.next()) != null;) {
                rows.add(r);
            }
        }
        return rows;
    }

    public static List<String> texts(final File file, final String column) throws Exception {
        final List<String> texts = new ArrayList<>();
        for (final Row r : read(file)) {
            texts.add(r.getString(column));
        }
        return texts;
    }

    /**
     * Ukrainian for Cyrillic with і/ї/є/ґ, Russian for other Cyrillic, English for Latin
     * letters, UNKNOWN otherwise.
     */
    public static final class ScriptDetector implements Detector {
        @Override
        public Language detect(final String text) {
            boolean cyrillic = false;
            boolean latin = false;
            for (int i = 0; i < text.length(); i++) {
                final char c = Character.toLowerCase(text.charAt(i));
                if ("іїєґ".indexOf(c) >= 0)
                    return Language.UKRAINIAN;
                if (Character.UnicodeBlock.of(c) == Character.UnicodeBlock.CYRILLIC)
                    cyrillic = true;
                else if (c >= 'a' && c <= 'z')
                    latin = true;
            }
            if (cyrillic)
                return Language.RUSSIAN;
            return latin ? Language.ENGLISH : Language.UNKNOWN;
        }
    }
}
