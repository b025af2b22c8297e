
package babylon.filter;

import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.avro.Schema;
import org.apache.avro.Schema.Field;
import org.apache.avro.Schema.Type;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroSchemaConverter;
import org.apache.parquet.avro.AvroWriteSupport;
import org.apache.parquet.conf.ParquetConfiguration;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.api.WriteSupport;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.metadata.ParquetMetadata;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.OutputFile;
import org.apache.parquet.io.PositionOutputStream;
import org.apache.parquet.io.SeekableInputStream;
import org.apache.parquet.schema.GroupType;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;

/**
 * Parquet File Handler (using parquet-avro)
 *
 * Streams rows in and out of Parquet files. A reader recovers the Avro schema of
 * the file and a writer created from it reuses that schema verbatim, so filtered
 * output has exactly the columns and types of its input. The Parquet layout of the
 * source, logical annotations included, is written back whenever the Avro writer can
 * fill it field by field; files written by other tools keep annotations Avro has no
 * name for (e.g. {@code INTEGER(8,true)}, {@code TIMESTAMP(NANOS,true)}).
 */
public final class ParquetFile implements GenericFile {

    public static final String DEFAULT_COMPRESSION = "zstd";
    static final String VERSION_KEY = "babylonify.version";
    static final String VERSION = "0.0.1";

    private final File file;
    private final Logger logger;

    private Schema avroSchema;
    private MessageType layout;
    private Meta cachedMeta;

    private ParquetReader<GenericRecord> reader;
    private ParquetWriter<GenericRecord> writer;
    private long written = 0L;

    private ParquetFile(final File file, final Schema schema, final Logger logger) {
        this.file = file;
        this.avroSchema = schema;
        this.logger = (logger != null ? logger : new Logger.NullLogger());
    }

    // ---------- Static open/create helpers ----------

    /** Open Parquet file for reading. */
    public static ParquetFile open(final File file) throws IOException {
        return open(file, new Logger.NullLogger());
    }

    /**
     * Open Parquet file for reading. The footer is read eagerly so a missing or
     * broken file fails here rather than on the first row.
     */
    public static ParquetFile open(final File file, final Logger logger) throws IOException {
        if (!file.isFile())
            throw new FilterException(ErrorCode.STORAGE_READ_ERROR, "no such file " + file);
        final ParquetFile f = new ParquetFile(file, null, logger);
        f.avroSchema = f.readSchema();
        f.logger.log("open r, %s, file size : %s", file.getName(), IO.readableBytesSize(file.length()));
        return f;
    }

    /**
     * Create Parquet file for writing with an exact Avro record schema.
     */
    public static ParquetFile create(final File file, final Schema schema, final String compression,
            final Logger logger) throws IOException {
        return create(file, schema, null, compression, logger);
    }

    /**
     * Create Parquet file for writing with an exact Avro record schema and, when it
     * fits the schema, the Parquet layout of a source file.
     *
     * @param source layout to write, may be null
     */
    public static ParquetFile create(final File file, final Schema schema, final MessageType source,
            final String compression, final Logger logger) throws IOException {
        if (schema == null || schema.getType() != Type.RECORD)
            throw new IllegalArgumentException("schema");
        final ParquetFile f = new ParquetFile(file, schema, logger);
        f.openWriter(codec(compression), source);
        return f;
    }

    /**
     * Create Parquet file for writing from column definitions. Every column is nullable
     * unless declared NOT NULL.
     */
    public static ParquetFile create(final File file, final Column[] columns, final String compression,
            final Logger logger) throws IOException {
        if (columns == null || columns.length == 0)
            throw new IllegalArgumentException("columns");
        final Meta meta = new Meta(file.getName()).columns(columns);
        return create(file, buildAvroSchema(meta), compression, logger);
    }

    static CompressionCodecName codec(final String compression) {
        if (compression == null || compression.isBlank())
            return CompressionCodecName.ZSTD;
        try {
            return CompressionCodecName.valueOf(compression.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown compression : " + compression);
        }
    }

    // ---------- Lifecycle ----------

    @Override
    public void close() throws IOException {
        IOException first = null;
        try {
            if (reader != null)
                reader.close();
        } catch (IOException ex) {
            first = ex;
        } finally {
            reader = null;
        }
        try {
            if (writer != null)
                writer.close();
        } catch (IOException ex) {
            if (first == null)
                first = new FilterException(ErrorCode.STORAGE_WRITE_ERROR, file, ex);
        } finally {
            writer = null;
        }

        logger.log("closed, %s, file size : %s", file.getName(), IO.readableBytesSize(file.length()));
        if (first != null)
            throw first;
    }

    @Override
    public long fileSize() {
        return file.length();
    }

    public static long rows(final File parquetFile) throws IOException {
        try (ParquetFileReader fr = ParquetFileReader.open(new NioInputFile(parquetFile))) {
            return fr.getRecordCount();
        }
    }

    @Override
    public long rows(boolean force) throws IOException {
        if (writer != null)
            return written;
        if (!force)
            return ParquetFile.rows(file);
        long n = 0;
        try (ParquetReader<GenericRecord> r = newReader()) {
            while (r.read() != null)
                n++;
        }
        return n;
    }

    // ---------- Metadata ----------

    /** Avro record schema of the file */
    public Schema schema() {
        return avroSchema;
    }

    /** Parquet message type of the file */
    public MessageType layout() {
        return layout;
    }

    @Override
    public Meta meta() throws IOException {
        if (cachedMeta == null)
            cachedMeta = new Meta(file.getName()).columns(columnsFromAvro(avroSchema));
        return cachedMeta;
    }

    /**
     * Footer key/value metadata of a finished file.
     */
    public static Map<String, String> keyValueMetaData(final File parquetFile) throws IOException {
        try (ParquetFileReader fr = ParquetFileReader.open(new NioInputFile(parquetFile))) {
            return new HashMap<>(fr.getFooter().getFileMetaData().getKeyValueMetaData());
        }
    }

    private Schema readSchema() throws IOException {
        final ParquetMetadata footer;
        try (ParquetFileReader fr = ParquetFileReader.open(localInput())) {
            footer = fr.getFooter();
        } catch (IOException | RuntimeException ex) {
            throw new FilterException(ErrorCode.STORAGE_READ_ERROR, file, ex);
        }
        layout = footer.getFileMetaData().getSchema();
        try {
            // Avro schema from file metadata if it was written through parquet-avro
            final String avroSchemaStr = footer.getFileMetaData().getKeyValueMetaData().get("parquet.avro.schema");
            if (avroSchemaStr != null)
                return new Schema.Parser().parse(avroSchemaStr);
            return new AvroSchemaConverter().convert(footer.getFileMetaData().getSchema());
        } catch (RuntimeException ex) {
            throw new FilterException(ErrorCode.SCHEMA_UNREADABLE, file, ex);
        }
    }

    // ---------- Read ----------

    @Override
    public Cursor<Row> find() throws IOException {
        if (writer != null)
            throw new IllegalStateException("writing");

        final Meta m = meta();
        final ParquetReader<GenericRecord> r;
        try {
            r = newReader();
        } catch (IOException | RuntimeException ex) {
            throw new FilterException(ErrorCode.STORAGE_READ_ERROR, file, ex);
        }
        this.reader = r;

        return new Cursor<Row>() {
            private boolean finished = false;
            private long n = 0;

            @Override
            public Row next() throws Exception {
                if (finished)
                    return null;
                final GenericRecord rec;
                try {
                    rec = r.read();
                } catch (IOException | RuntimeException ex) {
                    finished = true;
                    throw new FilterException(ErrorCode.STORAGE_READ_ERROR, file + " at row " + n, ex);
                }
                if (rec == null) {
                    finished = true;
                    return null;
                }
                n++;
                return recordToRow(m, rec);
            }

            @Override
            public void close() throws Exception {
                finished = true;
                if (reader == r)
                    reader = null;
                r.close();
            }
        };
    }

    private ParquetReader<GenericRecord> newReader() throws IOException {
        return AvroParquetReader.<GenericRecord>builder(localInput())
                .withDataModel(GenericData.get())
                .build();
    }

    // ---------- Write ----------

    @Override
    public long write(final Row row) throws IOException {
        if (writer == null)
            throw new IOException("writer not opened");
        try {
            writer.write(rowToRecord(row));
        } catch (IOException | RuntimeException ex) {
            throw new FilterException(ErrorCode.STORAGE_WRITE_ERROR, file + " at row " + written, ex);
        }
        return ++written;
    }

    // ---------- Internals ----------

    private void openWriter(final CompressionCodecName codec, final MessageType source) throws IOException {
        final Map<String, String> metadata = new HashMap<>();
        metadata.put(VERSION_KEY, VERSION);
        try {
            final boolean oldLists = source != null && !sameLayout(source, avroLayout(avroSchema, false))
                    && sameLayout(source, avroLayout(avroSchema, true));
            final MessageType converted = avroLayout(avroSchema, oldLists);
            this.layout = (source != null && sameLayout(source, converted)) ? source : converted;
            if (source != null && layout != source)
                logger.log("layout of %s does not fit its Avro schema, writing the Avro layout", file.getName());

            this.writer = new LayoutWriter(localOutput(), avroSchema, layout)
                    .withConf(conf(oldLists))
                    .withCompressionCodec(codec)
                    .withExtraMetaData(metadata)
                    .build();
        } catch (IOException | RuntimeException ex) {
            throw new FilterException(ErrorCode.STORAGE_WRITE_ERROR, file, ex);
        }
        logger.log("open w, %s, codec : %s", file.getName(), codec);
    }

    private static Configuration conf(final boolean oldLists) {
        final Configuration conf = new Configuration();
        conf.setBoolean(AvroWriteSupport.WRITE_OLD_LIST_STRUCTURE, oldLists);
        return conf;
    }

    static MessageType avroLayout(final Schema schema, final boolean oldLists) {
        return new AvroSchemaConverter(conf(oldLists)).convert(schema);
    }

    /**
     * Same nesting, repetition and physical types, field by field. Names and logical
     * annotations are not compared; the Avro writer addresses fields by position.
     */
    static boolean sameLayout(final org.apache.parquet.schema.Type a, final org.apache.parquet.schema.Type b) {
        if (a.isPrimitive() != b.isPrimitive() || a.getRepetition() != b.getRepetition())
            return false;
        if (a.isPrimitive()) {
            final PrimitiveType p = a.asPrimitiveType();
            final PrimitiveType q = b.asPrimitiveType();
            return p.getPrimitiveTypeName() == q.getPrimitiveTypeName() && p.getTypeLength() == q.getTypeLength();
        }
        final GroupType g = a.asGroupType();
        final GroupType h = b.asGroupType();
        if (g.getFieldCount() != h.getFieldCount())
            return false;
        for (int i = 0; i < g.getFieldCount(); i++) {
            if (!sameLayout(g.getType(i), h.getType(i)))
                return false;
        }
        return true;
    }

    /**
     * Avro writer over an explicit Parquet layout.
     */
    private static final class LayoutWriter extends ParquetWriter.Builder<GenericRecord, LayoutWriter> {
        private final Schema schema;
        private final MessageType type;

        LayoutWriter(final OutputFile file, final Schema schema, final MessageType type) {
            super(file);
            this.schema = schema;
            this.type = type;
        }

        @Override
        protected LayoutWriter self() {
            return this;
        }

        @Override
        protected WriteSupport<GenericRecord> getWriteSupport(final Configuration conf) {
            return new AvroWriteSupport<>(type, schema, GenericData.get());
        }

        @Override
        protected WriteSupport<GenericRecord> getWriteSupport(final ParquetConfiguration conf) {
            return new AvroWriteSupport<>(type, schema, GenericData.get());
        }
    }

    private InputFile localInput() {
        return new NioInputFile(file);
    }

    private OutputFile localOutput() {
        return new NioOutputFile(file);
    }

    private static Schema buildAvroSchema(final Meta meta) {
        final List<Field> fields = new ArrayList<>();
        for (final Column c : meta.columns()) {
            final Schema t = avroType(c);
            fields.add(new Field(c.name(), c.nullable() ? nullable(t) : t, null, (Object) null));
        }
        final Schema rec = Schema.createRecord(safeName(meta.name()), null, ParquetFile.class.getPackageName(), false);
        rec.setFields(fields);
        return rec;
    }

    private static Schema nullable(final Schema s) {
        final List<Schema> u = new ArrayList<>(2);
        u.add(Schema.create(Type.NULL));
        u.add(s);
        return Schema.createUnion(u);
    }

    private static String safeName(final String n) {
        String s = n;
        final int dot = s.indexOf('.');
        if (dot > 0)
            s = s.substring(0, dot);
        s = s.replaceAll("[^A-Za-z0-9_]", "_");
        return (s.isEmpty() || Character.isDigit(s.charAt(0))) ? "_" + s : s;
    }

    private static Schema avroType(final Column c) {
        return switch (c.type()) {
            case Column.TYPE_INT -> Schema.create(Type.INT);
            case Column.TYPE_INT64 -> Schema.create(Type.LONG);
            case Column.TYPE_DOUBLE -> Schema.create(Type.DOUBLE);
            case Column.TYPE_FLOAT -> Schema.create(Type.FLOAT);
            case Column.TYPE_BYTES -> Schema.create(Type.BYTES);
            case Column.TYPE_BOOLEAN -> Schema.create(Type.BOOLEAN);
            case Column.TYPE_STRING -> Schema.create(Type.STRING);
            default -> throw new IllegalArgumentException("Unsupported column type : " + c);
        };
    }

    private GenericRecord rowToRecord(final Row row) {
        final GenericRecord rec = new GenericData.Record(avroSchema);
        final List<Field> fields = avroSchema.getFields();
        final Column[] cols = row.meta().columns();
        for (int i = 0; i < fields.size(); i++) {
            rec.put(i, toAvroValue(cols[i], row.get(i)));
        }
        return rec;
    }

    private static Object toAvroValue(final Column c, final Object v) {
        if (v == null)
            return null;
        switch (c.type()) {
            case Column.TYPE_INT:
                return ((Number) v).intValue();
            case Column.TYPE_INT64:
                return ((Number) v).longValue();
            case Column.TYPE_DOUBLE:
                return ((Number) v).doubleValue();
            case Column.TYPE_FLOAT:
                return ((Number) v).floatValue();
            case Column.TYPE_BYTES:
                return (v instanceof byte[] b) ? ByteBuffer.wrap(b) : v;
            case Column.TYPE_STRING:
                return v.toString();
            default:
                // nested values go back exactly as the reader produced them
                return v;
        }
    }

    private static Row recordToRow(final Meta meta, final GenericRecord rec) {
        final Column[] cols = meta.columns();
        final Object[] a = new Object[cols.length];
        for (int i = 0; i < cols.length; i++) {
            a[i] = rec.get(i);
        }
        return Row.create(meta, a);
    }

    static Column[] columnsFromAvro(final Schema s) {
        final List<Column> cols = new ArrayList<>();
        for (final Field f : s.getFields()) {
            final boolean nullable = isNullable(f.schema());
            final Schema t = unwrapNullable(f.schema());
            cols.add(new Column(f.name(), toColumnType(t), nullable));
        }
        return cols.toArray(Column[]::new);
    }

    private static boolean isNullable(final Schema s) {
        if (s.getType() == Type.NULL)
            return true;
        return s.getType() == Type.UNION && s.getTypes().stream().anyMatch(e -> e.getType() == Type.NULL);
    }

    /**
     * [null, T] becomes T; wider unions stay unions.
     */
    private static Schema unwrapNullable(final Schema s) {
        if (s.getType() == Type.UNION) {
            final List<Schema> members = new ArrayList<>();
            for (Schema e : s.getTypes()) {
                if (e.getType() != Type.NULL)
                    members.add(e);
            }
            if (members.size() == 1)
                return members.get(0);
            if (members.isEmpty())
                return Schema.create(Type.NULL);
        }
        return s;
    }

    private static short toColumnType(final Schema t) {
        return switch (t.getType()) {
            case INT -> Column.TYPE_INT;
            case LONG -> Column.TYPE_INT64;
            case DOUBLE -> Column.TYPE_DOUBLE;
            case FLOAT -> Column.TYPE_FLOAT;
            case BYTES -> Column.TYPE_BYTES;
            case STRING -> Column.TYPE_STRING;
            case BOOLEAN -> Column.TYPE_BOOLEAN;
            case NULL -> Column.TYPE_NULL;
            default -> Column.TYPE_OBJECT;
        };
    }

    // ---------- NIO-backed Parquet IO (no Hadoop filesystem) ----------

    static final class NioInputFile implements InputFile {
        private final File file;

        NioInputFile(final File file) {
            this.file = file;
        }

        @Override
        public long getLength() throws IOException {
            return Files.size(file.toPath());
        }

        @Override
        public SeekableInputStream newStream() throws IOException {
            return new NioSeekableInputStream(FileChannel.open(file.toPath(), StandardOpenOption.READ));
        }
    }

    static final class NioSeekableInputStream extends SeekableInputStream {
        private final FileChannel ch;
        private long pos = 0L;

        NioSeekableInputStream(final FileChannel ch) {
            this.ch = ch;
        }

        @Override
        public int read() throws IOException {
            final ByteBuffer one = ByteBuffer.allocate(1);
            final int n = ch.read(one, pos);
            if (n <= 0)
                return -1;
            pos += n;
            return one.get(0) & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            return read(ByteBuffer.wrap(b, off, len));
        }

        @Override
        public int read(ByteBuffer dst) throws IOException {
            final int n = ch.read(dst, pos);
            if (n > 0)
                pos += n;
            return n;
        }

        @Override
        public void readFully(byte[] bytes) throws IOException {
            readFully(ByteBuffer.wrap(bytes));
        }

        @Override
        public void readFully(byte[] bytes, int off, int len) throws IOException {
            readFully(ByteBuffer.wrap(bytes, off, len));
        }

        @Override
        public void readFully(ByteBuffer dst) throws IOException {
            while (dst.hasRemaining()) {
                if (read(dst) < 0)
                    throw new EOFException("Unexpected EOF");
            }
        }

        @Override
        public long getPos() {
            return pos;
        }

        @Override
        public void seek(long newPos) {
            this.pos = newPos;
        }

        @Override
        public int available() throws IOException {
            final long rem = ch.size() - pos;
            return (rem > Integer.MAX_VALUE) ? Integer.MAX_VALUE : (int) Math.max(0, rem);
        }

        @Override
        public void close() throws IOException {
            ch.close();
        }
    }

    static final class NioOutputFile implements OutputFile {
        private final File file;

        NioOutputFile(final File file) {
            this.file = file;
        }

        @Override
        public PositionOutputStream create(long blockSizeHint) throws IOException {
            return createOrOverwrite(blockSizeHint);
        }

        @Override
        public PositionOutputStream createOrOverwrite(long blockSizeHint) throws IOException {
            final File parent = file.getAbsoluteFile().getParentFile();
            if (parent != null && !parent.isDirectory())
                Files.createDirectories(parent.toPath());
            return new NioPositionOutputStream(FileChannel.open(
                    file.toPath(),
                    StandardOpenOption.WRITE,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING));
        }

        @Override
        public boolean supportsBlockSize() {
            return false;
        }

        @Override
        public long defaultBlockSize() {
            return 0;
        }
    }

    static final class NioPositionOutputStream extends PositionOutputStream {
        private final FileChannel ch;
        private long pos = 0L;

        NioPositionOutputStream(final FileChannel ch) {
            this.ch = ch;
        }

        @Override
        public long getPos() {
            return pos;
        }

        @Override
        public void write(int b) throws IOException {
            write(new byte[] { (byte) b }, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            final ByteBuffer bb = ByteBuffer.wrap(b, off, len);
            while (bb.hasRemaining()) {
                pos += ch.write(bb, pos);
            }
        }

        @Override
        public void close() throws IOException {
            ch.close();
        }
    }
}
