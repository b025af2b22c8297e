package babylon.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestcaseCLI {

    @TempDir
    File dir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    private int cli(final String... args) {
        return CLI.execute(new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8), args, new Fixtures.ScriptDetector());
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    @Test
    void help() {
        assertEquals(0, cli("--help"));
        assertTrue(out().contains("--input-dir"), out());
        assertTrue(out().contains(" examples:"), out());
        assertEquals(0, cli());
    }

    @Test
    void version() {
        assertEquals(0, cli("-V"));
        assertTrue(out().contains(ParquetFile.VERSION), out());
    }

    @Test
    void singleFile() throws Exception {
        final File in = Fixtures.transcripts(new File(dir, "in.parquet"), "Привіт світ", "Hello world", "", null);
        final File out = new File(dir, "out.parquet");

        assertEquals(0, cli("-i", in.getPath(), "-o", out.getPath(), "-l", "uk", "--threads", "2"));
        assertEquals("✅ Filtered 4 rows -> 1 rows kept (lang = Ukrainian, cleaned = false) [" + in.getPath()
                + " -> " + out.getPath() + "]", out().trim());
        assertEquals(Arrays.asList("Привіт світ"), Fixtures.texts(out, "transcription"));
    }

    @Test
    void singleFileWithCleaningAndReport() throws Exception {
        final File in = Fixtures.transcripts(new File(dir, "in.parquet"), "Hello, world! 123", "Привіт");
        final File out = new File(dir, "out.parquet");
        final File report = new File(dir, "report.json");

        assertEquals(0, cli("--input", in.getPath(), "--output", out.getPath(), "--lang", "English", "--clean",
                "--report", report.getPath()));
        assertTrue(out().contains("cleaned = true"), out());
        assertEquals(Arrays.asList("Hello, world!"), Fixtures.texts(out, "transcription"));
        assertTrue(new String(Files.readAllBytes(report.toPath()), StandardCharsets.UTF_8).contains("\"SUCCESS\""));
    }

    @Test
    void unknownLanguageTouchesNothing() throws Exception {
        final File in = Fixtures.transcripts(new File(dir, "in.parquet"), "Привіт");
        final File out = new File(dir, "out.parquet");

        assertEquals(1, cli("-i", in.getPath(), "-o", out.getPath(), "-l", "xx"));
        assertTrue(err().contains("resolution-error"), err());
        assertTrue(err().contains("Unknown language"), err());
        assertFalse(out.exists());
    }

    @Test
    void singleFileFailure() throws Exception {
        final File in = Fixtures.transcripts(new File(dir, "in.parquet"), "Привіт");
        final File out = new File(dir, "out.parquet");

        assertEquals(1, cli("-i", in.getPath(), "-o", out.getPath(), "-c", "text"));
        assertTrue(err().startsWith("❌ " + in.getPath() + ": schema-error - "), err());
        assertEquals("", out());
        assertFalse(out.exists());
    }

    @Test
    void directoryWithAFailure() throws Exception {
        final File in = new File(dir, "in");
        final File out = new File(dir, "out");
        assertTrue(in.mkdir());
        Fixtures.transcripts(new File(in, "a.parquet"), "Привіт", "Hello");
        Files.write(new File(in, "b.parquet").toPath(), new byte[] { 0 });

        assertEquals(2, cli("--input-dir", in.getPath(), "-o", out.getPath()));
        assertTrue(out().contains("✅ Filtered 2 rows -> 1 rows kept"), out());
        assertTrue(out().contains("processed=2 succeeded=1 failed=1"), out());
        assertTrue(err().contains("❌ " + new File(in, "b.parquet").getPath() + ": io-error"), err());
    }

    @Test
    void usageErrors() {
        assertEquals(1, cli("-o", "x.parquet"));
        assertTrue(err().contains("Exactly one of --input or --input-dir"), err());

        assertEquals(1, cli("-i", "a.parquet", "--input-dir", "d", "-o", "x"));
        assertEquals(1, cli("-i", "a.parquet"));
        assertEquals(1, cli("-i", "a.parquet", "-o", "x.parquet", "--threads", "many"));
        assertEquals(1, cli("-i", "a.parquet", "-o", "x.parquet", "--frobnicate"));
        assertEquals(1, cli("-i", "a.parquet", "-o"));
        assertEquals(1, cli("-i", "a.parquet", "-o", "x.parquet", "--batch-size", "0"));
        assertTrue(err().contains("usage-error"), err());
    }
}
