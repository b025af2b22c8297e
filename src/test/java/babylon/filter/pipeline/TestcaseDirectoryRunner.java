package babylon.filter.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import babylon.filter.ErrorCode;
import babylon.filter.FilterException;
import babylon.filter.Fixtures;

public class TestcaseDirectoryRunner {

    @TempDir
    File dir;

    File in;
    File out;

    @BeforeEach
    void setUp() {
        in = new File(dir, "in");
        out = new File(dir, "out");
        assertTrue(in.mkdir());
    }

    private RunReport run(final PrintStream ps) throws FilterException {
        final FilterConfig config = FilterConfig.builder().threads(2).build();
        try (LanguageFilter f = new LanguageFilter(config, new Fixtures.ScriptDetector(), null)) {
            return f.directory(in, out, ps);
        }
    }

    @Test
    void everyFileDone() throws Exception {
        Fixtures.transcripts(new File(in, "b.parquet"), "Привіт", "Hello");
        Fixtures.transcripts(new File(in, "a.parquet"), "Hello", "Ґанок", "Їжак");

        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final RunReport report = run(new PrintStream(bytes, true, StandardCharsets.UTF_8));
        assertEquals(RunReport.Status.SUCCESS, report.status());
        assertEquals(0, report.exitCode());
        assertEquals(2, report.succeeded());
        assertEquals(5, report.rowsIn());
        assertEquals(3, report.rowsOut());

        // discovery order is by file name
        assertTrue(report.files().get(0).source().endsWith("a.parquet"));
        assertEquals(Arrays.asList("Ґанок", "Їжак"), Fixtures.texts(new File(out, "a.parquet"), "transcription"));
        assertEquals(Arrays.asList("Привіт"), Fixtures.texts(new File(out, "b.parquet"), "transcription"));

        final String[] lines = bytes.toString(StandardCharsets.UTF_8).split("\\R");
        assertEquals(2, lines.length);
        assertTrue(lines[0].startsWith("✅ Filtered 3 rows -> 2 rows kept"), lines[0]);
    }

    @Test
    void oneBrokenFileMakesAPartialRun() throws Exception {
        Fixtures.transcripts(new File(in, "good.parquet"), "Привіт");
        Files.write(new File(in, "bad.parquet").toPath(), "PAR1 truncated".getBytes(StandardCharsets.UTF_8));

        final RunReport report = run(null);
        assertEquals(2, report.processed());
        assertEquals(1, report.succeeded());
        assertEquals(1, report.failed());
        assertEquals(RunReport.Status.PARTIAL, report.status());
        assertEquals(2, report.exitCode());

        final FileOutcome bad = report.files().get(0);
        assertFalse(bad.succeeded());
        assertEquals(ErrorCode.Kind.IO, bad.kind());
        assertTrue(bad.summary().startsWith("❌ "), bad.summary());
        assertFalse(new File(out, "bad.parquet").exists());
        assertTrue(new File(out, "good.parquet").isFile());
        assertTrue(report.summary().startsWith("processed=2 succeeded=1 failed=1"), report.summary());
    }

    @Test
    void schemaFailureDoesNotStopTheRun() throws Exception {
        Fixtures.transcripts(new File(in, "1.parquet"), "Привіт");
        Fixtures.write(new File(in, "2.parquet"), new babylon.filter.Column[] {
                new babylon.filter.Column("other", babylon.filter.Column.TYPE_STRING, true) },
                List.<Object[]>of(new Object[] { "Привіт" }));
        Fixtures.transcripts(new File(in, "3.parquet"), "Привіт");

        final RunReport report = run(null);
        assertEquals(RunReport.Status.PARTIAL, report.status());
        assertEquals(ErrorCode.COLUMN_NOT_FOUND, report.files().get(1).error());
        assertEquals(ErrorCode.Kind.SCHEMA, report.files().get(1).kind());
        assertTrue(report.files().get(2).succeeded());
    }

    @Test
    void everyFileFailed() throws Exception {
        Files.write(new File(in, "x.parquet").toPath(), new byte[] { 1, 2, 3 });

        final RunReport report = run(null);
        assertEquals(RunReport.Status.FAILED, report.status());
        assertEquals(1, report.exitCode());
    }

    @Test
    void otherFilesAreIgnored() throws Exception {
        Fixtures.transcripts(new File(in, "a.parquet"), "Привіт");
        Files.write(new File(in, "notes.txt").toPath(), "hello".getBytes(StandardCharsets.UTF_8));
        assertTrue(new File(in, "nested.parquet").mkdir());

        final List<FileTask> tasks = DirectoryRunner.plan(in, out);
        assertEquals(1, tasks.size());
        assertEquals(new File(out, "a.parquet"), tasks.get(0).destination());
        assertTrue(out.isDirectory());
    }

    @Test
    void noEligibleFiles() throws Exception {
        Files.write(new File(in, "notes.txt").toPath(), "hello".getBytes(StandardCharsets.UTF_8));

        final FilterException ex = assertThrows(FilterException.class, () -> run(null));
        assertTrue(ex.isErrorCode(ErrorCode.NO_INPUT_FILES));
    }

    @Test
    void outputMustBeADirectory() throws Exception {
        Fixtures.transcripts(new File(in, "a.parquet"), "Привіт");
        Files.write(out.toPath(), new byte[0]);

        final FilterException ex = assertThrows(FilterException.class, () -> run(null));
        assertEquals(ErrorCode.OUTPUT_NOT_DIRECTORY, ex.getErrorCode());
        assertEquals(out, ex.getContext());
    }

    @Test
    void inputMustBeADirectory() throws Exception {
        final File file = Fixtures.transcripts(new File(dir, "a.parquet"), "Привіт");
        final FilterException ex = assertThrows(FilterException.class, () -> DirectoryRunner.plan(file, out));
        assertEquals(ErrorCode.STORAGE_READ_ERROR, ex.getErrorCode());
    }
}
