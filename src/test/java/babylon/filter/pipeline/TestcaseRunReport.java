package babylon.filter.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.github.pemistahl.lingua.api.Language;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import babylon.filter.ErrorCode;
import babylon.filter.FilterException;

public class TestcaseRunReport {

    @TempDir
    File dir;

    private static FileTask task(final String name) {
        return new FileTask(new File("in", name), new File("out", name));
    }

    @Test
    void status() {
        assertEquals(RunReport.Status.FAILED, new RunReport().status());

        final RunReport report = new RunReport()
                .add(FileOutcome.done(task("a.parquet"), 10, 4, 5, Language.UKRAINIAN, false));
        assertEquals(RunReport.Status.SUCCESS, report.status());

        report.add(FileOutcome.failed(task("b.parquet"), 0, 1, Language.UKRAINIAN, false,
                new FilterException(ErrorCode.COLUMN_NOT_FOUND, "'transcription'")));
        assertEquals(RunReport.Status.PARTIAL, report.status());
        assertEquals(2, report.exitCode());
        assertEquals(10, report.rowsIn());
        assertEquals(4, report.rowsOut());
    }

    @Test
    void json() throws Exception {
        final RunReport report = new RunReport()
                .add(FileOutcome.done(task("a.parquet"), 10, 4, 5, Language.UKRAINIAN, true))
                .add(FileOutcome.failed(task("b.parquet"), 3, 1, Language.UKRAINIAN, true,
                        new FilterException(ErrorCode.DETECTION_FAILED, "batch 0")));

        final File file = new File(dir, "report.json");
        report.write(file);
        final JsonObject root = JsonParser.parseString(new String(Files.readAllBytes(file.toPath()),
                StandardCharsets.UTF_8)).getAsJsonObject();

        assertEquals("PARTIAL", root.get("status").getAsString());
        assertEquals(2, root.get("processed").getAsInt());
        assertEquals(1, root.get("failed").getAsInt());

        final JsonArray files = root.getAsJsonArray("files");
        final JsonObject a = files.get(0).getAsJsonObject();
        assertEquals("DONE", a.get("status").getAsString());
        assertEquals(4, a.get("rowsOut").getAsLong());
        assertEquals("Ukrainian", a.get("language").getAsString());
        assertTrue(a.get("cleaned").getAsBoolean());
        assertFalse(a.has("error"));

        final JsonObject b = files.get(1).getAsJsonObject();
        assertEquals("DETECTION_FAILED", b.get("error").getAsString());
        assertEquals("detection-error", b.get("kind").getAsString());
        assertFalse(b.has("exception"));
    }
}
