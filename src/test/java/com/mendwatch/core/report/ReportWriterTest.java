package com.mendwatch.core.report;

import com.mendwatch.core.MutableClock;
import com.mendwatch.core.model.ErrorReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportWriterTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private ReportWriter writer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00.000Z"));
        writer = new ReportWriter(tempDir.resolve("reports"), new ReportCodec(), clock);
    }

    @Test
    @DisplayName("writes a markdown and a JSON file named after the timestamp")
    void writesPair() throws Exception {
        ReportFiles files = writer.write(ReportCodecTest.fixedReport());

        assertEquals("error_report_20260301_100000_000.md", files.markdown().getFileName().toString());
        assertEquals("error_report_20260301_100000_000.json", files.json().getFileName().toString());
        String markdown = Files.readString(files.markdown());
        assertTrue(markdown.startsWith("# Error Report"));
        assertTrue(markdown.contains("- **File:** src/app.py"));
        assertTrue(markdown.contains("- **Function:** main"));
        assertTrue(markdown.contains("- **Class:** N/A"));
        assertTrue(markdown.contains("- x = 1  \n+ x = 1"));
        assertTrue(markdown.contains("## Recommendations"));
    }

    @Test
    @DisplayName("reports written at the same instant get distinct names")
    void sameInstant() throws Exception {
        ReportFiles first = writer.write(ReportCodecTest.fixedReport());
        ReportFiles second = writer.write(ReportCodecTest.fixedReport());

        assertNotEquals(first.json(), second.json());
        assertEquals("error_report_20260301_100000_000_1.json", second.json().getFileName().toString());
    }

    @Test
    @DisplayName("recent loads reports back newest first and respects the limit")
    void recent() throws Exception {
        ErrorReport report = ReportCodecTest.fixedReport();
        writer.write(report);
        clock.advance(Duration.ofSeconds(1));
        writer.write(report);
        clock.advance(Duration.ofSeconds(1));
        ReportFiles newest = writer.write(report);

        List<ErrorReport> loaded = writer.recent(2);

        assertEquals(2, loaded.size());
        assertEquals(report, loaded.get(0));
        assertTrue(Files.exists(newest.json()));
    }

    @Test
    @DisplayName("unreadable report files are skipped")
    void skipsCorrupt() throws Exception {
        writer.write(ReportCodecTest.fixedReport());
        Files.writeString(writer.directory().resolve("error_report_99999999_000000_000.json"), "{not json");

        List<ErrorReport> loaded = writer.recent(10);

        assertEquals(1, loaded.size());
    }

    @Test
    @DisplayName("a missing directory has no reports")
    void missingDirectory() {
        assertTrue(writer.recent(5).isEmpty());
    }
}
