package com.mendwatch.core.report;

import com.mendwatch.core.model.Change;
import com.mendwatch.core.model.ErrorContext;
import com.mendwatch.core.model.ErrorReport;
import com.mendwatch.core.model.Fix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Persists reports as an {@code error_report_<timestamp>.md} / {@code .json} pair. The JSON
 * file is the machine-readable copy that {@link #recent(int)} loads back.
 */
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    static final String PREFIX = "error_report_";
    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

    private final Path directory;
    private final ReportCodec codec;
    private final Clock clock;

    public ReportWriter(Path directory, ReportCodec codec) {
        this(directory, codec, Clock.systemUTC());
    }

    public ReportWriter(Path directory, ReportCodec codec, Clock clock) {
        this.directory = directory;
        this.codec = codec;
        this.clock = clock;
    }

    public Path directory() {
        return directory;
    }

    /**
     * Writes both files, creating the report directory if needed.
     *
     * @throws IOException if either file cannot be written
     */
    public synchronized ReportFiles write(ErrorReport report) throws IOException {
        Files.createDirectories(directory);
        String base = PREFIX + STAMP.format(clock.instant());
        String name = base;
        for (int i = 1; Files.exists(directory.resolve(name + ".json")); i++) {
            name = base + "_" + i;
        }
        Path markdown = directory.resolve(name + ".md");
        Path json = directory.resolve(name + ".json");
        Files.writeString(markdown, renderMarkdown(report), StandardCharsets.UTF_8);
        Files.writeString(json, codec.toJson(report), StandardCharsets.UTF_8);
        log.info("Wrote report {}", json.getFileName());
        return new ReportFiles(markdown, json);
    }

    /**
     * Loads up to {@code limit} reports, newest first. Unreadable files are skipped.
     */
    public List<ErrorReport> recent(int limit) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream
                    .filter(p -> {
                        String fileName = p.getFileName().toString();
                        return fileName.startsWith(PREFIX) && fileName.endsWith(".json");
                    })
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .limit(limit)
                    .toList();
        } catch (IOException e) {
            log.error("Failed to list reports in {}: {}", directory, e.getMessage());
            return List.of();
        }
        var reports = new ArrayList<ErrorReport>();
        for (Path file : files) {
            try {
                reports.add(codec.fromJson(Files.readString(file, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                log.error("Failed to load report {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return reports;
    }

    static String renderMarkdown(ErrorReport report) {
        var md = new StringBuilder();
        var error = report.error();
        md.append("# Error Report\n\n");
        md.append("## Overview\n\n");
        md.append("- **Timestamp:** ").append(report.timestamp()).append('\n');
        md.append("- **Type:** ").append(error.errorType()).append('\n');
        md.append("- **Status:** ").append(report.status()).append('\n');
        md.append("- **Severity:** ").append(error.severity()).append("\n\n");

        md.append("## Error Details\n\n");
        md.append("- **Message:** ").append(error.message()).append('\n');
        md.append("- **File:** ").append(error.filePath()).append('\n');
        md.append("- **Line:** ").append(error.lineNumber()).append('\n');
        md.append("- **Fix Attempts:** ").append(error.fixAttempts()).append('/').append(error.maxRetries()).append("\n\n");

        ErrorContext context = report.context();
        if (context != null && !context.lineContent().isEmpty()) {
            md.append("## Context\n\n```\n").append(context.lineContent()).append("\n```\n\n");
            md.append("- **Function:** ").append(orNa(context.functionName())).append('\n');
            md.append("- **Class:** ").append(orNa(context.className())).append("\n\n");
            if (!context.imports().isEmpty()) {
                md.append("### Imports\n\n```\n");
                context.imports().forEach(i -> md.append(i).append('\n'));
                md.append("```\n\n");
            }
        }

        Fix fix = report.fix();
        if (fix != null) {
            md.append("## Fix Details\n\n");
            md.append("- **Type:** ").append(fix.fixType()).append('\n');
            md.append("- **Success:** ").append(fix.success()).append('\n');
            md.append("- **Fixed At:** ").append(fix.fixedAt()).append('\n');
            md.append("- **Backup:** ").append(orNa(fix.backupPath())).append("\n\n");
            if (!fix.changes().isEmpty()) {
                md.append("### Changes\n\n");
                for (Change change : fix.changes()) {
                    md.append("```diff\n")
                            .append("- ").append(change.oldText()).append('\n')
                            .append("+ ").append(change.newText()).append('\n')
                            .append("```\n\n");
                }
            }
        }

        if (!report.metrics().isEmpty()) {
            md.append("## Metrics\n\n");
            for (Map.Entry<String, Object> entry : report.metrics().entrySet()) {
                md.append("- **").append(entry.getKey()).append(":** ").append(entry.getValue()).append('\n');
            }
            md.append('\n');
        }
        if (!report.recommendations().isEmpty()) {
            md.append("## Recommendations\n\n");
            report.recommendations().forEach(r -> md.append("- ").append(r).append('\n'));
        }
        return md.toString();
    }

    private static String orNa(String value) {
        return value == null || value.isBlank() ? "N/A" : value;
    }
}
