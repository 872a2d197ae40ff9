package com.mendwatch.dispatch.cli;

import com.mendwatch.core.model.ErrorReport;
import com.mendwatch.core.report.ReportAnalyzer;
import com.mendwatch.core.report.ReportWriter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: mendwatch reports [--limit N]
 * <p>
 * Lists the most recent error reports and prints aggregate statistics over them.
 */
@Command(name = "reports", mixinStandardHelpOptions = true, description = "Show recent error reports")
@Component
public class ReportsCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of reports to load (default: ${DEFAULT-VALUE})",
            defaultValue = "10")
    private int limit;

    private final ReportWriter reportWriter;
    private final ReportAnalyzer reportAnalyzer;

    public ReportsCommand(ReportWriter reportWriter, ReportAnalyzer reportAnalyzer) {
        this.reportWriter = reportWriter;
        this.reportAnalyzer = reportAnalyzer;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        List<ErrorReport> reports = reportWriter.recent(limit);
        if (reports.isEmpty()) {
            ConsoleOutput.info("No reports in " + reportWriter.directory());
            return;
        }
        for (ErrorReport report : reports) {
            String line = report.timestamp() + " " + report.error().errorType() + " "
                    + report.error().filePath() + ":" + report.error().lineNumber() + " " + report.status();
            switch (report.status()) {
                case FIXED -> ConsoleOutput.success(line);
                case FAILED -> ConsoleOutput.error(line);
                default -> ConsoleOutput.info(line);
            }
        }

        var analysis = reportAnalyzer.analyze(reports);
        System.out.println("──────────────────────────────────");
        System.out.printf("  Reports: %d, fixed: %d, failed: %d%n",
                analysis.totalErrors(), analysis.fixedErrors(), analysis.failedErrors());
        System.out.printf("  Success rate: %.1f%%, average fix time: %.1fs%n",
                analysis.successRate(), analysis.avgFixSeconds());
        ConsoleOutput.counts("By type", analysis.errorTypes());
        ConsoleOutput.counts("By fix", analysis.fixTypes());
        ConsoleOutput.counts("By file", analysis.commonFiles());
    }
}
