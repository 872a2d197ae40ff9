package com.mendwatch.core.report;

import com.mendwatch.core.model.ErrorReport;
import com.mendwatch.core.model.ErrorStatus;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.TreeMap;

public class ReportAnalyzer {

    public ReportAnalysis analyze(List<ErrorReport> reports) {
        var errorTypes = new TreeMap<String, Integer>();
        var fixTypes = new TreeMap<String, Integer>();
        var files = new TreeMap<String, Integer>();
        int fixed = 0;
        int failed = 0;
        double fixSeconds = 0;
        int timedFixes = 0;

        for (ErrorReport report : reports) {
            if (report.status() == ErrorStatus.FIXED) {
                fixed++;
            } else if (report.status() == ErrorStatus.FAILED) {
                failed++;
            }
            errorTypes.merge(report.error().errorType(), 1, Integer::sum);
            files.merge(String.valueOf(report.error().filePath()), 1, Integer::sum);
            if (report.fix() != null) {
                fixTypes.merge(report.fix().fixType(), 1, Integer::sum);
                if (report.fix().fixedAt() != null && report.error().createdAt() != null) {
                    fixSeconds += Duration.between(report.error().createdAt(), report.fix().fixedAt()).toMillis() / 1000.0;
                    timedFixes++;
                }
            }
        }

        double avgFix = timedFixes == 0 ? 0.0 : fixSeconds / timedFixes;
        double successRate = reports.isEmpty() ? 0.0 : fixed * 100.0 / reports.size();
        return new ReportAnalysis(reports.size(), fixed, failed,
                Collections.unmodifiableMap(errorTypes),
                Collections.unmodifiableMap(fixTypes),
                Collections.unmodifiableMap(files),
                avgFix, successRate);
    }
}
