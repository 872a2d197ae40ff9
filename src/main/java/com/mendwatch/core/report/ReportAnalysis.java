package com.mendwatch.core.report;

import java.util.Map;

/**
 * Aggregates over a set of reports.
 *
 * @param avgFixSeconds mean time from detection to fix over reports that carry a fix
 * @param successRate   fixed reports as a percentage of all reports
 */
public record ReportAnalysis(
    int totalErrors,
    int fixedErrors,
    int failedErrors,
    Map<String, Integer> errorTypes,
    Map<String, Integer> fixTypes,
    Map<String, Integer> commonFiles,
    double avgFixSeconds,
    double successRate
) {}
