package com.mendwatch.core.errors;

import java.util.Map;

/**
 * Aggregate counts over the error store, taken under one lock acquisition.
 *
 * @param total      all errors recorded
 * @param resolved   errors with status FIXED
 * @param unresolved everything else
 * @param byType     error count per error type
 * @param byFile     error count per file
 */
public record ErrorStats(
    int total,
    int resolved,
    int unresolved,
    Map<String, Integer> byType,
    Map<String, Integer> byFile
) {}
