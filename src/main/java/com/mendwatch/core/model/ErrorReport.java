package com.mendwatch.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted report describing an error, its context and the fix applied to it.
 *
 * @param error           the error snapshot
 * @param fix             the applied fix (nullable)
 * @param context         source context
 * @param timestamp       when the report was generated
 * @param reportType      e.g. "error_fix"
 * @param status          error status at report time
 * @param metrics         optional metrics attached by the caller
 * @param recommendations optional follow-up suggestions
 */
public record ErrorReport(
    DetectedError error,
    Fix fix,
    ErrorContext context,
    Instant timestamp,
    String reportType,
    ErrorStatus status,
    Map<String, Object> metrics,
    List<String> recommendations
) implements Serializable {

    public ErrorReport {
        context = context == null ? ErrorContext.empty() : context;
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public static ErrorReport forError(DetectedError error, ErrorContext context) {
        return new ErrorReport(error, error.fix(), context, Instant.now(), "error_fix",
                error.status(), Map.of(), List.of());
    }
}
