package com.mendwatch.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * An error found in the monitored project.
 * <p>
 * Instances are immutable; state changes produce a copy through the {@code with*} methods so that
 * the {@code ErrorStore} can hand out snapshots without exposing its own state.
 *
 * @param id          unique identifier, never changes
 * @param errorType   detector category (e.g. "SyntaxError", "Style")
 * @param message     detector message
 * @param filePath    file the error was found in
 * @param lineNumber  1-based line, 0 when unknown
 * @param severity    detector-assigned severity
 * @param status      resolution state
 * @param fixAttempts number of remediation attempts so far
 * @param maxRetries  attempts allowed before the error is given up on
 * @param createdAt   when the error was first recorded
 * @param updatedAt   last state change
 * @param fixedAt     when the error was resolved (nullable)
 * @param fix         the applied fix (nullable)
 */
public record DetectedError(
    String id,
    String errorType,
    String message,
    String filePath,
    int lineNumber,
    ErrorSeverity severity,
    ErrorStatus status,
    int fixAttempts,
    int maxRetries,
    Instant createdAt,
    Instant updatedAt,
    Instant fixedAt,
    Fix fix
) implements Serializable {

    public static final int DEFAULT_MAX_RETRIES = 3;

    /**
     * Creates a new pending error with a random id.
     */
    public static DetectedError of(String errorType, String message, String filePath,
                                   int lineNumber, ErrorSeverity severity) {
        Instant now = Instant.now();
        return new DetectedError(UUID.randomUUID().toString(), errorType, message, filePath,
                lineNumber, severity, ErrorStatus.PENDING, 0, DEFAULT_MAX_RETRIES,
                now, now, null, null);
    }

    /** Key used to detect duplicates: one unresolved error per (file, line, type). */
    @JsonIgnore
    public Key key() {
        return new Key(filePath, lineNumber, errorType);
    }

    @JsonIgnore
    public boolean isResolved() {
        return status.isResolved();
    }

    @JsonIgnore
    public boolean retriesExhausted() {
        return fixAttempts >= maxRetries;
    }

    public DetectedError withStatus(ErrorStatus newStatus, Instant at) {
        return new DetectedError(id, errorType, message, filePath, lineNumber, severity,
                newStatus, fixAttempts, maxRetries, createdAt, at, fixedAt, fix);
    }

    public DetectedError withFixAttempts(int attempts, Instant at) {
        return new DetectedError(id, errorType, message, filePath, lineNumber, severity,
                status, attempts, maxRetries, createdAt, at, fixedAt, fix);
    }

    public DetectedError withMaxRetries(int retries) {
        return new DetectedError(id, errorType, message, filePath, lineNumber, severity,
                status, fixAttempts, retries, createdAt, updatedAt, fixedAt, fix);
    }

    public DetectedError resolvedWith(Fix appliedFix, Instant at) {
        return new DetectedError(id, errorType, message, filePath, lineNumber, severity,
                ErrorStatus.FIXED, fixAttempts, maxRetries, createdAt, at, at, appliedFix);
    }

    public record Key(String filePath, int lineNumber, String errorType) implements Serializable {}
}
