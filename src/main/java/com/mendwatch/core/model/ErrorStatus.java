package com.mendwatch.core.model;

/**
 * Resolution state of a detected error.
 * <p>
 * Transitions only move forward, except {@code FAILED -> PENDING} when an error is retried.
 */
public enum ErrorStatus {
    PENDING,
    IN_PROGRESS,
    FIXED,
    FAILED;

    public boolean isResolved() {
        return this == FIXED;
    }
}
