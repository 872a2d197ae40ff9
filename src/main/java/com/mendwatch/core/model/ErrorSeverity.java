package com.mendwatch.core.model;

/**
 * Severity assigned to a detected error by the detector that found it.
 */
public enum ErrorSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
