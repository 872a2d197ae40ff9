package com.mendwatch.core.remediation;

/**
 * How a failed operation is handled.
 */
public enum ErrorKind {
    /** Bad input or a rejected check. Never retried. */
    VALIDATION,
    /** A temporary condition; the last good state is kept. */
    TRANSIENT,
    /** Cannot succeed; the task ends and its state is left for reconciliation. */
    UNRECOVERABLE,
    /** The task ran and failed; a fix may be retried up to the error's retry budget. */
    EXECUTION
}
