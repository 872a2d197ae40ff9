package com.mendwatch.core.security;

/**
 * Raised when the security context cannot be established, e.g. the configured project root is
 * not a usable directory. Runtime checks report violations as {@code false} instead.
 */
public class SecurityViolationException extends RuntimeException {

    public SecurityViolationException(String message) {
        super(message);
    }

    public SecurityViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
