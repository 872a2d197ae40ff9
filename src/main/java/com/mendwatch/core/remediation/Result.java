package com.mendwatch.core.remediation;

/**
 * Outcome of a task handler: a value on success, an {@link ErrorKind} and message on failure.
 */
public record Result<T>(T value, ErrorKind kind, String message) {

    public static <T> Result<T> ok(T value) {
        return new Result<>(value, null, null);
    }

    public static <T> Result<T> failure(ErrorKind kind, String message) {
        return new Result<>(null, kind, message);
    }

    public boolean isOk() {
        return kind == null;
    }
}
