package com.mendwatch.core.security;

import java.util.Locale;
import java.util.Optional;

/**
 * File operations checked by {@link PathGuard}, each mapped to the capability of the
 * {@link SecurityContext} that must be granted for it.
 */
public enum FileOperation {
    READ("read"),
    WRITE("write"),
    DELETE("write"),
    EXECUTE("analyze");

    private final String capability;

    FileOperation(String capability) {
        this.capability = capability;
    }

    public String capability() {
        return capability;
    }

    /** Parses "read", "write", "delete" or "execute"; empty for anything else. */
    public static Optional<FileOperation> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
