package com.mendwatch.core.model;

/**
 * Kinds of remediation work.
 * <p>
 * Deduplication is decided per kind: a deduplicated kind never has two non-terminal tasks for
 * the same file. Error fixes are never deduplicated so that every detected error gets its own task.
 */
public enum TaskType {
    RUN_TESTS(false),
    FIX_ERROR(false),
    LINTING(true),
    PROJECT_SCAN(true);

    private final boolean deduplicated;

    TaskType(boolean deduplicated) {
        this.deduplicated = deduplicated;
    }

    public boolean isDeduplicated() {
        return deduplicated;
    }
}
