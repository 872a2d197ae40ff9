package com.mendwatch.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Recorded outcome of a remediation applied to a {@link DetectedError}.
 *
 * @param errorId    the error this fix belongs to
 * @param success    whether the fix was applied successfully
 * @param message    human-readable summary
 * @param fixType    strategy that produced the fix (e.g. "trailing_whitespace")
 * @param changes    ordered list of edits
 * @param backupPath copy of the original file taken before writing (nullable)
 * @param fixedAt    when the fix was applied
 */
public record Fix(
    String errorId,
    boolean success,
    String message,
    String fixType,
    List<Change> changes,
    String backupPath,
    Instant fixedAt
) implements Serializable {

    public Fix {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }
}
