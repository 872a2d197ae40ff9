package com.mendwatch.core.remediation;

import com.mendwatch.core.model.Change;

import java.util.List;

/**
 * New file content proposed by a {@link FixStrategy}. An empty change list means the file
 * already satisfies the strategy.
 */
public record FixProposal(String content, List<Change> changes, String message) {

    public FixProposal {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public boolean isNoop() {
        return changes.isEmpty();
    }
}
