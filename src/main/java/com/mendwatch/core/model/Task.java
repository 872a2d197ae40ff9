package com.mendwatch.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;

/**
 * A unit of remediation work tracked by the task queue.
 *
 * @param id        unique identifier (e.g. "TASK-0001")
 * @param type      kind of work
 * @param priority  scheduling priority
 * @param status    lifecycle state
 * @param file      file the task targets (project root for scans)
 * @param line      line within the file, 0 when not applicable
 * @param errorId   id of the error this task fixes (nullable, lookup only)
 * @param context   free-form description passed to the handler
 * @param createdAt when the task was queued
 * @param updatedAt last status change, used for the staleness sweep
 */
public record Task(
    String id,
    TaskType type,
    TaskPriority priority,
    TaskStatus status,
    String file,
    int line,
    String errorId,
    String context,
    Instant createdAt,
    Instant updatedAt
) implements Serializable {

    public Task withStatus(TaskStatus newStatus, Instant at) {
        return new Task(id, type, priority, newStatus, file, line, errorId, context, createdAt, at);
    }

    /** Pending or in progress. */
    @JsonIgnore
    public boolean isActive() {
        return !status.isTerminal();
    }
}
