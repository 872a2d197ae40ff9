package com.mendwatch.core.agent;

import java.time.Instant;

/**
 * Something an agent did, e.g. a task it executed.
 *
 * @param type    activity kind (e.g. "task", "lifecycle")
 * @param status  outcome (e.g. "started", "completed", "failed")
 * @param details free text
 * @param project project the activity relates to (nullable)
 */
public record AgentActivity(
    Instant timestamp,
    String type,
    String status,
    String details,
    String project
) {}
