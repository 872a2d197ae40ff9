package com.mendwatch.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the engine, used by the CLI watch mode and report hooks.
 *
 * @param eventType event type (e.g. "error.detected", "task.created", "agent.started")
 * @param source    the agent id, task id or file the event relates to
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record MendwatchEvent(
    String eventType,
    String source,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static MendwatchEvent of(String eventType, String source, Map<String, Object> payload) {
        return new MendwatchEvent(eventType, source, payload, Instant.now());
    }

    /** The part of the event type before the first dot, e.g. {@code task} for {@code task.failed}. */
    public String category() {
        int dot = eventType.indexOf('.');
        return dot < 0 ? eventType : eventType.substring(0, dot);
    }
}
