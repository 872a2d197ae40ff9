package com.mendwatch.core.agent;

/**
 * Lifecycle of a monitored agent: {@code RUNNING -> STOPPED}, or {@code RUNNING -> ERROR} when
 * its sampling loop dies. An agent never returns to RUNNING under the same id.
 */
public enum AgentStatus {
    RUNNING,
    STOPPED,
    ERROR
}
