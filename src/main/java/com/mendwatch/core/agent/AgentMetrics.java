package com.mendwatch.core.agent;

import java.time.Instant;

/**
 * Metrics snapshot of an agent as last applied by its sampling loop.
 *
 * @param activeTime when the last sample was applied (null until the first one)
 */
public record AgentMetrics(
    double cpuUsage,
    double memoryUsage,
    double responseTime,
    double successRate,
    int errorCount,
    Instant activeTime
) {

    public static AgentMetrics initial() {
        return new AgentMetrics(0.0, 0.0, 0.0, 0.0, 0, null);
    }

    public static AgentMetrics from(MetricsSample sample, Instant at) {
        return new AgentMetrics(sample.cpuUsage(), sample.memoryUsage(), sample.responseTime(),
                sample.successRate(), sample.errorCount(), at);
    }
}
