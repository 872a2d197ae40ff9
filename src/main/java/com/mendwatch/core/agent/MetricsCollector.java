package com.mendwatch.core.agent;

/**
 * Source of agent metrics, polled by each agent's sampling thread. Implementations may block.
 */
@FunctionalInterface
public interface MetricsCollector {

    /**
     * @throws MetricsSourceExhaustedException when the source will never produce another sample
     */
    MetricsSample collect();
}
