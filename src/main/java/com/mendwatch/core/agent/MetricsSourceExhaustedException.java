package com.mendwatch.core.agent;

/**
 * Signals that a {@link MetricsCollector} can no longer produce samples. Ends the sampling loop
 * of the agent that observed it.
 */
public class MetricsSourceExhaustedException extends RuntimeException {

    public MetricsSourceExhaustedException(String message) {
        super(message);
    }

    public MetricsSourceExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
