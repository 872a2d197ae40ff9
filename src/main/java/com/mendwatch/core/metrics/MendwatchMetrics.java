package com.mendwatch.core.metrics;

import com.mendwatch.core.model.TaskStatus;
import com.mendwatch.core.model.TaskType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for error detection and remediation.
 */
public class MendwatchMetrics {

    public static final String TASK_DURATION = "mendwatch.task.duration";
    public static final String TASK_RESULTS = "mendwatch.tasks.results";

    private final MeterRegistry registry;

    public MendwatchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void recordErrorDetected(String errorType) {
        Counter.builder("mendwatch.errors.detected")
                .tag("type", errorType)
                .register(registry)
                .increment();
    }

    public void recordDuplicateError() {
        Counter.builder("mendwatch.errors.duplicates")
                .description("Detections rejected because an unresolved duplicate exists")
                .register(registry)
                .increment();
    }

    public void recordErrorResolved(String fixType) {
        Counter.builder("mendwatch.errors.resolved")
                .tag("fix", fixType)
                .register(registry)
                .increment();
    }

    public void recordTaskCreated(TaskType type) {
        Counter.builder("mendwatch.tasks.created")
                .tag("type", type.name())
                .register(registry)
                .increment();
    }

    /**
     * Records the terminal outcome of a task and how long it ran.
     */
    public void recordTaskExecution(TaskType type, TaskStatus outcome, long ms) {
        Timer.builder(TASK_DURATION)
                .tag("type", type.name())
                .register(registry)
                .record(Duration.ofMillis(ms));
        Counter.builder(TASK_RESULTS)
                .tag("type", type.name())
                .tag("status", outcome.name())
                .register(registry)
                .increment();
    }

    public void recordStaleTasks(int count) {
        Counter.builder("mendwatch.tasks.stale")
                .description("In-progress tasks failed by the staleness sweep")
                .register(registry)
                .increment(count);
    }

    public void recordAgentSample(String agentId) {
        Counter.builder("mendwatch.agent.samples")
                .tag("agent", agentId)
                .register(registry)
                .increment();
    }

    public void recordSecurityScan(int vulnerabilities) {
        DistributionSummary.builder("mendwatch.security.vulnerabilities")
                .description("Vulnerabilities found per security scan")
                .register(registry)
                .record(vulnerabilities);
    }
}
