package com.mendwatch.core.agent;

import com.mendwatch.core.metrics.MendwatchMetrics;
import com.mendwatch.core.model.TaskStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Builds agent samples from the Micrometer registry: process CPU and heap gauges bound by
 * Spring Boot, plus the task timers and result counters recorded by {@link MendwatchMetrics}.
 * Missing meters read as zero.
 */
public class MeterRegistryMetricsCollector implements MetricsCollector {

    private final MeterRegistry registry;

    public MeterRegistryMetricsCollector(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public MetricsSample collect() {
        if (registry.isClosed()) {
            throw new MetricsSourceExhaustedException("Meter registry is closed");
        }
        double cpu = gauge("process.cpu.usage") * 100.0;
        double memory = heapUsagePercent();

        double totalMs = 0;
        long calls = 0;
        for (Timer timer : registry.find(MendwatchMetrics.TASK_DURATION).timers()) {
            totalMs += timer.totalTime(TimeUnit.MILLISECONDS);
            calls += timer.count();
        }
        double responseTime = calls == 0 ? 0.0 : totalMs / calls;

        double completed = 0;
        double failed = 0;
        for (Counter counter : registry.find(MendwatchMetrics.TASK_RESULTS).counters()) {
            String status = counter.getId().getTag("status");
            if (TaskStatus.COMPLETED.name().equals(status)) {
                completed += counter.count();
            } else if (TaskStatus.FAILED.name().equals(status)) {
                failed += counter.count();
            }
        }
        double finished = completed + failed;
        double successRate = finished == 0 ? 100.0 : completed * 100.0 / finished;

        return new MetricsSample(cpu, memory, responseTime, successRate, (int) failed);
    }

    private double gauge(String name) {
        Gauge gauge = registry.find(name).gauge();
        if (gauge == null || Double.isNaN(gauge.value())) {
            return 0.0;
        }
        return gauge.value();
    }

    private double heapUsagePercent() {
        double used = 0;
        double max = 0;
        for (Gauge gauge : registry.find("jvm.memory.used").tag("area", "heap").gauges()) {
            used += positive(gauge.value());
        }
        for (Gauge gauge : registry.find("jvm.memory.max").tag("area", "heap").gauges()) {
            max += positive(gauge.value());
        }
        if (max <= 0) {
            Runtime runtime = Runtime.getRuntime();
            used = runtime.totalMemory() - runtime.freeMemory();
            max = runtime.maxMemory();
        }
        return max <= 0 ? 0.0 : used * 100.0 / max;
    }

    private static double positive(double value) {
        return Double.isNaN(value) || value < 0 ? 0.0 : value;
    }
}
