package com.mendwatch.core.agent;

/**
 * Resource usage of the process hosting the agents.
 */
public record ContainerMetrics(
    double cpuPercent,
    double memoryPercent,
    int threadCount,
    long heapUsedBytes,
    long uptimeMs
) {}
