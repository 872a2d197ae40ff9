package com.mendwatch.core.agent;

/**
 * One reading from a {@link MetricsCollector}.
 *
 * @param cpuUsage     CPU usage in percent
 * @param memoryUsage  memory usage in percent
 * @param responseTime mean task response time in milliseconds
 * @param successRate  share of successful tasks in percent
 * @param errorCount   failed tasks so far
 */
public record MetricsSample(
    double cpuUsage,
    double memoryUsage,
    double responseTime,
    double successRate,
    int errorCount
) {}
