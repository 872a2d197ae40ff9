package com.mendwatch.core.agent;

import java.lang.management.ManagementFactory;

/**
 * Reads process resource usage from the JVM management beans.
 */
public class JvmContainerProbe implements ContainerProbe {

    @Override
    public ContainerMetrics probe() {
        double cpu = 0.0;
        var os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            double load = sunOs.getProcessCpuLoad();
            cpu = load < 0 ? 0.0 : load * 100.0;
        }
        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        double memory = runtime.maxMemory() > 0 ? used * 100.0 / runtime.maxMemory() : 0.0;
        return new ContainerMetrics(
                cpu,
                memory,
                ManagementFactory.getThreadMXBean().getThreadCount(),
                ManagementFactory.getMemoryMXBean().getHeapMemoryUsage().getUsed(),
                ManagementFactory.getRuntimeMXBean().getUptime());
    }
}
