package com.mendwatch.core.agent;

@FunctionalInterface
public interface ContainerProbe {

    ContainerMetrics probe();
}
