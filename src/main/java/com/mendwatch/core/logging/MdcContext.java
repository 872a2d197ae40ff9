package com.mendwatch.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Mendwatch-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setAgent(String agentId) {
        MDC.put("agentId", agentId);
    }

    public static void setTask(String taskId, String taskType) {
        MDC.put("taskId", taskId);
        MDC.put("taskType", taskType);
    }

    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("taskType");
    }

    public static void clear() {
        MDC.remove("agentId");
        MDC.remove("taskId");
        MDC.remove("taskType");
    }
}
