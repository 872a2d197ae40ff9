package com.mendwatch.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setAgent puts agentId in MDC")
    void setAgent() {
        MdcContext.setAgent("remediator");
        assertEquals("remediator", MDC.get("agentId"));
    }

    @Test
    @DisplayName("clearTask keeps the agent")
    void clearTaskKeepsAgent() {
        MdcContext.setAgent("remediator");
        MdcContext.setTask("TASK-0001", "FIX_ERROR");
        assertEquals("TASK-0001", MDC.get("taskId"));
        assertEquals("FIX_ERROR", MDC.get("taskType"));

        MdcContext.clearTask();

        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("taskType"));
        assertEquals("remediator", MDC.get("agentId"));
    }

    @Test
    @DisplayName("clear removes all mendwatch MDC keys")
    void clear() {
        MdcContext.setAgent("remediator");
        MdcContext.setTask("TASK-0001", "FIX_ERROR");
        MdcContext.clear();
        assertNull(MDC.get("agentId"));
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("taskType"));
    }
}
