package com.plansmith.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Plansmith-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setNode(String runId, String node) {
        MDC.put("runId", runId);
        MDC.put("node", node);
    }

    public static void clearNode() {
        MDC.remove("node");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("node");
    }
}
