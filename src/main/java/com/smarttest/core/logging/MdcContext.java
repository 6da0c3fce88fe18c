package com.smarttest.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing run-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setRun(String runId, String projectId) {
        MDC.put("runId", runId);
        if (projectId != null) {
            MDC.put("projectId", projectId);
        }
    }

    public static void setStep(String runId, String step) {
        MDC.put("runId", runId);
        MDC.put("step", step);
    }

    public static boolean hasRun() {
        return MDC.get("runId") != null;
    }

    public static void clearStep() {
        MDC.remove("step");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("projectId");
        MDC.remove("step");
    }
}
