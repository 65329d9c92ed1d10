package com.skillbench.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Skillbench-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setProject(String projectId) {
        MDC.put("projectId", projectId);
    }

    public static void setTask(String projectId, String skillId, String caseId) {
        MDC.put("projectId", projectId);
        MDC.put("skillId", skillId);
        MDC.put("caseId", caseId);
    }

    public static void setRound(String projectId, String iterationId, int round) {
        MDC.put("projectId", projectId);
        MDC.put("iterationId", iterationId);
        MDC.put("round", String.valueOf(round));
    }

    public static void clearTask() {
        MDC.remove("skillId");
        MDC.remove("caseId");
    }

    public static void clear() {
        MDC.remove("projectId");
        MDC.remove("skillId");
        MDC.remove("caseId");
        MDC.remove("iterationId");
        MDC.remove("round");
    }
}
