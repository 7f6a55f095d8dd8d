package com.congruence.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing pipeline MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(long projectId, long runId, String branch) {
        MDC.put("projectId", String.valueOf(projectId));
        MDC.put("runId", String.valueOf(runId));
        MDC.put("branch", branch);
    }

    public static void setCommand(String command) {
        MDC.put("command", command);
    }

    public static void clearCommand() {
        MDC.remove("command");
    }

    public static void clear() {
        MDC.remove("projectId");
        MDC.remove("runId");
        MDC.remove("branch");
        MDC.remove("command");
    }
}
