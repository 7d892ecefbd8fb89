package com.jiracdc.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing operation-scoped MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setOperation(String operationId, String projectKey) {
        MDC.put("operationId", operationId);
        MDC.put("projectKey", projectKey);
    }

    public static void setTask(String operationId, String taskId, String taskKind) {
        MDC.put("operationId", operationId);
        MDC.put("taskId", taskId);
        MDC.put("taskKind", taskKind);
    }

    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("taskKind");
    }

    public static void clear() {
        MDC.remove("operationId");
        MDC.remove("projectKey");
        MDC.remove("taskId");
        MDC.remove("taskKind");
    }
}
