package com.gatekeeper.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Gatekeeper-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRequest(String requestId) {
        MDC.put("requestId", requestId);
    }

    public static void setBranch(String branch) {
        MDC.put("branch", branch);
    }

    public static void clear() {
        MDC.remove("requestId");
        MDC.remove("branch");
    }
}
