package com.playfactory.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing PlayFactory MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setServer(String serverId) {
        MDC.put("serverId", serverId);
    }

    public static void setOperation(String serverId, String operation) {
        MDC.put("serverId", serverId);
        MDC.put("operation", operation);
    }

    public static void clear() {
        MDC.remove("serverId");
        MDC.remove("operation");
    }
}
