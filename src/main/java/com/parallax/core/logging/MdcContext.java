package com.parallax.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Parallax-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setItem(String sessionId, int itemIndex, String taskKind) {
        MDC.put("sessionId", sessionId);
        MDC.put("itemIndex", String.valueOf(itemIndex));
        MDC.put("taskKind", taskKind);
    }

    public static void setLevel(String sessionId, int levelNumber) {
        MDC.put("sessionId", sessionId);
        MDC.put("levelNumber", String.valueOf(levelNumber));
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("itemIndex");
        MDC.remove("taskKind");
        MDC.remove("levelNumber");
    }
}
