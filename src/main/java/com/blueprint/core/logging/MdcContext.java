package com.blueprint.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Blueprint-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setIdea(String ideaId) {
        MDC.put("ideaId", ideaId);
    }

    public static void setStage(String ideaId, String stage) {
        MDC.put("ideaId", ideaId);
        MDC.put("stage", stage);
    }

    public static void clearStage() {
        MDC.remove("stage");
    }

    public static void clear() {
        MDC.remove("ideaId");
        MDC.remove("stage");
    }
}
