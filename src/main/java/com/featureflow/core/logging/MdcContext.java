package com.featureflow.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Featureflow MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setFeature(String featureId) {
        MDC.put("featureId", featureId);
    }

    public static void setPhase(String featureId, String phase) {
        MDC.put("featureId", featureId);
        MDC.put("phase", phase);
    }

    public static void clearPhase() {
        MDC.remove("phase");
    }

    public static void clear() {
        MDC.remove("featureId");
        MDC.remove("phase");
    }
}
