package com.ontask.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing OnTask-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setScan(String scanId) {
        MDC.put("scanId", scanId);
    }

    public static void setDocument(String scanId, int documentIndex) {
        MDC.put("scanId", scanId);
        MDC.put("documentIndex", String.valueOf(documentIndex));
    }

    public static void clearDocument() {
        MDC.remove("documentIndex");
    }

    public static void clear() {
        MDC.remove("scanId");
        MDC.remove("documentIndex");
    }
}
