package com.purchasingpower.docflow.util;

import org.slf4j.Logger;

/**
 * Logging helpers for calls leaving the process.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(String service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging (to avoid log spam)
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
