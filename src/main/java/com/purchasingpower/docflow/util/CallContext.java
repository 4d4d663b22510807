package com.purchasingpower.docflow.util;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Context for one completion-service call: call id, timing and request/response logging.
 *
 * @see ExternalCallLogger
 */
public class CallContext {
    private final String callId;
    private final String service;
    private final String operation;
    private final Instant startTime;
    private final Logger logger;

    CallContext(String service, String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(String summary) {
        logger.info("🤖 {} → {} [{}]", service, operation, callId);
        if (summary != null && !summary.isEmpty()) {
            logger.debug("  Request: {}", summary);
        }
    }

    public void logResponse(String summary) {
        logger.info("🤖 {} ← {} [{}] ({}ms)", service, operation, callId, getElapsedMs());
        if (summary != null && !summary.isEmpty()) {
            logger.debug("  Response: {}", summary);
        }
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("🤖 {} ✖ {} [{}] ({}ms) - {}", service, operation, callId, getElapsedMs(), errorMessage);
        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    public String getCallId() {
        return callId;
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }
}
