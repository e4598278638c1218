package com.tracker.sync.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forIssue(passId, key.toString(), "update")) {
 *     log.info("action.applied type={}", type);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for a whole reconciliation pass.
     */
    public static LogContext forPass(String passId) {
        LogContext ctx = new LogContext();
        ctx.put("passId", passId);
        ctx.put("operation", "pass");
        return ctx;
    }

    /**
     * Context for fetching and normalizing one source.
     */
    public static LogContext forSource(String passId, String sourceId) {
        LogContext ctx = new LogContext();
        ctx.put("passId", passId);
        ctx.put("sourceId", sourceId);
        ctx.put("operation", "fetch");
        return ctx;
    }

    /**
     * Context for work on one issue.
     */
    public static LogContext forIssue(String passId, String issueKey, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("passId", passId);
        ctx.put("issueKey", issueKey);
        ctx.put("operation", operation);
        return ctx;
    }

    public static String generatePassId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
