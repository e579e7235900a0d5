package com.resource.naming.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable wrapper around SLF4J MDC. Entries added here are removed on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forClaim(correlationId, "storage_account", actor)) {
 *     log.info("claim.succeeded name={}", name);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forClaim(String correlationId, String resourceType, String actor) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("resourceType", resourceType);
        ctx.put("actor", actor);
        ctx.put("operation", "claim");
        return ctx;
    }

    public static LogContext forRelease(String correlationId, String name, String actor) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("name", name);
        ctx.put("actor", actor);
        ctx.put("operation", "release");
        return ctx;
    }

    public static LogContext forSync(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "slug-sync");
        return ctx;
    }

    public static String generateCorrelationId() {
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
