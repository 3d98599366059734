package com.drugbox.recognition.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Keys put through a context are removed when it closes.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRegion(scanId, regionId)) {
 *     log.info("region.decided action={}", action);
 * }
 * </pre>
 *
 * <p>MDC is thread-local, so each worker thread opens its own context.</p>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forScan(String scanId, String source) {
        LogContext ctx = new LogContext();
        ctx.put("scanId", scanId);
        ctx.put("source", source);
        ctx.put("operation", "scan");
        return ctx;
    }

    public static LogContext forRegion(String scanId, String regionId) {
        LogContext ctx = new LogContext();
        ctx.put("scanId", scanId);
        ctx.put("regionId", regionId);
        ctx.put("operation", "region");
        return ctx;
    }

    public static LogContext forOptimize(String operationId) {
        LogContext ctx = new LogContext();
        ctx.put("operationId", operationId);
        ctx.put("operation", "optimize");
        return ctx;
    }

    public static String generateId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
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
