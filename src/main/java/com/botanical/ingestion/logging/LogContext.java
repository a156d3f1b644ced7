package com.botanical.ingestion.logging;

import com.botanical.ingestion.core.model.Provider;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forProviderRequest(correlationId, Provider.TREFLE, "/plants/123")) {
 *     log.info("provider.request endpoint={}", endpoint);
 * } // MDC entries are cleared here
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one outbound provider call.
     */
    public static LogContext forProviderRequest(String correlationId, Provider provider, String endpoint) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("provider", provider.key());
        ctx.put("endpoint", endpoint);
        ctx.put("operation", "provider-request");
        return ctx;
    }

    /**
     * Creates a log context for ingesting one provider record.
     */
    public static LogContext forIngest(String correlationId, Provider provider, String scientificName) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("provider", provider.key());
        ctx.put("scientificName", scientificName);
        ctx.put("operation", "ingest");
        return ctx;
    }

    /**
     * Creates a log context for a bulk reconciliation run.
     */
    public static LogContext forReconcile(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "reconcile");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
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
