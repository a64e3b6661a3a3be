package com.movie.night.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and, on close, restores whatever values those
 * keys held before, so contexts can nest.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forEnrichment(runId, movieId)) {
 *     log.info("enrichment.step.completed step={}", step);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    // key -> value it held before this context, null if absent
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Context for enriching a single movie.
     */
    public static LogContext forEnrichment(String runId, long movieId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("movieId", String.valueOf(movieId));
        ctx.put("operation", "enrich");
        return ctx;
    }

    /**
     * Context for a resumable batch job.
     */
    public static LogContext forBatch(String runId, String job) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("job", job);
        ctx.put("operation", "batch");
        return ctx;
    }

    /**
     * Context for a trailer lookup. Leaves {@code operation} alone since lookups
     * usually run inside an enrichment or batch context.
     */
    public static LogContext forTrailer(String title) {
        LogContext ctx = new LogContext();
        ctx.put("trailerTitle", title);
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * The run id of an enclosing context, or a fresh one when there is none.
     */
    public static String currentRunId() {
        String runId = MDC.get("runId");
        return runId != null ? runId : generateRunId();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (Map.Entry<String, String> entry : previous.entrySet()) {
            if (entry.getValue() != null) {
                MDC.put(entry.getKey(), entry.getValue());
            } else {
                MDC.remove(entry.getKey());
            }
        }
        previous.clear();
    }
}
