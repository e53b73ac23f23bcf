package com.statute.ledger.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries, removed again on {@link #close()}.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forDecision(correlationId, statuteId, subjectId)) {
 *     log.info("Decision recorded: {}", result);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String STATUTE_ID = "statuteId";
    public static final String SUBJECT_ID = "subjectId";
    public static final String OPERATION = "operation";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for evaluating one statute and recording the outcome.
     */
    public static LogContext forDecision(String correlationId, String statuteId, String subjectId) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(STATUTE_ID, statuteId);
        ctx.put(SUBJECT_ID, subjectId);
        ctx.put(OPERATION, "decide");
        return ctx;
    }

    /**
     * Context for evaluating every statute of a jurisdiction.
     */
    public static LogContext forJurisdiction(String correlationId, String jurisdiction, String subjectId) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put("jurisdiction", jurisdiction);
        ctx.put(SUBJECT_ID, subjectId);
        ctx.put(OPERATION, "decideAll");
        return ctx;
    }

    public static LogContext forVerification(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(OPERATION, "verify");
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
