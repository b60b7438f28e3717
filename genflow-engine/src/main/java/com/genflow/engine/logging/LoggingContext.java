package com.genflow.engine.logging;

import org.slf4j.MDC;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs of a run carry the workflow, run and step identifiers.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forStep("product-planning", runId, "prd")) {
 *     log.info("Generating step"); // Automatically includes workflow, runId, stepId
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [main] INFO  c.g.e.e.StepExecutor - Step prd completed
 *   workflow=product-planning runId=3f2a91c0 stepId=prd attempt=2 traceId=9b1c22de
 */
public final class LoggingContext implements AutoCloseable {

    public static final String WORKFLOW = "workflow";
    public static final String RUN_ID = "runId";
    public static final String STEP_ID = "stepId";
    public static final String ATTEMPT = "attempt";
    public static final String TRACE_ID = "traceId";

    private final boolean stepScoped;

    private LoggingContext(boolean stepScoped) {
        this.stepScoped = stepScoped;
    }

    /**
     * Create a logging context for a whole workflow run.
     * Closing it removes every genflow key.
     */
    public static LoggingContext forRun(String workflow, String runId) {
        LoggingContext ctx = new LoggingContext(false);
        if (workflow != null) {
            MDC.put(WORKFLOW, workflow);
        }
        if (runId != null) {
            MDC.put(RUN_ID, runId);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for one step.
     * Closing it removes only the step keys, so it nests inside a run context.
     */
    public static LoggingContext forStep(String workflow, String runId, String stepId) {
        LoggingContext ctx = new LoggingContext(true);
        if (workflow != null) {
            MDC.put(WORKFLOW, workflow);
        }
        if (runId != null) {
            MDC.put(RUN_ID, runId);
        }
        if (stepId != null) {
            MDC.put(STEP_ID, stepId);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Record the current attempt number in the context.
     */
    public static void setAttempt(int attempt) {
        MDC.put(ATTEMPT, String.valueOf(attempt));
    }

    public static String getStepId() {
        return MDC.get(STEP_ID);
    }

    public static String getRunId() {
        return MDC.get(RUN_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    /**
     * New short run identifier.
     */
    public static String newRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(STEP_ID);
        MDC.remove(ATTEMPT);
        if (!stepScoped) {
            MDC.remove(WORKFLOW);
            MDC.remove(RUN_ID);
            MDC.remove(TRACE_ID);
        }
    }
}
