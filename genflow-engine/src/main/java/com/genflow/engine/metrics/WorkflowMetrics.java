package com.genflow.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for workflow runs, retries and the generation cache.
 * Until {@link #bindTo(MeterRegistry)} is called, meters go to the global registry.
 *
 * Metrics exposed:
 * - Step outcomes (completed, failed, skipped, replayed from checkpoint)
 * - Step duration by step id
 * - Retry attempts and exhaustion
 * - Cache hits and misses
 * - Active workflow gauge
 */
public class WorkflowMetrics implements MeterBinder {

    // Metric names
    public static final String STEPS_COMPLETED = "genflow.steps.completed";
    public static final String STEPS_FAILED = "genflow.steps.failed";
    public static final String STEPS_SKIPPED = "genflow.steps.skipped";
    public static final String STEPS_REPLAYED = "genflow.steps.replayed";
    public static final String STEP_DURATION = "genflow.step.duration";

    public static final String RETRY_ATTEMPTS = "genflow.retry.attempts";
    public static final String RETRY_EXHAUSTED = "genflow.retry.exhausted";

    public static final String CACHE_HITS = "genflow.cache.hits";
    public static final String CACHE_MISSES = "genflow.cache.misses";

    public static final String WORKFLOWS_ACTIVE = "genflow.workflows.active";

    private volatile MeterRegistry registry = Metrics.globalRegistry;
    private final AtomicInteger activeWorkflows = new AtomicInteger(0);

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(WORKFLOWS_ACTIVE, activeWorkflows, AtomicInteger::get)
            .description("Number of workflows currently running")
            .register(registry);
    }

    // ========== Workflow Metrics ==========

    public void workflowStarted(String workflowName) {
        activeWorkflows.incrementAndGet();
    }

    public void workflowFinished(String workflowName) {
        activeWorkflows.updateAndGet(v -> Math.max(0, v - 1));
    }

    public int activeWorkflows() {
        return activeWorkflows.get();
    }

    // ========== Step Metrics ==========

    public void stepCompleted(String workflowName, String stepId, Duration duration) {
        Counter.builder(STEPS_COMPLETED)
            .tag("workflow", workflowName)
            .tag("step", stepId)
            .description("Total steps completed")
            .register(registry)
            .increment();

        Timer.builder(STEP_DURATION)
            .tag("workflow", workflowName)
            .tag("step", stepId)
            .description("Step generation duration, retries included")
            .register(registry)
            .record(duration);
    }

    public void stepFailed(String workflowName, String stepId, String errorType) {
        Counter.builder(STEPS_FAILED)
            .tag("workflow", workflowName)
            .tag("step", stepId)
            .tag("error_type", errorType)
            .description("Total steps failed after retries")
            .register(registry)
            .increment();
    }

    public void stepSkipped(String workflowName, String stepId) {
        Counter.builder(STEPS_SKIPPED)
            .tag("workflow", workflowName)
            .tag("step", stepId)
            .description("Total steps skipped")
            .register(registry)
            .increment();
    }

    public void stepReplayed(String workflowName, String stepId) {
        Counter.builder(STEPS_REPLAYED)
            .tag("workflow", workflowName)
            .tag("step", stepId)
            .description("Total steps restored from a checkpoint")
            .register(registry)
            .increment();
    }

    // ========== Retry Metrics ==========

    public void retryAttempted(int attemptNumber) {
        Counter.builder(RETRY_ATTEMPTS)
            .tag("attempt", String.valueOf(attemptNumber))
            .description("Total retry attempts")
            .register(registry)
            .increment();
    }

    public void retryExhausted() {
        Counter.builder(RETRY_EXHAUSTED)
            .description("Operations that failed on every attempt")
            .register(registry)
            .increment();
    }

    // ========== Cache Metrics ==========

    public void cacheHit(String tier) {
        Counter.builder(CACHE_HITS)
            .tag("tier", tier)
            .description("Cache lookups served")
            .register(registry)
            .increment();
    }

    public void cacheMiss() {
        Counter.builder(CACHE_MISSES)
            .description("Cache lookups that found nothing")
            .register(registry)
            .increment();
    }
}
