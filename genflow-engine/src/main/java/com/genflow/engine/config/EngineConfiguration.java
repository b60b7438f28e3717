package com.genflow.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genflow.core.model.AutomationMode;
import com.genflow.core.model.DelayStrategy;
import com.genflow.core.model.RetryConfig;
import com.genflow.engine.metrics.WorkflowMetrics;
import com.genflow.engine.retry.ErrorClassifier;
import com.genflow.engine.retry.RetryPolicy;
import com.genflow.engine.retry.Sleeper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Spring wiring for the engine.
 *
 * Configures:
 * - Engine properties from genflow.properties (every key has a default)
 * - Jackson with ISO-8601 dates
 * - Micrometer registry and workflow metrics
 * - Retry policy and the per-project workflow engine factory
 */
@Configuration
@PropertySource(value = "classpath:genflow.properties", ignoreResourceNotFound = true)
public class EngineConfiguration {

    @Bean
    public EngineProperties engineProperties(
            @Value("${genflow.state-dir:.genflow}") String stateDir,
            @Value("${genflow.retry.max-retries:3}") int maxRetries,
            @Value("${genflow.retry.base-delay-ms:10000}") long baseDelayMs,
            @Value("${genflow.retry.max-delay-ms:60000}") long maxDelayMs,
            @Value("${genflow.retry.strategy:EXPONENTIAL}") String strategy,
            @Value("${genflow.retry.delay-sequence-ms:10000,30000,60000}") String delaySequence,
            @Value("${genflow.cache.default-ttl-seconds:3600}") long cacheTtlSeconds,
            @Value("${genflow.cache.max-memory-entries:1000}") int cacheMaxEntries,
            @Value("${genflow.automation-mode:AUTO}") String automationMode) {
        RetryConfig retry = RetryConfig.builder()
            .maxRetries(maxRetries)
            .baseDelay(Duration.ofMillis(baseDelayMs))
            .maxDelay(Duration.ofMillis(maxDelayMs))
            .strategy(DelayStrategy.valueOf(strategy.trim().toUpperCase()))
            .delaySequence(parseDelays(delaySequence))
            .build();
        return new EngineProperties(
            stateDir,
            retry,
            cacheTtlSeconds > 0 ? Duration.ofSeconds(cacheTtlSeconds) : null,
            cacheMaxEntries,
            AutomationMode.fromWireValue(automationMode));
    }

    @Bean
    public ObjectMapper objectMapper() {
        return WorkflowEngine.defaultObjectMapper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public WorkflowMetrics workflowMetrics(MeterRegistry meterRegistry) {
        WorkflowMetrics metrics = new WorkflowMetrics();
        metrics.bindTo(meterRegistry);
        return metrics;
    }

    @Bean
    public RetryPolicy retryPolicy(EngineProperties properties) {
        return new RetryPolicy(properties.retry(), Sleeper.threadSleep(), new ErrorClassifier());
    }

    @Bean
    public WorkflowEngine workflowEngine(
            EngineProperties properties,
            ObjectMapper objectMapper,
            Clock clock,
            WorkflowMetrics workflowMetrics,
            RetryPolicy retryPolicy) {
        return new WorkflowEngine(properties, objectMapper, clock, workflowMetrics, retryPolicy);
    }

    /**
     * Comma-separated milliseconds; blank means no explicit sequence.
     */
    static List<Duration> parseDelays(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(s -> Duration.ofMillis(Long.parseLong(s)))
            .toList();
    }
}
