package com.genflow.engine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.genflow.core.generation.StepGeneratorRegistry;
import com.genflow.core.model.WorkflowDefinition;
import com.genflow.core.repository.CheckpointRepository;
import com.genflow.engine.cache.GenerationCache;
import com.genflow.engine.executor.StepExecutor;
import com.genflow.engine.metrics.WorkflowMetrics;
import com.genflow.engine.persistence.FileCheckpointRepository;
import com.genflow.engine.retry.RetryPolicy;
import com.genflow.engine.runner.ResumeService;
import com.genflow.engine.runner.WorkflowRunner;
import com.genflow.engine.statemachine.WorkflowStateMachine;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Builds per-project components from shared engine settings.
 * Every runner gets its own state machine, checkpoint store and executor.
 */
public class WorkflowEngine {

    private final EngineProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final WorkflowMetrics metrics;
    private final RetryPolicy retryPolicy;

    public WorkflowEngine(
            EngineProperties properties,
            ObjectMapper objectMapper,
            Clock clock,
            WorkflowMetrics metrics,
            RetryPolicy retryPolicy) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.metrics = metrics;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Engine with default settings and real sleeping between retries.
     */
    public static WorkflowEngine withDefaults() {
        EngineProperties properties = EngineProperties.defaults();
        return new WorkflowEngine(properties, defaultObjectMapper(), Clock.systemUTC(),
            new WorkflowMetrics(), new RetryPolicy(properties.retry()));
    }

    /**
     * Jackson mapper for checkpoint and cache files: ISO-8601 dates, unknown fields ignored.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public CheckpointRepository checkpointRepository(Path projectPath) {
        return new FileCheckpointRepository(properties.checkpointsDirectory(projectPath), objectMapper);
    }

    /**
     * Runner persisting checkpoints under the project's state directory.
     */
    public WorkflowRunner newRunner(WorkflowDefinition definition, StepGeneratorRegistry generators, Path projectPath) {
        return newRunner(definition, generators, checkpointRepository(projectPath));
    }

    public WorkflowRunner newRunner(WorkflowDefinition definition, StepGeneratorRegistry generators,
                                    CheckpointRepository checkpoints) {
        WorkflowStateMachine stateMachine = new WorkflowStateMachine(definition, properties.automationMode(), clock);
        StepExecutor executor = new StepExecutor(checkpoints, retryPolicy, properties.retry(), clock, metrics);
        return new WorkflowRunner(stateMachine, executor, generators, checkpoints, metrics, clock,
            properties.stateDir());
    }

    public ResumeService resumeService(WorkflowDefinition definition, Path projectPath) {
        return new ResumeService(definition, checkpointRepository(projectPath));
    }

    public GenerationCache newCache(Path projectPath) {
        return new GenerationCache(properties.cacheDirectory(projectPath), properties.cacheDefaultTtl(),
            properties.cacheMaxMemoryEntries(), objectMapper, clock, metrics);
    }

    public EngineProperties getProperties() {
        return properties;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public WorkflowMetrics getMetrics() {
        return metrics;
    }
}
