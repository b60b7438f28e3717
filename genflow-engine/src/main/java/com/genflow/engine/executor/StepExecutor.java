package com.genflow.engine.executor;

import com.genflow.core.exception.StepExecutionException;
import com.genflow.core.generation.GenerationException;
import com.genflow.core.generation.StepContext;
import com.genflow.core.generation.StepGenerator;
import com.genflow.core.model.CheckpointRecord;
import com.genflow.core.model.RetryConfig;
import com.genflow.core.model.RetryEventType;
import com.genflow.core.model.RetryOutcome;
import com.genflow.core.model.StepOutput;
import com.genflow.core.repository.CheckpointRepository;
import com.genflow.engine.logging.LoggingContext;
import com.genflow.engine.metrics.WorkflowMetrics;
import com.genflow.engine.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Executes a single step: checkpoint replay, generation under the retry policy,
 * and checkpoint persistence.
 *
 * <p>Retries happen inside the {@link RetryPolicy} only. A failed outcome is
 * raised once as a {@link StepExecutionException} and no checkpoint is written.
 */
public class StepExecutor {
    
    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);
    
    private final CheckpointRepository checkpointRepository;
    private final RetryPolicy retryPolicy;
    private final RetryConfig retryConfig;
    private final Clock clock;
    private final WorkflowMetrics metrics;
    
    public StepExecutor(
            CheckpointRepository checkpointRepository,
            RetryPolicy retryPolicy,
            RetryConfig retryConfig,
            Clock clock,
            WorkflowMetrics metrics) {
        this.checkpointRepository = checkpointRepository;
        this.retryPolicy = retryPolicy;
        this.retryConfig = retryConfig;
        this.clock = clock;
        this.metrics = metrics;
    }
    
    /**
     * Execute a step.
     * 
     * @param context Step context; its attempt number is replaced per attempt
     * @param generator Generator for the step
     * @param resuming When true, a completed checkpoint is returned without generating
     * @return The step result
     * @throws StepExecutionException if generation failed after the retry policy gave up
     */
    public StepExecutionResult executeStep(StepContext context, StepGenerator generator, boolean resuming) {
        String stepId = context.getStepId();
        
        if (resuming) {
            Optional<CheckpointRecord> checkpoint = loadCheckpoint(stepId);
            if (checkpoint.isPresent() && checkpoint.get().isResumable()) {
                log.info("Step {} restored from checkpoint saved at {}", stepId, checkpoint.get().savedAt());
                metrics.stepReplayed(context.getWorkflowName(), stepId);
                return StepExecutionResult.replayed(stepId, checkpoint.get().output());
            }
        }
        
        Instant startedAt = clock.instant();
        log.info("Executing step {}", stepId);
        
        RetryOutcome<StepOutput> outcome = retryPolicy.run(attempt -> {
            LoggingContext.setAttempt(attempt);
            StepOutput output = generator.generate(context.forAttempt(attempt));
            if (output == null) {
                throw GenerationException.invalidResponse("Generator returned no output for step " + stepId);
            }
            return output;
        }, retryConfig, event -> {
            if (event.type() == RetryEventType.RETRY) {
                metrics.retryAttempted(event.attempt() + 1);
            } else if (event.type() == RetryEventType.EXHAUSTED) {
                metrics.retryExhausted();
            }
        });
        
        if (!outcome.success()) {
            String errorType = retryPolicy.getClassifier().errorType(outcome.error());
            metrics.stepFailed(context.getWorkflowName(), stepId, errorType);
            log.warn("Step {} failed after {} attempt(s) [{}]", stepId, outcome.attempts(), errorType);
            throw new StepExecutionException(stepId, outcome.attempts(), outcome.error());
        }
        
        Instant savedAt = clock.instant();
        checkpointRepository.save(CheckpointRecord.completed(
            stepId, context.getAutomationMode(), startedAt, savedAt, outcome.result()));
        metrics.stepCompleted(context.getWorkflowName(), stepId, outcome.totalElapsed());
        log.info("Step {} completed in {} attempt(s)", stepId, outcome.attempts());
        
        return new StepExecutionResult(stepId, outcome.result(), outcome.attempts(), false, outcome.totalElapsed());
    }
    
    /**
     * Persist a user-authored output as the step's checkpoint.
     */
    public StepExecutionResult saveManualOutput(StepContext context, StepOutput output, Instant startedAt) {
        Instant savedAt = clock.instant();
        checkpointRepository.save(CheckpointRecord.completed(
            context.getStepId(), context.getAutomationMode(), startedAt, savedAt, output));
        log.info("Step {} completed from manual output", context.getStepId());
        return new StepExecutionResult(context.getStepId(), output, 0, false,
            Duration.between(startedAt == null ? savedAt : startedAt, savedAt));
    }
    
    /**
     * Record that a step was skipped so a later resume keeps it skipped.
     */
    public void markSkipped(String workflowName, String stepId) {
        checkpointRepository.save(CheckpointRecord.skipped(stepId, clock.instant()));
        metrics.stepSkipped(workflowName, stepId);
        log.info("Step {} skipped", stepId);
    }
    
    public Optional<CheckpointRecord> loadCheckpoint(String stepId) {
        return checkpointRepository.findByStepId(stepId);
    }
    
    /**
     * True when a completed or skipped checkpoint exists for the step.
     */
    public boolean isStepFinished(String stepId) {
        return loadCheckpoint(stepId).map(r -> r.status().isTerminal()).orElse(false);
    }
}
