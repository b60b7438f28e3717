package com.genflow.engine.runner;

import com.genflow.core.exception.InvalidTransitionException;
import com.genflow.core.exception.MissingProjectContextException;
import com.genflow.core.exception.NotFoundException;
import com.genflow.core.exception.StepExecutionException;
import com.genflow.core.exception.WorkflowAlreadyRunningException;
import com.genflow.core.generation.StepContext;
import com.genflow.core.generation.StepGenerator;
import com.genflow.core.generation.StepGeneratorRegistry;
import com.genflow.core.model.AutomationMode;
import com.genflow.core.model.CheckpointRecord;
import com.genflow.core.model.FailureRecord;
import com.genflow.core.model.StepOutput;
import com.genflow.core.model.StepState;
import com.genflow.core.model.StepStatus;
import com.genflow.core.model.WorkflowDefinition;
import com.genflow.core.model.WorkflowProgress;
import com.genflow.core.model.WorkflowStep;
import com.genflow.core.repository.CheckpointRepository;
import com.genflow.engine.executor.StepExecutionResult;
import com.genflow.engine.executor.StepExecutor;
import com.genflow.engine.logging.LoggingContext;
import com.genflow.engine.manual.ManualStepDetector;
import com.genflow.engine.metrics.WorkflowMetrics;
import com.genflow.engine.statemachine.WorkflowStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Drives a workflow's steps in order, one at a time.
 *
 * <p>Each step is either skipped (mode SKIP), taken from a user-authored file
 * (mode MANUAL, when one exists) or generated through the {@link StepExecutor}.
 * The first failing step stops the run; the result names it. Only one run per
 * runner may be active.
 *
 * <p>Resume reloads checkpoints, marks completed and skipped steps in the state
 * machine without generating them, and continues from the first unfinished step.
 */
public class WorkflowRunner {
    
    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);
    
    private final WorkflowDefinition definition;
    private final WorkflowStateMachine stateMachine;
    private final StepExecutor stepExecutor;
    private final StepGeneratorRegistry generators;
    private final CheckpointRepository checkpointRepository;
    private final WorkflowMetrics metrics;
    private final Clock clock;
    private final String stateDir;
    
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    
    public WorkflowRunner(
            WorkflowStateMachine stateMachine,
            StepExecutor stepExecutor,
            StepGeneratorRegistry generators,
            CheckpointRepository checkpointRepository,
            WorkflowMetrics metrics,
            Clock clock,
            String stateDir) {
        this.definition = stateMachine.getDefinition();
        this.stateMachine = stateMachine;
        this.stepExecutor = stepExecutor;
        this.generators = generators;
        this.checkpointRepository = checkpointRepository;
        this.metrics = metrics;
        this.clock = clock;
        this.stateDir = stateDir;
    }
    
    /**
     * Run the workflow from its current state, generating every unfinished step.
     *
     * @throws WorkflowAlreadyRunningException if a run is active
     * @throws MissingProjectContextException if project path or idea is missing
     */
    public WorkflowResult run(WorkflowRunConfig config) {
        return execute(config, false);
    }
    
    /**
     * Restore finished steps from checkpoints, then run the rest.
     *
     * @throws WorkflowAlreadyRunningException if a run is active
     * @throws MissingProjectContextException if project path or idea is missing
     */
    public WorkflowResult resume(WorkflowRunConfig config) {
        return execute(config, true);
    }
    
    /**
     * Ask the active run to stop before its next step.
     * A generation call already in flight is allowed to finish.
     */
    public void cancel() {
        if (running.get()) {
            log.info("Cancellation requested for workflow {}", definition.name());
            cancelRequested.set(true);
        }
    }
    
    public boolean isRunning() {
        return running.get();
    }
    
    public WorkflowProgress getProgress() {
        return stateMachine.getProgress();
    }
    
    public WorkflowStateMachine getStateMachine() {
        return stateMachine;
    }
    
    private WorkflowResult execute(WorkflowRunConfig config, boolean resuming) {
        if (!running.compareAndSet(false, true)) {
            throw new WorkflowAlreadyRunningException(definition.name());
        }
        cancelRequested.set(false);
        try (LoggingContext ctx = LoggingContext.forRun(definition.name(), LoggingContext.newRunId())) {
            validate(config);
            metrics.workflowStarted(definition.name());
            try {
                log.info("{} workflow {} ({} steps) for project {}",
                    resuming ? "Resuming" : "Running", definition.name(), definition.size(), config.projectPath());
                return runSteps(config, resuming);
            } finally {
                metrics.workflowFinished(definition.name());
            }
        } finally {
            running.set(false);
        }
    }
    
    private void validate(WorkflowRunConfig config) {
        if (config.projectPath() == null || config.projectPath().toString().isBlank()) {
            throw new MissingProjectContextException("projectPath");
        }
        if (config.projectIdea() == null || config.projectIdea().isBlank()) {
            throw new MissingProjectContextException("projectIdea");
        }
    }
    
    private WorkflowResult runSteps(WorkflowRunConfig config, boolean resuming) {
        WorkflowCallbacks callbacks = config.callbacks();
        if (config.automationMode() != null) {
            stateMachine.setGlobalAutomationMode(config.automationMode());
        }
        
        Map<String, CheckpointRecord> checkpoints = new HashMap<>();
        for (CheckpointRecord record : checkpointRepository.findAll()) {
            if (definition.findStep(record.stepId()).isPresent()) {
                checkpoints.put(record.stepId(), record);
            }
        }
        if (resuming) {
            restoreFromCheckpoints(checkpoints);
        }
        
        ManualStepDetector manualDetector = ManualStepDetector.forProject(config.projectPath(), stateDir);
        Map<String, StepOutput> outputs = new LinkedHashMap<>();
        Map<String, Integer> attempts = new LinkedHashMap<>();
        
        for (WorkflowStep step : definition.steps()) {
            String stepId = step.stepId();
            StepState state = stateMachine.getStepState(stepId);
            
            if (state.status() == StepStatus.COMPLETED) {
                Optional.ofNullable(checkpoints.get(stepId))
                    .filter(CheckpointRecord::isResumable)
                    .ifPresent(record -> outputs.put(stepId, record.output()));
                continue;
            }
            if (state.status() == StepStatus.SKIPPED) {
                continue;
            }
            if (cancelRequested.get()) {
                log.info("Workflow {} cancelled before step {}", definition.name(), stepId);
                return result(false, null, null, outputs, attempts, true);
            }
            
            StepContext context = new StepContext(definition.name(), step, config.projectPath(),
                config.projectIdea(), state.automationMode(), outputs, 1);
            
            try (LoggingContext stepCtx = LoggingContext.forStep(definition.name(), LoggingContext.getRunId(), stepId)) {
                try {
                    if (state.automationMode() == AutomationMode.SKIP) {
                        stateMachine.skipStep(stepId);
                        stepExecutor.markSkipped(definition.name(), stepId);
                        notify(callbacks, c -> c.onStepSkip(stepId));
                        notify(callbacks, c -> c.onProgress(stateMachine.getProgress()));
                        continue;
                    }
                    if (state.automationMode() == AutomationMode.MANUAL) {
                        Optional<StepOutput> manual = manualDetector.detect(stepId);
                        if (manual.isPresent()) {
                            Instant startedAt = clock.instant();
                            startIfPending(stepId, callbacks);
                            stepExecutor.saveManualOutput(context, manual.get(), startedAt);
                            stateMachine.completeStep(stepId);
                            outputs.put(stepId, manual.get());
                            notify(callbacks, c -> c.onManualStepDetected(stepId, manualDetector.outputFileFor(stepId)));
                            notify(callbacks, c -> c.onStepComplete(stepId, manual.get()));
                            notify(callbacks, c -> c.onProgress(stateMachine.getProgress()));
                            continue;
                        }
                        log.info("No manual output for step {}, generating it", stepId);
                    }
                    
                    StepGenerator generator = generators.resolve(stepId);
                    startIfPending(stepId, callbacks);
                    StepExecutionResult result = stepExecutor.executeStep(context, generator, resuming);
                    if (!result.replayed()) {
                        attempts.put(stepId, result.attempts());
                    }
                    stateMachine.completeStep(stepId);
                    outputs.put(stepId, result.output());
                    notify(callbacks, c -> c.onStepComplete(stepId, result.output()));
                    notify(callbacks, c -> c.onProgress(stateMachine.getProgress()));
                } catch (StepExecutionException e) {
                    attempts.put(stepId, e.getAttempts());
                    return failed(stepId, e.getCause() != null ? e.getCause() : e, outputs, attempts, callbacks);
                } catch (InvalidTransitionException | NotFoundException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.warn("Step {} failed outside generation", stepId, e);
                    metrics.stepFailed(definition.name(), stepId, FailureRecord.errorCodeOf(e));
                    return failed(stepId, e, outputs, attempts, callbacks);
                }
            }
        }
        
        boolean complete = stateMachine.isComplete();
        log.info("Workflow {} finished: {}", definition.name(), stateMachine.getProgress());
        if (complete) {
            clearFailureRecord();
        }
        return result(complete, null, null, outputs, attempts, false);
    }
    
    private WorkflowResult failed(String stepId, Throwable error, Map<String, StepOutput> outputs,
                                  Map<String, Integer> attempts, WorkflowCallbacks callbacks) {
        log.warn("Workflow {} stopped at step {}: {}", definition.name(), stepId, error.getMessage());
        notify(callbacks, c -> c.onStepFailed(stepId, error));
        saveFailureRecord(stepId, error, attempts.getOrDefault(stepId, 0));
        return result(false, stepId, error, outputs, attempts, false);
    }
    
    private void saveFailureRecord(String stepId, Throwable error, int stepAttempts) {
        Map<String, StepStatus> statuses = new LinkedHashMap<>();
        for (StepState state : stateMachine.getStepStates()) {
            statuses.put(state.stepId(), state.status());
        }
        try {
            checkpointRepository.saveFailure(FailureRecord.of(definition.name(), stepId, error, stepAttempts,
                clock.instant(), statuses));
        } catch (RuntimeException e) {
            log.warn("Cannot save failure record for step {}: {}", stepId, e.getMessage());
        }
    }
    
    private void clearFailureRecord() {
        try {
            if (checkpointRepository.clearFailure()) {
                log.debug("Cleared failure record of workflow {}", definition.name());
            }
        } catch (RuntimeException e) {
            log.warn("Cannot clear failure record of workflow {}: {}", definition.name(), e.getMessage());
        }
    }
    
    /**
     * Mark checkpointed steps as finished without generating them.
     * A step is restored only while no other step is in progress; any step left
     * pending is replayed from its checkpoint by the executor when the loop reaches it.
     */
    private void restoreFromCheckpoints(Map<String, CheckpointRecord> checkpoints) {
        int restored = 0;
        for (WorkflowStep step : definition.steps()) {
            CheckpointRecord record = checkpoints.get(step.stepId());
            if (record == null) {
                continue;
            }
            StepState state = stateMachine.getStepState(step.stepId());
            if (record.isResumable()) {
                if (state.status() == StepStatus.PENDING && stateMachine.getInProgressStep().isEmpty()) {
                    stateMachine.startStep(step.stepId());
                    stateMachine.completeStep(step.stepId());
                    metrics.stepReplayed(definition.name(), step.stepId());
                    restored++;
                } else if (state.status() == StepStatus.IN_PROGRESS) {
                    stateMachine.completeStep(step.stepId());
                    metrics.stepReplayed(definition.name(), step.stepId());
                    restored++;
                }
            } else if (record.isSkipped() && !state.isTerminal()) {
                stateMachine.skipStep(step.stepId());
                restored++;
            }
        }
        log.info("Restored {} step(s) from checkpoints", restored);
    }
    
    private void startIfPending(String stepId, WorkflowCallbacks callbacks) {
        if (stateMachine.getStepState(stepId).status() == StepStatus.PENDING) {
            stateMachine.startStep(stepId);
        }
        notify(callbacks, c -> c.onStepStart(stepId));
    }
    
    private WorkflowResult result(boolean success, String failedStep, Throwable error,
                                  Map<String, StepOutput> outputs, Map<String, Integer> attempts,
                                  boolean cancelled) {
        WorkflowProgress progress = stateMachine.getProgress();
        return new WorkflowResult(success && error == null && !cancelled, progress.completed(), progress.skipped(),
            failedStep, error, outputs, attempts, cancelled);
    }
    
    private void notify(WorkflowCallbacks callbacks, Consumer<WorkflowCallbacks> call) {
        try {
            call.accept(callbacks);
        } catch (RuntimeException e) {
            log.warn("Workflow callback failed: {}", e.getMessage(), e);
        }
    }
}
