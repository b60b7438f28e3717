package com.genflow.engine.statemachine;

import com.genflow.core.exception.InvalidTransitionException;
import com.genflow.core.model.AutomationMode;
import com.genflow.core.model.StepState;
import com.genflow.core.model.StepStatus;
import com.genflow.core.model.WorkflowDefinition;
import com.genflow.core.model.WorkflowEvent;
import com.genflow.core.model.WorkflowEventType;
import com.genflow.core.model.WorkflowProgress;
import com.genflow.core.model.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns the lifecycle state of every step of one workflow.
 *
 * Transitions:
 * - PENDING -> IN_PROGRESS (start)
 * - IN_PROGRESS -> COMPLETED (complete)
 * - PENDING | IN_PROGRESS -> SKIPPED (skip)
 * - COMPLETED | SKIPPED -> PENDING (goTo, clears timestamps)
 *
 * Invariants:
 * - at most one step is IN_PROGRESS
 * - WORKFLOW_STARTED is emitted on the first start only
 * - WORKFLOW_COMPLETED is emitted once per completion; a rewind re-arms it
 *
 * All mutating methods are synchronized. Listeners run on the calling thread.
 */
public class WorkflowStateMachine {
    
    private static final Logger log = LoggerFactory.getLogger(WorkflowStateMachine.class);
    
    private final WorkflowDefinition definition;
    private final Clock clock;
    private final Map<String, StepState> steps = new LinkedHashMap<>();
    private final List<WorkflowEventListener> allListeners = new CopyOnWriteArrayList<>();
    private final Map<WorkflowEventType, List<WorkflowEventListener>> typedListeners =
        new EnumMap<>(WorkflowEventType.class);
    
    private AutomationMode globalMode;
    private int currentIndex;
    private Instant startedAt;
    private Instant completedAt;
    
    public WorkflowStateMachine(WorkflowDefinition definition) {
        this(definition, AutomationMode.AUTO, Clock.systemUTC());
    }
    
    public WorkflowStateMachine(WorkflowDefinition definition, AutomationMode globalMode, Clock clock) {
        this.definition = definition;
        this.globalMode = globalMode;
        this.clock = clock;
        for (WorkflowEventType type : WorkflowEventType.values()) {
            typedListeners.put(type, new CopyOnWriteArrayList<>());
        }
        reset();
    }
    
    // ========== Queries ==========
    
    public WorkflowDefinition getDefinition() {
        return definition;
    }
    
    public synchronized StepState getStepState(String stepId) {
        definition.getStep(stepId);
        return steps.get(stepId);
    }
    
    /**
     * Snapshot of all step states in step order.
     */
    public synchronized List<StepState> getStepStates() {
        return List.copyOf(steps.values());
    }
    
    public synchronized int getCurrentIndex() {
        return currentIndex;
    }
    
    public synchronized WorkflowStep getCurrentStep() {
        return definition.stepAt(currentIndex);
    }
    
    public synchronized Optional<StepState> getInProgressStep() {
        return steps.values().stream()
            .filter(s -> s.status() == StepStatus.IN_PROGRESS)
            .findFirst();
    }
    
    public synchronized boolean isStarted() {
        return startedAt != null;
    }
    
    /**
     * True when every step is COMPLETED or SKIPPED.
     */
    public synchronized boolean isComplete() {
        return steps.values().stream().allMatch(StepState::isTerminal);
    }
    
    public synchronized AutomationMode getGlobalMode() {
        return globalMode;
    }
    
    public synchronized AutomationMode getAutomationMode(String stepId) {
        return getStepState(stepId).automationMode();
    }
    
    /**
     * Step counts by status, derived from the current states.
     */
    public synchronized WorkflowProgress getProgress() {
        int pending = 0;
        int inProgress = 0;
        int completed = 0;
        int skipped = 0;
        for (StepState state : steps.values()) {
            switch (state.status()) {
                case PENDING -> pending++;
                case IN_PROGRESS -> inProgress++;
                case COMPLETED -> completed++;
                case SKIPPED -> skipped++;
            }
        }
        return new WorkflowProgress(steps.size(), pending, inProgress, completed, skipped,
            definition.stepAt(currentIndex).stepId());
    }
    
    // ========== Transitions ==========
    
    /**
     * PENDING -> IN_PROGRESS. Stamps startedAt and moves the cursor to the step.
     *
     * @throws InvalidTransitionException if the step is not pending or another step is in progress
     */
    public synchronized void startStep(String stepId) {
        StepState state = getStepState(stepId);
        if (state.status() != StepStatus.PENDING) {
            throw new InvalidTransitionException(stepId, state.status(), "start");
        }
        Optional<StepState> running = getInProgressStep();
        if (running.isPresent()) {
            throw new InvalidTransitionException(String.format(
                "Cannot start step %s: step %s is already in progress",
                stepId, running.get().stepId()));
        }
        
        Instant now = clock.instant();
        if (startedAt == null) {
            startedAt = now;
            emit(WorkflowEvent.of(WorkflowEventType.WORKFLOW_STARTED, now));
        }
        steps.put(stepId, state.withStarted(now));
        currentIndex = definition.indexOf(stepId);
        log.debug("Step {} started", stepId);
        emit(WorkflowEvent.forStep(WorkflowEventType.STEP_STARTED, stepId, now));
    }
    
    /**
     * IN_PROGRESS -> COMPLETED.
     *
     * @throws InvalidTransitionException if the step is not in progress
     */
    public synchronized void completeStep(String stepId) {
        StepState state = getStepState(stepId);
        if (state.status() != StepStatus.IN_PROGRESS) {
            throw new InvalidTransitionException(stepId, state.status(), "complete");
        }
        Instant now = clock.instant();
        steps.put(stepId, state.withCompleted(now));
        log.debug("Step {} completed", stepId);
        emit(WorkflowEvent.forStep(WorkflowEventType.STEP_COMPLETED, stepId, now));
        checkWorkflowCompleted(now);
    }
    
    /**
     * PENDING | IN_PROGRESS -> SKIPPED.
     *
     * @throws InvalidTransitionException if the step is already terminal
     */
    public synchronized void skipStep(String stepId) {
        StepState state = getStepState(stepId);
        if (state.isTerminal()) {
            throw new InvalidTransitionException(stepId, state.status(), "skip");
        }
        Instant now = clock.instant();
        steps.put(stepId, state.withSkipped(now));
        log.debug("Step {} skipped", stepId);
        emit(WorkflowEvent.forStep(WorkflowEventType.STEP_SKIPPED, stepId, now));
        checkWorkflowCompleted(now);
    }
    
    /**
     * Rewind a finished step to PENDING and move the cursor to it.
     * A step that is already pending only moves the cursor.
     *
     * @throws InvalidTransitionException if the step is in progress
     */
    public synchronized void goToStep(String stepId) {
        StepState state = getStepState(stepId);
        int index = definition.indexOf(stepId);
        if (state.status() == StepStatus.PENDING) {
            currentIndex = index;
            return;
        }
        if (state.status() == StepStatus.IN_PROGRESS) {
            throw new InvalidTransitionException(stepId, state.status(), "rewind");
        }
        Instant now = clock.instant();
        steps.put(stepId, state.withReset());
        currentIndex = index;
        completedAt = null;
        log.debug("Step {} reset to pending", stepId);
        emit(WorkflowEvent.forStep(WorkflowEventType.STEP_RESET, stepId, now));
    }
    
    /**
     * Put every step back to PENDING with the global mode. Emits nothing.
     */
    public synchronized void reset() {
        steps.clear();
        for (WorkflowStep step : definition.steps()) {
            steps.put(step.stepId(), StepState.pending(step.stepId(), globalMode));
        }
        currentIndex = 0;
        startedAt = null;
        completedAt = null;
    }
    
    // ========== Automation Mode ==========
    
    public synchronized void setStepAutomationMode(String stepId, AutomationMode mode) {
        StepState state = getStepState(stepId);
        AutomationMode previous = state.automationMode();
        if (previous == mode) {
            return;
        }
        steps.put(stepId, state.withAutomationMode(mode));
        emit(WorkflowEvent.modeChanged(stepId, previous, mode, clock.instant()));
    }
    
    /**
     * Change the global mode. Only PENDING steps pick it up.
     */
    public synchronized void setGlobalAutomationMode(AutomationMode mode) {
        AutomationMode previous = globalMode;
        if (previous == mode) {
            return;
        }
        globalMode = mode;
        steps.replaceAll((id, state) -> state.status() == StepStatus.PENDING
            ? state.withAutomationMode(mode)
            : state);
        emit(WorkflowEvent.modeChanged(null, previous, mode, clock.instant()));
    }
    
    // ========== Listeners ==========
    
    public void addListener(WorkflowEventListener listener) {
        allListeners.add(listener);
    }
    
    public void addListener(WorkflowEventType type, WorkflowEventListener listener) {
        typedListeners.get(type).add(listener);
    }
    
    public void removeListener(WorkflowEventListener listener) {
        allListeners.remove(listener);
        typedListeners.values().forEach(list -> list.remove(listener));
    }
    
    private void checkWorkflowCompleted(Instant now) {
        if (completedAt == null && isComplete()) {
            completedAt = now;
            log.info("Workflow {} completed", definition.name());
            emit(WorkflowEvent.of(WorkflowEventType.WORKFLOW_COMPLETED, now));
        }
    }
    
    private void emit(WorkflowEvent event) {
        List<WorkflowEventListener> targets = new ArrayList<>(typedListeners.get(event.type()));
        targets.addAll(allListeners);
        for (WorkflowEventListener listener : targets) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} for step {}: {}",
                    event.type(), event.stepId(), e.getMessage(), e);
            }
        }
    }
}
