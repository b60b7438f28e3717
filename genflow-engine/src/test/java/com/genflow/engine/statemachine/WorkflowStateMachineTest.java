package com.genflow.engine.statemachine;

import com.genflow.core.exception.InvalidTransitionException;
import com.genflow.core.model.AutomationMode;
import com.genflow.core.model.StepState;
import com.genflow.core.model.StepStatus;
import com.genflow.core.model.WorkflowDefinition;
import com.genflow.core.model.WorkflowEvent;
import com.genflow.core.model.WorkflowEventType;
import com.genflow.core.model.WorkflowProgress;
import com.genflow.core.test.TimeController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class WorkflowStateMachineTest {

    private TimeController time;
    private WorkflowStateMachine machine;
    private List<WorkflowEvent> events;

    @BeforeEach
    void setUp() {
        time = TimeController.frozenAt(Instant.parse("2024-05-01T09:00:00Z"));
        machine = new WorkflowStateMachine(
            WorkflowDefinition.of("planning", "brief", "prd", "architecture"), AutomationMode.AUTO, time);
        events = new ArrayList<>();
        machine.addListener(events::add);
    }

    private List<WorkflowEventType> eventTypes() {
        return events.stream().map(WorkflowEvent::type).toList();
    }

    @Test
    void startStep_shouldStampStartedAtAndMoveCursor() {
        machine.startStep("prd");

        StepState state = machine.getStepState("prd");
        assertThat(state.status()).isEqualTo(StepStatus.IN_PROGRESS);
        assertThat(state.startedAt()).isEqualTo(time.now());
        assertThat(machine.getCurrentIndex()).isEqualTo(1);
        assertThat(machine.isStarted()).isTrue();
    }

    @Test
    void startStep_shouldEmitWorkflowStartedOnlyOnce() {
        machine.startStep("brief");
        machine.completeStep("brief");
        machine.startStep("prd");

        assertThat(eventTypes()).containsExactly(
            WorkflowEventType.WORKFLOW_STARTED,
            WorkflowEventType.STEP_STARTED,
            WorkflowEventType.STEP_COMPLETED,
            WorkflowEventType.STEP_STARTED);
    }

    @Test
    void startStep_shouldRejectSecondInProgressStep() {
        machine.startStep("brief");

        assertThatThrownBy(() -> machine.startStep("prd"))
            .isInstanceOf(InvalidTransitionException.class)
            .hasMessageContaining("brief is already in progress");
        assertThat(machine.getStepState("prd").status()).isEqualTo(StepStatus.PENDING);
    }

    @Test
    void startStep_shouldRejectNonPendingStep() {
        machine.startStep("brief");
        machine.completeStep("brief");

        assertThatThrownBy(() -> machine.startStep("brief"))
            .isInstanceOf(InvalidTransitionException.class)
            .hasMessageContaining("completed");
    }

    @Test
    void completeStep_shouldRequireInProgress() {
        Throwable thrown = catchThrowable(() -> machine.completeStep("brief"));

        assertThat(thrown).isInstanceOf(InvalidTransitionException.class);
        InvalidTransitionException ex = (InvalidTransitionException) thrown;

        assertThat(ex.getCurrentStatus()).isEqualTo(StepStatus.PENDING);
        assertThat(ex.getStepId()).isEqualTo("brief");
        assertThat(ex.getErrorCode()).isEqualTo(InvalidTransitionException.ERROR_CODE);
    }

    @Test
    void skipStep_shouldWorkFromPendingAndInProgress() {
        machine.skipStep("brief");
        machine.startStep("prd");
        machine.skipStep("prd");

        assertThat(machine.getStepState("brief").status()).isEqualTo(StepStatus.SKIPPED);
        assertThat(machine.getStepState("prd").status()).isEqualTo(StepStatus.SKIPPED);
        assertThat(machine.getInProgressStep()).isEmpty();
    }

    @Test
    void skipStep_shouldRejectTerminalStep() {
        machine.skipStep("brief");

        assertThatThrownBy(() -> machine.skipStep("brief"))
            .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    @DisplayName("WORKFLOW_COMPLETED is emitted once, when the last step finishes")
    void completeStep_shouldEmitWorkflowCompletedOnce() {
        machine.startStep("brief");
        machine.completeStep("brief");
        machine.skipStep("prd");
        assertThat(eventTypes()).doesNotContain(WorkflowEventType.WORKFLOW_COMPLETED);

        machine.startStep("architecture");
        machine.completeStep("architecture");

        assertThat(machine.isComplete()).isTrue();
        assertThat(eventTypes()).filteredOn(t -> t == WorkflowEventType.WORKFLOW_COMPLETED).hasSize(1);
    }

    @Test
    @DisplayName("Rewinding a finished step re-arms the completion event")
    void goToStep_shouldReArmCompletionEvent() {
        for (String id : List.of("brief", "prd", "architecture")) {
            machine.startStep(id);
            machine.completeStep(id);
        }
        machine.goToStep("prd");
        machine.startStep("prd");
        machine.completeStep("prd");

        assertThat(eventTypes()).filteredOn(t -> t == WorkflowEventType.WORKFLOW_COMPLETED).hasSize(2);
    }

    @Test
    void goToStep_shouldResetFinishedStepAndClearTimestamps() {
        machine.startStep("brief");
        machine.completeStep("brief");
        machine.startStep("prd");
        machine.completeStep("prd");

        machine.goToStep("brief");

        StepState state = machine.getStepState("brief");
        assertThat(state.status()).isEqualTo(StepStatus.PENDING);
        assertThat(state.startedAt()).isNull();
        assertThat(state.completedAt()).isNull();
        assertThat(machine.getCurrentIndex()).isZero();
        assertThat(events.get(events.size() - 1).type()).isEqualTo(WorkflowEventType.STEP_RESET);
        assertThat(events.get(events.size() - 1).stepId()).isEqualTo("brief");
    }

    @Test
    void goToStep_shouldResetSkippedStep() {
        machine.skipStep("architecture");

        machine.goToStep("architecture");

        assertThat(machine.getStepState("architecture").status()).isEqualTo(StepStatus.PENDING);
    }

    @Test
    void goToStep_onPendingStep_shouldOnlyMoveCursor() {
        machine.goToStep("architecture");

        assertThat(machine.getCurrentIndex()).isEqualTo(2);
        assertThat(events).isEmpty();
    }

    @Test
    void goToStep_onInProgressStep_shouldFail() {
        machine.startStep("brief");

        assertThatThrownBy(() -> machine.goToStep("brief"))
            .isInstanceOf(InvalidTransitionException.class)
            .hasMessageContaining("in-progress");
        assertThat(machine.getStepState("brief").status()).isEqualTo(StepStatus.IN_PROGRESS);
    }

    @Test
    void setGlobalAutomationMode_shouldOnlyAffectPendingSteps() {
        machine.startStep("brief");
        machine.completeStep("brief");
        machine.startStep("prd");

        machine.setGlobalAutomationMode(AutomationMode.SKIP);

        assertThat(machine.getAutomationMode("brief")).isEqualTo(AutomationMode.AUTO);
        assertThat(machine.getAutomationMode("prd")).isEqualTo(AutomationMode.AUTO);
        assertThat(machine.getAutomationMode("architecture")).isEqualTo(AutomationMode.SKIP);

        WorkflowEvent modeChanged = events.get(events.size() - 1);
        assertThat(modeChanged.type()).isEqualTo(WorkflowEventType.MODE_CHANGED);
        assertThat(modeChanged.stepId()).isNull();
        assertThat(modeChanged.previousValue()).isEqualTo("auto");
        assertThat(modeChanged.newValue()).isEqualTo("skip");
    }

    @Test
    void setStepAutomationMode_shouldEmitOnlyOnChange() {
        machine.setStepAutomationMode("prd", AutomationMode.MANUAL);
        machine.setStepAutomationMode("prd", AutomationMode.MANUAL);

        assertThat(events).hasSize(1);
        assertThat(events.get(0).stepId()).isEqualTo("prd");
        assertThat(machine.getAutomationMode("prd")).isEqualTo(AutomationMode.MANUAL);
    }

    @Test
    @DisplayName("A failing listener does not abort the transition or starve other listeners")
    void addListener_shouldIsolateFailingListener() {
        List<WorkflowEvent> typed = new ArrayList<>();
        machine.addListener(WorkflowEventType.STEP_STARTED, event -> {
            throw new IllegalStateException("listener bug");
        });
        machine.addListener(WorkflowEventType.STEP_STARTED, typed::add);

        machine.startStep("brief");

        assertThat(machine.getStepState("brief").status()).isEqualTo(StepStatus.IN_PROGRESS);
        assertThat(typed).hasSize(1);
        assertThat(eventTypes()).contains(WorkflowEventType.STEP_STARTED);
    }

    @Test
    void getProgress_shouldCountByStatus() {
        machine.startStep("brief");
        machine.completeStep("brief");
        machine.skipStep("architecture");
        machine.startStep("prd");

        WorkflowProgress progress = machine.getProgress();

        assertThat(progress.total()).isEqualTo(3);
        assertThat(progress.completed()).isEqualTo(1);
        assertThat(progress.skipped()).isEqualTo(1);
        assertThat(progress.inProgress()).isEqualTo(1);
        assertThat(progress.pending()).isZero();
        assertThat(progress.current()).isEqualTo("prd");
    }

    @Test
    @DisplayName("Random transition sequences never leave two steps in progress")
    void transitions_shouldNeverLeaveTwoStepsInProgress() {
        Random random = new Random(42);
        List<String> ids = machine.getDefinition().stepIds();
        for (int i = 0; i < 2000; i++) {
            String id = ids.get(random.nextInt(ids.size()));
            try {
                switch (random.nextInt(4)) {
                    case 0 -> machine.startStep(id);
                    case 1 -> machine.completeStep(id);
                    case 2 -> machine.skipStep(id);
                    default -> machine.goToStep(id);
                }
            } catch (InvalidTransitionException expected) {
                // rejected transitions leave the state untouched
            }
            long inProgress = machine.getStepStates().stream()
                .filter(s -> s.status() == StepStatus.IN_PROGRESS)
                .count();
            assertThat(inProgress).isLessThanOrEqualTo(1);
        }
    }
}
