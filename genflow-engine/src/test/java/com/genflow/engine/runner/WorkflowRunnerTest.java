package com.genflow.engine.runner;

import com.genflow.core.exception.CheckpointException;
import com.genflow.core.exception.MissingProjectContextException;
import com.genflow.core.exception.WorkflowAlreadyRunningException;
import com.genflow.core.generation.GenerationException;
import com.genflow.core.generation.StepGenerator;
import com.genflow.core.generation.StepGeneratorRegistry;
import com.genflow.core.model.AutomationMode;
import com.genflow.core.model.FailureRecord;
import com.genflow.core.model.RetryConfig;
import com.genflow.core.model.StepOutput;
import com.genflow.core.model.StepStatus;
import com.genflow.core.model.WorkflowDefinition;
import com.genflow.core.repository.CheckpointRepository;
import com.genflow.core.test.FailureInjector;
import com.genflow.core.test.TimeController;
import com.genflow.engine.config.WorkflowEngine;
import com.genflow.engine.executor.StepExecutor;
import com.genflow.engine.metrics.WorkflowMetrics;
import com.genflow.engine.persistence.FileCheckpointRepository;
import com.genflow.engine.retry.ErrorClassifier;
import com.genflow.engine.retry.RetryPolicy;
import com.genflow.engine.retry.Sleeper;
import com.genflow.engine.statemachine.WorkflowStateMachine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Scenario tests for running and resuming a twelve step workflow.
 */
class WorkflowRunnerTest {

    private static final String IDEA = "A habit tracker for remote teams";

    @TempDir
    Path projectDir;

    private TimeController time;
    private WorkflowDefinition definition;
    private CheckpointRepository checkpoints;
    private FailureInjector injector;
    private StepGeneratorRegistry generators;
    private List<String> generatedSteps;

    @BeforeEach
    void setUp() {
        time = TimeController.frozenAt(Instant.parse("2024-05-01T09:00:00Z"));
        definition = WorkflowDefinition.of("twelve",
            IntStream.rangeClosed(1, 12).mapToObj(i -> "step" + i).toArray(String[]::new));
        checkpoints = new FileCheckpointRepository(projectDir.resolve(".genflow/checkpoints"),
            WorkflowEngine.defaultObjectMapper());
        injector = new FailureInjector();
        generatedSteps = Collections.synchronizedList(new ArrayList<>());
        StepGenerator echo = ctx -> {
            generatedSteps.add(ctx.getStepId());
            time.advanceSeconds(1);
            return StepOutput.of("# " + ctx.getStepId() + " after " + ctx.getPreviousOutputs().keySet());
        };
        generators = new StepGeneratorRegistry().setDefault(injector.wrap(echo));
    }

    private WorkflowRunner newRunner() {
        WorkflowMetrics metrics = new WorkflowMetrics();
        RetryPolicy retryPolicy = new RetryPolicy(RetryConfig.defaultConfig(), Sleeper.noop(), new ErrorClassifier());
        StepExecutor executor = new StepExecutor(checkpoints, retryPolicy, RetryConfig.defaultConfig(), time, metrics);
        WorkflowStateMachine stateMachine = new WorkflowStateMachine(definition, AutomationMode.AUTO, time);
        return new WorkflowRunner(stateMachine, executor, generators, checkpoints, metrics, time, ".genflow");
    }

    private WorkflowRunConfig config() {
        return WorkflowRunConfig.builder().projectPath(projectDir).projectIdea(IDEA).build();
    }

    @Test
    @DisplayName("All steps generate in order and each sees the outputs before it")
    void run_shouldCompleteAllStepsInOrder() {
        WorkflowResult result = newRunner().run(config());

        assertThat(result.success()).isTrue();
        assertThat(result.completedCount()).isEqualTo(12);
        assertThat(result.failedStep()).isNull();
        assertThat(generatedSteps).containsExactlyElementsOf(definition.stepIds());
        assertThat(result.outputs()).containsOnlyKeys(definition.stepIds());
        assertThat(result.outputs().get("step3").content()).isEqualTo("# step3 after [step1, step2]");
        assertThat(checkpoints.findAll()).hasSize(12);
    }

    @Test
    @DisplayName("A transient network error on step 4 is retried and the run still completes")
    void run_shouldRetryTransientFailure() {
        injector.failNext("step4", () -> GenerationException.network("connection reset"));

        WorkflowResult result = newRunner().run(config());

        assertThat(result.success()).isTrue();
        assertThat(result.completedCount()).isEqualTo(12);
        assertThat(result.attemptsFor("step4")).isEqualTo(2);
        assertThat(result.attemptsFor("step3")).isEqualTo(1);
        assertThat(injector.getInvocationCount("step4")).isEqualTo(2);
    }

    @Test
    @DisplayName("An auth failure on step 6 stops the run without touching later steps")
    void run_shouldStopAtFirstFatalFailure() {
        injector.failAlways("step6", () -> GenerationException.authFailure("401 invalid api key"));
        WorkflowRunner runner = newRunner();

        WorkflowResult result = runner.run(config());

        assertThat(result.success()).isFalse();
        assertThat(result.failedStep()).isEqualTo("step6");
        assertThat(result.completedCount()).isEqualTo(5);
        assertThat(result.error()).isInstanceOf(GenerationException.class);
        assertThat(result.errorMessage()).contains("invalid api key");
        assertThat(result.attemptsFor("step6")).isEqualTo(1);
        assertThat(injector.getInvocationCount("step6")).isEqualTo(1);
        IntStream.rangeClosed(7, 12).forEach(i -> {
            assertThat(injector.getInvocationCount("step" + i)).isZero();
            assertThat(runner.getStateMachine().getStepState("step" + i).status()).isEqualTo(StepStatus.PENDING);
        });
        assertThat(checkpoints.findByStepId("step6")).isEmpty();
        assertThat(runner.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Exhausted retries report the step with all attempts counted")
    void run_shouldReportExhaustedRetries() {
        injector.failAlways("step2", () -> GenerationException.timeout("request timed out"));

        WorkflowResult result = newRunner().run(config());

        assertThat(result.failedStep()).isEqualTo("step2");
        assertThat(result.attemptsFor("step2")).isEqualTo(4);
        assertThat(injector.getInvocationCount("step2")).isEqualTo(4);
    }

    @Test
    @DisplayName("Resume with a fresh runner restores finished steps and regenerates only the rest")
    void resume_shouldNotRegenerateCompletedSteps() {
        injector.failAlways("step6", () -> GenerationException.authFailure("unauthorized"));
        newRunner().run(config());
        injector.reset();
        generatedSteps.clear();

        WorkflowRunner resumed = newRunner();
        WorkflowResult result = resumed.resume(config());

        assertThat(result.success()).isTrue();
        assertThat(result.completedCount()).isEqualTo(12);
        assertThat(generatedSteps).containsExactly("step6", "step7", "step8", "step9", "step10", "step11", "step12");
        assertThat(result.outputs()).containsKeys("step1", "step5", "step12");
        assertThat(result.attemptsFor("step1")).isZero();
    }

    @Test
    @DisplayName("Resume with the same runner continues the failed in-progress step")
    void resume_shouldContinueInProgressStepOnSameRunner() {
        injector.failNext("step3", () -> GenerationException.invalidResponse("garbled"));
        WorkflowRunner runner = newRunner();
        assertThat(runner.run(config()).failedStep()).isEqualTo("step3");
        assertThat(runner.getStateMachine().getStepState("step3").status()).isEqualTo(StepStatus.IN_PROGRESS);

        WorkflowResult result = runner.resume(config());

        assertThat(result.success()).isTrue();
        assertThat(generatedSteps.stream().filter("step1"::equals)).hasSize(1);
    }

    @Test
    @DisplayName("Skip mode marks every step skipped without generating")
    void run_shouldSkipEveryStepInSkipMode() {
        List<String> skipped = new ArrayList<>();
        WorkflowRunConfig config = WorkflowRunConfig.builder()
            .projectPath(projectDir)
            .projectIdea(IDEA)
            .automationMode(AutomationMode.SKIP)
            .callbacks(new WorkflowCallbacks() {
                @Override
                public void onStepSkip(String stepId) {
                    skipped.add(stepId);
                }
            })
            .build();

        WorkflowResult result = newRunner().run(config);

        assertThat(result.success()).isTrue();
        assertThat(result.skippedCount()).isEqualTo(12);
        assertThat(result.completedCount()).isZero();
        assertThat(generatedSteps).isEmpty();
        assertThat(skipped).hasSize(12);
        assertThat(checkpoints.findByStepId("step1").orElseThrow().isSkipped()).isTrue();
    }

    @Test
    @DisplayName("A single step in skip mode is passed over and stays skipped on resume")
    void run_shouldSkipSingleStep() {
        WorkflowRunner runner = newRunner();
        runner.getStateMachine().setStepAutomationMode("step2", AutomationMode.SKIP);

        WorkflowResult result = runner.run(config());

        assertThat(result.completedCount()).isEqualTo(11);
        assertThat(result.skippedCount()).isEqualTo(1);
        assertThat(generatedSteps).doesNotContain("step2");

        generatedSteps.clear();
        WorkflowResult resumed = newRunner().resume(config());
        assertThat(resumed.skippedCount()).isEqualTo(1);
        assertThat(generatedSteps).isEmpty();
    }

    @Test
    @DisplayName("Manual mode uses a user-written file and falls back to generation without one")
    void run_shouldUseManualOutputWhenPresent() throws IOException {
        Path outputs = Files.createDirectories(projectDir.resolve(".genflow/outputs"));
        Files.writeString(outputs.resolve("step2.md"), "# Hand written step 2");
        List<String> detected = new ArrayList<>();
        WorkflowRunConfig config = WorkflowRunConfig.builder()
            .projectPath(projectDir)
            .projectIdea(IDEA)
            .automationMode(AutomationMode.MANUAL)
            .callbacks(new WorkflowCallbacks() {
                @Override
                public void onManualStepDetected(String stepId, Path file) {
                    detected.add(stepId);
                }
            })
            .build();

        WorkflowResult result = newRunner().run(config);

        assertThat(result.success()).isTrue();
        assertThat(detected).containsExactly("step2");
        assertThat(generatedSteps).doesNotContain("step2").hasSize(11);
        assertThat(result.outputs().get("step2").content()).isEqualTo("# Hand written step 2");
        assertThat(result.outputs().get("step2").metadata().path("source").asText()).isEqualTo("manual");
        assertThat(checkpoints.findByStepId("step2").orElseThrow().automationMode()).isEqualTo(AutomationMode.MANUAL);
    }

    @Test
    @DisplayName("Cancel stops the run before the next step")
    void cancel_shouldStopBeforeNextStep() {
        AtomicReference<WorkflowRunner> holder = new AtomicReference<>();
        WorkflowRunConfig config = WorkflowRunConfig.builder()
            .projectPath(projectDir)
            .projectIdea(IDEA)
            .callbacks(new WorkflowCallbacks() {
                @Override
                public void onStepComplete(String stepId, StepOutput output) {
                    if (stepId.equals("step2")) {
                        holder.get().cancel();
                    }
                }
            })
            .build();
        WorkflowRunner runner = newRunner();
        holder.set(runner);

        WorkflowResult result = runner.run(config);

        assertThat(result.cancelled()).isTrue();
        assertThat(result.success()).isFalse();
        assertThat(result.completedCount()).isEqualTo(2);
        assertThat(generatedSteps).containsExactly("step1", "step2");
        assertThat(runner.isRunning()).isFalse();
    }

    @Test
    void run_shouldRejectConcurrentRun() {
        AtomicReference<WorkflowRunner> holder = new AtomicReference<>();
        AtomicReference<Throwable> nested = new AtomicReference<>();
        generators.register("step1", ctx -> {
            nested.set(catchThrowable(() -> holder.get().run(config())));
            return StepOutput.of("first");
        });
        WorkflowRunner runner = newRunner();
        holder.set(runner);

        WorkflowResult result = runner.run(config());

        assertThat(result.success()).isTrue();
        assertThat(nested.get())
            .isInstanceOf(WorkflowAlreadyRunningException.class)
            .hasMessageContaining("twelve");
    }

    @Test
    void run_shouldRequireProjectContext() {
        WorkflowRunner runner = newRunner();

        assertThatThrownBy(() -> runner.run(WorkflowRunConfig.builder().projectIdea(IDEA).build()))
            .isInstanceOf(MissingProjectContextException.class)
            .hasMessageContaining("projectPath");
        assertThatThrownBy(() -> runner.run(WorkflowRunConfig.builder().projectPath(projectDir).projectIdea(" ").build()))
            .isInstanceOf(MissingProjectContextException.class)
            .hasMessageContaining("projectIdea");
        assertThat(runner.isRunning()).isFalse();
        assertThat(runner.getStateMachine().isStarted()).isFalse();
    }

    @Test
    void run_shouldIsolateFailingCallbacks() {
        WorkflowRunConfig config = WorkflowRunConfig.builder()
            .projectPath(projectDir)
            .projectIdea(IDEA)
            .callbacks(new WorkflowCallbacks() {
                @Override
                public void onStepStart(String stepId) {
                    throw new IllegalStateException("ui crashed");
                }
            })
            .build();

        WorkflowResult result = newRunner().run(config);

        assertThat(result.success()).isTrue();
        assertThat(result.completedCount()).isEqualTo(12);
    }

    @Test
    @DisplayName("A checkpoint that cannot be written stops the run with a structured failure")
    void run_shouldReportCheckpointWriteFailure() throws IOException {
        definition = WorkflowDefinition.of("pair", "a", "b");
        Files.createDirectories(projectDir.resolve(".genflow"));
        Files.writeString(projectDir.resolve(".genflow/checkpoints"), "not a directory");
        WorkflowRunner runner = newRunner();

        WorkflowResult result = runner.run(config());

        assertThat(result.success()).isFalse();
        assertThat(result.failedStep()).isEqualTo("a");
        assertThat(result.error()).isInstanceOf(CheckpointException.class);
        assertThat(result.outputs()).isEmpty();
        assertThat(generatedSteps).containsExactly("a");
        assertThat(runner.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Step ids that are not plain file names are checkpointed and resumed")
    void resume_shouldHandleStepIdWithSpace() {
        definition = WorkflowDefinition.of("spaced", "product brief", "prd");
        injector.failAlways("prd", () -> GenerationException.authFailure("401 Unauthorized"));

        WorkflowResult failed = newRunner().run(config());

        assertThat(failed.failedStep()).isEqualTo("prd");
        assertThat(failed.completedCount()).isEqualTo(1);
        assertThat(checkpoints.findByStepId("product brief")).isPresent();

        injector.reset();
        generatedSteps.clear();
        WorkflowResult resumed = newRunner().resume(config());

        assertThat(resumed.success()).isTrue();
        assertThat(generatedSteps).containsExactly("prd");
        assertThat(resumed.outputs().get("product brief").content()).startsWith("# product brief");
    }

    @Test
    @DisplayName("A failed run leaves a failure record that a later successful run removes")
    void run_shouldRecordAndClearLastFailure() {
        injector.failAlways("step6", () -> GenerationException.authFailure("401 invalid api key"));

        newRunner().run(config());

        FailureRecord failure = checkpoints.findLastFailure().orElseThrow();
        assertThat(failure.failedStep()).isEqualTo("step6");
        assertThat(failure.errorCode()).isEqualTo("AUTH_FAILURE");
        assertThat(failure.message()).contains("invalid api key");
        assertThat(failure.attempts()).isEqualTo(1);
        assertThat(failure.occurredAt()).isEqualTo(time.instant());
        assertThat(failure.stepStatuses()).hasSize(12);
        assertThat(failure.stepStatuses().get("step5")).isEqualTo(StepStatus.COMPLETED);
        assertThat(failure.stepStatuses().get("step6")).isEqualTo(StepStatus.IN_PROGRESS);
        assertThat(failure.stepStatuses().get("step7")).isEqualTo(StepStatus.PENDING);
        assertThat(checkpoints.findAll()).hasSize(5);

        injector.reset();
        WorkflowResult resumed = newRunner().resume(config());

        assertThat(resumed.success()).isTrue();
        assertThat(checkpoints.findLastFailure()).isEmpty();
    }
}
