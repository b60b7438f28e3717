package com.genflow.examples.planning;

import com.fasterxml.jackson.databind.JsonNode;
import com.genflow.core.generation.GenerationException;
import com.genflow.core.generation.StepContext;
import com.genflow.core.model.AutomationMode;
import com.genflow.core.model.RetryConfig;
import com.genflow.core.model.StepOutput;
import com.genflow.core.model.WorkflowDefinition;
import com.genflow.engine.config.EngineProperties;
import com.genflow.engine.config.WorkflowEngine;
import com.genflow.engine.metrics.WorkflowMetrics;
import com.genflow.engine.retry.ErrorClassifier;
import com.genflow.engine.retry.RetryPolicy;
import com.genflow.engine.retry.Sleeper;
import com.genflow.engine.runner.ResumeService;
import com.genflow.engine.runner.WorkflowResult;
import com.genflow.engine.runner.WorkflowRunConfig;
import com.genflow.quality.QualityGate;
import com.genflow.quality.QualityGateStepGenerator;
import com.genflow.quality.ReviewAndFixLoop;
import com.genflow.quality.generation.GenerationContentFixer;
import com.genflow.quality.generation.JsonContentReviewer;
import com.genflow.quality.generation.JsonQualityScorer;
import com.genflow.quality.model.ReviewLoopResult;
import com.genflow.quality.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end runs of the product planning workflow against the simulated backend.
 */
class ProductPlanningWorkflowTest {

    @TempDir
    Path projectDir;

    private final SimulatedGenerationClient client = new SimulatedGenerationClient();

    private final WorkflowEngine engine = new WorkflowEngine(
        EngineProperties.defaults(),
        WorkflowEngine.defaultObjectMapper(),
        Clock.systemUTC(),
        new WorkflowMetrics(),
        new RetryPolicy(RetryConfig.defaultConfig(), Sleeper.noop(), new ErrorClassifier()));

    private final WorkflowDefinition definition = ProductPlanningWorkflow.createDefinition();

    private WorkflowResult run(boolean resume) {
        QualityGate gate = new QualityGate(
            new JsonQualityScorer(client, engine.getObjectMapper()),
            new GenerationContentFixer(client));
        WorkflowRunConfig config = WorkflowRunConfig.builder()
            .projectPath(projectDir)
            .projectIdea("Shared grocery lists")
            .automationMode(AutomationMode.AUTO)
            .build();
        var runner = engine.newRunner(definition, ProductPlanningWorkflow.createGenerators(client, gate), projectDir);
        return resume ? runner.resume(config) : runner.run(config);
    }

    @Test
    void createDefinition_shouldListTwelveStepsInOrder() {
        assertThat(definition.size()).isEqualTo(12);
        assertThat(definition.stepIds().get(0)).isEqualTo(ProductPlanningWorkflow.STEP_BRAINSTORMING);
        assertThat(definition.stepIds().get(3)).isEqualTo(ProductPlanningWorkflow.STEP_PRD);
        assertThat(definition.stepIds().get(11)).isEqualTo(ProductPlanningWorkflow.STEP_QA_TESTING);
        assertThat(definition.steps().get(5).displayName()).isEqualTo("Architecture");
    }

    @Test
    void buildPrompt_shouldIncludeIdeaAndEarlierDocuments() {
        Map<String, StepOutput> previous = new LinkedHashMap<>();
        previous.put("brainstorming", StepOutput.of("# Ideas"));
        previous.put("research", StepOutput.of("# Findings"));
        StepContext context = new StepContext(ProductPlanningWorkflow.WORKFLOW_NAME, definition.steps().get(2),
            projectDir, "Shared grocery lists", AutomationMode.AUTO, previous, 1);

        String prompt = ProductPlanningWorkflow.buildPrompt(context);

        assertThat(prompt).startsWith("Step: Product Brief\n");
        assertThat(prompt).contains("Project idea: Shared grocery lists");
        assertThat(prompt.indexOf("### brainstorming")).isLessThan(prompt.indexOf("### research"));
        assertThat(prompt).contains("# Findings");
    }

    @Test
    @DisplayName("Full run: every step completes and gated steps carry a passing quality record")
    void run_shouldCompleteAndGateSelectedSteps() {
        WorkflowResult result = run(false);

        assertThat(result.success()).isTrue();
        assertThat(result.completedCount()).isEqualTo(12);
        assertThat(result.outputs()).hasSize(12);

        JsonNode prdQuality = result.outputs().get(ProductPlanningWorkflow.STEP_PRD)
            .metadata().get(QualityGateStepGenerator.METADATA_FIELD);
        assertThat(prdQuality.get("passed").asBoolean()).isTrue();
        assertThat(prdQuality.get("score").asInt()).isEqualTo(86);
        assertThat(prdQuality.get("attempts").asInt()).isEqualTo(1);
        assertThat(result.outputs().get(ProductPlanningWorkflow.STEP_PRD).content())
            .contains(SimulatedGenerationClient.REVISION_MARKER);

        for (String gated : ProductPlanningWorkflow.GATED_STEPS) {
            assertThat(result.outputs().get(gated).metadata().has("quality")).as(gated).isTrue();
        }
        assertThat(result.outputs().get(ProductPlanningWorkflow.STEP_RESEARCH).metadata().has("quality")).isFalse();
    }

    @Test
    @DisplayName("Transient failures: the step is retried and the run still succeeds")
    void run_shouldRetryTransientFailures() {
        client.failTimes("Step: Research\n", 2, GenerationException.network("connect ECONNREFUSED"));

        WorkflowResult result = run(false);

        assertThat(result.success()).isTrue();
        assertThat(result.attemptsFor(ProductPlanningWorkflow.STEP_RESEARCH)).isEqualTo(3);
    }

    @Test
    @DisplayName("Auth failure at architecture, then resume completes the remaining steps")
    void resume_shouldContinueAfterPermanentFailure() {
        client.failStep("Architecture", GenerationException.authFailure("HTTP 401 Unauthorized"));

        WorkflowResult failed = run(false);

        assertThat(failed.success()).isFalse();
        assertThat(failed.failedStep()).isEqualTo(ProductPlanningWorkflow.STEP_ARCHITECTURE);
        assertThat(failed.completedCount()).isEqualTo(5);
        assertThat(failed.attemptsFor(ProductPlanningWorkflow.STEP_ARCHITECTURE)).isEqualTo(1);

        ResumeService.ResumeInfo info = engine.resumeService(definition, projectDir).getResumeInfo();
        assertThat(info.canResume()).isTrue();
        assertThat(info.nextStep()).isEqualTo(ProductPlanningWorkflow.STEP_ARCHITECTURE);
        assertThat(info.lastFailure().failedStep()).isEqualTo(ProductPlanningWorkflow.STEP_ARCHITECTURE);
        assertThat(info.lastFailure().errorCode()).isEqualTo("AUTH_FAILURE");

        client.clearFailures();
        WorkflowResult resumed = run(true);

        assertThat(resumed.success()).isTrue();
        assertThat(resumed.completedCount()).isEqualTo(12);
        assertThat(engine.resumeService(definition, projectDir).getResumeInfo().lastFailure()).isNull();
    }

    @Test
    void reviewLoop_shouldResolveBlockingFindingsAfterOneFix() {
        ReviewAndFixLoop loop = new ReviewAndFixLoop(
            new JsonContentReviewer(client, engine.getObjectMapper()),
            new GenerationContentFixer(client));

        ReviewLoopResult result = loop.run("# Architecture\n\nOne service.\n", "architecture");

        assertThat(result.resolved()).isTrue();
        assertThat(result.iterations()).isEqualTo(2);
        assertThat(result.count(Severity.CRITICAL)).isEqualTo(1);
        assertThat(result.count(Severity.MINOR)).isEqualTo(1);
        assertThat(result.finalContent()).startsWith("# Architecture").contains(SimulatedGenerationClient.REVISION_MARKER);
    }

    @Test
    void simulatedClient_shouldFailOnlyScriptedCalls() throws GenerationException {
        client.failNext(GenerationException.timeout("Request timed out"));

        assertThatThrownBy(() -> client.generate("Step: Research\nProject idea: x\n"))
            .isInstanceOf(GenerationException.class)
            .hasMessage("Request timed out");
        assertThat(client.generate("Step: Research\nProject idea: x\n")).startsWith("# Research");
        assertThat(client.getCallCount()).isEqualTo(2);
    }
}
