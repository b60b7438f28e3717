package com.genflow.examples.planning;

import com.genflow.core.generation.GenerationClient;
import com.genflow.core.generation.GenerationException;
import com.genflow.core.generation.StepGeneratorRegistry;
import com.genflow.core.model.AutomationMode;
import com.genflow.core.model.DelayStrategy;
import com.genflow.core.model.RetryConfig;
import com.genflow.core.model.StepOutput;
import com.genflow.core.model.WorkflowDefinition;
import com.genflow.engine.cache.CachingGenerationClient;
import com.genflow.engine.cache.GenerationCache;
import com.genflow.engine.config.EngineProperties;
import com.genflow.engine.config.WorkflowEngine;
import com.genflow.engine.metrics.WorkflowMetrics;
import com.genflow.engine.retry.RetryPolicy;
import com.genflow.engine.runner.ResumeService;
import com.genflow.engine.runner.WorkflowCallbacks;
import com.genflow.engine.runner.WorkflowResult;
import com.genflow.engine.runner.WorkflowRunConfig;
import com.genflow.engine.runner.WorkflowRunner;
import com.genflow.quality.QualityGate;
import com.genflow.quality.QualityGateStepGenerator;
import com.genflow.quality.ReviewAndFixLoop;
import com.genflow.quality.generation.GenerationContentFixer;
import com.genflow.quality.generation.JsonContentReviewer;
import com.genflow.quality.generation.JsonQualityScorer;
import com.genflow.quality.model.ReviewLoopResult;
import com.genflow.quality.model.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Demonstration of the product planning workflow.
 * 
 * Shows:
 * 1. Normal execution with transient failures retried
 * 2. Permanent failure and resume from checkpoints
 * 3. Manual and skip modes
 * 4. Response caching across runs
 * 5. Review-and-fix loop on a single document
 */
public class ProductPlanningDemo {
    
    private static final Logger log = LoggerFactory.getLogger(ProductPlanningDemo.class);
    
    private static final String PROJECT_IDEA = "A habit tracker that pairs users with accountability partners";
    
    private static final RetryConfig FAST_RETRY = RetryConfig.builder()
        .maxRetries(3)
        .baseDelay(Duration.ofMillis(50))
        .maxDelay(Duration.ofMillis(200))
        .strategy(DelayStrategy.EXPONENTIAL)
        .build();
    
    private static final MeterRegistry meterRegistry = new SimpleMeterRegistry();
    
    public static void main(String[] args) throws Exception {
        log.info("╔════════════════════════════════════════════════════════════╗");
        log.info("║           GENFLOW PRODUCT PLANNING DEMONSTRATION            ║");
        log.info("╚════════════════════════════════════════════════════════════╝");
        
        WorkflowEngine engine = createEngine();
        
        runScenario1_NormalExecution(engine);
        runScenario2_FailureAndResume(engine);
        runScenario3_ManualAndSkip(engine);
        runScenario4_Caching(engine);
        runScenario5_ReviewLoop(engine);
        
        log.info("");
        log.info("╔════════════════════════════════════════════════════════════╗");
        log.info("║                 ALL SCENARIOS COMPLETED                     ║");
        log.info("╚════════════════════════════════════════════════════════════╝");
        log.info("Steps completed across all runs: {}", countOf(WorkflowMetrics.STEPS_COMPLETED));
        log.info("Retry attempts across all runs: {}", countOf(WorkflowMetrics.RETRY_ATTEMPTS));
    }
    
    /**
     * Scenario 1: every step generated, two steps hit transient backend errors.
     */
    private static void runScenario1_NormalExecution(WorkflowEngine engine) throws IOException {
        banner("SCENARIO 1: Normal Execution With Transient Failures");
        
        SimulatedGenerationClient client = new SimulatedGenerationClient()
            .failTimes("Step: Research\n", 2, GenerationException.network("connect ECONNREFUSED"))
            .failTimes("Step: UX Design\n", 1, GenerationException.rateLimit("Rate limit exceeded"));
        
        Path project = Files.createTempDirectory("genflow-demo-1");
        WorkflowDefinition definition = ProductPlanningWorkflow.createDefinition();
        WorkflowRunner runner = engine.newRunner(definition, generatorsFor(client, engine), project);
        
        WorkflowResult result = runner.run(runConfig(project, AutomationMode.AUTO, new ProgressLogger()));
        
        log.info("Success: {}, completed {}/{}", result.success(), result.completedCount(), definition.size());
        log.info("Attempts for {}: {}", ProductPlanningWorkflow.STEP_RESEARCH,
            result.attemptsFor(ProductPlanningWorkflow.STEP_RESEARCH));
        log.info("Attempts for {}: {}", ProductPlanningWorkflow.STEP_UX_DESIGN,
            result.attemptsFor(ProductPlanningWorkflow.STEP_UX_DESIGN));
        logQuality(result.outputs().get(ProductPlanningWorkflow.STEP_PRD), ProductPlanningWorkflow.STEP_PRD);
        log.info("Backend calls: {}", client.getCallCount());
        
        log.info("✓ SCENARIO 1 COMPLETE");
    }
    
    /**
     * Scenario 2: an authentication error stops the run at architecture; a second
     * runner resumes once credentials are fixed.
     */
    private static void runScenario2_FailureAndResume(WorkflowEngine engine) throws IOException {
        banner("SCENARIO 2: Permanent Failure and Resume");
        
        SimulatedGenerationClient client = new SimulatedGenerationClient()
            .failStep("Architecture", GenerationException.authFailure("HTTP 401 Unauthorized"));
        
        Path project = Files.createTempDirectory("genflow-demo-2");
        WorkflowDefinition definition = ProductPlanningWorkflow.createDefinition();
        
        WorkflowResult failed = engine.newRunner(definition, generatorsFor(client, engine), project)
            .run(runConfig(project, AutomationMode.AUTO, WorkflowCallbacks.NONE));
        log.info("First run: success={}, failed step={}, error={}",
            failed.success(), failed.failedStep(), failed.errorMessage());
        log.info("Attempts at failed step: {} (auth errors are not retried)", failed.attemptsFor(failed.failedStep()));
        
        ResumeService resumeService = engine.resumeService(definition, project);
        ResumeService.ResumeInfo info = resumeService.getResumeInfo();
        log.info("Resume available: {}, next step {} ({} of {}), completed {}",
            info.canResume(), info.nextStep(), info.stepNumber(), info.totalSteps(), info.completedSteps());
        if (info.lastFailure() != null) {
            log.info("Last run stopped at {}: {} ({})",
                info.lastFailure().failedStep(), info.lastFailure().errorCode(), info.lastFailure().message());
        }
        
        // Credentials fixed
        client.clearFailures();
        int callsBefore = client.getCallCount();
        
        WorkflowResult resumed = engine.newRunner(definition, generatorsFor(client, engine), project)
            .resume(runConfig(project, AutomationMode.AUTO, WorkflowCallbacks.NONE));
        log.info("Resumed run: success={}, completed {}/{}, backend calls {}",
            resumed.success(), resumed.completedCount(), definition.size(), client.getCallCount() - callsBefore);
        
        log.info("✓ SCENARIO 2 COMPLETE");
    }
    
    /**
     * Scenario 3: a user-authored PRD is picked up in manual mode; a second project
     * skips every step.
     */
    private static void runScenario3_ManualAndSkip(WorkflowEngine engine) throws IOException {
        banner("SCENARIO 3: Manual and Skip Modes");
        
        WorkflowDefinition definition = ProductPlanningWorkflow.createDefinition();
        SimulatedGenerationClient client = new SimulatedGenerationClient();
        
        Path manualProject = Files.createTempDirectory("genflow-demo-3-manual");
        Path outputs = engine.getProperties().stateDirectory(manualProject).resolve("outputs");
        Files.createDirectories(outputs);
        Files.writeString(outputs.resolve(ProductPlanningWorkflow.STEP_PRD + ".md"),
            "# PRD\n\nWritten by the product manager.\n");
        
        WorkflowResult manual = engine.newRunner(definition, generatorsFor(client, engine), manualProject)
            .run(runConfig(manualProject, AutomationMode.MANUAL, new ProgressLogger()));
        StepOutput prd = manual.outputs().get(ProductPlanningWorkflow.STEP_PRD);
        log.info("Manual run: success={}, prd source={}", manual.success(), prd.metadata().path("source").asText());
        
        Path skipProject = Files.createTempDirectory("genflow-demo-3-skip");
        WorkflowResult skipped = engine.newRunner(definition, generatorsFor(client, engine), skipProject)
            .run(runConfig(skipProject, AutomationMode.SKIP, WorkflowCallbacks.NONE));
        log.info("Skip run: success={}, skipped {}/{}", skipped.success(), skipped.skippedCount(), definition.size());
        
        log.info("✓ SCENARIO 3 COMPLETE");
    }
    
    /**
     * Scenario 4: the second run of the same project is answered from the cache.
     */
    private static void runScenario4_Caching(WorkflowEngine engine) throws IOException {
        banner("SCENARIO 4: Generation Cache");
        
        Path project = Files.createTempDirectory("genflow-demo-4");
        WorkflowDefinition definition = ProductPlanningWorkflow.createDefinition();
        SimulatedGenerationClient backend = new SimulatedGenerationClient();
        GenerationCache cache = engine.newCache(project);
        GenerationClient cached = new CachingGenerationClient(backend, cache, Duration.ofHours(1));
        
        engine.newRunner(definition, generatorsFor(cached, engine), project)
            .run(runConfig(project, AutomationMode.AUTO, WorkflowCallbacks.NONE));
        int firstRunCalls = backend.getCallCount();
        log.info("First run backend calls: {}, cache {}", firstRunCalls, cache.getStats());
        
        engine.resumeService(definition, project).startFresh();
        WorkflowResult second = engine.newRunner(definition, generatorsFor(cached, engine), project)
            .run(runConfig(project, AutomationMode.AUTO, WorkflowCallbacks.NONE));
        log.info("Second run: success={}, new backend calls: {}",
            second.success(), backend.getCallCount() - firstRunCalls);
        log.info("Cache hits: {}", countOf(WorkflowMetrics.CACHE_HITS));
        
        log.info("✓ SCENARIO 4 COMPLETE");
    }
    
    /**
     * Scenario 5: an architecture document reviewed until no blocking finding remains.
     */
    private static void runScenario5_ReviewLoop(WorkflowEngine engine) {
        banner("SCENARIO 5: Review and Fix Loop");
        
        SimulatedGenerationClient client = new SimulatedGenerationClient();
        ReviewAndFixLoop loop = new ReviewAndFixLoop(
            new JsonContentReviewer(client, engine.getObjectMapper()),
            new GenerationContentFixer(client));
        
        ReviewLoopResult result = loop.run("# Architecture\n\nOne service, one database.\n", "architecture");
        
        log.info("Resolved: {} after {} iteration(s)", result.resolved(), result.iterations());
        log.info("Findings: {} critical, {} major, {} minor",
            result.count(Severity.CRITICAL), result.count(Severity.MAJOR), result.count(Severity.MINOR));
        log.info("Final document:\n{}", result.finalContent());
        
        log.info("✓ SCENARIO 5 COMPLETE");
    }
    
    // ========== Helpers ==========
    
    private static WorkflowEngine createEngine() {
        EngineProperties properties = EngineProperties.defaults().withRetry(FAST_RETRY);
        WorkflowMetrics metrics = new WorkflowMetrics();
        metrics.bindTo(meterRegistry);
        return new WorkflowEngine(properties, WorkflowEngine.defaultObjectMapper(), Clock.systemUTC(),
            metrics, new RetryPolicy(properties.retry()));
    }
    
    private static StepGeneratorRegistry generatorsFor(GenerationClient client, WorkflowEngine engine) {
        QualityGate gate = new QualityGate(
            new JsonQualityScorer(client, engine.getObjectMapper()),
            new GenerationContentFixer(client));
        return ProductPlanningWorkflow.createGenerators(client, gate);
    }
    
    private static WorkflowRunConfig runConfig(Path project, AutomationMode mode, WorkflowCallbacks callbacks) {
        return WorkflowRunConfig.builder()
            .projectPath(project)
            .projectIdea(PROJECT_IDEA)
            .automationMode(mode)
            .callbacks(callbacks)
            .build();
    }
    
    private static void logQuality(StepOutput output, String stepId) {
        if (output == null) {
            return;
        }
        var quality = output.metadata().path(QualityGateStepGenerator.METADATA_FIELD);
        log.info("Quality gate for {}: passed={}, score={}, grade={}, fix passes={}",
            stepId, quality.path("passed").asBoolean(), quality.path("score").asInt(),
            quality.path("grade").asText(), quality.path("attempts").asInt());
    }
    
    private static double countOf(String meterName) {
        return meterRegistry.find(meterName).counters().stream().mapToDouble(Counter::count).sum();
    }
    
    private static void banner(String title) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(title);
        log.info("═══════════════════════════════════════════════════════════════");
    }
    
    private static class ProgressLogger implements WorkflowCallbacks {
        
        @Override
        public void onStepComplete(String stepId, StepOutput output) {
            log.info("  ✓ {} ({} chars)", stepId, output.content().length());
        }
        
        @Override
        public void onManualStepDetected(String stepId, Path file) {
            log.info("  ✎ {} taken from {}", stepId, file.getFileName());
        }
        
        @Override
        public void onStepFailed(String stepId, Throwable error) {
            log.info("  ✗ {}: {}", stepId, error.getMessage());
        }
    }
}
