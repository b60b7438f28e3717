package com.genflow.examples.planning;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.genflow.core.generation.GenerationClient;
import com.genflow.core.generation.GenerationException;
import com.genflow.core.generation.GenerationOptions;
import com.genflow.core.generation.StepContext;
import com.genflow.core.generation.StepGenerator;
import com.genflow.core.generation.StepGeneratorRegistry;
import com.genflow.core.model.StepOutput;
import com.genflow.core.model.WorkflowDefinition;
import com.genflow.core.model.WorkflowStep;
import com.genflow.quality.QualityGate;
import com.genflow.quality.QualityGateStepGenerator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Product Planning Workflow Example.
 * 
 * Takes a product idea from brainstorming to QA in twelve generated documents.
 * Each step sees the documents of every step before it.
 * 
 * Workflow Steps:
 * 1. brainstorming - Explore the idea
 * 2. research - Market and domain research
 * 3. product-brief - One-page product brief
 * 4. prd - Product requirements (quality gated)
 * 5. ux-design - UX design specification
 * 6. architecture - Technical architecture (quality gated)
 * 7. epics-stories - Epics and user stories (quality gated)
 * 8. sprint-planning - Sprint plan
 * 9. tech-spec - Technical specification
 * 10. development - Implementation notes
 * 11. code-review - Code review report (quality gated)
 * 12. qa-testing - QA test plan
 */
public class ProductPlanningWorkflow {
    
    public static final String WORKFLOW_NAME = "product-planning";
    
    // Step IDs
    public static final String STEP_BRAINSTORMING = "brainstorming";
    public static final String STEP_RESEARCH = "research";
    public static final String STEP_PRODUCT_BRIEF = "product-brief";
    public static final String STEP_PRD = "prd";
    public static final String STEP_UX_DESIGN = "ux-design";
    public static final String STEP_ARCHITECTURE = "architecture";
    public static final String STEP_EPICS_STORIES = "epics-stories";
    public static final String STEP_SPRINT_PLANNING = "sprint-planning";
    public static final String STEP_TECH_SPEC = "tech-spec";
    public static final String STEP_DEVELOPMENT = "development";
    public static final String STEP_CODE_REVIEW = "code-review";
    public static final String STEP_QA_TESTING = "qa-testing";
    
    private static final Map<String, String> DISPLAY_NAMES = new LinkedHashMap<>();
    
    static {
        DISPLAY_NAMES.put(STEP_BRAINSTORMING, "Brainstorming");
        DISPLAY_NAMES.put(STEP_RESEARCH, "Research");
        DISPLAY_NAMES.put(STEP_PRODUCT_BRIEF, "Product Brief");
        DISPLAY_NAMES.put(STEP_PRD, "Product Requirements Document");
        DISPLAY_NAMES.put(STEP_UX_DESIGN, "UX Design");
        DISPLAY_NAMES.put(STEP_ARCHITECTURE, "Architecture");
        DISPLAY_NAMES.put(STEP_EPICS_STORIES, "Epics and Stories");
        DISPLAY_NAMES.put(STEP_SPRINT_PLANNING, "Sprint Planning");
        DISPLAY_NAMES.put(STEP_TECH_SPEC, "Technical Specification");
        DISPLAY_NAMES.put(STEP_DEVELOPMENT, "Development");
        DISPLAY_NAMES.put(STEP_CODE_REVIEW, "Code Review");
        DISPLAY_NAMES.put(STEP_QA_TESTING, "QA Testing");
    }
    
    /** Steps whose output must pass a quality gate. */
    public static final List<String> GATED_STEPS = List.of(STEP_PRD, STEP_ARCHITECTURE, STEP_EPICS_STORIES, STEP_CODE_REVIEW);
    
    private static final int MAX_PREVIOUS_CHARS = 1500;
    
    /**
     * Creates the workflow definition for product planning.
     */
    public static WorkflowDefinition createDefinition() {
        List<WorkflowStep> steps = new ArrayList<>();
        int ordinal = 0;
        for (Map.Entry<String, String> entry : DISPLAY_NAMES.entrySet()) {
            steps.add(new WorkflowStep(entry.getKey(), ordinal++, entry.getValue()));
        }
        return new WorkflowDefinition(WORKFLOW_NAME, steps);
    }
    
    /**
     * Generators for every step: one prompt-based generator, with the gated steps
     * passed through the quality gate when one is given.
     */
    public static StepGeneratorRegistry createGenerators(GenerationClient client, QualityGate gate) {
        StepGenerator documents = new DocumentGenerator(client);
        StepGenerator gated = gate == null
            ? documents
            : QualityGateStepGenerator.forSteps(documents, gate, GATED_STEPS.toArray(String[]::new));
        return new StepGeneratorRegistry().setDefault(gated);
    }
    
    /**
     * Prompt for a step: the idea, then a digest of each earlier document.
     */
    public static String buildPrompt(StepContext context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Step: ").append(context.getStep().displayName()).append('\n');
        prompt.append("Project idea: ").append(context.getProjectIdea()).append("\n\n");
        if (!context.getPreviousOutputs().isEmpty()) {
            prompt.append("Earlier documents:\n");
            context.getPreviousOutputs().forEach((stepId, output) -> {
                String content = output.content();
                prompt.append("### ").append(stepId).append('\n')
                    .append(content.length() > MAX_PREVIOUS_CHARS ? content.substring(0, MAX_PREVIOUS_CHARS) : content)
                    .append("\n\n");
            });
        }
        prompt.append("Write the ").append(context.getStep().displayName()).append(" document in markdown.");
        return prompt.toString();
    }
    
    /**
     * Step generator calling the generation backend with {@link #buildPrompt(StepContext)}.
     */
    static class DocumentGenerator implements StepGenerator {
        
        private final GenerationClient client;
        
        DocumentGenerator(GenerationClient client) {
            this.client = client;
        }
        
        @Override
        public StepOutput generate(StepContext context) throws GenerationException {
            String content = client.generate(buildPrompt(context),
                GenerationOptions.withSystemPrompt("You are a senior product team writing planning documents."));
            ObjectNode metadata = JsonNodeFactory.instance.objectNode()
                .put("step", context.getStepId())
                .put("attempt", context.getAttemptNumber())
                .put("characters", content.length());
            return StepOutput.of(content, metadata);
        }
    }
}
