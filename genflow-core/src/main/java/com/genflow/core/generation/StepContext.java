package com.genflow.core.generation;

import com.genflow.core.model.AutomationMode;
import com.genflow.core.model.StepOutput;
import com.genflow.core.model.WorkflowStep;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Context provided to step generators during execution.
 */
public class StepContext {
    
    private final String workflowName;
    private final WorkflowStep step;
    private final Path projectPath;
    private final String projectIdea;
    private final AutomationMode automationMode;
    private final Map<String, StepOutput> previousOutputs;
    private final int attemptNumber;
    
    public StepContext(
            String workflowName,
            WorkflowStep step,
            Path projectPath,
            String projectIdea,
            AutomationMode automationMode,
            Map<String, StepOutput> previousOutputs,
            int attemptNumber) {
        this.workflowName = workflowName;
        this.step = step;
        this.projectPath = projectPath;
        this.projectIdea = projectIdea;
        this.automationMode = automationMode;
        this.previousOutputs = Collections.unmodifiableMap(new LinkedHashMap<>(previousOutputs));
        this.attemptNumber = attemptNumber;
    }
    
    /**
     * Same context for the given attempt number.
     */
    public StepContext forAttempt(int attempt) {
        return new StepContext(workflowName, step, projectPath, projectIdea,
            automationMode, previousOutputs, attempt);
    }
    
    public String getWorkflowName() {
        return workflowName;
    }
    
    public WorkflowStep getStep() {
        return step;
    }
    
    public String getStepId() {
        return step.stepId();
    }
    
    public Path getProjectPath() {
        return projectPath;
    }
    
    public String getProjectIdea() {
        return projectIdea;
    }
    
    public AutomationMode getAutomationMode() {
        return automationMode;
    }
    
    /**
     * Outputs of the steps finished before this one, in step order.
     */
    public Map<String, StepOutput> getPreviousOutputs() {
        return previousOutputs;
    }
    
    public Optional<String> getPreviousContent(String stepId) {
        return Optional.ofNullable(previousOutputs.get(stepId)).map(StepOutput::content);
    }
    
    /**
     * 1-based attempt number under the retry policy.
     */
    public int getAttemptNumber() {
        return attemptNumber;
    }
}
