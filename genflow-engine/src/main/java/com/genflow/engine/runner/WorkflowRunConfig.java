package com.genflow.engine.runner;

import com.genflow.core.model.AutomationMode;

import java.nio.file.Path;

/**
 * Inputs of one run.
 *
 * @param automationMode global mode applied before the run, null keeps the current one
 */
public record WorkflowRunConfig(
    Path projectPath,
    String projectIdea,
    AutomationMode automationMode,
    WorkflowCallbacks callbacks
) {
    public WorkflowRunConfig {
        if (callbacks == null) {
            callbacks = WorkflowCallbacks.NONE;
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private Path projectPath;
        private String projectIdea;
        private AutomationMode automationMode;
        private WorkflowCallbacks callbacks = WorkflowCallbacks.NONE;
        
        public Builder projectPath(Path projectPath) {
            this.projectPath = projectPath;
            return this;
        }
        
        public Builder projectIdea(String projectIdea) {
            this.projectIdea = projectIdea;
            return this;
        }
        
        public Builder automationMode(AutomationMode automationMode) {
            this.automationMode = automationMode;
            return this;
        }
        
        public Builder callbacks(WorkflowCallbacks callbacks) {
            this.callbacks = callbacks;
            return this;
        }
        
        public WorkflowRunConfig build() {
            return new WorkflowRunConfig(projectPath, projectIdea, automationMode, callbacks);
        }
    }
}
