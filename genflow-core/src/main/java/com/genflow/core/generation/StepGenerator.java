package com.genflow.core.generation;

import com.genflow.core.model.StepOutput;

/**
 * Produces the artifact for one workflow step.
 * Implementations usually build a prompt from the context and call a {@link GenerationClient}.
 */
@FunctionalInterface
public interface StepGenerator {
    
    /**
     * Generate the step's output. Called once per attempt.
     * 
     * @param context Step context: project, previous outputs, attempt number
     * @return The step output
     * @throws GenerationException if generation fails
     */
    StepOutput generate(StepContext context) throws GenerationException;
}
