package com.genflow.engine.executor;

import com.genflow.core.model.StepOutput;

import java.time.Duration;

/**
 * Outcome of one successful step execution.
 *
 * @param attempts generation attempts used; 0 when the output came from a checkpoint or a manual file
 * @param replayed true when the output was read back from a checkpoint
 */
public record StepExecutionResult(
    String stepId,
    StepOutput output,
    int attempts,
    boolean replayed,
    Duration elapsed
) {
    public static StepExecutionResult replayed(String stepId, StepOutput output) {
        return new StepExecutionResult(stepId, output, 0, true, Duration.ZERO);
    }
}
