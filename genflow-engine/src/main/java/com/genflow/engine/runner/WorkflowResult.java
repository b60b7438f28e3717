package com.genflow.engine.runner;

import com.genflow.core.model.StepOutput;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured outcome of a run. Expected failures are reported here, not thrown.
 *
 * @param completedCount steps COMPLETED at the end of the run, restored ones included
 * @param failedStep     step that stopped the run, null otherwise
 * @param outputs        outputs of completed steps in step order, partial on failure
 * @param attempts       generation attempts per executed step
 */
public record WorkflowResult(
    boolean success,
    int completedCount,
    int skippedCount,
    String failedStep,
    Throwable error,
    Map<String, StepOutput> outputs,
    Map<String, Integer> attempts,
    boolean cancelled
) {
    public WorkflowResult {
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        attempts = Collections.unmodifiableMap(new LinkedHashMap<>(attempts));
    }
    
    public String errorMessage() {
        return error == null ? null : error.getMessage();
    }
    
    public int attemptsFor(String stepId) {
        return attempts.getOrDefault(stepId, 0);
    }
}
