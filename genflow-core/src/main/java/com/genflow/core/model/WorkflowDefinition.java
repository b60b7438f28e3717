package com.genflow.core.model;

import com.genflow.core.exception.NotFoundException;
import com.genflow.core.exception.WorkflowValidationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable definition of a workflow: a name plus a totally ordered step list.
 *
 * Invariants:
 * - at least one step
 * - step ids are unique
 * - ordinals match list positions
 */
public record WorkflowDefinition(String name, List<WorkflowStep> steps) {

    public WorkflowDefinition {
        if (name == null || name.isBlank()) {
            throw new WorkflowValidationException("name", "must not be blank");
        }
        if (steps == null || steps.isEmpty()) {
            throw new WorkflowValidationException("steps", "at least one step is required");
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);
            if (!seen.add(step.stepId())) {
                throw new WorkflowValidationException("steps", "duplicate step id " + step.stepId());
            }
            if (step.ordinal() != i) {
                throw new WorkflowValidationException("steps",
                    "step " + step.stepId() + " has ordinal " + step.ordinal() + " at position " + i);
            }
        }
        steps = List.copyOf(steps);
    }

    /**
     * Build a definition from step ids in execution order.
     */
    public static WorkflowDefinition of(String name, String... stepIds) {
        return of(name, List.of(stepIds));
    }

    public static WorkflowDefinition of(String name, List<String> stepIds) {
        List<WorkflowStep> steps = new ArrayList<>();
        for (int i = 0; i < stepIds.size(); i++) {
            steps.add(WorkflowStep.of(stepIds.get(i), i));
        }
        return new WorkflowDefinition(name, steps);
    }

    public int size() {
        return steps.size();
    }

    public WorkflowStep stepAt(int index) {
        return steps.get(index);
    }

    public Optional<WorkflowStep> findStep(String stepId) {
        return steps.stream().filter(s -> s.stepId().equals(stepId)).findFirst();
    }

    /**
     * Get a step by id.
     *
     * @throws NotFoundException if the workflow has no such step
     */
    public WorkflowStep getStep(String stepId) {
        return findStep(stepId).orElseThrow(() -> new NotFoundException("Step", stepId));
    }

    public int indexOf(String stepId) {
        return getStep(stepId).ordinal();
    }

    public List<String> stepIds() {
        return steps.stream().map(WorkflowStep::stepId).toList();
    }
}
