package com.genflow.engine.runner;

import com.genflow.core.model.CheckpointRecord;
import com.genflow.core.model.FailureRecord;
import com.genflow.core.model.StepOutput;
import com.genflow.core.model.WorkflowDefinition;
import com.genflow.core.model.WorkflowStep;
import com.genflow.core.repository.CheckpointRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Inspects the checkpoints of a project to decide whether a run can be resumed.
 */
public class ResumeService {
    
    private static final Logger log = LoggerFactory.getLogger(ResumeService.class);
    
    private final WorkflowDefinition definition;
    private final CheckpointRepository checkpointRepository;
    
    public ResumeService(WorkflowDefinition definition, CheckpointRepository checkpointRepository) {
        this.definition = definition;
        this.checkpointRepository = checkpointRepository;
    }
    
    /**
     * Summary of the saved progress.
     *
     * @param canResume      at least one step finished and at least one left
     * @param nextStep       first step without a completed or skipped checkpoint, null if none
     * @param completedSteps step ids with a completed checkpoint, in step order
     * @param skippedSteps   step ids with a skipped checkpoint, in step order
     * @param lastSavedAt    most recent checkpoint time, null without checkpoints
     * @param lastFailure    why the last run stopped, null if it did not stop on a failing step
     */
    public record ResumeInfo(
        boolean canResume,
        String nextStep,
        List<String> completedSteps,
        List<String> skippedSteps,
        int totalSteps,
        Instant lastSavedAt,
        FailureRecord lastFailure
    ) {
        public int stepNumber() {
            return nextStep == null ? totalSteps : completedSteps.size() + skippedSteps.size() + 1;
        }
    }
    
    public ResumeInfo getResumeInfo() {
        Map<String, CheckpointRecord> checkpoints = loadCheckpoints();
        List<String> completed = definition.stepIds().stream()
            .filter(id -> checkpoints.containsKey(id) && checkpoints.get(id).isResumable())
            .toList();
        List<String> skipped = definition.stepIds().stream()
            .filter(id -> checkpoints.containsKey(id) && checkpoints.get(id).isSkipped())
            .toList();
        String nextStep = definition.steps().stream()
            .map(WorkflowStep::stepId)
            .filter(id -> !completed.contains(id) && !skipped.contains(id))
            .findFirst()
            .orElse(null);
        Instant lastSavedAt = checkpoints.values().stream()
            .map(CheckpointRecord::savedAt)
            .max(Instant::compareTo)
            .orElse(null);
        boolean canResume = !completed.isEmpty() && nextStep != null;
        FailureRecord lastFailure = checkpointRepository.findLastFailure()
            .filter(failure -> definition.findStep(failure.failedStep()).isPresent())
            .orElse(null);
        return new ResumeInfo(canResume, nextStep, completed, skipped, definition.size(), lastSavedAt, lastFailure);
    }
    
    /**
     * Outputs of completed checkpoints, in step order.
     */
    public Map<String, StepOutput> restoredOutputs() {
        Map<String, CheckpointRecord> checkpoints = loadCheckpoints();
        Map<String, StepOutput> outputs = new LinkedHashMap<>();
        for (String stepId : definition.stepIds()) {
            Optional.ofNullable(checkpoints.get(stepId))
                .filter(CheckpointRecord::isResumable)
                .ifPresent(record -> outputs.put(stepId, record.output()));
        }
        return outputs;
    }
    
    /**
     * Discard all saved progress.
     *
     * @return number of checkpoints deleted
     */
    public int startFresh() {
        int deleted = checkpointRepository.deleteAll();
        log.info("Cleared {} checkpoint(s) for workflow {}", deleted, definition.name());
        return deleted;
    }
    
    private Map<String, CheckpointRecord> loadCheckpoints() {
        return checkpointRepository.findAll().stream()
            .filter(record -> definition.findStep(record.stepId()).isPresent())
            .collect(Collectors.toMap(CheckpointRecord::stepId, Function.identity(), (a, b) -> b));
    }
}
