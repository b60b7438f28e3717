package com.genflow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Persisted result of one step, one record per step id.
 * Written after a step completes or is skipped; overwritten when the step reruns.
 *
 * Invariants:
 * - status is COMPLETED or SKIPPED
 * - output is present for COMPLETED records
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CheckpointRecord(
    int schemaVersion,
    String stepId,
    StepStatus status,
    AutomationMode automationMode,
    Instant startedAt,
    Instant savedAt,
    Long durationMs,
    StepOutput output
) {
    public static final int CURRENT_SCHEMA_VERSION = 1;

    public static CheckpointRecord completed(String stepId, AutomationMode mode, Instant startedAt,
                                             Instant savedAt, StepOutput output) {
        Long duration = startedAt == null ? null : savedAt.toEpochMilli() - startedAt.toEpochMilli();
        return new CheckpointRecord(CURRENT_SCHEMA_VERSION, stepId, StepStatus.COMPLETED,
            mode, startedAt, savedAt, duration, output);
    }

    public static CheckpointRecord skipped(String stepId, Instant savedAt) {
        return new CheckpointRecord(CURRENT_SCHEMA_VERSION, stepId, StepStatus.SKIPPED,
            AutomationMode.SKIP, null, savedAt, null, null);
    }

    /**
     * A completed record with output can be replayed without re-generation.
     */
    @JsonIgnore
    public boolean isResumable() {
        return status == StepStatus.COMPLETED && output != null;
    }

    @JsonIgnore
    public boolean isSkipped() {
        return status == StepStatus.SKIPPED;
    }
}
