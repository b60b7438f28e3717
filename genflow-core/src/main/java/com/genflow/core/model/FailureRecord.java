package com.genflow.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.genflow.core.exception.GenflowException;
import com.genflow.core.generation.GenerationException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot written when a run stops on a failing step.
 * At most one exists per project; a later successful run removes it.
 *
 * @param errorCode    generation error kind, engine error code, or the exception class name
 * @param attempts     generation attempts made for the failed step, 0 when unknown
 * @param stepStatuses status of every step when the run stopped, in step order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FailureRecord(
    int schemaVersion,
    String workflowName,
    String failedStep,
    String errorCode,
    String message,
    int attempts,
    Instant occurredAt,
    Map<String, StepStatus> stepStatuses
) {
    public static final int CURRENT_SCHEMA_VERSION = 1;

    public FailureRecord {
        stepStatuses = stepStatuses == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(stepStatuses));
    }

    public static FailureRecord of(String workflowName, String failedStep, Throwable error, int attempts,
                                   Instant occurredAt, Map<String, StepStatus> stepStatuses) {
        return new FailureRecord(CURRENT_SCHEMA_VERSION, workflowName, failedStep, errorCodeOf(error),
            error == null ? null : error.getMessage(), attempts, occurredAt, stepStatuses);
    }

    public static String errorCodeOf(Throwable error) {
        if (error == null) {
            return "UNKNOWN";
        }
        if (error instanceof GenerationException generation) {
            return generation.getKind().name();
        }
        if (error instanceof GenflowException genflow) {
            return genflow.getErrorCode();
        }
        return error.getClass().getSimpleName();
    }
}
