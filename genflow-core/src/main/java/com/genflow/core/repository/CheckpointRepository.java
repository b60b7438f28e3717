package com.genflow.core.repository;

import com.genflow.core.model.CheckpointRecord;
import com.genflow.core.model.FailureRecord;

import java.util.List;
import java.util.Optional;

/**
 * Repository for per-step checkpoints. One record per step id.
 */
public interface CheckpointRepository {

    /**
     * Save a checkpoint, replacing any existing record for the same step.
     *
     * @param record The checkpoint to save
     * @throws com.genflow.core.exception.CheckpointException if the record cannot be written
     */
    void save(CheckpointRecord record);

    /**
     * Find the checkpoint for a step.
     * Unreadable records are reported as absent.
     *
     * @param stepId The step id
     * @return The checkpoint if present and readable
     */
    Optional<CheckpointRecord> findByStepId(String stepId);

    /**
     * Find all readable checkpoints.
     *
     * @return Checkpoints ordered by savedAt
     */
    List<CheckpointRecord> findAll();

    /**
     * Delete the checkpoint for a step, if any.
     *
     * @return true if a checkpoint was deleted
     */
    boolean delete(String stepId);

    /**
     * Delete every checkpoint and the failure record.
     *
     * @return number of checkpoints deleted
     */
    int deleteAll();

    /**
     * Save the failure of the last run, replacing any earlier one.
     *
     * @throws com.genflow.core.exception.CheckpointException if the record cannot be written
     */
    void saveFailure(FailureRecord record);

    /**
     * The failure of the last run, if it stopped on a failing step.
     * An unreadable record is reported as absent.
     */
    Optional<FailureRecord> findLastFailure();

    /**
     * Remove the failure record.
     *
     * @return true if a record was removed
     */
    boolean clearFailure();
}
