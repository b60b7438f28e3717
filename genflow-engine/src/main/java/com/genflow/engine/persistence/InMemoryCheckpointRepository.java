package com.genflow.engine.persistence;

import com.genflow.core.model.CheckpointRecord;
import com.genflow.core.model.FailureRecord;
import com.genflow.core.repository.CheckpointRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * In-memory implementation of CheckpointRepository.
 * For tests and runs that do not need to survive the process.
 */
public class InMemoryCheckpointRepository implements CheckpointRepository {
    
    private final Map<String, CheckpointRecord> checkpoints = new ConcurrentHashMap<>();
    private final AtomicReference<FailureRecord> lastFailure = new AtomicReference<>();
    
    @Override
    public void save(CheckpointRecord record) {
        checkpoints.put(record.stepId(), record);
    }
    
    @Override
    public Optional<CheckpointRecord> findByStepId(String stepId) {
        return Optional.ofNullable(checkpoints.get(stepId));
    }
    
    @Override
    public List<CheckpointRecord> findAll() {
        return checkpoints.values().stream()
            .sorted(Comparator.comparing(CheckpointRecord::savedAt))
            .collect(Collectors.toList());
    }
    
    @Override
    public boolean delete(String stepId) {
        return checkpoints.remove(stepId) != null;
    }
    
    @Override
    public int deleteAll() {
        int count = checkpoints.size();
        checkpoints.clear();
        lastFailure.set(null);
        return count;
    }
    
    @Override
    public void saveFailure(FailureRecord record) {
        lastFailure.set(record);
    }
    
    @Override
    public Optional<FailureRecord> findLastFailure() {
        return Optional.ofNullable(lastFailure.get());
    }
    
    @Override
    public boolean clearFailure() {
        return lastFailure.getAndSet(null) != null;
    }
}
