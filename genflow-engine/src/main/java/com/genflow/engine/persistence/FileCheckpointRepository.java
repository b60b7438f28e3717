package com.genflow.engine.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genflow.core.exception.CheckpointException;
import com.genflow.core.model.AutomationMode;
import com.genflow.core.model.CheckpointRecord;
import com.genflow.core.model.FailureRecord;
import com.genflow.core.model.StepOutput;
import com.genflow.core.model.StepStatus;
import com.genflow.core.repository.CheckpointRepository;
import com.genflow.engine.cache.CacheKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Checkpoint repository storing one JSON file per step: {@code <dir>/<stepId>.json}.
 * Step ids that are not plain file names are stored under the SHA-256 of the id.
 * The failure of the last run lives in {@code <dir>/_last-error.json}.
 *
 * <p>Files are written to a temporary sibling and moved into place, so a reader
 * never sees a half-written checkpoint. Unreadable files, unknown schema versions
 * and unsuccessful legacy records are logged and reported as absent.
 *
 * <p>Legacy files (no {@code schemaVersion}) have the shape
 * {@code {stepId, success, executedAt, duration, output}} and are converted on read.
 */
public class FileCheckpointRepository implements CheckpointRepository {
    
    private static final Logger log = LoggerFactory.getLogger(FileCheckpointRepository.class);
    private static final Pattern SAFE_STEP_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");
    private static final String SUFFIX = ".json";
    private static final String FAILURE_FILE = "_last-error" + SUFFIX;
    
    private final Path directory;
    private final ObjectMapper objectMapper;
    
    public FileCheckpointRepository(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }
    
    public Path getDirectory() {
        return directory;
    }
    
    @Override
    public void save(CheckpointRecord record) {
        try {
            write(fileFor(record.stepId()), record);
            log.debug("Saved checkpoint {} ({})", record.stepId(), record.status().wireValue());
        } catch (IOException e) {
            throw new CheckpointException(record.stepId(), "save", e);
        }
    }
    
    @Override
    public Optional<CheckpointRecord> findByStepId(String stepId) {
        return read(fileFor(stepId));
    }
    
    @Override
    public List<CheckpointRecord> findAll() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<CheckpointRecord> records = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                if (!isFailureFile(file)) {
                    read(file).ifPresent(records::add);
                }
            }
        } catch (IOException e) {
            log.warn("Cannot list checkpoints in {}: {}", directory, e.getMessage());
            return List.of();
        }
        records.sort(Comparator.comparing(CheckpointRecord::savedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        return records;
    }
    
    @Override
    public boolean delete(String stepId) {
        try {
            return Files.deleteIfExists(fileFor(stepId));
        } catch (IOException e) {
            throw new CheckpointException(stepId, "delete", e);
        }
    }
    
    @Override
    public int deleteAll() {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        int deleted = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                if (Files.deleteIfExists(file) && !isFailureFile(file)) {
                    deleted++;
                }
            }
        } catch (IOException e) {
            throw new CheckpointException("*", "delete", e);
        }
        log.info("Deleted {} checkpoint(s) from {}", deleted, directory);
        return deleted;
    }
    
    @Override
    public void saveFailure(FailureRecord record) {
        try {
            write(directory.resolve(FAILURE_FILE), record);
            log.debug("Saved failure record for step {}", record.failedStep());
        } catch (IOException e) {
            throw new CheckpointException("Failed to save failure record for step " + record.failedStep(), e);
        }
    }
    
    @Override
    public Optional<FailureRecord> findLastFailure() {
        Path file = directory.resolve(FAILURE_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            JsonNode json = objectMapper.readTree(file.toFile());
            int version = json == null ? 0 : json.path("schemaVersion").asInt(0);
            if (version != FailureRecord.CURRENT_SCHEMA_VERSION) {
                log.warn("Ignoring failure record {}: unsupported schema version {}", file.getFileName(), version);
                return Optional.empty();
            }
            return Optional.of(objectMapper.treeToValue(json, FailureRecord.class));
        } catch (IOException | IllegalArgumentException | DateTimeException e) {
            log.warn("Ignoring unreadable failure record {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }
    
    @Override
    public boolean clearFailure() {
        try {
            return Files.deleteIfExists(directory.resolve(FAILURE_FILE));
        } catch (IOException e) {
            throw new CheckpointException("Failed to clear failure record in " + directory, e);
        }
    }
    
    private void write(Path target, Object value) throws IOException {
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, stripSuffix(target), ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), value);
            moveIntoPlace(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
    
    private Optional<CheckpointRecord> read(Path file) {
        JsonNode json;
        try {
            json = objectMapper.readTree(file.toFile());
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            log.warn("Ignoring unreadable checkpoint {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
        if (json == null || !json.isObject()) {
            log.warn("Ignoring checkpoint {}: not a JSON object", file.getFileName());
            return Optional.empty();
        }
        try {
            if (!json.has("schemaVersion")) {
                return convertLegacy(file, json);
            }
            int version = json.get("schemaVersion").asInt();
            if (version != CheckpointRecord.CURRENT_SCHEMA_VERSION) {
                log.warn("Ignoring checkpoint {}: unsupported schema version {}", file.getFileName(), version);
                return Optional.empty();
            }
            CheckpointRecord record = objectMapper.treeToValue(json, CheckpointRecord.class);
            if (record.stepId() == null || record.status() == null || record.savedAt() == null
                    || !record.status().isTerminal()) {
                log.warn("Ignoring checkpoint {}: missing or non-final fields", file.getFileName());
                return Optional.empty();
            }
            return Optional.of(record);
        } catch (IOException | IllegalArgumentException | DateTimeException e) {
            log.warn("Ignoring malformed checkpoint {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }
    
    private Optional<CheckpointRecord> convertLegacy(Path file, JsonNode json) throws IOException {
        if (!json.path("success").asBoolean(false) || !json.hasNonNull("output")) {
            log.warn("Ignoring legacy checkpoint {}: step did not succeed", file.getFileName());
            return Optional.empty();
        }
        String stepId = json.path("stepId").asText(stripSuffix(file));
        Instant executedAt = json.hasNonNull("executedAt")
            ? Instant.parse(json.get("executedAt").asText())
            : Files.getLastModifiedTime(file).toInstant();
        Long duration = json.hasNonNull("duration") ? json.get("duration").asLong() : null;
        StepOutput output = objectMapper.treeToValue(json.get("output"), StepOutput.class);
        log.debug("Converted legacy checkpoint {}", stepId);
        return Optional.of(new CheckpointRecord(CheckpointRecord.CURRENT_SCHEMA_VERSION, stepId,
            StepStatus.COMPLETED, AutomationMode.AUTO, executedAt, executedAt, duration, output));
    }
    
    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
    
    Path fileFor(String stepId) {
        if (stepId == null) {
            throw new IllegalArgumentException("Step id must not be null");
        }
        String name = SAFE_STEP_ID.matcher(stepId).matches() ? stepId : CacheKeys.sha256Hex(stepId);
        return directory.resolve(name + SUFFIX);
    }
    
    private static boolean isFailureFile(Path file) {
        return FAILURE_FILE.equals(file.getFileName().toString());
    }
    
    private static String stripSuffix(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(SUFFIX) ? name.substring(0, name.length() - SUFFIX.length()) : name;
    }
}
