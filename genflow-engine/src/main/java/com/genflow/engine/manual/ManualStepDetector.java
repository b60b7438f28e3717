package com.genflow.engine.manual;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.genflow.core.model.StepOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Finds user-authored step outputs for steps in manual mode.
 * The output for step {@code prd} lives at {@code <outputs dir>/prd.md}.
 */
public class ManualStepDetector {
    
    private static final Logger log = LoggerFactory.getLogger(ManualStepDetector.class);
    
    private final Path projectPath;
    private final Path outputsDirectory;
    
    public ManualStepDetector(Path projectPath, Path outputsDirectory) {
        this.projectPath = projectPath;
        this.outputsDirectory = outputsDirectory;
    }
    
    /**
     * Detector for {@code <project>/<stateDir>/outputs}.
     */
    public static ManualStepDetector forProject(Path projectPath, String stateDir) {
        return new ManualStepDetector(projectPath, projectPath.resolve(stateDir).resolve("outputs"));
    }
    
    public Path outputFileFor(String stepId) {
        return outputsDirectory.resolve(stepId + ".md");
    }
    
    public boolean hasManualOutput(String stepId) {
        Path file = outputFileFor(stepId);
        try {
            return Files.isRegularFile(file) && Files.size(file) > 0;
        } catch (IOException e) {
            log.warn("Cannot inspect manual output {}: {}", file, e.getMessage());
            return false;
        }
    }
    
    /**
     * Read the manual output for a step.
     * Missing, blank or unreadable files yield empty.
     */
    public Optional<StepOutput> detect(String stepId) {
        Path file = outputFileFor(stepId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Cannot read manual output {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        if (content.isBlank()) {
            return Optional.empty();
        }
        String relative = projectPath.relativize(file).toString().replace('\\', '/');
        ObjectNode metadata = JsonNodeFactory.instance.objectNode()
            .put("source", "manual")
            .put("file", relative);
        log.info("Found manual output for step {} at {}", stepId, relative);
        return Optional.of(new StepOutput(content, List.of(relative), metadata));
    }
}
