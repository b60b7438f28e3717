package com.genflow.engine.config;

import com.genflow.core.model.AutomationMode;
import com.genflow.core.model.RetryConfig;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Engine settings, usually bound from {@code genflow.properties}.
 *
 * @param stateDir              project-relative directory for checkpoints, cache and manual outputs
 * @param cacheDefaultTtl       TTL for cache entries stored without one
 * @param automationMode        initial global automation mode of new runners
 */
public record EngineProperties(
    String stateDir,
    RetryConfig retry,
    Duration cacheDefaultTtl,
    int cacheMaxMemoryEntries,
    AutomationMode automationMode
) {
    public static final String DEFAULT_STATE_DIR = ".genflow";

    public EngineProperties {
        if (stateDir == null || stateDir.isBlank()) {
            stateDir = DEFAULT_STATE_DIR;
        }
        if (retry == null) {
            retry = RetryConfig.defaultConfig();
        }
        if (automationMode == null) {
            automationMode = AutomationMode.AUTO;
        }
        if (cacheMaxMemoryEntries < 1) {
            throw new IllegalArgumentException("cacheMaxMemoryEntries must be >= 1");
        }
    }

    public static EngineProperties defaults() {
        return new EngineProperties(DEFAULT_STATE_DIR, RetryConfig.defaultConfig(),
            Duration.ofHours(1), 1000, AutomationMode.AUTO);
    }

    public EngineProperties withRetry(RetryConfig retry) {
        return new EngineProperties(stateDir, retry, cacheDefaultTtl, cacheMaxMemoryEntries, automationMode);
    }

    public Path stateDirectory(Path projectPath) {
        return projectPath.resolve(stateDir);
    }

    public Path checkpointsDirectory(Path projectPath) {
        return stateDirectory(projectPath).resolve("checkpoints");
    }

    public Path cacheDirectory(Path projectPath) {
        return stateDirectory(projectPath).resolve("cache");
    }
}
