package com.genflow.quality.model;

import java.util.Locale;
import java.util.Map;

/**
 * Threshold and auto-fix limit of a quality gate.
 *
 * @param minScore   lowest passing overall score
 * @param maxRetries auto-fix passes allowed after the first scoring
 * @param autoFix    when false the gate only scores
 */
public record QualityGateConfig(int minScore, int maxRetries, boolean autoFix) {
    
    private static final QualityGateConfig DOCUMENT = new QualityGateConfig(70, 3, true);
    private static final QualityGateConfig STORY = new QualityGateConfig(65, 2, true);
    private static final QualityGateConfig CODE_REVIEW = new QualityGateConfig(75, 3, true);
    private static final QualityGateConfig DEFAULT = new QualityGateConfig(60, 2, true);
    
    private static final Map<String, QualityGateConfig> BY_CONTENT_TYPE = Map.of(
        "prd", DOCUMENT,
        "architecture", DOCUMENT,
        "epics", DOCUMENT,
        "epics-stories", DOCUMENT,
        "story", STORY,
        "code-review", CODE_REVIEW
    );
    
    public QualityGateConfig {
        if (minScore < 0 || minScore > 100) {
            throw new IllegalArgumentException("minScore must be between 0 and 100");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
    }
    
    /**
     * Defaults per content type; a {@code create-} prefix is ignored.
     * Unknown types get 60 / 2.
     */
    public static QualityGateConfig forContentType(String contentType) {
        if (contentType == null) {
            return DEFAULT;
        }
        String key = contentType.trim().toLowerCase(Locale.ROOT);
        if (key.startsWith("create-")) {
            key = key.substring("create-".length());
        }
        return BY_CONTENT_TYPE.getOrDefault(key, DEFAULT);
    }
    
    public QualityGateConfig withMinScore(int minScore) {
        return new QualityGateConfig(minScore, maxRetries, autoFix);
    }
    
    public QualityGateConfig withoutAutoFix() {
        return new QualityGateConfig(minScore, maxRetries, false);
    }
}
