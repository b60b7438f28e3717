package com.genflow.quality.model;

import java.util.List;

/**
 * Score of one quality dimension, with the issues that cost points.
 */
public record QualityCategory(
    String name,
    int score,
    int maxScore,
    List<String> issues,
    List<String> suggestions
) {
    /** Categories scoring below this share of their maximum are sent to the fixer. */
    public static final double FIX_THRESHOLD = 0.7;
    
    public QualityCategory {
        issues = issues == null ? List.of() : List.copyOf(issues);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
    
    public static QualityCategory of(String name, int score, int maxScore, String... issues) {
        return new QualityCategory(name, score, maxScore, List.of(issues), List.of());
    }
    
    public boolean needsFix() {
        return score < maxScore * FIX_THRESHOLD;
    }
}
