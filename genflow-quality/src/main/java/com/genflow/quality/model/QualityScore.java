package com.genflow.quality.model;

import java.util.List;

/**
 * Overall 0-100 score of a piece of content, its grade and per-category breakdown.
 */
public record QualityScore(
    int overall,
    Grade grade,
    List<QualityCategory> categories,
    String summary
) {
    public static final int FALLBACK_SCORE = 70;
    
    public QualityScore {
        if (overall < 0 || overall > 100) {
            throw new IllegalArgumentException("overall must be between 0 and 100, got " + overall);
        }
        if (grade == null) {
            grade = Grade.forScore(overall);
        }
        categories = categories == null ? List.of() : List.copyOf(categories);
        summary = summary == null ? "" : summary;
    }
    
    public static QualityScore of(int overall, List<QualityCategory> categories, String summary) {
        return new QualityScore(overall, Grade.forScore(overall), categories, summary);
    }
    
    public static QualityScore of(int overall, QualityCategory... categories) {
        return of(overall, List.of(categories), "");
    }
    
    /**
     * Neutral score used when an evaluation reply cannot be interpreted.
     */
    public static QualityScore fallback() {
        return new QualityScore(FALLBACK_SCORE, Grade.C, List.of(), "Evaluation could not be completed");
    }
    
    /**
     * Placeholder for content that could not be scored at all.
     */
    public static QualityScore unavailable(String reason) {
        return new QualityScore(0, Grade.F, List.of(), reason);
    }
    
    /**
     * Issues of the categories below the fix threshold, in category order.
     */
    public List<String> issuesToFix() {
        return categories.stream()
            .filter(QualityCategory::needsFix)
            .flatMap(c -> c.issues().stream())
            .toList();
    }
    
    public List<String> allIssues() {
        return categories.stream()
            .flatMap(c -> c.issues().stream())
            .toList();
    }
}
