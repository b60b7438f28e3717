package com.genflow.quality.model;

import java.util.List;

/**
 * Outcome of a quality gate.
 *
 * @param passed          best score reached the minimum
 * @param score           best score obtained
 * @param minimumRequired threshold in effect
 * @param attempts        auto-fix passes performed
 * @param issues          open issues of the best score
 * @param improvements    changes reported by every fix pass
 * @param content         content with the best score
 * @param errorMessage    why scoring or fixing stopped early, null otherwise
 */
public record QualityGateResult(
    boolean passed,
    QualityScore score,
    int minimumRequired,
    int attempts,
    List<String> issues,
    List<String> improvements,
    String content,
    String errorMessage
) {
    public QualityGateResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
        improvements = improvements == null ? List.of() : List.copyOf(improvements);
    }
    
    public boolean hasError() {
        return errorMessage != null;
    }
}
