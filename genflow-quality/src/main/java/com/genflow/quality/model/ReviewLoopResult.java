package com.genflow.quality.model;

import java.util.List;

/**
 * Outcome of a review-and-fix loop.
 *
 * @param finalContent content after the last fix
 * @param allFindings  findings of every iteration, in order
 * @param iterations   reviews performed
 * @param resolved     the last review had no critical or major finding
 * @param errorMessage why the loop stopped early, null otherwise
 */
public record ReviewLoopResult(
    String finalContent,
    List<ReviewFinding> allFindings,
    int iterations,
    boolean resolved,
    String errorMessage
) {
    public ReviewLoopResult {
        allFindings = allFindings == null ? List.of() : List.copyOf(allFindings);
    }
    
    public long count(Severity severity) {
        return allFindings.stream().filter(f -> f.severity() == severity).count();
    }
}
