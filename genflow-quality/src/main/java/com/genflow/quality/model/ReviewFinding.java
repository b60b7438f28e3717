package com.genflow.quality.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One problem raised by a content review.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReviewFinding(
    Severity severity,
    String category,
    String finding,
    String impact,
    String recommendation
) {
    public ReviewFinding {
        if (severity == null) {
            severity = Severity.MINOR;
        }
    }
    
    public static ReviewFinding of(Severity severity, String finding, String recommendation) {
        return new ReviewFinding(severity, "General", finding, null, recommendation);
    }
    
    public boolean isBlocking() {
        return severity.isBlocking();
    }
    
    /**
     * Single-line form handed to the fixer, e.g. {@code [major] No metrics: Add success metrics}.
     */
    public String describe() {
        return recommendation == null || recommendation.isBlank()
            ? String.format("[%s] %s", severity.wireValue(), finding)
            : String.format("[%s] %s: %s", severity.wireValue(), finding, recommendation);
    }
}
