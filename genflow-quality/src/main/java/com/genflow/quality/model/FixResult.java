package com.genflow.quality.model;

import java.util.List;

/**
 * Revised content returned by one fix pass, with the changes it reports.
 */
public record FixResult(String improvedContent, List<String> changes) {
    
    public FixResult {
        improvedContent = improvedContent == null ? "" : improvedContent;
        changes = changes == null ? List.of() : List.copyOf(changes);
    }
    
    public static FixResult unchanged(String content) {
        return new FixResult(content, List.of());
    }
}
