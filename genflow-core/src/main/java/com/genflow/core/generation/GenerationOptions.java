package com.genflow.core.generation;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Per-call options passed through to the generation backend.
 * All fields are optional; null means "backend default".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerationOptions(
    String systemPrompt,
    Integer maxTokens,
    Double temperature
) {
    public static GenerationOptions defaults() {
        return new GenerationOptions(null, null, null);
    }

    public static GenerationOptions withSystemPrompt(String systemPrompt) {
        return new GenerationOptions(systemPrompt, null, null);
    }
}
