package com.genflow.core.generation;

/**
 * The external text-generation backend.
 * Calls may fail with transient or permanent errors; callers decide about retries.
 */
@FunctionalInterface
public interface GenerationClient {
    
    /**
     * Generate text for a prompt.
     * 
     * @param prompt The prompt
     * @param options Backend options
     * @return The generated text
     * @throws GenerationException if the backend call fails
     */
    String generate(String prompt, GenerationOptions options) throws GenerationException;
    
    default String generate(String prompt) throws GenerationException {
        return generate(prompt, GenerationOptions.defaults());
    }
}
