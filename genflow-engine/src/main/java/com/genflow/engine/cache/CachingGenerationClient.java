package com.genflow.engine.cache;

import com.genflow.core.generation.GenerationClient;
import com.genflow.core.generation.GenerationException;
import com.genflow.core.generation.GenerationOptions;

import java.time.Duration;

/**
 * Generation client that answers repeated (prompt, options) pairs from a {@link GenerationCache}.
 * Failures are not cached.
 */
public class CachingGenerationClient implements GenerationClient {
    
    private static final String NAMESPACE = "generation";
    
    private final GenerationClient delegate;
    private final GenerationCache cache;
    private final Duration ttl;
    
    /**
     * @param ttl TTL for cached responses, null for the cache default
     */
    public CachingGenerationClient(GenerationClient delegate, GenerationCache cache, Duration ttl) {
        this.delegate = delegate;
        this.cache = cache;
        this.ttl = ttl;
    }
    
    @Override
    public String generate(String prompt, GenerationOptions options) throws GenerationException {
        GenerationOptions effective = options == null ? GenerationOptions.defaults() : options;
        String key = CacheKeys.generate(NAMESPACE, prompt, effective);
        return cache.getOrCompute(key, String.class, ttl, () -> delegate.generate(prompt, effective));
    }
}
