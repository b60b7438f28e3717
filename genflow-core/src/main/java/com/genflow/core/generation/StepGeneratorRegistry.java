package com.genflow.core.generation;

import com.genflow.core.exception.NotFoundException;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps step ids to the generators that produce them.
 *
 * <p>Usage:
 * <pre>
 * StepGeneratorRegistry registry = new StepGeneratorRegistry();
 * registry.register("prd", context -> StepOutput.of(client.generate(prdPrompt(context))));
 * registry.setDefault(context -> StepOutput.of(client.generate(genericPrompt(context))));
 * </pre>
 */
public class StepGeneratorRegistry {
    
    private final Map<String, StepGenerator> generators = new ConcurrentHashMap<>();
    private volatile StepGenerator defaultGenerator;
    
    /**
     * Register the generator for a step id, replacing any previous one.
     */
    public StepGeneratorRegistry register(String stepId, StepGenerator generator) {
        generators.put(stepId, generator);
        return this;
    }
    
    /**
     * Generator used for steps without a dedicated registration.
     */
    public StepGeneratorRegistry setDefault(StepGenerator generator) {
        this.defaultGenerator = generator;
        return this;
    }
    
    public Optional<StepGenerator> find(String stepId) {
        StepGenerator generator = generators.get(stepId);
        return Optional.ofNullable(generator != null ? generator : defaultGenerator);
    }
    
    /**
     * @throws NotFoundException if neither a dedicated nor a default generator exists
     */
    public StepGenerator resolve(String stepId) {
        return find(stepId).orElseThrow(() -> new NotFoundException("StepGenerator", stepId));
    }
    
    public Set<String> registeredSteps() {
        return Set.copyOf(generators.keySet());
    }
}
