package com.genflow.quality;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.genflow.core.generation.GenerationException;
import com.genflow.core.generation.StepContext;
import com.genflow.core.generation.StepGenerator;
import com.genflow.core.model.StepOutput;
import com.genflow.quality.model.QualityGateConfig;
import com.genflow.quality.model.QualityGateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Set;
import java.util.function.Function;

/**
 * Step generator that passes its delegate's output through a {@link QualityGate}.
 *
 * <p>The step output carries the gated content and a {@code quality} metadata object:
 * <pre>
 * {"quality": {"passed": true, "score": 72, "grade": "C", "minimumRequired": 70,
 *              "attempts": 1, "issues": [], "improvements": ["..."]}}
 * </pre>
 * A failing gate is recorded there and does not fail the step. Steps for which the
 * config function returns null are passed through untouched.
 */
public class QualityGateStepGenerator implements StepGenerator {
    
    private static final Logger log = LoggerFactory.getLogger(QualityGateStepGenerator.class);
    
    public static final String METADATA_FIELD = "quality";
    
    private final StepGenerator delegate;
    private final QualityGate gate;
    private final Function<String, QualityGateConfig> configForStep;
    
    /**
     * @param configForStep gate config per step id, null for steps without a gate
     */
    public QualityGateStepGenerator(StepGenerator delegate, QualityGate gate,
                                    Function<String, QualityGateConfig> configForStep) {
        this.delegate = delegate;
        this.gate = gate;
        this.configForStep = configForStep;
    }
    
    /**
     * Gate only the listed steps, each with the defaults for its step id.
     */
    public static QualityGateStepGenerator forSteps(StepGenerator delegate, QualityGate gate, String... stepIds) {
        Set<String> gated = Set.copyOf(Arrays.asList(stepIds));
        return new QualityGateStepGenerator(delegate, gate,
            stepId -> gated.contains(stepId) ? QualityGateConfig.forContentType(stepId) : null);
    }
    
    @Override
    public StepOutput generate(StepContext context) throws GenerationException {
        StepOutput output = delegate.generate(context);
        QualityGateConfig config = output == null ? null : configForStep.apply(context.getStepId());
        if (config == null) {
            return output;
        }
        
        QualityGateResult result = gate.runGate(output.content(), context.getStepId(), config);
        if (!result.passed()) {
            log.warn("Step {} kept below quality threshold: {} < {}",
                context.getStepId(), result.score().overall(), result.minimumRequired());
        }
        return new StepOutput(result.content(), output.files(), output.metadata())
            .withMetadata(METADATA_FIELD, toMetadata(result));
    }
    
    static ObjectNode toMetadata(QualityGateResult result) {
        ObjectNode quality = JsonNodeFactory.instance.objectNode()
            .put("passed", result.passed())
            .put("score", result.score().overall())
            .put("grade", result.score().grade().name())
            .put("minimumRequired", result.minimumRequired())
            .put("attempts", result.attempts());
        ArrayNode issues = quality.putArray("issues");
        result.issues().forEach(issues::add);
        ArrayNode improvements = quality.putArray("improvements");
        result.improvements().forEach(improvements::add);
        if (result.hasError()) {
            quality.put("error", result.errorMessage());
        }
        return quality;
    }
}
