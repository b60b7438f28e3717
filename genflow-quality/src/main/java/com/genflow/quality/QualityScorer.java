package com.genflow.quality;

import com.genflow.core.generation.GenerationException;
import com.genflow.quality.model.QualityScore;

/**
 * Scores content of a given type.
 */
@FunctionalInterface
public interface QualityScorer {
    
    QualityScore score(String content, String contentType) throws GenerationException;
}
