package com.genflow.quality;

import com.genflow.core.generation.GenerationException;
import com.genflow.quality.model.ReviewFinding;

import java.util.List;

/**
 * Critical review of content, returning every problem found.
 */
@FunctionalInterface
public interface ContentReviewer {
    
    List<ReviewFinding> review(String content, String contentType) throws GenerationException;
}
