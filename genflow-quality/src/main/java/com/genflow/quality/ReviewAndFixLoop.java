package com.genflow.quality;

import com.genflow.core.generation.GenerationException;
import com.genflow.quality.model.FixResult;
import com.genflow.quality.model.ReviewFinding;
import com.genflow.quality.model.ReviewLoopResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reviews content and fixes its critical and major findings until a review
 * comes back with minor findings only, or the iteration limit is reached.
 * Every finding of every review is kept for audit.
 */
public class ReviewAndFixLoop {
    
    private static final Logger log = LoggerFactory.getLogger(ReviewAndFixLoop.class);
    
    public static final int DEFAULT_MAX_ITERATIONS = 3;
    
    private final ContentReviewer reviewer;
    private final ContentFixer fixer;
    
    public ReviewAndFixLoop(ContentReviewer reviewer, ContentFixer fixer) {
        this.reviewer = reviewer;
        this.fixer = fixer;
    }
    
    public ReviewLoopResult run(String content, String contentType) {
        return run(content, contentType, DEFAULT_MAX_ITERATIONS);
    }
    
    /**
     * @param maxIterations reviews allowed; a fix only follows a review that leaves room for another
     */
    public ReviewLoopResult run(String content, String contentType, int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1");
        }
        String current = content;
        List<ReviewFinding> allFindings = new ArrayList<>();
        int iteration = 0;
        
        while (iteration < maxIterations) {
            iteration++;
            List<ReviewFinding> findings;
            try {
                findings = reviewer.review(current, contentType);
            } catch (GenerationException e) {
                log.warn("Review {}/{} of {} failed: {}", iteration, maxIterations, contentType, e.getMessage());
                return new ReviewLoopResult(current, allFindings, iteration, false, e.getMessage());
            }
            allFindings.addAll(findings);
            
            List<String> blocking = findings.stream()
                .filter(ReviewFinding::isBlocking)
                .map(ReviewFinding::describe)
                .toList();
            log.info("Review {}/{} of {}: {} finding(s), {} blocking",
                iteration, maxIterations, contentType, findings.size(), blocking.size());
            if (blocking.isEmpty()) {
                return new ReviewLoopResult(current, allFindings, iteration, true, null);
            }
            
            if (iteration < maxIterations) {
                try {
                    FixResult fix = fixer.fix(current, blocking, contentType);
                    current = fix.improvedContent();
                    log.debug("Fix after review {} reported {} change(s)", iteration, fix.changes().size());
                } catch (GenerationException e) {
                    log.warn("Fix after review {} of {} failed: {}", iteration, contentType, e.getMessage());
                    return new ReviewLoopResult(current, allFindings, iteration, false, e.getMessage());
                }
            }
        }
        
        log.warn("Review loop for {} stopped after {} iteration(s) with blocking findings left", contentType, iteration);
        return new ReviewLoopResult(current, allFindings, iteration, false, null);
    }
}
