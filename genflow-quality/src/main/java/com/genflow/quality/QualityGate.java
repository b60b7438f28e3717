package com.genflow.quality;

import com.genflow.core.generation.GenerationException;
import com.genflow.quality.model.FixResult;
import com.genflow.quality.model.QualityGateConfig;
import com.genflow.quality.model.QualityGateResult;
import com.genflow.quality.model.QualityScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores content and, while it is below the threshold, runs bounded auto-fix passes.
 *
 * <p>The first scoring is free; each auto-fix pass (fix then re-score) counts as one
 * attempt, and at most {@link QualityGateConfig#maxRetries()} are made. The gate
 * always terminates with a result: a failing gate, or a scorer or fixer error, is
 * reported in the result and never thrown. The returned content is the best-scoring
 * version seen.
 */
public class QualityGate {
    
    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);
    
    private final QualityScorer scorer;
    private final ContentFixer fixer;
    
    public QualityGate(QualityScorer scorer, ContentFixer fixer) {
        this.scorer = scorer;
        this.fixer = fixer;
    }
    
    /**
     * Run the gate with the defaults for the content type.
     */
    public QualityGateResult runGate(String content, String contentType) {
        return runGate(content, contentType, QualityGateConfig.forContentType(contentType));
    }
    
    public QualityGateResult runGate(String content, String contentType, QualityGateConfig config) {
        int minimum = config.minScore();
        QualityScore score;
        try {
            score = scorer.score(content, contentType);
        } catch (GenerationException e) {
            log.warn("Quality gate for {} could not score content: {}", contentType, e.getMessage());
            return new QualityGateResult(false, QualityScore.unavailable(e.getMessage()), minimum, 0,
                List.of(), List.of(), content, e.getMessage());
        }
        log.info("Quality gate for {}: score {} ({}), minimum {}", contentType, score.overall(), score.grade(), minimum);
        
        String current = content;
        String best = content;
        QualityScore bestScore = score;
        List<String> improvements = new ArrayList<>();
        int attempts = 0;
        String error = null;
        
        while (score.overall() < minimum && config.autoFix() && attempts < config.maxRetries()) {
            attempts++;
            List<String> issues = issuesFor(score, minimum);
            log.info("Auto-fix pass {}/{} for {} with {} issue(s)", attempts, config.maxRetries(), contentType, issues.size());
            try {
                FixResult fix = fixer.fix(current, issues, contentType);
                current = fix.improvedContent();
                improvements.addAll(fix.changes());
                score = scorer.score(current, contentType);
            } catch (GenerationException e) {
                log.warn("Auto-fix pass {} for {} failed: {}", attempts, contentType, e.getMessage());
                error = e.getMessage();
                break;
            }
            log.info("Score after pass {}: {} ({})", attempts, score.overall(), score.grade());
            if (score.overall() > bestScore.overall()) {
                best = current;
                bestScore = score;
            }
        }
        
        boolean passed = bestScore.overall() >= minimum;
        if (passed) {
            log.info("Quality gate for {} passed with {} after {} fix pass(es)", contentType, bestScore.overall(), attempts);
        } else {
            log.warn("Quality gate for {} failed: best score {} < {} after {} fix pass(es)",
                contentType, bestScore.overall(), minimum, attempts);
        }
        return new QualityGateResult(passed, bestScore, minimum, attempts,
            passed ? List.of() : issuesFor(bestScore, minimum), improvements, best, error);
    }
    
    private List<String> issuesFor(QualityScore score, int minimum) {
        List<String> issues = score.issuesToFix();
        if (issues.isEmpty()) {
            issues = score.allIssues();
        }
        if (issues.isEmpty()) {
            issues = List.of(String.format("Overall quality score %d is below the required %d", score.overall(), minimum));
        }
        return issues;
    }
}
