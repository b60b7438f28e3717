package com.genflow.quality.generation;

import com.genflow.core.generation.GenerationClient;
import com.genflow.core.generation.GenerationException;
import com.genflow.core.generation.GenerationOptions;
import com.genflow.quality.ContentFixer;
import com.genflow.quality.model.FixResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixer asking the generation backend for a revised document.
 *
 * <p>The reply is expected in two markdown sections:
 * <pre>
 * ## IMPROVED CONTENT
 * ...revised document...
 *
 * ## CHANGES
 * - change one
 * - change two
 * </pre>
 * Without an {@code IMPROVED CONTENT} section the content is returned unchanged.
 */
public class GenerationContentFixer implements ContentFixer {
    
    private static final Logger log = LoggerFactory.getLogger(GenerationContentFixer.class);
    
    static final String CONTENT_HEADING = "## IMPROVED CONTENT";
    static final String CHANGES_HEADING = "## CHANGES";
    
    private static final Pattern CONTENT_SECTION = Pattern.compile(
        Pattern.quote(CONTENT_HEADING) + "\\R(.*?)(?=" + Pattern.quote(CHANGES_HEADING) + "|\\z)", Pattern.DOTALL);
    private static final Pattern CHANGES_SECTION = Pattern.compile(
        Pattern.quote(CHANGES_HEADING) + "\\R(.*)\\z", Pattern.DOTALL);
    private static final String SYSTEM_PROMPT =
        "You improve documents. Fix the listed issues, keep the original structure and explain every change.";
    
    private final GenerationClient client;
    
    public GenerationContentFixer(GenerationClient client) {
        this.client = client;
    }
    
    @Override
    public FixResult fix(String content, List<String> issues, String contentType) throws GenerationException {
        StringBuilder prompt = new StringBuilder()
            .append("Content type: ").append(contentType).append("\n\n")
            .append("Current content:\n").append(content).append("\n\n---\n\n")
            .append("Issues to fix:\n");
        for (int i = 0; i < issues.size(); i++) {
            prompt.append(i + 1).append(". ").append(issues.get(i)).append('\n');
        }
        prompt.append("\nReply in this format:\n")
            .append(CONTENT_HEADING).append("\n[revised content]\n\n")
            .append(CHANGES_HEADING).append("\n- change 1\n- change 2\n");
        
        FixResult result = parse(client.generate(prompt.toString(), GenerationOptions.withSystemPrompt(SYSTEM_PROMPT)), content);
        log.debug("Fix for {} returned {} change(s)", contentType, result.changes().size());
        return result;
    }
    
    static FixResult parse(String reply, String original) {
        if (reply == null) {
            return FixResult.unchanged(original);
        }
        Matcher contentMatch = CONTENT_SECTION.matcher(reply);
        if (!contentMatch.find() || contentMatch.group(1).isBlank()) {
            return FixResult.unchanged(original);
        }
        String improved = contentMatch.group(1).trim();
        
        Matcher changesMatch = CHANGES_SECTION.matcher(reply);
        List<String> changes = changesMatch.find()
            ? changesMatch.group(1).lines()
                .map(String::trim)
                .filter(line -> line.startsWith("-"))
                .map(line -> line.substring(1).trim())
                .filter(line -> !line.isEmpty())
                .toList()
            : List.of();
        return new FixResult(improved, changes);
    }
}
