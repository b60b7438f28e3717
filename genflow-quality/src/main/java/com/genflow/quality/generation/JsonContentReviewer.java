package com.genflow.quality.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genflow.core.generation.GenerationClient;
import com.genflow.core.generation.GenerationException;
import com.genflow.core.generation.GenerationOptions;
import com.genflow.quality.ContentReviewer;
import com.genflow.quality.model.ReviewFinding;
import com.genflow.quality.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Adversarial reviewer backed by the generation backend.
 * The reply must hold a {@code findings[]} array; when it cannot be read a single
 * minor finding asking for a manual review is returned.
 */
public class JsonContentReviewer implements ContentReviewer {
    
    private static final Logger log = LoggerFactory.getLogger(JsonContentReviewer.class);
    private static final int MAX_CONTENT_CHARS = 5000;
    private static final String SYSTEM_PROMPT =
        "You are a relentless critic. Find between 5 and 15 concrete problems and never report that all is fine.";
    
    private static final Map<String, String> FOCUS = Map.of(
        "prd", "ambiguous requirements, missing edge cases, contradictions, unmeasurable goals",
        "architecture", "single points of failure, scalability bottlenecks, security gaps, over- or under-engineering",
        "code", "bugs, performance problems, security holes, code smells, testability",
        "story", "INVEST violations, vague acceptance criteria, missing edge cases, dependencies"
    );
    private static final String GENERAL_FOCUS = "gaps, inconsistencies, ambiguities, risks";
    
    private final GenerationClient client;
    private final ObjectMapper objectMapper;
    
    public JsonContentReviewer(GenerationClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }
    
    @Override
    public List<ReviewFinding> review(String content, String contentType) throws GenerationException {
        String prompt = "Content:\n" + JsonReplies.truncate(content, MAX_CONTENT_CHARS) + "\n\n"
            + "Look for: " + FOCUS.getOrDefault(contentType, GENERAL_FOCUS) + "\n\n"
            + "Reply with JSON only:\n"
            + "{\"findings\": [{\"severity\": \"critical|major|minor\", \"category\": \"...\", "
            + "\"finding\": \"...\", \"impact\": \"...\", \"recommendation\": \"...\"}]}";
        String reply = client.generate(prompt, GenerationOptions.withSystemPrompt(SYSTEM_PROMPT));
        
        Optional<JsonNode> json = JsonReplies.extractObject(objectMapper, reply, "findings");
        if (json.isPresent() && json.get().get("findings").isArray()) {
            try {
                List<ReviewFinding> findings = new ArrayList<>();
                for (JsonNode node : json.get().get("findings")) {
                    ReviewFinding finding = objectMapper.treeToValue(node, ReviewFinding.class);
                    if (finding.finding() != null && !finding.finding().isBlank()) {
                        findings.add(finding);
                    }
                }
                return findings;
            } catch (JsonProcessingException e) {
                log.warn("Malformed finding in review of {}: {}", contentType, e.getOriginalMessage());
            }
        } else {
            log.warn("Unparseable review reply for {}", contentType);
        }
        return List.of(new ReviewFinding(Severity.MINOR, "General", "Review could not be completed",
            "Unknown", "Review the content manually"));
    }
}
