package com.genflow.quality.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genflow.core.generation.GenerationClient;
import com.genflow.core.generation.GenerationException;
import com.genflow.core.generation.GenerationOptions;
import com.genflow.quality.QualityScorer;
import com.genflow.quality.model.Grade;
import com.genflow.quality.model.QualityCategory;
import com.genflow.quality.model.QualityScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Scorer asking the generation backend for a JSON evaluation.
 *
 * <p>The reply must contain an object with {@code overall}, {@code grade},
 * {@code categories[]} and {@code summary}. Scores are clamped to 0-100 and a
 * missing or unknown grade is derived from the score. An unparseable reply
 * yields {@link QualityScore#fallback()}; backend failures propagate.
 */
public class JsonQualityScorer implements QualityScorer {
    
    private static final Logger log = LoggerFactory.getLogger(JsonQualityScorer.class);
    private static final int MAX_CONTENT_CHARS = 5000;
    private static final String SYSTEM_PROMPT =
        "You are a strict reviewer. Score the document from 0 to 100 and list issues and suggestions per category.";
    
    private final GenerationClient client;
    private final ObjectMapper objectMapper;
    
    public JsonQualityScorer(GenerationClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }
    
    @Override
    public QualityScore score(String content, String contentType) throws GenerationException {
        String reply = client.generate(prompt(content, contentType), GenerationOptions.withSystemPrompt(SYSTEM_PROMPT));
        Optional<JsonNode> json = JsonReplies.extractObject(objectMapper, reply, "overall");
        if (json.isEmpty() || !json.get().get("overall").isNumber()) {
            log.warn("Unparseable quality evaluation for {}, using fallback score", contentType);
            return QualityScore.fallback();
        }
        return toScore(json.get());
    }
    
    String prompt(String content, String contentType) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Content type: ").append(contentType).append("\n\n");
        prompt.append("Content:\n").append(JsonReplies.truncate(content, MAX_CONTENT_CHARS)).append("\n\n");
        prompt.append("Score each category from 0 to ").append(maxPerCategory(contentType)).append(":\n");
        for (String category : categoriesFor(contentType)) {
            prompt.append("- ").append(category).append('\n');
        }
        prompt.append("\nReply with JSON only:\n")
            .append("{\"overall\": 0-100, \"grade\": \"A|B|C|D|F\", ")
            .append("\"categories\": [{\"name\": \"...\", \"score\": 0, \"maxScore\": 0, ")
            .append("\"issues\": [\"...\"], \"suggestions\": [\"...\"]}], \"summary\": \"...\"}");
        return prompt.toString();
    }
    
    static List<String> categoriesFor(String contentType) {
        String type = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (type.contains("architecture")) {
            return List.of("Scalability", "Security", "Maintainability", "Performance", "Modularity");
        }
        if (type.contains("story") || type.contains("stories")) {
            return List.of("Independent", "Negotiable", "Valuable", "Estimable", "Small", "Testable");
        }
        return List.of("Completeness", "Clarity", "Measurability", "Consistency", "Feasibility");
    }
    
    private static int maxPerCategory(String contentType) {
        return 100 / categoriesFor(contentType).size();
    }
    
    private QualityScore toScore(JsonNode json) {
        int overall = clamp(json.get("overall").asInt());
        Grade grade = Grade.parse(json.path("grade").asText(null));
        List<QualityCategory> categories = new ArrayList<>();
        for (JsonNode category : json.path("categories")) {
            categories.add(new QualityCategory(
                category.path("name").asText("Unnamed"),
                category.path("score").asInt(0),
                category.path("maxScore").asInt(0),
                texts(category.path("issues")),
                texts(category.path("suggestions"))));
        }
        return new QualityScore(overall, grade, categories, json.path("summary").asText(""));
    }
    
    private static List<String> texts(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : array) {
            if (item.isValueNode() && !item.asText().isBlank()) {
                values.add(item.asText().trim());
            }
        }
        return values;
    }
    
    private static int clamp(int score) {
        return Math.max(0, Math.min(100, score));
    }
}
