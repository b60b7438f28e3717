package com.genflow.quality.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Pulls the JSON object out of a free-text generation reply.
 */
final class JsonReplies {
    
    private static final Logger log = LoggerFactory.getLogger(JsonReplies.class);
    
    private JsonReplies() {
    }
    
    /**
     * The span from the first '{' to the last '}', parsed, when it is an object
     * containing {@code requiredField}.
     */
    static Optional<JsonNode> extractObject(ObjectMapper objectMapper, String reply, String requiredField) {
        if (reply == null) {
            return Optional.empty();
        }
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        try {
            JsonNode json = objectMapper.readTree(reply.substring(start, end + 1));
            if (json != null && json.isObject() && json.has(requiredField)) {
                return Optional.of(json);
            }
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("Reply is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
    
    static String truncate(String content, int maxChars) {
        if (content == null) {
            return "";
        }
        return content.length() <= maxChars ? content : content.substring(0, maxChars);
    }
}
