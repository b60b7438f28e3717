package com.genflow.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Artifact produced by a step: the generated text plus free-form metadata.
 *
 * @param content  generated content, never null
 * @param files    paths of files written alongside the content, relative to the project
 * @param metadata opaque JSON object, never null
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record StepOutput(String content, List<String> files, JsonNode metadata) {

    public StepOutput {
        content = content == null ? "" : content;
        files = files == null ? List.of() : List.copyOf(files);
        metadata = metadata == null ? JsonNodeFactory.instance.objectNode() : metadata;
    }

    public static StepOutput of(String content) {
        return new StepOutput(content, List.of(), null);
    }

    public static StepOutput of(String content, JsonNode metadata) {
        return new StepOutput(content, List.of(), metadata);
    }

    /**
     * Copy of this output with one extra metadata field.
     */
    public StepOutput withMetadata(String field, JsonNode value) {
        ObjectNode copy = metadata.isObject()
            ? ((ObjectNode) metadata).deepCopy()
            : JsonNodeFactory.instance.objectNode();
        copy.set(field, value);
        return new StepOutput(content, files, copy);
    }
}
