package org.example.webverse.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Serialized outcome of one stage invocation as seen by the director.
 */
public record StageResult(
        String stage,
        String contentType,
        Map<String, String> metadata,
        JsonNode body
) {
    public StageResult {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean hasObjectBody() {
        return body != null && body.isObject();
    }
}
