package org.example.webverse.service.host;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * What a stage emitted: either a JSON body or binary content with metadata.
 */
public record StageEmission(
        String contentType,
        JsonNode json,
        byte[] binary,
        Map<String, String> metadata
) {
    public static final String JSON_CONTENT_TYPE = "application/json";

    public StageEmission {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static StageEmission json(JsonNode body) {
        return new StageEmission(JSON_CONTENT_TYPE, body, null, Map.of());
    }

    public static StageEmission binary(byte[] bytes, String mimeType, Map<String, String> metadata) {
        return new StageEmission(mimeType, null, bytes, metadata);
    }

    public boolean isBinary() {
        return binary != null;
    }
}
