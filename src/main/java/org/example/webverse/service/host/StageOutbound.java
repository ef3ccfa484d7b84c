package org.example.webverse.service.host;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Write side of a stage request. A stage emits exactly one response.
 */
public interface StageOutbound {

    void emit(JsonNode body);

    void emitBinary(byte[] bytes, String mimeType, Map<String, String> metadata);
}
