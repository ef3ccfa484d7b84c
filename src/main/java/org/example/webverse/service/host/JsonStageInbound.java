package org.example.webverse.service.host;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Inbound side for in-process invocation, where the payload is already a JSON tree.
 */
public class JsonStageInbound implements StageInbound {

    private final JsonNode payload;
    private final ObjectMapper objectMapper;

    public JsonStageInbound(JsonNode payload, ObjectMapper objectMapper) {
        this.payload = payload == null ? objectMapper.createObjectNode() : payload;
        this.objectMapper = objectMapper;
    }

    @Override
    public JsonNode structured() {
        return payload;
    }

    @Override
    public String text() throws IOException {
        return objectMapper.writeValueAsString(payload);
    }
}
