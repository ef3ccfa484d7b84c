package org.example.webverse.service.host;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads an inbound payload as a JSON object: structured decode first, then the
 * text form parsed as JSON, then an empty object. Never fails.
 */
@Component
public class InboundPayloadReader {

    private static final Logger log = LoggerFactory.getLogger(InboundPayloadReader.class);

    private final ObjectMapper objectMapper;

    public InboundPayloadReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode read(StageInbound inbound) {
        try {
            JsonNode structured = inbound.structured();
            if (structured instanceof ObjectNode object) {
                return object;
            }
        } catch (Exception e) {
            log.debug("Request payload is not structured JSON: {}", e.getMessage());
        }

        String text;
        try {
            text = inbound.text();
        } catch (Exception e) {
            log.debug("Request payload not readable as text", e);
            return objectMapper.createObjectNode();
        }

        if (text != null && !text.isBlank()) {
            try {
                JsonNode decoded = objectMapper.readTree(text);
                if (decoded instanceof ObjectNode object) {
                    return object;
                }
                log.warn("Received JSON payload but it was not an object: {}", decoded.getNodeType());
            } catch (JsonProcessingException e) {
                log.warn("Could not parse text payload as JSON");
            }
        }
        return objectMapper.createObjectNode();
    }
}
