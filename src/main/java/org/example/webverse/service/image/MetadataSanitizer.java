package org.example.webverse.service.image;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattens metadata into single-line text values that can travel in a response header.
 */
@Component
public class MetadataSanitizer {

    private static final Logger log = LoggerFactory.getLogger(MetadataSanitizer.class);

    static final int MAX_VALUE_LENGTH = 1000;
    static final String TRUNCATION_MARKER = "...";

    private final ObjectMapper objectMapper;

    public MetadataSanitizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Null values are dropped, structured values become compact JSON, line
     * breaks become spaces, and values left empty after trimming are dropped.
     * Values longer than {@value #MAX_VALUE_LENGTH} characters are cut short
     * and end with {@value #TRUNCATION_MARKER}.
     */
    public Map<String, String> sanitize(Map<String, ?> metadata) {
        Map<String, String> sanitized = new LinkedHashMap<>();
        if (metadata == null) {
            return sanitized;
        }
        metadata.forEach((key, value) -> {
            if (key == null || value == null) {
                return;
            }
            String text = toText(value).replace('\r', ' ').replace('\n', ' ').trim();
            if (!text.isEmpty()) {
                sanitized.put(key, cap(text));
            }
        });
        return sanitized;
    }

    private static String cap(String text) {
        if (text.length() <= MAX_VALUE_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_VALUE_LENGTH - TRUNCATION_MARKER.length()) + TRUNCATION_MARKER;
    }

    private String toText(Object value) {
        if (value instanceof JsonNode node) {
            return node.isValueNode() ? node.asText() : node.toString();
        }
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("Metadata value of type {} is not serializable as JSON", value.getClass().getSimpleName());
            return String.valueOf(value);
        }
    }
}
