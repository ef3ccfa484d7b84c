package org.example.webverse.service.coercion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns raw model output into a JSON object, tolerating code fences and prose
 * around the object.
 */
@Component
public class ModelOutputParser {

    private static final Logger log = LoggerFactory.getLogger(ModelOutputParser.class);

    private final ObjectMapper objectMapper;

    public ModelOutputParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the parsed object, or empty when the text holds no JSON object
     */
    public Optional<ObjectNode> parseObject(String raw) {
        String cleaned = stripWrapping(raw);
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }

        try {
            JsonNode parsed = objectMapper.readTree(cleaned);
            if (parsed instanceof ObjectNode object) {
                return Optional.of(object);
            }
            log.debug("Model output parsed as {} instead of an object", parsed == null ? "nothing" : parsed.getNodeType());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("Model output is not bare JSON, looking for an embedded object");
        }

        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        try {
            JsonNode embedded = objectMapper.readTree(cleaned.substring(start, end + 1));
            return embedded instanceof ObjectNode object ? Optional.of(object) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * Remove surrounding whitespace, a leading ```json (or bare ```) fence and
     * trailing backticks.
     */
    static String stripWrapping(String raw) {
        if (raw == null) {
            return "";
        }
        String cleaned = raw.strip();
        if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
            if (cleaned.regionMatches(true, 0, "json", 0, 4)) {
                cleaned = cleaned.substring(4);
            }
        }
        int end = cleaned.length();
        while (end > 0 && cleaned.charAt(end - 1) == '`') {
            end--;
        }
        return cleaned.substring(0, end).strip();
    }
}
