package org.example.webverse.service.stage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Output-shape hints sent with structured generation requests, loaded once
 * from {@code schemas/} on the classpath.
 */
@Component
public class ResponseSchemas {

    static final String PAGE_SCHEMA = "schemas/page.schema.json";
    static final String ILLUSTRATION_SCHEMA = "schemas/illustration.schema.json";

    private final JsonNode page;
    private final JsonNode illustration;

    public ResponseSchemas(ObjectMapper objectMapper) {
        this.page = load(objectMapper, PAGE_SCHEMA);
        this.illustration = load(objectMapper, ILLUSTRATION_SCHEMA);
    }

    public JsonNode page() {
        return page;
    }

    public JsonNode illustration() {
        return illustration;
    }

    private static JsonNode load(ObjectMapper objectMapper, String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load response schema " + path, e);
        }
    }
}
