package org.example.webverse.service.llm;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Rendering capability: turns a prompt into the service's raw response, which
 * somewhere inside carries the image bytes.
 */
public interface ImageRenderProvider {

    /**
     * @throws GenerationException when the call fails or times out
     */
    JsonNode render(String prompt);

    String getModelName();

    boolean isAvailable();
}
