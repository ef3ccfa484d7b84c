package org.example.webverse.service.llm;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Options for text generation requests.
 *
 * @param responseSchema JSON schema the response should follow, or null for free text
 * @param systemInstruction instruction sent separately from the prompt, or null
 */
public record LlmOptions(
    double temperature,
    Double topP,        // nullable
    Integer maxTokens,  // nullable
    JsonNode responseSchema,
    String systemInstruction
) {
    /**
     * Create options asking for a JSON object that matches {@code schema}.
     */
    public static LlmOptions structured(double temp, JsonNode schema, String systemInstruction) {
        return new LlmOptions(temp, null, null, schema, systemInstruction);
    }

    public boolean wantsJson() {
        return responseSchema != null;
    }
}
