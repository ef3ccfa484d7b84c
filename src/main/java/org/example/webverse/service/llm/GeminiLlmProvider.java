package org.example.webverse.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * LLM provider implementation for Google Gemini.
 * Calls the /v1beta/models/{model}:generateContent endpoint.
 */
public class GeminiLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(GeminiLlmProvider.class);

    private final WebClient webClient;
    private final String model;
    private final int timeoutSeconds;
    private final String apiKey;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GeminiLlmProvider(String baseUrl, String apiKey, String model, int timeoutSeconds) {
        this.apiKey = apiKey;
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("x-goog-api-key", apiKey == null ? "" : apiKey)
                .build();
        log.info("Gemini LLM provider initialized: model={}", model);
    }

    @Override
    public String generate(String prompt, LlmOptions options) {
        if (!isAvailable()) {
            throw new GenerationException(getProviderName(), "Gemini API key not configured");
        }

        ObjectNode requestBody = objectMapper.createObjectNode();
        ArrayNode parts = requestBody.putArray("contents").addObject()
                .put("role", "user")
                .putArray("parts");
        parts.addObject().put("text", prompt);

        if (options.systemInstruction() != null && !options.systemInstruction().isBlank()) {
            requestBody.putObject("systemInstruction")
                    .putArray("parts")
                    .addObject()
                    .put("text", options.systemInstruction());
        }

        ObjectNode generationConfig = requestBody.putObject("generationConfig");
        generationConfig.put("temperature", options.temperature());
        if (options.topP() != null) {
            generationConfig.put("topP", options.topP());
        }
        if (options.maxTokens() != null) {
            generationConfig.put("maxOutputTokens", options.maxTokens());
        }
        if (options.wantsJson()) {
            generationConfig.put("responseMimeType", "application/json");
            generationConfig.set("responseSchema", options.responseSchema());
        }

        try {
            String response = webClient.post()
                    .uri("/v1beta/models/{model}:generateContent", model)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(objectMapper.writeValueAsString(requestBody))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();

            return extractText(objectMapper.readTree(response));

        } catch (WebClientResponseException e) {
            log.error("Gemini API error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new GenerationException(getProviderName(), "Gemini API error: " + e.getStatusCode(), e);
        } catch (Exception e) {
            log.error("Failed to generate response from Gemini", e);
            throw new GenerationException(getProviderName(), "Failed to generate response from Gemini", e);
        }
    }

    /**
     * Joins the text parts of every candidate. Returns an empty string when
     * the response carries no text at all.
     */
    static String extractText(JsonNode response) {
        if (response == null) {
            return "";
        }
        List<String> fragments = new ArrayList<>();
        for (JsonNode candidate : response.path("candidates")) {
            for (JsonNode part : candidate.path("content").path("parts")) {
                JsonNode text = part.get("text");
                if (text != null && text.isTextual() && !text.asText().isEmpty()) {
                    fragments.add(text.asText());
                }
            }
        }
        return String.join("\n", fragments);
    }

    @Override
    public boolean isAvailable() {
        if (apiKey == null || apiKey.isBlank()) {
            log.debug("Gemini not available: API key not configured");
            return false;
        }
        return true;
    }

    @Override
    public String getProviderName() {
        return "gemini";
    }
}
