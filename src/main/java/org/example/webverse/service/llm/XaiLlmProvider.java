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
import java.util.Optional;

/**
 * LLM provider for xAI (Grok) over the OpenAI-compatible /chat/completions endpoint.
 * Schemas travel as a strict {@code json_schema} response format.
 */
public class XaiLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(XaiLlmProvider.class);

    static final String SCHEMA_NAME = "webverse_payload";

    private final WebClient webClient;
    private final String model;
    private final int timeoutSeconds;
    private final String apiKey;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public XaiLlmProvider(String baseUrl, String apiKey, String model, int timeoutSeconds) {
        this.apiKey = apiKey;
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .build();
        log.info("xAI LLM provider initialized: model={}", model);
    }

    @Override
    public String generate(String prompt, LlmOptions options) {
        if (!isAvailable()) {
            throw new GenerationException(getProviderName(), "xAI API key not configured");
        }

        String response;
        try {
            response = webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(objectMapper.writeValueAsString(buildRequest(prompt, options)))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
        } catch (WebClientResponseException e) {
            log.error("xAI API error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new GenerationException(getProviderName(), "xAI API error: " + e.getStatusCode(), e);
        } catch (Exception e) {
            log.error("Failed to generate response from xAI model {}", model, e);
            throw new GenerationException(getProviderName(), "Failed to generate response from xAI", e);
        }

        JsonNode responseNode;
        try {
            responseNode = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new GenerationException(getProviderName(), "Unreadable response from xAI API", e);
        }
        return extractContent(responseNode)
                .orElseThrow(() -> new GenerationException(getProviderName(), "Invalid response format from xAI API"));
    }

    ObjectNode buildRequest(String prompt, LlmOptions options) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", model);
        request.put("temperature", options.temperature());
        if (options.topP() != null) {
            request.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            request.put("max_tokens", options.maxTokens());
        }

        ArrayNode messages = request.putArray("messages");
        if (options.systemInstruction() != null && !options.systemInstruction().isBlank()) {
            messages.addObject().put("role", "system").put("content", options.systemInstruction());
        }
        messages.addObject().put("role", "user").put("content", prompt);

        if (options.wantsJson()) {
            ObjectNode jsonSchema = request.putObject("response_format")
                    .put("type", "json_schema")
                    .putObject("json_schema");
            jsonSchema.put("name", SCHEMA_NAME);
            jsonSchema.set("schema", options.responseSchema());
        }
        return request;
    }

    /**
     * Content of the first choice's message, if the response has one.
     */
    static Optional<String> extractContent(JsonNode response) {
        if (response == null) {
            return Optional.empty();
        }
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? Optional.of(content.asText()) : Optional.empty();
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String getProviderName() {
        return "xai";
    }
}
