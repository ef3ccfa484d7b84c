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

/**
 * LLM provider for a local Ollama server, using the /api/chat endpoint.
 * Structured requests pass the JSON schema through Ollama's {@code format} field.
 */
public class OllamaLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OllamaLlmProvider.class);

    private final WebClient webClient;
    private final String model;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OllamaLlmProvider(String baseUrl, String model, int timeoutSeconds) {
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .build();
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
        log.info("Ollama LLM provider initialized: baseUrl={}, model={}", baseUrl, model);
    }

    @Override
    public String generate(String prompt, LlmOptions options) {
        ObjectNode request = buildRequest(prompt, options);
        try {
            String response = webClient.post()
                    .uri("/api/chat")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(objectMapper.writeValueAsString(request))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();

            return extractContent(objectMapper.readTree(response));
        } catch (WebClientResponseException e) {
            log.error("Ollama API error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new GenerationException(getProviderName(), "Ollama API error: " + e.getStatusCode(), e);
        } catch (Exception e) {
            log.error("Failed to generate response from Ollama model {}", model, e);
            throw new GenerationException(getProviderName(), "Failed to generate response from Ollama", e);
        }
    }

    ObjectNode buildRequest(String prompt, LlmOptions options) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", model);
        request.put("stream", false);

        ArrayNode messages = request.putArray("messages");
        if (options.systemInstruction() != null && !options.systemInstruction().isBlank()) {
            messages.addObject().put("role", "system").put("content", options.systemInstruction());
        }
        messages.addObject().put("role", "user").put("content", prompt);

        ObjectNode modelOptions = request.putObject("options");
        modelOptions.put("temperature", options.temperature());
        if (options.topP() != null) {
            modelOptions.put("top_p", options.topP());
        }
        if (options.maxTokens() != null) {
            modelOptions.put("num_predict", options.maxTokens());
        }
        if (options.wantsJson()) {
            request.set("format", options.responseSchema());
        }
        return request;
    }

    static String extractContent(JsonNode response) {
        if (response == null) {
            return "";
        }
        return response.path("message").path("content").asText("");
    }

    @Override
    public boolean isAvailable() {
        try {
            webClient.get()
                    .uri("/api/tags")
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(2));
            return true;
        } catch (Exception e) {
            log.debug("Ollama not available: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getProviderName() {
        return "ollama";
    }
}
