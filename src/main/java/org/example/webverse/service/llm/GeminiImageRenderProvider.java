package org.example.webverse.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * Image rendering through a Gemini image model. The raw response is returned
 * untouched; locating the inline image data is the caller's job.
 */
public class GeminiImageRenderProvider implements ImageRenderProvider {

    private static final Logger log = LoggerFactory.getLogger(GeminiImageRenderProvider.class);

    private final WebClient webClient;
    private final String model;
    private final int timeoutSeconds;
    private final String apiKey;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public GeminiImageRenderProvider(String baseUrl, String apiKey, String model, int timeoutSeconds) {
        this.apiKey = apiKey;
        this.model = model;
        this.timeoutSeconds = timeoutSeconds;
        // Inline images arrive base64-encoded inside the JSON body
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("x-goog-api-key", apiKey == null ? "" : apiKey)
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(16 * 1024 * 1024))
                .build();
        log.info("Gemini image provider initialized: model={}", model);
    }

    @Override
    public JsonNode render(String prompt) {
        if (!isAvailable()) {
            throw new GenerationException("gemini-image", "Gemini API key not configured");
        }

        ObjectNode requestBody = objectMapper.createObjectNode();
        requestBody.putArray("contents").addObject()
                .put("role", "user")
                .putArray("parts")
                .addObject()
                .put("text", prompt);
        requestBody.putObject("generationConfig")
                .putArray("responseModalities")
                .add("TEXT")
                .add("IMAGE");

        try {
            String response = webClient.post()
                    .uri("/v1beta/models/{model}:generateContent", model)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(objectMapper.writeValueAsString(requestBody))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();

            return objectMapper.readTree(response == null ? "{}" : response);

        } catch (WebClientResponseException e) {
            log.error("Gemini image API error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new GenerationException("gemini-image", "Gemini image API error: " + e.getStatusCode(), e);
        } catch (Exception e) {
            log.error("Failed to render image with Gemini", e);
            throw new GenerationException("gemini-image", "Failed to render image with Gemini", e);
        }
    }

    @Override
    public String getModelName() {
        return model;
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }
}
