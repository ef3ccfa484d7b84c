package org.example.webverse.config;

import org.example.webverse.service.llm.GeminiImageRenderProvider;
import org.example.webverse.service.llm.GeminiLlmProvider;
import org.example.webverse.service.llm.GenerationLimiter;
import org.example.webverse.service.llm.ImageRenderProvider;
import org.example.webverse.service.llm.LimitedImageRenderProvider;
import org.example.webverse.service.llm.LimitedLlmProvider;
import org.example.webverse.service.llm.LlmProvider;
import org.example.webverse.service.llm.OllamaLlmProvider;
import org.example.webverse.service.llm.XaiLlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the generative service.
 * Creates separate text providers for the writer and illustrator stages plus
 * the image renderer, all sharing one concurrency limiter.
 */
@Configuration
public class LlmProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmProviderConfig.class);

    @Value("${ai.gemini.api-key:}")
    private String geminiApiKey;

    @Value("${ai.gemini.base-url:https://generativelanguage.googleapis.com}")
    private String geminiBaseUrl;

    @Value("${ai.xai.base-url:https://api.x.ai/v1}")
    private String xaiBaseUrl;

    // Writer provider config
    @Value("${ai.writer.provider:gemini}")
    private String writerProvider;

    @Value("${ai.writer.timeout-seconds:60}")
    private int writerTimeoutSeconds;

    @Value("${ai.writer.gemini.model:gemini-2.0-flash}")
    private String writerGeminiModel;

    @Value("${ai.writer.ollama.base-url:http://localhost:11434}")
    private String writerOllamaBaseUrl;

    @Value("${ai.writer.ollama.model:llama3.1:latest}")
    private String writerOllamaModel;

    @Value("${ai.writer.xai.api-key:}")
    private String writerXaiApiKey;

    @Value("${ai.writer.xai.model:grok-4-1-fast-non-reasoning}")
    private String writerXaiModel;

    // Illustrator provider config (defaults to the writer's settings)
    @Value("${ai.illustrator.provider:${ai.writer.provider:gemini}}")
    private String illustratorProvider;

    @Value("${ai.illustrator.timeout-seconds:${ai.writer.timeout-seconds:60}}")
    private int illustratorTimeoutSeconds;

    @Value("${ai.illustrator.gemini.model:${ai.writer.gemini.model:gemini-2.0-flash}}")
    private String illustratorGeminiModel;

    @Value("${ai.illustrator.ollama.base-url:${ai.writer.ollama.base-url:http://localhost:11434}}")
    private String illustratorOllamaBaseUrl;

    @Value("${ai.illustrator.ollama.model:${ai.writer.ollama.model:llama3.1:latest}}")
    private String illustratorOllamaModel;

    @Value("${ai.illustrator.xai.api-key:${ai.writer.xai.api-key:}}")
    private String illustratorXaiApiKey;

    @Value("${ai.illustrator.xai.model:${ai.writer.xai.model:grok-4-1-fast-non-reasoning}}")
    private String illustratorXaiModel;

    // Image renderer config
    @Value("${ai.image.gemini.model:gemini-2.5-flash-image}")
    private String imageGeminiModel;

    @Value("${ai.image.timeout-seconds:120}")
    private int imageTimeoutSeconds;

    @Bean
    public GenerationLimiter generationLimiter(WebverseProperties properties) {
        WebverseProperties.Generation generation = properties.getGeneration();
        log.info("Limiting generative calls to {} concurrent requests", generation.getMaxConcurrentCalls());
        return new GenerationLimiter(
                generation.getMaxConcurrentCalls(),
                Duration.ofSeconds(generation.getAcquireTimeoutSeconds()));
    }

    @Bean
    @Qualifier("writerLlmProvider")
    public LlmProvider writerLlmProvider(GenerationLimiter generationLimiter) {
        log.info("Configuring writer LLM provider: {}", writerProvider);
        return new LimitedLlmProvider(createProvider(
                writerProvider,
                writerGeminiModel,
                writerOllamaBaseUrl, writerOllamaModel,
                writerXaiApiKey, writerXaiModel,
                writerTimeoutSeconds,
                "writer"
        ), generationLimiter);
    }

    @Bean
    @Qualifier("illustratorLlmProvider")
    public LlmProvider illustratorLlmProvider(GenerationLimiter generationLimiter) {
        log.info("Configuring illustrator LLM provider: {}", illustratorProvider);
        return new LimitedLlmProvider(createProvider(
                illustratorProvider,
                illustratorGeminiModel,
                illustratorOllamaBaseUrl, illustratorOllamaModel,
                illustratorXaiApiKey, illustratorXaiModel,
                illustratorTimeoutSeconds,
                "illustrator"
        ), generationLimiter);
    }

    @Bean
    public ImageRenderProvider imageRenderProvider(GenerationLimiter generationLimiter) {
        if (geminiApiKey == null || geminiApiKey.isBlank()) {
            log.warn("Gemini API key not configured; image stage will serve placeholder images");
        }
        return new LimitedImageRenderProvider(
                new GeminiImageRenderProvider(geminiBaseUrl, geminiApiKey, imageGeminiModel, imageTimeoutSeconds),
                generationLimiter);
    }

    private LlmProvider createProvider(
            String providerType,
            String geminiModel,
            String ollamaBaseUrl, String ollamaModel,
            String xaiApiKey, String xaiModel,
            int timeoutSeconds,
            String purpose) {

        return switch (providerType.toLowerCase()) {
            case "ollama" -> {
                log.info("Creating Ollama provider for {}: baseUrl={}, model={}",
                        purpose, ollamaBaseUrl, ollamaModel);
                yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
            }
            case "xai" -> {
                if (xaiApiKey == null || xaiApiKey.isBlank()) {
                    log.warn("xAI API key not configured for {} provider, falling back to Gemini", purpose);
                    yield new GeminiLlmProvider(geminiBaseUrl, geminiApiKey, geminiModel, timeoutSeconds);
                }
                log.info("Creating xAI provider for {}: model={}", purpose, xaiModel);
                yield new XaiLlmProvider(xaiBaseUrl, xaiApiKey, xaiModel, timeoutSeconds);
            }
            case "gemini" -> {
                log.info("Creating Gemini provider for {}: model={}", purpose, geminiModel);
                yield new GeminiLlmProvider(geminiBaseUrl, geminiApiKey, geminiModel, timeoutSeconds);
            }
            default -> {
                log.warn("Unknown provider type '{}' for {}, falling back to Gemini", providerType, purpose);
                yield new GeminiLlmProvider(geminiBaseUrl, geminiApiKey, geminiModel, timeoutSeconds);
            }
        };
    }
}
