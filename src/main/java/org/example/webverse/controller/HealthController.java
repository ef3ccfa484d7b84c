package org.example.webverse.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.webverse.config.RequestCorrelation;
import org.example.webverse.service.host.StageRegistry;
import org.example.webverse.service.llm.GenerationLimiter;
import org.example.webverse.service.llm.ImageRenderProvider;
import org.example.webverse.service.llm.LlmProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final LlmProvider writerLlmProvider;
    private final LlmProvider illustratorLlmProvider;
    private final ImageRenderProvider imageRenderProvider;
    private final GenerationLimiter generationLimiter;
    private final StageRegistry stageRegistry;

    public HealthController(
            @Qualifier("writerLlmProvider") LlmProvider writerLlmProvider,
            @Qualifier("illustratorLlmProvider") LlmProvider illustratorLlmProvider,
            ImageRenderProvider imageRenderProvider,
            GenerationLimiter generationLimiter,
            StageRegistry stageRegistry) {
        this.writerLlmProvider = writerLlmProvider;
        this.illustratorLlmProvider = illustratorLlmProvider;
        this.imageRenderProvider = imageRenderProvider;
        this.generationLimiter = generationLimiter;
        this.stageRegistry = stageRegistry;
    }

    /**
     * Stages answer with fallback content when a provider is down, so an
     * unavailable provider makes the service degraded rather than failed.
     */
    @GetMapping
    public HealthDetails health(HttpServletRequest request) {
        ProviderHealth providers = new ProviderHealth(
                writerLlmProvider.getProviderName(),
                writerLlmProvider.isAvailable(),
                illustratorLlmProvider.getProviderName(),
                illustratorLlmProvider.isAvailable(),
                imageRenderProvider.getModelName(),
                imageRenderProvider.isAvailable()
        );
        boolean providersAvailable = providers.writerAvailable()
                && providers.illustratorAvailable()
                && providers.imageAvailable();

        return new HealthDetails(
                providersAvailable ? "ok" : "degraded",
                RequestCorrelation.resolveRequestId(request),
                LocalDateTime.now(),
                List.copyOf(stageRegistry.names()),
                providers,
                new GenerationCapacity(generationLimiter.getMaxConcurrent(), generationLimiter.availablePermits())
        );
    }

    public record HealthDetails(
            String status,
            String requestId,
            LocalDateTime asOf,
            List<String> stages,
            ProviderHealth providers,
            GenerationCapacity generation
    ) {
    }

    public record ProviderHealth(
            String writerProvider,
            boolean writerAvailable,
            String illustratorProvider,
            boolean illustratorAvailable,
            String imageModel,
            boolean imageAvailable
    ) {
    }

    public record GenerationCapacity(int maxConcurrent, int availablePermits) {}
}
