package org.example.webverse.controller;

import org.example.webverse.service.host.StageRegistry;
import org.example.webverse.service.llm.GenerationLimiter;
import org.example.webverse.service.llm.ImageRenderProvider;
import org.example.webverse.service.llm.LlmProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashSet;
import java.util.List;

import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean(name = "writerLlmProvider")
    private LlmProvider writerLlmProvider;

    @MockitoBean(name = "illustratorLlmProvider")
    private LlmProvider illustratorLlmProvider;

    @MockitoBean
    private ImageRenderProvider imageRenderProvider;

    @MockitoBean
    private GenerationLimiter generationLimiter;

    @MockitoBean
    private StageRegistry stageRegistry;

    @Test
    void health_allProvidersAvailable_returnsOk() throws Exception {
        stubProviders(true);
        when(generationLimiter.getMaxConcurrent()).thenReturn(4);
        when(generationLimiter.availablePermits()).thenReturn(3);
        when(stageRegistry.names()).thenReturn(new LinkedHashSet<>(List.of("writer", "illustrator", "image-generator")));

        mockMvc.perform(get("/api/health").header("X-Request-Id", "req-health-1"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "req-health-1"))
                .andExpect(jsonPath("$.status", is("ok")))
                .andExpect(jsonPath("$.requestId", is("req-health-1")))
                .andExpect(jsonPath("$.stages[1]", is("illustrator")))
                .andExpect(jsonPath("$.providers.writerProvider", is("gemini")))
                .andExpect(jsonPath("$.providers.illustratorProvider", is("ollama")))
                .andExpect(jsonPath("$.providers.imageModel", is("gemini-2.5-flash-image")))
                .andExpect(jsonPath("$.generation.maxConcurrent", is(4)))
                .andExpect(jsonPath("$.generation.availablePermits", is(3)));
    }

    @Test
    void health_imageProviderUnavailable_returnsDegraded() throws Exception {
        stubProviders(true);
        when(imageRenderProvider.isAvailable()).thenReturn(false);

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.status", is("degraded")))
                .andExpect(jsonPath("$.providers.writerAvailable", is(true)))
                .andExpect(jsonPath("$.providers.imageAvailable", is(false)));
    }

    private void stubProviders(boolean available) {
        when(writerLlmProvider.getProviderName()).thenReturn("gemini");
        when(writerLlmProvider.isAvailable()).thenReturn(available);
        when(illustratorLlmProvider.getProviderName()).thenReturn("ollama");
        when(illustratorLlmProvider.isAvailable()).thenReturn(available);
        when(imageRenderProvider.getModelName()).thenReturn("gemini-2.5-flash-image");
        when(imageRenderProvider.isAvailable()).thenReturn(available);
    }
}
