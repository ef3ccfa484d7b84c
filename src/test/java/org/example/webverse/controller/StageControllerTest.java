package org.example.webverse.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.webverse.service.host.LocalStageInvoker;
import org.example.webverse.service.host.Stage;
import org.example.webverse.service.host.StageEmission;
import org.example.webverse.service.host.StageInbound;
import org.example.webverse.service.host.StageInvocationException;
import org.example.webverse.service.host.StageRegistry;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(StageController.class)
class StageControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private StageRegistry stageRegistry;

    @MockitoBean
    private LocalStageInvoker stageInvoker;

    @Test
    void listStages_returnsRegisteredNames() throws Exception {
        when(stageRegistry.names()).thenReturn(new LinkedHashSet<>(List.of("writer", "illustrator", "image-generator")));

        mockMvc.perform(get("/api/stages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stages[0]", is("writer")))
                .andExpect(jsonPath("$.stages[2]", is("image-generator")));
    }

    @Test
    void invokeStage_unknownName_returnsNotFound() throws Exception {
        when(stageRegistry.find("colorist")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/stages/colorist")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound());

        verify(stageInvoker, never()).dispatch(any(), any());
    }

    @Test
    void invokeStage_jsonEmission_returnsJsonBodyAndRequestId() throws Exception {
        when(stageRegistry.find("writer")).thenReturn(Optional.of(mock(Stage.class)));
        when(stageInvoker.dispatch(eq("writer"), any(StageInbound.class)))
                .thenReturn(StageEmission.json(objectMapper.readTree("{\"page\": 1, \"story\": \"Thwip.\"}")));

        mockMvc.perform(post("/api/stages/writer")
                        .header("X-Request-Id", "req-stage-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"choice\": \"swing-left\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "req-stage-1"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.page", is(1)))
                .andExpect(jsonPath("$.story", is("Thwip.")));

        ArgumentCaptor<StageInbound> inbound = ArgumentCaptor.forClass(StageInbound.class);
        verify(stageInvoker).dispatch(eq("writer"), inbound.capture());
        assertEquals("swing-left", inbound.getValue().structured().get("choice").asText());
    }

    @Test
    void invokeStage_binaryEmission_returnsBytesWithEncodedMetadata() throws Exception {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G'};
        when(stageRegistry.find("image-generator")).thenReturn(Optional.of(mock(Stage.class)));
        when(stageInvoker.dispatch(eq("image-generator"), any(StageInbound.class)))
                .thenReturn(StageEmission.binary(png, "image/png", Map.of("fallback", "true")));

        String expectedMetadata = Base64.getEncoder()
                .encodeToString("{\"fallback\":\"true\"}".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(post("/api/stages/image-generator")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_PNG))
                .andExpect(header().string(StageController.METADATA_HEADER, expectedMetadata))
                .andExpect(content().bytes(png));
    }

    @Test
    void invokeStage_stageThrows_returnsServerErrorWithStageError() throws Exception {
        when(stageRegistry.find("image-generator")).thenReturn(Optional.of(mock(Stage.class)));
        when(stageInvoker.dispatch(eq("image-generator"), any(StageInbound.class)))
                .thenThrow(new StageInvocationException("image-generator", "Stage 'image-generator' failed"));

        mockMvc.perform(post("/api/stages/image-generator"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.stage", is("image-generator")))
                .andExpect(jsonPath("$.kind", is("invocation_failed")))
                .andExpect(jsonPath("$.code", is("image_generator_failed")));
    }
}
