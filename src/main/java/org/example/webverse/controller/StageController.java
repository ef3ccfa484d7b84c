package org.example.webverse.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.webverse.model.StageError;
import org.example.webverse.model.StageFailureKind;
import org.example.webverse.service.host.HttpStageInbound;
import org.example.webverse.service.host.LocalStageInvoker;
import org.example.webverse.service.host.StageEmission;
import org.example.webverse.service.host.StageInvocationException;
import org.example.webverse.service.host.StageRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Direct entry point for each stage, so a stage can be called on its own
 * exactly as the director calls it.
 */
@RestController
@RequestMapping("/api/stages")
public class StageController {

    private static final Logger log = LoggerFactory.getLogger(StageController.class);

    public static final String METADATA_HEADER = "X-Stage-Metadata";

    private final StageRegistry stageRegistry;
    private final LocalStageInvoker stageInvoker;
    private final ObjectMapper objectMapper;

    public StageController(StageRegistry stageRegistry, LocalStageInvoker stageInvoker, ObjectMapper objectMapper) {
        this.stageRegistry = stageRegistry;
        this.stageInvoker = stageInvoker;
        this.objectMapper = objectMapper;
    }

    @GetMapping
    public StageList listStages() {
        return new StageList(List.copyOf(stageRegistry.names()));
    }

    @PostMapping("/{name}")
    public ResponseEntity<?> invokeStage(
            @PathVariable String name,
            @RequestBody(required = false) byte[] body,
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType) {
        if (stageRegistry.find(name).isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        StageEmission emission;
        try {
            emission = stageInvoker.dispatch(name, HttpStageInbound.of(body, contentType, objectMapper));
        } catch (StageInvocationException e) {
            log.error("Direct invocation of stage '{}' failed", name, e);
            return ResponseEntity.internalServerError()
                    .body(new StageError(name, StageFailureKind.INVOCATION_FAILED, e.getMessage()));
        }

        if (!emission.isBinary()) {
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(emission.json());
        }
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(emission.contentType()))
                .header(METADATA_HEADER, encodeMetadata(emission.metadata()))
                .body(emission.binary());
    }

    /**
     * Base64 of the compact UTF-8 JSON of {@code metadata}; header values must stay ASCII.
     */
    String encodeMetadata(Map<String, String> metadata) {
        try {
            byte[] json = objectMapper.writeValueAsString(metadata).getBytes(StandardCharsets.UTF_8);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode stage metadata", e);
        }
    }

    public record StageList(List<String> stages) {}
}
