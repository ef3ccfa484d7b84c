package org.example.webverse.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.example.webverse.config.WebverseProperties;
import org.example.webverse.model.PipelineReport;
import org.example.webverse.service.DirectorService;
import org.example.webverse.service.host.HttpStageInbound;
import org.example.webverse.service.host.InboundPayloadReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

@RestController
@RequestMapping("/api/pipeline")
public class PipelineController {

    private static final Logger log = LoggerFactory.getLogger(PipelineController.class);

    private final DirectorService directorService;
    private final InboundPayloadReader payloadReader;
    private final ObjectMapper objectMapper;
    private final WebverseProperties properties;

    public PipelineController(
            DirectorService directorService,
            InboundPayloadReader payloadReader,
            ObjectMapper objectMapper,
            WebverseProperties properties) {
        this.directorService = directorService;
        this.payloadReader = payloadReader;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Run the full pipeline. Answers 200 with the report once the director
     * finishes; a failed stage is reported in the body. When the caller goes
     * away or the request times out, no further stage is started.
     */
    @PostMapping
    public DeferredResult<PipelineReport> runPipeline(
            @RequestBody(required = false) byte[] body,
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType) {
        ObjectNode payload = payloadReader.read(HttpStageInbound.of(body, contentType, objectMapper));

        AtomicBoolean cancelled = new AtomicBoolean(false);
        DeferredResult<PipelineReport> result =
                new DeferredResult<>(properties.getPipeline().getTimeoutSeconds() * 1000L);
        result.onTimeout(() -> {
            log.warn("Pipeline request timed out; remaining stages will be skipped");
            cancelled.set(true);
        });
        result.onError(error -> {
            log.warn("Pipeline request ended early: {}", error.getMessage());
            cancelled.set(true);
        });

        directorService.runAsync(payload, cancelled::get).whenComplete((report, error) -> {
            if (error != null) {
                result.setErrorResult(unwrap(error));
            } else {
                result.setResult(report);
            }
        });
        return result;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
