package org.example.webverse.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.example.webverse.config.WebverseProperties;
import org.example.webverse.model.PipelineReport;
import org.example.webverse.model.StageError;
import org.example.webverse.model.StageFailureKind;
import org.example.webverse.model.StageResult;
import org.example.webverse.service.host.StageInvocationException;
import org.example.webverse.service.host.StageInvoker;
import org.example.webverse.service.stage.IllustratorStage;
import org.example.webverse.service.stage.ImageStage;
import org.example.webverse.service.stage.WriterStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Runs writer, illustrator and image stages in sequence for one request.
 * A stage that cannot be invoked, or that answers without a JSON object where
 * the next stage needs one, ends the run; results gathered so far are kept in
 * the report.
 */
@Service
public class DirectorService {

    private static final Logger log = LoggerFactory.getLogger(DirectorService.class);

    enum State {
        WRITER,
        ILLUSTRATOR,
        IMAGE,
        SUCCEEDED,
        FAILED
    }

    private final StageInvoker stageInvoker;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;

    public DirectorService(StageInvoker stageInvoker, ObjectMapper objectMapper, WebverseProperties properties) {
        this.stageInvoker = stageInvoker;
        this.objectMapper = objectMapper;
        this.executor = Executors.newFixedThreadPool(
                Math.max(1, properties.getPipeline().getWorkerThreads()),
                new DirectorThreadFactory());
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    /**
     * Run the pipeline on the director's worker pool, carrying the caller's
     * logging context onto the worker thread.
     */
    public CompletableFuture<PipelineReport> runAsync(JsonNode payload, BooleanSupplier cancelled) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return CompletableFuture.supplyAsync(() -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return run(payload, cancelled);
            } finally {
                MDC.clear();
            }
        }, executor);
    }

    public PipelineReport run(JsonNode payload) {
        return run(payload, () -> false);
    }

    /**
     * @param payload the inbound request, forwarded to the writer; null is treated as empty
     * @param cancelled checked before each stage; once true no further stage is started
     */
    public PipelineReport run(JsonNode payload, BooleanSupplier cancelled) {
        JsonNode input = payload == null || !payload.isObject() ? objectMapper.createObjectNode() : payload;
        log.info("Director starting orchestration");

        StageResult writer = null;
        StageResult illustrator = null;
        StageResult image = null;
        StageError error = null;

        State state = State.WRITER;
        while (state != State.SUCCEEDED && state != State.FAILED) {
            String stageName = stageName(state);
            if (cancelled.getAsBoolean()) {
                log.warn("Pipeline cancelled before stage '{}'", stageName);
                error = new StageError(stageName, StageFailureKind.CANCELLED,
                        "Request was cancelled before stage '" + stageName + "' started.");
                state = State.FAILED;
                continue;
            }

            JsonNode stageInput = switch (state) {
                case WRITER -> input;
                case ILLUSTRATOR -> writer.body();
                default -> illustrator.body();
            };

            StageResult result;
            try {
                result = stageInvoker.invoke(stageName, stageInput);
            } catch (StageInvocationException e) {
                log.error("Stage '{}' invocation failed", e.getStage(), e);
                error = new StageError(e.getStage(), StageFailureKind.INVOCATION_FAILED, e.getMessage());
                state = State.FAILED;
                continue;
            }

            switch (state) {
                case WRITER -> writer = result;
                case ILLUSTRATOR -> illustrator = result;
                default -> image = result;
            }

            if (state != State.IMAGE && !result.hasObjectBody()) {
                log.error("Stage '{}' returned unsupported payload type: {}", stageName,
                        result.body() == null ? "none" : result.body().getNodeType());
                error = new StageError(stageName, StageFailureKind.INVALID_PAYLOAD,
                        "Stage '" + stageName + "' must return a JSON object payload.");
                state = State.FAILED;
                continue;
            }

            state = next(state);
        }

        if (state == State.FAILED) {
            log.warn("Pipeline failed at stage '{}' ({})", error.stage(), error.code());
            return PipelineReport.failure(writer, illustrator, error);
        }
        log.info("Director orchestration completed successfully");
        return PipelineReport.success(writer, illustrator, image);
    }

    private static State next(State state) {
        return switch (state) {
            case WRITER -> State.ILLUSTRATOR;
            case ILLUSTRATOR -> State.IMAGE;
            default -> State.SUCCEEDED;
        };
    }

    static String stageName(State state) {
        return switch (state) {
            case WRITER -> WriterStage.NAME;
            case ILLUSTRATOR -> IllustratorStage.NAME;
            case IMAGE -> ImageStage.NAME;
            default -> throw new IllegalArgumentException("No stage for state " + state);
        };
    }

    private static final class DirectorThreadFactory implements ThreadFactory {
        private final AtomicInteger nextThreadId = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "director-" + nextThreadId.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
