package org.example.webverse.service.host;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.example.webverse.model.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Base64;

/**
 * Invokes stages registered in this process, feeding them the same inbound and
 * outbound abstractions the HTTP entry point uses.
 */
@Component
public class LocalStageInvoker implements StageInvoker {

    private static final Logger log = LoggerFactory.getLogger(LocalStageInvoker.class);
    static final String MDC_STAGE = "stage";

    private final StageRegistry stageRegistry;
    private final ObjectMapper objectMapper;

    public LocalStageInvoker(StageRegistry stageRegistry, ObjectMapper objectMapper) {
        this.stageRegistry = stageRegistry;
        this.objectMapper = objectMapper;
    }

    @Override
    public StageResult invoke(String stageName, JsonNode payload) {
        if (log.isDebugEnabled()) {
            log.debug("Invoking stage '{}' with payload keys: {}", stageName, fieldNames(payload));
        }
        return toResult(stageName, dispatch(stageName, new JsonStageInbound(payload, objectMapper)));
    }

    /**
     * Run the named stage against {@code inbound} and return what it emitted.
     * Shared by named invocation and the HTTP entry point.
     *
     * @throws StageInvocationException if the stage is unknown, throws, or emits nothing
     */
    public StageEmission dispatch(String stageName, StageInbound inbound) {
        Stage stage = stageRegistry.find(stageName)
                .orElseThrow(() -> new StageInvocationException(stageName, "Unknown stage: " + stageName));

        CapturingStageOutbound outbound = new CapturingStageOutbound();
        String previousStage = MDC.get(MDC_STAGE);
        MDC.put(MDC_STAGE, stageName);
        try {
            stage.handle(inbound, outbound);
        } catch (RuntimeException e) {
            throw new StageInvocationException(stageName,
                    "Stage '" + stageName + "' failed: " + e.getMessage(), e);
        } finally {
            if (previousStage == null) {
                MDC.remove(MDC_STAGE);
            } else {
                MDC.put(MDC_STAGE, previousStage);
            }
        }
        return outbound.emission()
                .orElseThrow(() -> new StageInvocationException(stageName,
                        "Stage '" + stageName + "' produced no response"));
    }

    StageResult toResult(String stageName, StageEmission emission) {
        if (!emission.isBinary()) {
            return new StageResult(stageName, emission.contentType(), emission.metadata(), emission.json());
        }
        ObjectNode descriptor = objectMapper.createObjectNode();
        descriptor.put("encoding", "base64");
        descriptor.put("data", Base64.getEncoder().encodeToString(emission.binary()));
        descriptor.put("size", emission.binary().length);
        return new StageResult(stageName, emission.contentType(), emission.metadata(), descriptor);
    }

    private static String fieldNames(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return "[]";
        }
        StringBuilder names = new StringBuilder("[");
        payload.fieldNames().forEachRemaining(name -> {
            if (names.length() > 1) {
                names.append(", ");
            }
            names.append(name);
        });
        return names.append(']').toString();
    }
}
