package org.example.webverse.service.host;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Optional;

/**
 * Keeps the emitted response in memory so the caller can forward it later.
 */
public class CapturingStageOutbound implements StageOutbound {

    private StageEmission emission;

    @Override
    public void emit(JsonNode body) {
        record(StageEmission.json(body));
    }

    @Override
    public void emitBinary(byte[] bytes, String mimeType, Map<String, String> metadata) {
        record(StageEmission.binary(bytes, mimeType, metadata));
    }

    public Optional<StageEmission> emission() {
        return Optional.ofNullable(emission);
    }

    private void record(StageEmission next) {
        if (emission != null) {
            throw new IllegalStateException("Stage already emitted a response");
        }
        emission = next;
    }
}
