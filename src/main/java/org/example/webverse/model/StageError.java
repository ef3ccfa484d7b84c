package org.example.webverse.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StageError(
        String stage,
        StageFailureKind kind,
        String details
) {
    /**
     * Wire code such as {@code writer_failed} or {@code image_generator_invalid_payload}.
     */
    @JsonProperty("code")
    public String code() {
        return stage.replace('-', '_') + "_" + kind.codeSuffix();
    }
}
