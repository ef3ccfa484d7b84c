package org.example.webverse.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StageFailureKind {
    INVOCATION_FAILED("invocation_failed", "failed"),
    INVALID_PAYLOAD("invalid_payload", "invalid_payload"),
    CANCELLED("cancelled", "cancelled");

    private final String value;
    private final String codeSuffix;

    StageFailureKind(String value, String codeSuffix) {
        this.value = value;
        this.codeSuffix = codeSuffix;
    }

    @JsonValue
    public String value() {
        return value;
    }

    String codeSuffix() {
        return codeSuffix;
    }
}
