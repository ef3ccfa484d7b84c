package org.example.webverse.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Summary of an earlier page, resubmitted by the caller on every turn.
 */
public record HistoryEntry(
        int page,
        @JsonInclude(JsonInclude.Include.ALWAYS) String choice,
        String story
) {
}
