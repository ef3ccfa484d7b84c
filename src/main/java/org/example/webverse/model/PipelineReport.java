package org.example.webverse.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Director result: all three stage results on success, or the results gathered
 * before the failing stage plus an error naming that stage.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineReport(
        StageResult writer,
        StageResult illustrator,
        StageResult image,
        StageError error
) {
    public static PipelineReport success(StageResult writer, StageResult illustrator, StageResult image) {
        return new PipelineReport(writer, illustrator, image, null);
    }

    public static PipelineReport failure(StageResult writer, StageResult illustrator, StageError error) {
        return new PipelineReport(writer, illustrator, null, error);
    }

    @JsonProperty("details")
    public String details() {
        return error == null ? null : error.details();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}
