package org.example.webverse.service.host;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.webverse.model.StageResult;

/**
 * Invokes a stage by its logical name.
 */
public interface StageInvoker {

    /**
     * @throws StageInvocationException when the stage cannot be reached or fails to answer
     */
    StageResult invoke(String stageName, JsonNode payload);
}
