package org.example.webverse.service.host;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * Read side of a stage request, independent of the transport that carried it.
 */
public interface StageInbound {

    /**
     * Decode the payload as JSON.
     *
     * @throws IOException when the payload is not structured data
     */
    JsonNode structured() throws IOException;

    /**
     * The payload as text; empty when there is no payload.
     */
    String text() throws IOException;
}
