package org.example.webverse.service.host;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class InboundPayloadReaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final InboundPayloadReader reader = new InboundPayloadReader(objectMapper);

    @Test
    void read_jsonBody_decodesStructured() {
        ObjectNode payload = reader.read(http("{\"choice\": \"left\"}", MediaType.APPLICATION_JSON));

        assertEquals("left", payload.get("choice").asText());
    }

    @Test
    void read_jsonSentAsText_retriesTextAsJson() {
        ObjectNode payload = reader.read(http("{\"history\": []}", MediaType.TEXT_PLAIN));

        assertTrue(payload.get("history").isArray());
    }

    @Test
    void read_plainText_returnsEmptyObject() {
        assertTrue(reader.read(http("Start a new adventure", MediaType.TEXT_PLAIN)).isEmpty());
    }

    @Test
    void read_jsonArray_returnsEmptyObject() {
        assertTrue(reader.read(http("[1, 2]", MediaType.APPLICATION_JSON)).isEmpty());
    }

    @Test
    void read_emptyBody_returnsEmptyObject() {
        assertTrue(reader.read(http("", null)).isEmpty());
    }

    @Test
    void read_unreadableInbound_returnsEmptyObject() {
        StageInbound failing = new StageInbound() {
            @Override
            public JsonNode structured() throws IOException {
                throw new IOException("not structured");
            }

            @Override
            public String text() throws IOException {
                throw new IOException("not text");
            }
        };

        assertTrue(reader.read(failing).isEmpty());
    }

    @Test
    void httpInbound_malformedContentType_treatedAsText() {
        HttpStageInbound inbound = HttpStageInbound.of(
                "{\"choice\": \"up\"}".getBytes(StandardCharsets.UTF_8), "not a media type", objectMapper);

        assertEquals("up", reader.read(inbound).get("choice").asText());
    }

    private HttpStageInbound http(String body, MediaType contentType) {
        return new HttpStageInbound(body.getBytes(StandardCharsets.UTF_8), contentType, objectMapper);
    }
}
