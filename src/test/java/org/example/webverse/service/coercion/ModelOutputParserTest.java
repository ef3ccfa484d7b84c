package org.example.webverse.service.coercion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ModelOutputParserTest {

    private static final String FENCE = "`".repeat(3);

    private final ModelOutputParser parser = new ModelOutputParser(new ObjectMapper());

    @Test
    void parseObject_bareJson_returnsObject() {
        Optional<ObjectNode> parsed = parser.parseObject("  {\"story\": \"Thwip\"}\n");

        assertTrue(parsed.isPresent());
        assertEquals("Thwip", parsed.get().get("story").asText());
    }

    @Test
    void parseObject_fencedJson_stripsFence() {
        Optional<ObjectNode> parsed = parser.parseObject(FENCE + "json\n{\"story\": \"Fenced\"}\n" + FENCE);

        assertTrue(parsed.isPresent());
        assertEquals("Fenced", parsed.get().get("story").asText());
    }

    @Test
    void parseObject_bareFence_stripsFence() {
        Optional<ObjectNode> parsed = parser.parseObject(FENCE + "\n{\"a\": 1}" + FENCE);

        assertEquals(1, parsed.orElseThrow().get("a").asInt());
    }

    @Test
    void parseObject_proseAroundObject_extractsEmbeddedObject() {
        Optional<ObjectNode> parsed = parser.parseObject("Here is your page: {\"story\": \"Hi\"} Enjoy!");

        assertEquals("Hi", parsed.orElseThrow().get("story").asText());
    }

    @Test
    void parseObject_nonObjectJson_returnsEmpty() {
        assertTrue(parser.parseObject("[1, 2, 3]").isEmpty());
        assertTrue(parser.parseObject("\"text\"").isEmpty());
    }

    @Test
    void parseObject_garbage_returnsEmpty() {
        assertTrue(parser.parseObject("no json here").isEmpty());
        assertTrue(parser.parseObject("{broken").isEmpty());
        assertTrue(parser.parseObject("").isEmpty());
        assertTrue(parser.parseObject(null).isEmpty());
    }

    @Test
    void stripWrapping_removesTrailingBackticksOnly() {
        assertEquals("{\"a\":1}", ModelOutputParser.stripWrapping(" {\"a\":1}`` "));
    }
}
