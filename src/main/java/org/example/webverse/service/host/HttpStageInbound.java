package org.example.webverse.service.host;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Inbound side for a raw HTTP request body.
 */
public class HttpStageInbound implements StageInbound {

    private static final Logger log = LoggerFactory.getLogger(HttpStageInbound.class);

    private final byte[] body;
    private final MediaType contentType;
    private final ObjectMapper objectMapper;

    public HttpStageInbound(byte[] body, MediaType contentType, ObjectMapper objectMapper) {
        this.body = body == null ? new byte[0] : body;
        this.contentType = contentType;
        this.objectMapper = objectMapper;
    }

    /**
     * Build from a raw {@code Content-Type} header; a missing or malformed header
     * is treated as no content type.
     */
    public static HttpStageInbound of(byte[] body, String contentTypeHeader, ObjectMapper objectMapper) {
        MediaType contentType = null;
        if (contentTypeHeader != null && !contentTypeHeader.isBlank()) {
            try {
                contentType = MediaType.parseMediaType(contentTypeHeader);
            } catch (InvalidMediaTypeException e) {
                log.debug("Ignoring unparseable content type '{}'", contentTypeHeader);
            }
        }
        return new HttpStageInbound(body, contentType, objectMapper);
    }

    @Override
    public JsonNode structured() throws IOException {
        if (contentType == null || !isJson(contentType)) {
            throw new IOException("Payload content type is not JSON: " + contentType);
        }
        return objectMapper.readTree(body);
    }

    @Override
    public String text() {
        Charset charset = contentType != null && contentType.getCharset() != null
                ? contentType.getCharset()
                : StandardCharsets.UTF_8;
        return new String(body, charset);
    }

    private static boolean isJson(MediaType mediaType) {
        return MediaType.APPLICATION_JSON.isCompatibleWith(mediaType)
                || mediaType.getSubtype().endsWith("+json");
    }
}
