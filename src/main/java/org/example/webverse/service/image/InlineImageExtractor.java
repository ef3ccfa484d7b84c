package org.example.webverse.service.image;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.webverse.model.ImageMimeType;
import org.example.webverse.service.coercion.PayloadCoercion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Finds the first inline image in a generateContent-style response.
 * Every content part of every candidate is tried against the strategies in
 * order; the top-level {@code content.parts} are checked last.
 */
@Component
public class InlineImageExtractor {

    private static final Logger log = LoggerFactory.getLogger(InlineImageExtractor.class);

    private final List<ImageExtractionStrategy> partStrategies;

    public InlineImageExtractor() {
        this(List.of(
                InlineImageExtractor::fromInlineData,
                part -> fromInlineData(part.get("data")),
                part -> fromInlineData(part.get("image"))
        ));
    }

    InlineImageExtractor(List<ImageExtractionStrategy> partStrategies) {
        this.partStrategies = List.copyOf(partStrategies);
    }

    public Optional<ExtractedImage> extract(JsonNode response) {
        if (response == null || !response.isObject()) {
            return Optional.empty();
        }

        JsonNode candidates = response.path("candidates");
        if (candidates.isArray()) {
            for (JsonNode candidate : candidates) {
                JsonNode parts = candidate.path("content").path("parts");
                if (!parts.isArray()) {
                    continue;
                }
                for (JsonNode part : parts) {
                    for (ImageExtractionStrategy strategy : partStrategies) {
                        Optional<ExtractedImage> extracted = strategy.extract(part);
                        if (extracted.isPresent()) {
                            return extracted;
                        }
                    }
                }
            }
        }

        JsonNode topLevelParts = response.path("content").path("parts");
        if (topLevelParts.isArray()) {
            for (JsonNode part : topLevelParts) {
                Optional<ExtractedImage> extracted = fromInlineData(part);
                if (extracted.isPresent()) {
                    return extracted;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Read {@code inlineData} (or {@code inline_data}) from a part: base64
     * {@code data} plus an optional MIME type, PNG when absent. Images in a
     * format that cannot be delivered are skipped.
     */
    static Optional<ExtractedImage> fromInlineData(JsonNode part) {
        if (part == null || !part.isObject()) {
            return Optional.empty();
        }
        JsonNode inline = PayloadCoercion.first(part, "inlineData", "inline_data");
        if (inline == null || !inline.isObject()) {
            return Optional.empty();
        }
        JsonNode data = inline.get("data");
        if (data == null || !data.isTextual() || data.asText().isEmpty()) {
            return Optional.empty();
        }
        byte[] bytes = toBytes(data.asText());
        if (bytes.length == 0) {
            return Optional.empty();
        }
        String mimeType = PayloadCoercion.firstText(inline, "mimeType", "mime_type");
        Optional<ImageMimeType> resolved = ImageMimeType.fromValue(mimeType);
        if (resolved.isEmpty()) {
            log.warn("Skipping inline image with unsupported MIME type {}", mimeType);
            return Optional.empty();
        }
        return Optional.of(new ExtractedImage(bytes, resolved.get()));
    }

    // Undecodable data is passed through as its UTF-8 bytes
    static byte[] toBytes(String data) {
        try {
            return Base64.getMimeDecoder().decode(data);
        } catch (IllegalArgumentException e) {
            return data.getBytes(StandardCharsets.UTF_8);
        }
    }
}
