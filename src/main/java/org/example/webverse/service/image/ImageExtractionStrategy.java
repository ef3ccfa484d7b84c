package org.example.webverse.service.image;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * One way of finding inline image bytes in a content part of a rendering response.
 */
@FunctionalInterface
public interface ImageExtractionStrategy {

    Optional<ExtractedImage> extract(JsonNode part);
}
