package org.example.webverse.model;

import java.util.Map;

public record RenderedImage(
        byte[] bytes,
        ImageMimeType mimeType,
        Map<String, String> metadata,
        boolean fallbackUsed
) {
    public RenderedImage {
        bytes = bytes == null ? new byte[0] : bytes;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
