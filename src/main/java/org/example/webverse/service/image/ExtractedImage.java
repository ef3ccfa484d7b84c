package org.example.webverse.service.image;

import org.example.webverse.model.ImageMimeType;

public record ExtractedImage(
        byte[] bytes,
        ImageMimeType mimeType
) {
}
