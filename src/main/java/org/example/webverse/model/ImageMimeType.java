package org.example.webverse.model;

import java.util.Locale;
import java.util.Optional;

public enum ImageMimeType {
    PNG("image/png"),
    JPEG("image/jpeg"),
    WEBP("image/webp");

    private final String value;

    ImageMimeType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolve a MIME type reported by the rendering service. A missing type
     * means PNG; a type outside the supported set resolves to empty.
     */
    public static Optional<ImageMimeType> fromValue(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return Optional.of(PNG);
        }
        String normalized = mimeType.trim().toLowerCase(Locale.ROOT);
        if ("image/jpg".equals(normalized)) {
            return Optional.of(JPEG);
        }
        for (ImageMimeType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
