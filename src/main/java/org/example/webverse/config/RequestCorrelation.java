package org.example.webverse.config;

import jakarta.servlet.http.HttpServletRequest;

import java.util.UUID;

public final class RequestCorrelation {

    public static final String HEADER_NAME = "X-Request-Id";
    public static final String ATTRIBUTE_NAME = "requestId";
    public static final String MDC_KEY = "requestId";
    public static final String UNKNOWN = "unknown";

    static final int MAX_REQUEST_ID_LENGTH = 80;

    private RequestCorrelation() {
    }

    public static String resolveRequestId(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        Object requestId = request.getAttribute(ATTRIBUTE_NAME);
        if (requestId instanceof String value && !value.isBlank()) {
            return value;
        }
        return UNKNOWN;
    }

    /**
     * The caller's id when usable, otherwise a fresh random one.
     */
    static String resolveIncoming(String headerValue) {
        String normalized = normalize(headerValue);
        return normalized != null ? normalized : UUID.randomUUID().toString();
    }

    /**
     * Trimmed caller-supplied id, cut to 80 characters; null when blank.
     */
    static String normalize(String headerValue) {
        if (headerValue == null) {
            return null;
        }
        String trimmed = headerValue.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > MAX_REQUEST_ID_LENGTH ? trimmed.substring(0, MAX_REQUEST_ID_LENGTH) : trimmed;
    }
}
