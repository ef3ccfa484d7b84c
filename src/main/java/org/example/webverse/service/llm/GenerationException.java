package org.example.webverse.service.llm;

/**
 * Thrown when a call to the generative service fails, times out, or cannot get
 * a free slot. Stages treat it as a routine trigger for fallback content.
 */
public class GenerationException extends RuntimeException {

    private final String provider;

    public GenerationException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public GenerationException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
