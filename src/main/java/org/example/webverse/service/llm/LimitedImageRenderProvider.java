package org.example.webverse.service.llm;

import com.fasterxml.jackson.databind.JsonNode;

public class LimitedImageRenderProvider implements ImageRenderProvider {

    private final ImageRenderProvider delegate;
    private final GenerationLimiter limiter;

    public LimitedImageRenderProvider(ImageRenderProvider delegate, GenerationLimiter limiter) {
        this.delegate = delegate;
        this.limiter = limiter;
    }

    @Override
    public JsonNode render(String prompt) {
        return limiter.call(delegate.getModelName(), () -> delegate.render(prompt));
    }

    @Override
    public String getModelName() {
        return delegate.getModelName();
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }
}
