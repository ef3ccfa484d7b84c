package org.example.webverse.service.llm;

/**
 * Routes every generate call of the wrapped provider through a shared {@link GenerationLimiter}.
 */
public class LimitedLlmProvider implements LlmProvider {

    private final LlmProvider delegate;
    private final GenerationLimiter limiter;

    public LimitedLlmProvider(LlmProvider delegate, GenerationLimiter limiter) {
        this.delegate = delegate;
        this.limiter = limiter;
    }

    @Override
    public String generate(String prompt, LlmOptions options) {
        return limiter.call(delegate.getProviderName(), () -> delegate.generate(prompt, options));
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }

    @Override
    public String getProviderName() {
        return delegate.getProviderName();
    }
}
