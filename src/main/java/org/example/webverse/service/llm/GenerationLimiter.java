package org.example.webverse.service.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Caps the number of in-flight calls to the generative service across all
 * concurrent pipeline runs.
 */
public class GenerationLimiter {

    private static final Logger log = LoggerFactory.getLogger(GenerationLimiter.class);

    private final Semaphore permits;
    private final int maxConcurrent;
    private final Duration acquireTimeout;

    public GenerationLimiter(int maxConcurrent, Duration acquireTimeout) {
        this.maxConcurrent = Math.max(1, maxConcurrent);
        this.acquireTimeout = acquireTimeout == null || acquireTimeout.isNegative()
                ? Duration.ZERO
                : acquireTimeout;
        this.permits = new Semaphore(this.maxConcurrent, true);
    }

    /**
     * Run {@code call} once a permit is free.
     *
     * @throws GenerationException if no permit frees up in time or the thread is interrupted
     */
    public <T> T call(String purpose, Supplier<T> call) {
        boolean acquired;
        try {
            acquired = permits.tryAcquire(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException(purpose, "Interrupted while waiting for a generation slot", e);
        }
        if (!acquired) {
            log.warn("No generation slot for {} within {}ms ({} in flight)",
                    purpose, acquireTimeout.toMillis(), maxConcurrent);
            throw new GenerationException(purpose, "No generation slot available");
        }
        try {
            return call.get();
        } finally {
            permits.release();
        }
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }
}
