package org.example.webverse.service.fallback;

/**
 * Supplies the per-call seed that fixes fallback content for one stage call.
 */
@FunctionalInterface
public interface SeedSource {

    /**
     * @return a value in [0, 2^32)
     */
    long nextSeed();
}
