package org.example.webverse.service.fallback;

import java.util.Collections;
import java.util.List;

/**
 * 32-bit linear congruential generator (Numerical Recipes constants).
 * The sequence depends only on the seed, so fallback content can be reproduced
 * exactly, including by implementations outside the JVM.
 */
public final class SeededRandom {

    private static final long MASK = 0xFFFFFFFFL;
    private static final long MULTIPLIER = 1664525L;
    private static final long INCREMENT = 1013904223L;

    private long state;

    public SeededRandom(long seed) {
        this.state = seed & MASK;
    }

    /**
     * @return the next value in [0, 2^32)
     */
    public long nextUnsignedInt() {
        state = (state * MULTIPLIER + INCREMENT) & MASK;
        return state;
    }

    /**
     * @return a value in [0, bound)
     */
    public int nextIndex(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return (int) ((nextUnsignedInt() * bound) >>> 32);
    }

    public <T> T pick(List<T> options) {
        return options.get(nextIndex(options.size()));
    }

    /**
     * Fisher-Yates shuffle in place, walking from the last index down.
     */
    public <T> void shuffle(List<T> items) {
        for (int i = items.size() - 1; i > 0; i--) {
            int j = nextIndex(i + 1);
            Collections.swap(items, i, j);
        }
    }
}
