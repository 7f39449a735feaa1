package org.outbreak.runtime.internal.services;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.outbreak.runtime.spi.IRandomProvider;

/**
 * {@link IRandomProvider} backed by the Apache Commons Math {@link Well19937c} generator. The stream is
 * fully determined by the seed and identical across platforms.
 */
public final class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final RandomGenerator rng;

    /**
     * @param seed The seed of the stream.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
    }

    @Override
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be > 0 but was " + bound);
        }
        return rng.nextInt(bound);
    }

    @Override
    public double nextDouble() {
        return rng.nextDouble();
    }

    @Override
    public String toString() {
        return "SeededRandomProvider{seed=" + seed + "}";
    }
}
