package com.hcltech.lineage.common.random;

import java.util.SplittableRandom;

/**
 * The single random source threaded through a run.
 * <p>
 * Nothing in the graph code touches ambient randomness; every draw goes through an instance of this
 * interface, so a run is reproducible from {@link #seed()}.
 */
public interface IRandom {

    /** Uniform in [0, 1). */
    double nextDouble();

    /** Uniform in [0, bound). */
    int nextInt(int bound);

    /** The seed this source was created from. */
    long seed();

    default boolean nextBoolean() {
        return nextDouble() < 0.5;
    }

    static IRandom seeded(long seed) {
        return new SeededRandom(seed);
    }

    /** A fresh seed is drawn; read it back with {@link #seed()} to replay the run. */
    static IRandom unseeded() {
        return new SeededRandom(new SplittableRandom().nextLong());
    }
}
