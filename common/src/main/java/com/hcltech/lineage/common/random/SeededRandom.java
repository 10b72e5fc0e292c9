package com.hcltech.lineage.common.random;

import java.util.SplittableRandom;

/** Not thread safe. A run owns its instance. */
final class SeededRandom implements IRandom {
    private final long seed;
    private final SplittableRandom rng;

    SeededRandom(long seed) {
        this.seed = seed;
        this.rng = new SplittableRandom(seed);
    }

    @Override
    public double nextDouble() {
        return rng.nextDouble();
    }

    @Override
    public int nextInt(int bound) {
        if (bound <= 0) throw new IllegalArgumentException("bound must be > 0 but was " + bound);
        return rng.nextInt(bound);
    }

    @Override
    public long seed() {
        return seed;
    }

    @Override
    public String toString() {
        return "SeededRandom(" + seed + ")";
    }
}
