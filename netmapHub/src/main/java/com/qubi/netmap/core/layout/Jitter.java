package com.qubi.netmap.core.layout;

import java.util.Random;

/**
 * Seedable source of cosmetic offsets. Each device draws from its own stream, seeded from
 * the engine seed and the device identity, so offsets do not depend on iteration order.
 */
public final class Jitter {
    private final long seed;

    public Jitter(long seed) {
        this.seed = seed;
    }

    /** Uniform offset in {@code [-radius, radius]} on both axes for the given key. */
    public double[] offset(String key, double radius) {
        Random r = new Random(seed * 1_000_003L + (key == null ? 0 : key.hashCode()));
        return new double[] {
                (r.nextDouble() * 2 - 1) * radius,
                (r.nextDouble() * 2 - 1) * radius
        };
    }
}
