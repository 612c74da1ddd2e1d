package com.dynop.wayfinding.simulation;

import java.nio.charset.StandardCharsets;
import java.util.SplittableRandom;

/**
 * Derives an independent random stream for every (seed, scenario, run, agent) tuple.
 *
 * <p>Components are folded together with the SplitMix64 finalizer, so a stream depends only on its
 * own coordinates and never on execution order.
 */
public final class SeedSequence {

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private SeedSequence() {
    }

    public static SplittableRandom streamFor(long seed, String scenario, int run, int agent) {
        return new SplittableRandom(derive(seed, scenario, run, agent));
    }

    static long derive(long seed, String scenario, int run, int agent) {
        long state = mix64(seed + GOLDEN_GAMMA);
        state = mix64(state ^ fnv1a(scenario));
        state = mix64(state + GOLDEN_GAMMA * (run + 1L));
        state = mix64(state ^ (GOLDEN_GAMMA * (agent + 1L)));
        return state;
    }

    static long mix64(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    private static long fnv1a(String text) {
        long hash = 0xCBF29CE484222325L;
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            hash ^= b & 0xff;
            hash *= 0x100000001B3L;
        }
        return hash;
    }
}
