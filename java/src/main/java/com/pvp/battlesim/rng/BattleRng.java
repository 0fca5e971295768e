package com.pvp.battlesim.rng;

import java.security.SecureRandom;

/**
 * Seeded random number generator for reproducible battles.
 * Uses the Mulberry32 PRNG so a seed fully determines every draw a battle makes:
 * weighted decisions, shield coin flips, buff triggers and charge move priority ties.
 * <p>
 * Instances are not thread-safe. Give each battle its own generator.
 */
public class BattleRng {
    private final long seed;
    private long state;

    /**
     * Create a new BattleRng with the specified seed.
     * Only the lower 32 bits of the seed are used.
     */
    public BattleRng(long seed) {
        this.seed = seed;
        this.state = seed & 0xFFFFFFFFL;
    }

    /**
     * Create a new BattleRng with a random seed from SecureRandom.
     */
    public BattleRng() {
        this(new SecureRandom().nextLong());
    }

    /**
     * Generate next random number in [0, 1).
     */
    public double next() {
        state = (state + 0x6D2B79F5L) & 0xFFFFFFFFL;
        long t = state;

        t = ((t ^ (t >>> 15)) * (t | 1)) & 0xFFFFFFFFL;
        t = (t ^ (t + ((t ^ (t >>> 7)) * (t | 61)) & 0xFFFFFFFFL)) & 0xFFFFFFFFL;

        long result = (t ^ (t >>> 14)) & 0xFFFFFFFFL;

        return result / 4294967296.0;
    }

    /**
     * Return true with the given probability. Probabilities of 1 or more never consume a draw,
     * probabilities of 0 or less never do either.
     */
    public boolean chance(double probability) {
        if (probability >= 1.0) {
            return true;
        }
        if (probability <= 0.0) {
            return false;
        }
        return next() < probability;
    }

    /**
     * Derive an independent generator, e.g. one per battle in a batch.
     */
    public BattleRng fork(int index) {
        return new BattleRng(seed + index);
    }

    /**
     * Get the seed this generator was created with.
     */
    public long getSeed() {
        return seed;
    }

    /**
     * Get the current state (for debugging/testing).
     */
    public long getState() {
        return state;
    }
}
