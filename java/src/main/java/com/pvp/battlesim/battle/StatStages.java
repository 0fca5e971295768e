package com.pvp.battlesim.battle;

/**
 * Stat stage arithmetic. Stages run from -4 to +4.
 */
public final class StatStages {

    public static final int MIN_STAGE = -4;
    public static final int MAX_STAGE = 4;

    private StatStages() {
        // Utility class - no instantiation
    }

    public static boolean isValid(int stage) {
        return stage >= MIN_STAGE && stage <= MAX_STAGE;
    }

    public static int clamp(int stage) {
        return Math.max(MIN_STAGE, Math.min(MAX_STAGE, stage));
    }

    /**
     * Stat multiplier for a stage. Out-of-range stages are clamped first.
     * +1 is 1.5x, +4 is 3x, -1 is 2/3, -4 is 1/3.
     */
    public static double multiplier(int stage) {
        int s = clamp(stage);
        if (s > 0) {
            return Math.max(2, 2 + s) / 2.0;
        } else if (s < 0) {
            return 2.0 / Math.max(2, 2 - s);
        }
        return 1.0;
    }
}
