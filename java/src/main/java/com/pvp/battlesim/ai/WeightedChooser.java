package com.pvp.battlesim.ai;

import com.pvp.battlesim.rng.BattleRng;

import java.util.List;

/**
 * Weighted sampling over decision options.
 */
public final class WeightedChooser {

    private WeightedChooser() {
        // Utility class - no instantiation
    }

    /**
     * Draw one option with probability weight / total.
     * When every weight is zero the first option is returned without consuming a draw.
     */
    public static DecisionOption choose(List<DecisionOption> options, BattleRng rng) {
        if (options == null || options.isEmpty()) {
            throw new IllegalArgumentException("No options to choose from");
        }
        double total = 0;
        for (DecisionOption option : options) {
            total += option.weight();
        }
        if (total == 0) {
            return options.get(0);
        }

        double roll = rng.next() * total;
        double cumulative = 0;
        DecisionOption lastPositive = options.get(0);
        for (DecisionOption option : options) {
            if (option.weight() <= 0) {
                continue;
            }
            cumulative += option.weight();
            lastPositive = option;
            if (roll < cumulative) {
                return option;
            }
        }
        // Rounding can leave the roll just past the final boundary
        return lastPositive;
    }
}
