package com.pvp.battlesim.ai;

import com.pvp.battlesim.move.ChargedMove;

/**
 * A weighted choice.
 *
 * @param label  Display label, e.g. "FAST_MOVE"
 * @param weight Non-negative selection weight
 * @param move   Charged move this option throws, or null for the fast move
 */
public record DecisionOption(String label, double weight, ChargedMove move) {

    public static final String FAST_MOVE = "FAST_MOVE";

    public DecisionOption {
        if (Double.isNaN(weight) || weight < 0) {
            throw new IllegalArgumentException("Option weight must be non-negative, got " + weight);
        }
    }

    public static DecisionOption fast(double weight) {
        return new DecisionOption(FAST_MOVE, weight, null);
    }

    public static DecisionOption charged(ChargedMove move, double weight) {
        return new DecisionOption(move.id(), weight, move);
    }

    public boolean isFastMove() {
        return move == null;
    }
}
