package com.pvp.battlesim.ai;

/**
 * Whether a defender would shield, plus relative weights for randomized shielding.
 *
 * @param value          The verdict
 * @param shieldWeight   Weight in favor of shielding
 * @param noShieldWeight Weight against shielding
 */
public record ShieldDecision(boolean value, int shieldWeight, int noShieldWeight) {

    public static final ShieldDecision NO_SHIELDS = new ShieldDecision(false, 0, 1);

    /**
     * Probability of shielding when drawn from the weights.
     */
    public double shieldProbability() {
        int total = shieldWeight + noShieldWeight;
        return total > 0 ? (double) shieldWeight / total : 0;
    }
}
