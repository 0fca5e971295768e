package com.pvp.battlesim.ai;

/**
 * Behavioral thresholds used by the decision engine.
 *
 * @param baitDpeRatio             Bait with the cheaper move unless the costlier one's damage per energy
 *                                 exceeds this multiple of the cheaper one's
 * @param shieldDrawBoost          Weight multiplier for a move predicted to draw a shield
 * @param farmCompletionBoost      Weight multiplier for the costliest move when just reached
 * @param farmCompletionMargin     Energy above cost that still counts as "just reached"
 * @param selfDebuffEnergyMultiple Self-debuffing moves are deferred below this multiple of the costliest move's cost
 * @param selfBuffEnergyMargin     Energy above cost that waives deferral for net self-buffing moves
 * @param nearEnergyWindow         Moves this close in cost are ordered by damage per energy
 * @param substantialHealthRatio   Health fraction above which neither side is in a hurry
 * @param comparableValueRatio     An alternative is comparable when its damage per energy is at least this
 *                                 fraction of a self-debuffing move's
 * @param lowHealthBaitRatio       No baiting below this health fraction...
 * @param lowHealthBaitEnergy      ...unless energy is at least this
 * @param maxSearchStates          State budget of one move-sequence search
 * @param tieTolerance             Relative gap under which two candidate weights count as tied
 */
public record DecisionPolicy(
        double baitDpeRatio,
        double shieldDrawBoost,
        double farmCompletionBoost,
        int farmCompletionMargin,
        double selfDebuffEnergyMultiple,
        int selfBuffEnergyMargin,
        int nearEnergyWindow,
        double substantialHealthRatio,
        double comparableValueRatio,
        double lowHealthBaitRatio,
        int lowHealthBaitEnergy,
        int maxSearchStates,
        double tieTolerance
) {
    public DecisionPolicy {
        if (baitDpeRatio <= 0 || shieldDrawBoost <= 0 || farmCompletionBoost <= 0) {
            throw new IllegalArgumentException("Ratios and boosts must be positive");
        }
        if (maxSearchStates <= 0) {
            throw new IllegalArgumentException("maxSearchStates must be positive, got " + maxSearchStates);
        }
        if (tieTolerance < 0 || tieTolerance >= 1) {
            throw new IllegalArgumentException("tieTolerance must be in [0, 1), got " + tieTolerance);
        }
    }

    public static DecisionPolicy defaults() {
        return new DecisionPolicy(
                1.5,
                1.3,
                1.2,
                5,
                2.0,
                10,
                10,
                0.5,
                0.75,
                0.25,
                70,
                500,
                0.05
        );
    }

    public DecisionPolicy withMaxSearchStates(int maxSearchStates) {
        return new DecisionPolicy(baitDpeRatio, shieldDrawBoost, farmCompletionBoost, farmCompletionMargin,
                selfDebuffEnergyMultiple, selfBuffEnergyMargin, nearEnergyWindow, substantialHealthRatio,
                comparableValueRatio, lowHealthBaitRatio, lowHealthBaitEnergy, maxSearchStates, tieTolerance);
    }

    public DecisionPolicy withBaitDpeRatio(double baitDpeRatio) {
        return new DecisionPolicy(baitDpeRatio, shieldDrawBoost, farmCompletionBoost, farmCompletionMargin,
                selfDebuffEnergyMultiple, selfBuffEnergyMargin, nearEnergyWindow, substantialHealthRatio,
                comparableValueRatio, lowHealthBaitRatio, lowHealthBaitEnergy, maxSearchStates, tieTolerance);
    }
}
