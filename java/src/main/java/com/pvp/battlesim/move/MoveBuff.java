package com.pvp.battlesim.move;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Stat change a charged move may trigger.
 * Multipliers above 1 raise a stage, below 1 lower it; 1 leaves the stat alone.
 *
 * @param attackMultiplier  Attack multiplier
 * @param defenseMultiplier Defense multiplier
 * @param target            Who receives the change
 * @param chance            Trigger probability in [0, 1]
 */
public record MoveBuff(
        @JsonProperty("attack") double attackMultiplier,
        @JsonProperty("defense") double defenseMultiplier,
        @JsonProperty("target") BuffTarget target,
        @JsonProperty("chance") double chance
) {
    public MoveBuff {
        if (attackMultiplier <= 0 || defenseMultiplier <= 0) {
            throw new IllegalArgumentException("Buff multipliers must be positive");
        }
        if (chance < 0 || chance > 1) {
            throw new IllegalArgumentException("Buff chance must be in [0, 1], got " + chance);
        }
        if (target == null) {
            target = BuffTarget.SELF;
        }
    }

    /**
     * Matchup files may omit target and chance; they default to SELF and 1.
     */
    @JsonCreator
    static MoveBuff fromJson(
            @JsonProperty("attack") Double attack,
            @JsonProperty("defense") Double defense,
            @JsonProperty("target") BuffTarget target,
            @JsonProperty("chance") Double chance) {
        return new MoveBuff(
                attack != null ? attack : 1.0,
                defense != null ? defense : 1.0,
                target,
                chance != null ? chance : 1.0);
    }

    public static MoveBuff self(double attackMultiplier, double defenseMultiplier, double chance) {
        return new MoveBuff(attackMultiplier, defenseMultiplier, BuffTarget.SELF, chance);
    }

    public static MoveBuff opponent(double attackMultiplier, double defenseMultiplier, double chance) {
        return new MoveBuff(attackMultiplier, defenseMultiplier, BuffTarget.OPPONENT, chance);
    }

    /**
     * Stage change for the attack stat when this buff triggers.
     */
    public int attackStages() {
        return toStages(attackMultiplier);
    }

    /**
     * Stage change for the defense stat when this buff triggers.
     */
    public int defenseStages() {
        return toStages(defenseMultiplier);
    }

    /**
     * Convert a multiplier to a stage delta.
     */
    public static int toStages(double multiplier) {
        if (multiplier >= 2.0) {
            return 2;
        } else if (multiplier >= 1.5) {
            return 1;
        } else if (multiplier <= 0.5) {
            return -2;
        } else if (multiplier <= 0.75) {
            return -1;
        }
        return 0;
    }

    boolean practical() {
        return chance > 0;
    }

    boolean lowersAny() {
        return attackMultiplier < 1 || defenseMultiplier < 1;
    }

    boolean raisesAny() {
        return attackMultiplier > 1 || defenseMultiplier > 1;
    }
}
