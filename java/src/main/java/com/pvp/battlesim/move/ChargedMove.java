package com.pvp.battlesim.move;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Charged move template. Immutable and shared across battles.
 * Buff classifications are derived from {@link #buff()}, never stored.
 *
 * @param id         Move identifier, e.g. "ROCK_SLIDE"
 * @param name       Display name
 * @param type       Move type
 * @param power      Base power
 * @param energyCost Energy spent per use
 * @param buff       Stat change this move may trigger, or null
 */
public record ChargedMove(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("type") CombatType type,
        @JsonProperty("power") int power,
        @JsonProperty("energy_cost") int energyCost,
        @JsonProperty("buff") MoveBuff buff
) {
    public ChargedMove {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Charged move id is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("Charged move " + id + " has no type");
        }
        if (power < 0) {
            throw new IllegalArgumentException("Charged move " + id + " has negative power: " + power);
        }
        if (energyCost < 0 || energyCost > 100) {
            throw new IllegalArgumentException("Charged move " + id + " energy cost out of range: " + energyCost);
        }
        if (name == null) {
            name = id;
        }
    }

    public ChargedMove(String id, CombatType type, int power, int energyCost) {
        this(id, id, type, power, energyCost, null);
    }

    public ChargedMove(String id, CombatType type, int power, int energyCost, MoveBuff buff) {
        this(id, id, type, power, energyCost, buff);
    }

    /**
     * Damage per energy, 0 for a free move.
     */
    @JsonIgnore
    public double dpe() {
        return energyCost > 0 ? (double) power / energyCost : 0;
    }

    @JsonIgnore
    public boolean hasBuff() {
        return buff != null && buff.practical();
    }

    /**
     * Lowers one of the user's own stats.
     */
    @JsonIgnore
    public boolean isSelfDebuffing() {
        return hasBuff() && buff.target() == BuffTarget.SELF && buff.lowersAny();
    }

    /**
     * Raises one of the user's own stats.
     */
    @JsonIgnore
    public boolean isSelfBuffing() {
        return hasBuff() && buff.target() == BuffTarget.SELF && buff.raisesAny();
    }

    /**
     * Lowers one of the opponent's stats.
     */
    @JsonIgnore
    public boolean isOpponentDebuffing() {
        return hasBuff() && buff.target() == BuffTarget.OPPONENT && buff.lowersAny();
    }

    /**
     * Lowers the user's own attack, like Superpower.
     */
    @JsonIgnore
    public boolean isSelfAttackDebuffing() {
        return hasBuff() && buff.target() == BuffTarget.SELF && buff.attackMultiplier() < 1;
    }

    /**
     * Net stage change applied to the user (attack + defense), 0 when the buff targets the opponent.
     */
    @JsonIgnore
    public int netSelfStages() {
        if (!hasBuff() || buff.target() != BuffTarget.SELF) {
            return 0;
        }
        return buff.attackStages() + buff.defenseStages();
    }

    /**
     * Attack stage change applied to the user when the buff triggers.
     */
    @JsonIgnore
    public int selfAttackStages() {
        if (!hasBuff() || buff.target() != BuffTarget.SELF) {
            return 0;
        }
        return buff.attackStages();
    }

    @Override
    public String toString() {
        return id;
    }
}
