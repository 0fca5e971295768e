package com.pvp.battlesim.move;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fast move template. Immutable and shared across battles.
 *
 * @param id         Move identifier, e.g. "MUD_SHOT"
 * @param name       Display name
 * @param type       Move type
 * @param power      Base power
 * @param energyGain Energy gained per use
 * @param turns      Duration in 500 ms turns
 */
public record FastMove(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("type") CombatType type,
        @JsonProperty("power") int power,
        @JsonProperty("energy_gain") int energyGain,
        @JsonProperty("turns") int turns
) {
    public static final int TURN_DURATION_MS = 500;

    public FastMove {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Fast move id is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("Fast move " + id + " has no type");
        }
        if (power < 0) {
            throw new IllegalArgumentException("Fast move " + id + " has negative power: " + power);
        }
        if (energyGain < 0 || energyGain > 100) {
            throw new IllegalArgumentException("Fast move " + id + " energy gain out of range: " + energyGain);
        }
        if (turns < 0) {
            throw new IllegalArgumentException("Fast move " + id + " has negative turns: " + turns);
        }
        if (name == null) {
            name = id;
        }
    }

    /**
     * Cooldown in milliseconds.
     */
    @JsonIgnore
    public int cooldown() {
        return turns * TURN_DURATION_MS;
    }

    /**
     * Damage per second, 0 for a zero cooldown.
     */
    @JsonIgnore
    public double dps() {
        int cooldown = cooldown();
        return cooldown > 0 ? power / (cooldown / 1000.0) : 0;
    }

    /**
     * Energy per second, 0 for a zero cooldown.
     */
    @JsonIgnore
    public double eps() {
        int cooldown = cooldown();
        return cooldown > 0 ? energyGain / (cooldown / 1000.0) : 0;
    }

    @Override
    public String toString() {
        return id;
    }
}
