package com.pvp.battlesim.combatant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Species base stats.
 */
public record BaseStats(
        @JsonProperty("attack") int attack,
        @JsonProperty("defense") int defense,
        @JsonProperty("stamina") int stamina
) {
    public BaseStats {
        if (attack <= 0 || defense <= 0 || stamina <= 0) {
            throw new InvalidCombatantException(
                    "Base stats must be positive, got " + attack + "/" + defense + "/" + stamina);
        }
    }
}
