package com.pvp.battlesim.combatant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-instance stat modifiers, each in [0, 15].
 */
public record IndividualValues(
        @JsonProperty("attack") int attack,
        @JsonProperty("defense") int defense,
        @JsonProperty("stamina") int stamina
) {
    public static final int MAX = 15;
    public static final IndividualValues ZERO = new IndividualValues(0, 0, 0);
    public static final IndividualValues PERFECT = new IndividualValues(MAX, MAX, MAX);

    public IndividualValues {
        check("attack", attack);
        check("defense", defense);
        check("stamina", stamina);
    }

    private static void check(String stat, int value) {
        if (value < 0 || value > MAX) {
            throw new InvalidCombatantException(stat + " IV must be in [0, 15], got " + value);
        }
    }
}
