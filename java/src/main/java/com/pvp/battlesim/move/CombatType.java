package com.pvp.battlesim.move;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The 18 elemental types shared by moves and combatants.
 */
public enum CombatType {
    NORMAL,
    FIGHTING,
    FLYING,
    POISON,
    GROUND,
    ROCK,
    BUG,
    GHOST,
    STEEL,
    FIRE,
    WATER,
    GRASS,
    ELECTRIC,
    PSYCHIC,
    ICE,
    DRAGON,
    DARK,
    FAIRY;

    /**
     * Lower-case name used in matchup files ("water", "flying", ...).
     */
    @JsonValue
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a type from its name.
     * @param name The type name (case-insensitive)
     * @return The corresponding type, or null for a null/blank/"none" name
     * @throws IllegalArgumentException if the name is not a known type
     */
    @JsonCreator
    public static CombatType fromName(String name) {
        if (name == null || name.isBlank() || name.equalsIgnoreCase("none")) {
            return null;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown type: " + name, e);
        }
    }
}
