package com.pvp.battlesim.ai;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a combatant picks its actions and shield responses.
 */
public enum DecisionMode {
    /** Full heuristic engine; shields follow the shield engine's verdict. */
    SMART,
    /** Uniform over every legal action; shields are a coin flip. */
    RANDOM,
    /** Randomized heuristic weights; shields drawn from the shield engine's weights. */
    WEIGHTED_RANDOM;

    @JsonValue
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DecisionMode fromName(String name) {
        if (name == null || name.isBlank()) {
            return SMART;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown decision mode: " + name, e);
        }
    }
}
