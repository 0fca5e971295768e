package com.pvp.battlesim.move;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Who receives a charged move's stat change.
 */
public enum BuffTarget {
    SELF,
    OPPONENT;

    @JsonValue
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BuffTarget fromName(String name) {
        if (name == null || name.isBlank()) {
            return SELF;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "self" -> SELF;
            case "opponent", "enemy" -> OPPONENT;
            default -> throw new IllegalArgumentException("Invalid buff target: " + name);
        };
    }
}
