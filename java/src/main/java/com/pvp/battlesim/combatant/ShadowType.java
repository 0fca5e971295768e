package com.pvp.battlesim.combatant;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Shadow form of a combatant. Shadows hit harder and take more damage.
 */
public enum ShadowType {
    NORMAL(1.0, 1.0),
    SHADOW(1.2, 0.833333),
    PURIFIED(1.0, 1.0);

    private final double attackFactor;
    private final double defenseFactor;

    ShadowType(double attackFactor, double defenseFactor) {
        this.attackFactor = attackFactor;
        this.defenseFactor = defenseFactor;
    }

    public double getAttackFactor() {
        return attackFactor;
    }

    public double getDefenseFactor() {
        return defenseFactor;
    }

    @JsonValue
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ShadowType fromName(String name) {
        if (name == null || name.isBlank()) {
            return NORMAL;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown shadow type: " + name, e);
        }
    }
}
