package com.pvp.battlesim.combatant;

/**
 * Thrown when a combatant is configured with values the ruleset does not allow.
 * Raised at construction, before any battle turn runs.
 */
public class InvalidCombatantException extends IllegalArgumentException {
    public InvalidCombatantException(String message) {
        super(message);
    }

    public InvalidCombatantException(String message, Throwable cause) {
        super(message, cause);
    }
}
