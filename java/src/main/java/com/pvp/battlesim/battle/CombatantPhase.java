package com.pvp.battlesim.battle;

/**
 * Per-side phase within a tick.
 */
public enum CombatantPhase {
    /** Fast move still in progress. */
    COOLDOWN,
    /** Eligible for a new decision. */
    READY,
    /** This tick's action has been applied. */
    ACTION_RESOLVED
}
