package com.pvp.battlesim.battle;

/**
 * Kind of action a combatant takes on a tick.
 */
public enum ActionKind {
    FAST,
    CHARGED
}
