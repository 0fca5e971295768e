package com.pvp.battlesim.battle;

/**
 * One of the two battle participants.
 */
public enum Side {
    ONE,
    TWO;

    public Side opponent() {
        return this == ONE ? TWO : ONE;
    }
}
