package com.pvp.battlesim.ai;

import com.pvp.battlesim.battle.ActionKind;
import com.pvp.battlesim.move.ChargedMove;

/**
 * The action a combatant commits to on a tick.
 *
 * @param kind   Fast or charged
 * @param move   The charged move, null for the fast move
 * @param reason Why it was chosen, for debug logs
 */
public record BattleAction(ActionKind kind, ChargedMove move, String reason) {

    public BattleAction {
        if (kind == ActionKind.CHARGED && move == null) {
            throw new IllegalArgumentException("Charged action requires a move");
        }
        if (kind == ActionKind.FAST && move != null) {
            throw new IllegalArgumentException("Fast action takes no charged move");
        }
    }

    public static BattleAction fast(String reason) {
        return new BattleAction(ActionKind.FAST, null, reason);
    }

    public static BattleAction charged(ChargedMove move, String reason) {
        return new BattleAction(ActionKind.CHARGED, move, reason);
    }

    public boolean isFast() {
        return kind == ActionKind.FAST;
    }

    public boolean isCharged() {
        return kind == ActionKind.CHARGED;
    }
}
