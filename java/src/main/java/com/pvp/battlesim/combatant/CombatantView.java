package com.pvp.battlesim.combatant;

import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.move.CombatType;
import com.pvp.battlesim.move.FastMove;

import java.util.List;

/**
 * Read-only view of a combatant's stats, battle state and moves.
 * Damage and decision logic depend only on this view.
 */
public interface CombatantView {

    String getId();

    CombatType getPrimaryType();

    /**
     * Second type, or null for a single-typed combatant.
     */
    CombatType getSecondaryType();

    /**
     * Effective attack before stat stages.
     */
    double getAttack();

    /**
     * Effective defense before stat stages.
     */
    double getDefense();

    int getMaxHp();

    int getHp();

    int getEnergy();

    int getShields();

    int getAttackStage();

    int getDefenseStage();

    /**
     * Ticks left before this combatant may act again; 0 when ready.
     */
    int getCooldown();

    FastMove getFastMove();

    /**
     * Zero to two charged moves, in slot order.
     */
    List<ChargedMove> getChargedMoves();

    boolean isFarmEnergy();

    boolean isBaitShields();

    boolean isOptimizeMoveTiming();

    default boolean hasType(CombatType type) {
        return type != null && (type == getPrimaryType() || type == getSecondaryType());
    }

    default boolean isFainted() {
        return getHp() <= 0;
    }

    default double getHpRatio() {
        return getMaxHp() > 0 ? (double) getHp() / getMaxHp() : 0;
    }

    /**
     * Cheapest charged move, or null when there are none.
     */
    default ChargedMove getCheapestChargedMove() {
        ChargedMove cheapest = null;
        for (ChargedMove move : getChargedMoves()) {
            if (cheapest == null || move.energyCost() < cheapest.energyCost()) {
                cheapest = move;
            }
        }
        return cheapest;
    }

    /**
     * Most expensive charged move, or null when there are none.
     */
    default ChargedMove getCostliestChargedMove() {
        ChargedMove costliest = null;
        for (ChargedMove move : getChargedMoves()) {
            if (costliest == null || move.energyCost() > costliest.energyCost()) {
                costliest = move;
            }
        }
        return costliest;
    }
}
