package com.pvp.battlesim.battle;

import com.pvp.battlesim.combatant.CombatantView;
import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.move.CombatType;
import com.pvp.battlesim.move.FastMove;
import com.pvp.battlesim.move.TypeEffectiveness;

/**
 * Single-attack damage.
 * damage = floor(0.5 * power * attack / defense * effectiveness * stab) + 1
 */
public final class DamageCalculator {

    public static final double STAB = 1.2;
    public static final int SHIELDED_DAMAGE = 1;

    private DamageCalculator() {
        // Utility class - no instantiation
    }

    public static int damage(CombatantView attacker, CombatantView defender, FastMove move) {
        return damage(attacker, defender, move.power(), move.type(), 0);
    }

    public static int damage(CombatantView attacker, CombatantView defender, ChargedMove move) {
        return damage(attacker, defender, move.power(), move.type(), 0);
    }

    /**
     * Damage with the attacker's attack stage shifted by {@code attackStageDelta},
     * as when projecting the effect of earlier self-buffs.
     */
    public static int damage(CombatantView attacker, CombatantView defender, FastMove move, int attackStageDelta) {
        return damage(attacker, defender, move.power(), move.type(), attackStageDelta);
    }

    public static int damage(CombatantView attacker, CombatantView defender, ChargedMove move, int attackStageDelta) {
        return damage(attacker, defender, move.power(), move.type(), attackStageDelta);
    }

    /**
     * Charged move damage; a shielded hit always deals {@link #SHIELDED_DAMAGE}.
     */
    public static int chargedDamage(CombatantView attacker, CombatantView defender, ChargedMove move, boolean shielded) {
        if (shielded) {
            return SHIELDED_DAMAGE;
        }
        return damage(attacker, defender, move);
    }

    private static int damage(CombatantView attacker, CombatantView defender,
                              int power, CombatType type, int attackStageDelta) {
        double attack = attacker.getAttack() * StatStages.multiplier(attacker.getAttackStage() + attackStageDelta);
        double defense = defender.getDefense() * StatStages.multiplier(defender.getDefenseStage());
        double effectiveness = TypeEffectiveness.effectiveness(
                type, defender.getPrimaryType(), defender.getSecondaryType());
        double stab = attacker.hasType(type) ? STAB : 1.0;

        return (int) Math.floor(0.5 * power * (attack / defense) * effectiveness * stab) + 1;
    }
}
