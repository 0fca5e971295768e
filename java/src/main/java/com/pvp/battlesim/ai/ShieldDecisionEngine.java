package com.pvp.battlesim.ai;

import com.pvp.battlesim.battle.DamageCalculator;
import com.pvp.battlesim.combatant.CombatantView;
import com.pvp.battlesim.move.ChargedMove;

/**
 * Predicts whether a defender blocks an incoming charged move.
 * The weights are used for randomized shielding and for bait planning.
 */
public final class ShieldDecisionEngine {

    private static final int BASE_SHIELD_WEIGHT = 1;
    private static final int NO_SHIELD_WEIGHT = 2;
    private static final int CYCLE_WEIGHT = 2;
    private static final int DANGER_WEIGHT = 4;
    private static final int HEAVY_PRESSURE_WEIGHT = 12;

    private ShieldDecisionEngine() {
        // Utility class - no instantiation
    }

    /**
     * Decide for the defender's current health, energy and shield count.
     *
     * @param attacker The combatant throwing the move
     * @param defender The combatant deciding whether to shield
     * @param move     The incoming charged move
     * @return The verdict and its weights; {@link ShieldDecision#NO_SHIELDS} when the defender has none
     */
    public static ShieldDecision decide(CombatantView attacker, CombatantView defender, ChargedMove move) {
        if (defender.getShields() <= 0) {
            return ShieldDecision.NO_SHIELDS;
        }

        boolean useShield = false;
        int shieldWeight = BASE_SHIELD_WEIGHT;
        int hp = defender.getHp();
        int damage = DamageCalculator.damage(attacker, defender, move);
        int postMoveHp = hp - damage;

        // Damage the attacker deals per shield cycle, to see if the defender lives to shield the next one
        int fastDamage = DamageCalculator.damage(attacker, defender, attacker.getFastMove());
        int energyGain = attacker.getFastMove().energyGain();
        int leftover = Math.max(attacker.getEnergy() - move.energyCost(), 0);
        int fastAttacks = energyGain > 0
                ? (int) Math.ceil((double) (move.energyCost() - leftover) / energyGain) + 1
                : 1;
        int cycleDamage = (fastAttacks * fastDamage + 1) * defender.getShields();

        if (postMoveHp <= cycleDamage) {
            useShield = true;
            shieldWeight = CYCLE_WEIGHT;
        }

        int fastTurns = attacker.getFastMove().turns();
        double fastDamagePerTurn = fastTurns > 0 ? (double) fastDamage / fastTurns : fastDamage;

        for (ChargedMove threat : attacker.getChargedMoves()) {
            int threatDamage = DamageCalculator.damage(attacker, defender, threat);

            if (threatDamage >= hp / 1.4 && fastDamagePerTurn > 1.5) {
                useShield = true;
                shieldWeight = DANGER_WEIGHT;
            }
            if (threatDamage >= hp - cycleDamage) {
                useShield = true;
                shieldWeight = DANGER_WEIGHT;
            }
            if (threatDamage >= hp / 2.0 && fastDamagePerTurn > 2) {
                shieldWeight = HEAVY_PRESSURE_WEIGHT;
            }
        }

        // First of a series of attack-lowering nukes
        if (move.isSelfAttackDebuffing() && hp > 0 && (double) damage / hp > 0.55) {
            useShield = true;
            shieldWeight = DANGER_WEIGHT;
        }

        if (damage * 2 >= defender.getMaxHp()) {
            shieldWeight = Math.max(shieldWeight, DANGER_WEIGHT);
        }

        if (postMoveHp <= 0) {
            useShield = true;
            shieldWeight = Math.max(shieldWeight, DANGER_WEIGHT);
        }

        return new ShieldDecision(useShield, shieldWeight, NO_SHIELD_WEIGHT);
    }
}
