package com.pvp.battlesim.ai;

import com.pvp.battlesim.battle.DamageCalculator;
import com.pvp.battlesim.combatant.CombatantView;
import com.pvp.battlesim.move.ChargedMove;

import java.util.ArrayList;
import java.util.List;

/**
 * Holds back self-debuffing moves while the combatant is exposed.
 * <p>
 * A self-debuffing move is deferred when the combatant has no shields, its energy is below
 * {@link DecisionPolicy#selfDebuffEnergyMultiple()} times its costliest move's cost, and the
 * opponent can already afford its hardest-hitting move and would not have it shielded.
 * A move that raises the user's stages on net is still allowed once energy covers its cost plus
 * {@link DecisionPolicy#selfBuffEnergyMargin()}.
 */
public final class SelfDebuffDeferral {

    private SelfDebuffDeferral() {
        // Utility class - no instantiation
    }

    /**
     * @return The candidates that may be used now, in their original order
     */
    public static List<ChargedMove> filter(CombatantView self, CombatantView opponent,
                                           List<ChargedMove> candidates, DecisionPolicy policy) {
        if (!shouldDefer(self, opponent, policy)) {
            return List.copyOf(candidates);
        }
        List<ChargedMove> allowed = new ArrayList<>(candidates.size());
        for (ChargedMove move : candidates) {
            if (!move.isSelfDebuffing() || isWaived(self, move, policy)) {
                allowed.add(move);
            }
        }
        return allowed;
    }

    /**
     * Whether the current situation calls for deferring self-debuffing moves at all.
     */
    public static boolean shouldDefer(CombatantView self, CombatantView opponent, DecisionPolicy policy) {
        if (self.getShields() != 0) {
            return false;
        }
        ChargedMove costliest = self.getCostliestChargedMove();
        if (costliest == null || self.getEnergy() >= policy.selfDebuffEnergyMultiple() * costliest.energyCost()) {
            return false;
        }
        ChargedMove threat = strongestMove(opponent, self);
        if (threat == null || opponent.getEnergy() < threat.energyCost()) {
            return false;
        }
        return !ShieldDecisionEngine.decide(opponent, self, threat).value();
    }

    static boolean isWaived(CombatantView self, ChargedMove move, DecisionPolicy policy) {
        return move.isSelfBuffing()
                && move.netSelfStages() > 0
                && self.getEnergy() >= move.energyCost() + policy.selfBuffEnergyMargin();
    }

    private static ChargedMove strongestMove(CombatantView attacker, CombatantView defender) {
        ChargedMove strongest = null;
        int strongestDamage = -1;
        for (ChargedMove move : attacker.getChargedMoves()) {
            int damage = DamageCalculator.damage(attacker, defender, move);
            if (damage > strongestDamage) {
                strongest = move;
                strongestDamage = damage;
            }
        }
        return strongest;
    }
}
