package com.pvp.battlesim.ai;

import com.pvp.battlesim.battle.DamageCalculator;
import com.pvp.battlesim.combatant.CombatantView;
import com.pvp.battlesim.move.ChargedMove;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders candidate charged moves before the final pick.
 * <ol>
 *   <li>Opponent out of shields: most damage first. Otherwise: cheapest first.</li>
 *   <li>Moves within a few energy of each other: better damage per energy first.</li>
 *   <li>With both sides healthy, a non-lethal self-debuffing move drops below a comparable alternative.</li>
 * </ol>
 */
public final class MoveReordering {

    private MoveReordering() {
        // Utility class - no instantiation
    }

    public static List<ChargedMove> reorder(CombatantView self, CombatantView opponent,
                                            List<ChargedMove> candidates, DecisionPolicy policy) {
        List<ChargedMove> ordered = new ArrayList<>(candidates);
        if (ordered.size() < 2) {
            return ordered;
        }

        if (opponent.getShields() == 0) {
            ordered.sort(Comparator.comparingInt((ChargedMove m) -> DamageCalculator.damage(self, opponent, m))
                    .reversed());
        } else {
            ordered.sort(Comparator.comparingInt(ChargedMove::energyCost));
        }

        // Near-equal cost: efficiency decides
        for (int i = 0; i + 1 < ordered.size(); i++) {
            ChargedMove a = ordered.get(i);
            ChargedMove b = ordered.get(i + 1);
            if (Math.abs(a.energyCost() - b.energyCost()) <= policy.nearEnergyWindow()
                    && effectiveDpe(self, opponent, b) > effectiveDpe(self, opponent, a)) {
                ordered.set(i, b);
                ordered.set(i + 1, a);
            }
        }

        if (self.getHpRatio() > policy.substantialHealthRatio()
                && opponent.getHpRatio() > policy.substantialHealthRatio()) {
            pushDebuffingMovesDown(self, opponent, ordered, policy);
        }
        return ordered;
    }

    /**
     * Damage dealt to this opponent per energy spent; 0 for a free move.
     */
    public static double effectiveDpe(CombatantView self, CombatantView opponent, ChargedMove move) {
        if (move.energyCost() <= 0) {
            return 0;
        }
        return (double) DamageCalculator.damage(self, opponent, move) / move.energyCost();
    }

    private static void pushDebuffingMovesDown(CombatantView self, CombatantView opponent,
                                               List<ChargedMove> ordered, DecisionPolicy policy) {
        for (int i = 0; i < ordered.size(); i++) {
            ChargedMove move = ordered.get(i);
            if (!move.isSelfDebuffing() || DamageCalculator.damage(self, opponent, move) >= opponent.getHp()) {
                continue;
            }
            double threshold = policy.comparableValueRatio() * effectiveDpe(self, opponent, move);
            for (int j = i + 1; j < ordered.size(); j++) {
                ChargedMove alternative = ordered.get(j);
                if (!alternative.isSelfDebuffing() && effectiveDpe(self, opponent, alternative) >= threshold) {
                    ordered.remove(i);
                    ordered.add(j, move);
                    return;
                }
            }
        }
    }
}
