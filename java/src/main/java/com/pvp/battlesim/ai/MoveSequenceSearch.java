package com.pvp.battlesim.ai;

import com.pvp.battlesim.battle.DamageCalculator;
import com.pvp.battlesim.battle.StatStages;
import com.pvp.battlesim.combatant.CombatantView;
import com.pvp.battlesim.move.BuffTarget;
import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.move.FastMove;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded search for the quickest way to knock the opponent out with the given charged moves.
 * <p>
 * States are kept in a queue ordered by turn. Each state expands once per candidate move:
 * throw it now when affordable, otherwise farm fast moves until it is, then throw it.
 * The opponent's shield response branches on the {@link ShieldDecisionEngine} prediction,
 * and chance-based self buffs branch on their trigger probability.
 * <p>
 * The search keeps no state between calls.
 */
public final class MoveSequenceSearch {
    private static final Logger logger = LoggerFactory.getLogger(MoveSequenceSearch.class);

    private MoveSequenceSearch() {
        // Utility class - no instantiation
    }

    /**
     * Search knockout sequences.
     *
     * @param self       The deciding combatant
     * @param opponent   The opponent
     * @param candidates Charged moves the sequence may use
     * @param policy     Supplies the state budget
     * @return The best plan found, or an empty result when no knockout was reached
     */
    public static SearchResult search(CombatantView self, CombatantView opponent,
                                      List<ChargedMove> candidates, DecisionPolicy policy) {
        List<BattleState> queue = new ArrayList<>();
        List<BattleState> knockouts = new ArrayList<>();
        BattleState best = null;
        int explored = 0;
        boolean capped = false;

        queue.add(BattleState.initial(self.getEnergy(), opponent.getHp(), opponent.getShields()));

        while (!queue.isEmpty()) {
            if (explored >= policy.maxSearchStates()) {
                capped = true;
                logger.debug("{} search hit the {} state budget", self.getId(), policy.maxSearchStates());
                break;
            }
            explored++;

            BattleState current = queue.remove(0);

            if (current.isKnockout()) {
                knockouts.add(current);
                if (best == null || SearchResult.isBetter(current, best)) {
                    best = current;
                }
                // Queue is ordered by turn, so the first certain knockout is the fastest
                if (current.isCertain()) {
                    break;
                }
                continue;
            }

            for (ChargedMove move : candidates) {
                for (BattleState next : expand(self, opponent, current, move)) {
                    insert(queue, next);
                }
            }
        }

        return new SearchResult(best, knockouts, explored, capped);
    }

    /**
     * Successor states from throwing {@code move}, farming first when it is not yet affordable.
     */
    static List<BattleState> expand(CombatantView self, CombatantView opponent,
                                    BattleState current, ChargedMove move) {
        List<BattleState> successors = new ArrayList<>(4);
        FastMove fastMove = self.getFastMove();

        int fastMovesNeeded = 0;
        if (current.energy() < move.energyCost()) {
            if (fastMove.energyGain() <= 0) {
                // Never affordable
                return successors;
            }
            fastMovesNeeded = (int) Math.ceil(
                    (double) (move.energyCost() - current.energy()) / fastMove.energyGain());
        }

        int stages = current.attackStages();
        int fastDamage = DamageCalculator.damage(self, opponent, fastMove, stages);
        int moveDamage = DamageCalculator.damage(self, opponent, move, stages);

        int energyBeforeThrow = Math.min(100, current.energy() + fastMovesNeeded * fastMove.energyGain());
        int energyAfter = energyBeforeThrow - move.energyCost();
        int hpBeforeThrow = current.opponentHp() - fastMovesNeeded * fastDamage;
        int turn = current.turn() + fastMovesNeeded * fastMove.turns() + 1;

        // Stage outcomes: the buff may always, never or sometimes trigger
        int buffedStages = stages;
        double buffChance = 0;
        if (move.hasBuff() && move.buff().target() == BuffTarget.SELF && move.selfAttackStages() != 0) {
            buffedStages = StatStages.clamp(stages + move.selfAttackStages());
            buffChance = move.buff().chance();
        }

        // Shield outcomes
        List<ShieldOutcome> shieldOutcomes = new ArrayList<>(2);
        if (current.opponentShields() > 0 && hpBeforeThrow > 0) {
            ShieldDecision decision = ShieldDecisionEngine.decide(
                    ProjectedView.attacker(self, energyBeforeThrow, stages),
                    ProjectedView.defender(opponent, hpBeforeThrow, current.opponentShields()),
                    move);
            double p = decision.value() ? 1.0 : decision.shieldProbability();
            if (p > 0) {
                shieldOutcomes.add(new ShieldOutcome(true, p));
            }
            if (p < 1) {
                shieldOutcomes.add(new ShieldOutcome(false, 1 - p));
            }
        } else {
            shieldOutcomes.add(new ShieldOutcome(false, 1.0));
        }

        for (ShieldOutcome outcome : shieldOutcomes) {
            boolean shielded = outcome.shielded();
            double chance = current.chance() * outcome.probability();
            int hp = hpBeforeThrow - (shielded ? DamageCalculator.SHIELDED_DAMAGE : moveDamage);
            int shields = shielded ? current.opponentShields() - 1 : current.opponentShields();

            if (buffChance >= 1) {
                successors.add(current.next(energyAfter, hp, turn, shields, move, buffedStages, chance));
            } else if (buffChance > 0) {
                successors.add(current.next(energyAfter, hp, turn, shields, move, buffedStages,
                        chance * buffChance));
                successors.add(current.next(energyAfter, hp, turn, shields, move, stages,
                        chance * (1 - buffChance)));
            } else {
                successors.add(current.next(energyAfter, hp, turn, shields, move, stages, chance));
            }
        }
        return successors;
    }

    /**
     * Insert after every state of an equal or earlier turn, unless one of those dominates it.
     */
    static void insert(List<BattleState> queue, BattleState state) {
        int i = 0;
        while (i < queue.size() && queue.get(i).turn() <= state.turn()) {
            if (queue.get(i).dominates(state)) {
                return;
            }
            i++;
        }
        queue.add(i, state);
    }

    private record ShieldOutcome(boolean shielded, double probability) {
    }
}
