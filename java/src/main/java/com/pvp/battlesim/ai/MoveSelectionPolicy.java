package com.pvp.battlesim.ai;

import com.pvp.battlesim.combatant.CombatantView;
import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.rng.BattleRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Chooses between charged moves and charging up, given the moves still in play.
 * <p>
 * Rules, in order:
 * <ol>
 *   <li>Defer self-debuffing moves while exposed ({@link SelfDebuffDeferral}).</li>
 *   <li>Bait: against shields, open with the cheaper remaining move unless the costlier one is far more efficient.</li>
 *   <li>Farm: if the best plan opens with a move not yet affordable, keep using the fast move.</li>
 *   <li>Among moves tied on plan value, prefer higher damage per energy.</li>
 * </ol>
 */
public final class MoveSelectionPolicy {
    private static final Logger logger = LoggerFactory.getLogger(MoveSelectionPolicy.class);

    private MoveSelectionPolicy() {
        // Utility class - no instantiation
    }

    public static BattleAction select(CombatantView self, CombatantView opponent,
                                      List<ChargedMove> candidates, DecisionPolicy policy, BattleRng rng) {
        if (candidates.isEmpty()) {
            return BattleAction.fast("no charged moves in play");
        }

        // 1. Deferral narrows the set every later rule may open with
        List<ChargedMove> allowed = SelfDebuffDeferral.filter(self, opponent, candidates, policy);
        if (allowed.isEmpty()) {
            return BattleAction.fast("deferring self-debuffing moves");
        }

        // 2. Bait
        ChargedMove bait = baitMove(self, opponent, allowed, policy);
        if (bait != null) {
            if (self.getEnergy() >= bait.energyCost()) {
                return BattleAction.charged(bait, "baiting a shield with " + bait.id());
            }
            return BattleAction.fast("charging toward bait move " + bait.id());
        }

        SearchResult plan = MoveSequenceSearch.search(self, opponent, allowed, policy);
        logger.debug("{} explored {} states, best plan {}", self.getId(), plan.statesExplored(),
                plan.hasPlan() ? plan.best().moves() : "none");
        if (!plan.hasPlan()) {
            return BattleAction.fast(plan.capped() ? "search budget exhausted" : "no knockout plan");
        }

        // 3. Farm
        ChargedMove opener = plan.firstMove();
        if (self.getEnergy() < opener.energyCost()) {
            return BattleAction.fast("farming energy for " + opener.id());
        }

        // 4. Weighted pick among the affordable moves tied with the best plan
        List<ChargedMove> ordered = MoveReordering.reorder(self, opponent, allowed, policy);
        List<DecisionOption> options = weigh(self, opponent, ordered, plan, policy);
        ChargedMove chosen = breakTies(self, opponent, options, policy, rng);
        if (chosen == null) {
            chosen = opener;
        }
        return BattleAction.charged(chosen, "plan " + plan.best().moves() + " opens with " + chosen.id());
    }

    /**
     * The cheaper move when a bait is worthwhile, else null.
     */
    static ChargedMove baitMove(CombatantView self, CombatantView opponent,
                                List<ChargedMove> candidates, DecisionPolicy policy) {
        if (opponent.getShields() <= 0 || !self.isBaitShields() || candidates.size() != 2) {
            return null;
        }
        if (self.getHpRatio() < policy.lowHealthBaitRatio() && self.getEnergy() < policy.lowHealthBaitEnergy()) {
            return null;
        }
        ChargedMove first = candidates.get(0);
        ChargedMove second = candidates.get(1);
        if (first.energyCost() == second.energyCost()) {
            return null;
        }
        ChargedMove cheaper = first.energyCost() < second.energyCost() ? first : second;
        ChargedMove costlier = cheaper == first ? second : first;

        double cheaperDpe = MoveReordering.effectiveDpe(self, opponent, cheaper);
        double costlierDpe = MoveReordering.effectiveDpe(self, opponent, costlier);
        if (costlierDpe > policy.baitDpeRatio() * cheaperDpe) {
            return null;
        }
        return cheaper;
    }

    /**
     * Weight each affordable move by its plan value and the shield-draw and farm-completion boosts.
     */
    static List<DecisionOption> weigh(CombatantView self, CombatantView opponent, List<ChargedMove> ordered,
                                      SearchResult plan, DecisionPolicy policy) {
        ChargedMove costliest = null;
        for (ChargedMove move : ordered) {
            if (costliest == null || move.energyCost() > costliest.energyCost()) {
                costliest = move;
            }
        }

        List<DecisionOption> options = new ArrayList<>(ordered.size());
        for (ChargedMove move : ordered) {
            if (self.getEnergy() < move.energyCost()) {
                continue;
            }
            double weight = plan.score(move);
            if (weight <= 0) {
                continue;
            }
            if (opponent.getShields() > 0 && ShieldDecisionEngine.decide(self, opponent, move).value()) {
                weight *= policy.shieldDrawBoost();
            }
            if (ordered.size() > 1 && move == costliest
                    && self.getEnergy() - move.energyCost() <= policy.farmCompletionMargin()) {
                weight *= policy.farmCompletionBoost();
            }
            options.add(DecisionOption.charged(move, weight));
        }
        return options;
    }

    /**
     * Keep the options within tolerance of the top weight, prefer higher damage per energy,
     * and draw among whatever is still tied.
     */
    static ChargedMove breakTies(CombatantView self, CombatantView opponent, List<DecisionOption> options,
                                 DecisionPolicy policy, BattleRng rng) {
        if (options.isEmpty()) {
            return null;
        }
        double top = options.stream().mapToDouble(DecisionOption::weight).max().orElse(0);
        List<DecisionOption> tied = new ArrayList<>();
        for (DecisionOption option : options) {
            if (option.weight() >= top * (1 - policy.tieTolerance())) {
                tied.add(option);
            }
        }
        if (tied.size() == 1) {
            return tied.get(0).move();
        }

        double bestDpe = tied.stream()
                .mapToDouble(o -> MoveReordering.effectiveDpe(self, opponent, o.move()))
                .max().orElse(0);
        List<DecisionOption> finalists = new ArrayList<>();
        for (DecisionOption option : tied) {
            if (MoveReordering.effectiveDpe(self, opponent, option.move()) >= bestDpe - 1e-9) {
                finalists.add(option);
            }
        }
        if (finalists.size() == 1) {
            return finalists.get(0).move();
        }
        return WeightedChooser.choose(finalists, rng).move();
    }
}
