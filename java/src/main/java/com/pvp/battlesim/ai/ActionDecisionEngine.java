package com.pvp.battlesim.ai;

import com.pvp.battlesim.battle.DamageCalculator;
import com.pvp.battlesim.combatant.CombatantView;
import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.rng.BattleRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-tick action choice for a combatant that is ready to act.
 * <p>
 * SMART decisions, in priority order:
 * <ol>
 *   <li>No charged move affordable: fast move.</li>
 *   <li>Survival: about to be knocked out, throw the hardest-hitting affordable move that is not deferred.</li>
 *   <li>Lethal: an affordable move that knocks the opponent out after its shield response.</li>
 *   <li>Timing: hold a charged move to land it during the opponent's fast move.</li>
 *   <li>Otherwise {@link MoveSelectionPolicy}.</li>
 * </ol>
 * A fast move is always available as the fallback.
 */
public class ActionDecisionEngine {
    private static final Logger logger = LoggerFactory.getLogger(ActionDecisionEngine.class);

    private static final double RANDOM_FAST_WEIGHT = 10;

    private final DecisionMode mode;
    private final DecisionPolicy policy;

    public ActionDecisionEngine(DecisionMode mode, DecisionPolicy policy) {
        if (mode == null || policy == null) {
            throw new IllegalArgumentException("Decision mode and policy are required");
        }
        this.mode = mode;
        this.policy = policy;
    }

    public ActionDecisionEngine() {
        this(DecisionMode.SMART, DecisionPolicy.defaults());
    }

    public DecisionMode getMode() {
        return mode;
    }

    public DecisionPolicy getPolicy() {
        return policy;
    }

    /**
     * Choose this tick's action.
     *
     * @param self     The combatant deciding; must be off cooldown
     * @param opponent Its opponent
     * @param rng      Source for every random draw the decision makes
     */
    public BattleAction decide(CombatantView self, CombatantView opponent, BattleRng rng) {
        BattleAction action = switch (mode) {
            case SMART -> decideSmart(self, opponent, rng);
            case RANDOM -> decideUniform(self, rng);
            case WEIGHTED_RANDOM -> decideWeightedRandom(self, opponent, rng);
        };
        logger.debug("{} [{} energy] -> {} ({})", self.getId(), self.getEnergy(),
                action.isFast() ? self.getFastMove().id() : action.move().id(), action.reason());
        return action;
    }

    // ==================== SMART ====================

    private BattleAction decideSmart(CombatantView self, CombatantView opponent, BattleRng rng) {
        ChargedMove cheapest = self.getCheapestChargedMove();
        if (cheapest == null) {
            return BattleAction.fast("no charged moves");
        }
        if (self.getEnergy() < cheapest.energyCost()) {
            return BattleAction.fast("charging");
        }

        SurvivalCheck.Result survival = SurvivalCheck.evaluate(self, opponent, policy);
        if (survival.endangered()) {
            if (survival.emergencyMove() != null) {
                return BattleAction.charged(survival.emergencyMove(),
                        survival.turnsToLive() + " turn(s) to live");
            }
            return BattleAction.fast(survival.turnsToLive() + " turn(s) to live, nothing affordable");
        }

        ChargedMove lethal = findLethalMove(self, opponent);
        if (lethal != null) {
            return BattleAction.charged(lethal, "lethal");
        }

        if (MoveTimingOptimizer.shouldWait(self, opponent, survival.turnsToLive())) {
            return BattleAction.fast("optimizing move timing");
        }

        List<ChargedMove> candidates = self.getChargedMoves();
        if (self.isFarmEnergy()) {
            candidates = List.of(self.getCostliestChargedMove());
        }
        return MoveSelectionPolicy.select(self, opponent, candidates, policy, rng);
    }

    /**
     * An affordable move that knocks the opponent out once its shield response is accounted for.
     * Non-debuffing moves are preferred. The second slot is skipped while baiting, and nothing is
     * returned when the next fast move would finish the opponent anyway.
     */
    ChargedMove findLethalMove(CombatantView self, CombatantView opponent) {
        int fastDamage = DamageCalculator.damage(self, opponent, self.getFastMove());
        if (opponent.getHp() <= fastDamage) {
            return null;
        }

        List<ChargedMove> moves = self.getChargedMoves();
        ChargedMove debuffingLethal = null;
        for (int i = 0; i < moves.size(); i++) {
            ChargedMove move = moves.get(i);
            if (self.getEnergy() < move.energyCost() || (i > 0 && self.isBaitShields())) {
                continue;
            }
            boolean shielded = ShieldDecisionEngine.decide(self, opponent, move).value();
            int damage = DamageCalculator.chargedDamage(self, opponent, move, shielded);
            if (damage < opponent.getHp()) {
                continue;
            }
            if (!move.isSelfDebuffing()) {
                return move;
            }
            if (debuffingLethal == null) {
                debuffingLethal = move;
            }
        }
        return debuffingLethal;
    }

    // ==================== RANDOM ====================

    private BattleAction decideUniform(CombatantView self, BattleRng rng) {
        List<DecisionOption> options = new ArrayList<>();
        options.add(DecisionOption.fast(1));
        for (ChargedMove move : self.getChargedMoves()) {
            if (self.getEnergy() >= move.energyCost()) {
                options.add(DecisionOption.charged(move, 1));
            }
        }
        return toAction(WeightedChooser.choose(options, rng), "uniform random");
    }

    // ==================== WEIGHTED RANDOM ====================

    private BattleAction decideWeightedRandom(CombatantView self, CombatantView opponent, BattleRng rng) {
        List<ChargedMove> moves = self.getChargedMoves();
        double fastWeight = RANDOM_FAST_WEIGHT;
        boolean hasKnockout = false;

        ChargedMove mostEfficient = null;
        double bestDpe = -1;
        for (ChargedMove move : moves) {
            double dpe = MoveReordering.effectiveDpe(self, opponent, move);
            if (dpe > bestDpe) {
                mostEfficient = move;
                bestDpe = dpe;
            }
        }

        List<DecisionOption> options = new ArrayList<>();
        List<Integer> damages = new ArrayList<>();
        for (int i = 0; i < moves.size(); i++) {
            ChargedMove move = moves.get(i);
            if (self.getEnergy() < move.energyCost()) {
                continue;
            }
            int damage = DamageCalculator.damage(self, opponent, move);
            double weight = Math.round(self.getEnergy() / 4.0);
            if (mostEfficient != null && self.getEnergy() < mostEfficient.energyCost()) {
                weight = Math.round(self.getEnergy() / 50.0);
            }
            if (hasKnockout) {
                weight = 0;
            }
            if (damage >= opponent.getHp() && opponent.getShields() == 0) {
                fastWeight = 0;
                hasKnockout = true;
            }
            // Strictly worse than the first slot
            if (i > 0 && damage < DamageCalculator.damage(self, opponent, moves.get(0))
                    && move.energyCost() >= moves.get(0).energyCost()
                    && !move.isSelfBuffing()) {
                weight = 0;
            }
            if (self.getEnergy() == 100) {
                weight *= 2;
            }
            options.add(DecisionOption.charged(move, weight));
            damages.add(damage);
        }

        // Both knock out through shields: drop a self-debuffing one that costs no less
        if (options.size() == 2 && opponent.getShields() > 0
                && damages.get(0) >= opponent.getHp() && damages.get(1) >= opponent.getHp()) {
            ChargedMove a = options.get(0).move();
            ChargedMove b = options.get(1).move();
            if (a.isSelfDebuffing() && !b.isSelfDebuffing() && b.energyCost() <= a.energyCost()) {
                options.set(0, DecisionOption.charged(a, 0));
            } else if (b.isSelfDebuffing() && !a.isSelfDebuffing() && a.energyCost() <= b.energyCost()) {
                options.set(1, DecisionOption.charged(b, 0));
            }
        }

        options.add(DecisionOption.fast(fastWeight));
        return toAction(WeightedChooser.choose(options, rng), "weighted random");
    }

    private static BattleAction toAction(DecisionOption option, String reason) {
        return option.isFastMove() ? BattleAction.fast(reason) : BattleAction.charged(option.move(), reason);
    }
}
