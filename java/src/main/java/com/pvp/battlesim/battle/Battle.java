package com.pvp.battlesim.battle;

import com.pvp.battlesim.ai.ActionDecisionEngine;
import com.pvp.battlesim.ai.BattleAction;
import com.pvp.battlesim.ai.ShieldDecision;
import com.pvp.battlesim.ai.ShieldDecisionEngine;
import com.pvp.battlesim.combatant.Combatant;
import com.pvp.battlesim.move.BuffTarget;
import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.move.FastMove;
import com.pvp.battlesim.move.MoveBuff;
import com.pvp.battlesim.rng.BattleRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turn-by-turn simulation of one battle.
 * <p>
 * Each tick, every side off cooldown decides on the same snapshot. Charged moves resolve first,
 * the higher attack stat going first, then fast moves resolve simultaneously.
 * The battle ends after a tick in which someone faints, or when the tick cap is reached.
 * <p>
 * The battle works on its own copies of the combatants, so the originals can be reused.
 */
public class Battle {
    private static final Logger logger = LoggerFactory.getLogger(Battle.class);

    private final Map<Side, Combatant> combatants = new EnumMap<>(Side.class);
    private final Map<Side, CombatantPhase> phases = new EnumMap<>(Side.class);
    private final BattleConfig config;
    private final BattleRng rng;
    private final ActionDecisionEngine engine;
    private final List<TimelineEvent> timeline = new ArrayList<>();

    private int turn;
    private boolean started;

    public Battle(Combatant one, Combatant two, BattleConfig config, BattleRng rng) {
        if (one == null || two == null) {
            throw new IllegalArgumentException("Both combatants must be set before simulation");
        }
        if (rng == null) {
            throw new IllegalArgumentException("A random source is required");
        }
        this.combatants.put(Side.ONE, one.copy());
        this.combatants.put(Side.TWO, two.copy());
        this.config = config != null ? config : BattleConfig.defaults();
        this.rng = rng;
        this.engine = new ActionDecisionEngine(this.config.mode(), this.config.policy());
    }

    /**
     * Run from a fresh start to a terminal state.
     */
    public BattleResult simulate() {
        start();
        while (!isOver()) {
            tick();
        }
        BattleResult result = result();
        logger.debug("Battle over after {} turns: winner {}, ratings {}/{}",
                result.turns(), result.isDraw() ? "draw" : result.winner(), result.ratingOne(), result.ratingTwo());
        return result;
    }

    /**
     * Reset both combatants to their starting shields and energy.
     */
    public void start() {
        for (Side side : Side.values()) {
            combatants.get(side).reset(config.shields(side), config.energy(side));
            phases.put(side, CombatantPhase.READY);
        }
        timeline.clear();
        turn = 0;
        started = true;
        logger.debug("Battle start: {} vs {}", combatants.get(Side.ONE), combatants.get(Side.TWO));
    }

    public boolean isOver() {
        return combatants.get(Side.ONE).isFainted()
                || combatants.get(Side.TWO).isFainted()
                || turn >= config.maxTurns();
    }

    /**
     * Advance one tick.
     * @throws IllegalStateException if the battle is already over
     */
    public void tick() {
        if (!started) {
            start();
        }
        if (isOver()) {
            throw new IllegalStateException("Battle is already over");
        }

        // Decide on one shared snapshot
        Map<Side, BattleAction> actions = new EnumMap<>(Side.class);
        for (Side side : Side.values()) {
            Combatant self = combatants.get(side);
            if (self.getCooldown() > 0) {
                phases.put(side, CombatantPhase.COOLDOWN);
            } else {
                phases.put(side, CombatantPhase.READY);
                actions.put(side, engine.decide(self, combatants.get(side.opponent()), rng));
            }
        }

        for (Side side : chargedOrder(actions)) {
            if (combatants.get(side).isFainted() || combatants.get(side.opponent()).isFainted()) {
                continue;
            }
            resolveCharged(side, actions.get(side).move());
            phases.put(side, CombatantPhase.ACTION_RESOLVED);
        }

        resolveFastMoves(actions);

        for (Side side : Side.values()) {
            if (!actions.containsKey(side)) {
                combatants.get(side).tickCooldown();
            }
        }
        turn++;
    }

    /**
     * Sides throwing a charged move this tick, higher attack first; ties are a coin flip.
     */
    private List<Side> chargedOrder(Map<Side, BattleAction> actions) {
        List<Side> order = new ArrayList<>(2);
        for (Side side : Side.values()) {
            BattleAction action = actions.get(side);
            if (action != null && action.isCharged()) {
                order.add(side);
            }
        }
        if (order.size() == 2) {
            double attackOne = combatants.get(Side.ONE).getAttack();
            double attackTwo = combatants.get(Side.TWO).getAttack();
            boolean twoFirst = attackTwo > attackOne || (attackTwo == attackOne && rng.chance(0.5));
            if (twoFirst) {
                order = List.of(Side.TWO, Side.ONE);
            }
        }
        return order;
    }

    private void resolveCharged(Side side, ChargedMove move) {
        Combatant attacker = combatants.get(side);
        Combatant defender = combatants.get(side.opponent());

        boolean shielded = defender.getShields() > 0 && wouldShield(attacker, defender, move);
        if (shielded) {
            defender.useShield();
        }
        int damage = DamageCalculator.chargedDamage(attacker, defender, move, shielded);
        attacker.spendEnergy(move.energyCost());
        defender.takeDamage(damage);

        boolean buffApplied = false;
        if (move.hasBuff()) {
            MoveBuff buff = move.buff();
            buffApplied = rng.chance(buff.chance());
            if (buffApplied) {
                Combatant target = buff.target() == BuffTarget.SELF ? attacker : defender;
                target.applyStages(buff.attackStages(), buff.defenseStages());
            }
        }

        logger.debug("Turn {}: {} uses {} for {} damage{}{} ({} HP left)", turn, attacker.getId(), move.id(),
                damage, shielded ? " (shielded)" : "", buffApplied ? " (buff)" : "", defender.getHp());
        record(side, ActionKind.CHARGED, move.id(), damage, shielded, buffApplied, attacker.getEnergy());
    }

    private boolean wouldShield(Combatant attacker, Combatant defender, ChargedMove move) {
        ShieldDecision decision = ShieldDecisionEngine.decide(attacker, defender, move);
        return switch (config.mode()) {
            case SMART -> decision.value();
            case RANDOM -> rng.chance(0.5);
            case WEIGHTED_RANDOM -> rng.chance(decision.shieldProbability());
        };
    }

    private void resolveFastMoves(Map<Side, BattleAction> actions) {
        Map<Side, Integer> damage = new EnumMap<>(Side.class);
        for (Side side : Side.values()) {
            BattleAction action = actions.get(side);
            if (action == null || !action.isFast() || combatants.get(side).isFainted()) {
                continue;
            }
            Combatant attacker = combatants.get(side);
            damage.put(side, DamageCalculator.damage(attacker, combatants.get(side.opponent()), attacker.getFastMove()));
        }

        // Both hits land even if one of them is a knockout
        for (Map.Entry<Side, Integer> entry : damage.entrySet()) {
            Side side = entry.getKey();
            Combatant attacker = combatants.get(side);
            Combatant defender = combatants.get(side.opponent());
            FastMove move = attacker.getFastMove();

            defender.takeDamage(entry.getValue());
            attacker.gainEnergy(move.energyGain());
            attacker.setCooldown(move.turns() - 1);
            phases.put(side, CombatantPhase.ACTION_RESOLVED);

            logger.debug("Turn {}: {} uses {} for {} damage ({} HP left)", turn, attacker.getId(), move.id(),
                    entry.getValue(), defender.getHp());
            record(side, ActionKind.FAST, move.id(), entry.getValue(), false, false, attacker.getEnergy());
        }
    }

    private void record(Side actor, ActionKind kind, String moveId, int damage,
                        boolean shielded, boolean buffApplied, int energyAfter) {
        if (config.recordTimeline()) {
            timeline.add(new TimelineEvent(turn, actor, kind, moveId, damage, shielded, buffApplied, energyAfter));
        }
    }

    /**
     * Result for the current state; normally called once the battle is over.
     */
    public BattleResult result() {
        Combatant one = combatants.get(Side.ONE);
        Combatant two = combatants.get(Side.TWO);
        int ratingOne = BattleResult.rate(one.getHp(), one.getMaxHp(), two.getHp(), two.getMaxHp());
        int ratingTwo = BattleResult.MAX_RATING - ratingOne;

        Side winner;
        if (one.isFainted() && two.isFainted()) {
            winner = null;
        } else if (one.isFainted()) {
            winner = Side.TWO;
        } else if (two.isFainted()) {
            winner = Side.ONE;
        } else if (ratingOne != ratingTwo) {
            winner = ratingOne > ratingTwo ? Side.ONE : Side.TWO;
        } else {
            winner = null;
        }

        int timeRemainingMs = Math.max(0, config.maxTurns() - turn) * FastMove.TURN_DURATION_MS;
        return new BattleResult(winner, one.getHp(), two.getHp(), ratingOne, ratingTwo, turn,
                timeRemainingMs, timeline);
    }

    public Combatant combatant(Side side) {
        return combatants.get(side);
    }

    public CombatantPhase phase(Side side) {
        return phases.get(side);
    }

    public int getTurn() {
        return turn;
    }

    public List<TimelineEvent> getTimeline() {
        return List.copyOf(timeline);
    }
}
