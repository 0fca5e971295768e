package com.pvp.battlesim.ai;

import com.pvp.battlesim.battle.DamageCalculator;
import com.pvp.battlesim.combatant.CombatantView;
import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.move.FastMove;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Estimates how many turns a combatant has before the opponent can knock it out,
 * and names the move to throw when it will not live to land another fast move.
 * Self-debuffing moves held back by {@link SelfDebuffDeferral} are only thrown when
 * nothing else is affordable.
 */
public final class SurvivalCheck {

    /** Turns to live when no knockout threat was found. */
    public static final int SAFE = Integer.MAX_VALUE;

    private static final int MAX_PROJECTIONS = 1000;

    private SurvivalCheck() {
        // Utility class - no instantiation
    }

    /**
     * @param turnsToLive    Turns before a projected knockout, or {@link #SAFE}
     * @param emergencyMove  The highest-damage affordable move to throw now, or null
     * @param endangered     Whether the combatant cannot live through its next fast move
     */
    public record Result(int turnsToLive, ChargedMove emergencyMove, boolean endangered) {
    }

    private record Projection(int hp, int opponentEnergy, int turn, int shields) {
    }

    public static Result evaluate(CombatantView self, CombatantView opponent, DecisionPolicy policy) {
        FastMove ownFast = self.getFastMove();
        FastMove opponentFast = opponent.getFastMove();
        boolean winsCmp = self.getAttack() >= opponent.getAttack();
        int fastDamage = DamageCalculator.damage(self, opponent, ownFast);
        int opponentFastDamage = DamageCalculator.damage(opponent, self, opponentFast);
        ChargedMove opponentCheapest = opponent.getCheapestChargedMove();

        long turnsToLive = SAFE;
        Deque<Projection> stack = new ArrayDeque<>();

        // An opponent fast move already under way lands first
        if (opponent.getCooldown() != 0) {
            stack.push(new Projection(self.getHp() - opponentFastDamage,
                    Math.min(100, opponent.getEnergy() + opponentFast.energyGain()),
                    opponent.getCooldown(), self.getShields()));
        } else {
            stack.push(new Projection(self.getHp(), opponent.getEnergy(), 0, self.getShields()));
        }

        int projections = 0;
        while (!stack.isEmpty() && projections++ < MAX_PROJECTIONS) {
            Projection current = stack.pop();

            // Past the point where a fast move of our own would land first
            if (current.hp() > opponentFastDamage) {
                int horizon = winsCmp ? ownFast.turns() : ownFast.turns() + 1;
                if (current.turn() > horizon) {
                    continue;
                }
            }

            if (current.shields() != 0) {
                if (opponentCheapest != null && current.opponentEnergy() >= opponentCheapest.energyCost()) {
                    stack.push(new Projection(current.hp() - DamageCalculator.SHIELDED_DAMAGE,
                            current.opponentEnergy() - opponentCheapest.energyCost(),
                            current.turn() + 1, current.shields() - 1));
                }
            } else {
                for (ChargedMove move : opponent.getChargedMoves()) {
                    if (current.opponentEnergy() < move.energyCost()) {
                        continue;
                    }
                    int damage = DamageCalculator.damage(opponent, self, move);
                    if (damage >= current.hp()) {
                        turnsToLive = Math.min(current.turn(), turnsToLive);
                        if (self.getAttack() > opponent.getAttack() && ownFast.cooldown() > 0
                                && opponentFast.cooldown() % ownFast.cooldown() == 0) {
                            turnsToLive++;
                        }
                        break;
                    }
                    stack.push(new Projection(current.hp() - damage,
                            current.opponentEnergy() - move.energyCost(),
                            current.turn() + 1, current.shields()));
                }
            }

            if (current.hp() - opponentFastDamage <= 0) {
                turnsToLive = Math.min(current.turn() + opponentFast.turns(), turnsToLive);
                break;
            }
            stack.push(new Projection(current.hp() - opponentFastDamage,
                    Math.min(100, current.opponentEnergy() + opponentFast.energyGain()),
                    current.turn() + opponentFast.turns(), current.shields()));
        }

        // Timing corrections for fast moves that resolve around the same tick
        if (self.getHp() <= opponentFastDamage * 2 && opponentFast.cooldown() == FastMove.TURN_DURATION_MS) {
            turnsToLive--;
        }
        if (self.getHp() <= opponentFastDamage && opponent.getCooldown() > 0
                && opponentFast.cooldown() > FastMove.TURN_DURATION_MS) {
            turnsToLive = opponent.getCooldown();
            if (opponent.getHp() > fastDamage) {
                turnsToLive--;
            }
        }
        if (self.getHp() <= opponentFastDamage && opponent.getCooldown() == 0
                && opponentFast.cooldown() <= ownFast.cooldown() + FastMove.TURN_DURATION_MS
                && opponent.getHp() > fastDamage) {
            turnsToLive--;
        }

        long windowMs = turnsToLive * FastMove.TURN_DURATION_MS;
        boolean endangered = windowMs < ownFast.cooldown()
                || (windowMs == ownFast.cooldown() && (!winsCmp || self.getHp() <= opponentFastDamage));

        int reported = (int) Math.min(SAFE, Math.max(0, turnsToLive));
        if (!endangered) {
            return new Result(reported, null, false);
        }
        ChargedMove emergency = hardestHit(self, opponent,
                SelfDebuffDeferral.filter(self, opponent, self.getChargedMoves(), policy));
        if (emergency == null) {
            emergency = hardestHit(self, opponent, self.getChargedMoves());
        }
        return new Result(reported, emergency, true);
    }

    /**
     * Highest damage the combatant can deal right now, counting a double throw when it wins ties.
     */
    private static ChargedMove hardestHit(CombatantView self, CombatantView opponent, List<ChargedMove> moves) {
        ChargedMove best = null;
        int bestDamage = -1;
        for (int n = moves.size() - 1; n >= 0; n--) {
            ChargedMove move = moves.get(n);
            if (self.getEnergy() < move.energyCost()) {
                continue;
            }
            int damage = DamageCalculator.damage(self, opponent, move);
            if (damage > bestDamage) {
                best = move;
                bestDamage = damage;
            }
            if (self.getEnergy() >= move.energyCost() * 2
                    && self.getAttack() > opponent.getAttack()
                    && damage * 2 > bestDamage) {
                best = move;
                bestDamage = damage * 2;
            }
        }
        return best;
    }
}
