package com.pvp.battlesim.ai;

import com.pvp.battlesim.battle.DamageCalculator;
import com.pvp.battlesim.combatant.CombatantView;
import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.move.FastMove;

/**
 * Delays a charged move by one fast move so it lands while the opponent is mid fast move,
 * denying them a free hit during the charged move. Only active for combatants with
 * {@code optimizeMoveTiming} set.
 */
public final class MoveTimingOptimizer {

    private MoveTimingOptimizer() {
        // Utility class - no instantiation
    }

    /**
     * @param turnsToLive Result of the survival check for this tick
     * @return true to use the fast move now and throw the charged move later
     */
    public static boolean shouldWait(CombatantView self, CombatantView opponent, int turnsToLive) {
        if (!self.isOptimizeMoveTiming() || self.getChargedMoves().isEmpty()) {
            return false;
        }

        int target = shouldDisable(self, opponent) ? 0 : targetCooldown(self, opponent);
        int opponentCooldownMs = opponent.getCooldown() * FastMove.TURN_DURATION_MS;
        if (target <= 0 || !(opponentCooldownMs == 0 || opponentCooldownMs > target)) {
            return false;
        }

        return isSafe(self, opponent)
                && hasEnergyRoom(self)
                && isStrategicallySound(self, opponent, turnsToLive);
    }

    /**
     * Opponent cooldown (ms) at or under which a charged move should go out.
     */
    static int targetCooldown(CombatantView self, CombatantView opponent) {
        int own = self.getFastMove().cooldown();
        int theirs = opponent.getFastMove().cooldown();
        int target = 500;
        if (own >= 2000) {
            target = 1000;
        }
        if (own >= 1500 && theirs == 2500) {
            target = 1000;
        }
        if (own == 1000 && theirs == 2000) {
            target = 1000;
        }
        return target;
    }

    /**
     * Equal durations, or a longer move that is an exact multiple of the opponent's, gain nothing.
     */
    static boolean shouldDisable(CombatantView self, CombatantView opponent) {
        int own = self.getFastMove().cooldown();
        int theirs = opponent.getFastMove().cooldown();
        if (own == theirs) {
            return true;
        }
        return theirs > 0 && own > theirs && own % theirs == 0;
    }

    private static boolean isSafe(CombatantView self, CombatantView opponent) {
        int opponentFastDamage = DamageCalculator.damage(opponent, self, opponent.getFastMove());
        if (self.getHp() <= opponentFastDamage) {
            return false;
        }
        int theirs = opponent.getFastMove().cooldown();
        if (theirs <= 0) {
            return false;
        }
        int fastMovesInWindow = (self.getFastMove().cooldown() + FastMove.TURN_DURATION_MS) / theirs;
        return self.getHp() > opponentFastDamage * fastMovesInWindow;
    }

    private static boolean hasEnergyRoom(CombatantView self) {
        return self.getEnergy() + self.getFastMove().energyGain() <= 100;
    }

    private static boolean isStrategicallySound(CombatantView self, CombatantView opponent, int turnsToLive) {
        ChargedMove first = self.getChargedMoves().get(0);
        long plannedTurns = self.getFastMove().turns()
                + (first.energyCost() > 0 ? self.getEnergy() / first.energyCost() : 0);
        if (self.getAttack() < opponent.getAttack()) {
            plannedTurns++;
        }
        if (plannedTurns > turnsToLive) {
            return false;
        }

        // Take the knockout instead of waiting
        if (opponent.getShields() == 0) {
            for (ChargedMove move : self.getChargedMoves()) {
                if (self.getEnergy() >= move.energyCost()
                        && DamageCalculator.damage(self, opponent, move) >= opponent.getHp()) {
                    return false;
                }
            }
        }

        FastMove theirFast = opponent.getFastMove();
        if (theirFast.cooldown() <= 0) {
            return false;
        }
        int opponentFastDamage = DamageCalculator.damage(opponent, self, theirFast);
        int fastMovesInWindow = self.getFastMove().cooldown() / theirFast.cooldown();
        for (ChargedMove move : opponent.getChargedMoves()) {
            int fastMovesNeeded = 0;
            if (opponent.getEnergy() < move.energyCost()) {
                if (theirFast.energyGain() <= 0) {
                    continue;
                }
                fastMovesNeeded = (int) Math.ceil(
                        (double) (move.energyCost() - opponent.getEnergy()) / theirFast.energyGain());
            }
            int turnsUntilMove = fastMovesNeeded * theirFast.turns() + 1;
            int incoming = self.getShields() > 0
                    ? DamageCalculator.SHIELDED_DAMAGE + opponentFastDamage * fastMovesInWindow
                    : DamageCalculator.damage(opponent, self, move) + opponentFastDamage * fastMovesInWindow;
            if (turnsUntilMove <= self.getFastMove().turns() && incoming >= self.getHp()) {
                return false;
            }
        }
        return true;
    }
}
