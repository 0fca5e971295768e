package com.pvp.battlesim.ai;

import com.pvp.battlesim.move.ChargedMove;

import java.util.ArrayList;
import java.util.List;

/**
 * A point in a planned move sequence. Lives only inside one search.
 *
 * @param energy          Own energy
 * @param opponentHp      Opponent's remaining health
 * @param turn            Turns elapsed since the decision point
 * @param opponentShields Opponent's remaining shields
 * @param moves           Charged moves thrown so far, in order
 * @param attackStages    Net attack stage change accumulated from own buffs
 * @param chance          Probability this branch materializes
 */
public record BattleState(
        int energy,
        int opponentHp,
        int turn,
        int opponentShields,
        List<ChargedMove> moves,
        int attackStages,
        double chance
) {
    public BattleState {
        moves = List.copyOf(moves);
    }

    public static BattleState initial(int energy, int opponentHp, int opponentShields) {
        return new BattleState(energy, opponentHp, 0, opponentShields, List.of(), 0, 1.0);
    }

    public boolean isKnockout() {
        return opponentHp <= 0;
    }

    public boolean isCertain() {
        return chance >= 1.0;
    }

    /**
     * First move of the sequence, or null for the initial state.
     */
    public ChargedMove firstMove() {
        return moves.isEmpty() ? null : moves.get(0);
    }

    BattleState next(int energy, int opponentHp, int turn, int opponentShields,
                     ChargedMove move, int attackStages, double chance) {
        List<ChargedMove> sequence = new ArrayList<>(moves.size() + 1);
        sequence.addAll(moves);
        sequence.add(move);
        return new BattleState(energy, opponentHp, turn, opponentShields, sequence, attackStages, chance);
    }

    /**
     * True when this state is at least as good as {@code other} on every axis.
     */
    boolean dominates(BattleState other) {
        return opponentHp <= other.opponentHp
                && energy >= other.energy
                && attackStages >= other.attackStages
                && opponentShields <= other.opponentShields
                && chance >= other.chance;
    }
}
