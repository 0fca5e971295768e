package com.pvp.battlesim.ai;

import com.pvp.battlesim.move.ChargedMove;

import java.util.List;

/**
 * Outcome of one move-sequence search.
 *
 * @param best           Best knockout state found, or null when none was reached
 * @param knockouts      Every knockout state found, in discovery order
 * @param statesExplored States taken off the queue
 * @param capped         Whether the state budget ran out
 */
public record SearchResult(
        BattleState best,
        List<BattleState> knockouts,
        int statesExplored,
        boolean capped
) {
    public SearchResult {
        knockouts = List.copyOf(knockouts);
    }

    public boolean hasPlan() {
        return best != null && best.firstMove() != null;
    }

    /**
     * First move of the best plan, or null.
     */
    public ChargedMove firstMove() {
        return best != null ? best.firstMove() : null;
    }

    /**
     * Best knockout state whose sequence opens with {@code move}, or null.
     */
    public BattleState bestStartingWith(ChargedMove move) {
        BattleState found = null;
        for (BattleState state : knockouts) {
            if (move.equals(state.firstMove()) && (found == null || isBetter(state, found))) {
                found = state;
            }
        }
        return found;
    }

    /**
     * Chance of the best knockout sequence opening with {@code move}; 0 when there is none.
     */
    public double score(ChargedMove move) {
        BattleState state = bestStartingWith(move);
        return state != null ? state.chance() : 0;
    }

    /**
     * Higher chance wins, then the earlier knockout.
     */
    static boolean isBetter(BattleState candidate, BattleState incumbent) {
        if (candidate.chance() != incumbent.chance()) {
            return candidate.chance() > incumbent.chance();
        }
        return candidate.turn() < incumbent.turn();
    }
}
