package com.pvp.battlesim.battle;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of one simulated battle.
 *
 * @param winner          Winning side, or null for a draw
 * @param hpOne           Final health of side one
 * @param hpTwo           Final health of side two
 * @param ratingOne       Rating of side one in [0, 1000]
 * @param ratingTwo       Rating of side two; the two ratings sum to 1000
 * @param turns           Ticks elapsed
 * @param timeRemainingMs Battle timer left when the battle ended
 * @param timeline        Resolved actions in order, empty unless requested
 */
public record BattleResult(
        @JsonProperty("winner") Side winner,
        @JsonProperty("hp_one") int hpOne,
        @JsonProperty("hp_two") int hpTwo,
        @JsonProperty("rating_one") int ratingOne,
        @JsonProperty("rating_two") int ratingTwo,
        @JsonProperty("turns") int turns,
        @JsonProperty("time_remaining_ms") int timeRemainingMs,
        @JsonProperty("timeline") List<TimelineEvent> timeline
) {
    public static final int MAX_RATING = 1000;

    public BattleResult {
        timeline = timeline == null ? List.of() : List.copyOf(timeline);
    }

    @JsonIgnore
    public boolean isDraw() {
        return winner == null;
    }

    public int rating(Side side) {
        return side == Side.ONE ? ratingOne : ratingTwo;
    }

    public int hp(Side side) {
        return side == Side.ONE ? hpOne : hpTwo;
    }

    /**
     * Rating for side one from both sides' remaining health fractions.
     * 500 means an even trade.
     */
    public static int rate(int hpOne, int maxHpOne, int hpTwo, int maxHpTwo) {
        double fractionOne = maxHpOne > 0 ? (double) hpOne / maxHpOne : 0;
        double fractionTwo = maxHpTwo > 0 ? (double) hpTwo / maxHpTwo : 0;
        int rating = (int) Math.floor(500 * (fractionOne + (1 - fractionTwo)));
        return Math.max(0, Math.min(MAX_RATING, rating));
    }
}
