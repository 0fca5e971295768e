package com.pvp.battlesim.battle;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One resolved action.
 *
 * @param turn         Tick the action resolved on
 * @param actor        Acting side
 * @param kind         Fast or charged
 * @param moveId       Move identifier
 * @param damage       Damage dealt (1 when shielded)
 * @param shielded     Whether the defender shielded
 * @param buffApplied  Whether the move's stat change triggered
 * @param energyAfter  Actor energy once the action resolved
 */
public record TimelineEvent(
        @JsonProperty("turn") int turn,
        @JsonProperty("actor") Side actor,
        @JsonProperty("kind") ActionKind kind,
        @JsonProperty("move_id") String moveId,
        @JsonProperty("damage") int damage,
        @JsonProperty("shielded") boolean shielded,
        @JsonProperty("buff_applied") boolean buffApplied,
        @JsonProperty("energy_after") int energyAfter
) {
}
