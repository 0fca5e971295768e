package com.pvp.battlesim.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pvp.battlesim.ai.DecisionMode;
import com.pvp.battlesim.combatant.BaseStats;
import com.pvp.battlesim.combatant.IndividualValues;
import com.pvp.battlesim.combatant.ShadowType;
import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.move.CombatType;
import com.pvp.battlesim.move.FastMove;

import java.util.List;

/**
 * JSON layout of a matchup file.
 * <pre>
 * {
 *   "moves": { "fast": [...], "charged": [...] },
 *   "combatants": [ {...}, {...} ],
 *   "battle": { "shields": [2, 2], "max_turns": 480, "mode": "smart" }
 * }
 * </pre>
 */
public record MatchupFile(
        @JsonProperty("moves") Moves moves,
        @JsonProperty("combatants") List<CombatantEntry> combatants,
        @JsonProperty("battle") BattleSettings battle
) {

    public record Moves(
            @JsonProperty("fast") List<FastMove> fast,
            @JsonProperty("charged") List<ChargedMove> charged
    ) {
    }

    public record CombatantEntry(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("types") List<CombatType> types,
            @JsonProperty("base_stats") BaseStats baseStats,
            @JsonProperty("ivs") IndividualValues ivs,
            @JsonProperty("level") Double level,
            @JsonProperty("shadow") ShadowType shadow,
            @JsonProperty("fast_move") String fastMove,
            @JsonProperty("charged_moves") List<String> chargedMoves,
            @JsonProperty("farm_energy") Boolean farmEnergy,
            @JsonProperty("bait_shields") Boolean baitShields,
            @JsonProperty("optimize_move_timing") Boolean optimizeMoveTiming
    ) {
    }

    public record BattleSettings(
            @JsonProperty("shields") List<Integer> shields,
            @JsonProperty("energy") List<Integer> energy,
            @JsonProperty("max_turns") Integer maxTurns,
            @JsonProperty("mode") DecisionMode mode,
            @JsonProperty("timeline") Boolean timeline
    ) {
    }
}
