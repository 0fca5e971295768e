package com.pvp.battlesim.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pvp.battlesim.battle.BattleConfig;
import com.pvp.battlesim.combatant.Combatant;
import com.pvp.battlesim.combatant.InvalidCombatantException;
import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.move.CombatType;
import com.pvp.battlesim.move.FastMove;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a matchup (move definitions, two combatants, battle settings) from JSON.
 */
public final class MatchupLoader {
    private static final Logger logger = LoggerFactory.getLogger(MatchupLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MatchupLoader() {
        // Utility class - no instantiation
    }

    /**
     * Load a matchup from a JSON file.
     */
    public static Matchup fromFile(String path) throws MatchupException {
        try {
            String content = Files.readString(Path.of(path));
            return fromJson(content);
        } catch (IOException e) {
            throw new MatchupException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load a matchup from a classpath resource.
     */
    public static Matchup fromResource(String resourcePath) throws MatchupException {
        try (InputStream is = MatchupLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new MatchupException("Resource not found: " + resourcePath);
            }
            return resolve(MAPPER.readValue(is, MatchupFile.class));
        } catch (IOException e) {
            throw new MatchupException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load a matchup from a JSON string.
     */
    public static Matchup fromJson(String json) throws MatchupException {
        try {
            return resolve(MAPPER.readValue(json, MatchupFile.class));
        } catch (IOException e) {
            throw new MatchupException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static Matchup resolve(MatchupFile file) throws MatchupException {
        if (file.moves() == null) {
            throw new MatchupException("Missing 'moves' section");
        }
        Map<String, FastMove> fastMoves = new HashMap<>();
        if (file.moves().fast() != null) {
            for (FastMove move : file.moves().fast()) {
                fastMoves.put(move.id(), move);
            }
        }
        Map<String, ChargedMove> chargedMoves = new HashMap<>();
        if (file.moves().charged() != null) {
            for (ChargedMove move : file.moves().charged()) {
                chargedMoves.put(move.id(), move);
            }
        }

        List<MatchupFile.CombatantEntry> entries = file.combatants();
        if (entries == null || entries.size() != 2) {
            throw new MatchupException("Expected exactly 2 combatants, got " + (entries == null ? 0 : entries.size()));
        }
        Combatant one = build(entries.get(0), fastMoves, chargedMoves);
        Combatant two = build(entries.get(1), fastMoves, chargedMoves);
        BattleConfig config = battleConfig(file.battle());

        logger.debug("Loaded matchup {} vs {} ({} fast, {} charged moves)",
                one.getId(), two.getId(), fastMoves.size(), chargedMoves.size());
        return new Matchup(one, two, config);
    }

    private static Combatant build(MatchupFile.CombatantEntry entry,
                                   Map<String, FastMove> fastMoves,
                                   Map<String, ChargedMove> chargedMoves) throws MatchupException {
        String id = entry.id() != null ? entry.id() : "<unnamed>";
        FastMove fast = entry.fastMove() != null ? fastMoves.get(entry.fastMove()) : null;
        if (entry.fastMove() != null && fast == null) {
            throw new MatchupException(id + ": unknown fast move " + entry.fastMove());
        }

        List<CombatType> types = entry.types() != null ? entry.types() : List.of();
        if (types.isEmpty() || types.size() > 2) {
            throw new MatchupException(id + ": expected one or two types, got " + types.size());
        }

        try {
            Combatant.Builder builder = Combatant.builder(entry.id())
                    .name(entry.name())
                    .types(types.get(0), types.size() > 1 ? types.get(1) : null)
                    .baseStats(entry.baseStats())
                    .fastMove(fast);
            if (entry.ivs() != null) {
                builder.ivs(entry.ivs());
            }
            if (entry.level() != null) {
                builder.level(entry.level());
            }
            if (entry.shadow() != null) {
                builder.shadowType(entry.shadow());
            }
            if (entry.chargedMoves() != null) {
                for (String moveId : entry.chargedMoves()) {
                    ChargedMove move = chargedMoves.get(moveId);
                    if (move == null) {
                        throw new MatchupException(id + ": unknown charged move " + moveId);
                    }
                    builder.chargedMove(move);
                }
            }
            if (entry.farmEnergy() != null) {
                builder.farmEnergy(entry.farmEnergy());
            }
            if (entry.baitShields() != null) {
                builder.baitShields(entry.baitShields());
            }
            if (entry.optimizeMoveTiming() != null) {
                builder.optimizeMoveTiming(entry.optimizeMoveTiming());
            }
            return builder.build();
        } catch (InvalidCombatantException e) {
            throw new MatchupException("Invalid combatant " + id + ": " + e.getMessage(), e);
        }
    }

    private static BattleConfig battleConfig(MatchupFile.BattleSettings settings) throws MatchupException {
        BattleConfig config = BattleConfig.defaults();
        if (settings == null) {
            return config;
        }
        try {
            if (settings.shields() != null) {
                int[] pair = pair("shields", settings.shields());
                config = config.withShields(pair[0], pair[1]);
            }
            if (settings.energy() != null) {
                int[] pair = pair("energy", settings.energy());
                config = config.withEnergy(pair[0], pair[1]);
            }
            if (settings.maxTurns() != null) {
                config = config.withMaxTurns(settings.maxTurns());
            }
            if (settings.mode() != null) {
                config = config.withMode(settings.mode());
            }
            if (settings.timeline() != null) {
                config = config.withTimeline(settings.timeline());
            }
        } catch (IllegalArgumentException e) {
            throw new MatchupException("Invalid battle settings: " + e.getMessage(), e);
        }
        return config;
    }

    /**
     * A one-element list applies to both sides.
     */
    private static int[] pair(String field, List<Integer> values) throws MatchupException {
        if (values.contains(null)) {
            throw new MatchupException("'" + field + "' must not contain null values");
        }
        if (values.size() == 1) {
            return new int[]{values.get(0), values.get(0)};
        }
        if (values.size() == 2) {
            return new int[]{values.get(0), values.get(1)};
        }
        throw new MatchupException("'" + field + "' needs one or two values, got " + values.size());
    }
}
