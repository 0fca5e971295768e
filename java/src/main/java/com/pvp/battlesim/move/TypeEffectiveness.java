package com.pvp.battlesim.move;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static com.pvp.battlesim.move.CombatType.*;

/**
 * Static multiplicative type chart.
 * Each matched defending type contributes one factor; dual types multiply.
 */
public final class TypeEffectiveness {

    public static final double SUPER_EFFECTIVE = 1.6;
    public static final double NEUTRAL = 1.0;
    public static final double RESISTED = 0.625;
    public static final double DOUBLY_RESISTED = 0.390625;

    private static final Map<CombatType, Map<CombatType, Double>> CHART = new EnumMap<>(CombatType.class);

    static {
        row(NORMAL).resist(ROCK, STEEL).immune(GHOST);
        row(FIGHTING).strong(NORMAL, ROCK, STEEL, ICE, DARK)
                .resist(FLYING, POISON, BUG, PSYCHIC, FAIRY).immune(GHOST);
        row(FLYING).strong(FIGHTING, BUG, GRASS).resist(ROCK, STEEL, ELECTRIC);
        row(POISON).strong(GRASS, FAIRY).resist(POISON, GROUND, ROCK, GHOST).immune(STEEL);
        row(GROUND).strong(POISON, ROCK, STEEL, FIRE, ELECTRIC).resist(BUG, GRASS).immune(FLYING);
        row(ROCK).strong(FLYING, BUG, FIRE, ICE).resist(FIGHTING, GROUND, STEEL);
        row(BUG).strong(GRASS, PSYCHIC, DARK)
                .resist(FIGHTING, FLYING, POISON, GHOST, STEEL, FIRE, FAIRY);
        row(GHOST).strong(GHOST, PSYCHIC).resist(DARK).immune(NORMAL);
        row(STEEL).strong(ROCK, ICE, FAIRY).resist(STEEL, FIRE, WATER, ELECTRIC);
        row(FIRE).strong(BUG, STEEL, GRASS, ICE).resist(ROCK, FIRE, WATER, DRAGON);
        row(WATER).strong(GROUND, ROCK, FIRE).resist(WATER, GRASS, DRAGON);
        row(GRASS).strong(GROUND, ROCK, WATER)
                .resist(FLYING, POISON, BUG, STEEL, FIRE, GRASS, DRAGON);
        row(ELECTRIC).strong(FLYING, WATER).resist(GRASS, ELECTRIC, DRAGON).immune(GROUND);
        row(PSYCHIC).strong(FIGHTING, POISON).resist(STEEL, PSYCHIC).immune(DARK);
        row(ICE).strong(FLYING, GROUND, GRASS, DRAGON).resist(STEEL, FIRE, WATER, ICE);
        row(DRAGON).strong(DRAGON).resist(STEEL).immune(FAIRY);
        row(DARK).strong(GHOST, PSYCHIC).resist(FIGHTING, DARK, FAIRY);
        row(FAIRY).strong(FIGHTING, DRAGON, DARK).resist(POISON, STEEL, FIRE);
    }

    private TypeEffectiveness() {
        // Utility class - no instantiation
    }

    /**
     * Multiplier for a single attacking type against a single defending type.
     * A null defending type is neutral.
     */
    public static double against(CombatType attacking, CombatType defending) {
        if (attacking == null || defending == null) {
            return NEUTRAL;
        }
        return CHART.get(attacking).getOrDefault(defending, NEUTRAL);
    }

    /**
     * Multiplier for an attacking type against a defending type pair.
     *
     * @param attacking The attacking move's type
     * @param primary   The defender's first type
     * @param secondary The defender's second type, or null
     * @return The product of both single-type factors
     */
    public static double effectiveness(CombatType attacking, CombatType primary, CombatType secondary) {
        return against(attacking, primary) * against(attacking, secondary);
    }

    /**
     * Effectiveness of every attacking type against a defending type pair, in enum order.
     */
    public static Map<CombatType, Double> allEffectiveness(CombatType primary, CombatType secondary) {
        Map<CombatType, Double> result = new EnumMap<>(CombatType.class);
        for (CombatType attacking : CombatType.values()) {
            result.put(attacking, effectiveness(attacking, primary, secondary));
        }
        return Collections.unmodifiableMap(result);
    }

    private static Row row(CombatType attacking) {
        Map<CombatType, Double> entries = new EnumMap<>(CombatType.class);
        CHART.put(attacking, entries);
        return new Row(entries);
    }

    /**
     * Builder for one line of the chart.
     */
    private record Row(Map<CombatType, Double> entries) {
        Row strong(CombatType... types) {
            return put(SUPER_EFFECTIVE, types);
        }

        Row resist(CombatType... types) {
            return put(RESISTED, types);
        }

        Row immune(CombatType... types) {
            return put(DOUBLY_RESISTED, types);
        }

        private Row put(double multiplier, CombatType... types) {
            for (CombatType type : types) {
                entries.put(type, multiplier);
            }
            return this;
        }
    }
}
