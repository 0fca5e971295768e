package com.pvp.battlesim.battle;

import com.pvp.battlesim.ai.DecisionMode;
import com.pvp.battlesim.ai.DecisionPolicy;

/**
 * Battle settings.
 *
 * @param shieldsOne     Starting shields for side one
 * @param shieldsTwo     Starting shields for side two
 * @param energyOne      Starting energy for side one
 * @param energyTwo      Starting energy for side two
 * @param maxTurns       Tick cap; 480 ticks is the 240 second timer
 * @param mode           How both sides decide
 * @param recordTimeline Whether to record resolved actions
 * @param policy         Decision thresholds
 */
public record BattleConfig(
        int shieldsOne,
        int shieldsTwo,
        int energyOne,
        int energyTwo,
        int maxTurns,
        DecisionMode mode,
        boolean recordTimeline,
        DecisionPolicy policy
) {
    public static final int DEFAULT_SHIELDS = 2;
    public static final int DEFAULT_MAX_TURNS = 480;

    public BattleConfig {
        if (shieldsOne < 0 || shieldsTwo < 0) {
            throw new IllegalArgumentException("Shields must be non-negative");
        }
        if (energyOne < 0 || energyOne > 100 || energyTwo < 0 || energyTwo > 100) {
            throw new IllegalArgumentException("Starting energy must be in [0, 100]");
        }
        if (maxTurns <= 0) {
            throw new IllegalArgumentException("maxTurns must be positive, got " + maxTurns);
        }
        if (mode == null) {
            mode = DecisionMode.SMART;
        }
        if (policy == null) {
            policy = DecisionPolicy.defaults();
        }
    }

    public static BattleConfig defaults() {
        return new BattleConfig(DEFAULT_SHIELDS, DEFAULT_SHIELDS, 0, 0, DEFAULT_MAX_TURNS,
                DecisionMode.SMART, false, DecisionPolicy.defaults());
    }

    public int shields(Side side) {
        return side == Side.ONE ? shieldsOne : shieldsTwo;
    }

    public int energy(Side side) {
        return side == Side.ONE ? energyOne : energyTwo;
    }

    public BattleConfig withShields(int one, int two) {
        return new BattleConfig(one, two, energyOne, energyTwo, maxTurns, mode, recordTimeline, policy);
    }

    public BattleConfig withEnergy(int one, int two) {
        return new BattleConfig(shieldsOne, shieldsTwo, one, two, maxTurns, mode, recordTimeline, policy);
    }

    public BattleConfig withMaxTurns(int turns) {
        return new BattleConfig(shieldsOne, shieldsTwo, energyOne, energyTwo, turns, mode, recordTimeline, policy);
    }

    public BattleConfig withMode(DecisionMode newMode) {
        return new BattleConfig(shieldsOne, shieldsTwo, energyOne, energyTwo, maxTurns, newMode, recordTimeline, policy);
    }

    public BattleConfig withTimeline(boolean record) {
        return new BattleConfig(shieldsOne, shieldsTwo, energyOne, energyTwo, maxTurns, mode, record, policy);
    }

    public BattleConfig withPolicy(DecisionPolicy newPolicy) {
        return new BattleConfig(shieldsOne, shieldsTwo, energyOne, energyTwo, maxTurns, mode, recordTimeline, newPolicy);
    }
}
