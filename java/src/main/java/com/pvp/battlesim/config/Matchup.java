package com.pvp.battlesim.config;

import com.pvp.battlesim.battle.Battle;
import com.pvp.battlesim.battle.BattleConfig;
import com.pvp.battlesim.combatant.Combatant;
import com.pvp.battlesim.rng.BattleRng;

/**
 * Two resolved combatants and the settings to battle them under.
 */
public record Matchup(Combatant one, Combatant two, BattleConfig config) {

    /**
     * Create a battle for this matchup.
     */
    public Battle newBattle(BattleRng rng) {
        return new Battle(one, two, config, rng);
    }

    public Matchup withConfig(BattleConfig newConfig) {
        return new Matchup(one, two, newConfig);
    }
}
