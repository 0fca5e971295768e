package com.pvp.battlesim;

import com.pvp.battlesim.combatant.Combatant;
import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.move.CombatType;
import com.pvp.battlesim.move.FastMove;
import com.pvp.battlesim.move.MoveBuff;

/**
 * Shared moves and combatants for tests.
 */
public final class Fixtures {

    public static final FastMove BUBBLE = new FastMove("BUBBLE", "Bubble", CombatType.WATER, 7, 11, 3);
    public static final FastMove MUD_SHOT = new FastMove("MUD_SHOT", "Mud Shot", CombatType.GROUND, 3, 9, 2);
    public static final FastMove COUNTER = new FastMove("COUNTER", "Counter", CombatType.FIGHTING, 8, 7, 2);

    public static final ChargedMove ICE_BEAM = new ChargedMove("ICE_BEAM", CombatType.ICE, 90, 55);
    public static final ChargedMove PLAY_ROUGH = new ChargedMove("PLAY_ROUGH", CombatType.FAIRY, 90, 60);
    public static final ChargedMove ROCK_SLIDE = new ChargedMove("ROCK_SLIDE", CombatType.ROCK, 75, 45);
    public static final ChargedMove EARTHQUAKE = new ChargedMove("EARTHQUAKE", CombatType.GROUND, 120, 65);
    public static final ChargedMove SUPERPOWER = new ChargedMove("SUPERPOWER", CombatType.FIGHTING, 85, 40,
            MoveBuff.self(0.667, 0.667, 1.0));
    public static final ChargedMove POWER_UP_PUNCH = new ChargedMove("POWER_UP_PUNCH", CombatType.FIGHTING, 20, 35,
            MoveBuff.self(1.5, 1.0, 1.0));
    public static final ChargedMove CLOSE_COMBAT = new ChargedMove("CLOSE_COMBAT", CombatType.FIGHTING, 100, 45,
            MoveBuff.self(1.0, 0.5, 1.0));

    private Fixtures() {
        // Utility class - no instantiation
    }

    /**
     * Water/fairy bulky attacker: 177 HP at level 40 with zero IVs.
     */
    public static Combatant.Builder azumarill() {
        return Combatant.builder("azumarill")
                .name("Azumarill")
                .types(CombatType.WATER, CombatType.FAIRY)
                .baseStats(112, 152, 225)
                .fastMove(BUBBLE)
                .chargedMove(ICE_BEAM)
                .chargedMove(PLAY_ROUGH);
    }

    /**
     * Ground/steel attacker: 189 HP at level 40 with zero IVs.
     */
    public static Combatant.Builder stunfisk() {
        return Combatant.builder("stunfisk_galarian")
                .name("Stunfisk (Galarian)")
                .types(CombatType.GROUND, CombatType.STEEL)
                .baseStats(144, 171, 240)
                .fastMove(MUD_SHOT)
                .chargedMove(ROCK_SLIDE)
                .chargedMove(EARTHQUAKE);
    }
}
