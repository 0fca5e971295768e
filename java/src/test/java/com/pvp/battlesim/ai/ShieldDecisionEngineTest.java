package com.pvp.battlesim.ai;

import com.pvp.battlesim.StubCombatant;
import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.move.CombatType;
import com.pvp.battlesim.move.FastMove;
import com.pvp.battlesim.move.MoveBuff;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ShieldDecisionEngineTest {

    // Damage below is for 100 attack into 100 defense with STAB
    private static final ChargedMove WEAK = new ChargedMove("WEAK", CombatType.NORMAL, 20, 35);    // 13
    private static final ChargedMove NUKE = new ChargedMove("NUKE", CombatType.NORMAL, 90, 50);    // 55
    private static final ChargedMove BIG_NUKE = new ChargedMove("BIG_NUKE", CombatType.NORMAL, 120, 60); // 73

    @Test
    void testNoShieldsLeft() {
        StubCombatant attacker = new StubCombatant("a").chargedMoves(NUKE);
        StubCombatant defender = new StubCombatant("d").shields(0).hp(10);

        ShieldDecision decision = ShieldDecisionEngine.decide(attacker, defender, NUKE);

        assertEquals(ShieldDecision.NO_SHIELDS, decision);
        assertEquals(0.0, decision.shieldProbability());
    }

    @Test
    void testShieldsLethalHit() {
        StubCombatant attacker = new StubCombatant("a").chargedMoves(NUKE);
        StubCombatant defender = new StubCombatant("d").shields(1).hp(50);

        ShieldDecision decision = ShieldDecisionEngine.decide(attacker, defender, NUKE);

        assertTrue(decision.value(), "A knockout blow should always be shielded");
        assertTrue(decision.shieldWeight() >= 4);
    }

    @Test
    void testLetsHarmlessHitThrough() {
        StubCombatant attacker = new StubCombatant("a").chargedMoves(WEAK);
        StubCombatant defender = new StubCombatant("d").shields(1);

        ShieldDecision decision = ShieldDecisionEngine.decide(attacker, defender, WEAK);

        assertFalse(decision.value());
        assertEquals(new ShieldDecision(false, 1, 2), decision);
        assertEquals(1.0 / 3, decision.shieldProbability(), 1e-9);
    }

    @Test
    void testHeavyThreatInArsenal() {
        StubCombatant attacker = new StubCombatant("a").chargedMoves(WEAK, BIG_NUKE);
        StubCombatant defender = new StubCombatant("d").shields(1);

        // The bait itself is harmless, but a 73 damage follow-up is in the arsenal
        ShieldDecision decision = ShieldDecisionEngine.decide(attacker, defender, WEAK);

        assertTrue(decision.value());
        assertEquals(12, decision.shieldWeight());
    }

    @Test
    void testAttackLoweringNuke() {
        ChargedMove superpower = new ChargedMove("SUPERPOWER", CombatType.NORMAL, 85, 40,
                MoveBuff.self(0.667, 0.667, 1.0));
        StubCombatant attacker = new StubCombatant("a")
                .fastMove(new FastMove("SLOW", "Slow", CombatType.NORMAL, 0, 50, 5))
                .chargedMoves(superpower);
        StubCombatant defender = new StubCombatant("d").shields(1).hp(90);

        // 52 damage into 90 health, with little fast move pressure behind it
        ShieldDecision decision = ShieldDecisionEngine.decide(attacker, defender, superpower);

        assertTrue(decision.value(), "The first of a series of attack-lowering nukes should be shielded");
        assertEquals(4, decision.shieldWeight());
    }
}
