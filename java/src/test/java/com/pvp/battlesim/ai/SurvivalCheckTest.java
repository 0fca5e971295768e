package com.pvp.battlesim.ai;

import com.pvp.battlesim.StubCombatant;
import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.move.CombatType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SurvivalCheckTest {

    private static final ChargedMove CHEAP = new ChargedMove("CHEAP", CombatType.NORMAL, 45, 35);   // 28
    private static final ChargedMove NUKE = new ChargedMove("NUKE", CombatType.NORMAL, 90, 50);     // 55

    @Test
    void testHealthyCombatantIsSafe() {
        StubCombatant self = new StubCombatant("self").energy(50).chargedMoves(NUKE);
        StubCombatant opponent = new StubCombatant("opp");

        SurvivalCheck.Result result = SurvivalCheck.evaluate(self, opponent, DecisionPolicy.defaults());

        assertFalse(result.endangered());
        assertEquals(SurvivalCheck.SAFE, result.turnsToLive());
        assertNull(result.emergencyMove());
    }

    @Test
    void testOneFastMoveFromFainting() {
        StubCombatant self = new StubCombatant("self").energy(50).hp(2).chargedMoves(NUKE);
        StubCombatant opponent = new StubCombatant("opp");

        SurvivalCheck.Result result = SurvivalCheck.evaluate(self, opponent, DecisionPolicy.defaults());

        assertTrue(result.endangered());
        assertEquals(0, result.turnsToLive());
        assertSame(NUKE, result.emergencyMove());
    }

    @Test
    void testOpponentChargedMoveThreat() {
        StubCombatant self = new StubCombatant("self").energy(35).hp(40).chargedMoves(CHEAP, NUKE);
        StubCombatant opponent = new StubCombatant("opp").energy(60).chargedMoves(NUKE);

        // An unshielded 55 damage nuke is ready now
        SurvivalCheck.Result result = SurvivalCheck.evaluate(self, opponent, DecisionPolicy.defaults());

        assertTrue(result.endangered());
        assertSame(CHEAP, result.emergencyMove(), "Only the cheap move is affordable");
    }

    @Test
    void testEndangeredWithNothingAffordable() {
        StubCombatant self = new StubCombatant("self").energy(10).hp(2).chargedMoves(NUKE);
        StubCombatant opponent = new StubCombatant("opp");

        SurvivalCheck.Result result = SurvivalCheck.evaluate(self, opponent, DecisionPolicy.defaults());

        assertTrue(result.endangered());
        assertNull(result.emergencyMove());
    }
}
