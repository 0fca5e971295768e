package com.pvp.battlesim.ai;

import com.pvp.battlesim.StubCombatant;
import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.move.CombatType;
import com.pvp.battlesim.move.MoveBuff;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The stub's fast move deals 3 damage and gains 4 energy per turn.
 */
class MoveSequenceSearchTest {

    private static final ChargedMove CHEAP = new ChargedMove("CHEAP", CombatType.NORMAL, 45, 35); // 28
    private static final ChargedMove NUKE = new ChargedMove("NUKE", CombatType.NORMAL, 90, 50);   // 55

    private static final DecisionPolicy POLICY = DecisionPolicy.defaults();

    @Test
    void testImmediateKnockout() {
        StubCombatant self = new StubCombatant("self").energy(50).chargedMoves(NUKE);
        StubCombatant opponent = new StubCombatant("opp").hp(50);

        SearchResult result = MoveSequenceSearch.search(self, opponent, List.of(NUKE), POLICY);

        assertTrue(result.hasPlan());
        assertSame(NUKE, result.firstMove());
        assertEquals(1, result.best().turn());
        assertTrue(result.best().isCertain());
        assertFalse(result.capped());
    }

    @Test
    void testFarmsBeforeThrowing() {
        StubCombatant self = new StubCombatant("self").energy(0).chargedMoves(NUKE);
        StubCombatant opponent = new StubCombatant("opp").hp(50);

        SearchResult result = MoveSequenceSearch.search(self, opponent, List.of(NUKE), POLICY);

        // 13 fast moves for 52 energy, then the throw
        assertEquals(14, result.best().turn());
        assertEquals(List.of(NUKE), result.best().moves());
    }

    @Test
    void testPredictedShieldCostsAThrow() {
        StubCombatant self = new StubCombatant("self").energy(50).chargedMoves(NUKE);
        StubCombatant opponent = new StubCombatant("opp").hp(50).shields(1);

        SearchResult result = MoveSequenceSearch.search(self, opponent, List.of(NUKE), POLICY);

        BattleState best = result.best();
        assertEquals(List.of(NUKE, NUKE), best.moves(), "The first throw should be shielded");
        assertEquals(0, best.opponentShields());
        assertEquals(15, best.turn());
        assertTrue(best.isCertain());
    }

    @Test
    void testPrefersFastestKnockout() {
        StubCombatant self = new StubCombatant("self").energy(50).chargedMoves(CHEAP, NUKE);
        StubCombatant opponent = new StubCombatant("opp").hp(50);

        SearchResult result = MoveSequenceSearch.search(self, opponent, List.of(CHEAP, NUKE), POLICY);

        assertSame(NUKE, result.firstMove());
        assertEquals(1.0, result.score(NUKE));
        assertEquals(0.0, result.score(CHEAP), "No knockout opening with the cheap move was reached first");
    }

    @Test
    void testBudgetExhausted() {
        StubCombatant self = new StubCombatant("self").energy(0).chargedMoves(CHEAP, NUKE);
        StubCombatant opponent = new StubCombatant("opp").hp(1000, 1000);

        SearchResult result = MoveSequenceSearch.search(self, opponent, List.of(CHEAP, NUKE),
                POLICY.withMaxSearchStates(5));

        assertTrue(result.capped());
        assertEquals(5, result.statesExplored());
        assertFalse(result.hasPlan());
        assertNull(result.firstMove());
    }

    @Test
    void testNoCandidates() {
        StubCombatant self = new StubCombatant("self").energy(100);
        StubCombatant opponent = new StubCombatant("opp");

        SearchResult result = MoveSequenceSearch.search(self, opponent, List.of(), POLICY);

        assertFalse(result.hasPlan());
        assertEquals(1, result.statesExplored());
    }

    @Test
    void testBuffChanceSplitsBranches() {
        ChargedMove maybeBoost = new ChargedMove("MAYBE_BOOST", CombatType.NORMAL, 20, 35,
                MoveBuff.self(2.0, 1.0, 0.25));
        StubCombatant self = new StubCombatant("self").energy(35);
        StubCombatant opponent = new StubCombatant("opp");
        BattleState start = BattleState.initial(35, 100, 0);

        List<BattleState> next = MoveSequenceSearch.expand(self, opponent, start, maybeBoost);

        assertEquals(2, next.size());
        assertEquals(2, next.get(0).attackStages());
        assertEquals(0.25, next.get(0).chance(), 1e-9);
        assertEquals(0, next.get(1).attackStages());
        assertEquals(0.75, next.get(1).chance(), 1e-9);
    }

    @Test
    void testDominatedStatesArePruned() {
        BattleState strong = new BattleState(20, 40, 3, 0, List.of(NUKE), 0, 1.0);
        BattleState weak = new BattleState(10, 45, 3, 0, List.of(CHEAP), 0, 1.0);
        List<BattleState> queue = new ArrayList<>(List.of(strong));

        MoveSequenceSearch.insert(queue, weak);

        assertEquals(1, queue.size());
        assertTrue(strong.dominates(weak));
        assertFalse(weak.dominates(strong));
    }
}
