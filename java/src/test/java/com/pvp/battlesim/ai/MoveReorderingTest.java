package com.pvp.battlesim.ai;

import com.pvp.battlesim.StubCombatant;
import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.move.CombatType;
import com.pvp.battlesim.move.MoveBuff;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MoveReorderingTest {

    private static final ChargedMove CHEAP = new ChargedMove("CHEAP", CombatType.NORMAL, 45, 35);   // 28
    private static final ChargedMove NUKE = new ChargedMove("NUKE", CombatType.NORMAL, 90, 50);     // 55
    private static final ChargedMove WEAK_40 = new ChargedMove("WEAK_40", CombatType.NORMAL, 60, 40); // 37
    private static final ChargedMove STRONG_45 = new ChargedMove("STRONG_45", CombatType.NORMAL, 90, 45); // 55
    private static final ChargedMove SUPERPOWER = new ChargedMove("SUPERPOWER", CombatType.NORMAL, 85, 40,
            MoveBuff.self(0.667, 0.667, 1.0));                                                     // 52
    private static final ChargedMove SLAM = new ChargedMove("SLAM", CombatType.NORMAL, 75, 45);     // 46

    private static final DecisionPolicy POLICY = DecisionPolicy.defaults();

    @Test
    void testMostDamageFirstWithoutShields() {
        StubCombatant self = new StubCombatant("self");
        StubCombatant opponent = new StubCombatant("opp").shields(0);

        assertEquals(List.of(NUKE, CHEAP), MoveReordering.reorder(self, opponent, List.of(CHEAP, NUKE), POLICY));
    }

    @Test
    void testCheapestFirstAgainstShields() {
        StubCombatant self = new StubCombatant("self");
        StubCombatant opponent = new StubCombatant("opp").shields(2);

        assertEquals(List.of(CHEAP, NUKE), MoveReordering.reorder(self, opponent, List.of(NUKE, CHEAP), POLICY));
    }

    @Test
    void testNearEqualCostOrderedByEfficiency() {
        StubCombatant self = new StubCombatant("self");
        StubCombatant opponent = new StubCombatant("opp").shields(1);

        assertEquals(List.of(STRONG_45, WEAK_40),
                MoveReordering.reorder(self, opponent, List.of(WEAK_40, STRONG_45), POLICY));
    }

    @Test
    void testSelfDebuffingMoveDropsBehindComparableAlternative() {
        StubCombatant self = new StubCombatant("self");
        StubCombatant opponent = new StubCombatant("opp").shields(1);

        assertEquals(List.of(SLAM, SUPERPOWER),
                MoveReordering.reorder(self, opponent, List.of(SUPERPOWER, SLAM), POLICY));
    }

    @Test
    void testSelfDebuffingMoveKeptWhenOpponentIsLow() {
        StubCombatant self = new StubCombatant("self");
        StubCombatant opponent = new StubCombatant("opp").shields(1).hp(40);

        assertEquals(List.of(SUPERPOWER, SLAM),
                MoveReordering.reorder(self, opponent, List.of(SUPERPOWER, SLAM), POLICY));
    }

    @Test
    void testEffectiveDpe() {
        StubCombatant self = new StubCombatant("self");
        StubCombatant opponent = new StubCombatant("opp");

        assertEquals(55.0 / 50, MoveReordering.effectiveDpe(self, opponent, NUKE), 1e-9);
        assertEquals(0.0, MoveReordering.effectiveDpe(self, opponent,
                new ChargedMove("FREE", CombatType.NORMAL, 50, 0)));
    }
}
