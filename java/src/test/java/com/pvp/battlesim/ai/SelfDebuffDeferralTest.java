package com.pvp.battlesim.ai;

import com.pvp.battlesim.StubCombatant;
import com.pvp.battlesim.move.ChargedMove;
import com.pvp.battlesim.move.CombatType;
import com.pvp.battlesim.move.MoveBuff;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SelfDebuffDeferralTest {

    private static final ChargedMove SUPERPOWER = new ChargedMove("SUPERPOWER", CombatType.FIGHTING, 85, 40,
            MoveBuff.self(0.667, 0.667, 1.0));
    private static final ChargedMove CRUNCH = new ChargedMove("CRUNCH", CombatType.DARK, 70, 45);
    private static final ChargedMove FLAME_CHARGE = new ChargedMove("FLAME_CHARGE", CombatType.FIRE, 65, 40,
            MoveBuff.self(2.0, 0.667, 1.0));
    private static final ChargedMove NUKE = new ChargedMove("NUKE", CombatType.NORMAL, 90, 50);

    private static final DecisionPolicy POLICY = DecisionPolicy.defaults();

    private static StubCombatant exposed(int energy) {
        return new StubCombatant("self").shields(0).energy(energy).chargedMoves(SUPERPOWER, CRUNCH);
    }

    private static StubCombatant threatening() {
        return new StubCombatant("opp").energy(60).chargedMoves(NUKE);
    }

    @Test
    void testDefersWhileExposed() {
        List<ChargedMove> allowed = SelfDebuffDeferral.filter(exposed(50), threatening(),
                List.of(SUPERPOWER, CRUNCH), POLICY);

        assertEquals(List.of(CRUNCH), allowed);
    }

    @Test
    void testNoDeferralWithPlentyOfEnergy() {
        // 100 energy covers two of the costliest move
        assertFalse(SelfDebuffDeferral.shouldDefer(exposed(100), threatening(), POLICY));
    }

    @Test
    void testNoDeferralWithShields() {
        assertFalse(SelfDebuffDeferral.shouldDefer(exposed(50).shields(1), threatening(), POLICY));
    }

    @Test
    void testNoDeferralWhenOpponentCannotThrow() {
        assertFalse(SelfDebuffDeferral.shouldDefer(exposed(50), threatening().energy(10), POLICY));
    }

    @Test
    void testNetSelfBuffWaivedWithMargin() {
        StubCombatant self = new StubCombatant("self").shields(0).energy(50).chargedMoves(FLAME_CHARGE, CRUNCH);

        assertTrue(FLAME_CHARGE.isSelfDebuffing());
        assertEquals(List.of(FLAME_CHARGE, CRUNCH),
                SelfDebuffDeferral.filter(self, threatening(), List.of(FLAME_CHARGE, CRUNCH), POLICY));
        assertEquals(List.of(CRUNCH),
                SelfDebuffDeferral.filter(self.energy(45), threatening(), List.of(FLAME_CHARGE, CRUNCH), POLICY),
                "Without the energy margin the buff does not outweigh the exposure");
    }
}
