package com.pvp.battlesim.battle;

import com.pvp.battlesim.Fixtures;
import com.pvp.battlesim.ai.DecisionMode;
import com.pvp.battlesim.ai.DecisionPolicy;
import com.pvp.battlesim.combatant.Combatant;
import com.pvp.battlesim.rng.BattleRng;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BattleTest {

    private static Combatant azumarill;
    private static Combatant stunfisk;

    @BeforeAll
    static void setUp() {
        azumarill = Fixtures.azumarill().build();
        stunfisk = Fixtures.stunfisk().build();
    }

    @Test
    void testBattleRunsToCompletion() {
        Battle battle = new Battle(azumarill, stunfisk, BattleConfig.defaults(), new BattleRng(42));
        BattleResult result = battle.simulate();

        assertTrue(battle.isOver());
        assertTrue(result.turns() > 0 && result.turns() <= BattleConfig.DEFAULT_MAX_TURNS);
        assertEquals(BattleResult.MAX_RATING, result.ratingOne() + result.ratingTwo(), "Ratings should sum to 1000");
        assertTrue(result.ratingOne() >= 0 && result.ratingOne() <= BattleResult.MAX_RATING);
        assertTrue(result.hpOne() == 0 || result.hpTwo() == 0 || result.turns() == BattleConfig.DEFAULT_MAX_TURNS);
        if (!result.isDraw()) {
            assertTrue(result.rating(result.winner()) >= result.rating(result.winner().opponent()),
                    "The winner should not be rated below the loser");
        }
    }

    @Test
    void testSameSeedSameResult() {
        BattleConfig config = BattleConfig.defaults().withTimeline(true);

        BattleResult first = new Battle(azumarill, stunfisk, config, new BattleRng(7)).simulate();
        BattleResult second = new Battle(azumarill, stunfisk, config, new BattleRng(7)).simulate();

        assertEquals(first, second, "Same seed should replay the same battle");
    }

    @Test
    void testOriginalsUntouched() {
        new Battle(azumarill, stunfisk, BattleConfig.defaults(), new BattleRng(1)).simulate();

        assertEquals(azumarill.getMaxHp(), azumarill.getHp());
        assertEquals(0, azumarill.getEnergy());
        assertEquals(2, stunfisk.getShields());
    }

    @Test
    void testTimeoutDecidedByRating() {
        BattleConfig config = BattleConfig.defaults().withMaxTurns(3);
        BattleResult result = new Battle(azumarill, stunfisk, config, new BattleRng(1)).simulate();

        // Two mud shots (2 each) against one bubble (5)
        assertEquals(3, result.turns());
        assertEquals(0, result.timeRemainingMs());
        assertEquals(173, result.hpOne());
        assertEquals(184, result.hpTwo());
        assertEquals(501, result.ratingOne());
        assertEquals(499, result.ratingTwo());
        assertEquals(Side.ONE, result.winner());
    }

    @Test
    void testPhasesFollowCooldowns() {
        Battle battle = new Battle(azumarill, stunfisk, BattleConfig.defaults(), new BattleRng(1));
        battle.start();
        assertEquals(CombatantPhase.READY, battle.phase(Side.ONE));

        battle.tick();
        assertEquals(CombatantPhase.ACTION_RESOLVED, battle.phase(Side.ONE));
        assertEquals(CombatantPhase.ACTION_RESOLVED, battle.phase(Side.TWO));
        assertEquals(2, battle.combatant(Side.ONE).getCooldown(), "Bubble takes three turns");
        assertEquals(11, battle.combatant(Side.ONE).getEnergy());

        battle.tick();
        assertEquals(CombatantPhase.COOLDOWN, battle.phase(Side.ONE));
        assertEquals(CombatantPhase.COOLDOWN, battle.phase(Side.TWO));

        battle.tick();
        assertEquals(CombatantPhase.COOLDOWN, battle.phase(Side.ONE));
        assertEquals(CombatantPhase.ACTION_RESOLVED, battle.phase(Side.TWO));
        assertEquals(18, battle.combatant(Side.TWO).getEnergy());
        assertEquals(3, battle.getTurn());
    }

    @Test
    void testShieldsAbsorbChargedMoves() {
        BattleConfig config = BattleConfig.defaults().withTimeline(true);
        Battle battle = new Battle(azumarill, stunfisk, config, new BattleRng(3));
        BattleResult result = battle.simulate();

        int shieldedByTwo = 0;
        for (TimelineEvent event : result.timeline()) {
            if (event.kind() == ActionKind.CHARGED && event.shielded()) {
                assertEquals(DamageCalculator.SHIELDED_DAMAGE, event.damage());
                if (event.actor() == Side.ONE) {
                    shieldedByTwo++;
                }
            }
            if (event.kind() == ActionKind.FAST) {
                assertFalse(event.shielded());
            }
        }
        assertEquals(2 - shieldedByTwo, battle.combatant(Side.TWO).getShields());
        assertFalse(result.timeline().isEmpty());
        assertEquals(result.timeline(), battle.getTimeline());
    }

    @Test
    void testTimelineOnlyWhenRequested() {
        BattleResult result = new Battle(azumarill, stunfisk, BattleConfig.defaults(), new BattleRng(3)).simulate();

        assertTrue(result.timeline().isEmpty());
    }

    @Test
    void testStartingEnergyAndShields() {
        BattleConfig config = BattleConfig.defaults().withShields(0, 1).withEnergy(50, 0);
        Battle battle = new Battle(azumarill, stunfisk, config, new BattleRng(1));
        battle.start();

        assertEquals(0, battle.combatant(Side.ONE).getShields());
        assertEquals(1, battle.combatant(Side.TWO).getShields());
        assertEquals(50, battle.combatant(Side.ONE).getEnergy());
    }

    @Test
    void testRandomModesFinish() {
        for (DecisionMode mode : DecisionMode.values()) {
            BattleConfig config = BattleConfig.defaults().withMode(mode).withEnergy(100, 100);
            BattleResult result = new Battle(azumarill, stunfisk, config, new BattleRng(9)).simulate();

            assertEquals(BattleResult.MAX_RATING, result.ratingOne() + result.ratingTwo(), mode + " ratings");
            assertTrue(result.turns() <= BattleConfig.DEFAULT_MAX_TURNS);
        }
    }

    @Test
    void testSmallSearchBudgetStillFinishes() {
        BattleConfig config = BattleConfig.defaults()
                .withEnergy(60, 60)
                .withPolicy(DecisionPolicy.defaults().withMaxSearchStates(3));
        BattleResult result = new Battle(azumarill, stunfisk, config, new BattleRng(4)).simulate();

        assertEquals(BattleResult.MAX_RATING, result.ratingOne() + result.ratingTwo());
    }

    @Test
    void testTickAfterEndFails() {
        Battle battle = new Battle(azumarill, stunfisk, BattleConfig.defaults().withMaxTurns(1), new BattleRng(1));
        battle.simulate();

        assertThrows(IllegalStateException.class, battle::tick);
    }

    @Test
    void testRequiresRandomSource() {
        assertThrows(IllegalArgumentException.class,
                () -> new Battle(azumarill, stunfisk, BattleConfig.defaults(), null));
        assertThrows(IllegalArgumentException.class,
                () -> new Battle(azumarill, null, BattleConfig.defaults(), new BattleRng(1)));
    }

    @Test
    void testConfigValidation() {
        assertThrows(IllegalArgumentException.class, () -> BattleConfig.defaults().withShields(-1, 2));
        assertThrows(IllegalArgumentException.class, () -> BattleConfig.defaults().withEnergy(0, 101));
        assertThrows(IllegalArgumentException.class, () -> BattleConfig.defaults().withMaxTurns(0));
    }
}
