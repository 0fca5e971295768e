package com.pvp.battlesim.battle;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BattleResultTest {

    @Test
    void testRating() {
        assertEquals(500, BattleResult.rate(100, 100, 100, 100), "Full health on both sides is an even trade");
        assertEquals(1000, BattleResult.rate(100, 100, 0, 100));
        assertEquals(0, BattleResult.rate(0, 100, 100, 100));
        assertEquals(500, BattleResult.rate(0, 100, 0, 100));
        assertEquals(750, BattleResult.rate(50, 100, 0, 100));
    }

    @Test
    void testDrawAndAccessors() {
        BattleResult draw = new BattleResult(null, 0, 0, 500, 500, 10, 235000, null);
        BattleResult win = new BattleResult(Side.ONE, 40, 0, 700, 300, 10, 235000, List.of());

        assertTrue(draw.isDraw());
        assertTrue(draw.timeline().isEmpty());
        assertFalse(win.isDraw());
        assertEquals(300, win.rating(Side.TWO));
        assertEquals(40, win.hp(Side.ONE));
    }
}
