package com.neighborgrid.life;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LifeRuleTest {

    @Test
    void parsesConwayRule() {
        LifeRule rule = LifeRule.parse("B3/S23");
        assertTrue(rule.shouldLive(false, 3));
        assertFalse(rule.shouldLive(false, 2));
        assertTrue(rule.shouldLive(true, 2));
        assertTrue(rule.shouldLive(true, 3));
        assertFalse(rule.shouldLive(true, 4));
        assertEquals(LifeRule.defaultLife(), rule);
    }

    @Test
    void labelIsNormalized() {
        LifeRule rule = LifeRule.parse(" b63/s32 ");
        assertEquals("B36/S23", rule.label());
        assertEquals("B36/S23", rule.toString());
    }

    @Test
    void emptySegmentsAreAllowed() {
        LifeRule rule = LifeRule.parse("B/S");
        for (int count = 0; count <= LifeRule.MAX_NEIGHBORS; count++) {
            assertFalse(rule.shouldLive(true, count));
            assertFalse(rule.shouldLive(false, count));
        }
    }

    @Test
    void malformedRulesAreRejected() {
        assertEquals("Rule string is empty",
                assertThrows(IllegalArgumentException.class, () -> LifeRule.parse(" ")).getMessage());
        assertThrows(IllegalArgumentException.class, () -> LifeRule.parse("B3S23"));
        assertThrows(IllegalArgumentException.class, () -> LifeRule.parse("S23/B3"));
        assertThrows(IllegalArgumentException.class, () -> LifeRule.parse("B3x/S23"));
        assertThrows(IllegalArgumentException.class, () -> LifeRule.parse("B9/S23"));
        assertThrows(IllegalArgumentException.class, () -> LifeRule.parse("B33/S23"));
    }

    @Test
    void neighborCountMustBeInRange() {
        LifeRule rule = LifeRule.defaultLife();
        assertThrows(IllegalArgumentException.class, () -> rule.shouldLive(true, 9));
        assertThrows(IllegalArgumentException.class, () -> rule.shouldLive(false, -1));
    }
}
