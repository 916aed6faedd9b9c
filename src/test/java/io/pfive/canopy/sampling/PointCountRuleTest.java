// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.canopy.sampling;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PointCountRuleTest {

    @Test
    void countGrowsLinearlyWithArea () {
        PointCountRule rule = new PointCountRule(100, 1100, 50, 250);
        // 50 + 0.2 * 500 + 1
        assertEquals(151, rule.count(600));
        assertEquals(51, rule.count(100));
        assertEquals(70, rule.count(197));
    }

    @Test
    void countIsClamped () {
        PointCountRule rule = new PointCountRule(100, 1100, 50, 250);
        assertEquals(50, rule.count(10));
        assertEquals(250, rule.count(1100));
        assertEquals(250, rule.count(5000));
    }

    @Test
    void reversedBoundsAreSwapped () {
        PointCountRule rule = new PointCountRule(1100, 100, 250, 50);
        assertEquals(100, rule.minArea, 0);
        assertEquals(1100, rule.maxArea, 0);
        assertEquals(50, rule.minPoints);
        assertEquals(250, rule.maxPoints);
        assertEquals(151, rule.count(600));
    }

    @Test
    void equalAreaBoundsChooseAnEnd () {
        PointCountRule rule = new PointCountRule(500, 500, 20, 80);
        assertEquals(20, rule.count(499.9));
        assertEquals(80, rule.count(500));
        assertEquals(80, rule.count(10_000));
    }

    @Test
    void negativeCountsAreRejected () {
        assertThrows(IllegalArgumentException.class, () -> new PointCountRule(0, 10, -1, 5));
    }

}
