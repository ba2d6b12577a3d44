package com.kotsin.insights.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MathUtilsTest {

    // ========== safeDivide ==========

    @Test
    void testSafeDivide_NormalDivision() {
        assertEquals(2.5, MathUtils.safeDivide(5.0, 2.0, 0.0), 1e-12);
    }

    @Test
    void testSafeDivide_ZeroDenominatorReturnsDefault() {
        assertEquals(-1.0, MathUtils.safeDivide(5.0, 0.0, -1.0));
    }

    @Test
    void testSafeDivide_NaNAndInfiniteDenominatorReturnDefault() {
        assertEquals(0.0, MathUtils.safeDivide(5.0, Double.NaN, 0.0));
        assertEquals(0.0, MathUtils.safeDivide(5.0, Double.POSITIVE_INFINITY, 0.0));
    }

    @Test
    void testSafeDivide_OverflowingResultReturnsDefault() {
        assertEquals(7.0, MathUtils.safeDivide(Double.MAX_VALUE, 1e-300, 7.0));
    }

    // ========== valueOrDefault ==========

    @Test
    void testValueOrDefault() {
        assertEquals(3.0, MathUtils.valueOrDefault(3.0, 0.0));
        assertEquals(0.0, MathUtils.valueOrDefault(null, 0.0));
        assertEquals(1.0, MathUtils.valueOrDefault(Double.NaN, 1.0));
    }

    // ========== clamp ==========

    @Test
    void testClamp() {
        assertEquals(1.0, MathUtils.clamp(1.5, -1.0, 1.0));
        assertEquals(-1.0, MathUtils.clamp(-3.0, -1.0, 1.0));
        assertEquals(0.25, MathUtils.clamp(0.25, -1.0, 1.0));
    }

    @Test
    void testClamp_NaNCollapsesToMin() {
        assertEquals(0.0, MathUtils.clampUnit(Double.NaN));
    }
}
