package com.hellblazer.seeds.common;

import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.LongRange;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FixedPointMath - integer-only arithmetic backing replayable scores.
 *
 * @author hal.hildebrand
 */
class FixedPointMathTest {

    @Test
    void testIsqrtSmallValues() {
        assertEquals(0L, FixedPointMath.isqrt(0));
        assertEquals(1L, FixedPointMath.isqrt(1));
        assertEquals(1L, FixedPointMath.isqrt(3));
        assertEquals(2L, FixedPointMath.isqrt(4));
        assertEquals(3L, FixedPointMath.isqrt(15));
        assertEquals(4L, FixedPointMath.isqrt(16));
    }

    @Test
    void testIsqrtLargeValues() {
        assertEquals(3_037_000_499L, FixedPointMath.isqrt(Long.MAX_VALUE));
        assertEquals(1_000_000L, FixedPointMath.isqrt(1_000_000_000_000L));
    }

    @Test
    void testIsqrtRejectsNegative() {
        assertThrows(ArithmeticException.class, () -> FixedPointMath.isqrt(-1));
    }

    @Test
    void testDampenKnownValues() {
        assertEquals(0L, FixedPointMath.dampen(0));
        assertEquals(1_000_000L, FixedPointMath.dampen(1));
        assertEquals(1_414_213L, FixedPointMath.dampen(2));
        assertEquals(2_000_000L, FixedPointMath.dampen(4));
        assertEquals(10_000_000L, FixedPointMath.dampen(100));
    }

    @Test
    void testDampenIsSubLinear() {
        // Two contributions from one elector weigh less than two electors contributing once
        assertTrue(FixedPointMath.dampen(2) < 2 * FixedPointMath.dampen(1));
    }

    @Test
    void testScalePerMille() {
        assertEquals(750L, FixedPointMath.scalePerMille(1000, 750, 1000));
        assertEquals(1_125L, FixedPointMath.scalePerMille(1000, 1500, 750));
        // one truncation: 99 * 1000 * 10 / 10^6 floors once to 0, 150 * 1000 * 10 / 10^6 to 1
        assertEquals(0L, FixedPointMath.scalePerMille(99, 1000, 10));
        assertEquals(1L, FixedPointMath.scalePerMille(150, 1000, 10));
        assertEquals(4L, FixedPointMath.scalePerMille(999, 999, 5));
        assertThrows(ArithmeticException.class, () -> FixedPointMath.scalePerMille(Long.MAX_VALUE, 2, 1));
    }

    @Test
    void testClamp() {
        assertEquals(10L, FixedPointMath.clamp(5, 10, 20));
        assertEquals(20L, FixedPointMath.clamp(25, 10, 20));
        assertEquals(15L, FixedPointMath.clamp(15, 10, 20));
    }

    @Test
    void testSaturatingAdd() {
        assertEquals(5L, FixedPointMath.saturatingAdd(2, 3));
        assertEquals(Long.MAX_VALUE, FixedPointMath.saturatingAdd(Long.MAX_VALUE, 1));
    }

    @Property
    @Label("isqrt is the exact floor square root")
    void isqrtIsFloorSquareRoot(@ForAll @LongRange(min = 0, max = Long.MAX_VALUE) long value) {
        long r = FixedPointMath.isqrt(value);
        assertTrue(r * r <= value);
        long next = r + 1;
        // (r + 1)^2 must exceed value; compare via division to stay within range
        assertTrue(next > value / next);
    }

    @Property
    @Label("Marginal dampened weight only grows by truncation slack")
    void marginalWeightIsNonIncreasing(@ForAll @LongRange(min = 1, max = 200_000) long n) {
        long previous = FixedPointMath.dampen(n) - FixedPointMath.dampen(n - 1);
        long next = FixedPointMath.dampen(n + 1) - FixedPointMath.dampen(n);
        assertTrue(next <= previous + 1, "marginal weight grew at n=" + n);
        assertTrue(next > 0, "marginal weight must stay positive at n=" + n);
    }

    @Property
    @Label("Quadrupling the count strictly shrinks the marginal weight")
    void marginalWeightDiminishes(@ForAll @LongRange(min = 1, max = 10_000) long n) {
        long early = FixedPointMath.dampen(n) - FixedPointMath.dampen(n - 1);
        long late = FixedPointMath.dampen(4 * n) - FixedPointMath.dampen(4 * n - 1);
        assertTrue(late < early, "marginal weight did not diminish at n=" + n);
    }
}
