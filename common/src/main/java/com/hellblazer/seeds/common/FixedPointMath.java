/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Seeds.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.seeds.common;

/**
 * Deterministic fixed-point integer arithmetic for replayable scoring.
 * <p>
 * Every node replaying the same sequence of operations must compute bit-identical scores, so nothing here touches
 * floating point:
 * - Integer square root by Newton iteration, exact floor for every non-negative long
 * - Per-mille scaling with overflow detection instead of silent wrap-around
 * <p>
 * Usage:
 * <pre>
 * // Dampened weight of an elector's n-th contribution
 * long weight = FixedPointMath.dampen(n);
 *
 * // Apply a 1.5 weight and a 0.75 decay, both per-mille, truncating once
 * long scaled = FixedPointMath.scalePerMille(weight, 1500, 750);
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class FixedPointMath {

    /**
     * Fixed-point scale of score values (six decimal places).
     */
    public static final long SCALE = 1_000_000L;

    /**
     * Denominator for per-mille multipliers (weights, decay factors).
     */
    public static final long PER_MILLE = 1_000L;

    // Prevent instantiation
    private FixedPointMath() {
    }

    /**
     * Floor of the square root of a non-negative value.
     *
     * @param value non-negative input
     * @return largest r with r * r <= value
     */
    public static long isqrt(long value) {
        if (value < 0) {
            throw new ArithmeticException("Square root of negative value: " + value);
        }
        if (value < 2) {
            return value;
        }
        // Newton iteration from an over-estimate converges monotonically downward
        long x = 1L << ((64 - Long.numberOfLeadingZeros(value) + 1) / 2);
        while (true) {
            long y = (x + value / x) >>> 1;
            if (y >= x) {
                return x;
            }
            x = y;
        }
    }

    /**
     * Sub-linear dampening of a cumulative contribution count: floor(sqrt(n * SCALE)).
     *
     * @param count cumulative contributions, non-negative
     * @return dampened weight in SCALE units
     */
    public static long dampen(long count) {
        if (count < 0) {
            throw new ArithmeticException("Negative contribution count: " + count);
        }
        return isqrt(Math.multiplyExact(count, SCALE));
    }

    /**
     * Multiply by two per-mille factors, truncating toward zero once at the end.
     *
     * @param value  value to scale
     * @param first  factor in thousandths
     * @param second factor in thousandths
     * @return value * first * second / 1000^2
     * @throws ArithmeticException if the intermediate product overflows
     */
    public static long scalePerMille(long value, long first, long second) {
        return Math.multiplyExact(Math.multiplyExact(value, first), second) / (PER_MILLE * PER_MILLE);
    }

    /**
     * Clamp value between min and max.
     *
     * @param value Value to clamp
     * @param min   Minimum value
     * @param max   Maximum value
     * @return Clamped value
     */
    public static long clamp(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Saturating addition for non-negative accumulators.
     *
     * @param a non-negative value
     * @param b non-negative value
     * @return a + b, or Long.MAX_VALUE on overflow
     */
    public static long saturatingAdd(long a, long b) {
        long r = a + b;
        if (((a ^ r) & (b ^ r)) < 0) {
            return Long.MAX_VALUE;
        }
        return r;
    }
}
