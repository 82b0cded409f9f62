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
package com.hellblazer.seeds.engine;

import com.hellblazer.seeds.common.FixedPointMath;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-elector accounting: daily quota counters, the dampening state of every (elector, seed) pair and per-round
 * statistics kept for audit queries.
 * <p>
 * Daily counters reset implicitly: a counter stamped with an older day reads as zero.
 *
 * @author hal.hildebrand
 */
final class ElectorLedger {
    static final long SECONDS_PER_DAY = 86_400L;

    private final Map<String, DailyCounter> blessingsToday    = new HashMap<>();
    private final Map<String, DailyCounter> commandmentsToday = new HashMap<>();
    private final Map<Pair, PairState>      blessingPairs     = new HashMap<>();
    private final Map<Pair, PairState>      commandmentPairs  = new HashMap<>();
    private final Map<RoundSeed, Long>      roundScores       = new HashMap<>();
    private final Map<RoundPair, Long>      roundBlessings    = new HashMap<>();

    static long day(long now) {
        return Math.floorDiv(now, SECONDS_PER_DAY);
    }

    static long secondsUntilDailyReset(long now) {
        return SECONDS_PER_DAY - Math.floorMod(now, SECONDS_PER_DAY);
    }

    long blessingCount(String elector, long seedId) {
        var pair = blessingPairs.get(new Pair(elector, seedId));
        return pair == null ? 0 : pair.count;
    }

    long blessingsUsed(String elector, long day) {
        return used(blessingsToday, elector, day);
    }

    long commandmentsUsed(String elector, long day) {
        return used(commandmentsToday, elector, day);
    }

    /**
     * Count one blessing against the pair and return the increase of its dampened weight.
     */
    long recordBlessing(String elector, long seedId, long day) {
        consume(blessingsToday, elector, day);
        return blessingPairs.computeIfAbsent(new Pair(elector, seedId), k -> new PairState()).advance();
    }

    void recordRoundBlessing(long round, String elector, long seedId, long scoreDelta) {
        roundBlessings.merge(new RoundPair(round, elector, seedId), 1L, Long::sum);
        roundScores.merge(new RoundSeed(round, seedId), scoreDelta, Long::sum);
    }

    /**
     * Count one commandment against the pair and return the increase of its dampened weight.
     */
    long recordCommandment(String elector, long seedId, long day) {
        consume(commandmentsToday, elector, day);
        return commandmentPairs.computeIfAbsent(new Pair(elector, seedId), k -> new PairState()).advance();
    }

    void recordRoundScore(long round, long seedId, long scoreDelta) {
        roundScores.merge(new RoundSeed(round, seedId), scoreDelta, Long::sum);
    }

    /**
     * Remaining quota given the attested units and the per-unit allowance, never negative.
     */
    static long remaining(long ownedUnits, long perUnit, long used) {
        return Math.max(0L, Math.multiplyExact(ownedUnits, perUnit) - used);
    }

    long roundBlessings(long round, String elector, long seedId) {
        return roundBlessings.getOrDefault(new RoundPair(round, elector, seedId), 0L);
    }

    long roundScore(long round, long seedId) {
        return roundScores.getOrDefault(new RoundSeed(round, seedId), 0L);
    }

    private static void consume(Map<String, DailyCounter> counters, String elector, long day) {
        var counter = counters.computeIfAbsent(elector, k -> new DailyCounter());
        if (counter.day != day) {
            counter.day = day;
            counter.count = 0;
        }
        counter.count++;
    }

    private static long used(Map<String, DailyCounter> counters, String elector, long day) {
        var counter = counters.get(elector);
        return counter == null || counter.day != day ? 0 : counter.count;
    }

    private static final class DailyCounter {
        long day = Long.MIN_VALUE;
        long count;
    }

    /**
     * Cumulative count and the last dampened weight applied for it.
     */
    private static final class PairState {
        long count;
        long lastDampened;

        long advance() {
            count++;
            var dampened = FixedPointMath.dampen(count);
            var delta = dampened - lastDampened;
            lastDampened = dampened;
            return delta;
        }
    }

    private record Pair(String elector, long seedId) {
    }

    private record RoundSeed(long round, long seedId) {
    }

    private record RoundPair(long round, String elector, long seedId) {
    }
}
