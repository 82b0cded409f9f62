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

import com.hellblazer.seeds.engine.config.EngineConfig;
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

import static com.hellblazer.seeds.engine.EngineFixture.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Engine invariants under arbitrary interleavings of submit, retract, bless, commandment, time and advance.
 *
 * @author hal.hildebrand
 */
public class SeedsEnginePropertyTest {

    private static final List<String> ELECTORS = List.of(X, Y, Z);

    @Property(tries = 200)
    @Label("Persistent mode: eligible set is exactly the open seeds")
    void persistentEligibleSet(@ForAll @Size(max = 60) List<@IntRange(max = 999) Integer> ops) {
        var f = new EngineFixture(EngineConfig.testConfig()
                                              .toBuilder()
                                              .withRoundMode(RoundMode.PERSISTENT)
                                              .withDeadlockStrategy(DeadlockStrategy.SKIP_ROUND)
                                              .build());
        for (var op : ops) {
            apply(f, op);
            var expected = new TreeSet<Long>();
            for (var seed : f.engine.getSeeds(0, SeedsEngine.MAX_PAGE_SIZE)) {
                if (!seed.retracted() && seed.selectedInRound() == 0) {
                    expected.add(seed.id());
                }
            }
            assertEquals(expected, eligible(f));
        }
    }

    @Property(tries = 200)
    @Label("Round-based mode without skips: eligible set is the open seeds of the current round")
    void roundBasedEligibleSet(@ForAll @Size(max = 60) List<@IntRange(max = 999) Integer> ops) {
        var f = new EngineFixture(EngineConfig.testConfig());
        for (var op : ops) {
            apply(f, op);
            var round = f.engine.currentRound();
            var expected = new TreeSet<Long>();
            for (var seed : f.engine.getSeeds(0, SeedsEngine.MAX_PAGE_SIZE)) {
                if (!seed.retracted() && seed.selectedInRound() == 0 && seed.submittedInRound() == round) {
                    expected.add(seed.id());
                }
            }
            assertEquals(expected, eligible(f));
        }
    }

    @Property(tries = 200)
    @Label("Daily usage never exceeds units times allowance and scores never go negative")
    void quotasAndScoresBounded(@ForAll @Size(max = 80) List<@IntRange(max = 999) Integer> ops) {
        var f = new EngineFixture(EngineConfig.testConfig()
                                              .toBuilder()
                                              .withRoundMode(RoundMode.PERSISTENT)
                                              .withDeadlockStrategy(DeadlockStrategy.SKIP_ROUND)
                                              .withCommandmentWeight(250)
                                              .build());
        var perUnit = f.engine.currentParameters().blessingsPerUnit();
        for (var op : ops) {
            apply(f, op);
            for (var elector : ELECTORS) {
                var owned = f.units(elector).length;
                assertTrue(f.engine.getUserDailyBlessingCount(elector) <= (long) owned * perUnit);
                assertTrue(f.engine.getUserDailyCommandmentCount(elector) <= owned);
            }
            for (var seed : f.engine.getSeeds(0, SeedsEngine.MAX_PAGE_SIZE)) {
                assertTrue(seed.blessingScore() >= 0);
            }
        }
    }

    private static void apply(EngineFixture f, int op) {
        var total = f.engine.getTotalSeedsCount();
        long seedId = total == 0 ? 1 : 1 + (op / 7) % total;
        var elector = ELECTORS.get((op / 3) % ELECTORS.size());
        if (op % 7 == 6) {
            f.elapse(600L * (1 + op % 5));
        }
        var before = Observed.of(f);
        try {
            switch (op % 7) {
                case 0, 1 -> f.submit(op);
                case 2 -> f.engine.retractSeed(seedId, CREATOR);
                case 3, 4 -> f.bless(elector, seedId);
                case 5 -> f.engine.submitCommandment(elector, seedId, handle(op), f.units(elector), f.proof(elector),
                                                     0);
                default -> {
                    if (f.engine.isResolvable()) {
                        f.engine.advance();
                    }
                }
            }
        } catch (SeedsException rejected) {
            assertEquals(before, Observed.of(f), "rejected with " + rejected.code() + " but state changed");
        }
    }

    private static TreeSet<Long> eligible(EngineFixture f) {
        var ids = new TreeSet<Long>();
        Arrays.stream(f.engine.getEligibleSeeds()).forEach(ids::add);
        return ids;
    }

    /**
     * Everything a rejected operation could have touched: seeds, eligibility, round and daily usage.
     */
    private record Observed(List<Seed> seeds, TreeSet<Long> eligible, long round, RoundPhase phase,
                            List<Long> dailyUsage) {

        static Observed of(EngineFixture f) {
            var usage = new ArrayList<Long>();
            for (var elector : ELECTORS) {
                usage.add(f.engine.getUserDailyBlessingCount(elector));
                usage.add(f.engine.getUserDailyCommandmentCount(elector));
            }
            return new Observed(f.engine.getSeeds(0, SeedsEngine.MAX_PAGE_SIZE), SeedsEnginePropertyTest.eligible(f), f.engine.currentRound(),
                                f.engine.phase(), usage);
        }
    }
}
