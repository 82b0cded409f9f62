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
package com.hellblazer.seeds.engine.config;

import com.hellblazer.seeds.engine.DeadlockStrategy;
import com.hellblazer.seeds.engine.RoundMode;
import com.hellblazer.seeds.engine.TieBreakingStrategy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class EngineConfigTest {

    @Test
    public void testDefaults() {
        var config = EngineConfig.defaultConfig();
        var p = config.getParameters();
        assertEquals(86_400, p.periodDuration());
        assertEquals(1_000, p.blessingWeight());
        assertEquals(0, p.commandmentWeight());
        assertEquals(1_000, p.timeDecayBase());
        assertEquals(10, p.timeDecayMin());
        assertEquals(RoundMode.ROUND_BASED, p.roundMode());
        assertEquals(TieBreakingStrategy.LOWEST_SEED_ID, p.tieBreakingStrategy());
        assertEquals(DeadlockStrategy.REVERT, p.deadlockStrategy());
        assertFalse(p.scoreResetOnRoundEnd());
        assertEquals(100_000, config.getMaxTotalSeeds());
        assertEquals(1_000, config.getMaxSeedsPerRound());
        assertEquals(100, config.getMaxBatchSize());
        assertTrue(config.getTreasury().isEmpty());
    }

    @Test
    public void testBuilderRoundTrip() {
        var config = EngineConfig.builder()
                                 .withBlessingCost(7)
                                 .withTreasury("0x00000000000000000000000000000000000000EE")
                                 .withTieBreakingStrategy(TieBreakingStrategy.PSEUDO_RANDOM)
                                 .build();
        assertEquals("0x00000000000000000000000000000000000000ee", config.getTreasury().orElseThrow());
        var copy = config.toBuilder().build();
        assertEquals(config.getParameters(), copy.getParameters());
        assertEquals(config.getTreasury(), copy.getTreasury());
    }

    @Test
    public void testRejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().withPeriodDuration(60).build());
        assertThrows(IllegalArgumentException.class,
                     () -> EngineConfig.builder().withPeriodDuration(8 * 86_400L).build());
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().withTimeDecay(500, 0).build());
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().withBlessingWeight(-1).build());
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().withBlessingsPerUnit(0).build());
        assertThrows(IllegalArgumentException.class,
                     () -> EngineConfig.builder().withMaxTotalSeeds(10).withMaxSeedsPerRound(11).build());
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().withMaxBatchSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.builder().withTreasury("treasury"));
        assertThrows(NullPointerException.class, () -> EngineConfig.builder().withRoundMode(null));
    }
}
