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

import com.hellblazer.seeds.engine.ErrorCode;
import com.hellblazer.seeds.engine.RoundMode;
import com.hellblazer.seeds.engine.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigurationLedgerTest {

    @Test
    public void testPendingAppliedOnlyOnRequest() {
        var ledger = new ConfigurationLedger(ScoringParameters.defaults(), null);
        assertFalse(ledger.hasPendingChanges());
        assertFalse(ledger.applyPending());

        ledger.update(p -> p.withRoundMode(RoundMode.PERSISTENT));
        ledger.update(p -> p.withBlessingCost(25));
        assertTrue(ledger.hasPendingChanges());
        assertEquals(RoundMode.ROUND_BASED, ledger.current().roundMode());
        assertEquals(0, ledger.current().blessingCost());

        assertTrue(ledger.applyPending());
        assertEquals(RoundMode.PERSISTENT, ledger.current().roundMode());
        assertEquals(25, ledger.current().blessingCost());
        assertFalse(ledger.hasPendingChanges());
    }

    @Test
    public void testInvalidUpdateLeavesPendingUnchanged() {
        var ledger = new ConfigurationLedger(ScoringParameters.defaults(), null);
        ledger.update(p -> p.withBlessingWeight(500));
        var e = assertThrows(ValidationException.class, () -> ledger.update(p -> p.withCommandmentsPerUnit(0)));
        assertEquals(ErrorCode.INVALID_CONFIGURATION, e.code());
        assertEquals(500, ledger.pending().blessingWeight());
        assertEquals(1, ledger.pending().commandmentsPerUnit());
    }

    @Test
    public void testTreasuryIsImmediate() {
        var ledger = new ConfigurationLedger(ScoringParameters.defaults(), null);
        assertTrue(ledger.treasury().isEmpty());
        ledger.setTreasury("0x00000000000000000000000000000000000000ee");
        assertEquals("0x00000000000000000000000000000000000000ee", ledger.treasury().orElseThrow());
        assertFalse(ledger.hasPendingChanges());
    }
}
