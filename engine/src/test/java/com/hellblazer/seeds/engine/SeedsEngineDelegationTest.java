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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.hellblazer.seeds.engine.EngineFixture.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Relayed blessings on behalf of electors that approved a delegate.
 *
 * @author hal.hildebrand
 */
public class SeedsEngineDelegationTest {

    private EngineFixture f;
    private SeedsEngine   engine;

    @BeforeEach
    public void setup() {
        f = new EngineFixture(EngineConfig.testConfig().toBuilder().withMaxBatchSize(4).build());
        engine = f.engine;
        engine.grantRole(ADMIN, Role.RELAYER, RELAYER);
    }

    @Test
    public void testRelayedBlessingConsumesElectorQuota() {
        var a = f.submit(1);
        var e = assertThrows(AuthorizationException.class,
                             () -> engine.blessSeedFor(RELAYER, a, X, f.units(X), f.proof(X), 0));
        assertEquals(ErrorCode.NOT_DELEGATE, e.code());

        engine.approveDelegate(X, RELAYER, true);
        assertTrue(engine.isDelegate(X, RELAYER));
        var result = engine.blessSeedFor(RELAYER, a, X, f.units(X), f.proof(X), 0);
        assertEquals(X, result.elector());
        assertEquals(1, engine.getUserDailyBlessingCount(X));
        assertEquals(0, engine.getUserDailyBlessingCount(RELAYER));
        assertTrue(engine.hasBlessed(X, a));

        engine.approveDelegate(X, RELAYER, false);
        assertFalse(engine.isDelegate(X, RELAYER));
        assertThrows(AuthorizationException.class,
                     () -> engine.blessSeedFor(RELAYER, a, X, f.units(X), f.proof(X), 0));
    }

    @Test
    public void testRelayerRoleIsRequired() {
        var a = f.submit(1);
        engine.approveDelegate(X, OUTSIDER, true);
        var e = assertThrows(AuthorizationException.class,
                             () -> engine.blessSeedFor(OUTSIDER, a, X, f.units(X), f.proof(X), 0));
        assertEquals(ErrorCode.MISSING_ROLE, e.code());

        engine.revokeRole(ADMIN, Role.RELAYER, RELAYER);
        assertFalse(engine.hasRole(Role.RELAYER, RELAYER));
    }

    @Test
    public void testBatchAppliesInOrder() {
        var a = f.submit(1);
        var b = f.submit(2);
        engine.approveDelegate(X, RELAYER, true);
        engine.approveDelegate(Y, RELAYER, true);

        var results = engine.batchBlessSeedsFor(RELAYER, List.of(request(a, X), request(a, X), request(b, Y)), 0);

        assertEquals(3, results.size());
        assertTrue(results.get(1).scoreDelta() < results.get(0).scoreDelta(), "second blessing is dampened");
        assertEquals(results.get(1).newScore(), engine.getSeed(a).blessingScore());
        assertEquals(2, engine.getBlessingCount(X, a));
        assertEquals(1, engine.getBlessingCount(Y, b));
    }

    @Test
    public void testBatchIsAllOrNothing() {
        var a = f.submit(1);
        engine.approveDelegate(Y, RELAYER, true);
        engine.approveDelegate(X, RELAYER, true);

        // Y holds 1 unit at 2 blessings per unit; the third blessing exceeds the quota
        var batch = List.of(request(a, X), request(a, Y), request(a, Y), request(a, Y));
        var e = assertThrows(EligibilityException.class, () -> engine.batchBlessSeedsFor(RELAYER, batch, 0));
        assertEquals(ErrorCode.DAILY_QUOTA_EXHAUSTED, e.code());
        assertEquals(0, engine.getSeed(a).blessingScore());
        assertEquals(0, engine.getUserDailyBlessingCount(X));
        assertEquals(0, engine.getUserDailyBlessingCount(Y));
    }

    @Test
    public void testBatchSizeIsBounded() {
        var a = f.submit(1);
        var batch = new ArrayList<BlessingRequest>();
        for (int i = 0; i < 5; i++) {
            batch.add(request(a, Z));
        }
        var e = assertThrows(ValidationException.class, () -> engine.batchBlessSeedsFor(RELAYER, batch, 0));
        assertEquals(ErrorCode.BATCH_TOO_LARGE, e.code());
    }

    private BlessingRequest request(long seedId, String elector) {
        return new BlessingRequest(seedId, elector, f.units(elector), f.proof(elector));
    }
}
