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

import com.hellblazer.seeds.eligibility.MerkleHash;
import com.hellblazer.seeds.eligibility.MerkleOwnershipOracle;
import com.hellblazer.seeds.eligibility.OwnershipTree;
import com.hellblazer.seeds.engine.config.EngineConfig;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A wired engine over a fixed ownership snapshot with a hand-driven clock.
 *
 * @author hal.hildebrand
 */
final class EngineFixture {
    static final String ADMIN    = "0x00000000000000000000000000000000000000a1";
    static final String CREATOR  = "0x00000000000000000000000000000000000000c1";
    static final String RELAYER  = "0x00000000000000000000000000000000000000b1";
    static final String TREASURY = "0x00000000000000000000000000000000000000ee";
    static final String X        = "0x0000000000000000000000000000000000000001";
    static final String Y        = "0x0000000000000000000000000000000000000002";
    static final String Z        = "0x0000000000000000000000000000000000000003";
    static final String OUTSIDER = "0x0000000000000000000000000000000000000009";

    /**
     * Midnight UTC, so the first day has a full 86,400 seconds.
     */
    static final long T0 = 1_700_006_400L;

    final AtomicLong    clock = new AtomicLong(T0);
    final OwnershipTree tree  = OwnershipTree.build(
    Map.of(X, new long[] { 1, 2 }, Y, new long[] { 3 }, Z, new long[] { 4, 5, 6 }));
    final SeedsEngine   engine;

    EngineFixture(EngineConfig config) {
        this(config, new InMemoryPaymentGateway(), round -> 0L);
    }

    EngineFixture(EngineConfig config, PaymentGateway payments, EntropySource entropy) {
        engine = new SeedsEngine(config, ADMIN, new MerkleOwnershipOracle(), payments, entropy, clock::get);
        engine.updateOwnershipRoot(ADMIN, tree.root());
        engine.grantRole(ADMIN, Role.CREATOR, CREATOR);
    }

    static String handle(int i) {
        return String.format("Qm%044d", i);
    }

    BlessingResult bless(String elector, long seedId) {
        return engine.blessSeed(elector, seedId, units(elector), proof(elector), 0);
    }

    void elapse(long seconds) {
        clock.addAndGet(seconds);
    }

    /**
     * Move past the end of the current period.
     */
    void endPeriod() {
        elapse(engine.getTimeUntilPeriodEnd());
    }

    List<MerkleHash> proof(String elector) {
        return tree.proof(elector).orElseThrow();
    }

    long submit(int i) {
        return engine.submitSeed(CREATOR, handle(i));
    }

    long[] units(String elector) {
        return tree.unitIds(elector).orElseThrow();
    }
}
