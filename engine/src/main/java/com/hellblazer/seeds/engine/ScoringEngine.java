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
import com.hellblazer.seeds.engine.config.ConfigurationLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Applies dampened, time-decayed contributions from blessings and commandments and enforces the daily quotas.
 * <p>
 * Each (elector, seed) pair remembers the dampened weight already applied, so a contribution adds only
 * {@code dampen(n) - dampen(n - 1)} scaled by weight and decay. Every call is O(1) regardless of history.
 * <p>
 * Validation never mutates; {@code apply*} re-validates before mutating so a caller can validate, settle payment and
 * apply within one critical section.
 *
 * @author hal.hildebrand
 */
final class ScoringEngine {
    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    private final SeedRegistry            registry;
    private final ElectorLedger           electors;
    private final RoundStateMachine       rounds;
    private final ConfigurationLedger     config;
    private final LongSupplier            clock;
    private final List<Commandment>       commandments = new ArrayList<>();
    private final Map<Long, List<Commandment>> bySeed  = new HashMap<>();

    ScoringEngine(SeedRegistry registry, ElectorLedger electors, RoundStateMachine rounds, ConfigurationLedger config,
                  LongSupplier clock) {
        this.registry = registry;
        this.electors = electors;
        this.rounds = rounds;
        this.config = config;
        this.clock = clock;
    }

    /**
     * @param ownedUnits units attested by the eligibility oracle for this call
     * @param proofValid result of the oracle check
     */
    BlessingResult applyBlessing(long seedId, String elector, long ownedUnits, boolean proofValid) {
        var seed = validateBlessing(seedId, elector, ownedUnits, proofValid, 0);
        var now = clock.getAsLong();
        var parameters = config.current();
        var round = rounds.current();

        var dampenedDelta = electors.recordBlessing(elector, seedId, ElectorLedger.day(now));
        var decay = TimeDecay.factor(parameters, round, now);
        var scoreDelta = TimeDecay.weigh(dampenedDelta, parameters.blessingWeight(), decay);
        seed.blessingScore = FixedPointMath.saturatingAdd(seed.blessingScore, scoreDelta);
        seed.blessingCount++;
        electors.recordRoundBlessing(round.number(), elector, seedId, scoreDelta);
        log.debug("Blessing {} -> seed {}: dampened delta {}, decay {}, score +{} = {}", elector, seedId,
                  dampenedDelta, decay, scoreDelta, seed.blessingScore);
        return new BlessingResult(seedId, elector, scoreDelta, seed.blessingScore);
    }

    ScoredCommandment applyCommandment(long seedId, String elector, String contentHandle, long ownedUnits,
                                       boolean proofValid) {
        var seed = validateCommandment(seedId, elector, contentHandle, ownedUnits, proofValid);
        var now = clock.getAsLong();
        var parameters = config.current();
        var round = rounds.current();

        var dampenedDelta = electors.recordCommandment(elector, seedId, ElectorLedger.day(now));
        long scoreDelta = 0;
        if (parameters.commandmentWeight() > 0 && registry.eligible().contains(seedId) && !rounds.isResolvable(now)) {
            var decay = TimeDecay.factor(parameters, round, now);
            scoreDelta = TimeDecay.weigh(dampenedDelta, parameters.commandmentWeight(), decay);
            seed.blessingScore = FixedPointMath.saturatingAdd(seed.blessingScore, scoreDelta);
            electors.recordRoundScore(round.number(), seedId, scoreDelta);
        }
        seed.commandmentCount++;
        var commandment = new Commandment(commandments.size() + 1L, seedId, elector, contentHandle, now,
                                          round.number());
        commandments.add(commandment);
        bySeed.computeIfAbsent(seedId, k -> new ArrayList<>()).add(commandment);
        log.debug("Commandment {} by {} on seed {}, score +{}", commandment.id(), elector, seedId, scoreDelta);
        return new ScoredCommandment(commandment, scoreDelta);
    }

    List<Commandment> commandments(long seedId) {
        var list = bySeed.get(seedId);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    long remainingBlessings(String elector, long ownedUnits) {
        return ElectorLedger.remaining(ownedUnits, config.current().blessingsPerUnit(),
                                       electors.blessingsUsed(elector, ElectorLedger.day(clock.getAsLong())));
    }

    long remainingCommandments(String elector, long ownedUnits) {
        return ElectorLedger.remaining(ownedUnits, config.current().commandmentsPerUnit(),
                                       electors.commandmentsUsed(elector, ElectorLedger.day(clock.getAsLong())));
    }

    /**
     * @param reserved blessings by the same elector already accepted earlier in the same batch
     */
    SeedState validateBlessing(long seedId, String elector, long ownedUnits, boolean proofValid, long reserved) {
        if (!proofValid) {
            throw new EligibilityException(ErrorCode.INVALID_PROOF, "Ownership proof rejected for " + elector);
        }
        var seed = registry.get(seedId);
        if (seed.retracted) {
            throw new LifecycleException(ErrorCode.SEED_RETRACTED, "Seed " + seedId + " is retracted");
        }
        if (seed.selectedInRound != 0) {
            throw new LifecycleException(ErrorCode.SEED_ALREADY_WON,
                                         "Seed " + seedId + " won round " + seed.selectedInRound);
        }
        if (!registry.eligible().contains(seedId)) {
            throw new LifecycleException(ErrorCode.SEED_NOT_ELIGIBLE,
                                         "Seed " + seedId + " is not competing in round " + rounds.number());
        }
        var now = clock.getAsLong();
        rounds.requireOpen(now);
        var used = electors.blessingsUsed(elector, ElectorLedger.day(now)) + reserved;
        if (ElectorLedger.remaining(ownedUnits, config.current().blessingsPerUnit(), used) == 0) {
            throw new EligibilityException(ErrorCode.DAILY_QUOTA_EXHAUSTED,
                                           elector + " has used " + used + " of " + ownedUnits + " x "
                                           + config.current().blessingsPerUnit() + " blessings today");
        }
        return seed;
    }

    SeedState validateCommandment(long seedId, String elector, String contentHandle, long ownedUnits,
                                  boolean proofValid) {
        ContentHandles.require(contentHandle);
        if (!proofValid) {
            throw new EligibilityException(ErrorCode.INVALID_PROOF, "Ownership proof rejected for " + elector);
        }
        var seed = registry.get(seedId);
        if (seed.retracted) {
            throw new LifecycleException(ErrorCode.SEED_RETRACTED, "Seed " + seedId + " is retracted");
        }
        var used = electors.commandmentsUsed(elector, ElectorLedger.day(clock.getAsLong()));
        if (ElectorLedger.remaining(ownedUnits, config.current().commandmentsPerUnit(), used) == 0) {
            throw new EligibilityException(ErrorCode.DAILY_QUOTA_EXHAUSTED,
                                           elector + " has used " + used + " of " + ownedUnits + " x "
                                           + config.current().commandmentsPerUnit() + " commandments today");
        }
        return seed;
    }

    record ScoredCommandment(Commandment commandment, long scoreDelta) {
    }
}
