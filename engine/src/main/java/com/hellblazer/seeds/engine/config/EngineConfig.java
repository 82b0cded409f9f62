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

import com.hellblazer.seeds.eligibility.Addresses;
import com.hellblazer.seeds.engine.DeadlockStrategy;
import com.hellblazer.seeds.engine.RoundMode;
import com.hellblazer.seeds.engine.TieBreakingStrategy;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable construction-time configuration of a {@link com.hellblazer.seeds.engine.SeedsEngine}: the initial scoring
 * parameters plus the structural ceilings that never change after construction.
 *
 * @author hal.hildebrand
 */
public final class EngineConfig {

    public static final int DEFAULT_MAX_TOTAL_SEEDS     = 100_000;
    public static final int DEFAULT_MAX_SEEDS_PER_ROUND = 1_000;
    public static final int DEFAULT_MAX_BATCH_SIZE      = 100;

    private final ScoringParameters parameters;
    private final int               maxTotalSeeds;
    private final int               maxSeedsPerRound;
    private final int               maxBatchSize;
    private final String            treasury;

    private EngineConfig(Builder builder, ScoringParameters parameters) {
        this.parameters = parameters;
        this.maxTotalSeeds = builder.maxTotalSeeds;
        this.maxSeedsPerRound = builder.maxSeedsPerRound;
        this.maxBatchSize = builder.maxBatchSize;
        this.treasury = builder.treasury;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Production defaults: one-day rounds, free actions, round-based competition.
     */
    public static EngineConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Short-period configuration for tests: one-hour rounds, no time decay, two blessings per unit.
     */
    public static EngineConfig testConfig() {
        return builder().withPeriodDuration(ScoringParameters.MIN_PERIOD_DURATION)
                        .withTimeDecay(1_000L, 1_000L)
                        .withBlessingsPerUnit(2)
                        .build();
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public int getMaxSeedsPerRound() {
        return maxSeedsPerRound;
    }

    public int getMaxTotalSeeds() {
        return maxTotalSeeds;
    }

    public ScoringParameters getParameters() {
        return parameters;
    }

    /**
     * @return the initial treasury address, normalized, if one was configured
     */
    public Optional<String> getTreasury() {
        return Optional.ofNullable(treasury);
    }

    /**
     * Builder seeded from this configuration.
     */
    public Builder toBuilder() {
        var b = new Builder();
        b.blessingWeight = parameters.blessingWeight();
        b.commandmentWeight = parameters.commandmentWeight();
        b.timeDecayBase = parameters.timeDecayBase();
        b.timeDecayMin = parameters.timeDecayMin();
        b.blessingCost = parameters.blessingCost();
        b.commandmentCost = parameters.commandmentCost();
        b.roundMode = parameters.roundMode();
        b.tieBreakingStrategy = parameters.tieBreakingStrategy();
        b.deadlockStrategy = parameters.deadlockStrategy();
        b.scoreResetOnRoundEnd = parameters.scoreResetOnRoundEnd();
        b.blessingsPerUnit = parameters.blessingsPerUnit();
        b.commandmentsPerUnit = parameters.commandmentsPerUnit();
        b.periodDuration = parameters.periodDuration();
        b.maxTotalSeeds = maxTotalSeeds;
        b.maxSeedsPerRound = maxSeedsPerRound;
        b.maxBatchSize = maxBatchSize;
        b.treasury = treasury;
        return b;
    }

    @Override
    public String toString() {
        return "EngineConfig{" + "parameters=" + parameters + ", maxTotalSeeds=" + maxTotalSeeds
        + ", maxSeedsPerRound=" + maxSeedsPerRound + ", maxBatchSize=" + maxBatchSize + ", treasury=" + treasury
        + '}';
    }

    public static class Builder {
        private static final ScoringParameters DEFAULTS = ScoringParameters.defaults();

        private long                blessingWeight       = DEFAULTS.blessingWeight();
        private long                commandmentWeight    = DEFAULTS.commandmentWeight();
        private long                timeDecayBase        = DEFAULTS.timeDecayBase();
        private long                timeDecayMin         = DEFAULTS.timeDecayMin();
        private long                blessingCost         = DEFAULTS.blessingCost();
        private long                commandmentCost      = DEFAULTS.commandmentCost();
        private RoundMode           roundMode            = DEFAULTS.roundMode();
        private TieBreakingStrategy tieBreakingStrategy  = DEFAULTS.tieBreakingStrategy();
        private DeadlockStrategy    deadlockStrategy     = DEFAULTS.deadlockStrategy();
        private boolean             scoreResetOnRoundEnd = DEFAULTS.scoreResetOnRoundEnd();
        private int                 blessingsPerUnit     = DEFAULTS.blessingsPerUnit();
        private int                 commandmentsPerUnit  = DEFAULTS.commandmentsPerUnit();
        private long                periodDuration       = DEFAULTS.periodDuration();
        private int                 maxTotalSeeds        = DEFAULT_MAX_TOTAL_SEEDS;
        private int                 maxSeedsPerRound     = DEFAULT_MAX_SEEDS_PER_ROUND;
        private int                 maxBatchSize         = DEFAULT_MAX_BATCH_SIZE;
        private String              treasury;

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if any value is out of range
         */
        public EngineConfig build() {
            if (maxTotalSeeds < 1) {
                throw new IllegalArgumentException("Max total seeds must be positive: " + maxTotalSeeds);
            }
            if (maxSeedsPerRound < 1 || maxSeedsPerRound > maxTotalSeeds) {
                throw new IllegalArgumentException(
                "Max seeds per round must be in [1, " + maxTotalSeeds + "]: " + maxSeedsPerRound);
            }
            if (maxBatchSize < 1) {
                throw new IllegalArgumentException("Max batch size must be positive: " + maxBatchSize);
            }
            var parameters = new ScoringParameters(blessingWeight, commandmentWeight, timeDecayBase, timeDecayMin,
                                                   blessingCost, commandmentCost, roundMode, tieBreakingStrategy,
                                                   deadlockStrategy, scoreResetOnRoundEnd, blessingsPerUnit,
                                                   commandmentsPerUnit, periodDuration);
            return new EngineConfig(this, parameters);
        }

        public Builder withBlessingCost(long cost) {
            this.blessingCost = cost;
            return this;
        }

        public Builder withBlessingWeight(long weight) {
            this.blessingWeight = weight;
            return this;
        }

        public Builder withBlessingsPerUnit(int count) {
            this.blessingsPerUnit = count;
            return this;
        }

        public Builder withCommandmentCost(long cost) {
            this.commandmentCost = cost;
            return this;
        }

        public Builder withCommandmentWeight(long weight) {
            this.commandmentWeight = weight;
            return this;
        }

        public Builder withCommandmentsPerUnit(int count) {
            this.commandmentsPerUnit = count;
            return this;
        }

        public Builder withDeadlockStrategy(DeadlockStrategy strategy) {
            this.deadlockStrategy = Objects.requireNonNull(strategy, "strategy");
            return this;
        }

        public Builder withMaxBatchSize(int size) {
            this.maxBatchSize = size;
            return this;
        }

        public Builder withMaxSeedsPerRound(int max) {
            this.maxSeedsPerRound = max;
            return this;
        }

        public Builder withMaxTotalSeeds(int max) {
            this.maxTotalSeeds = max;
            return this;
        }

        /**
         * Round length in seconds, between one hour and seven days.
         */
        public Builder withPeriodDuration(long seconds) {
            this.periodDuration = seconds;
            return this;
        }

        public Builder withRoundMode(RoundMode mode) {
            this.roundMode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder withScoreResetOnRoundEnd(boolean reset) {
            this.scoreResetOnRoundEnd = reset;
            return this;
        }

        public Builder withTieBreakingStrategy(TieBreakingStrategy strategy) {
            this.tieBreakingStrategy = Objects.requireNonNull(strategy, "strategy");
            return this;
        }

        /**
         * Decay factors in per-mille. Equal values disable decay.
         */
        public Builder withTimeDecay(long base, long min) {
            this.timeDecayBase = base;
            this.timeDecayMin = min;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the address is malformed
         */
        public Builder withTreasury(String address) {
            this.treasury = address == null ? null : Addresses.normalize(address);
            return this;
        }
    }
}
