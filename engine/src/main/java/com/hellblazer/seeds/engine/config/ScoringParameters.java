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

import java.util.Objects;

/**
 * The tunable economic and scoring parameters. Staged as "pending" at any time and swapped into "current" only at a
 * round boundary.
 * <p>
 * Weights and decay factors are per-mille: 1000 means 1.0.
 *
 * @param blessingWeight       multiplier applied to dampened blessing deltas
 * @param commandmentWeight    multiplier applied to dampened commandment deltas; 0 disables commandment scoring
 * @param timeDecayBase        decay factor at the start of a period
 * @param timeDecayMin         floor of the decay factor; no contribution is ever decayed below it
 * @param blessingCost         price of one blessing in base currency units
 * @param commandmentCost      price of one commandment in base currency units
 * @param roundMode            which seeds compete in a round
 * @param tieBreakingStrategy  selection among tied leaders
 * @param deadlockStrategy     handling of an all-zero round
 * @param scoreResetOnRoundEnd zero the scores of losing candidates when a round resolves with a winner
 * @param blessingsPerUnit     daily blessings granted per owned unit
 * @param commandmentsPerUnit  daily commandments granted per owned unit
 * @param periodDuration       round length in seconds
 * @author hal.hildebrand
 */
public record ScoringParameters(long blessingWeight, long commandmentWeight, long timeDecayBase, long timeDecayMin,
                                long blessingCost, long commandmentCost, RoundMode roundMode,
                                TieBreakingStrategy tieBreakingStrategy, DeadlockStrategy deadlockStrategy,
                                boolean scoreResetOnRoundEnd, int blessingsPerUnit, int commandmentsPerUnit,
                                long periodDuration) {

    public static final long MAX_WEIGHT          = 1_000_000L;
    public static final long MAX_DECAY           = 1_000L;
    public static final int  MAX_PER_UNIT        = 1_000;
    public static final long MIN_PERIOD_DURATION = 3_600L;
    public static final long MAX_PERIOD_DURATION = 7L * 86_400L;

    public ScoringParameters {
        Objects.requireNonNull(roundMode, "roundMode");
        Objects.requireNonNull(tieBreakingStrategy, "tieBreakingStrategy");
        Objects.requireNonNull(deadlockStrategy, "deadlockStrategy");
        if (blessingWeight < 0 || blessingWeight > MAX_WEIGHT) {
            throw new IllegalArgumentException("Blessing weight must be in [0, " + MAX_WEIGHT + "]: " + blessingWeight);
        }
        if (commandmentWeight < 0 || commandmentWeight > MAX_WEIGHT) {
            throw new IllegalArgumentException(
            "Commandment weight must be in [0, " + MAX_WEIGHT + "]: " + commandmentWeight);
        }
        if (timeDecayMin < 1 || timeDecayMin > timeDecayBase || timeDecayBase > MAX_DECAY) {
            throw new IllegalArgumentException(
            "Time decay must satisfy 1 <= min <= base <= " + MAX_DECAY + ": min=" + timeDecayMin + ", base="
            + timeDecayBase);
        }
        if (blessingCost < 0 || commandmentCost < 0) {
            throw new IllegalArgumentException("Costs must be non-negative");
        }
        if (blessingsPerUnit < 1 || blessingsPerUnit > MAX_PER_UNIT) {
            throw new IllegalArgumentException("Blessings per unit must be in [1, " + MAX_PER_UNIT + "]");
        }
        if (commandmentsPerUnit < 1 || commandmentsPerUnit > MAX_PER_UNIT) {
            throw new IllegalArgumentException("Commandments per unit must be in [1, " + MAX_PER_UNIT + "]");
        }
        if (periodDuration < MIN_PERIOD_DURATION || periodDuration > MAX_PERIOD_DURATION) {
            throw new IllegalArgumentException(
            "Period duration must be between " + MIN_PERIOD_DURATION + "s and " + MAX_PERIOD_DURATION + "s: "
            + periodDuration);
        }
    }

    /**
     * Defaults: unit weights, linear decay from 100% to a 1% floor, free actions, round-based competition, lowest id
     * wins ties, deadlocks revert, one blessing and one commandment per unit per day, one-day periods.
     */
    public static ScoringParameters defaults() {
        return new ScoringParameters(1_000L, 0L, 1_000L, 10L, 0L, 0L, RoundMode.ROUND_BASED,
                                     TieBreakingStrategy.LOWEST_SEED_ID, DeadlockStrategy.REVERT, false, 1, 1,
                                     86_400L);
    }

    public ScoringParameters withBlessingWeight(long v) {
        return new ScoringParameters(v, commandmentWeight, timeDecayBase, timeDecayMin, blessingCost, commandmentCost,
                                     roundMode, tieBreakingStrategy, deadlockStrategy, scoreResetOnRoundEnd,
                                     blessingsPerUnit, commandmentsPerUnit, periodDuration);
    }

    public ScoringParameters withCommandmentWeight(long v) {
        return new ScoringParameters(blessingWeight, v, timeDecayBase, timeDecayMin, blessingCost, commandmentCost,
                                     roundMode, tieBreakingStrategy, deadlockStrategy, scoreResetOnRoundEnd,
                                     blessingsPerUnit, commandmentsPerUnit, periodDuration);
    }

    public ScoringParameters withTimeDecay(long base, long min) {
        return new ScoringParameters(blessingWeight, commandmentWeight, base, min, blessingCost, commandmentCost,
                                     roundMode, tieBreakingStrategy, deadlockStrategy, scoreResetOnRoundEnd,
                                     blessingsPerUnit, commandmentsPerUnit, periodDuration);
    }

    public ScoringParameters withBlessingCost(long v) {
        return new ScoringParameters(blessingWeight, commandmentWeight, timeDecayBase, timeDecayMin, v,
                                     commandmentCost, roundMode, tieBreakingStrategy, deadlockStrategy,
                                     scoreResetOnRoundEnd, blessingsPerUnit, commandmentsPerUnit, periodDuration);
    }

    public ScoringParameters withCommandmentCost(long v) {
        return new ScoringParameters(blessingWeight, commandmentWeight, timeDecayBase, timeDecayMin, blessingCost, v,
                                     roundMode, tieBreakingStrategy, deadlockStrategy, scoreResetOnRoundEnd,
                                     blessingsPerUnit, commandmentsPerUnit, periodDuration);
    }

    public ScoringParameters withRoundMode(RoundMode v) {
        return new ScoringParameters(blessingWeight, commandmentWeight, timeDecayBase, timeDecayMin, blessingCost,
                                     commandmentCost, v, tieBreakingStrategy, deadlockStrategy, scoreResetOnRoundEnd,
                                     blessingsPerUnit, commandmentsPerUnit, periodDuration);
    }

    public ScoringParameters withTieBreakingStrategy(TieBreakingStrategy v) {
        return new ScoringParameters(blessingWeight, commandmentWeight, timeDecayBase, timeDecayMin, blessingCost,
                                     commandmentCost, roundMode, v, deadlockStrategy, scoreResetOnRoundEnd,
                                     blessingsPerUnit, commandmentsPerUnit, periodDuration);
    }

    public ScoringParameters withDeadlockStrategy(DeadlockStrategy v) {
        return new ScoringParameters(blessingWeight, commandmentWeight, timeDecayBase, timeDecayMin, blessingCost,
                                     commandmentCost, roundMode, tieBreakingStrategy, v, scoreResetOnRoundEnd,
                                     blessingsPerUnit, commandmentsPerUnit, periodDuration);
    }

    public ScoringParameters withScoreResetOnRoundEnd(boolean v) {
        return new ScoringParameters(blessingWeight, commandmentWeight, timeDecayBase, timeDecayMin, blessingCost,
                                     commandmentCost, roundMode, tieBreakingStrategy, deadlockStrategy, v,
                                     blessingsPerUnit, commandmentsPerUnit, periodDuration);
    }

    public ScoringParameters withBlessingsPerUnit(int v) {
        return new ScoringParameters(blessingWeight, commandmentWeight, timeDecayBase, timeDecayMin, blessingCost,
                                     commandmentCost, roundMode, tieBreakingStrategy, deadlockStrategy,
                                     scoreResetOnRoundEnd, v, commandmentsPerUnit, periodDuration);
    }

    public ScoringParameters withCommandmentsPerUnit(int v) {
        return new ScoringParameters(blessingWeight, commandmentWeight, timeDecayBase, timeDecayMin, blessingCost,
                                     commandmentCost, roundMode, tieBreakingStrategy, deadlockStrategy,
                                     scoreResetOnRoundEnd, blessingsPerUnit, v, periodDuration);
    }

    public ScoringParameters withPeriodDuration(long v) {
        return new ScoringParameters(blessingWeight, commandmentWeight, timeDecayBase, timeDecayMin, blessingCost,
                                     commandmentCost, roundMode, tieBreakingStrategy, deadlockStrategy,
                                     scoreResetOnRoundEnd, blessingsPerUnit, commandmentsPerUnit, v);
    }
}
