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
import com.hellblazer.seeds.engine.config.ScoringParameters;

/**
 * Linear within-period decay of contribution weight.
 * <p>
 * The factor starts at {@code timeDecayBase} when the period opens and falls in proportion to the time remaining,
 * never below {@code timeDecayMin}. Early contributions therefore weigh more than late ones, which blunts last-minute
 * swings. Equal base and minimum disable decay.
 *
 * @author hal.hildebrand
 */
public final class TimeDecay {

    private TimeDecay() {
    }

    /**
     * @return per-mille factor in [timeDecayMin, timeDecayBase]
     */
    public static long factor(ScoringParameters parameters, Round round, long now) {
        var duration = round.periodDuration();
        var remaining = FixedPointMath.clamp(round.periodEnd() - now, 0L, duration);
        var linear = parameters.timeDecayBase() * remaining / duration;
        return Math.max(parameters.timeDecayMin(), linear);
    }

    /**
     * Scale a dampened delta by weight and decay in a single truncation.
     * <p>
     * A positive delta under a positive weight always contributes at least one unit, so the decay floor never
     * rounds a counted blessing down to nothing.
     *
     * @return {@code dampenedDelta * weight * decay / PER_MILLE^2}, at least 1 when delta and weight are positive
     */
    public static long weigh(long dampenedDelta, long weight, long decay) {
        if (dampenedDelta <= 0 || weight <= 0) {
            return 0L;
        }
        return Math.max(1L, FixedPointMath.scalePerMille(dampenedDelta, weight, decay));
    }
}
