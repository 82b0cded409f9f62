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

/**
 * A round. Resolved rounds are immutable history; the open round is reported with {@code resolvedAt == 0}.
 *
 * @param number         starts at 1, strictly increasing
 * @param periodStart    engine clock when the round opened, epoch seconds
 * @param periodDuration length of the voting window, seconds
 * @param resolvedAt     engine clock at resolution, 0 while open
 * @param winnerSeedId   winning seed, 0 when open or skipped
 * @param rewin          the winner had already won an earlier round
 * @author hal.hildebrand
 */
public record Round(long number, long periodStart, long periodDuration, long resolvedAt, long winnerSeedId,
                    boolean rewin) {

    public boolean isResolved() {
        return resolvedAt != 0;
    }

    public boolean isSkipped() {
        return isResolved() && winnerSeedId == 0;
    }

    public long periodEnd() {
        return periodStart + periodDuration;
    }
}
