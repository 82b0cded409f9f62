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
 * Outcome of resolving a round. A reverted deadlock is not an outcome; it is raised as a {@link LifecycleException}.
 *
 * @author hal.hildebrand
 */
public sealed interface Resolution permits Resolution.Winner, Resolution.Skip {

    /**
     * @param rewin the seed had already won an earlier round
     */
    record Winner(long seedId, long score, boolean rewin) implements Resolution {
    }

    /**
     * No winner; the round still advances.
     *
     * @param strategy deadlock strategy that produced the skip
     */
    record Skip(DeadlockStrategy strategy) implements Resolution {
    }
}
