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
 * Selection among candidates tied at the maximum score.
 *
 * @author hal.hildebrand
 */
public enum TieBreakingStrategy {
    /**
     * Smallest creation timestamp, then lowest id
     */
    EARLIEST_SUBMISSION,

    /**
     * Largest creation timestamp, then highest id
     */
    LATEST_SUBMISSION,

    LOWEST_SEED_ID,

    HIGHEST_SEED_ID,

    /**
     * Index drawn from the injected entropy source. Best effort only: whoever controls the entropy input controls the
     * pick.
     */
    PSEUDO_RANDOM
}
