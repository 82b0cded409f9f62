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
 * Handling of a round whose candidates all score zero.
 *
 * @author hal.hildebrand
 */
public enum DeadlockStrategy {
    /**
     * Resolution fails and the round stays resolvable until some candidate scores
     */
    REVERT,

    /**
     * The round advances with no winner; every candidate stays eligible
     */
    SKIP_ROUND,

    /**
     * A candidate is drawn from the injected entropy source despite its zero score
     */
    RANDOM_FROM_ALL,

    /**
     * Previously selected seeds rejoin the pool for this resolution, so a prior winner may be selected again
     */
    ALLOW_REWINS
}
