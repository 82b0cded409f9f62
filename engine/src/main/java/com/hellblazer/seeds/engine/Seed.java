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
 * Immutable snapshot of a seed as seen by queries and listeners.
 *
 * @param id               stable id, assigned from 1 and never reused
 * @param creator          normalized submitter address
 * @param contentHandle    content address of the work
 * @param blessingScore    fixed-point score, never negative
 * @param blessingCount    blessings cast on the seed
 * @param commandmentCount commandments attached to the seed
 * @param createdAt        engine clock at submission, epoch seconds
 * @param submittedInRound round that was current at submission
 * @param selectedInRound  round the seed won, 0 while undecided
 * @param retracted        withdrawn by its creator
 * @author hal.hildebrand
 */
public record Seed(long id, String creator, String contentHandle, long blessingScore, long blessingCount,
                   long commandmentCount, long createdAt, long submittedInRound, long selectedInRound,
                   boolean retracted) {

    public boolean isWinner() {
        return selectedInRound != 0;
    }
}
