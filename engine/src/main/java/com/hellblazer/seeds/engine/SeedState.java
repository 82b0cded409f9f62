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
 * Mutable engine-side seed. Only the engine's collaborators touch it, always under the engine's write lock.
 *
 * @author hal.hildebrand
 */
final class SeedState {
    final long   id;
    final String creator;
    final String contentHandle;
    final long   createdAt;
    final long   submittedInRound;

    long    blessingScore;
    long    blessingCount;
    long    commandmentCount;
    long    selectedInRound;
    boolean retracted;
    /**
     * Round in which the seed may compete under round-based mode. Starts at the submission round and moves forward only
     * when a round is skipped.
     */
    long    eligibleInRound;

    SeedState(long id, String creator, String contentHandle, long createdAt, long submittedInRound) {
        this.id = id;
        this.creator = creator;
        this.contentHandle = contentHandle;
        this.createdAt = createdAt;
        this.submittedInRound = submittedInRound;
        this.eligibleInRound = submittedInRound;
    }

    /**
     * Neither retracted nor decided.
     */
    boolean isOpen() {
        return !retracted && selectedInRound == 0;
    }

    Seed snapshot() {
        return new Seed(id, creator, contentHandle, blessingScore, blessingCount, commandmentCount, createdAt,
                        submittedInRound, selectedInRound, retracted);
    }

    @Override
    public String toString() {
        return "Seed#" + id;
    }
}
