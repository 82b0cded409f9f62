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

import com.hellblazer.seeds.engine.event.WinnerRecord;

import java.util.Optional;

/**
 * Outcome of a successful {@code advance()}.
 *
 * @param resolved           the round just closed
 * @param winner             present when the round produced a winner
 * @param configApplied      pending configuration differed from current and was swapped in
 * @param nextRound          the round now open
 * @author hal.hildebrand
 */
public record AdvanceResult(Round resolved, Optional<WinnerRecord> winner, boolean configApplied, Round nextRound) {

    public static AdvanceResult skipped(Round resolved, boolean configApplied, Round nextRound) {
        return new AdvanceResult(resolved, Optional.empty(), configApplied, nextRound);
    }

    public static AdvanceResult won(Round resolved, WinnerRecord winner, boolean configApplied, Round nextRound) {
        return new AdvanceResult(resolved, Optional.of(winner), configApplied, nextRound);
    }

    public boolean isSkipped() {
        return winner.isEmpty();
    }
}
