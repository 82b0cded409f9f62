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
package com.hellblazer.seeds.engine.event;

/**
 * Structured outcome of a round resolved with a winner, handed to the downstream elevation workflow. That workflow owns
 * its own idempotency; the engine emits each record once and never retries.
 *
 * @param round         the resolved round
 * @param seedId        the winning seed
 * @param contentHandle content address of the winning work
 * @param finalScore    the winner's score at resolution, fixed-point scaled
 * @author hal.hildebrand
 */
public record WinnerRecord(long round, long seedId, String contentHandle, long finalScore) {
}
