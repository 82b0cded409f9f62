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
 * Receives engine events after the mutation that produced them has completed.
 * <p>
 * Events are dispatched synchronously on the mutating thread while the engine's write lock is held, so
 * implementations must be fast and must not call back into mutating engine operations from another thread. Exceptions
 * are caught and logged by the engine; a failing listener never rolls back state or starves other listeners.
 *
 * <pre>
 * engine.addEventListener(event -> {
 *     if (event instanceof SeedsEvent.WinnerSelected w) {
 *         elevation.enqueue(w.winner());
 *     }
 * });
 * </pre>
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface SeedsEventListener {

    void onEvent(SeedsEvent event);
}
