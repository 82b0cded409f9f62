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
 * Moves base currency on behalf of the engine. Called only after every other check of an operation has passed, and
 * before any state is mutated.
 *
 * @author hal.hildebrand
 */
public interface PaymentGateway {

    /**
     * Credit the treasury with an accepted cost.
     */
    void deposit(String treasury, long amount);

    /**
     * Return the excess of a payment to the payer.
     */
    void refund(String payer, long amount);
}
