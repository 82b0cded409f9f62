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
 * Base sealed class for every rejection raised by the engine.
 * <p>
 * The hierarchy is closed over the failure categories: validation, authorization, eligibility, lifecycle and payment.
 * A thrown SeedsException always means the operation had no effect on engine state; the engine never retries on the
 * caller's behalf.
 *
 * @author hal.hildebrand
 */
public abstract sealed class SeedsException extends RuntimeException
permits ValidationException, AuthorizationException, EligibilityException, LifecycleException, PaymentException {

    private final ErrorCode code;

    protected SeedsException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    }
}
