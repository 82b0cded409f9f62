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
 * Machine-readable reason attached to every {@link SeedsException}.
 *
 * @author hal.hildebrand
 */
public enum ErrorCode {
    // validation
    INVALID_CONTENT_HANDLE,
    INVALID_ADDRESS,
    EMPTY_UNIT_IDS,
    DUPLICATE_UNIT_IDS,
    BATCH_TOO_LARGE,
    INVALID_CONFIGURATION,
    INVALID_ROOT,
    INVALID_PAGE,
    // authorization
    NOT_CREATOR,
    MISSING_ROLE,
    NOT_DELEGATE,
    // eligibility
    INVALID_PROOF,
    DAILY_QUOTA_EXHAUSTED,
    // lifecycle
    SEED_NOT_FOUND,
    SEED_RETRACTED,
    SEED_ALREADY_WON,
    SEED_NOT_ELIGIBLE,
    PERIOD_NOT_ENDED,
    PERIOD_ENDED,
    NO_VALID_WINNER,
    ROUND_SEED_LIMIT,
    TOTAL_SEED_LIMIT,
    ROUND_NOT_FOUND,
    PAUSED,
    NOT_PAUSED,
    // payment
    INSUFFICIENT_PAYMENT,
    TREASURY_NOT_CONFIGURED
}
