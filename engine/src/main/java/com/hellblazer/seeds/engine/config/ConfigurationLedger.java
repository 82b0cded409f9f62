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
package com.hellblazer.seeds.engine.config;

import com.hellblazer.seeds.engine.ErrorCode;
import com.hellblazer.seeds.engine.ValidationException;

import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Current and pending scoring parameters. Writes land in pending; {@link #applyPending()} is called exactly once per
 * round boundary. The treasury address is the only value applied immediately.
 * <p>
 * Not thread safe; the owning engine serializes access.
 *
 * @author hal.hildebrand
 */
public final class ConfigurationLedger {

    private ScoringParameters current;
    private ScoringParameters pending;
    private String            treasury;

    public ConfigurationLedger(ScoringParameters initial, String treasury) {
        this.current = Objects.requireNonNull(initial, "initial");
        this.pending = initial;
        this.treasury = treasury;
    }

    /**
     * Swap pending into current.
     *
     * @return true if any value changed
     */
    public boolean applyPending() {
        if (!hasPendingChanges()) {
            return false;
        }
        current = pending;
        return true;
    }

    public ScoringParameters current() {
        return current;
    }

    public boolean hasPendingChanges() {
        return !current.equals(pending);
    }

    public ScoringParameters pending() {
        return pending;
    }

    public void setTreasury(String treasury) {
        this.treasury = treasury;
    }

    public Optional<String> treasury() {
        return Optional.ofNullable(treasury);
    }

    /**
     * Stage a change derived from the pending values.
     *
     * @return the new pending parameters
     * @throws ValidationException with {@link ErrorCode#INVALID_CONFIGURATION} if the result is out of range; pending
     *                             is left unchanged
     */
    public ScoringParameters update(UnaryOperator<ScoringParameters> change) {
        ScoringParameters next;
        try {
            next = change.apply(pending);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ValidationException(ErrorCode.INVALID_CONFIGURATION, e.getMessage());
        }
        pending = next;
        return next;
    }
}
