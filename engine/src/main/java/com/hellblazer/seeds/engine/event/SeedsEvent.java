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

import com.hellblazer.seeds.eligibility.MerkleHash;
import com.hellblazer.seeds.engine.DeadlockStrategy;
import com.hellblazer.seeds.engine.Role;
import com.hellblazer.seeds.engine.config.ScoringParameters;

/**
 * Sealed interface for engine lifecycle events.
 * <p>
 * Events are immutable records describing a completed state change. Scores are fixed-point values scaled by
 * {@link com.hellblazer.seeds.common.FixedPointMath#SCALE}.
 *
 * @author hal.hildebrand
 */
public sealed interface SeedsEvent
permits SeedsEvent.SeedSubmitted, SeedsEvent.SeedRetracted, SeedsEvent.BlessingSubmitted,
        SeedsEvent.CommandmentSubmitted, SeedsEvent.WinnerSelected, SeedsEvent.RoundSkipped, SeedsEvent.ScoresReset,
        SeedsEvent.BlessingPeriodStarted, SeedsEvent.ConfigurationApplied, SeedsEvent.OwnershipRootUpdated,
        SeedsEvent.TreasuryUpdated, SeedsEvent.Paused, SeedsEvent.Unpaused, SeedsEvent.RoleChanged,
        SeedsEvent.DelegateApproval {

    /**
     * Engine clock at the time of the event, epoch seconds.
     */
    long timestamp();

    /**
     * Round that was current when the event occurred.
     */
    long round();

    record SeedSubmitted(long timestamp, long round, long seedId, String creator, String contentHandle)
    implements SeedsEvent {
    }

    record SeedRetracted(long timestamp, long round, long seedId, String creator) implements SeedsEvent {
    }

    /**
     * @param elector    whose quota was consumed
     * @param actor      the caller; a relayer for delegated blessings, otherwise the elector
     * @param scoreDelta score actually added, zero when the contribution rounded away
     * @param newScore   seed score after the blessing
     */
    record BlessingSubmitted(long timestamp, long round, long seedId, String elector, String actor, long scoreDelta,
                             long newScore) implements SeedsEvent {
        public boolean delegated() {
            return !elector.equals(actor);
        }
    }

    record CommandmentSubmitted(long timestamp, long round, long commandmentId, long seedId, String elector,
                                String contentHandle, long scoreDelta) implements SeedsEvent {
    }

    /**
     * @param rewin true if the winner had already won an earlier round and was readmitted by
     *              {@link DeadlockStrategy#ALLOW_REWINS}
     */
    record WinnerSelected(long timestamp, long round, WinnerRecord winner, boolean rewin) implements SeedsEvent {
    }

    /**
     * @param carriedOver seeds left eligible for the next round
     */
    record RoundSkipped(long timestamp, long round, DeadlockStrategy strategy, int carriedOver)
    implements SeedsEvent {
    }

    record ScoresReset(long timestamp, long round, int seedsReset) implements SeedsEvent {
    }

    record BlessingPeriodStarted(long timestamp, long round, long periodEnd) implements SeedsEvent {
    }

    record ConfigurationApplied(long timestamp, long round, ScoringParameters previous, ScoringParameters current)
    implements SeedsEvent {
    }

    record OwnershipRootUpdated(long timestamp, long round, MerkleHash previous, MerkleHash root)
    implements SeedsEvent {
    }

    /**
     * @param previous prior treasury, or null if none was set
     */
    record TreasuryUpdated(long timestamp, long round, String previous, String treasury) implements SeedsEvent {
    }

    record Paused(long timestamp, long round, String admin, String reason) implements SeedsEvent {
    }

    record Unpaused(long timestamp, long round, String admin) implements SeedsEvent {
    }

    record RoleChanged(long timestamp, long round, Role role, String account, boolean granted, String admin)
    implements SeedsEvent {
    }

    record DelegateApproval(long timestamp, long round, String elector, String delegate, boolean approved)
    implements SeedsEvent {
    }
}
