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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Round number, period boundaries and resolved history.
 * <p>
 * The current round is OPEN while {@code now < periodStart + periodDuration} and RESOLVABLE afterwards. Resolution
 * closes it into history and opens the next round at the resolution time. The period duration is captured when a round
 * opens, so deferred configuration never stretches or shortens a running round.
 *
 * @author hal.hildebrand
 */
public final class RoundStateMachine {
    private static final Logger log = LoggerFactory.getLogger(RoundStateMachine.class);

    private final List<Round> history = new ArrayList<>();
    private long              number  = 1;
    private long              periodStart;
    private long              periodDuration;

    public RoundStateMachine(long periodStart, long periodDuration) {
        if (periodDuration <= 0) {
            throw new IllegalArgumentException("Period duration must be positive: " + periodDuration);
        }
        this.periodStart = periodStart;
        this.periodDuration = periodDuration;
    }

    /**
     * Record the outcome of the current round and open the next one.
     *
     * @param winnerSeedId winner, or 0 for a skipped round
     * @return the resolved round
     * @throws LifecycleException with {@link ErrorCode#PERIOD_NOT_ENDED} if the round is still open
     */
    public Round close(long now, long winnerSeedId, boolean rewin, long nextPeriodDuration) {
        requireResolvable(now);
        if (nextPeriodDuration <= 0) {
            throw new IllegalArgumentException("Period duration must be positive: " + nextPeriodDuration);
        }
        var resolved = new Round(number, periodStart, periodDuration, now, winnerSeedId, rewin);
        history.add(resolved);
        number++;
        periodStart = now;
        periodDuration = nextPeriodDuration;
        log.info("Round {} resolved ({}), round {} open until {}", resolved.number(),
                 winnerSeedId == 0 ? "skipped" : "winner " + winnerSeedId, number, periodEnd());
        return resolved;
    }

    public Round current() {
        return new Round(number, periodStart, periodDuration, 0L, 0L, false);
    }

    public boolean isResolvable(long now) {
        return now >= periodEnd();
    }

    public long number() {
        return number;
    }

    public long periodEnd() {
        return periodStart + periodDuration;
    }

    public long periodStart() {
        return periodStart;
    }

    public RoundPhase phase(long now) {
        return isResolvable(now) ? RoundPhase.RESOLVABLE : RoundPhase.OPEN;
    }

    /**
     * @throws LifecycleException with {@link ErrorCode#PERIOD_ENDED} once the voting window has closed
     */
    public void requireOpen(long now) {
        if (isResolvable(now)) {
            throw new LifecycleException(ErrorCode.PERIOD_ENDED,
                                         "Round " + number + " period ended at " + periodEnd());
        }
    }

    /**
     * @throws LifecycleException with {@link ErrorCode#PERIOD_NOT_ENDED} while the voting window is open
     */
    public void requireResolvable(long now) {
        if (!isResolvable(now)) {
            throw new LifecycleException(ErrorCode.PERIOD_NOT_ENDED,
                                         "Round " + number + " period ends at " + periodEnd() + ", now " + now);
        }
    }

    /**
     * Resolved history or the open round.
     */
    public Optional<Round> round(long roundNumber) {
        if (roundNumber == number) {
            return Optional.of(current());
        }
        if (roundNumber < 1 || roundNumber > history.size()) {
            return Optional.empty();
        }
        return Optional.of(history.get((int) (roundNumber - 1)));
    }

    public long timeUntilPeriodEnd(long now) {
        return Math.max(0L, periodEnd() - now);
    }

    /**
     * @return winning seed of a resolved round, 0 if skipped, open or unknown
     */
    public long winner(long roundNumber) {
        return round(roundNumber).map(Round::winnerSeedId).orElse(0L);
    }
}
