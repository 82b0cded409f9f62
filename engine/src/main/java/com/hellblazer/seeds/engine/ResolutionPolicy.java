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
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Chooses a round's winner from the scored candidates.
 * <p>
 * The highest positive score wins and ties are broken by the configured {@link TieBreakingStrategy}. When no candidate
 * has a positive score the round is deadlocked and the {@link DeadlockStrategy} decides. Given the same candidates,
 * strategies and entropy the result is always the same, independent of candidate order.
 *
 * @author hal.hildebrand
 */
public class ResolutionPolicy {
    private static final Logger log = LoggerFactory.getLogger(ResolutionPolicy.class);

    private static final Comparator<Candidate> BY_ID = Comparator.comparingLong(Candidate::seedId);

    private final EntropySource entropy;

    public ResolutionPolicy(EntropySource entropy) {
        this.entropy = Objects.requireNonNull(entropy, "entropy");
    }

    /**
     * @param round            the round being resolved
     * @param candidates       eligible, open seeds of the round
     * @param previousWinners  decided, unretracted seeds; consulted only by {@link DeadlockStrategy#ALLOW_REWINS}
     * @param tieBreaking      selection among tied leaders
     * @param deadlock         handling of an all-zero round
     * @throws LifecycleException with {@link ErrorCode#NO_VALID_WINNER} if the deadlock is reverted
     */
    public Resolution resolve(long round, Collection<Candidate> candidates, Collection<Candidate> previousWinners,
                              TieBreakingStrategy tieBreaking, DeadlockStrategy deadlock) {
        var leaders = leaders(candidates);
        if (!leaders.isEmpty()) {
            var winner = breakTie(round, leaders, tieBreaking);
            return new Resolution.Winner(winner.seedId(), winner.score(), false);
        }

        log.warn("Round {} deadlocked: {} candidates, none with a positive score, strategy {}", round,
                 candidates.size(), deadlock);
        switch (deadlock) {
            case REVERT:
                throw new LifecycleException(ErrorCode.NO_VALID_WINNER,
                                             "Round " + round + " has no seed with a positive score");
            case SKIP_ROUND:
                return new Resolution.Skip(deadlock);
            case RANDOM_FROM_ALL:
                if (candidates.isEmpty()) {
                    return new Resolution.Skip(deadlock);
                }
                var all = new ArrayList<>(candidates);
                all.sort(BY_ID);
                var picked = all.get(pick(round, all.size()));
                return new Resolution.Winner(picked.seedId(), picked.score(), false);
            case ALLOW_REWINS:
                var pool = new ArrayList<Candidate>(candidates.size() + previousWinners.size());
                pool.addAll(candidates);
                pool.addAll(previousWinners);
                var rewinLeaders = leaders(pool);
                if (rewinLeaders.isEmpty()) {
                    throw new LifecycleException(ErrorCode.NO_VALID_WINNER,
                                                 "Round " + round + " has no seed with a positive score, even among "
                                                 + previousWinners.size() + " previous winners");
                }
                var rewinner = breakTie(round, rewinLeaders, tieBreaking);
                var rewin = previousWinners.stream().anyMatch(c -> c.seedId() == rewinner.seedId());
                return new Resolution.Winner(rewinner.seedId(), rewinner.score(), rewin);
            default:
                throw new IllegalStateException("Unknown deadlock strategy: " + deadlock);
        }
    }

    Candidate breakTie(long round, List<Candidate> leaders, TieBreakingStrategy strategy) {
        if (leaders.size() == 1) {
            return leaders.get(0);
        }
        return switch (strategy) {
            case LOWEST_SEED_ID -> leaders.get(0);
            case HIGHEST_SEED_ID -> leaders.get(leaders.size() - 1);
            case EARLIEST_SUBMISSION -> leaders.stream()
                                               .min(Comparator.comparingLong(Candidate::createdAt).thenComparing(BY_ID))
                                               .orElseThrow();
            case LATEST_SUBMISSION -> leaders.stream()
                                             .max(Comparator.comparingLong(Candidate::createdAt).thenComparing(BY_ID))
                                             .orElseThrow();
            case PSEUDO_RANDOM -> leaders.get(pick(round, leaders.size()));
        };
    }

    /**
     * Candidates tied at the highest positive score, ascending by id. Empty if no score is positive.
     */
    static List<Candidate> leaders(Collection<Candidate> candidates) {
        long max = 0;
        for (var c : candidates) {
            max = Math.max(max, c.score());
        }
        var leaders = new ArrayList<Candidate>();
        if (max == 0) {
            return leaders;
        }
        for (var c : candidates) {
            if (c.score() == max) {
                leaders.add(c);
            }
        }
        leaders.sort(BY_ID);
        return leaders;
    }

    private int pick(long round, int size) {
        return (int) Math.floorMod(entropy.entropy(round), (long) size);
    }
}
