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

import com.hellblazer.seeds.common.LongArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns every seed ever submitted, the per-round submission index and the eligible set.
 * <p>
 * Validation methods never mutate; each mutation assumes its matching validation passed in the same critical section.
 *
 * @author hal.hildebrand
 */
final class SeedRegistry {
    private static final Logger log = LoggerFactory.getLogger(SeedRegistry.class);

    private final List<SeedState>          seeds       = new ArrayList<>();
    private final Map<Long, LongArrayList> roundIndex  = new HashMap<>();
    private final EligibleSet              eligible    = new EligibleSet();
    private final int                      maxTotal;
    private final int                      maxPerRound;

    SeedRegistry(int maxTotal, int maxPerRound) {
        this.maxTotal = maxTotal;
        this.maxPerRound = maxPerRound;
    }

    EligibleSet eligible() {
        return eligible;
    }

    Optional<SeedState> find(long seedId) {
        if (seedId < 1 || seedId > seeds.size()) {
            return Optional.empty();
        }
        return Optional.of(seeds.get((int) (seedId - 1)));
    }

    /**
     * @throws LifecycleException with {@link ErrorCode#SEED_NOT_FOUND}
     */
    SeedState get(long seedId) {
        return find(seedId).orElseThrow(
        () -> new LifecycleException(ErrorCode.SEED_NOT_FOUND, "Seed " + seedId + " does not exist"));
    }

    /**
     * Winners keep their first winning round. The seed leaves the eligible set either way.
     */
    void markWinner(SeedState seed, long round) {
        if (seed.selectedInRound == 0) {
            seed.selectedInRound = round;
        }
        eligible.remove(seed.id);
    }

    List<SeedState> page(int offset, int limit) {
        if (offset >= seeds.size()) {
            return List.of();
        }
        var end = (int) Math.min((long) offset + limit, seeds.size());
        return seeds.subList(offset, end);
    }

    /**
     * Bring the eligible set in line with the round that is about to open.
     *
     * @param mode         round mode that will govern the new round
     * @param previousMode round mode that governed the round just resolved
     * @param newRound     the round about to open
     */
    void reconcile(RoundMode mode, RoundMode previousMode, long newRound) {
        if (mode == RoundMode.ROUND_BASED) {
            var expired = eligible.retainIf(id -> get(id).eligibleInRound == newRound);
            if (expired > 0) {
                log.debug("Expired {} round-based seeds entering round {}", expired, newRound);
            }
        } else if (previousMode == RoundMode.ROUND_BASED) {
            int restored = 0;
            for (var seed : seeds) {
                if (seed.isOpen() && eligible.add(seed.id)) {
                    restored++;
                }
            }
            log.info("Switched to persistent eligibility entering round {}, restored {} seeds", newRound, restored);
        }
    }

    /**
     * Under round-based mode, let the current competitors compete again in the next round.
     *
     * @return number of seeds carried over
     */
    int carryOver(long fromRound, long toRound) {
        int carried = 0;
        for (var id : eligible.toArray()) {
            var seed = get(id);
            if (seed.eligibleInRound == fromRound) {
                seed.eligibleInRound = toRound;
                carried++;
            }
        }
        return carried;
    }

    /**
     * Seeds that won a round and were never retracted, ascending by id.
     */
    List<SeedState> previousWinners() {
        var winners = new ArrayList<SeedState>();
        for (var seed : seeds) {
            if (seed.selectedInRound != 0 && !seed.retracted) {
                winners.add(seed);
            }
        }
        return winners;
    }

    void retract(SeedState seed) {
        seed.retracted = true;
        eligible.remove(seed.id);
    }

    long[] roundSubmissions(long round) {
        var ids = roundIndex.get(round);
        return ids == null ? new long[0] : ids.toArray();
    }

    int size() {
        return seeds.size();
    }

    SeedState submit(String creator, String contentHandle, long now, long round) {
        var seed = new SeedState(seeds.size() + 1L, creator, contentHandle, now, round);
        seeds.add(seed);
        roundIndex.computeIfAbsent(round, r -> new LongArrayList()).addLong(seed.id);
        eligible.add(seed.id);
        return seed;
    }

    /**
     * @throws LifecycleException for missing, retracted or decided seeds
     * @throws AuthorizationException if the caller did not create the seed
     */
    SeedState validateRetract(long seedId, String caller) {
        var seed = get(seedId);
        if (!seed.creator.equals(caller)) {
            throw new AuthorizationException(ErrorCode.NOT_CREATOR,
                                             caller + " is not the creator of seed " + seedId);
        }
        if (seed.retracted) {
            throw new LifecycleException(ErrorCode.SEED_RETRACTED, "Seed " + seedId + " is already retracted");
        }
        if (seed.selectedInRound != 0) {
            throw new LifecycleException(ErrorCode.SEED_ALREADY_WON,
                                         "Seed " + seedId + " won round " + seed.selectedInRound);
        }
        return seed;
    }

    /**
     * @throws LifecycleException when a seed ceiling is reached
     */
    void validateSubmit(long round) {
        if (seeds.size() >= maxTotal) {
            throw new LifecycleException(ErrorCode.TOTAL_SEED_LIMIT, "Total seed limit reached: " + maxTotal);
        }
        var inRound = roundIndex.get(round);
        if (inRound != null && inRound.size() >= maxPerRound) {
            throw new LifecycleException(ErrorCode.ROUND_SEED_LIMIT,
                                         "Round " + round + " seed limit reached: " + maxPerRound);
        }
    }
}
