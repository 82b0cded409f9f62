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

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.function.LongPredicate;

/**
 * Dense, order-irrelevant set of seed ids able to win, with O(1) insertion, membership and swap-and-pop removal.
 * <p>
 * Iteration order is the dense array order, which is fully determined by the history of adds and removes. Resolution
 * and leader queries read {@link #sortedIds()} so their candidate order does not depend on that history.
 *
 * @author hal.hildebrand
 */
final class EligibleSet {
    private final LongArrayList      ids   = new LongArrayList();
    private final Map<Long, Integer> index = new HashMap<>();

    /**
     * @return false if already present
     */
    boolean add(long seedId) {
        if (index.containsKey(seedId)) {
            return false;
        }
        index.put(seedId, ids.size());
        ids.addLong(seedId);
        return true;
    }

    boolean contains(long seedId) {
        return index.containsKey(seedId);
    }

    /**
     * Swap the last id into the removed slot and shrink.
     *
     * @return false if absent
     */
    boolean remove(long seedId) {
        var position = index.remove(seedId);
        if (position == null) {
            return false;
        }
        var last = ids.removeLast();
        if (last != seedId) {
            ids.setLong(position, last);
            index.put(last, position);
        }
        return true;
    }

    /**
     * Remove every id failing the predicate.
     *
     * @return number removed
     */
    int retainIf(LongPredicate keep) {
        int removed = 0;
        for (var id : ids.toArray()) {
            if (!keep.test(id)) {
                remove(id);
                removed++;
            }
        }
        return removed;
    }

    int size() {
        return ids.size();
    }

    long[] slice(int offset, int limit) {
        return ids.slice(offset, (int) Math.min((long) offset + limit, Integer.MAX_VALUE));
    }

    long[] sortedIds() {
        var copy = ids.toArray();
        Arrays.sort(copy);
        return copy;
    }

    long[] toArray() {
        return ids.toArray();
    }

    @Override
    public String toString() {
        return "EligibleSet" + ids;
    }
}
