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

import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

public class EligibleSetTest {

    @Test
    public void testSwapAndPop() {
        var set = new EligibleSet();
        for (long id = 1; id <= 4; id++) {
            assertTrue(set.add(id));
        }
        assertFalse(set.add(2));

        assertTrue(set.remove(2));
        assertArrayEquals(new long[] { 1, 4, 3 }, set.toArray());
        assertFalse(set.contains(2));
        assertTrue(set.remove(3));
        assertArrayEquals(new long[] { 1, 4 }, set.toArray());
        assertFalse(set.remove(3));
        assertEquals(2, set.size());
    }

    @Test
    public void testRetainIfAndSlices() {
        var set = new EligibleSet();
        for (long id = 1; id <= 6; id++) {
            set.add(id);
        }
        assertEquals(3, set.retainIf(id -> id % 2 == 0));
        assertArrayEquals(new long[] { 2, 4, 6 }, set.sortedIds());
        assertEquals(1, set.slice(2, Integer.MAX_VALUE).length);
        assertEquals(0, set.slice(10, 5).length);
    }

    @Property
    @Label("Matches a reference set under arbitrary adds and removes")
    void matchesReference(@ForAll @Size(max = 200) List<@IntRange(min = -40, max = 40) Integer> ops) {
        var set = new EligibleSet();
        var reference = new TreeSet<Long>();
        for (var op : ops) {
            long id = Math.abs(op);
            if (op >= 0) {
                assertEquals(reference.add(id), set.add(id));
            } else {
                assertEquals(reference.remove(id), set.remove(id));
            }
            assertEquals(reference.size(), set.size());
        }
        assertArrayEquals(reference.stream().mapToLong(Long::longValue).toArray(), set.sortedIds());
        for (var id : set.toArray()) {
            assertTrue(set.contains(id));
        }
        assertEquals(set.size(), Arrays.stream(set.toArray()).distinct().count());
    }
}
