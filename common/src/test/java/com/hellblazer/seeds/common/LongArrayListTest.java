package com.hellblazer.seeds.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LongArrayList
 */
class LongArrayListTest {

    @Test
    void testAddAndGrow() {
        var list = new LongArrayList(1);
        for (long i = 0; i < 100; i++) {
            list.addLong(i * 3);
        }
        assertEquals(100, list.size());
        assertEquals(0L, list.getLong(0));
        assertEquals(297L, list.getLong(99));
    }

    @Test
    void testSetAndRemoveLast() {
        var list = list(5, 6, 7);
        assertEquals(6L, list.setLong(1, 7));
        assertEquals(7L, list.removeLast());
        assertEquals(2, list.size());
        assertArrayEquals(new long[] { 5, 7 }, list.toArray());
    }

    @Test
    void testRemoveLastOnEmpty() {
        assertThrows(IndexOutOfBoundsException.class, () -> new LongArrayList().removeLast());
    }

    @Test
    void testSliceClampsToSize() {
        var list = list(1, 2, 3, 4, 5);
        assertArrayEquals(new long[] { 2, 3 }, list.slice(1, 3));
        assertArrayEquals(new long[] { 4, 5 }, list.slice(3, 10));
        assertArrayEquals(new long[0], list.slice(7, 9));
        assertThrows(IndexOutOfBoundsException.class, () -> list.slice(3, 1));
    }

    @Test
    void testBoundsChecked() {
        var list = list(1);
        assertThrows(IndexOutOfBoundsException.class, () -> list.getLong(1));
        assertThrows(IndexOutOfBoundsException.class, () -> list.setLong(-1, 0));
    }

    @Test
    void testEquality() {
        var a = list(1, 2, 3);
        var b = list(1, 2, 3);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        a.removeLast();
        assertNotEquals(a, b);
    }

    private static LongArrayList list(long... elements) {
        var list = new LongArrayList(elements.length);
        for (var e : elements) {
            list.addLong(e);
        }
        return list;
    }
}
