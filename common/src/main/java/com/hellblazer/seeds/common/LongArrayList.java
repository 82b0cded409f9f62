// Protocol Buffers - Google's data interchange format
// Copyright 2008 Google Inc.  All rights reserved.
// https://developers.google.com/protocol-buffers/
//
// Redistribution and use in source and binary forms, with or without
// modification, are permitted provided that the following conditions are
// met:
//
//     * Redistributions of source code must retain the above copyright
// notice, this list of conditions and the following disclaimer.
//     * Redistributions in binary form must reproduce the above
// copyright notice, this list of conditions and the following disclaimer
// in the documentation and/or other materials provided with the
// distribution.
//     * Neither the name of Google Inc. nor the names of its
// contributors may be used to endorse or promote products derived from
// this software without specific prior written permission.
//
// THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
// "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
// LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
// A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
// OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
// SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
// LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
// DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
// THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
// (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
// OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.

package com.hellblazer.seeds.common;

import java.util.Arrays;
import java.util.RandomAccess;

/**
 * Chopped down implementation specialized for dense seed id storage
 */
public final class LongArrayList implements RandomAccess {

    private static final int DEFAULT_CAPACITY = 10;

    /** The backing store for the list. */
    private long[] array;
    private int    size;

    public LongArrayList() {
        this(DEFAULT_CAPACITY);
    }

    public LongArrayList(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("Initial capacity must be non-negative: " + initialCapacity);
        }
        array = new long[initialCapacity];
        size = 0;
    }

    public void addLong(long element) {
        if (size == array.length) {
            // Resize to 1.5x the size
            int length = ((size * 3) / 2) + 1;
            array = Arrays.copyOf(array, length);
        }

        array[size++] = element;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof final LongArrayList other)) {
            return false;
        }
        if (size != other.size) {
            return false;
        }

        final long[] arr = other.array;
        for (int i = 0; i < size; i++) {
            if (array[i] != arr[i]) {
                return false;
            }
        }

        return true;
    }

    public long getLong(int index) {
        ensureIndexInRange(index);
        return array[index];
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int i = 0; i < size; i++) {
            result = (31 * result) + Long.hashCode(array[i]);
        }
        return result;
    }

    /**
     * Remove and return the last element.
     */
    public long removeLast() {
        if (size == 0) {
            throw new IndexOutOfBoundsException("List is empty");
        }
        return array[--size];
    }

    public long setLong(int index, long element) {
        ensureIndexInRange(index);
        long previousValue = array[index];
        array[index] = element;
        return previousValue;
    }

    public int size() {
        return size;
    }

    /**
     * Copy of the elements in [fromIndex, toIndex), clamped to the current size.
     */
    public long[] slice(int fromIndex, int toIndex) {
        if (fromIndex < 0 || toIndex < fromIndex) {
            throw new IndexOutOfBoundsException("fromIndex:" + fromIndex + ", toIndex:" + toIndex);
        }
        int from = Math.min(fromIndex, size);
        int to = Math.min(toIndex, size);
        return Arrays.copyOfRange(array, from, to);
    }

    public long[] toArray() {
        return Arrays.copyOf(array, size);
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray());
    }

    private void ensureIndexInRange(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException(makeOutOfBoundsExceptionMessage(index));
        }
    }

    private String makeOutOfBoundsExceptionMessage(int index) {
        return "Index:" + index + ", Size:" + size;
    }
}
