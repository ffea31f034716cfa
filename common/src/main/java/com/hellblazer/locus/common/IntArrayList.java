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

package com.hellblazer.locus.common;

import java.util.Arrays;
import java.util.RandomAccess;
import java.util.function.IntConsumer;
import java.util.stream.IntStream;

/**
 * Growable list of primitive ints, used for the index arenas of the locator: leaves hold vertex indices and vertices
 * hold element indices. Unboxed to keep large meshes cheap.
 */
public final class IntArrayList implements RandomAccess {

    private static final int DEFAULT_CAPACITY = 4;

    private int[] array;
    private int   size;

    public IntArrayList() {
        this(DEFAULT_CAPACITY);
    }

    public IntArrayList(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("Capacity cannot be negative: " + initialCapacity);
        }
        array = new int[initialCapacity];
    }

    private IntArrayList(int[] array, int size) {
        this.array = array;
        this.size = size;
    }

    public static IntArrayList of(int... values) {
        return new IntArrayList(values.clone(), values.length);
    }

    public void addInt(int element) {
        if (size == array.length) {
            // Resize to 1.5x the size
            array = Arrays.copyOf(array, ((size * 3) / 2) + 1);
        }
        array[size++] = element;
    }

    /**
     * Append the element unless it is already present
     *
     * @return true if the element was added
     */
    public boolean addIfAbsent(int element) {
        if (contains(element)) {
            return false;
        }
        addInt(element);
        return true;
    }

    public boolean contains(int element) {
        return indexOf(element) != -1;
    }

    public int indexOf(int element) {
        for (int i = 0; i < size; i++) {
            if (array[i] == element) {
                return i;
            }
        }
        return -1;
    }

    public int getInt(int index) {
        ensureIndexInRange(index);
        return array[index];
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public void forEach(IntConsumer action) {
        for (int i = 0; i < size; i++) {
            action.accept(array[i]);
        }
    }

    public IntStream stream() {
        return Arrays.stream(array, 0, size);
    }

    public int[] toArray() {
        return Arrays.copyOf(array, size);
    }

    /**
     * Release the slack capacity; used once a list is frozen.
     */
    public void trimToSize() {
        if (array.length != size) {
            array = Arrays.copyOf(array, size);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IntArrayList other)) {
            return false;
        }
        return Arrays.equals(array, 0, size, other.array, 0, other.size);
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int i = 0; i < size; i++) {
            result = (31 * result) + array[i];
        }
        return result;
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray());
    }

    private void ensureIndexInRange(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index:" + index + ", Size:" + size);
        }
    }
}
