/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.acks.automaton;

import java.util.Arrays;

/**
 * Growable list of primitive ints. Avoids boxing in trie construction and match collection.
 *
 * <p>Not thread-safe.
 */
final class IntArrayList {

    private static final int[] EMPTY = new int[0];

    private int[] values;
    private int size;

    IntArrayList() {
        this(8);
    }

    IntArrayList(int initialCapacity) {
        values = initialCapacity == 0 ? EMPTY : new int[initialCapacity];
    }

    void add(int value) {
        if (size == values.length) {
            values = Arrays.copyOf(values, Math.max(8, size + (size >> 1)));
        }
        values[size++] = value;
    }

    void addAll(IntArrayList other) {
        int newSize = size + other.size;
        if (newSize > values.length) {
            values = Arrays.copyOf(values, Math.max(newSize, size + (size >> 1)));
        }
        System.arraycopy(other.values, 0, values, size, other.size);
        size = newSize;
    }

    int size() {
        return size;
    }

    boolean isEmpty() {
        return size == 0;
    }

    int[] toArray() {
        return size == 0 ? EMPTY : Arrays.copyOf(values, size);
    }
}
