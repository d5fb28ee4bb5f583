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

import java.util.HashSet;
import java.util.Set;

/**
 * Per-call record of report-once pattern ids already seen by the automaton.
 *
 * <p>Created fresh for every search or scan and never shared between calls, so implementations
 * are not thread-safe.
 */
abstract class ReportOnceTracker {

    /**
     * Marks {@code id} as reported.
     *
     * @return true if this is the first time {@code id} is marked
     */
    abstract boolean markFirst(int id);

    /**
     * Picks the bitset when every id fits under {@code bitsetMaxId}, the hash set otherwise.
     */
    static ReportOnceTracker create(int maxId, int bitsetMaxId) {
        return maxId <= bitsetMaxId ? new Bitset(maxId) : new Hashed();
    }

    /** One bit per id in {@code [0, maxId]}. */
    static final class Bitset extends ReportOnceTracker {
        private final long[] words;

        Bitset(int maxId) {
            words = new long[(maxId >>> 6) + 1];
        }

        @Override
        boolean markFirst(int id) {
            int word = id >>> 6;
            long mask = 1L << id; // shift uses the low 6 bits
            if ((words[word] & mask) != 0) {
                return false;
            }
            words[word] |= mask;
            return true;
        }
    }

    /** Unbounded ids. */
    static final class Hashed extends ReportOnceTracker {
        private final Set<Integer> seen = new HashSet<>();

        @Override
        boolean markFirst(int id) {
            return seen.add(id);
        }
    }
}
