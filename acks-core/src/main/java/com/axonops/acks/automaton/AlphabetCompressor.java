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

import com.axonops.acks.api.Pattern;
import java.util.List;

/**
 * Builds the compressed {@link Alphabet} of a pattern set.
 *
 * <p>Only byte values that occur in some pattern get a symbol, so the transition table's second
 * dimension is the number of distinct (case-folded) pattern bytes plus one rather than 256.
 */
public final class AlphabetCompressor {

    private AlphabetCompressor() {
        // Utility class
    }

    /**
     * Assigns symbols 1..n to the distinct folded bytes of {@code patterns}, in ascending byte
     * order; everything else maps to {@link Alphabet#NO_SYMBOL}.
     *
     * @param patterns registered patterns (may be empty)
     * @return the alphabet
     */
    public static Alphabet compress(List<Pattern> patterns) {
        boolean[] used = new boolean[256];
        for (Pattern pattern : patterns) {
            for (int i = 0; i < pattern.length(); i++) {
                used[Alphabet.toLower(pattern.byteAt(i)) & 0xFF] = true;
            }
        }

        int[] table = new int[256];
        int size = 1; // 0 is reserved for unused bytes
        for (int b = 0; b < 256; b++) {
            // Uppercase never marked used; filled from lowercase below
            if (used[b]) {
                table[b] = size++;
            }
        }
        for (int b = 'A'; b <= 'Z'; b++) {
            table[b] = table[b + 32];
        }
        return new Alphabet(table, size);
    }
}
