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

/**
 * Compressed input alphabet: maps each byte value to a dense symbol.
 *
 * <p>Symbol 0 is reserved for bytes that occur in no pattern. Uppercase ASCII letters share the
 * symbol of their lowercase counterpart. Immutable.
 *
 * @since 1.0.0
 */
public final class Alphabet {

    /** Symbol of every byte value that occurs in no pattern. */
    public static final int NO_SYMBOL = 0;

    private final int[] translationTable;
    private final int size;

    Alphabet(int[] translationTable, int size) {
        if (translationTable.length != 256) {
            throw new IllegalArgumentException("translation table must have 256 entries");
        }
        this.translationTable = translationTable;
        this.size = size;
    }

    /**
     * @return symbol of {@code b}, {@link #NO_SYMBOL} if no pattern uses it
     */
    public int symbolOf(byte b) {
        return translationTable[b & 0xFF];
    }

    /**
     * @return number of symbols, including {@link #NO_SYMBOL}
     */
    public int size() {
        return size;
    }

    int[] translationTable() {
        return translationTable;
    }

    static byte toLower(byte b) {
        return b >= 'A' && b <= 'Z' ? (byte) (b + 32) : b;
    }
}
