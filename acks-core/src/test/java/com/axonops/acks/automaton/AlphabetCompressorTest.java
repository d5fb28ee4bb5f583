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

import static org.assertj.core.api.Assertions.*;

import com.axonops.acks.api.Pattern;
import com.axonops.acks.api.PatternFlag;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests for byte-to-symbol compression.
 */
class AlphabetCompressorTest {

    @Test
    void testCompress_SymbolsInAscendingByteOrder() {
        Alphabet alphabet = AlphabetCompressor.compress(List.of(Pattern.of("Ab", 1), Pattern.of("b!", 2)));

        assertThat(alphabet.size()).isEqualTo(4);
        assertThat(alphabet.symbolOf((byte) '!')).isEqualTo(1);
        assertThat(alphabet.symbolOf((byte) 'a')).isEqualTo(2);
        assertThat(alphabet.symbolOf((byte) 'b')).isEqualTo(3);
    }

    @Test
    void testCompress_UppercaseSharesLowercaseSymbol() {
        Alphabet alphabet = AlphabetCompressor.compress(List.of(Pattern.of("Ab", 1)));

        for (char c = 'a'; c <= 'z'; c++) {
            assertThat(alphabet.symbolOf((byte) Character.toUpperCase(c)))
                .as("symbol for %s", c)
                .isEqualTo(alphabet.symbolOf((byte) c));
        }
        assertThat(alphabet.symbolOf((byte) 'A')).isEqualTo(alphabet.symbolOf((byte) 'a')).isNotZero();
    }

    @Test
    void testCompress_FoldingIndependentOfFlags() {
        Alphabet sensitive = AlphabetCompressor.compress(List.of(Pattern.of("XY", 1)));
        Alphabet insensitive = AlphabetCompressor.compress(List.of(Pattern.of("XY", 1, PatternFlag.CASE_INSENSITIVE)));

        assertThat(sensitive.size()).isEqualTo(insensitive.size()).isEqualTo(3);
        assertThat(sensitive.symbolOf((byte) 'x')).isEqualTo(insensitive.symbolOf((byte) 'X'));
    }

    @Test
    void testCompress_UnusedBytesMapToNoSymbol() {
        Alphabet alphabet = AlphabetCompressor.compress(List.of(Pattern.of("abc", 1)));

        assertThat(alphabet.symbolOf((byte) 'z')).isEqualTo(Alphabet.NO_SYMBOL);
        assertThat(alphabet.symbolOf((byte) 0x00)).isEqualTo(Alphabet.NO_SYMBOL);
        assertThat(alphabet.symbolOf((byte) 0xFF)).isEqualTo(Alphabet.NO_SYMBOL);
    }

    @Test
    void testCompress_HighBytes() {
        Alphabet alphabet = AlphabetCompressor.compress(List.of(Pattern.of(new byte[] {(byte) 0xFF, (byte) 0x80}, 1)));

        assertThat(alphabet.size()).isEqualTo(3);
        assertThat(alphabet.symbolOf((byte) 0x80)).isEqualTo(1);
        assertThat(alphabet.symbolOf((byte) 0xFF)).isEqualTo(2);
    }

    @Test
    void testCompress_AllBytesUsed() {
        byte[] everything = new byte[256];
        for (int b = 0; b < 256; b++) {
            everything[b] = (byte) b;
        }

        Alphabet alphabet = AlphabetCompressor.compress(List.of(Pattern.of(everything, 1)));

        // 256 bytes minus 26 uppercase folded onto lowercase, plus the reserved symbol
        assertThat(alphabet.size()).isEqualTo(256 - 26 + 1);
    }

    @Test
    void testCompress_NoPatterns() {
        Alphabet alphabet = AlphabetCompressor.compress(List.of());

        assertThat(alphabet.size()).isEqualTo(1);
        assertThat(alphabet.symbolOf((byte) 'a')).isEqualTo(Alphabet.NO_SYMBOL);
    }
}
