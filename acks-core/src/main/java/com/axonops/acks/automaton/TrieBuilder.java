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
 * Builds the goto function: one trie path per pattern, over compressed symbols.
 */
final class TrieBuilder {

    private TrieBuilder() {
        // Utility class
    }

    /**
     * Inserts every pattern, in registration order, and records each pattern's index as an output
     * of the state its path ends in. Patterns with identical folded text end in the same state.
     *
     * @param patterns registered patterns
     * @param alphabet alphabet built from the same patterns
     * @return the trie
     */
    static Trie build(List<Pattern> patterns, Alphabet alphabet) {
        int totalBytes = 0;
        for (Pattern pattern : patterns) {
            totalBytes += pattern.length();
        }
        // Upper bound on states is 1 + totalBytes; shared prefixes make it smaller
        Trie trie = new Trie(Math.min(totalBytes + 1, 1 << 16));

        for (int k = 0; k < patterns.size(); k++) {
            Pattern pattern = patterns.get(k);
            int state = 0;
            for (int i = 0; i < pattern.length(); i++) {
                int symbol = alphabet.symbolOf(pattern.byteAt(i));
                int next = trie.child(state, symbol);
                state = next >= 0 ? next : trie.addChild(state, symbol);
            }
            trie.addOutput(state, k);
        }
        return trie;
    }
}
