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
import com.axonops.acks.api.ResourceException;
import com.axonops.acks.config.AcksConfig;
import com.axonops.acks.metrics.MetricNames;
import java.util.List;

/**
 * Flattens the trie and its failure links into one total transition table.
 *
 * <p>Every {@code (state, symbol)} pair gets a next state, so the search loop does exactly one
 * table lookup per byte and never walks failure links. The cost is a table of
 * {@code states x alphabetSize} ints, paid once per build.
 */
final class DfaCompiler {

    private DfaCompiler() {
        // Utility class
    }

    /**
     * Computes the transition of every state on every symbol.
     *
     * <p>For a state {@code s} and symbol {@code c}: the trie edge if {@code s} has one, otherwise
     * the transition of the first state on {@code s}'s failure chain that has an edge on
     * {@code c}, otherwise the root. Rows are filled in breadth-first order; the row of
     * {@code failure(s)} is then already complete and equals the result of that chain walk, so
     * each row starts as a copy of its failure row and is overwritten with the state's own edges.
     *
     * @throws ResourceException if the table would exceed
     *     {@link AcksConfig#maxTransitionTableEntries()}
     */
    static CompiledAutomaton compile(
            Trie trie,
            FailureLinkBuilder.FailureLinks links,
            Alphabet alphabet,
            List<Pattern> patterns,
            AcksConfig config) {
        int stateCount = trie.stateCount();
        int alphabetSize = alphabet.size();
        long entries = (long) stateCount * alphabetSize;
        if (entries > config.maxTransitionTableEntries()) {
            config.metricsRegistry().incrementCounter(MetricNames.ERRORS_RESOURCE_EXHAUSTED);
            throw new ResourceException(
                "Transition table too large: " + stateCount + " states x " + alphabetSize
                    + " symbols = " + entries + " entries exceeds maxTransitionTableEntries "
                    + config.maxTransitionTableEntries());
        }

        int[] transitions = new int[(int) entries];
        int[][] outputs = new int[stateCount][];

        for (int state : links.order) {
            int row = state * alphabetSize;
            if (state != 0) {
                System.arraycopy(transitions, links.failure[state] * alphabetSize, transitions, row, alphabetSize);
            }
            // Root row defaults to 0 (back to root)
            for (int e = 0; e < trie.edgeCount(state); e++) {
                transitions[row + trie.edgeSymbol(state, e)] = trie.edgeTarget(state, e);
            }

            int[] out = trie.outputs(state);
            outputs[state] = out.length == 0 ? CompiledAutomaton.noOutputs() : out;
        }

        return new CompiledAutomaton(alphabet, transitions, outputs, patterns);
    }
}
