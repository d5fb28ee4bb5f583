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
 * Computes Aho-Corasick failure links breadth-first and completes every state's output set.
 */
final class FailureLinkBuilder {

    private FailureLinkBuilder() {
        // Utility class
    }

    /**
     * Failure links plus the breadth-first order in which they were computed.
     *
     * <p>{@code order} lists every state exactly once, root first, in non-decreasing depth. A
     * state's failure target is strictly shallower, so it always appears earlier in
     * {@code order}.
     */
    static final class FailureLinks {
        final int[] failure;
        final int[] order;

        private FailureLinks(int[] failure, int[] order) {
            this.failure = failure;
            this.order = order;
        }
    }

    /**
     * Links every state and appends the outputs of its failure target to its own outputs.
     *
     * <p>The queue is processed in depth order, so when a state is linked the output set of its
     * failure target already contains everything inherited from further suffixes.
     *
     * @param trie trie to link; its output sets are extended in place
     * @return failure links and visiting order
     */
    static FailureLinks link(Trie trie) {
        int stateCount = trie.stateCount();
        int[] failure = new int[stateCount];
        int[] queue = new int[stateCount];
        int head = 0;
        int tail = 0;
        queue[tail++] = 0;

        while (head < tail) {
            int parent = queue[head++];
            for (int e = 0; e < trie.edgeCount(parent); e++) {
                int symbol = trie.edgeSymbol(parent, e);
                int state = trie.edgeTarget(parent, e);
                queue[tail++] = state;

                if (parent == 0) {
                    failure[state] = 0;
                } else {
                    failure[state] = longestSuffixTarget(trie, failure, failure[parent], symbol);
                }
                trie.mergeOutputs(state, failure[state]);
            }
        }

        if (tail != stateCount) {
            throw new IllegalStateException(
                "Trie has unreachable states: visited " + tail + " of " + stateCount);
        }
        return new FailureLinks(failure, queue);
    }

    /**
     * Follows the failure chain from {@code start} to the first state with an edge on
     * {@code symbol}.
     *
     * @return that edge's target, or the root if no state on the chain has one
     */
    private static int longestSuffixTarget(Trie trie, int[] failure, int start, int symbol) {
        int candidate = start;
        while (true) {
            int target = trie.child(candidate, symbol);
            if (target >= 0) {
                return target;
            }
            if (candidate == 0) {
                return 0;
            }
            candidate = failure[candidate];
        }
    }
}
