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
 * Goto function of the automaton: a prefix trie over compressed symbols.
 *
 * <p>States are integers, 0 is the root. Each state keeps its outgoing edges in a small array
 * sorted by symbol, so lookups are a binary search and memory stays proportional to the number of
 * edges rather than {@code states x alphabet}.
 *
 * <p>Not thread-safe. Only lives for the duration of a build.
 */
final class Trie {

    private static final int[] EMPTY = new int[0];

    private int[][] edgeSymbols;
    private int[][] edgeTargets;
    private int[] edgeCounts;
    private IntArrayList[] outputs;
    private int stateCount;

    Trie(int expectedStates) {
        int capacity = Math.max(1, expectedStates);
        edgeSymbols = new int[capacity][];
        edgeTargets = new int[capacity][];
        edgeCounts = new int[capacity];
        outputs = new IntArrayList[capacity];
        addState(); // root
    }

    int stateCount() {
        return stateCount;
    }

    /**
     * @return target of the edge labelled {@code symbol}, or -1 if there is none
     */
    int child(int state, int symbol) {
        int index = Arrays.binarySearch(edgeSymbols[state], 0, edgeCounts[state], symbol);
        return index >= 0 ? edgeTargets[state][index] : -1;
    }

    /**
     * Creates a new state reached from {@code state} by {@code symbol}. The edge must not exist.
     *
     * @return the new state
     */
    int addChild(int state, int symbol) {
        int count = edgeCounts[state];
        int insertAt = -(Arrays.binarySearch(edgeSymbols[state], 0, count, symbol) + 1);
        if (insertAt < 0) {
            throw new IllegalStateException("Edge already exists: state " + state + ", symbol " + symbol);
        }
        int target = addState();
        if (count == edgeSymbols[state].length) {
            int capacity = Math.max(2, count * 2);
            edgeSymbols[state] = Arrays.copyOf(edgeSymbols[state], capacity);
            edgeTargets[state] = Arrays.copyOf(edgeTargets[state], capacity);
        }
        int[] symbols = edgeSymbols[state];
        int[] targets = edgeTargets[state];
        System.arraycopy(symbols, insertAt, symbols, insertAt + 1, count - insertAt);
        System.arraycopy(targets, insertAt, targets, insertAt + 1, count - insertAt);
        symbols[insertAt] = symbol;
        targets[insertAt] = target;
        edgeCounts[state] = count + 1;
        return target;
    }

    int edgeCount(int state) {
        return edgeCounts[state];
    }

    int edgeSymbol(int state, int index) {
        return edgeSymbols[state][index];
    }

    int edgeTarget(int state, int index) {
        return edgeTargets[state][index];
    }

    void addOutput(int state, int patternIndex) {
        if (outputs[state] == null) {
            outputs[state] = new IntArrayList(2);
        }
        outputs[state].add(patternIndex);
    }

    /**
     * Appends the output set of {@code source} to that of {@code target}.
     */
    void mergeOutputs(int target, int source) {
        IntArrayList from = outputs[source];
        if (from == null || from.isEmpty()) {
            return;
        }
        if (outputs[target] == null) {
            outputs[target] = new IntArrayList(from.size());
        }
        outputs[target].addAll(from);
    }

    /**
     * @return pattern indices ending at {@code state}, empty if none
     */
    int[] outputs(int state) {
        IntArrayList list = outputs[state];
        return list == null ? EMPTY : list.toArray();
    }

    private int addState() {
        if (stateCount == edgeCounts.length) {
            int capacity = stateCount + (stateCount >> 1) + 1;
            edgeSymbols = Arrays.copyOf(edgeSymbols, capacity);
            edgeTargets = Arrays.copyOf(edgeTargets, capacity);
            edgeCounts = Arrays.copyOf(edgeCounts, capacity);
            outputs = Arrays.copyOf(outputs, capacity);
        }
        int state = stateCount++;
        edgeSymbols[state] = EMPTY;
        edgeTargets[state] = EMPTY;
        return state;
    }
}
