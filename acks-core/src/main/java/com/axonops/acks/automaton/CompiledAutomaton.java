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
 * Immutable output of a build: everything a search needs, nothing it can change.
 *
 * <p>All fields are final and never written after construction, so one instance may be read by
 * any number of concurrent searches once it has been safely published.
 *
 * @since 1.0.0
 */
public final class CompiledAutomaton {

    private static final int[] NO_OUTPUTS = new int[0];

    private final int[] translationTable;
    private final int alphabetSize;
    private final int[] transitions;
    private final int[][] outputs;
    private final Pattern[] patterns;
    private final int stateCount;
    private final int maxId;
    private final boolean hasReportOnce;

    CompiledAutomaton(Alphabet alphabet, int[] transitions, int[][] outputs, List<Pattern> patterns) {
        this.translationTable = alphabet.translationTable().clone();
        this.alphabetSize = alphabet.size();
        this.transitions = transitions;
        this.outputs = outputs;
        this.patterns = patterns.toArray(new Pattern[0]);
        this.stateCount = outputs.length;

        int highest = 0;
        boolean reportOnce = false;
        for (Pattern pattern : this.patterns) {
            highest = Math.max(highest, pattern.id());
            reportOnce |= pattern.isReportOnce();
        }
        this.maxId = highest;
        this.hasReportOnce = reportOnce;
    }

    static int[] noOutputs() {
        return NO_OUTPUTS;
    }

    public int stateCount() {
        return stateCount;
    }

    public int alphabetSize() {
        return alphabetSize;
    }

    public int patternCount() {
        return patterns.length;
    }

    /**
     * @return highest registered pattern id, 0 if there are no patterns
     */
    public int maxId() {
        return maxId;
    }

    public boolean hasReportOnce() {
        return hasReportOnce;
    }

    public long transitionTableEntries() {
        return transitions.length;
    }

    /**
     * Single-step transition, for inspection and tests. The search loop reads the table directly.
     */
    public int nextState(int state, byte input) {
        int index = state * alphabetSize + translationTable[input & 0xFF];
        return index >= 0 && index < transitions.length ? transitions[index] : 0;
    }

    /**
     * @return copy of the pattern indices (registration positions) recognised at {@code state}
     */
    public int[] outputsOf(int state) {
        return outputs[state].clone();
    }

    public Pattern pattern(int index) {
        return patterns[index];
    }

    int[] translationTable() {
        return translationTable;
    }

    int[] transitions() {
        return transitions;
    }

    int[][] outputs() {
        return outputs;
    }

    Pattern[] patterns() {
        return patterns;
    }
}
