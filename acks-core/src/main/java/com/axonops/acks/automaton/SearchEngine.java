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
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Streams input through a {@link CompiledAutomaton}.
 *
 * <p>One active state, one forward pass, one table lookup per byte. After every transition the
 * state's output set is checked; a report-once candidate is test-and-marked first, then each
 * candidate is re-verified byte-for-byte unless it is case-insensitive, then handed to the sink.
 * A case-sensitive report-once pattern whose first hit in a call is a case-folded false positive
 * is therefore not reported in that call.
 *
 * <p>Thread-safe: the engine only reads the automaton. Each call allocates its own
 * {@link ReportOnceTracker}.
 *
 * @since 1.0.0
 */
public final class SearchEngine {

    private final CompiledAutomaton automaton;
    private final int reportOnceBitsetMaxId;

    /**
     * @param automaton compiled automaton to search with
     * @param reportOnceBitsetMaxId highest max id for which report-once dedup uses a bitset
     */
    public SearchEngine(CompiledAutomaton automaton, int reportOnceBitsetMaxId) {
        this.automaton = Objects.requireNonNull(automaton, "automaton cannot be null");
        this.reportOnceBitsetMaxId = reportOnceBitsetMaxId;
    }

    public CompiledAutomaton automaton() {
        return automaton;
    }

    /**
     * @return true if report-once dedup on this automaton uses the hash set
     */
    public boolean usesHashedReportOnce() {
        return automaton.hasReportOnce() && automaton.maxId() > reportOnceBitsetMaxId;
    }

    /**
     * Collects the ids of all matches in {@code text[offset, offset + length)}, in discovery
     * order.
     */
    public int[] search(byte[] text, int offset, int length) {
        IntArrayList ids = new IntArrayList();
        run(text, offset, length, (pattern, end) -> {
            ids.add(pattern.id());
            return true;
        });
        return ids.toArray();
    }

    /**
     * Collects the ids of all matches in the buffer's remaining bytes, in discovery order.
     */
    public int[] search(ByteBuffer buffer) {
        IntArrayList ids = new IntArrayList();
        run(buffer, (pattern, end) -> {
            ids.add(pattern.id());
            return true;
        });
        return ids.toArray();
    }

    /**
     * Runs one pass over {@code text[offset, offset + length)}.
     *
     * @return true if the pass consumed all input, false if the sink stopped it
     * @throws E whatever the sink throws; no further input is read
     */
    public <E extends Exception> boolean run(byte[] text, int offset, int length, MatchSink<E> sink) throws E {
        Objects.checkFromIndexSize(offset, length, text.length);
        final int[] translation = automaton.translationTable();
        final int[] transitions = automaton.transitions();
        final int[][] outputs = automaton.outputs();
        final Pattern[] patterns = automaton.patterns();
        final int alphabetSize = automaton.alphabetSize();
        final int end = offset + length;
        ReportOnceTracker reported = newTracker();

        int state = 0;
        for (int i = offset; i < end; i++) {
            int index = state * alphabetSize + translation[text[i] & 0xFF];
            state = index >= 0 && index < transitions.length ? transitions[index] : 0;

            int[] candidates = outputs[state];
            for (int k = 0; k < candidates.length; k++) {
                Pattern pattern = patterns[candidates[k]];
                // A report-once id is spent by its first DFA hit, verified or not
                if (pattern.isReportOnce() && !reported.markFirst(pattern.id())) {
                    continue;
                }
                if (!pattern.isCaseInsensitive()
                        && !pattern.matchesAt(text, i - pattern.length() + 1, offset, end)) {
                    continue;
                }
                if (!sink.accept(pattern, i - offset + 1)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Runs one pass over the buffer's remaining bytes using absolute reads; the buffer's position
     * and limit are not changed. Heap buffers take the array path.
     *
     * @return true if the pass consumed all input, false if the sink stopped it
     * @throws E whatever the sink throws; no further input is read
     */
    public <E extends Exception> boolean run(ByteBuffer buffer, MatchSink<E> sink) throws E {
        if (buffer.hasArray()) {
            return run(buffer.array(), buffer.arrayOffset() + buffer.position(), buffer.remaining(), sink);
        }
        final int[] translation = automaton.translationTable();
        final int[] transitions = automaton.transitions();
        final int[][] outputs = automaton.outputs();
        final Pattern[] patterns = automaton.patterns();
        final int alphabetSize = automaton.alphabetSize();
        final int start = buffer.position();
        final int end = buffer.limit();
        ReportOnceTracker reported = newTracker();

        int state = 0;
        for (int i = start; i < end; i++) {
            int index = state * alphabetSize + translation[buffer.get(i) & 0xFF];
            state = index >= 0 && index < transitions.length ? transitions[index] : 0;

            int[] candidates = outputs[state];
            for (int k = 0; k < candidates.length; k++) {
                Pattern pattern = patterns[candidates[k]];
                // A report-once id is spent by its first DFA hit, verified or not
                if (pattern.isReportOnce() && !reported.markFirst(pattern.id())) {
                    continue;
                }
                if (!pattern.isCaseInsensitive()
                        && !matchesAt(pattern, buffer, i - pattern.length() + 1, start, end)) {
                    continue;
                }
                if (!sink.accept(pattern, i - start + 1)) {
                    return false;
                }
            }
        }
        return true;
    }

    private ReportOnceTracker newTracker() {
        return automaton.hasReportOnce()
            ? ReportOnceTracker.create(automaton.maxId(), reportOnceBitsetMaxId)
            : null;
    }

    private static boolean matchesAt(Pattern pattern, ByteBuffer buffer, int offset, int from, int to) {
        int length = pattern.length();
        if (offset < from || offset + length > to) {
            return false;
        }
        for (int j = 0; j < length; j++) {
            if (pattern.byteAt(j) != buffer.get(offset + j)) {
                return false;
            }
        }
        return true;
    }
}
