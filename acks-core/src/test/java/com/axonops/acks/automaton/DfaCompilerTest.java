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
import com.axonops.acks.api.ResourceException;
import com.axonops.acks.config.AcksConfig;
import com.axonops.acks.metrics.DropwizardMetricsAdapter;
import com.axonops.acks.metrics.MetricNames;
import com.codahale.metrics.MetricRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests for the dense transition table.
 */
class DfaCompilerTest {

    private static final List<Pattern> PATTERNS = List.of(
        Pattern.of("he", 1),
        Pattern.of("she", 2),
        Pattern.of("his", 3),
        Pattern.of("hers", 4, PatternFlag.REPORT_ONCE));

    /** Goto function evaluated through the failure chain, for comparison with the table. */
    private static int walk(Trie trie, int[] failure, int state, int symbol) {
        while (true) {
            int child = trie.child(state, symbol);
            if (child >= 0) {
                return child;
            }
            if (state == 0) {
                return 0;
            }
            state = failure[state];
        }
    }

    @Test
    void testCompile_TableIsTotal() {
        CompiledAutomaton automaton = AutomatonCompiler.compile(PATTERNS, AcksConfig.DEFAULT);

        assertThat(automaton.transitionTableEntries())
            .isEqualTo((long) automaton.stateCount() * automaton.alphabetSize());
        for (int next : automaton.transitions()) {
            assertThat(next).isBetween(0, automaton.stateCount() - 1);
        }
    }

    @Test
    void testCompile_MatchesFailureWalk() {
        Alphabet alphabet = AlphabetCompressor.compress(PATTERNS);
        Trie trie = TrieBuilder.build(PATTERNS, alphabet);
        FailureLinkBuilder.FailureLinks links = FailureLinkBuilder.link(trie);

        CompiledAutomaton automaton = DfaCompiler.compile(trie, links, alphabet, PATTERNS, AcksConfig.DEFAULT);

        for (int state = 0; state < automaton.stateCount(); state++) {
            for (int b = 0; b < 256; b++) {
                int expected = walk(trie, links.failure, state, alphabet.symbolOf((byte) b));
                assertThat(automaton.nextState(state, (byte) b))
                    .as("state %d byte 0x%02x", state, b)
                    .isEqualTo(expected);
            }
        }
    }

    @Test
    void testCompile_UnusedSymbolReturnsToRoot() {
        CompiledAutomaton automaton = AutomatonCompiler.compile(PATTERNS, AcksConfig.DEFAULT);

        for (int state = 0; state < automaton.stateCount(); state++) {
            assertThat(automaton.nextState(state, (byte) 'z')).isZero();
        }
    }

    @Test
    void testCompile_OutputsAndSummary() {
        CompiledAutomaton automaton = AutomatonCompiler.compile(PATTERNS, AcksConfig.DEFAULT);

        assertThat(automaton.stateCount()).isEqualTo(10);
        assertThat(automaton.alphabetSize()).isEqualTo(6);
        assertThat(automaton.patternCount()).isEqualTo(4);
        assertThat(automaton.maxId()).isEqualTo(4);
        assertThat(automaton.hasReportOnce()).isTrue();
        assertThat(automaton.outputsOf(0)).isEmpty();
        assertThat(automaton.pattern(1).id()).isEqualTo(2);

        int state = 0;
        for (byte b : "she".getBytes()) {
            state = automaton.nextState(state, b);
        }
        assertThat(automaton.outputsOf(state)).containsExactly(1, 0);
    }

    @Test
    void testCompile_OutputsCopyIsDetached() {
        CompiledAutomaton automaton = AutomatonCompiler.compile(List.of(Pattern.of("a", 1)), AcksConfig.DEFAULT);
        int state = automaton.nextState(0, (byte) 'a');

        automaton.outputsOf(state)[0] = 99;

        assertThat(automaton.outputsOf(state)).containsExactly(0);
    }

    @Test
    void testCompile_NoPatterns() {
        CompiledAutomaton automaton = AutomatonCompiler.compile(List.of(), AcksConfig.DEFAULT);

        assertThat(automaton.stateCount()).isEqualTo(1);
        assertThat(automaton.alphabetSize()).isEqualTo(1);
        assertThat(automaton.maxId()).isZero();
        assertThat(automaton.hasReportOnce()).isFalse();
        assertThat(automaton.nextState(0, (byte) 'a')).isZero();
    }

    @Test
    void testCompile_TableLimitExceeded() {
        MetricRegistry registry = new MetricRegistry();
        AcksConfig config = AcksConfig.builder()
            .maxTransitionTableEntries(5)
            .metricsRegistry(new DropwizardMetricsAdapter(registry, "test"))
            .build();

        assertThatThrownBy(() -> AutomatonCompiler.compile(PATTERNS, config))
            .isInstanceOf(ResourceException.class)
            .hasMessageContaining("10 states x 6 symbols = 60 entries");

        assertThat(registry.counter("test." + MetricNames.ERRORS_RESOURCE_EXHAUSTED).getCount()).isEqualTo(1);
    }

    @Test
    void testCompile_TableLimitExact() {
        AcksConfig config = AcksConfig.builder().maxTransitionTableEntries(60).build();

        assertThat(AutomatonCompiler.compile(PATTERNS, config).transitionTableEntries()).isEqualTo(60);
    }
}
