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
import com.axonops.acks.config.AcksConfig;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the build pipeline: alphabet, trie, failure links, transition table.
 *
 * @since 1.0.0
 */
public final class AutomatonCompiler {
    private static final Logger logger = LoggerFactory.getLogger(AutomatonCompiler.class);

    private AutomatonCompiler() {
        // Utility class
    }

    /**
     * Compiles {@code patterns} into an immutable automaton.
     *
     * <p>The list is read, not retained; the returned automaton keeps its own copy of the
     * references. An empty list yields a single-state automaton that never matches.
     *
     * @param patterns patterns in registration order; index {@code k} is reported internally as
     *     pattern index {@code k}
     * @param config build limits and metrics
     * @return compiled automaton
     * @throws com.axonops.acks.api.ResourceException if the transition table exceeds the limit
     */
    public static CompiledAutomaton compile(List<Pattern> patterns, AcksConfig config) {
        Alphabet alphabet = AlphabetCompressor.compress(patterns);
        logger.debug("ACKS: Alphabet compressed - patterns: {}, symbols: {}", patterns.size(), alphabet.size());

        Trie trie = TrieBuilder.build(patterns, alphabet);
        logger.debug("ACKS: Trie built - states: {}", trie.stateCount());

        FailureLinkBuilder.FailureLinks links = FailureLinkBuilder.link(trie);
        logger.trace("ACKS: Failure links computed - states: {}", links.order.length);

        CompiledAutomaton automaton = DfaCompiler.compile(trie, links, alphabet, patterns, config);
        logger.debug("ACKS: Transition table compiled - entries: {}, maxId: {}, reportOnce: {}",
            automaton.transitionTableEntries(), automaton.maxId(), automaton.hasReportOnce());
        return automaton;
    }
}
