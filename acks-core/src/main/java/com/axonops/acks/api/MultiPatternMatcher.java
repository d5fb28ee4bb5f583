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

package com.axonops.acks.api;

import com.axonops.acks.automaton.AutomatonCompiler;
import com.axonops.acks.automaton.CompiledAutomaton;
import com.axonops.acks.automaton.MatchSink;
import com.axonops.acks.automaton.SearchEngine;
import com.axonops.acks.config.AcksConfig;
import com.axonops.acks.metrics.AcksMetricsRegistry;
import com.axonops.acks.metrics.MetricNames;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds all occurrences of a fixed set of byte patterns in one pass over the input.
 *
 * <p>Patterns are registered with {@link #addPattern}, compiled once by {@link #build()} into a
 * dense Aho-Corasick automaton, and then searched with {@link #search} or {@link #scan} any number
 * of times. Search cost is one table lookup per input byte, whatever the number of patterns.
 *
 * <pre>{@code
 * MultiPatternMatcher matcher = new MultiPatternMatcher();
 * matcher.addPattern("he", 1);
 * matcher.addPattern("she", 2);
 * matcher.addPattern("HIS", 3, PatternFlag.CASE_INSENSITIVE);
 * matcher.build();
 *
 * int[] ids = matcher.search("ushers");   // [2, 1]: "she" and "he" both end at index 3
 * }</pre>
 *
 * <p><strong>Thread Safety:</strong> Registration and {@link #build()} are not thread-safe and
 * must complete before any search. Once built, all search, scan and statistics methods may be
 * called concurrently from any number of threads; each call keeps its own report-once state.
 *
 * @since 1.0.0
 */
public final class MultiPatternMatcher {
    private static final Logger logger = LoggerFactory.getLogger(MultiPatternMatcher.class);

    private final AcksConfig config;
    private final AcksMetricsRegistry metrics;
    private final List<Pattern> patterns = new ArrayList<>();

    // Published once by build(); never replaced
    private volatile Built built;

    private record Built(SearchEngine engine, AutomatonStatistics statistics) {
    }

    /**
     * Creates a matcher with {@link AcksConfig#DEFAULT}.
     */
    public MultiPatternMatcher() {
        this(AcksConfig.DEFAULT);
    }

    public MultiPatternMatcher(AcksConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.metrics = config.metricsRegistry();
    }

    // ========== Registration ==========

    /**
     * Registers a pattern.
     *
     * <p>Has no effect once the matcher is built: the automaton is never patched. Build a new
     * matcher to change the pattern set.
     *
     * @param pattern pattern to add
     */
    public void addPattern(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        if (built != null) {
            logger.warn("ACKS: Pattern added after build is ignored - id: {}", pattern.id());
            return;
        }
        patterns.add(pattern);
        metrics.incrementCounter(MetricNames.PATTERNS_REGISTERED);
        logger.trace("ACKS: Pattern registered - id: {}, length: {}, flags: {}",
            pattern.id(), pattern.length(), pattern.flags());
    }

    /**
     * Registers a UTF-8 encoded string pattern.
     */
    public void addPattern(String content, int id, PatternFlag... flags) {
        addPattern(Pattern.of(content, id, flags));
    }

    /**
     * Registers patterns in iteration order.
     */
    public void addPatterns(Collection<Pattern> toAdd) {
        Objects.requireNonNull(toAdd, "patterns cannot be null");
        for (Pattern pattern : toAdd) {
            addPattern(pattern);
        }
    }

    public int patternCount() {
        return patterns.size();
    }

    // ========== Build ==========

    /**
     * Compiles the registered patterns. Must be called exactly once, before any search.
     *
     * @throws MatcherStateException if already built
     * @throws ResourceException if the transition table would exceed
     *     {@link AcksConfig#maxTransitionTableEntries()}
     */
    public void build() {
        if (built != null) {
            throw new MatcherStateException("build() already called");
        }
        long start = System.nanoTime();
        CompiledAutomaton automaton = AutomatonCompiler.compile(patterns, config);
        long durationNanos = System.nanoTime() - start;

        SearchEngine engine = new SearchEngine(automaton, config.reportOnceBitsetMaxId());
        AutomatonStatistics statistics = new AutomatonStatistics(
            automaton.patternCount(),
            automaton.stateCount(),
            automaton.alphabetSize(),
            automaton.transitionTableEntries(),
            automaton.maxId(),
            automaton.hasReportOnce(),
            durationNanos);
        built = new Built(engine, statistics);

        metrics.incrementCounter(MetricNames.AUTOMATON_BUILDS);
        metrics.recordTimer(MetricNames.AUTOMATON_BUILD_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.AUTOMATON_STATES, automaton.stateCount());

        if (engine.usesHashedReportOnce()) {
            logger.debug("ACKS: Max pattern id {} exceeds bitset limit {} - report-once uses hash set",
                automaton.maxId(), config.reportOnceBitsetMaxId());
        }
        logger.info("ACKS: Automaton built - patterns: {}, states: {}, alphabet: {}, tableEntries: {}, timeNs: {}",
            statistics.patternCount(), statistics.stateCount(), statistics.alphabetSize(),
            statistics.transitionTableEntries(), durationNanos);
    }

    public boolean isBuilt() {
        return built != null;
    }

    // ========== Search ==========

    /**
     * Finds all matches in {@code text}.
     *
     * @param text input bytes
     * @return external ids of all matches in discovery order; an id repeats for every occurrence
     *     unless its pattern is {@link PatternFlag#REPORT_ONCE}
     * @throws MatcherStateException if not built
     */
    public int[] search(byte[] text) {
        Objects.requireNonNull(text, "text cannot be null");
        return search(text, 0, text.length);
    }

    /**
     * Finds all matches in {@code text[offset, offset + length)}.
     *
     * @throws IndexOutOfBoundsException if the region is outside {@code text}
     */
    public int[] search(byte[] text, int offset, int length) {
        Objects.requireNonNull(text, "text cannot be null");
        SearchEngine engine = engine();
        long start = System.nanoTime();
        int[] ids = engine.search(text, offset, length);
        recordSearch(start, length, ids.length);
        return ids;
    }

    /**
     * Finds all matches in the UTF-8 encoding of {@code text}.
     */
    public int[] search(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        return search(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Finds all matches in the buffer's remaining bytes without copying them. The buffer's
     * position and limit are left unchanged.
     */
    public int[] search(ByteBuffer text) {
        Objects.requireNonNull(text, "text cannot be null");
        SearchEngine engine = engine();
        long start = System.nanoTime();
        int length = text.remaining();
        int[] ids = engine.search(text);
        recordSearch(start, length, ids.length);
        return ids;
    }

    // ========== Scan ==========

    /**
     * Reports every match in {@code text} to {@code handler} as it is found.
     *
     * <p>{@code to} is the exclusive end offset of the match. {@code from} is 0 unless
     * {@link AcksConfig#reportStartOffsets()} is enabled.
     *
     * @throws E the first exception thrown by the handler; scanning stops at that match
     * @throws MatcherStateException if not built
     */
    public <E extends Exception> void scan(byte[] text, MatchHandler<E> handler) throws E {
        Objects.requireNonNull(text, "text cannot be null");
        scan(text, 0, text.length, handler);
    }

    /**
     * Scans {@code text[offset, offset + length)}; offsets passed to the handler are relative to
     * {@code offset}.
     */
    public <E extends Exception> void scan(byte[] text, int offset, int length, MatchHandler<E> handler) throws E {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(handler, "handler cannot be null");
        SearchEngine engine = engine();
        ScanSink<E> sink = new ScanSink<>(handler, config.reportStartOffsets());
        long start = System.nanoTime();
        boolean completed = false;
        try {
            engine.run(text, offset, length, sink);
            completed = true;
        } finally {
            recordScan(start, length, sink.reported, completed);
        }
    }

    /**
     * Scans the buffer's remaining bytes; offsets are relative to its position, which is left
     * unchanged.
     */
    public <E extends Exception> void scan(ByteBuffer text, MatchHandler<E> handler) throws E {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(handler, "handler cannot be null");
        SearchEngine engine = engine();
        ScanSink<E> sink = new ScanSink<>(handler, config.reportStartOffsets());
        int length = text.remaining();
        long start = System.nanoTime();
        boolean completed = false;
        try {
            engine.run(text, sink);
            completed = true;
        } finally {
            recordScan(start, length, sink.reported, completed);
        }
    }

    // ========== Containment ==========

    /**
     * Tests whether any pattern occurs in {@code text}, stopping at the first match.
     */
    public boolean containsAny(byte[] text) {
        Objects.requireNonNull(text, "text cannot be null");
        SearchEngine engine = engine();
        long start = System.nanoTime();
        boolean found = !engine.run(text, 0, text.length, (pattern, end) -> false);
        recordSearch(start, text.length, found ? 1 : 0);
        return found;
    }

    /**
     * Tests whether any pattern occurs in the UTF-8 encoding of {@code text}.
     */
    public boolean containsAny(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        return containsAny(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Keeps the inputs that contain at least one pattern (bulk operation).
     *
     * @param inputs strings to test, UTF-8 encoded for matching
     * @return new mutable list of the matching inputs, in iteration order; empty if none match
     */
    public List<String> filter(Collection<String> inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        engine();
        List<String> kept = new ArrayList<>();
        for (String input : inputs) {
            if (containsAny(input)) {
                kept.add(input);
            }
        }
        return kept;
    }

    // ========== Introspection ==========

    /**
     * @return statistics of the built automaton
     * @throws MatcherStateException if not built
     */
    public AutomatonStatistics getStatistics() {
        Built current = built;
        if (current == null) {
            throw new MatcherStateException("getStatistics() called before build()");
        }
        return current.statistics();
    }

    public AcksConfig getConfig() {
        return config;
    }

    private SearchEngine engine() {
        Built current = built;
        if (current == null) {
            metrics.incrementCounter(MetricNames.ERRORS_NOT_BUILT);
            throw new MatcherStateException("search called before build()");
        }
        return current.engine();
    }

    private void recordSearch(long startNanos, long bytes, int matches) {
        metrics.recordTimer(MetricNames.SEARCH_LATENCY, System.nanoTime() - startNanos);
        metrics.incrementCounter(MetricNames.SEARCH_OPERATIONS);
        metrics.incrementCounter(MetricNames.SEARCH_BYTES, bytes);
        metrics.incrementCounter(MetricNames.SEARCH_MATCHES, matches);
    }

    private void recordScan(long startNanos, long bytes, int matches, boolean completed) {
        metrics.recordTimer(MetricNames.SCAN_LATENCY, System.nanoTime() - startNanos);
        metrics.incrementCounter(MetricNames.SCAN_OPERATIONS);
        metrics.incrementCounter(MetricNames.SEARCH_BYTES, bytes);
        metrics.incrementCounter(MetricNames.SEARCH_MATCHES, matches);
        if (!completed) {
            metrics.incrementCounter(MetricNames.SCAN_ABORTED);
        }
    }

    /** Adapts a {@link MatchHandler} to the engine, counting delivered matches. */
    private static final class ScanSink<E extends Exception> implements MatchSink<E> {
        private final MatchHandler<E> handler;
        private final boolean reportStartOffsets;
        private int reported;

        ScanSink(MatchHandler<E> handler, boolean reportStartOffsets) {
            this.handler = handler;
            this.reportStartOffsets = reportStartOffsets;
        }

        @Override
        public boolean accept(Pattern pattern, int end) throws E {
            reported++;
            handler.onMatch(pattern.id(), reportStartOffsets ? end - pattern.length() : 0, end);
            return true;
        }
    }
}
