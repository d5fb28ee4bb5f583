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

package com.axonops.acks.metrics;

/**
 * Metric name constants for libacks-java instrumentation.
 *
 * <h2>Architecture Overview</h2>
 *
 * <p>A {@link com.axonops.acks.api.MultiPatternMatcher} goes through two phases:
 *
 * <ol>
 *   <li><b>Build</b> - registered patterns are compiled once into a dense transition table. The
 *       table holds {@code states x alphabet} ints, so build time and memory grow with both the
 *       number of distinct pattern prefixes and the number of distinct bytes the patterns use.
 *   <li><b>Search</b> - every search or scan walks the input once, one table lookup per byte.
 *       Latency is linear in the input length and independent of the pattern count.
 * </ol>
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - latency histogram with percentiles (suffix: {@code .latency})
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * AcksConfig config = AcksConfig.builder()
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.acks"))
 *     .build();
 *
 * // After some searches:
 * Timer searches = registry.timer("myapp.acks.search.latency");
 * Counter bytes = registry.counter("myapp.acks.search.bytes.total.count");
 * }</pre>
 *
 * @since 1.0.0
 * @see AcksMetricsRegistry
 */
public final class MetricNames {

  private MetricNames() {
    // Utility class
  }

  // ========================================
  // Pattern Registration
  // ========================================

  /** Patterns registered with any matcher (Counter). */
  public static final String PATTERNS_REGISTERED = "patterns.registered.total.count";

  // ========================================
  // Automaton Build
  // ========================================

  /** Completed automaton builds (Counter). */
  public static final String AUTOMATON_BUILDS = "automaton.builds.total.count";

  /**
   * Time to compile an automaton: alphabet, trie, failure links and transition table (Timer).
   *
   * <p>Dominated by the transition table fill, which is proportional to states x alphabet.
   */
  public static final String AUTOMATON_BUILD_LATENCY = "automaton.build.latency";

  /** States compiled across all builds (Counter). */
  public static final String AUTOMATON_STATES = "automaton.states.total.count";

  // ========================================
  // Search
  // ========================================

  /** Collecting searches that ran to completion (Counter). */
  public static final String SEARCH_OPERATIONS = "search.operations.total.count";

  /** Latency of collecting searches (Timer). */
  public static final String SEARCH_LATENCY = "search.latency";

  /** Bytes consumed by searches and scans (Counter). */
  public static final String SEARCH_BYTES = "search.bytes.total.count";

  /** Match events reported by searches and scans (Counter). */
  public static final String SEARCH_MATCHES = "search.matches.total.count";

  // ========================================
  // Scan
  // ========================================

  /** Callback scans started (Counter). */
  public static final String SCAN_OPERATIONS = "scan.operations.total.count";

  /** Latency of callback scans, including time spent in the handler (Timer). */
  public static final String SCAN_LATENCY = "scan.latency";

  /**
   * Scans stopped because the match handler threw (Counter).
   *
   * <p>A rising count usually means the caller uses the handler exception to cut scans short.
   */
  public static final String SCAN_ABORTED = "scan.aborted.total.count";

  // ========================================
  // Errors
  // ========================================

  /** Builds rejected because the transition table would exceed the configured limit (Counter). */
  public static final String ERRORS_RESOURCE_EXHAUSTED = "errors.resource.exhausted.total.count";

  /** Searches attempted on a matcher that was never built (Counter). */
  public static final String ERRORS_NOT_BUILT = "errors.not_built.total.count";
}
