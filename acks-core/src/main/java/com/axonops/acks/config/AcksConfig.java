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

package com.axonops.acks.config;

import com.axonops.acks.metrics.AcksMetricsRegistry;
import com.axonops.acks.metrics.NoOpMetricsRegistry;
import java.util.Objects;

/**
 * Configuration for libacks-java matchers: search policies, build limits and metrics.
 *
 * <p>Immutable configuration using Java 17 records. One config may be shared by any number of
 * {@link com.axonops.acks.api.MultiPatternMatcher} instances.
 *
 * <h2>Report-Once Deduplication</h2>
 *
 * <p>Every search or scan that can hit a {@code REPORT_ONCE} pattern allocates its own record of
 * the pattern ids already reported. Two representations exist:
 *
 * <ul>
 *   <li><b>Bitset</b> - one bit per id up to the highest registered id. O(1) test-and-set and a
 *       fixed allocation of {@code maxId / 8} bytes per call.
 *   <li><b>Hash set</b> - unbounded ids, allocation proportional to the ids actually reported,
 *       higher cost per operation.
 * </ul>
 *
 * <p>The bitset is used while the highest registered id is at most {@code reportOnceBitsetMaxId}.
 * Keep ids small and dense to stay on the bitset path.
 *
 * <h2>Transition Table Limit</h2>
 *
 * <p>The compiled table holds {@code states x alphabetSize} ints. {@code
 * maxTransitionTableEntries} rejects builds above a chosen size with a {@link
 * com.axonops.acks.api.ResourceException} instead of an {@link OutOfMemoryError}. The default is
 * the largest array the JVM can allocate.
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Defaults: 16M bitset threshold, start offsets not computed, metrics disabled
 * MultiPatternMatcher matcher = new MultiPatternMatcher(AcksConfig.DEFAULT);
 *
 * // Signature scanner with sparse 32-bit ids and bounded memory
 * AcksConfig config = AcksConfig.builder()
 *     .reportOnceBitsetMaxId(1_000_000)
 *     .reportStartOffsets(true)
 *     .maxTransitionTableEntries(64_000_000)   // ~256MB table
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.acks"))
 *     .build();
 * }</pre>
 *
 * @param reportOnceBitsetMaxId highest pattern id for which report-once dedup uses a bitset (must
 *     be &gt;= 0)
 * @param reportStartOffsets compute the true start offset of scan matches instead of reporting 0
 * @param maxTransitionTableEntries maximum {@code states x alphabetSize} accepted by a build (1 to
 *     {@link #MAX_TABLE_ENTRIES})
 * @param metricsRegistry metrics implementation (use {@link NoOpMetricsRegistry} for zero overhead)
 * @since 1.0.0
 * @see com.axonops.acks.metrics.MetricNames
 */
public record AcksConfig(
    int reportOnceBitsetMaxId,
    boolean reportStartOffsets,
    int maxTransitionTableEntries,
    AcksMetricsRegistry metricsRegistry) {

  /** Largest int array most JVMs will allocate. */
  public static final int MAX_TABLE_ENTRIES = Integer.MAX_VALUE - 8;

  /** Default bitset threshold: 16M ids, a 2MB bitset per call in the worst case. */
  public static final int DEFAULT_REPORT_ONCE_BITSET_MAX_ID = 16 * 1024 * 1024;

  /**
   * Default configuration.
   *
   * <p>Bitset dedup up to id 16,777,216; scan start offsets reported as 0; transition table
   * bounded only by the JVM array limit; metrics disabled.
   */
  public static final AcksConfig DEFAULT =
      new AcksConfig(
          DEFAULT_REPORT_ONCE_BITSET_MAX_ID,
          false, // from = 0 in scan callbacks
          MAX_TABLE_ENTRIES,
          NoOpMetricsRegistry.INSTANCE // Metrics disabled (zero overhead)
          );

  /** Compact constructor with validation. */
  public AcksConfig {
    if (reportOnceBitsetMaxId < 0) {
      throw new IllegalArgumentException("reportOnceBitsetMaxId must be non-negative");
    }
    if (maxTransitionTableEntries <= 0) {
      throw new IllegalArgumentException("maxTransitionTableEntries must be positive");
    }
    if (maxTransitionTableEntries > MAX_TABLE_ENTRIES) {
      throw new IllegalArgumentException(
          "maxTransitionTableEntries ("
              + maxTransitionTableEntries
              + ") cannot exceed the JVM array limit ("
              + MAX_TABLE_ENTRIES
              + ")");
    }
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
  }

  /**
   * Creates a builder for custom configuration.
   *
   * <p>Builder starts with defaults and allows selective overrides.
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for custom configuration.
   *
   * <p>All fields start with the values of {@link #DEFAULT}.
   */
  public static class Builder {
    private int reportOnceBitsetMaxId = DEFAULT_REPORT_ONCE_BITSET_MAX_ID;
    private boolean reportStartOffsets = false;
    private int maxTransitionTableEntries = MAX_TABLE_ENTRIES;
    private AcksMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Set the highest pattern id for which report-once dedup uses a bitset.
     *
     * <p><b>Default: 16,777,216</b>
     *
     * <p>Above it each search falls back to a hash set of ids. Set to 0 to always use the hash set
     * unless the only id in use is 0.
     *
     * @param maxId highest id for the bitset path (must be &gt;= 0)
     * @return this builder
     */
    public Builder reportOnceBitsetMaxId(int maxId) {
      this.reportOnceBitsetMaxId = maxId;
      return this;
    }

    /**
     * Report true start offsets in scan callbacks.
     *
     * <p><b>Default: false</b> - {@code from} is always 0 and only the end offset is meaningful.
     * When enabled, {@code from = to - patternLength}.
     *
     * @param report true to compute start offsets
     * @return this builder
     */
    public Builder reportStartOffsets(boolean report) {
      this.reportStartOffsets = report;
      return this;
    }

    /**
     * Set the maximum transition table size a build may allocate.
     *
     * <p><b>Default: {@link #MAX_TABLE_ENTRIES}</b>
     *
     * <p>Each entry is one int (4 bytes).
     *
     * @param entries maximum {@code states x alphabetSize}
     * @return this builder
     */
    public Builder maxTransitionTableEntries(int entries) {
      this.maxTransitionTableEntries = entries;
      return this;
    }

    /**
     * Set metrics registry for instrumentation.
     *
     * <p><b>Default: {@link NoOpMetricsRegistry}</b>
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(AcksMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated immutable configuration
     * @throws IllegalArgumentException if configuration is invalid
     */
    public AcksConfig build() {
      return new AcksConfig(
          reportOnceBitsetMaxId, reportStartOffsets, maxTransitionTableEntries, metricsRegistry);
    }
  }
}
