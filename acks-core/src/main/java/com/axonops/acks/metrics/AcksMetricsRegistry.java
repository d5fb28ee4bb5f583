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
 * Abstract metrics registry interface for libacks-java.
 *
 * <p>Allows the library to work with or without the Dropwizard Metrics dependency.
 * Implementations can use Dropwizard Metrics, a custom metrics system, or no-op.
 *
 * <p><strong>Metric Types:</strong>
 * <ul>
 *   <li><strong>Counter:</strong> monotonically increasing count</li>
 *   <li><strong>Timer:</strong> duration in nanoseconds, kept as a histogram</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> All implementations must be thread-safe. Search operations
 * on one matcher run concurrently and record into the same metrics.
 *
 * @since 1.0.0
 * @see MetricNames
 */
public interface AcksMetricsRegistry {

    /**
     * Increment a counter by 1.
     *
     * @param name metric name (e.g., "search.operations.total.count")
     */
    void incrementCounter(String name);

    /**
     * Increment a counter by a specific delta.
     *
     * @param name metric name (e.g., "search.bytes.total.count")
     * @param delta amount to increment (must be non-negative)
     */
    void incrementCounter(String name, long delta);

    /**
     * Record a timer measurement in nanoseconds.
     *
     * @param name metric name (e.g., "automaton.build.latency")
     * @param durationNanos duration in nanoseconds
     */
    void recordTimer(String name, long durationNanos);
}
