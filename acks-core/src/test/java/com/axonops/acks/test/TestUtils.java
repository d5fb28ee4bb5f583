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

package com.axonops.acks.test;

import com.axonops.acks.api.MultiPatternMatcher;
import com.axonops.acks.api.Pattern;
import com.axonops.acks.config.AcksConfig;
import com.axonops.acks.metrics.DropwizardMetricsAdapter;
import com.axonops.acks.metrics.NoOpMetricsRegistry;
import com.codahale.metrics.MetricRegistry;
import java.util.Arrays;

/**
 * Test utilities for matcher setup.
 *
 * <h2>Usage Patterns</h2>
 *
 * <h3>Built Matcher From Patterns</h3>
 * <pre>{@code
 * MultiPatternMatcher matcher = TestUtils.built(
 *     Pattern.of("he", 1),
 *     Pattern.of("she", 2));
 * assertThat(TestUtils.sorted(matcher.search("ushers"))).containsExactly(1, 2);
 * }</pre>
 *
 * <h3>Test With Metrics</h3>
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * AcksConfig config = TestUtils.testConfigWithMetrics(registry, "test.acks").build();
 * MultiPatternMatcher matcher = new MultiPatternMatcher(config);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class TestUtils {
    private TestUtils() {
        // Utility class
    }

    /**
     * Creates test configuration: defaults with metrics disabled.
     *
     * @return builder with test defaults
     */
    public static AcksConfig.Builder testConfigBuilder() {
        return AcksConfig.builder()
            .metricsRegistry(NoOpMetricsRegistry.INSTANCE);
    }

    /**
     * Creates test configuration reporting into a Dropwizard registry.
     *
     * @param registry Dropwizard MetricRegistry
     * @param prefix metric name prefix
     * @return builder with metrics enabled
     */
    public static AcksConfig.Builder testConfigWithMetrics(MetricRegistry registry, String prefix) {
        return testConfigBuilder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, prefix));
    }

    /**
     * Registers the patterns in order and builds.
     */
    public static MultiPatternMatcher built(Pattern... patterns) {
        return built(AcksConfig.DEFAULT, patterns);
    }

    /**
     * Registers the patterns in order and builds with {@code config}.
     */
    public static MultiPatternMatcher built(AcksConfig config, Pattern... patterns) {
        MultiPatternMatcher matcher = new MultiPatternMatcher(config);
        for (Pattern pattern : patterns) {
            matcher.addPattern(pattern);
        }
        matcher.build();
        return matcher;
    }

    /**
     * Sorted copy, for comparing match sets where discovery order at one position is unspecified.
     */
    public static int[] sorted(int[] ids) {
        int[] copy = ids.clone();
        Arrays.sort(copy);
        return copy;
    }
}
