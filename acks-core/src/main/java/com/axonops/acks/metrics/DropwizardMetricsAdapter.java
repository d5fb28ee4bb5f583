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

import com.codahale.metrics.MetricRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Reports matcher counters and timers into a Dropwizard {@link MetricRegistry}.
 *
 * <p>Every name from {@link MetricNames} is joined to a prefix, so a matcher built with prefix
 * {@code "com.myapp.keywords"} counts searches under
 * {@code com.myapp.keywords.search.operations.total.count}. Matchers sharing a registry and a
 * prefix add into the same counters.
 *
 * <p>Thread-safe; Dropwizard counters and timers are.
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements AcksMetricsRegistry {

    /** Prefix used by {@link #DropwizardMetricsAdapter(MetricRegistry)}. */
    public static final String DEFAULT_PREFIX = "com.axonops.acks";

    private final MetricRegistry registry;
    private final String prefix;

    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * @param registry registry that receives the counters and timers
     * @param prefix dotted namespace placed before every metric name
     * @throws NullPointerException if registry or prefix is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(metricName(name)).inc();
    }

    @Override
    public void incrementCounter(String name, long delta) {
        registry.counter(metricName(name)).inc(delta);
    }

    @Override
    public void recordTimer(String name, long durationNanos) {
        registry.timer(metricName(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    private String metricName(String name) {
        return MetricRegistry.name(prefix, name);
    }
}
