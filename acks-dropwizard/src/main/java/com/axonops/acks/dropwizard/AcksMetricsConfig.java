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

package com.axonops.acks.dropwizard;

import com.axonops.acks.config.AcksConfig;
import com.axonops.acks.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Convenience factory for AcksConfig with Dropwizard Metrics integration.
 *
 * <p>Wires a {@link DropwizardMetricsAdapter} into the configuration and, unless told otherwise,
 * exposes the registry through JMX.
 *
 * <p><strong>Usage Examples:</strong>
 * <pre>{@code
 * // Host application already owns a registry:
 * AcksConfig config = AcksMetricsConfig.withMetrics(appRegistry, "com.myapp.keywords");
 * MultiPatternMatcher matcher = new MultiPatternMatcher(config);
 *
 * // Metrics plus other settings:
 * AcksConfig config = AcksMetricsConfig.builderWithMetrics(registry, "com.myapp.keywords", false)
 *     .reportStartOffsets(true)
 *     .build();
 * }</pre>
 *
 * <p><strong>JMX Exposure:</strong> one shared JmxReporter is started for the first registry
 * passed with JMX enabled. Call {@link #shutdown()} to stop it.
 *
 * @since 1.0.0
 */
public final class AcksMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(AcksMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private AcksMetricsConfig() {
        // Utility class
    }

    /**
     * Creates AcksConfig with Dropwizard Metrics and automatic JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return configured AcksConfig with metrics enabled
     */
    public static AcksConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates AcksConfig with Dropwizard Metrics.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to set up JMX exposure
     * @return configured AcksConfig with metrics enabled
     */
    public static AcksConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return builderWithMetrics(registry, metricPrefix, enableJmx).build();
    }

    /**
     * Creates AcksConfig with Dropwizard Metrics under {@value DropwizardMetricsAdapter#DEFAULT_PREFIX}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return configured AcksConfig with metrics enabled
     */
    public static AcksConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Creates a config builder with Dropwizard Metrics already set, for callers that also
     * override other settings.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to set up JMX exposure
     * @return builder with the metrics registry set
     */
    public static AcksConfig.Builder builderWithMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return AcksConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix));
    }

    /**
     * Starts the shared JmxReporter if none is running. Later registries are not reported.
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                logger.info("ACKS: Registering JmxReporter for metrics");
                jmxReporter = JmxReporter.forRegistry(registry).build();
                jmxReporter.start();
                logger.info("ACKS: JmxReporter started - metrics available via JMX");
            } catch (RuntimeException e) {
                // Not fatal: the host may already expose the registry
                logger.warn("ACKS: Failed to start JmxReporter (may already be configured)", e);
            }
        }
    }

    static synchronized boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /**
     * Stops the shared JmxReporter, if one was started.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("ACKS: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
