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

package com.axonops.versionregex.dropwizard;

import com.axonops.versionregex.cache.VersionRegexConfig;
import com.axonops.versionregex.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds a {@link VersionRegexConfig} wired to a Dropwizard {@link MetricRegistry}, optionally
 * exposing the registry over JMX.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * VersionRegexConfig config = VersionRegexMetricsConfig.withMetrics(registry, "myapp.versions");
 * VersionPattern.configureCache(config);
 * }</pre>
 *
 * <p>One {@link JmxReporter} is shared by every call; {@link #shutdown()} stops it.
 *
 * @since 1.0.0
 */
public final class VersionRegexMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(VersionRegexMetricsConfig.class);
    private static volatile JmxReporter jmxReporter;

    private VersionRegexMetricsConfig() {
        // Utility class
    }

    /**
     * Creates a config reporting to {@code registry} under the default prefix, with JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return configuration with metrics enabled
     */
    public static VersionRegexConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Creates a config reporting to {@code registry} under {@code metricPrefix}, with JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return configuration with metrics enabled
     */
    public static VersionRegexConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates a config reporting to {@code registry} under {@code metricPrefix}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to start the shared JMX reporter
     * @return configuration with metrics enabled
     */
    public static VersionRegexConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return withMetrics(VersionRegexConfig.builder(), registry, metricPrefix, enableJmx);
    }

    /**
     * Completes a partially configured builder with Dropwizard metrics.
     *
     * <p>Keeps every other setting (dialect, cache sizes, not-equal strategy) of the builder.
     *
     * @param builder builder carrying the remaining settings
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to start the shared JMX reporter
     * @return configuration with metrics enabled
     */
    public static VersionRegexConfig withMetrics(
        VersionRegexConfig.Builder builder, MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(builder, "builder cannot be null");
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return builder
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix))
            .build();
    }

    /**
     * Starts the shared JMX reporter unless one is running already.
     */
    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporter == null) {
            try {
                jmxReporter = JmxReporter.forRegistry(registry).build();
                jmxReporter.start();
                logger.info("VersionRegex: JmxReporter started - metrics available via JMX");
            } catch (RuntimeException e) {
                // Not fatal: the host may already expose the registry over JMX
                logger.warn("VersionRegex: Failed to start JmxReporter", e);
                jmxReporter = null;
            }
        }
    }

    static boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /**
     * Stops the shared JMX reporter, if any.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("VersionRegex: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
        }
    }
}
