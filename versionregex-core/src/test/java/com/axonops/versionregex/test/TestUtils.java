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
package com.axonops.versionregex.test;

import com.axonops.versionregex.api.VersionPattern;
import com.axonops.versionregex.cache.VersionPatternCache;
import com.axonops.versionregex.cache.VersionRegexConfig;
import com.axonops.versionregex.metrics.DropwizardMetricsAdapter;
import com.axonops.versionregex.metrics.NoOpMetricsRegistry;
import com.codahale.metrics.MetricRegistry;

/**
 * Test utilities for global cache setup and teardown.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * private VersionPatternCache originalCache;
 * private MetricRegistry registry;
 *
 * @BeforeEach
 * void setup() {
 *     registry = new MetricRegistry();
 *     originalCache = TestUtils.replaceGlobalCacheWithMetrics(registry, "test.prefix");
 * }
 *
 * @AfterEach
 * void cleanup() {
 *     TestUtils.restoreGlobalCache(originalCache);
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class TestUtils {
    private TestUtils() {
        // Utility class
    }

    /**
     * Test configuration: smaller cache and shorter timeouts than production.
     *
     * @return builder with test defaults
     */
    public static VersionRegexConfig.Builder testConfigBuilder() {
        return VersionRegexConfig.builder()
            .maxCacheSize(500)
            .idleTimeoutSeconds(60)
            .evictionScanIntervalSeconds(15)
            .metricsRegistry(NoOpMetricsRegistry.INSTANCE);
    }

    /**
     * Test configuration reporting to a Dropwizard registry (no JMX).
     *
     * @param registry Dropwizard MetricRegistry
     * @param prefix metric name prefix
     * @return builder with metrics enabled
     */
    public static VersionRegexConfig.Builder testConfigWithMetrics(MetricRegistry registry, String prefix) {
        return testConfigBuilder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, prefix));
    }

    /**
     * Replaces the global cache with one built from {@code config}.
     *
     * @param config custom configuration
     * @return original cache (save for restoration)
     */
    public static VersionPatternCache replaceGlobalCache(VersionRegexConfig config) {
        return VersionPattern.setGlobalCache(new VersionPatternCache(config));
    }

    /**
     * Replaces the global cache with a metrics-enabled one.
     *
     * @param registry Dropwizard MetricRegistry
     * @param prefix metric name prefix
     * @return original cache (save for restoration)
     */
    public static VersionPatternCache replaceGlobalCacheWithMetrics(MetricRegistry registry, String prefix) {
        return replaceGlobalCache(testConfigWithMetrics(registry, prefix).build());
    }

    /**
     * Restores the original global cache, shutting down the test cache.
     *
     * @param originalCache cache to restore (returned from replaceGlobalCache)
     */
    public static void restoreGlobalCache(VersionPatternCache originalCache) {
        if (originalCache != null) {
            VersionPatternCache testCache = VersionPattern.setGlobalCache(originalCache);
            if (testCache != originalCache) {
                testCache.shutdown();
            }
        }
    }
}
