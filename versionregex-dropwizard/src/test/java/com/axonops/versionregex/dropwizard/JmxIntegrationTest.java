package com.axonops.versionregex.dropwizard;

import com.axonops.versionregex.api.VersionPattern;
import com.axonops.versionregex.cache.VersionPatternCache;
import com.axonops.versionregex.cache.VersionRegexConfig;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.management.MBeanServer;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * JMX integration tests.
 *
 * Verifies that metrics are actually exposed via JMX and accessible
 * through the platform MBean server.
 */
class JmxIntegrationTest {

    private JmxReporter jmxReporter;
    private MetricRegistry registry;
    private VersionPatternCache originalCache;

    @BeforeEach
    void setup() {
        originalCache = VersionPattern.getGlobalCache();
        registry = new MetricRegistry();

        jmxReporter = JmxReporter.forRegistry(registry).build();
        jmxReporter.start();
    }

    @AfterEach
    void cleanup() {
        if (jmxReporter != null) {
            jmxReporter.stop();
        }
        VersionPatternCache testCache = VersionPattern.setGlobalCache(originalCache);
        if (testCache != originalCache) {
            testCache.shutdown();
        }
    }

    private void useConfig(VersionRegexConfig config) {
        VersionPatternCache previous = VersionPattern.setGlobalCache(new VersionPatternCache(config));
        if (previous != originalCache) {
            previous.shutdown();
        }
    }

    @Test
    void testMetricsExposedViaJmx() throws Exception {
        useConfig(VersionRegexMetricsConfig.withMetrics(registry, "com.test.jmx", false));

        VersionPattern.compile("^1.2.3").matches("1.4.0");

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();

        // Dropwizard uses the "metrics" domain with a type classification
        Set<ObjectName> mbeans = mBeanServer.queryNames(
            new ObjectName("metrics:name=com.test.jmx.*,type=*"), null
        );

        assertThat(mbeans)
            .as("JMX MBeans should be registered for version metrics")
            .hasSizeGreaterThanOrEqualTo(5);

        boolean foundCacheSizeGauge = mbeans.stream()
            .anyMatch(name -> name.toString().contains("cache.constraints.current.count") && name.toString().contains("type=gauges"));

        boolean foundCompiledCounter = mbeans.stream()
            .anyMatch(name -> name.toString().contains("constraints.compiled.total.count") && name.toString().contains("type=counters"));

        boolean foundCompilationTimer = mbeans.stream()
            .anyMatch(name -> name.toString().contains("constraints.compilation.latency") && name.toString().contains("type=timers"));

        assertThat(foundCacheSizeGauge).as("cache.constraints.current.count gauge should be in JMX").isTrue();
        assertThat(foundCompiledCounter).as("constraints.compiled.total.count counter should be in JMX").isTrue();
        assertThat(foundCompilationTimer).as("constraints.compilation.latency timer should be in JMX").isTrue();
    }

    @Test
    void testJmxGaugeReadable() throws Exception {
        useConfig(VersionRegexMetricsConfig.withMetrics(registry, "jmx.readable.test", false));

        VersionPattern.compile(">=1.0.0");
        VersionPattern.compile("<2.0.0");
        VersionPattern.compile("[1.0,2.0)");

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        ObjectName cacheSizeName = new ObjectName("metrics:name=jmx.readable.test.cache.constraints.current.count,type=gauges");

        assertThat(mBeanServer.isRegistered(cacheSizeName))
            .as("cache.constraints.current.count gauge should be registered in JMX")
            .isTrue();

        Object value = mBeanServer.getAttribute(cacheSizeName, "Value");
        assertThat(value).isInstanceOf(Number.class);
        assertThat(((Number) value).intValue())
            .as("Cache size via JMX should reflect actual cache state (3 constraints)")
            .isEqualTo(3);
    }

    @Test
    void testJmxTimerStatistics() throws Exception {
        useConfig(VersionRegexMetricsConfig.withMetrics(registry, "jmx.timer.test", false));

        for (int i = 0; i < 50; i++) {
            VersionPattern.compile(">=" + i + ".0.0");
        }

        assertThat(registry.getTimers().keySet())
            .contains("jmx.timer.test.constraints.compilation.latency");

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
        ObjectName timerName = new ObjectName("metrics:name=jmx.timer.test.constraints.compilation.latency,type=timers");

        assertThat(mBeanServer.isRegistered(timerName))
            .as("Compilation latency timer should be in JMX")
            .isTrue();

        long count = ((Number) mBeanServer.getAttribute(timerName, "Count")).longValue();
        assertThat(count).as("Timer count via JMX").isEqualTo(50);

        // min/max can be 0 for fast operations
        assertThat(mBeanServer.getAttribute(timerName, "Min")).isNotNull();
        assertThat(mBeanServer.getAttribute(timerName, "Max")).isNotNull();
    }

    @Test
    void testJmxCounterReadable() throws Exception {
        useConfig(VersionRegexMetricsConfig.withMetrics(registry, "jmx.counter.test", false));

        VersionPattern pattern = VersionPattern.compile("~1.2.0");
        VersionPattern.compile("~1.2.0");
        pattern.filter(java.util.List.of("1.2.1", "1.3.0", "1.2.9"));

        MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();

        ObjectName hits = new ObjectName("metrics:name=jmx.counter.test.constraints.cache.hits.total.count,type=counters");
        ObjectName items = new ObjectName("metrics:name=jmx.counter.test.matching.bulk.items.total.count,type=counters");

        assertThat(((Number) mBeanServer.getAttribute(hits, "Count")).longValue()).isEqualTo(1);
        assertThat(((Number) mBeanServer.getAttribute(items, "Count")).longValue()).isEqualTo(3);
    }
}
