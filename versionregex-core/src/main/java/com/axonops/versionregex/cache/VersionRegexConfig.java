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

package com.axonops.versionregex.cache;

import com.axonops.versionregex.dialect.RegexDialect;
import com.axonops.versionregex.metrics.NoOpMetricsRegistry;
import com.axonops.versionregex.metrics.VersionRegexMetricsRegistry;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for constraint compilation, caching and metrics.
 *
 * <p>Immutable. The cache keeps compiled constraints with a <b>dual eviction strategy</b>:
 *
 * <ol>
 *   <li><b>LRU Eviction</b> - When the cache exceeds {@code maxCacheSize}, least-recently-used
 *       entries are evicted asynchronously
 *   <li><b>Idle Eviction</b> - A background thread evicts entries unused for {@code
 *       idleTimeoutSeconds}
 * </ol>
 *
 * <p>{@code evictionProtectionMs} keeps a freshly compiled entry from being LRU-evicted before the
 * caller has used it.
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // Defaults: 10K entries, 5 min idle timeout, java.util.regex, no metrics
 * VersionPattern.configureCache(VersionRegexConfig.DEFAULT);
 *
 * // RE2 engine, not-equal evaluated as match-and-negate
 * VersionRegexConfig config = VersionRegexConfig.builder()
 *     .dialect(RegexDialect.RE2)
 *     .notEqualStrategy(NotEqualStrategy.NEGATED_MATCH)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.versions"))
 *     .build();
 * }</pre>
 *
 * @param cacheEnabled Enable caching of compiled constraints
 * @param maxCacheSize Maximum entries before LRU eviction (must be > 0 if cache enabled)
 * @param idleTimeoutSeconds Evict entries unused for this duration (must be > 0 if cache enabled)
 * @param evictionScanIntervalSeconds How often the idle eviction task runs (must be > 0 if cache
 *     enabled)
 * @param evictionProtectionMs Protect newly used entries from LRU eviction for this duration
 * @param dialect Regex engine used when no dialect is given explicitly
 * @param notEqualStrategy Handling of {@code !=} on dialects without lookahead
 * @param metricsRegistry Metrics implementation ({@link NoOpMetricsRegistry} for none)
 * @since 1.0.0
 * @see VersionPatternCache
 */
public record VersionRegexConfig(
    boolean cacheEnabled,
    int maxCacheSize,
    long idleTimeoutSeconds,
    long evictionScanIntervalSeconds,
    long evictionProtectionMs,
    RegexDialect dialect,
    NotEqualStrategy notEqualStrategy,
    VersionRegexMetricsRegistry metricsRegistry) {

  private static final Logger logger = LoggerFactory.getLogger(VersionRegexConfig.class);

  /** Default configuration for production use. */
  public static final VersionRegexConfig DEFAULT =
      new VersionRegexConfig(
          true, // Cache enabled
          10000, // Max 10K cached constraints
          300, // 5 minute idle timeout
          60, // Scan every 60 seconds
          1000, // 1 second eviction protection
          RegexDialect.JAVA,
          NotEqualStrategy.REJECT,
          NoOpMetricsRegistry.INSTANCE);

  /** Configuration with caching disabled; every compile call generates a fresh pattern. */
  public static final VersionRegexConfig NO_CACHE =
      new VersionRegexConfig(
          false, // Cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          RegexDialect.JAVA,
          NotEqualStrategy.REJECT,
          NoOpMetricsRegistry.INSTANCE);

  public VersionRegexConfig {
    Objects.requireNonNull(dialect, "dialect cannot be null");
    Objects.requireNonNull(notEqualStrategy, "notEqualStrategy cannot be null");
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");

    if (cacheEnabled) {
      if (maxCacheSize <= 0) {
        throw new IllegalArgumentException("maxCacheSize must be positive when cache enabled");
      }
      if (idleTimeoutSeconds <= 0) {
        throw new IllegalArgumentException(
            "idleTimeoutSeconds must be positive when cache enabled");
      }
      if (evictionScanIntervalSeconds <= 0) {
        throw new IllegalArgumentException(
            "evictionScanIntervalSeconds must be positive when cache enabled");
      }
      if (evictionProtectionMs < 0) {
        throw new IllegalArgumentException(
            "evictionProtectionMs must be non-negative when cache enabled");
      }

      // Valid, but idle entries will linger past their timeout
      if (evictionScanIntervalSeconds > idleTimeoutSeconds) {
        logger.warn(
            "VersionRegex: evictionScanIntervalSeconds ({}s) exceeds idleTimeoutSeconds ({}s) - idle entries may not be evicted promptly",
            evictionScanIntervalSeconds,
            idleTimeoutSeconds);
      }
    }
  }

  /**
   * Creates a builder starting from {@link #DEFAULT}.
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for custom configuration. All fields start at the {@link #DEFAULT} values. */
  public static class Builder {
    private boolean cacheEnabled = true;
    private int maxCacheSize = 10000;
    private long idleTimeoutSeconds = 300;
    private long evictionScanIntervalSeconds = 60;
    private long evictionProtectionMs = 1000;
    private RegexDialect dialect = RegexDialect.JAVA;
    private NotEqualStrategy notEqualStrategy = NotEqualStrategy.REJECT;
    private VersionRegexMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Enable or disable caching of compiled constraints.
     *
     * @param enabled true to enable caching (default)
     * @return this builder
     */
    public Builder cacheEnabled(boolean enabled) {
      this.cacheEnabled = enabled;
      return this;
    }

    /**
     * Set maximum number of cached constraints before LRU eviction.
     *
     * <p><b>Default: 10,000</b>
     *
     * @param size maximum cached entries (must be > 0)
     * @return this builder
     */
    public Builder maxCacheSize(int size) {
      this.maxCacheSize = size;
      return this;
    }

    /**
     * Set idle timeout for eviction.
     *
     * <p><b>Default: 300 seconds</b>
     *
     * @param seconds idle timeout in seconds (must be > 0)
     * @return this builder
     */
    public Builder idleTimeoutSeconds(long seconds) {
      this.idleTimeoutSeconds = seconds;
      return this;
    }

    /**
     * Set how often the idle eviction task runs.
     *
     * <p><b>Default: 60 seconds</b>. Should not exceed {@code idleTimeoutSeconds}.
     *
     * @param seconds scan interval in seconds (must be > 0)
     * @return this builder
     */
    public Builder evictionScanIntervalSeconds(long seconds) {
      this.evictionScanIntervalSeconds = seconds;
      return this;
    }

    /**
     * Set LRU eviction protection for recently used entries.
     *
     * <p><b>Default: 1000ms</b>. 0 disables protection.
     *
     * @param ms protection period in milliseconds (must be >= 0)
     * @return this builder
     */
    public Builder evictionProtectionMs(long ms) {
      this.evictionProtectionMs = ms;
      return this;
    }

    /**
     * Set the default regex dialect.
     *
     * @param dialect target engine (must not be null)
     * @return this builder
     * @throws NullPointerException if dialect is null
     */
    public Builder dialect(RegexDialect dialect) {
      this.dialect = Objects.requireNonNull(dialect, "dialect cannot be null");
      return this;
    }

    /**
     * Set how {@code !=} is handled on dialects without lookahead.
     *
     * @param strategy handling strategy (must not be null)
     * @return this builder
     * @throws NullPointerException if strategy is null
     */
    public Builder notEqualStrategy(NotEqualStrategy strategy) {
      this.notEqualStrategy = Objects.requireNonNull(strategy, "notEqualStrategy cannot be null");
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
    public Builder metricsRegistry(VersionRegexMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated configuration
     * @throws IllegalArgumentException if a value is out of range
     */
    public VersionRegexConfig build() {
      return new VersionRegexConfig(
          cacheEnabled,
          maxCacheSize,
          idleTimeoutSeconds,
          evictionScanIntervalSeconds,
          evictionProtectionMs,
          dialect,
          notEqualStrategy,
          metricsRegistry);
    }
  }
}
