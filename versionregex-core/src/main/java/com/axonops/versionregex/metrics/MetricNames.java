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

package com.axonops.versionregex.metrics;

/**
 * Metric name constants.
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 *   <li><b>Gauge</b> - Current value (suffix: {@code .current.count})
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * VersionRegexConfig config = VersionRegexMetricsConfig.withMetrics(registry, "myapp.versions");
 * VersionPattern.configureCache(config);
 *
 * VersionPattern.compile("^1.2.3").matches("1.4.0");
 *
 * Counter compiled = registry.counter(
 *     MetricRegistry.name("myapp.versions", MetricNames.CONSTRAINTS_COMPILED));
 * }</pre>
 *
 * <p>Cache hit rate is {@link #CONSTRAINTS_CACHE_HITS} / ({@link #CONSTRAINTS_CACHE_HITS} + {@link
 * #CONSTRAINTS_CACHE_MISSES}).
 *
 * @since 1.0.0
 * @see com.axonops.versionregex.cache.VersionPatternCache
 * @see com.axonops.versionregex.api.VersionPattern
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Constraint Compilation
  // ========================================

  /**
   * Constraints compiled into patterns (successful compilations only).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String CONSTRAINTS_COMPILED = "constraints.compiled.total.count";

  /**
   * Time to turn a constraint string into a compiled pattern.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String CONSTRAINTS_COMPILATION_LATENCY = "constraints.compilation.latency";

  /**
   * Compiled constraint found in cache.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String CONSTRAINTS_CACHE_HITS = "constraints.cache.hits.total.count";

  /**
   * Constraint not in cache (or cache disabled), compilation required.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String CONSTRAINTS_CACHE_MISSES = "constraints.cache.misses.total.count";

  // ========================================
  // Cache
  // ========================================

  /**
   * Compiled constraints currently cached.
   *
   * <p><b>Type:</b> Gauge (count)
   */
  public static final String CACHE_CONSTRAINTS_COUNT = "cache.constraints.current.count";

  /**
   * Entries evicted because the cache exceeded its maximum size.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> High values indicate the cache is too small for the working set
   */
  public static final String CACHE_EVICTIONS_LRU = "cache.evictions.lru.total.count";

  /**
   * Entries evicted after being unused for the idle timeout.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String CACHE_EVICTIONS_IDLE = "cache.evictions.idle.total.count";

  // ========================================
  // Errors
  // ========================================

  /** Malformed version literals. <b>Type:</b> Counter */
  public static final String ERRORS_PARSE = "errors.parse.total.count";

  /** Unknown operator symbols. <b>Type:</b> Counter */
  public static final String ERRORS_UNSUPPORTED_OPERATOR =
      "errors.unsupported_operator.total.count";

  /** Constraints rejected by the target dialect (not-equal on RE2). <b>Type:</b> Counter */
  public static final String ERRORS_DIALECT_UNSUPPORTED = "errors.dialect_unsupported.total.count";

  /**
   * Generated patterns rejected by the regex engine.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> Should always be zero; any value indicates a generator defect
   */
  public static final String ERRORS_PATTERN_COMPILATION =
      "errors.pattern_compilation.total.count";

  // ========================================
  // Matching
  // ========================================

  /** Single-version match calls. <b>Type:</b> Counter */
  public static final String MATCHING_OPERATIONS = "matching.operations.total.count";

  /** Single-version match latency. <b>Type:</b> Timer (nanoseconds) */
  public static final String MATCHING_LATENCY = "matching.latency";

  /** Bulk match calls ({@code matchAll}, {@code filter}, {@code filterNot}). <b>Type:</b> Counter */
  public static final String MATCHING_BULK_OPERATIONS = "matching.bulk.operations.total.count";

  /** Versions processed by bulk calls. <b>Type:</b> Counter */
  public static final String MATCHING_BULK_ITEMS = "matching.bulk.items.total.count";

  /** Latency of a whole bulk call. <b>Type:</b> Timer (nanoseconds) */
  public static final String MATCHING_BULK_LATENCY = "matching.bulk.latency";
}
