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

import com.axonops.versionregex.api.VersionPattern;
import com.axonops.versionregex.dialect.RegexDialect;
import com.axonops.versionregex.metrics.MetricNames;
import com.axonops.versionregex.metrics.VersionRegexMetricsRegistry;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe cache of compiled {@link VersionPattern}s keyed on constraint string and dialect.
 *
 * <p>Eviction strategies: 1. LRU (soft limit): when the cache exceeds max size, least recently used
 * entries are evicted asynchronously 2. Idle time: a background thread evicts entries idle beyond
 * the timeout
 *
 * <p>Reads are lock-free; a miss compiles through {@link ConcurrentHashMap#computeIfAbsent} so
 * each key is compiled by one thread. The cache may briefly exceed its maximum size while the LRU
 * eviction task catches up. Failed compilations are never cached.
 *
 * @since 1.0.0
 */
public final class VersionPatternCache {
  private static final Logger logger = LoggerFactory.getLogger(VersionPatternCache.class);

  private static final int LRU_SAMPLE_SIZE = 500;

  // Config, map and background tasks are published together through one volatile write
  private volatile CacheState state;

  private final AtomicLong hits = new AtomicLong(0);
  private final AtomicLong misses = new AtomicLong(0);
  private final AtomicLong evictionsLRU = new AtomicLong(0);
  private final AtomicLong evictionsIdle = new AtomicLong(0);

  /**
   * Creates a new cache with the given configuration.
   *
   * @param config the cache configuration
   */
  public VersionPatternCache(VersionRegexConfig config) {
    publish(config);
  }

  public VersionRegexConfig getConfig() {
    return state.config();
  }

  private void publish(VersionRegexConfig newConfig) {
    if (!newConfig.cacheEnabled()) {
      this.state = new CacheState(newConfig, null, null, null);
      logger.info("VersionRegex: Constraint caching disabled");
      return;
    }

    ExecutorService executor =
        Executors.newSingleThreadExecutor(
            r -> {
              Thread t = new Thread(r, "VersionRegex-LRU-Eviction");
              t.setDaemon(true);
              t.setPriority(Thread.MIN_PRIORITY);
              return t;
            });
    CacheState newState =
        new CacheState(
            newConfig,
            new ConcurrentHashMap<>(Math.min(newConfig.maxCacheSize(), 1024)),
            executor,
            new IdleEvictionTask(this, newConfig));
    this.state = newState;
    newState.evictionTask().start();

    logger.info(
        "VersionRegex: Cache initialized - maxSize: {}, idleTimeout: {}s, scanInterval: {}s, dialect: {}",
        newConfig.maxCacheSize(),
        newConfig.idleTimeoutSeconds(),
        newConfig.evictionScanIntervalSeconds(),
        newConfig.dialect());

    newConfig.metricsRegistry().registerGauge(MetricNames.CACHE_CONSTRAINTS_COUNT, this::currentSize);
  }

  /**
   * Gets a cached pattern or compiles and caches it.
   *
   * @param constraint constraint string as given by the caller
   * @param dialect target dialect
   * @param compiler compiles the pattern on a miss
   * @return cached or newly compiled pattern
   */
  public VersionPattern getOrCompile(
      String constraint, RegexDialect dialect, Supplier<VersionPattern> compiler) {
    CacheState current = state;
    VersionRegexConfig config = current.config();
    VersionRegexMetricsRegistry metrics = config.metricsRegistry();

    if (current.cache() == null) {
      misses.incrementAndGet();
      metrics.incrementCounter(MetricNames.CONSTRAINTS_CACHE_MISSES);
      return compiler.get();
    }

    CacheKey key = new CacheKey(constraint, dialect);

    CachedPattern cached = current.cache().get(key);
    if (cached != null) {
      cached.touch();
      hits.incrementAndGet();
      metrics.incrementCounter(MetricNames.CONSTRAINTS_CACHE_HITS);
      logger.trace("VersionRegex: Cache hit - {}", key);
      return cached.pattern();
    }

    misses.incrementAndGet();
    metrics.incrementCounter(MetricNames.CONSTRAINTS_CACHE_MISSES);
    logger.trace("VersionRegex: Cache miss - {}, compiling", key);

    // Exceptions from the compiler propagate and leave no entry behind
    CachedPattern created =
        current.cache().computeIfAbsent(key, k -> new CachedPattern(compiler.get()));

    int currentSize = current.cache().size();
    if (currentSize > config.maxCacheSize()) {
      triggerAsyncLRUEviction(current, currentSize - config.maxCacheSize());
    }

    return created.pattern();
  }

  private void triggerAsyncLRUEviction(CacheState current, int toEvict) {
    ExecutorService executor = current.lruEvictionExecutor();
    if (toEvict <= 0 || executor.isShutdown()) {
      return;
    }

    try {
      executor.submit(
          () -> {
            try {
              evictLRUBatch(current, toEvict);
            } catch (RuntimeException e) {
              logger.warn("VersionRegex: Error during async LRU eviction", e);
            }
          });
    } catch (RejectedExecutionException e) {
      // Lost a race with reconfigure() or shutdown(); the map being evicted has been discarded
      logger.debug("VersionRegex: LRU eviction skipped, executor stopped");
    }
  }

  /**
   * Evicts least-recently-used entries.
   *
   * <p>Sample-based: only a bounded sample of entries older than {@code evictionProtectionMs} is
   * considered, oldest first.
   */
  private void evictLRUBatch(CacheState snapshot, int toEvict) {
    VersionRegexConfig config = snapshot.config();
    ConcurrentHashMap<CacheKey, CachedPattern> current = snapshot.cache();
    int actualToEvict = Math.min(toEvict, current.size() - config.maxCacheSize());
    if (actualToEvict <= 0) {
      return;
    }

    long cutoffTime = System.nanoTime() - config.evictionProtectionMs() * 1_000_000L;

    List<Map.Entry<CacheKey, CachedPattern>> candidates =
        current.entrySet().stream()
            .filter(e -> e.getValue().lastAccessTimeNanos() < cutoffTime)
            .limit(LRU_SAMPLE_SIZE)
            .sorted(Comparator.comparingLong(e -> e.getValue().lastAccessTimeNanos()))
            .limit(actualToEvict)
            .collect(Collectors.toList());

    int evicted = 0;
    for (Map.Entry<CacheKey, CachedPattern> entry : candidates) {
      if (current.remove(entry.getKey(), entry.getValue())) {
        evictionsLRU.incrementAndGet();
        config.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_LRU);
        logger.trace("VersionRegex: LRU evicting {}", entry.getKey());
        evicted++;
      }
    }

    if (evicted > 0) {
      logger.debug(
          "VersionRegex: LRU eviction completed - evicted: {}, cacheSize: {}/{}",
          evicted,
          current.size(),
          config.maxCacheSize());
    }
  }

  /**
   * Evicts entries idle longer than the configured timeout (called by the background thread).
   *
   * @return number of entries evicted
   */
  int evictIdlePatterns() {
    CacheState snapshot = state;
    VersionRegexConfig config = snapshot.config();
    ConcurrentHashMap<CacheKey, CachedPattern> current = snapshot.cache();
    if (current == null) {
      return 0;
    }

    long cutoffNanos = System.nanoTime() - config.idleTimeoutSeconds() * 1_000_000_000L;
    AtomicLong evictedCount = new AtomicLong(0);

    current
        .entrySet()
        .removeIf(
            entry -> {
              if (entry.getValue().lastAccessTimeNanos() < cutoffNanos) {
                logger.trace("VersionRegex: Idle evicting {}", entry.getKey());
                evictionsIdle.incrementAndGet();
                config.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_IDLE);
                evictedCount.incrementAndGet();
                return true;
              }
              return false;
            });

    int evicted = (int) evictedCount.get();
    if (evicted > 0) {
      logger.debug(
          "VersionRegex: Idle eviction completed - evicted: {}, cacheSize: {}",
          evicted,
          current.size());
    }
    return evicted;
  }

  /** Gets a statistics snapshot. */
  public CacheStatistics getStatistics() {
    return new CacheStatistics(
        hits.get(),
        misses.get(),
        evictionsLRU.get(),
        evictionsIdle.get(),
        currentSize(),
        state.config().maxCacheSize());
  }

  private int currentSize() {
    ConcurrentHashMap<CacheKey, CachedPattern> current = state.cache();
    return current != null ? current.size() : 0;
  }

  /** Removes every cached entry. Statistics are kept. */
  public void clear() {
    ConcurrentHashMap<CacheKey, CachedPattern> current = state.cache();
    if (current == null) {
      return;
    }
    logger.debug("VersionRegex: Clearing cache - {} entries", current.size());
    current.clear();
  }

  /** Resets statistics (for testing). */
  public void resetStatistics() {
    hits.set(0);
    misses.set(0);
    evictionsLRU.set(0);
    evictionsIdle.set(0);
    logger.trace("VersionRegex: Cache statistics reset");
  }

  /** Clears the cache and resets statistics (for testing). */
  public void reset() {
    clear();
    resetStatistics();
  }

  /**
   * Replaces the configuration, dropping every cached entry and restarting the eviction threads.
   *
   * @param newConfig the new configuration
   */
  public synchronized void reconfigure(VersionRegexConfig newConfig) {
    logger.info("VersionRegex: Reconfiguring cache with new settings");

    stopBackgroundTasks();
    clear();
    resetStatistics();
    state.config().metricsRegistry().removeGauge(MetricNames.CACHE_CONSTRAINTS_COUNT);

    publish(newConfig);
  }

  /** Stops the eviction threads and clears the cache. */
  public synchronized void shutdown() {
    logger.info("VersionRegex: Shutting down cache");

    stopBackgroundTasks();
    clear();
    state.config().metricsRegistry().removeGauge(MetricNames.CACHE_CONSTRAINTS_COUNT);
  }

  boolean isIdleEvictionRunning() {
    IdleEvictionTask task = state.evictionTask();
    return task != null && task.isRunning();
  }

  private void stopBackgroundTasks() {
    CacheState current = state;
    if (current.evictionTask() != null) {
      current.evictionTask().stop();
    }
    if (current.lruEvictionExecutor() != null) {
      current.lruEvictionExecutor().shutdown();
    }
  }

  /** Immutable snapshot; {@code cache}, executor and task are all null when caching is disabled. */
  private record CacheState(
      VersionRegexConfig config,
      ConcurrentHashMap<CacheKey, CachedPattern> cache,
      ExecutorService lruEvictionExecutor,
      IdleEvictionTask evictionTask) {}

  private record CacheKey(String constraint, RegexDialect dialect) {
    @Override
    public String toString() {
      return (constraint.length() > 50 ? constraint.substring(0, 47) + "..." : constraint)
          + " ("
          + dialect
          + ")";
    }
  }

  private static final class CachedPattern {
    private final VersionPattern pattern;
    private final AtomicLong lastAccessTimeNanos;

    CachedPattern(VersionPattern pattern) {
      this.pattern = pattern;
      this.lastAccessTimeNanos = new AtomicLong(System.nanoTime());
    }

    VersionPattern pattern() {
      return pattern;
    }

    long lastAccessTimeNanos() {
      return lastAccessTimeNanos.get();
    }

    void touch() {
      lastAccessTimeNanos.set(System.nanoTime());
    }
  }
}
