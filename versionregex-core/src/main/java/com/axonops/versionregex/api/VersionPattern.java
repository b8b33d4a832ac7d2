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

package com.axonops.versionregex.api;

import com.axonops.versionregex.cache.CacheStatistics;
import com.axonops.versionregex.cache.NotEqualStrategy;
import com.axonops.versionregex.cache.VersionPatternCache;
import com.axonops.versionregex.cache.VersionRegexConfig;
import com.axonops.versionregex.core.ConstraintCompiler;
import com.axonops.versionregex.core.RegexFragments;
import com.axonops.versionregex.dialect.CompiledRegex;
import com.axonops.versionregex.dialect.RegexDialect;
import com.axonops.versionregex.metrics.MetricNames;
import com.axonops.versionregex.metrics.VersionRegexMetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A version constraint compiled into a regular expression.
 *
 * <p>Thread-safe and immutable: instances can be shared between threads.
 *
 * <p>Patterns from {@link #compile(String)} are cached in a global {@link VersionPatternCache}
 * keyed on the constraint string and dialect.
 *
 * <pre>{@code
 * VersionPattern caret = VersionPattern.compile("^1.2.3");
 * caret.matches("1.9.0");                                   // true
 * caret.filter(List.of("1.2.3", "2.0.0", "1.4.1-beta"));    // [1.2.3, 1.4.1-beta]
 * }</pre>
 *
 * <p>A {@code !=} constraint on a dialect without lookahead either fails or, with {@link
 * NotEqualStrategy#NEGATED_MATCH}, is evaluated as two patterns: the candidate must match {@link
 * #pattern()} and must not match {@link #exclusionPattern()}.
 *
 * @since 1.0.0
 */
public final class VersionPattern {
    private static final Logger logger = LoggerFactory.getLogger(VersionPattern.class);

    // Global cache (replaceable for testing)
    private static volatile VersionPatternCache cache = new VersionPatternCache(VersionRegexConfig.DEFAULT);

    /**
     * Gets the global cache.
     */
    public static VersionPatternCache getGlobalCache() {
        return cache;
    }

    private final VersionConstraint constraint;
    private final CompiledRegex regex;
    private final CompiledRegex exclusion;

    private VersionPattern(VersionConstraint constraint, CompiledRegex regex, CompiledRegex exclusion) {
        this.constraint = constraint;
        this.regex = regex;
        this.exclusion = exclusion;
    }

    /**
     * Compiles a constraint with the global configuration's dialect, using the cache.
     *
     * @param constraint constraint such as {@code ">=1.2.3"} or {@code "[1.0,2.0)"}
     * @return compiled pattern
     * @throws VersionRegexException if the constraint cannot be compiled
     */
    public static VersionPattern compile(String constraint) {
        return compile(constraint, cache.getConfig().dialect());
    }

    /**
     * Compiles a constraint for a specific dialect, using the cache.
     *
     * @param constraint constraint string
     * @param dialect target regex engine
     * @return compiled pattern
     * @throws VersionRegexException if the constraint cannot be compiled
     */
    public static VersionPattern compile(String constraint, RegexDialect dialect) {
        Objects.requireNonNull(constraint, "constraint cannot be null");
        Objects.requireNonNull(dialect, "dialect cannot be null");

        VersionPatternCache current = cache;
        return current.getOrCompile(constraint, dialect, () -> doCompile(constraint, dialect, current.getConfig()));
    }

    /**
     * Compiles a constraint bypassing the cache.
     *
     * @param constraint constraint string
     * @return compiled pattern
     */
    public static VersionPattern compileWithoutCache(String constraint) {
        return compileWithoutCache(constraint, cache.getConfig().dialect());
    }

    /**
     * Compiles a constraint for a specific dialect bypassing the cache.
     *
     * @param constraint constraint string
     * @param dialect target regex engine
     * @return compiled pattern
     */
    public static VersionPattern compileWithoutCache(String constraint, RegexDialect dialect) {
        Objects.requireNonNull(constraint, "constraint cannot be null");
        Objects.requireNonNull(dialect, "dialect cannot be null");
        return doCompile(constraint, dialect, cache.getConfig());
    }

    private static VersionPattern doCompile(String constraint, RegexDialect dialect, VersionRegexConfig config) {
        VersionRegexMetricsRegistry metrics = config.metricsRegistry();
        long startNanos = System.nanoTime();

        try {
            VersionConstraint parsed = ConstraintParser.parse(constraint);
            VersionPattern compiled;

            if (parsed.operator() == Operator.NOT_EQUAL
                && !dialect.supportsLookahead()
                && config.notEqualStrategy() == NotEqualStrategy.NEGATED_MATCH) {
                // Match any version, then reject the excluded one at the call site
                String any = RegexFragments.START + RegexFragments.LOOSE_VERSION + RegexFragments.END;
                compiled = new VersionPattern(
                    parsed,
                    dialect.compile(any),
                    dialect.compile(ConstraintCompiler.exactMatch(parsed.version())));
            } else {
                String pattern = new ConstraintCompiler(dialect).compile(parsed);
                compiled = new VersionPattern(parsed, dialect.compile(pattern), null);
            }

            long durationNanos = System.nanoTime() - startNanos;
            metrics.recordTimer(MetricNames.CONSTRAINTS_COMPILATION_LATENCY, durationNanos);
            metrics.incrementCounter(MetricNames.CONSTRAINTS_COMPILED);

            logger.trace("VersionRegex: Constraint compiled - constraint: '{}', dialect: {}, length: {}, timeNs: {}",
                constraint, dialect, compiled.regex.pattern().length(), durationNanos);
            return compiled;

        } catch (VersionParseException e) {
            metrics.incrementCounter(MetricNames.ERRORS_PARSE);
            logger.debug("VersionRegex: Constraint rejected - {}", e.getMessage());
            throw e;
        } catch (UnsupportedOperatorException e) {
            metrics.incrementCounter(MetricNames.ERRORS_UNSUPPORTED_OPERATOR);
            logger.debug("VersionRegex: Constraint rejected - {}", e.getMessage());
            throw e;
        } catch (DialectUnsupportedException e) {
            metrics.incrementCounter(MetricNames.ERRORS_DIALECT_UNSUPPORTED);
            logger.debug("VersionRegex: Constraint rejected - {}", e.getMessage());
            throw e;
        } catch (PatternCompilationException e) {
            metrics.incrementCounter(MetricNames.ERRORS_PATTERN_COMPILATION);
            logger.debug("VersionRegex: Generated pattern rejected by {} - {}", dialect, e.getMessage());
            throw e;
        }
    }

    /**
     * Tests whether a version satisfies the constraint.
     *
     * @param version candidate version string
     * @return true if the whole string satisfies the constraint
     * @throws NullPointerException if version is null
     */
    public boolean matches(String version) {
        Objects.requireNonNull(version, "version cannot be null");

        long startNanos = System.nanoTime();
        boolean result = test(version);
        long durationNanos = System.nanoTime() - startNanos;

        VersionRegexMetricsRegistry metrics = cache.getConfig().metricsRegistry();
        metrics.incrementCounter(MetricNames.MATCHING_OPERATIONS);
        metrics.recordTimer(MetricNames.MATCHING_LATENCY, durationNanos);

        return result;
    }

    private boolean test(String version) {
        return regex.matches(version) && (exclusion == null || !exclusion.matches(version));
    }

    // ========== Bulk Matching Operations ==========

    /**
     * Tests many versions at once.
     *
     * @param versions candidate versions
     * @return results parallel to {@code versions}
     * @throws NullPointerException if versions or any element is null
     */
    public boolean[] matchAll(String[] versions) {
        Objects.requireNonNull(versions, "versions cannot be null");

        if (versions.length == 0) {
            return new boolean[0];
        }

        long startNanos = System.nanoTime();
        boolean[] results = new boolean[versions.length];
        for (int i = 0; i < versions.length; i++) {
            results[i] = test(Objects.requireNonNull(versions[i], "versions cannot contain null"));
        }
        long durationNanos = System.nanoTime() - startNanos;

        VersionRegexMetricsRegistry metrics = cache.getConfig().metricsRegistry();
        metrics.incrementCounter(MetricNames.MATCHING_BULK_OPERATIONS);
        metrics.incrementCounter(MetricNames.MATCHING_BULK_ITEMS, versions.length);
        metrics.recordTimer(MetricNames.MATCHING_BULK_LATENCY, durationNanos);

        return results;
    }

    /**
     * Tests many versions at once.
     *
     * @param versions candidate versions (List, Set, or any Collection)
     * @return results in the collection's iteration order
     * @throws NullPointerException if versions or any element is null
     */
    public boolean[] matchAll(Collection<String> versions) {
        Objects.requireNonNull(versions, "versions cannot be null");
        return matchAll(versions.toArray(new String[0]));
    }

    /**
     * Keeps the versions that satisfy the constraint.
     *
     * @param versions candidate versions
     * @return new list of matching versions, in input order
     */
    public List<String> filter(Collection<String> versions) {
        return select(versions, true);
    }

    /**
     * Keeps the versions that do not satisfy the constraint.
     *
     * @param versions candidate versions
     * @return new list of non-matching versions, in input order
     */
    public List<String> filterNot(Collection<String> versions) {
        return select(versions, false);
    }

    private List<String> select(Collection<String> versions, boolean keepMatches) {
        Objects.requireNonNull(versions, "versions cannot be null");

        if (versions.isEmpty()) {
            return new ArrayList<>();
        }

        String[] array = versions.toArray(new String[0]);
        boolean[] matches = matchAll(array);

        List<String> result = new ArrayList<>();
        for (int i = 0; i < array.length; i++) {
            if (matches[i] == keepMatches) {
                result.add(array[i]);
            }
        }
        return result;
    }

    /**
     * The generated regular expression.
     */
    public String pattern() {
        return regex.pattern();
    }

    /**
     * Pattern a candidate must not match, or {@code null} when the constraint compiled into a
     * single pattern.
     */
    public String exclusionPattern() {
        return exclusion == null ? null : exclusion.pattern();
    }

    public VersionConstraint constraint() {
        return constraint;
    }

    public RegexDialect dialect() {
        return regex.dialect();
    }

    // ========== Global Cache ==========

    /**
     * Gets cache statistics (for monitoring).
     */
    public static CacheStatistics getCacheStatistics() {
        return cache.getStatistics();
    }

    /**
     * Clears the cache (for testing/maintenance).
     */
    public static void clearCache() {
        cache.clear();
    }

    /**
     * Clears the cache and resets its statistics (for testing).
     */
    public static void resetCache() {
        cache.reset();
    }

    /**
     * Reconfigures the global cache in place. All cached entries are dropped.
     *
     * @param config the new configuration
     */
    public static void configureCache(VersionRegexConfig config) {
        cache.reconfigure(config);
    }

    /**
     * Replaces the global cache (for testing).
     *
     * <p>The previous cache keeps its eviction threads running; the caller owns it and must call
     * {@link VersionPatternCache#shutdown()} on it unless it will be restored later. To change
     * settings without swapping instances use {@link #configureCache(VersionRegexConfig)}.
     *
     * @param newCache the new cache to use globally
     * @return the cache that was replaced
     */
    public static VersionPatternCache setGlobalCache(VersionPatternCache newCache) {
        Objects.requireNonNull(newCache, "cache cannot be null");
        synchronized (VersionPattern.class) {
            VersionPatternCache previous = cache;
            cache = newCache;
            return previous;
        }
    }

    public static VersionRegexConfig getCacheConfig() {
        return cache.getConfig();
    }

    @Override
    public String toString() {
        return "VersionPattern{constraint='" + constraint + "', dialect=" + regex.dialect() + "}";
    }
}
