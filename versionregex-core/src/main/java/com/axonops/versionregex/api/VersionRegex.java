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

import com.axonops.versionregex.core.ConstraintCompiler;
import com.axonops.versionregex.core.RegexFragments;
import com.axonops.versionregex.dialect.RegexDialect;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Main entry point for turning version constraints into regular expressions.
 *
 * Thread-safe: All methods can be called concurrently from multiple threads.
 *
 * @since 1.0.0
 */
public final class VersionRegex {

    private VersionRegex() {
        // Utility class
    }

    /**
     * Generates the pattern for a constraint in the global configuration's dialect.
     *
     * <p>Pure: no caching, no metrics. The same input always yields the same string.
     *
     * @param constraint constraint string
     * @return anchored regular expression
     * @throws VersionRegexException if the constraint is malformed or unsupported
     */
    public static String toRegex(String constraint) {
        return toRegex(constraint, VersionPattern.getCacheConfig().dialect());
    }

    /**
     * Generates the pattern for a constraint in a given dialect.
     *
     * @param constraint constraint string
     * @param dialect target regex engine
     * @return anchored regular expression valid in {@code dialect}
     * @throws DialectUnsupportedException for {@code !=} on a dialect without lookahead
     */
    public static String toRegex(String constraint, RegexDialect dialect) {
        Objects.requireNonNull(dialect, "dialect cannot be null");
        return new ConstraintCompiler(dialect).compile(ConstraintParser.parse(constraint));
    }

    public static VersionPattern compile(String constraint) {
        return VersionPattern.compile(constraint);
    }

    public static VersionPattern compile(String constraint, RegexDialect dialect) {
        return VersionPattern.compile(constraint, dialect);
    }

    // ========== Matching ==========

    /**
     * Tests whether a version satisfies a constraint.
     *
     * @param version candidate version
     * @param constraint constraint string
     * @return true if the version satisfies the constraint
     */
    public static boolean matches(String version, String constraint) {
        return compile(constraint).matches(version);
    }

    /**
     * Keeps the versions satisfying a constraint.
     *
     * @param constraint constraint string
     * @param versions candidate versions
     * @return matching versions in input order
     */
    public static List<String> filter(String constraint, Collection<String> versions) {
        return compile(constraint).filter(versions);
    }

    /**
     * Escapes regex metacharacters so that text matches literally in every supported dialect.
     *
     * @param text literal text
     * @return escaped text
     */
    public static String quoteMeta(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        return RegexFragments.quote(text);
    }
}
