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

package com.axonops.versionregex.core;

import com.axonops.versionregex.api.DialectUnsupportedException;
import com.axonops.versionregex.api.VersionConstraint;
import com.axonops.versionregex.api.VersionParseException;
import com.axonops.versionregex.dialect.RegexDialect;
import com.axonops.versionregex.ecosystem.GoModuleFormatter;
import com.axonops.versionregex.ecosystem.MavenRangeFormatter;
import com.axonops.versionregex.ecosystem.MultiSegmentFormatter;
import com.axonops.versionregex.ecosystem.WildcardFormatter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link VersionConstraint} into an anchored pattern string for one {@link RegexDialect}.
 *
 * <p>Compilation is pure: the same constraint and dialect always produce the same string. Only
 * {@link com.axonops.versionregex.api.Operator#NOT_EQUAL} depends on the dialect, since it needs
 * negative lookahead.
 *
 * <p>Thread-safe; instances hold no mutable state.
 *
 * @since 1.0.0
 */
public final class ConstraintCompiler {
  private static final Logger logger = LoggerFactory.getLogger(ConstraintCompiler.class);

  static final String LOOKAHEAD_FEATURE = "negative lookahead";

  private final RegexDialect dialect;

  public ConstraintCompiler(RegexDialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect cannot be null");
  }

  public RegexDialect dialect() {
    return dialect;
  }

  /**
   * Compiles a constraint into a pattern string.
   *
   * @param constraint parsed constraint
   * @return anchored pattern valid in this compiler's dialect
   * @throws VersionParseException if the version literal is malformed
   * @throws DialectUnsupportedException if the operator needs a feature the dialect lacks
   */
  public String compile(VersionConstraint constraint) {
    Objects.requireNonNull(constraint, "constraint cannot be null");
    String version = constraint.version();

    String pattern =
        switch (constraint.operator()) {
          case EXACT, EQUAL -> exactMatch(version);
          case GREATER_EQUAL -> comparison(BoundaryBuilder.atLeast(VersionTriple.parse(version)));
          case LESS_EQUAL -> comparison(BoundaryBuilder.atMost(VersionTriple.parse(version)));
          case GREATER -> comparison(BoundaryBuilder.greaterThan(VersionTriple.parse(version)));
          case LESS -> comparison(BoundaryBuilder.lessThan(VersionTriple.parse(version)));
          case NOT_EQUAL -> notEqual(constraint);
          case CARET -> caret(VersionTriple.parse(version));
          case TILDE, PESSIMISTIC, COMPATIBLE -> tilde(VersionTriple.parse(version));
          case MAVEN_RANGE -> MavenRangeFormatter.toRegex(version);
        };

    logger.trace(
        "VersionRegex: Compiled '{}' for {} - pattern length: {}",
        constraint,
        dialect,
        pattern.length());
    return pattern;
  }

  /**
   * Exact-match pattern for a version literal.
   *
   * <p>Wildcard, Go-tagged and multi-segment literals are delegated to their formatters. Other
   * literals match their numeric components literally; a pinned pre-release or build tail must
   * match as written, an absent one is optional.
   *
   * @param version version literal
   * @return anchored pattern
   * @throws VersionParseException if a component is not numeric
   */
  public static String exactMatch(String version) {
    if (version.isEmpty()) {
      throw new VersionParseException(version, "major", "version is empty");
    }
    if (WildcardFormatter.isWildcard(version)) {
      return WildcardFormatter.toRegex(version);
    }
    if (GoModuleFormatter.isGoModuleVersion(version)) {
      return GoModuleFormatter.toRegex(version);
    }
    if (MultiSegmentFormatter.isMultiSegmentVersion(version)) {
      return MultiSegmentFormatter.toRegex(version);
    }

    String main = version;
    String build = "";
    String preRelease = "";
    int plus = main.indexOf('+');
    if (plus != -1) {
      build = main.substring(plus);
      main = main.substring(0, plus);
    }
    int dash = main.indexOf('-');
    if (dash != -1) {
      preRelease = main.substring(dash);
      main = main.substring(0, dash);
    }

    StringBuilder pattern = new StringBuilder(RegexFragments.START);
    String[] parts = main.split("\\.", -1);
    for (int i = 0; i < parts.length; i++) {
      VersionTriple.parseComponent(version, VersionTriple.componentName(i), parts[i]);
      if (i > 0) {
        pattern.append(RegexFragments.DOT);
      }
      pattern.append(parts[i]);
    }

    pattern.append(
        preRelease.isEmpty() ? RegexFragments.PRE_RELEASE : RegexFragments.quote(preRelease));
    pattern.append(
        build.isEmpty() ? RegexFragments.BUILD_METADATA : RegexFragments.quote(build));

    return pattern.append(RegexFragments.END).toString();
  }

  private static String comparison(String body) {
    return RegexFragments.anchoredVersion(body);
  }

  private static String caret(VersionTriple version) {
    if (version.major() > 0) {
      return RegexFragments.START
          + version.major()
          + RegexFragments.DOT
          + RegexFragments.DIGITS
          + RegexFragments.DOT
          + RegexFragments.DIGITS
          + RegexFragments.SUFFIX
          + RegexFragments.END;
    }
    // 0.x is unstable: the minor plays the role of the major
    return RegexFragments.START
        + "0"
        + RegexFragments.DOT
        + version.minor()
        + RegexFragments.DOT
        + RegexFragments.DIGITS
        + RegexFragments.SUFFIX
        + RegexFragments.END;
  }

  private static String tilde(VersionTriple version) {
    return RegexFragments.START
        + version.major()
        + RegexFragments.DOT
        + version.minor()
        + RegexFragments.DOT
        + RegexFragments.DIGITS
        + RegexFragments.SUFFIX
        + RegexFragments.END;
  }

  private String notEqual(VersionConstraint constraint) {
    if (!dialect.supportsLookahead()) {
      throw new DialectUnsupportedException(constraint.toString(), dialect, LOOKAHEAD_FEATURE);
    }
    return RegexFragments.START
        + "(?!"
        + exactCore(constraint.version())
        + RegexFragments.END
        + ")"
        + RegexFragments.LOOSE_VERSION
        + RegexFragments.END;
  }

  /** Exact-match pattern without its anchors. */
  static String exactCore(String version) {
    String exact = exactMatch(version);
    return exact.substring(
        RegexFragments.START.length(), exact.length() - RegexFragments.END.length());
  }
}
