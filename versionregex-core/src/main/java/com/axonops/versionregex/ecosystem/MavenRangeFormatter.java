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

package com.axonops.versionregex.ecosystem;

import com.axonops.versionregex.api.VersionParseException;
import com.axonops.versionregex.core.BoundaryBuilder;
import com.axonops.versionregex.core.RegexFragments;
import com.axonops.versionregex.core.VersionTriple;
import java.util.ArrayList;
import java.util.List;

/**
 * Maven version ranges.
 *
 * <table>
 *   <caption>Supported forms</caption>
 *   <tr><th>Range</th><th>Meaning</th></tr>
 *   <tr><td>{@code [1.0,2.0]}</td><td>1.0 &lt;= x &lt;= 2.0</td></tr>
 *   <tr><td>{@code [1.0,2.0)}</td><td>1.0 &lt;= x &lt; 2.0</td></tr>
 *   <tr><td>{@code (1.0,2.0]}</td><td>1.0 &lt; x &lt;= 2.0</td></tr>
 *   <tr><td>{@code [1.0,)}</td><td>x &gt;= 1.0</td></tr>
 *   <tr><td>{@code (,1.0]}</td><td>x &lt;= 1.0</td></tr>
 *   <tr><td>{@code [1.0]}</td><td>x == 1.0</td></tr>
 *   <tr><td>{@code [1.0,2.0),[3.0,)}</td><td>union of the ranges</td></tr>
 * </table>
 *
 * <p>Bounds are reduced to {@link VersionTriple}s and handed to the {@link BoundaryBuilder}, so
 * every range compiles without lookaround.
 *
 * @since 1.0.0
 */
public final class MavenRangeFormatter {

  private static final String COMPONENT = "range";

  private MavenRangeFormatter() {
    // Utility class
  }

  /**
   * One bracketed range. A {@code null} bound is unbounded on that side.
   *
   * @param lower lower bound or {@code null}
   * @param lowerInclusive {@code [} (true) or {@code (} (false)
   * @param upper upper bound or {@code null}
   * @param upperInclusive {@code ]} (true) or {@code )} (false)
   */
  public record MavenRange(
      VersionTriple lower, boolean lowerInclusive, VersionTriple upper, boolean upperInclusive) {

    public boolean isUnbounded() {
      return lower == null && upper == null;
    }

    /** Pattern body (no anchors, no suffix) for this range. */
    String body() {
      if (lower != null && upper != null) {
        return BoundaryBuilder.between(lower, lowerInclusive, upper, upperInclusive);
      }
      if (lower != null) {
        return lowerInclusive ? BoundaryBuilder.atLeast(lower) : BoundaryBuilder.greaterThan(lower);
      }
      if (upper != null) {
        return upperInclusive ? BoundaryBuilder.atMost(upper) : BoundaryBuilder.lessThan(upper);
      }
      return RegexFragments.VERSION_CORE;
    }
  }

  public static boolean isRange(String literal) {
    String trimmed = literal.trim();
    return trimmed.startsWith("[") || trimmed.startsWith("(");
  }

  /**
   * Builds the anchored pattern for a range or union of ranges.
   *
   * @param literal range literal including brackets
   * @return anchored pattern; matches nothing if every range is empty
   * @throws VersionParseException if the literal is malformed
   */
  public static String toRegex(String literal) {
    List<MavenRange> ranges = parse(literal);

    List<String> bodies = new ArrayList<>(ranges.size());
    for (MavenRange range : ranges) {
      if (range.isUnbounded()) {
        return RegexFragments.ANY_VERSION;
      }
      String body = range.body();
      if (!RegexFragments.CONTRADICTION.equals(body)) {
        bodies.add(body);
      }
    }

    return RegexFragments.anchoredVersion(RegexFragments.alternation(bodies));
  }

  /**
   * Parses a range literal.
   *
   * @param literal e.g. {@code [1.0,2.0),[3.0,)}
   * @return ranges in declaration order (never empty)
   * @throws VersionParseException if brackets or bounds are malformed
   */
  public static List<MavenRange> parse(String literal) {
    String s = literal.trim();
    List<MavenRange> ranges = new ArrayList<>();
    int pos = 0;

    while (pos < s.length()) {
      char open = s.charAt(pos);
      if (open != '[' && open != '(') {
        throw new VersionParseException(
            literal, COMPONENT, s.substring(pos), "expected '[' or '(' at position " + pos);
      }

      int close = indexOfClose(s, pos + 1);
      if (close == -1) {
        throw new VersionParseException(
            literal, COMPONENT, s.substring(pos), "missing closing ']' or ')'");
      }
      ranges.add(parseRange(literal, open, s.substring(pos + 1, close), s.charAt(close)));

      pos = skipWhitespace(s, close + 1);
      if (pos < s.length()) {
        if (s.charAt(pos) != ',') {
          throw new VersionParseException(
              literal, COMPONENT, s.substring(pos), "expected ',' between ranges");
        }
        pos = skipWhitespace(s, pos + 1);
        if (pos == s.length()) {
          throw new VersionParseException(literal, COMPONENT, ",", "trailing ',' after range");
        }
      }
    }

    if (ranges.isEmpty()) {
      throw new VersionParseException(literal, COMPONENT, "empty range");
    }
    return ranges;
  }

  private static MavenRange parseRange(String literal, char open, String content, char close) {
    int comma = content.indexOf(',');

    if (comma == -1) {
      // [1.0] pins a single version
      String pinned = content.trim();
      if (open != '[' || close != ']') {
        throw new VersionParseException(
            literal, COMPONENT, open + content + close, "a single version must use '[' and ']'");
      }
      if (pinned.isEmpty()) {
        throw new VersionParseException(literal, COMPONENT, open + content + close, "no version");
      }
      VersionTriple version = VersionTriple.parse(pinned);
      return new MavenRange(version, true, version, true);
    }

    if (content.indexOf(',', comma + 1) != -1) {
      throw new VersionParseException(
          literal, COMPONENT, open + content + close, "more than two bounds");
    }

    String lowerText = content.substring(0, comma).trim();
    String upperText = content.substring(comma + 1).trim();
    VersionTriple lower = lowerText.isEmpty() ? null : VersionTriple.parse(lowerText);
    VersionTriple upper = upperText.isEmpty() ? null : VersionTriple.parse(upperText);

    return new MavenRange(lower, open == '[', upper, close == ']');
  }

  private static int indexOfClose(String s, int from) {
    for (int i = from; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == ']' || c == ')') {
        return i;
      }
    }
    return -1;
  }

  private static int skipWhitespace(String s, int from) {
    int i = from;
    while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
      i++;
    }
    return i;
  }
}
