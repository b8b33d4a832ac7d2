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

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the body of a pattern matching every version on one side of a threshold triple.
 *
 * <p>Versions are compared component-wise, so "at least M.m.p" becomes three disjoint clauses:
 *
 * <pre>
 *   major &gt;= M+1                  . any . any
 *   major =  M    minor &gt;= m+1    . any
 *   major =  M    minor =  m      patch &gt;= p
 * </pre>
 *
 * <p>Clauses that cannot match (a component below 0 or above {@link
 * DigitRangeSynthesizer#MAX_VALUE}) are dropped. A bound with no remaining clause yields {@link
 * RegexFragments#CONTRADICTION}.
 *
 * <p>The returned bodies carry no anchors and no suffix; see {@link
 * RegexFragments#anchoredVersion(String)}.
 *
 * @since 1.0.0
 */
public final class BoundaryBuilder {

  private BoundaryBuilder() {
    // Utility class
  }

  /** Versions {@code >= version}. */
  public static String atLeast(VersionTriple version) {
    return RegexFragments.alternation(lowerClauses(version.components(), 0, true));
  }

  /** Versions {@code > version}. */
  public static String greaterThan(VersionTriple version) {
    return RegexFragments.alternation(lowerClauses(version.components(), 0, false));
  }

  /** Versions {@code <= version}. */
  public static String atMost(VersionTriple version) {
    return RegexFragments.alternation(upperClauses(version.components(), 0, true));
  }

  /** Versions {@code < version}. */
  public static String lessThan(VersionTriple version) {
    return RegexFragments.alternation(upperClauses(version.components(), 0, false));
  }

  /**
   * Versions inside an interval.
   *
   * @param lower lower bound
   * @param lowerInclusive whether {@code lower} itself matches
   * @param upper upper bound
   * @param upperInclusive whether {@code upper} itself matches
   * @return pattern body, {@link RegexFragments#CONTRADICTION} for an empty interval
   */
  public static String between(
      VersionTriple lower, boolean lowerInclusive, VersionTriple upper, boolean upperInclusive) {
    List<String> clauses = new ArrayList<>();
    rangeClauses(
        lower.components(), lowerInclusive, upper.components(), upperInclusive, 0, "", clauses);
    return RegexFragments.alternation(clauses);
  }

  /** Clauses for components {@code [from..]} being at least (or above) the given values. */
  private static List<String> lowerClauses(long[] bound, int from, boolean inclusive) {
    List<String> clauses = new ArrayList<>(bound.length - from);
    int last = bound.length - 1;
    for (int i = from; i <= last; i++) {
      long threshold = i == last && inclusive ? bound[i] : bound[i] + 1;
      String open = DigitRangeSynthesizer.greaterOrEqual(threshold);
      if (RegexFragments.CONTRADICTION.equals(open)) {
        continue;
      }
      clauses.add(fixed(bound, from, i) + open + anyComponents(last - i));
    }
    return clauses;
  }

  /** Clauses for components {@code [from..]} being at most (or below) the given values. */
  private static List<String> upperClauses(long[] bound, int from, boolean inclusive) {
    List<String> clauses = new ArrayList<>(bound.length - from);
    int last = bound.length - 1;
    for (int i = from; i <= last; i++) {
      long threshold = i == last && inclusive ? bound[i] : bound[i] - 1;
      if (threshold < 0) {
        continue;
      }
      String open = DigitRangeSynthesizer.lessOrEqual(threshold);
      clauses.add(fixed(bound, from, i) + open + anyComponents(last - i));
    }
    return clauses;
  }

  private static void rangeClauses(
      long[] lower,
      boolean lowerInclusive,
      long[] upper,
      boolean upperInclusive,
      int index,
      String prefix,
      List<String> out) {
    int last = lower.length - 1;
    if (index == last) {
      long low = lowerInclusive ? lower[index] : lower[index] + 1;
      long high = upperInclusive ? upper[index] : upper[index] - 1;
      String open = DigitRangeSynthesizer.between(low, high);
      if (!RegexFragments.CONTRADICTION.equals(open)) {
        out.add(prefix + open);
      }
      return;
    }

    if (lower[index] > upper[index]) {
      return;
    }
    if (lower[index] == upper[index]) {
      rangeClauses(
          lower,
          lowerInclusive,
          upper,
          upperInclusive,
          index + 1,
          prefix + lower[index] + RegexFragments.DOT,
          out);
      return;
    }

    // Low edge: component equals the lower bound, the rest must be at least the lower rest
    String lowHead = prefix + lower[index] + RegexFragments.DOT;
    for (String clause : lowerClauses(lower, index + 1, lowerInclusive)) {
      out.add(lowHead + clause);
    }

    // Strictly between: anything goes for the remaining components
    String middle = DigitRangeSynthesizer.between(lower[index] + 1, upper[index] - 1);
    if (!RegexFragments.CONTRADICTION.equals(middle)) {
      out.add(prefix + middle + anyComponents(last - index));
    }

    // High edge: component equals the upper bound, the rest must be at most the upper rest
    String highHead = prefix + upper[index] + RegexFragments.DOT;
    for (String clause : upperClauses(upper, index + 1, upperInclusive)) {
      out.add(highHead + clause);
    }
  }

  /** Literal components {@code [from, to)}, each followed by a dot. */
  private static String fixed(long[] bound, int from, int to) {
    StringBuilder sb = new StringBuilder();
    for (int i = from; i < to; i++) {
      sb.append(bound[i]).append(RegexFragments.DOT);
    }
    return sb.toString();
  }

  private static String anyComponents(int count) {
    return (RegexFragments.DOT + RegexFragments.DIGITS).repeat(count);
  }
}
