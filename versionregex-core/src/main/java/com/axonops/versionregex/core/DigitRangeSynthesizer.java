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
 * Builds regex fragments matching every integer on one side of a threshold.
 *
 * <p>The fragments use only character classes, counted repetition and alternation, so the
 * comparison is fully encoded in the pattern and never evaluated at match time. Inputs are bounded
 * to ten decimal digits ({@link #MAX_VALUE}); numbers with more digits are outside the domain.
 *
 * <p>Example: {@code greaterOrEqual(123)} produces {@code (?:\d{4,}|[2-9]\d{2}|1[3-9]\d|12[3-9])}.
 *
 * <p>Thread-safe: all methods are pure functions.
 *
 * @since 1.0.0
 */
public final class DigitRangeSynthesizer {

  /** Largest supported threshold (ten digits). */
  public static final long MAX_VALUE = 9_999_999_999L;

  static final int MAX_DIGITS = 10;

  private static final long[] POWERS_OF_TEN = new long[MAX_DIGITS + 1];

  static {
    long power = 1;
    for (int i = 0; i <= MAX_DIGITS; i++) {
      POWERS_OF_TEN[i] = power;
      power *= 10;
    }
  }

  private DigitRangeSynthesizer() {
    // Utility class
  }

  /**
   * Fragment matching every integer {@code >= n}.
   *
   * @param n threshold; values {@code <= 0} match everything, values above {@link #MAX_VALUE}
   *     match nothing
   * @return regex fragment
   */
  public static String greaterOrEqual(long n) {
    if (n <= 0) {
      return RegexFragments.DIGITS;
    }
    if (n > MAX_VALUE) {
      return RegexFragments.CONTRADICTION;
    }

    char[] digits = Long.toString(n).toCharArray();
    int width = digits.length;
    List<String> alternatives = new ArrayList<>(width + 1);

    // Any number with more digits is larger
    if (width < MAX_DIGITS) {
      alternatives.add("\\d{" + (width + 1) + ",}");
    }

    for (int i = 0; i < width; i++) {
      int digit = digits[i] - '0';
      String prefix = new String(digits, 0, i);
      int remaining = width - i - 1;

      if (remaining == 0) {
        alternatives.add(prefix + digitsFrom(digit));
      } else if (digit < 9) {
        alternatives.add(prefix + digitsFrom(digit + 1) + anyDigits(remaining));
      }
    }

    return RegexFragments.alternation(alternatives);
  }

  /**
   * Fragment matching every integer {@code <= n}.
   *
   * @param n threshold; negative values match nothing
   * @return regex fragment
   * @throws IllegalArgumentException if {@code n} exceeds {@link #MAX_VALUE}
   */
  public static String lessOrEqual(long n) {
    if (n < 0) {
      return RegexFragments.CONTRADICTION;
    }
    checkInDomain(n);

    char[] digits = Long.toString(n).toCharArray();
    int width = digits.length;
    List<String> alternatives = new ArrayList<>(width * 2);

    // Any number with fewer digits is smaller
    for (int shorter = 1; shorter < width; shorter++) {
      alternatives.add(anyDigits(shorter));
    }

    for (int i = 0; i < width; i++) {
      int digit = digits[i] - '0';
      String prefix = new String(digits, 0, i);
      int remaining = width - i - 1;

      if (remaining == 0) {
        alternatives.add(prefix + digitsUpTo(digit));
      } else if (digit > 0) {
        alternatives.add(prefix + digitsUpTo(digit - 1) + anyDigits(remaining));
      }
    }

    return RegexFragments.alternation(alternatives);
  }

  /**
   * Fragment matching every integer in the closed interval {@code [lo, hi]}.
   *
   * <p>The interval is split by digit count, then each same-width interval is split at its first
   * differing digit into a low edge, a free middle and a high edge.
   *
   * @param lo inclusive lower bound (negative values are treated as 0)
   * @param hi inclusive upper bound
   * @return regex fragment; {@link RegexFragments#CONTRADICTION} if the interval is empty
   * @throws IllegalArgumentException if {@code hi} exceeds {@link #MAX_VALUE}
   */
  public static String between(long lo, long hi) {
    long from = Math.max(lo, 0);
    if (from > hi) {
      return RegexFragments.CONTRADICTION;
    }
    checkInDomain(hi);

    int fromWidth = digitCount(from);
    int toWidth = digitCount(hi);
    List<String> alternatives = new ArrayList<>();

    for (int width = fromWidth; width <= toWidth; width++) {
      long low = width == fromWidth ? from : POWERS_OF_TEN[width - 1];
      long high = width == toWidth ? hi : POWERS_OF_TEN[width] - 1;
      sameWidth(Long.toString(low), Long.toString(high), "", alternatives);
    }

    return RegexFragments.alternation(alternatives);
  }

  /** Appends alternatives covering {@code [from, to]}, both strings of equal length. */
  private static void sameWidth(String from, String to, String prefix, List<String> out) {
    int width = from.length();
    int common = 0;
    while (common < width && from.charAt(common) == to.charAt(common)) {
      common++;
    }
    if (common == width) {
      out.add(prefix + from);
      return;
    }

    String head = prefix + from.substring(0, common);
    int lowDigit = from.charAt(common) - '0';
    int highDigit = to.charAt(common) - '0';
    String fromTail = from.substring(common + 1);
    String toTail = to.substring(common + 1);
    int rest = fromTail.length();

    if (rest == 0) {
      out.add(head + digitClass(lowDigit, highDigit));
      return;
    }

    boolean fromFloor = isRepeated(fromTail, '0');
    boolean toCeiling = isRepeated(toTail, '9');
    int middleLow = fromFloor ? lowDigit : lowDigit + 1;
    int middleHigh = toCeiling ? highDigit : highDigit - 1;

    if (!fromFloor) {
      sameWidth(fromTail, "9".repeat(rest), head + lowDigit, out);
    }
    if (middleLow <= middleHigh) {
      out.add(head + digitClass(middleLow, middleHigh) + anyDigits(rest));
    }
    if (!toCeiling) {
      sameWidth("0".repeat(rest), toTail, head + highDigit, out);
    }
  }

  private static void checkInDomain(long n) {
    if (n > MAX_VALUE) {
      throw new IllegalArgumentException(
          "Threshold " + n + " exceeds maximum supported value " + MAX_VALUE);
    }
  }

  private static int digitCount(long n) {
    return Long.toString(n).length();
  }

  private static boolean isRepeated(String s, char c) {
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) != c) {
        return false;
      }
    }
    return true;
  }

  private static String digitsFrom(int digit) {
    return digitClass(digit, 9);
  }

  private static String digitsUpTo(int digit) {
    return digitClass(0, digit);
  }

  private static String digitClass(int low, int high) {
    if (low == high) {
      return Integer.toString(low);
    }
    if (low == 0 && high == 9) {
      return "\\d";
    }
    return "[" + low + "-" + high + "]";
  }

  private static String anyDigits(int count) {
    return count == 1 ? "\\d" : "\\d{" + count + "}";
  }
}
