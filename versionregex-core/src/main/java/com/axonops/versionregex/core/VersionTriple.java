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

import com.axonops.versionregex.api.VersionParseException;

/**
 * Numeric {@code major.minor.patch} of a version literal.
 *
 * <p>Missing trailing components default to 0, a pre-release or build tail is ignored, and
 * components after the third are ignored.
 *
 * @param major major component
 * @param minor minor component
 * @param patch patch component
 * @since 1.0.0
 */
public record VersionTriple(long major, long minor, long patch) {

  private static final String[] COMPONENT_NAMES = {"major", "minor", "patch"};

  public VersionTriple {
    checkComponent(major, "major");
    checkComponent(minor, "minor");
    checkComponent(patch, "patch");
  }

  /**
   * Parses the numeric part of a version literal.
   *
   * @param literal version literal such as {@code 1.2.3-beta+5}
   * @return parsed triple
   * @throws VersionParseException if a component is empty, not decimal, or too large
   */
  public static VersionTriple parse(String literal) {
    String numeric = stripSuffix(literal);
    String[] parts = numeric.split("\\.", -1);

    long[] values = new long[3];
    for (int i = 0; i < Math.min(parts.length, 3); i++) {
      values[i] = parseComponent(literal, COMPONENT_NAMES[i], parts[i]);
    }
    return new VersionTriple(values[0], values[1], values[2]);
  }

  /**
   * Parses one decimal version component.
   *
   * @param literal whole literal (for error reporting)
   * @param component component name (for error reporting)
   * @param text component text
   * @return component value
   * @throws VersionParseException if the text is not a decimal number within range
   */
  public static long parseComponent(String literal, String component, String text) {
    if (text.isEmpty()) {
      throw new VersionParseException(literal, component, text, "component is empty");
    }
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c < '0' || c > '9') {
        throw new VersionParseException(literal, component, text, "not a decimal number");
      }
    }
    // Long.parseLong overflows beyond 18 digits
    if (text.length() > 18) {
      throw new VersionParseException(literal, component, text, "too many digits");
    }
    long value = Long.parseLong(text);
    if (value > DigitRangeSynthesizer.MAX_VALUE) {
      throw new VersionParseException(
          literal, component, text, "exceeds " + DigitRangeSynthesizer.MAX_VALUE);
    }
    return value;
  }

  /**
   * Removes a pre-release ({@code -...}) or build ({@code +...}) tail.
   *
   * @param literal version literal
   * @return numeric part
   */
  public static String stripSuffix(String literal) {
    int end = literal.length();
    int dash = literal.indexOf('-');
    if (dash != -1) {
      end = dash;
    }
    int plus = literal.indexOf('+');
    if (plus != -1 && plus < end) {
      end = plus;
    }
    return literal.substring(0, end);
  }

  /**
   * Name of the component at a position, for error messages.
   *
   * @param index zero-based position in a dotted literal
   * @return {@code major}, {@code minor}, {@code patch}, {@code revision} or {@code segment N}
   */
  public static String componentName(int index) {
    if (index < COMPONENT_NAMES.length) {
      return COMPONENT_NAMES[index];
    }
    return index == 3 ? "revision" : "segment " + (index + 1);
  }

  /** Components as an array, major first. */
  long[] components() {
    return new long[] {major, minor, patch};
  }

  private static void checkComponent(long value, String name) {
    if (value < 0 || value > DigitRangeSynthesizer.MAX_VALUE) {
      throw new IllegalArgumentException(
          name + " must be between 0 and " + DigitRangeSynthesizer.MAX_VALUE + ": " + value);
    }
  }

  @Override
  public String toString() {
    return major + "." + minor + "." + patch;
  }
}
