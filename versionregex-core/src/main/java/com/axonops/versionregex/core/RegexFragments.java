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

import java.util.List;

/**
 * Shared regular-expression fragments used to assemble version patterns.
 *
 * <p>Every fragment is self-contained: it can be concatenated with any other fragment without
 * changing its meaning. Only constructs understood by both java.util.regex and RE2 are used
 * (alternation, character classes, counted repetition, word-boundary assertions).
 *
 * @since 1.0.0
 */
public final class RegexFragments {

  public static final String START = "^";
  public static final String END = "$";
  public static final String OR = "|";

  /** One or more ASCII digits (any version component). */
  public static final String DIGITS = "\\d+";

  /** Literal dot separating version components. */
  public static final String DOT = "\\.";

  /** Optional pre-release tag, e.g. {@code -beta.1}. */
  public static final String PRE_RELEASE = "(?:-[a-zA-Z0-9\\-\\.]+)?";

  /** Optional build-metadata tag, e.g. {@code +build.5}. */
  public static final String BUILD_METADATA = "(?:\\+[a-zA-Z0-9\\-\\.]+)?";

  /** Optional pre-release followed by optional build metadata. */
  public static final String SUFFIX = PRE_RELEASE + BUILD_METADATA;

  /** {@code major.minor.patch} with unconstrained components. */
  public static final String VERSION_CORE = DIGITS + DOT + DIGITS + DOT + DIGITS;

  /**
   * Matches nothing: a position cannot be both a word boundary and not a word boundary. Used where
   * a bound admits no value (e.g. "less than 0").
   */
  public static final String CONTRADICTION = "\\b\\B";

  /** Any full semantic version. */
  public static final String ANY_VERSION = START + VERSION_CORE + SUFFIX + END;

  /** Anchored pattern that matches no input at all. */
  public static final String NEVER_MATCHES = START + CONTRADICTION + END;

  /** Loose version shape (one to three components) used as the not-equal body. */
  public static final String LOOSE_VERSION = DIGITS + "(?:\\.\\d+)?(?:\\.\\d+)?" + SUFFIX;

  private static final String META_CHARACTERS = "\\.+*?()|[]{}^$";

  private RegexFragments() {
    // Utility class
  }

  /**
   * Escapes regex metacharacters so the text matches literally.
   *
   * <p>Uses plain backslash escapes rather than {@code \Q...\E} so the result is valid in every
   * supported dialect.
   *
   * @param text literal text
   * @return escaped text
   */
  public static String quote(String text) {
    StringBuilder sb = new StringBuilder(text.length() + 8);
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (META_CHARACTERS.indexOf(c) >= 0) {
        sb.append('\\');
      }
      sb.append(c);
    }
    return sb.toString();
  }

  /**
   * Joins alternatives into one fragment.
   *
   * <p>No alternatives yields {@link #CONTRADICTION}; a single alternative is returned bare;
   * several are wrapped in a non-capturing group.
   *
   * @param alternatives fragments to join
   * @return combined fragment
   */
  public static String alternation(List<String> alternatives) {
    if (alternatives.isEmpty()) {
      return CONTRADICTION;
    }
    if (alternatives.size() == 1) {
      return alternatives.get(0);
    }
    return "(?:" + String.join(OR, alternatives) + ")";
  }

  /**
   * Wraps a boundary body into a complete anchored version pattern.
   *
   * @param body alternation of version clauses (may be {@link #CONTRADICTION})
   * @return anchored pattern; {@link #NEVER_MATCHES} for a contradiction body
   */
  public static String anchoredVersion(String body) {
    if (CONTRADICTION.equals(body)) {
      return NEVER_MATCHES;
    }
    return START + "(?:" + body + ")" + SUFFIX + END;
  }
}
