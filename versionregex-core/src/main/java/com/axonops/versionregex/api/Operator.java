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

import java.util.List;

/**
 * Closed set of version constraint operators.
 *
 * <ul>
 *   <li>{@link #EXACT}, {@link #EQUAL} - exact match (also the default without an operator)
 *   <li>{@link #GREATER_EQUAL}, {@link #LESS_EQUAL}, {@link #GREATER}, {@link #LESS} - comparisons
 *   <li>{@link #NOT_EQUAL} - anything but the given version (needs negative lookahead)
 *   <li>{@link #CARET} - npm caret, compatible within major (within minor for 0.x)
 *   <li>{@link #TILDE}, {@link #PESSIMISTIC}, {@link #COMPATIBLE} - npm tilde, Ruby {@code ~>},
 *       Python {@code ~=}: compatible within minor
 *   <li>{@link #MAVEN_RANGE} - bracketed Maven range such as {@code [1.0,2.0)}
 * </ul>
 *
 * @since 1.0.0
 */
public enum Operator {
  EXACT("=="),
  EQUAL("="),
  GREATER_EQUAL(">="),
  LESS_EQUAL("<="),
  GREATER(">"),
  LESS("<"),
  NOT_EQUAL("!="),
  CARET("^"),
  TILDE("~"),
  PESSIMISTIC("~>"),
  COMPATIBLE("~="),
  MAVEN_RANGE("maven-range");

  /**
   * Order in which prefixes are tried, so that two-character operators win over their
   * one-character prefixes.
   */
  static final List<Operator> PREFIX_PRECEDENCE =
      List.of(
          GREATER_EQUAL,
          LESS_EQUAL,
          NOT_EQUAL,
          EXACT,
          PESSIMISTIC,
          COMPATIBLE,
          GREATER,
          LESS,
          EQUAL,
          CARET,
          TILDE);

  private final String symbol;

  Operator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  /**
   * Looks up an operator by its symbol.
   *
   * @param symbol operator symbol, e.g. {@code ">="} or {@code "maven-range"}
   * @return the operator
   * @throws UnsupportedOperatorException if no operator has this symbol
   */
  public static Operator fromSymbol(String symbol) {
    for (Operator operator : values()) {
      if (operator.symbol.equals(symbol)) {
        return operator;
      }
    }
    throw new UnsupportedOperatorException(symbol);
  }
}
