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

import java.util.Objects;

/**
 * Splits a raw constraint string into operator and version literal.
 *
 * <p>Leading {@code [} or {@code (} selects a Maven range. Otherwise the longest known operator
 * prefix is stripped; without one the constraint is an exact match.
 *
 * @since 1.0.0
 */
public final class ConstraintParser {

  private ConstraintParser() {
    // Utility class
  }

  /**
   * Parses a constraint such as {@code ">= 1.2.3"} or {@code "[1.0,2.0)"}.
   *
   * @param constraint raw constraint
   * @return operator and trimmed version literal
   */
  public static VersionConstraint parse(String constraint) {
    Objects.requireNonNull(constraint, "constraint cannot be null");
    String trimmed = constraint.trim();

    if (trimmed.startsWith("[") || trimmed.startsWith("(")) {
      return new VersionConstraint(Operator.MAVEN_RANGE, trimmed);
    }

    for (Operator operator : Operator.PREFIX_PRECEDENCE) {
      if (trimmed.startsWith(operator.symbol())) {
        return new VersionConstraint(
            operator, trimmed.substring(operator.symbol().length()).trim());
      }
    }

    return new VersionConstraint(Operator.EXACT, trimmed);
  }
}
