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
 * A parsed version constraint: an operator and the version literal it applies to.
 *
 * <p>For {@link Operator#MAVEN_RANGE} the version is the whole bracketed range, e.g. {@code
 * [1.0,2.0)}.
 *
 * @param operator constraint operator
 * @param version version literal (may carry a pre-release or build suffix)
 * @since 1.0.0
 */
public record VersionConstraint(Operator operator, String version) {

  public VersionConstraint {
    Objects.requireNonNull(operator, "operator cannot be null");
    Objects.requireNonNull(version, "version cannot be null");
  }

  /**
   * Creates a constraint from an operator symbol.
   *
   * @param operatorSymbol symbol such as {@code "^"} or {@code "maven-range"}
   * @param version version literal
   * @return the constraint
   * @throws UnsupportedOperatorException if the symbol is unknown
   */
  public static VersionConstraint of(String operatorSymbol, String version) {
    return new VersionConstraint(Operator.fromSymbol(operatorSymbol), version);
  }

  @Override
  public String toString() {
    return operator == Operator.MAVEN_RANGE ? version : operator.symbol() + version;
  }
}
