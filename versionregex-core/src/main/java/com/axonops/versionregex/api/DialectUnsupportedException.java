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

import com.axonops.versionregex.dialect.RegexDialect;

/**
 * Thrown when a constraint needs a regex feature the target dialect does not have.
 *
 * <p>Currently raised for {@link Operator#NOT_EQUAL} on dialects without negative lookahead (RE2).
 * See {@link com.axonops.versionregex.cache.VersionRegexConfig#notEqualStrategy()} for the
 * alternative.
 *
 * @since 1.0.0
 */
public final class DialectUnsupportedException extends VersionRegexException {

  private final String constraint;
  private final RegexDialect dialect;
  private final String feature;

  public DialectUnsupportedException(String constraint, RegexDialect dialect, String feature) {
    super(
        "VersionRegex: Constraint '"
            + constraint
            + "' requires "
            + feature
            + ", which the "
            + dialect
            + " dialect does not support");
    this.constraint = constraint;
    this.dialect = dialect;
    this.feature = feature;
  }

  public String getConstraint() {
    return constraint;
  }

  public RegexDialect getDialect() {
    return dialect;
  }

  public String getFeature() {
    return feature;
  }
}
