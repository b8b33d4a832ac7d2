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

/**
 * Thrown when an operator symbol is not one of the supported {@link Operator}s.
 *
 * @since 1.0.0
 */
public final class UnsupportedOperatorException extends VersionRegexException {

  private final String operator;

  public UnsupportedOperatorException(String operator) {
    super("VersionRegex: Unsupported operator: '" + operator + "'");
    this.operator = operator;
  }

  public String getOperator() {
    return operator;
  }
}
