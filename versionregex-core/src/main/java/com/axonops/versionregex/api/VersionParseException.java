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
 * Thrown when a version literal cannot be parsed, e.g. a non-numeric component.
 *
 * @since 1.0.0
 */
public final class VersionParseException extends VersionRegexException {

  private final String literal;
  private final String component;
  private final String invalidText;

  public VersionParseException(String literal, String component, String invalidText, String reason) {
    super(
        "VersionRegex: Invalid "
            + component
            + " '"
            + invalidText
            + "' in version '"
            + literal
            + "': "
            + reason);
    this.literal = literal;
    this.component = component;
    this.invalidText = invalidText;
  }

  public VersionParseException(String literal, String component, String reason) {
    this(literal, component, literal, reason);
  }

  /** The whole literal being parsed. */
  public String getLiteral() {
    return literal;
  }

  /** Which part failed: {@code major}, {@code minor}, {@code patch}, {@code range}, ... */
  public String getComponent() {
    return component;
  }

  /** The offending substring. */
  public String getInvalidText() {
    return invalidText;
  }
}
