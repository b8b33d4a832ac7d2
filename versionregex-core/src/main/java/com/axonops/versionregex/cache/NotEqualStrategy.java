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

package com.axonops.versionregex.cache;

/**
 * How {@code !=} constraints are handled on a dialect without negative lookahead.
 *
 * @since 1.0.0
 */
public enum NotEqualStrategy {

  /** Fail with {@link com.axonops.versionregex.api.DialectUnsupportedException}. */
  REJECT,

  /**
   * Compile two patterns, any version and the exact version, and accept a candidate that matches
   * the first but not the second. Only {@link com.axonops.versionregex.api.VersionPattern} can
   * apply this; {@code toRegex} still fails since no single pattern exists.
   */
  NEGATED_MATCH
}
