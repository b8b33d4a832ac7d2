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

package com.axonops.versionregex.dialect;

/**
 * A pattern compiled by a {@link RegexDialect}.
 *
 * <p>Implementations are immutable and thread-safe.
 *
 * @since 1.0.0
 */
public interface CompiledRegex {

  /** The source pattern. */
  String pattern();

  /** The dialect that compiled this pattern. */
  RegexDialect dialect();

  /**
   * Tests whether the whole input matches.
   *
   * @param input candidate text
   * @return true if the entire input matches
   */
  boolean matches(CharSequence input);
}
