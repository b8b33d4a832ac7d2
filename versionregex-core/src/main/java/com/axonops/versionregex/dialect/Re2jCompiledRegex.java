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

import com.google.re2j.Pattern;

/** {@link CompiledRegex} backed by RE2/J. */
final class Re2jCompiledRegex implements CompiledRegex {

  private final Pattern pattern;

  Re2jCompiledRegex(Pattern pattern) {
    this.pattern = pattern;
  }

  @Override
  public String pattern() {
    return pattern.pattern();
  }

  @Override
  public RegexDialect dialect() {
    return RegexDialect.RE2;
  }

  @Override
  public boolean matches(CharSequence input) {
    return pattern.matcher(input).matches();
  }

  @Override
  public String toString() {
    return "RE2:" + pattern.pattern();
  }
}
