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

import com.axonops.versionregex.api.PatternCompilationException;

/**
 * Regular-expression engines that generated patterns can target.
 *
 * <p>All generated patterns use standard syntax (alternation, character classes, counted
 * repetition, backslash escapes) that both engines accept. The only dialect-conditional construct
 * is the negative lookahead used by the not-equal operator, which RE2 rejects by design (it
 * guarantees linear-time matching).
 *
 * @since 1.0.0
 */
public enum RegexDialect {

  /** {@link java.util.regex.Pattern}: backtracking engine with lookaround. */
  JAVA(true) {
    @Override
    public CompiledRegex compile(String pattern) {
      try {
        return new JdkCompiledRegex(java.util.regex.Pattern.compile(pattern));
      } catch (java.util.regex.PatternSyntaxException e) {
        throw new PatternCompilationException(pattern, e.getDescription(), e);
      }
    }
  },

  /** RE2 semantics via RE2/J: linear-time matching, no lookaround. */
  RE2(false) {
    @Override
    public CompiledRegex compile(String pattern) {
      try {
        return new Re2jCompiledRegex(com.google.re2j.Pattern.compile(pattern));
      } catch (com.google.re2j.PatternSyntaxException e) {
        throw new PatternCompilationException(pattern, e.getMessage(), e);
      }
    }
  };

  private final boolean lookahead;

  RegexDialect(boolean lookahead) {
    this.lookahead = lookahead;
  }

  /** Whether {@code (?!...)} / {@code (?=...)} are supported. */
  public boolean supportsLookahead() {
    return lookahead;
  }

  /**
   * Compiles a pattern with this dialect's engine.
   *
   * @param pattern regex source
   * @return compiled pattern
   * @throws PatternCompilationException if the engine rejects the pattern
   */
  public abstract CompiledRegex compile(String pattern);
}
