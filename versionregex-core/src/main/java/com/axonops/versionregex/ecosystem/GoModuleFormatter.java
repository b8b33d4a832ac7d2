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

package com.axonops.versionregex.ecosystem;

import com.axonops.versionregex.core.RegexFragments;
import com.axonops.versionregex.core.VersionTriple;

/**
 * Go module versions, which carry a {@code v} tag: {@code v1.2.3}, {@code v1.2.3-beta}, {@code
 * v2.0.0+incompatible} and pseudo-versions such as {@code v0.0.0-20191109021931-daa7c04131f5}.
 *
 * <ul>
 *   <li>Pseudo-versions are matched literally.
 *   <li>A pinned pre-release matches itself and any longer pre-release starting with it, or none.
 *   <li>Without a pinned pre-release any pre-release is accepted.
 *   <li>Build metadata ({@code +incompatible}) is matched literally when present.
 * </ul>
 *
 * @since 1.0.0
 */
public final class GoModuleFormatter {

  private static final char TAG = 'v';
  private static final String PSEUDO_BASE = "0.0.0";
  private static final int PSEUDO_TIMESTAMP_LENGTH = 14;
  private static final int PSEUDO_REVISION_LENGTH = 12;

  private GoModuleFormatter() {
    // Utility class
  }

  public static boolean isGoModuleVersion(String version) {
    return version.length() > 1 && version.charAt(0) == TAG;
  }

  /**
   * Builds the anchored pattern for a tagged Go version.
   *
   * @param version literal starting with {@code v}
   * @return anchored pattern
   * @throws com.axonops.versionregex.api.VersionParseException if a numeric component is invalid
   */
  public static String toRegex(String version) {
    String untagged = version.substring(1);
    if (isPseudoVersion(untagged)) {
      return RegexFragments.START + RegexFragments.quote(version) + RegexFragments.END;
    }

    String build = "";
    int plus = untagged.indexOf('+');
    if (plus != -1) {
      build = untagged.substring(plus);
      untagged = untagged.substring(0, plus);
    }

    String preRelease = "";
    int dash = untagged.indexOf('-');
    if (dash != -1) {
      preRelease = untagged.substring(dash + 1);
      untagged = untagged.substring(0, dash);
    }

    StringBuilder pattern = new StringBuilder(RegexFragments.START).append(TAG);
    String[] parts = untagged.split("\\.", -1);
    for (int i = 0; i < parts.length; i++) {
      VersionTriple.parseComponent(version, VersionTriple.componentName(i), parts[i]);
      if (i > 0) {
        pattern.append(RegexFragments.DOT);
      }
      pattern.append(parts[i]);
    }

    if (dash != -1) {
      pattern.append("(?:-").append(RegexFragments.quote(preRelease)).append(".*)?");
    } else {
      pattern.append(RegexFragments.PRE_RELEASE);
    }
    pattern.append(RegexFragments.quote(build));

    return pattern.append(RegexFragments.END).toString();
  }

  /** {@code 0.0.0-<yyyymmddhhmmss>-<12 char revision>} */
  static boolean isPseudoVersion(String untagged) {
    String[] parts = untagged.split("-");
    return parts.length >= 3
        && PSEUDO_BASE.equals(parts[0])
        && parts[1].length() == PSEUDO_TIMESTAMP_LENGTH
        && parts[2].length() == PSEUDO_REVISION_LENGTH;
  }
}
