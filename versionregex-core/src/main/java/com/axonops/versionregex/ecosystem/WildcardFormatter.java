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
import java.util.ArrayList;
import java.util.List;

/**
 * Versions with {@code *} components, e.g. {@code 1.2.*} or {@code 1.*}.
 *
 * <p>Each {@code *} matches any number. A trailing {@code *} also stands for the components after
 * it, so {@code 1.*} matches {@code 1.4.2}.
 *
 * @since 1.0.0
 */
public final class WildcardFormatter {

  private static final String WILDCARD = "*";

  private WildcardFormatter() {
    // Utility class
  }

  public static boolean isWildcard(String version) {
    return version.contains(WILDCARD);
  }

  /**
   * Builds the anchored pattern for a wildcard version.
   *
   * @param version literal containing {@code *} components
   * @return anchored pattern
   * @throws com.axonops.versionregex.api.VersionParseException if a component is neither {@code
   *     *} nor a number
   */
  public static String toRegex(String version) {
    String[] parts = version.split("\\.", -1);
    List<String> fragments = new ArrayList<>(Math.max(parts.length, 3));

    for (int i = 0; i < parts.length; i++) {
      if (WILDCARD.equals(parts[i])) {
        fragments.add(RegexFragments.DIGITS);
      } else {
        VersionTriple.parseComponent(version, VersionTriple.componentName(i), parts[i]);
        fragments.add(parts[i]);
      }
    }

    if (WILDCARD.equals(parts[parts.length - 1])) {
      while (fragments.size() < 3) {
        fragments.add(RegexFragments.DIGITS);
      }
    }

    return RegexFragments.START
        + String.join(RegexFragments.DOT, fragments)
        + RegexFragments.SUFFIX
        + RegexFragments.END;
  }
}
