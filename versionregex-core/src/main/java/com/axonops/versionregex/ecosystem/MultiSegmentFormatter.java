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
import java.util.List;

/**
 * .NET / NuGet style versions: four numeric segments ({@code 1.0.0.0}) or a NuGet pre-release
 * label ({@code 2.1.0-preview1}).
 *
 * @since 1.0.0
 */
public final class MultiSegmentFormatter {

  private static final int SEGMENTS = 4;

  private static final List<String> PRE_RELEASE_LABELS =
      List.of("-alpha", "-beta", "-rc", "-preview");

  /** Optional NuGet pre-release, e.g. {@code -beta2} or {@code -rc.1}. */
  static final String OPTIONAL_PRE_RELEASE = "(?:-(?:alpha|beta|rc|preview)(?:\\d+)?(?:\\.\\d+)?)?";

  private MultiSegmentFormatter() {
    // Utility class
  }

  public static boolean isMultiSegmentVersion(String version) {
    // Count only the numeric part: build metadata may contain dots
    return VersionTriple.stripSuffix(version).split("\\.", -1).length == SEGMENTS
        || hasPreReleaseLabel(version);
  }

  static boolean hasPreReleaseLabel(String version) {
    for (String label : PRE_RELEASE_LABELS) {
      if (version.contains(label)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Builds the anchored pattern for a multi-segment version.
   *
   * @param version literal such as {@code 1.0.0.0} or {@code 1.0.0-beta}
   * @return anchored pattern
   * @throws com.axonops.versionregex.api.VersionParseException if a segment is not numeric
   */
  public static String toRegex(String version) {
    String main = version;
    String build = "";
    int plus = main.indexOf('+');
    if (plus != -1) {
      build = main.substring(plus);
      main = main.substring(0, plus);
    }

    String preRelease = "";
    int dash = main.indexOf('-');
    if (dash != -1) {
      preRelease = main.substring(dash);
      main = main.substring(0, dash);
    }

    StringBuilder pattern = new StringBuilder(RegexFragments.START);
    String[] parts = main.split("\\.", -1);
    for (int i = 0; i < parts.length; i++) {
      VersionTriple.parseComponent(version, VersionTriple.componentName(i), parts[i]);
      if (i > 0) {
        pattern.append(RegexFragments.DOT);
      }
      pattern.append(parts[i]);
    }

    if (preRelease.isEmpty()) {
      pattern.append(OPTIONAL_PRE_RELEASE);
    } else {
      pattern.append(RegexFragments.quote(preRelease));
    }
    if (build.isEmpty()) {
      pattern.append(RegexFragments.BUILD_METADATA);
    } else {
      pattern.append(RegexFragments.quote(build));
    }

    return pattern.append(RegexFragments.END).toString();
  }
}
