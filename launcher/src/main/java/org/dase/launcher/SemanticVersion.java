/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.dase.launcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.dase.launcher.CommandBuilderUtils.*;

/**
 * A dotted numeric version string, such as "3.5.1" or "1.3.0-rc1".
 * <p>
 * Versions compare component by component as numbers, so "1.2.0" sorts before "1.10.0". Missing
 * trailing components count as zero ("2.0" equals "2.0.0"). A version with a special suffix
 * (the part after the first '-') is a pre-release and sorts before the same version without one;
 * two suffixes compare as plain strings.
 */
final class SemanticVersion implements Comparable<SemanticVersion> {

  private static final Pattern VERSION_RE = Pattern.compile("(\\d+(?:\\.\\d+)*)(?:-(.+))?");

  private final String original;
  private final List<Integer> components;
  private final String special;

  private SemanticVersion(String original, List<Integer> components, String special) {
    this.original = original;
    this.components = components;
    this.special = special;
  }

  /**
   * Parses a version string. Leading "v" and surrounding whitespace are ignored.
   *
   * @throws IllegalArgumentException If the string is not a dotted numeric version.
   */
  static SemanticVersion parse(String version) {
    checkNotNull(version, "version");
    String trimmed = version.trim();
    if (trimmed.startsWith("v") || trimmed.startsWith("V")) {
      trimmed = trimmed.substring(1);
    }
    Matcher m = VERSION_RE.matcher(trimmed);
    checkArgument(m.matches(), "Invalid version string: '%s'.", version);

    List<Integer> parts = new ArrayList<>();
    for (String part : m.group(1).split("\\.")) {
      try {
        parts.add(Integer.parseInt(part));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
          String.format("Version component out of range in '%s'.", version), e);
      }
    }
    return new SemanticVersion(trimmed, Collections.unmodifiableList(parts), m.group(2));
  }

  /** Returns whether "a" is strictly lower than "b". */
  static boolean isLessThan(String a, String b) {
    return parse(a).compareTo(parse(b)) < 0;
  }

  boolean isPreRelease() {
    return special != null;
  }

  int component(int idx) {
    return idx < components.size() ? components.get(idx) : 0;
  }

  @Override
  public int compareTo(SemanticVersion other) {
    int len = Math.max(components.size(), other.components.size());
    for (int i = 0; i < len; i++) {
      int cmp = Integer.compare(component(i), other.component(i));
      if (cmp != 0) {
        return cmp;
      }
    }

    if (special == null) {
      return other.special == null ? 0 : 1;
    } else if (other.special == null) {
      return -1;
    }
    return special.compareTo(other.special);
  }

  @Override
  public boolean equals(Object o) {
    return (o instanceof SemanticVersion) && compareTo((SemanticVersion) o) == 0;
  }

  @Override
  public int hashCode() {
    // Trailing zeros do not change equality, so they must not change the hash either.
    int last = components.size();
    while (last > 0 && components.get(last - 1) == 0) {
      last--;
    }
    return Objects.hash(components.subList(0, last), special);
  }

  @Override
  public String toString() {
    return original;
  }

}
