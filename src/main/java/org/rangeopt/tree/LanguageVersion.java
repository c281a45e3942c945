/*
 * Copyright 2025 The Rangeopt Authors
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

package org.rangeopt.tree;

import com.google.common.base.Preconditions;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The version of the source language being compiled. Every rule whose behavior depends on the
 * language version is a method here, so that analyses take the version as an ordinary parameter
 * rather than consulting global state.
 */
public final class LanguageVersion implements Comparable<LanguageVersion> {

  public static final LanguageVersion V2_6 = new LanguageVersion(2, 6);
  public static final LanguageVersion V2_7 = new LanguageVersion(2, 7);
  public static final LanguageVersion V3_8 = new LanguageVersion(3, 8);

  /** The system property read by {@link #fromSystemProperty}. */
  public static final String PROPERTY = "rangeopt.languageVersion";

  private static final Pattern VERSION_PATTERN = Pattern.compile("(\\d+)\\.(\\d+)");

  public final int major;
  public final int minor;

  private LanguageVersion(int major, int minor) {
    this.major = major;
    this.minor = minor;
  }

  public static LanguageVersion of(int major, int minor) {
    Preconditions.checkArgument(major >= 0 && minor >= 0, "Bad version %s.%s", major, minor);
    return new LanguageVersion(major, minor);
  }

  /** Parses a version of the form {@code "major.minor"}. */
  public static LanguageVersion parse(String s) {
    Matcher m = VERSION_PATTERN.matcher(s.trim());
    Preconditions.checkArgument(m.matches(), "Bad version \"%s\"", s);
    return of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
  }

  /** Returns the version named by the {@value #PROPERTY} system property, or 2.7 if it is unset. */
  public static LanguageVersion fromSystemProperty() {
    String s = System.getProperty(PROPERTY);
    return (s == null) ? V2_7 : parse(s);
  }

  /**
   * True if this version has distinct eager (materializing) and lazy range builtins; later versions
   * only have the lazy one.
   */
  public boolean hasEagerRange() {
    return major < 3;
  }

  /** The name of the lazy range builtin in this version. */
  public String lazyRangeName() {
    return hasEagerRange() ? "xrange" : "range";
  }

  /**
   * True if a floating-point constant passed to the eager range builtin goes through an observable
   * coercion (and may therefore have a side effect or raise).
   */
  public boolean coercesFloatRangeArguments() {
    return compareTo(V2_7) >= 0;
  }

  @Override
  public int compareTo(LanguageVersion other) {
    return (major != other.major)
        ? Integer.compare(major, other.major)
        : Integer.compare(minor, other.minor);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof LanguageVersion other && major == other.major && minor == other.minor;
  }

  @Override
  public int hashCode() {
    return major * 31 + minor;
  }

  @Override
  public String toString() {
    return major + "." + minor;
  }
}
