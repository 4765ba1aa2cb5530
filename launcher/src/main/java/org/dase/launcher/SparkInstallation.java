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

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.dase.launcher.CommandBuilderUtils.*;

/**
 * A Spark installation, and the checks the launcher runs against it.
 * <p>
 * The installed version is read from the first line of the RELEASE file that Spark distributions
 * ship ("Spark 3.5.1 built for Hadoop 3.3.4"). Build trees have no RELEASE file, so the version is
 * then taken from the spark-core jar name.
 */
class SparkInstallation {

  /** Lowest Spark version the engines are built against. */
  static final String MIN_SPARK_VERSION = "3.0.0";

  private static final Pattern RELEASE_RE = Pattern.compile("^\\s*Spark\\s+(\\S+)");
  // Skips classifier jars such as "-tests" and "-sources".
  private static final Pattern CORE_JAR_RE =
    Pattern.compile("spark-core_[0-9.]+-(\\d[^-]*(?:-SNAPSHOT)?)\\.jar");

  private final File home;

  SparkInstallation(String home) {
    checkNotNull(home, "home");
    this.home = new File(home);
    checkState(this.home.isDirectory(), "Spark home '%s' is not a directory.", home);
  }

  String getHome() {
    return home.getAbsolutePath();
  }

  /** The "jars" directory of the installation, or null when there is none. */
  String getJarsDir() {
    File jars = new File(home, "jars");
    return jars.isDirectory() ? jars.getAbsolutePath() : null;
  }

  /**
   * Returns the installed Spark version.
   *
   * @throws IllegalStateException If the version cannot be determined.
   */
  String getVersion() throws IOException {
    String version = versionFromReleaseFile();
    if (version == null) {
      version = versionFromCoreJar();
    }
    checkState(version != null,
      "Cannot determine the version of the Spark installation at %s.", getHome());
    return version;
  }

  /**
   * Fails when the installed version is lower than the given minimum.
   *
   * @throws IllegalStateException If the installed version does not meet the minimum.
   */
  void checkMinimumVersion(String minVersion) throws IOException {
    String version = getVersion();
    checkState(!SemanticVersion.isLessThan(version, minVersion),
      "You have Apache Spark %s at %s which does not meet the minimum version requirement " +
      "of %s.", version, getHome(), minVersion);
  }

  private String versionFromReleaseFile() throws IOException {
    File release = new File(home, "RELEASE");
    if (!release.isFile()) {
      return null;
    }
    try (BufferedReader br = new BufferedReader(new InputStreamReader(
        new FileInputStream(release), StandardCharsets.UTF_8))) {
      String first = br.readLine();
      if (first == null) {
        return null;
      }
      Matcher m = RELEASE_RE.matcher(first);
      return m.find() ? m.group(1) : null;
    }
  }

  private String versionFromCoreJar() {
    String jarsDir = getJarsDir();
    if (jarsDir == null) {
      return null;
    }
    String[] names = new File(jarsDir).list();
    if (names == null) {
      return null;
    }
    for (String name : names) {
      Matcher m = CORE_JAR_RE.matcher(name);
      if (m.matches()) {
        return m.group(1);
      }
    }
    return null;
  }

}
