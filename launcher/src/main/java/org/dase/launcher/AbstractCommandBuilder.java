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
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import static org.dase.launcher.CommandBuilderUtils.*;

/**
 * Abstract command builder that defines the functionality shared by launchers: locating the
 * toolkit, Spark and Java installations, and reading the defaults file.
 */
abstract class AbstractCommandBuilder {

  private static final Logger LOG = Logger.getLogger(AbstractCommandBuilder.class.getName());

  private final Map<String, String> launcherEnv;

  // Cached to avoid reading the defaults file multiple times.
  private Map<String, String> effectiveConfig;

  AbstractCommandBuilder(Map<String, String> launcherEnv) {
    this.launcherEnv = launcherEnv;
  }

  /**
   * Builds the command to execute.
   *
   * @param env A map collecting environment variables that must be exported to the child process.
   *            Implementations add the variables downstream scripts rely on, such as DASE_HOME.
   */
  abstract List<String> buildCommand(Map<String, String> env)
      throws IOException, IllegalArgumentException;

  /**
   * Builds a list of arguments to run java: the java executable, any options listed in the
   * "java-opts" file of the configuration directory, and the given classpath.
   * <p>
   * Callers should still add at least the class to run, as well as any arguments to pass to the
   * class.
   */
  List<String> buildJavaCommand(List<String> classPath) throws IOException {
    List<String> cmd = new ArrayList<>();
    cmd.add(findJavaExecutable());

    File javaOpts = new File(getConfDir(), "java-opts");
    if (javaOpts.isFile()) {
      try (BufferedReader br = new BufferedReader(new InputStreamReader(
          new FileInputStream(javaOpts), StandardCharsets.UTF_8))) {
        String line;
        while ((line = br.readLine()) != null) {
          addOptionString(cmd, line);
        }
      }
    }

    cmd.add("-cp");
    cmd.add(join(File.pathSeparator, classPath));
    return cmd;
  }

  void addOptionString(List<String> cmd, String options) {
    if (!isEmpty(options)) {
      cmd.addAll(parseOptionString(options));
    }
  }

  /**
   * Finds the java executable: JAVA_HOME when it is set (and then it must point at a real
   * installation), otherwise the first "java" found on the PATH.
   */
  String findJavaExecutable() {
    String home = getenv(ENV_JAVA_HOME);
    if (home != null) {
      File java = new File(join(File.separator, home, "bin", javaExecutableName()));
      checkState(java.isFile(), "JAVA_HOME is set to '%s' but '%s' does not exist.", home,
        java.getAbsolutePath());
      return java.getAbsolutePath();
    }

    String path = getenv("PATH");
    if (!isEmpty(path)) {
      for (String dir : path.split(Pattern.quote(File.pathSeparator))) {
        if (isEmpty(dir)) {
          continue;
        }
        File candidate = new File(dir, javaExecutableName());
        if (candidate.isFile() && candidate.canExecute()) {
          LOG.fine(() -> "Using java found on PATH: " + candidate);
          return candidate.getAbsolutePath();
        }
      }
    }
    throw new IllegalStateException(
      "Cannot find a Java runtime; set JAVA_HOME or add 'java' to the PATH.");
  }

  /**
   * Returns the toolkit home. When DASE_HOME is not set, the home is derived from the launcher jar
   * when it sits in the "lib" directory of a distribution.
   */
  String getDaseHome() {
    String path = getenv(ENV_DASE_HOME);
    if (path == null) {
      path = homeFromLauncherJar();
    }
    checkState(path != null,
      "DASE home not found; set it explicitly or use the DASE_HOME environment variable.");
    return path;
  }

  /**
   * Returns the Spark installation directory: SPARK_HOME, or else the only "spark-*" directory
   * under the "vendors" directory of the toolkit home.
   */
  String getSparkHome() {
    String path = getenv(ENV_SPARK_HOME);
    if (path != null) {
      return path;
    }

    File vendors = new File(getDaseHome(), "vendors");
    File[] candidates = vendors.listFiles(f -> f.isDirectory() && f.getName().startsWith("spark-"));
    checkState(candidates != null && candidates.length > 0,
      "Spark home not found; set the SPARK_HOME environment variable.");
    checkState(candidates.length == 1,
      "Found %d Spark installations under %s; set SPARK_HOME to pick one.",
      candidates.length, vendors.getAbsolutePath());
    return candidates[0].getAbsolutePath();
  }

  String getConfDir() {
    String confDir = getenv("DASE_CONF_DIR");
    return confDir != null ? confDir : join(File.separator, getDaseHome(), "conf");
  }

  String getenv(String key) {
    return firstNonEmpty(launcherEnv.get(key));
  }

  Map<String, String> getEffectiveConfig() throws IOException {
    if (effectiveConfig == null) {
      effectiveConfig = new HashMap<>();
      Properties p = loadPropertiesFile();
      p.stringPropertyNames().forEach(key -> effectiveConfig.put(key, p.getProperty(key)));
    }
    return effectiveConfig;
  }

  /** Loads dase-defaults.conf under the configuration directory, if it exists. */
  private Properties loadPropertiesFile() throws IOException {
    Properties props = new Properties();
    File propsFile = new File(getConfDir(), DEFAULT_PROPERTIES_FILE);
    if (propsFile.isFile()) {
      try (InputStreamReader isr = new InputStreamReader(
          new FileInputStream(propsFile), StandardCharsets.UTF_8)) {
        props.load(isr);
        for (Map.Entry<Object, Object> e : props.entrySet()) {
          e.setValue(e.getValue().toString().trim());
        }
      }
    }
    return props;
  }

  private static String homeFromLauncherJar() {
    CodeSource source = AbstractCommandBuilder.class.getProtectionDomain().getCodeSource();
    if (source == null) {
      return null;
    }
    try {
      File location = new File(source.getLocation().toURI());
      File parent = location.getParentFile();
      if (location.isFile() && parent != null && "lib".equals(parent.getName())) {
        return parent.getParentFile().getAbsolutePath();
      }
    } catch (URISyntaxException e) {
      LOG.log(Level.FINE, "Cannot resolve the launcher jar location.", e);
    }
    return null;
  }

}
