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

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import static org.dase.launcher.CommandBuilderUtils.*;

/**
 * Computes the classpath of a launched class.
 * <p>
 * A distribution may install a "bin/compute-classpath.sh" helper under the toolkit home; when it
 * is present and executable, whatever it prints on stdout is the classpath, and a non-zero exit
 * status aborts the launch with the helper's output. Without a helper the classpath is assembled
 * from the installation directories.
 */
class ClasspathResolver {

  private static final Logger LOG = Logger.getLogger(ClasspathResolver.class.getName());

  static final String HELPER_SCRIPT = "compute-classpath.sh";

  private final AbstractCommandBuilder builder;

  ClasspathResolver(AbstractCommandBuilder builder) {
    this.builder = builder;
  }

  /**
   * Returns the classpath with one entry per element. Directories carry a trailing separator, the
   * way <i>java.net.URLClassLoader</i> expects them.
   *
   * @throws IllegalStateException If the helper fails or the toolkit jars cannot be found.
   */
  List<String> resolve(SparkInstallation spark, String extraClassPath) throws IOException {
    File helper = new File(join(File.separator, builder.getDaseHome(), "bin", HELPER_SCRIPT));
    if (helper.isFile() && helper.canExecute()) {
      LOG.fine(() -> "Computing classpath with " + helper);
      return runHelper(helper, spark);
    }
    return scan(spark, extraClassPath);
  }

  private List<String> runHelper(File helper, SparkInstallation spark) throws IOException {
    ProcessBuilder pb = new ProcessBuilder(helper.getAbsolutePath());
    pb.environment().put(ENV_DASE_HOME, builder.getDaseHome());
    pb.environment().put(ENV_SPARK_HOME, spark.getHome());

    Process process = pb.start();
    StreamDrainer stderr = new StreamDrainer(process.getErrorStream());
    stderr.start();
    String stdout = readFully(process.getInputStream());

    int exitCode;
    try {
      exitCode = process.waitFor();
      stderr.join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroy();
      throw new IOException("Interrupted while computing the classpath.", e);
    }

    String errors = stderr.getOutput().trim();
    if (exitCode != 0) {
      List<String> lines = new ArrayList<>();
      if (!stdout.trim().isEmpty()) {
        lines.add(stdout.trim());
      }
      if (!errors.isEmpty()) {
        lines.add(errors);
      }
      lines.add(String.format("Failed to compute the classpath: %s exited with code %d.",
        helper.getAbsolutePath(), exitCode));
      throw new IllegalStateException(join(System.lineSeparator(), lines));
    }
    if (!errors.isEmpty()) {
      LOG.warning(errors);
    }

    Set<String> cp = new LinkedHashSet<>();
    addToClassPath(cp, stdout.trim());
    checkState(!cp.isEmpty(), "%s printed an empty classpath.", helper.getAbsolutePath());
    return new ArrayList<>(cp);
  }

  private List<String> scan(SparkInstallation spark, String extraClassPath) {
    Set<String> cp = new LinkedHashSet<>();
    addToClassPath(cp, builder.getenv("DASE_CLASSPATH_PREPEND"));
    addToClassPath(cp, builder.getConfDir());
    addToClassPath(cp, extraClassPath);

    String libDir = findLibDir(builder.getDaseHome(), true);
    addToClassPath(cp, join(File.separator, libDir, "*"));

    String sparkJars = spark.getJarsDir();
    if (sparkJars != null) {
      addToClassPath(cp, join(File.separator, sparkJars, "*"));
    }

    addToClassPath(cp, builder.getenv("HADOOP_CONF_DIR"));
    addToClassPath(cp, builder.getenv("YARN_CONF_DIR"));
    addToClassPath(cp, builder.getenv("HBASE_CONF_DIR"));
    addToClassPath(cp, builder.getenv("DASE_EXTRA_CLASSPATH"));
    return new ArrayList<>(cp);
  }

  /**
   * Adds entries to the classpath.
   *
   * @param cp Set to which the new entries are appended.
   * @param entries New classpath entries (separated by File.pathSeparator).
   */
  private static void addToClassPath(Set<String> cp, String entries) {
    if (isEmpty(entries)) {
      return;
    }
    for (String entry : entries.split(Pattern.quote(File.pathSeparator))) {
      String trimmed = entry.trim();
      if (!isEmpty(trimmed)) {
        if (new File(trimmed).isDirectory() && !trimmed.endsWith(File.separator)) {
          trimmed += File.separator;
        }
        cp.add(trimmed);
      }
    }
  }

  private static String readFully(InputStream in) throws IOException {
    ByteArrayOutputStream buf = new ByteArrayOutputStream();
    in.transferTo(buf);
    return buf.toString(StandardCharsets.UTF_8);
  }

  /** Reads a child's stderr on its own thread so a chatty helper cannot block on a full pipe. */
  private static class StreamDrainer extends Thread {

    private final InputStream in;
    private volatile String output = "";

    StreamDrainer(InputStream in) {
      super("classpath-helper-stderr");
      this.in = in;
      setDaemon(true);
    }

    @Override
    public void run() {
      try {
        output = readFully(in);
      } catch (IOException e) {
        LOG.log(Level.FINE, "Error reading classpath helper output.", e);
      }
    }

    String getOutput() {
      return output;
    }

  }

}
