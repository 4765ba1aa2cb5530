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
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.bridge.SLF4JBridgeHandler;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Handles configuring the JUL -> SLF4J bridge, and lays out a fake toolkit, Spark and Java
 * installation under a temporary directory for each test.
 */
abstract class LauncherTestBase {

  static {
    SLF4JBridgeHandler.removeHandlersForRootLogger();
    SLF4JBridgeHandler.install();
  }

  @TempDir
  Path tempDir;

  File daseHome;
  File sparkHome;
  File javaHome;
  File java;
  Map<String, String> env;

  @BeforeEach
  public void setUpInstallation() throws IOException {
    daseHome = newDir("dase");
    newDir("dase", "lib");
    newDir("dase", "conf");

    sparkHome = newDir("spark");
    newDir("spark", "jars");
    writeFile(new File(sparkHome, "RELEASE"), "Spark 3.5.1 built for Hadoop 3.3.4\n");

    javaHome = newDir("jdk");
    java = writeFile(new File(newDir("jdk", "bin"), CommandBuilderUtils.javaExecutableName()),
      "#!/bin/sh\n");
    assertTrue(java.setExecutable(true));

    env = new HashMap<>();
    env.put("DASE_HOME", daseHome.getAbsolutePath());
    env.put("SPARK_HOME", sparkHome.getAbsolutePath());
    env.put("JAVA_HOME", javaHome.getAbsolutePath());
  }

  File newDir(String... path) throws IOException {
    return Files.createDirectories(tempDir.resolve(String.join(File.separator, path))).toFile();
  }

  static File writeFile(File file, String contents) throws IOException {
    Files.createDirectories(file.getParentFile().toPath());
    Files.writeString(file.toPath(), contents, StandardCharsets.UTF_8);
    return file;
  }

  /** Installs an executable classpath helper script with the given body. */
  File installClasspathHelper(String body) throws IOException {
    File helper = writeFile(
      new File(newDir("dase", "bin"), ClasspathResolver.HELPER_SCRIPT), "#!/bin/sh\n" + body);
    assertTrue(helper.setExecutable(true));
    return helper;
  }

  static PrintStream newStream(ByteArrayOutputStream buf) {
    return new PrintStream(buf, true, StandardCharsets.UTF_8);
  }

}
