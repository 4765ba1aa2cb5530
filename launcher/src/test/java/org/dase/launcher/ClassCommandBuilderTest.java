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

import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

import static org.dase.launcher.CommandBuilderUtils.*;

public class ClassCommandBuilderTest extends LauncherTestBase {

  private static final String CLASS_NAME = "org.dase.workflow.CreateWorkflow";

  @Test
  public void testCommandLayout() throws Exception {
    Map<String, String> childEnv = new HashMap<>();
    List<String> cmd = newBuilder("--engine-json", "engine.json").buildCommand(childEnv);

    assertEquals(java.getAbsolutePath(), cmd.get(0));
    assertEquals(Arrays.asList(CLASS_NAME, "--engine-json", "engine.json"),
      cmd.subList(cmd.size() - 3, cmd.size()));
    assertTrue(cmd.containsAll(JvmModuleOptions.defaultModuleOptionList()));
    assertTrue(cmd.contains("-Xmx" + DEFAULT_MEM));

    List<String> cp = classPath(cmd);
    assertEquals(new File(daseHome, "conf").getAbsolutePath() + File.separator, cp.get(0));
    assertTrue(cp.contains(join(File.separator, new File(daseHome, "lib").getAbsolutePath(), "*")));
    assertTrue(cp.contains(join(File.separator, new File(sparkHome, "jars").getAbsolutePath(),
      "*")));

    assertEquals(daseHome.getAbsolutePath(), childEnv.get("DASE_HOME"));
    assertEquals(sparkHome.getAbsolutePath(), childEnv.get("SPARK_HOME"));
  }

  @Test
  public void testJavaOptions() throws Exception {
    env.put("JAVA_OPTS", "-Dfoo=bar -Xmx4g");
    writeFile(new File(daseHome, "conf/java-opts"), "-Dfrom.file=1\n");

    List<String> cmd = newBuilder().buildCommand(new HashMap<>());
    assertTrue(cmd.contains("-Dfoo=bar"));
    assertTrue(cmd.contains("-Dfrom.file=1"));
    assertTrue(cmd.contains("-Xmx4g"));
    assertFalse(cmd.contains("-Xmx" + DEFAULT_MEM));
  }

  @Test
  public void testDefaultsFile() throws Exception {
    File extra = new File(tempDir.toFile(), "extra.jar");
    writeFile(new File(daseHome, "conf/" + DEFAULT_PROPERTIES_FILE),
      ClassCommandBuilder.DRIVER_MEMORY + " = 3g \n" +
      ClassCommandBuilder.DRIVER_EXTRA_CLASSPATH + "=" + extra.getAbsolutePath() + "\n" +
      ClassCommandBuilder.DRIVER_EXTRA_JAVA_OPTIONS + "=-Da=b '-Dc=d e'\n");

    List<String> cmd = newBuilder().buildCommand(new HashMap<>());
    assertTrue(cmd.contains("-Xmx3g"));
    assertTrue(cmd.contains("-Da=b"));
    assertTrue(cmd.contains("-Dc=d e"));
    assertTrue(classPath(cmd).contains(extra.getAbsolutePath()));

    // The environment wins over the defaults file.
    env.put("DASE_DRIVER_MEMORY", "5g");
    assertTrue(newBuilder().buildCommand(new HashMap<>()).contains("-Xmx5g"));
  }

  @Test
  public void testExtraClassPathEntries() throws Exception {
    File hadoopConf = newDir("hadoop-conf");
    env.put("HADOOP_CONF_DIR", hadoopConf.getAbsolutePath());
    env.put("DASE_CLASSPATH_PREPEND", "/first.jar");
    env.put("DASE_EXTRA_CLASSPATH", "/last.jar" + File.pathSeparator + "/first.jar");

    List<String> cp = classPath(newBuilder().buildCommand(new HashMap<>()));
    assertEquals("/first.jar", cp.get(0));
    assertEquals("/last.jar", cp.get(cp.size() - 1));
    assertEquals(1, Collections.frequency(cp, "/first.jar"));
    assertTrue(cp.contains(hadoopConf.getAbsolutePath() + File.separator));
  }

  @Test
  public void testSparkFromVendorsDirectory() throws Exception {
    env.remove("SPARK_HOME");
    File vendored = newDir("dase", "vendors", "spark-3.5.1-bin-hadoop3");
    writeFile(new File(vendored, "RELEASE"), "Spark 3.5.1 built for Hadoop 3.3.4\n");

    Map<String, String> childEnv = new HashMap<>();
    newBuilder().buildCommand(childEnv);
    assertEquals(vendored.getAbsolutePath(), childEnv.get("SPARK_HOME"));

    newDir("dase", "vendors", "spark-3.4.0-bin-hadoop3");
    IllegalStateException e = assertThrows(IllegalStateException.class,
      () -> newBuilder().buildCommand(new HashMap<>()));
    assertTrue(e.getMessage().contains("set SPARK_HOME"), e.getMessage());
  }

  @Test
  public void testMissingSpark() {
    env.remove("SPARK_HOME");
    IllegalStateException e = assertThrows(IllegalStateException.class,
      () -> newBuilder().buildCommand(new HashMap<>()));
    assertTrue(e.getMessage().startsWith("Spark home not found"), e.getMessage());
  }

  @Test
  public void testMinimumSparkVersionOverride() throws Exception {
    env.put("DASE_MIN_SPARK_VERSION", "4.0.0");
    IllegalStateException e = assertThrows(IllegalStateException.class,
      () -> newBuilder().buildCommand(new HashMap<>()));
    assertTrue(e.getMessage().contains("minimum version requirement of 4.0.0"), e.getMessage());

    env.remove("DASE_MIN_SPARK_VERSION");
    writeFile(new File(daseHome, "conf/" + DEFAULT_PROPERTIES_FILE),
      ClassCommandBuilder.SPARK_MIN_VERSION + "=3.5.0\n");
    assertEquals("3.5.0", newBuilder().getMinSparkVersion());
  }

  @Test
  public void testMissingLibDirectory() throws Exception {
    assertTrue(new File(daseHome, "lib").delete());
    IllegalStateException e = assertThrows(IllegalStateException.class,
      () -> newBuilder().buildCommand(new HashMap<>()));
    assertTrue(e.getMessage().startsWith("Library directory"), e.getMessage());
  }

  @Test
  public void testClasspathHelper() throws Exception {
    assumeFalse(isWindows());
    installClasspathHelper(
      "echo \"$DASE_HOME/custom.jar" + File.pathSeparator + "/opt/other.jar\"\n" +
      "echo 'using custom classpath' >&2\n");

    List<String> cp = classPath(newBuilder().buildCommand(new HashMap<>()));
    assertEquals(Arrays.asList(new File(daseHome, "custom.jar").getAbsolutePath(),
      "/opt/other.jar"), cp);
  }

  @Test
  public void testFailingClasspathHelper() throws Exception {
    assumeFalse(isWindows());
    installClasspathHelper("echo 'partial output'\necho 'HBASE_CONF_DIR is missing' >&2\nexit 3\n");

    IllegalStateException e = assertThrows(IllegalStateException.class,
      () -> newBuilder().buildCommand(new HashMap<>()));
    assertTrue(e.getMessage().contains("partial output"), e.getMessage());
    assertTrue(e.getMessage().contains("HBASE_CONF_DIR is missing"), e.getMessage());
    assertTrue(e.getMessage().contains("exited with code 3"), e.getMessage());
  }

  private ClassCommandBuilder newBuilder(String... args) {
    return new ClassCommandBuilder(CLASS_NAME, Arrays.asList(args), env);
  }

  private static List<String> classPath(List<String> cmd) {
    int idx = cmd.indexOf("-cp");
    assertTrue(idx >= 0, "No classpath in " + cmd);
    return Arrays.asList(cmd.get(idx + 1).split(File.pathSeparator));
  }

}
