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

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.dase.launcher.CommandBuilderUtils.*;

/**
 * Command builder for classes run on the toolkit classpath (workflows, tools, engine servers).
 * <p>
 * Before building the command it checks that a Java runtime exists and that the Spark
 * installation meets the minimum version. The toolkit and Spark homes are exported to the child
 * so that scripts it runs can find them.
 */
class ClassCommandBuilder extends AbstractCommandBuilder {

  /** Configuration key for the driver memory. */
  static final String DRIVER_MEMORY = "dase.driver.memory";
  /** Configuration key for extra driver VM options. */
  static final String DRIVER_EXTRA_JAVA_OPTIONS = "dase.driver.extraJavaOptions";
  /** Configuration key for extra driver class path entries. */
  static final String DRIVER_EXTRA_CLASSPATH = "dase.driver.extraClassPath";
  /** Configuration key overriding the minimum Spark version. */
  static final String SPARK_MIN_VERSION = "dase.spark.minVersion";

  private final String className;
  private final List<String> classArgs;

  ClassCommandBuilder(String className, List<String> classArgs, Map<String, String> launcherEnv) {
    super(launcherEnv);
    this.className = className;
    this.classArgs = classArgs;
  }

  @Override
  public List<String> buildCommand(Map<String, String> env)
      throws IOException, IllegalArgumentException {
    checkArgument(!isEmpty(className), "Not enough arguments: missing class name.");
    String daseHome = getDaseHome();

    // Resolve the runtime before anything else so a missing one is reported first.
    findJavaExecutable();

    SparkInstallation spark = new SparkInstallation(getSparkHome());
    spark.checkMinimumVersion(getMinSparkVersion());

    Map<String, String> config = getEffectiveConfig();
    List<String> classPath =
      new ClasspathResolver(this).resolve(spark, config.get(DRIVER_EXTRA_CLASSPATH));

    List<String> cmd = buildJavaCommand(classPath);
    cmd.addAll(JvmModuleOptions.defaultModuleOptionList());
    addOptionString(cmd, getenv("JAVA_OPTS"));
    addOptionString(cmd, config.get(DRIVER_EXTRA_JAVA_OPTIONS));

    // An explicit max heap in the java options wins over the memory settings.
    boolean hasMaxHeap = cmd.stream().anyMatch(opt -> opt.startsWith("-Xmx"));
    if (!hasMaxHeap) {
      String mem = firstNonEmpty(getenv("DASE_DRIVER_MEMORY"), config.get(DRIVER_MEMORY),
        DEFAULT_MEM);
      cmd.add("-Xmx" + mem);
    }

    cmd.add(className);
    cmd.addAll(classArgs);

    env.put(ENV_DASE_HOME, daseHome);
    env.put(ENV_SPARK_HOME, spark.getHome());
    return cmd;
  }

  String getMinSparkVersion() throws IOException {
    return firstNonEmpty(getenv("DASE_MIN_SPARK_VERSION"),
      getEffectiveConfig().get(SPARK_MIN_VERSION),
      SparkInstallation.MIN_SPARK_VERSION);
  }

}
