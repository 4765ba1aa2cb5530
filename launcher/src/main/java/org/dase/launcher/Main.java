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
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import static org.dase.launcher.CommandBuilderUtils.*;

/**
 * Command line interface for the launcher. Used internally by the "bin/dase-class" script.
 */
class Main {

  private static final Logger LOG = Logger.getLogger(Main.class.getName());

  /**
   * Usage: Main [class] [class args]
   * <p>
   * This class works in tandem with the "bin/dase-class" script to execute the final command.
   * <p>
   * On Unix-like systems, the output is a list of command arguments, separated by the NULL
   * character. On Windows, the output is a command line suitable for direct execution from the
   * script. Nothing is written to stdout when the launch fails; the exit code is then 1.
   */
  public static void main(String[] argsArray) {
    int exitCode = run(Arrays.asList(argsArray), System.getenv(), System.out, System.err);
    System.out.flush();
    if (exitCode != 0) {
      System.exit(exitCode);
    }
  }

  static int run(
      List<String> argList,
      Map<String, String> launcherEnv,
      PrintStream out,
      PrintStream err) {
    if (argList.isEmpty()) {
      err.println("Error: Not enough arguments: missing class name.");
      printUsage(err);
      return 1;
    }

    List<String> args = new ArrayList<>(argList);
    String className = args.remove(0);
    if (className.equals("--help") || className.equals("-h")) {
      printUsage(err);
      return 0;
    }

    ClassCommandBuilder builder = new ClassCommandBuilder(className, args, launcherEnv);
    Map<String, String> env = new LinkedHashMap<>();
    List<String> cmd;
    try {
      cmd = builder.buildCommand(env);
    } catch (IllegalArgumentException | IllegalStateException e) {
      LOG.log(Level.FINE, "Launch of " + className + " failed.", e);
      err.println("Error: " + e.getMessage());
      return 1;
    } catch (IOException e) {
      LOG.log(Level.FINE, "Launch of " + className + " failed.", e);
      err.println("Error: I/O failure while preparing the launch of " + className + ": " +
        e.getMessage());
      return 1;
    }

    if (!isEmpty(launcherEnv.get("DASE_PRINT_LAUNCH_COMMAND"))) {
      err.println("DASE Command: " + join(" ", cmd));
      err.println("========================================");
    }

    if (isWindows()) {
      out.println(prepareWindowsCommand(cmd, env));
    } else {
      // In bash, use NULL as the arg separator since it cannot be used in an argument.
      for (String c : prepareBashCommand(cmd, env)) {
        out.print(c);
        out.print('\0');
      }
    }
    return 0;
  }

  private static void printUsage(PrintStream err) {
    err.println(
      "Usage: dase-class <class> [class args]\n" +
      "\n" +
      "Runs <class> on the toolkit classpath with the Spark installation it was built for.\n" +
      "\n" +
      "Environment:\n" +
      "  DASE_HOME                  Toolkit installation (default: derived from the launcher jar).\n" +
      "  DASE_CONF_DIR              Configuration directory (default: $DASE_HOME/conf).\n" +
      "  SPARK_HOME                 Spark installation (default: $DASE_HOME/vendors/spark-*).\n" +
      "  JAVA_HOME                  Java installation (default: 'java' on the PATH).\n" +
      "  JAVA_OPTS                  Extra options for the java command.\n" +
      "  DASE_DRIVER_MEMORY         Max heap of the launched JVM (Default: " + DEFAULT_MEM + ").\n" +
      "  DASE_MIN_SPARK_VERSION     Lowest accepted Spark version (Default: " +
        SparkInstallation.MIN_SPARK_VERSION + ").\n" +
      "  DASE_PRINT_LAUNCH_COMMAND  Print the final command to stderr.\n");
  }

  /**
   * Prepare a command line for execution from a Windows batch script.
   *
   * The method quotes all arguments so that spaces are handled as expected. Quotes within arguments
   * are "double quoted" (which is batch for escaping a quote).
   */
  private static String prepareWindowsCommand(List<String> cmd, Map<String, String> childEnv) {
    StringBuilder cmdline = new StringBuilder();
    for (Map.Entry<String, String> e : childEnv.entrySet()) {
      cmdline.append(String.format("set %s=%s", e.getKey(), e.getValue()));
      cmdline.append(" && ");
    }
    for (String arg : cmd) {
      cmdline.append(quoteForBatchScript(arg));
      cmdline.append(" ");
    }
    return cmdline.toString();
  }

  /**
   * Prepare the command for execution from a bash script. The final command will have commands to
   * set up any needed environment variables needed by the child process.
   */
  static List<String> prepareBashCommand(List<String> cmd, Map<String, String> childEnv) {
    if (childEnv.isEmpty()) {
      return cmd;
    }

    List<String> newCmd = new ArrayList<>();
    newCmd.add("env");

    for (Map.Entry<String, String> e : childEnv.entrySet()) {
      newCmd.add(String.format("%s=%s", e.getKey(), e.getValue()));
    }
    newCmd.addAll(cmd);
    return newCmd;
  }

}
