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

package org.dase.workflow;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the command line options of the workflows.
 * <p>
 * This class holds the single list of options shared by the workflows; each workflow then checks
 * that the options it needs were given.
 */
class WorkflowOptionParser {

  protected final String CONF = "--conf";
  protected final String ENGINE_JSON = "--engine-json";
  protected final String EVALUATION = "--evaluation";
  protected final String MASTER = "--master";
  protected final String MODEL_DIR = "--model-dir";
  protected final String QUERY = "--query";

  protected final String HELP = "--help";
  protected final String VERBOSE = "--verbose";

  /**
   * The options taking a value. Each entry in the array contains the different aliases for the
   * same option; the first element of each entry is the "official" name of the option, passed to
   * {@link #handle(String, String)}.
   * <p>
   * These two arrays are visible for tests.
   */
  final String[][] opts = {
    { CONF, "-c" },
    { ENGINE_JSON },
    { EVALUATION },
    { MASTER },
    { MODEL_DIR },
    { QUERY },
  };

  /**
   * List of switches (command line options that do not take parameters).
   */
  final String[][] switches = {
    { HELP, "-h" },
    { VERBOSE, "-v" },
  };

  /**
   * Parse a list of workflow command line options.
   *
   * @throws IllegalArgumentException If an error is found during parsing.
   */
  protected final void parse(List<String> args) {
    Pattern eqSeparatedOpt = Pattern.compile("(--[^=]+)=(.+)");

    int idx;
    for (idx = 0; idx < args.size(); idx++) {
      String arg = args.get(idx);
      String value = null;

      Matcher m = eqSeparatedOpt.matcher(arg);
      if (m.matches()) {
        arg = m.group(1);
        value = m.group(2);
      }

      String name = findCliOption(arg, opts);
      if (name != null) {
        if (value == null) {
          if (idx == args.size() - 1) {
            throw new IllegalArgumentException(
                String.format("Missing argument for option '%s'.", arg));
          }
          idx++;
          value = args.get(idx);
        }
        if (!handle(name, value)) {
          break;
        }
        continue;
      }

      name = findCliOption(arg, switches);
      if (name != null) {
        if (value != null) {
          throw new IllegalArgumentException(
              String.format("Option '%s' does not take a value.", arg));
        }
        if (!handle(name, null)) {
          break;
        }
        continue;
      }

      if (!handleUnknown(arg)) {
        break;
      }
    }

    if (idx < args.size()) {
      idx++;
    }
    handleExtraArgs(args.subList(Math.min(idx, args.size()), args.size()));
  }

  /**
   * Callback for when an option is parsed.
   *
   * @param opt The long name of the cli option (might differ from actual command line).
   * @param value The value. This will be <i>null</i> if the option does not take a value.
   * @return Whether to continue parsing the argument list.
   */
  protected boolean handle(String opt, String value) {
    throw new UnsupportedOperationException();
  }

  /**
   * Callback for when an unrecognized option is parsed.
   *
   * @param opt Unrecognized option from the command line.
   * @return Whether to continue parsing the argument list.
   */
  protected boolean handleUnknown(String opt) {
    throw new UnsupportedOperationException();
  }

  /**
   * Callback for remaining command line arguments after either {@link #handle(String, String)} or
   * {@link #handleUnknown(String)} return "false". This will be called at the end of parsing even
   * when there are no remaining arguments.
   *
   * @param extra List of remaining arguments.
   */
  protected void handleExtraArgs(List<String> extra) {
    throw new UnsupportedOperationException();
  }

  private String findCliOption(String name, String[][] available) {
    for (String[] candidates : available) {
      for (String candidate : candidates) {
        if (candidate.equals(name)) {
          return candidates[0];
        }
      }
    }
    return null;
  }

}
