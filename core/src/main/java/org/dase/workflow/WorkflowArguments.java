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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The parsed command line of a workflow.
 */
class WorkflowArguments extends WorkflowOptionParser {

  String engineJson;
  String modelDir;
  String master;
  String query;
  String evaluationClass;
  final Map<String, String> conf = new LinkedHashMap<>();
  boolean verbose;
  boolean help;

  WorkflowArguments(List<String> args) {
    parse(args);
  }

  /**
   * @throws IllegalArgumentException If the option was not given.
   */
  String require(String value, String opt) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException(String.format("Missing required option '%s'.", opt));
    }
    return value;
  }

  @Override
  protected boolean handle(String opt, String value) {
    switch (opt) {
      case CONF:
        String[] setConf = value.split("=", 2);
        if (setConf.length != 2 || setConf[0].isEmpty()) {
          throw new IllegalArgumentException(String.format("Invalid argument to %s: %s", CONF,
            value));
        }
        conf.put(setConf[0], setConf[1]);
        break;
      case ENGINE_JSON:
        engineJson = value;
        break;
      case EVALUATION:
        evaluationClass = value;
        break;
      case MASTER:
        master = value;
        break;
      case MODEL_DIR:
        modelDir = value;
        break;
      case QUERY:
        query = value;
        break;
      case HELP:
        help = true;
        break;
      case VERBOSE:
        verbose = true;
        break;
      default:
        throw new IllegalStateException("Unexpected option: " + opt);
    }
    return true;
  }

  @Override
  protected boolean handleUnknown(String opt) {
    if (opt.startsWith("-")) {
      throw new IllegalArgumentException(String.format("Unrecognized option '%s'.", opt));
    }
    throw new IllegalArgumentException(String.format("Unexpected argument '%s'.", opt));
  }

  @Override
  protected void handleExtraArgs(List<String> extra) {
    if (!extra.isEmpty()) {
      throw new IllegalArgumentException("Unexpected arguments: " + extra);
    }
  }

}
