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

import java.util.Map;

import org.apache.spark.SparkConf;
import org.apache.spark.api.java.JavaSparkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the Spark context a workflow runs in.
 */
final class WorkflowContext {

  private static final Logger LOG = LoggerFactory.getLogger(WorkflowContext.class);

  static final String DEFAULT_MASTER = "local[*]";

  static JavaSparkContext create(String appName, WorkflowArguments args) {
    SparkConf conf = sparkConf(appName, args);
    LOG.info("Starting {} on {}", conf.get("spark.app.name"), conf.get("spark.master"));
    return new JavaSparkContext(conf);
  }

  /**
   * The configuration of the context: spark.* system properties, overridden by the --conf
   * options. The master is the --master option, else spark.master, else {@value #DEFAULT_MASTER}.
   */
  static SparkConf sparkConf(String appName, WorkflowArguments args) {
    SparkConf conf = new SparkConf();
    for (Map.Entry<String, String> e : args.conf.entrySet()) {
      conf.set(e.getKey(), e.getValue());
    }
    if (args.master != null) {
      conf.setMaster(args.master);
    } else if (!conf.contains("spark.master")) {
      conf.setMaster(DEFAULT_MASTER);
    }
    if (!conf.contains("spark.app.name")) {
      conf.setAppName(appName);
    }
    return conf;
  }

  private WorkflowContext() { }

}
