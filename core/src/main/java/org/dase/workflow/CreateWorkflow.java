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

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import org.apache.spark.api.java.JavaSparkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.dase.controller.Engine;
import org.dase.controller.EngineInstance;
import org.dase.controller.EngineParams;

/**
 * Trains an engine and saves its models.
 * <p>
 * Usage: CreateWorkflow --engine-json FILE --model-dir DIR [--master URL] [--conf K=V] [--verbose]
 * <p>
 * The model directory receives one sub-directory per configured algorithm, and a copy of the
 * engine configuration that {@link QueryWorkflow} falls back to.
 */
public final class CreateWorkflow {

  private static final Logger LOG = LoggerFactory.getLogger(CreateWorkflow.class);

  static final String ENGINE_JSON = "engine.json";

  public static void main(String[] args) {
    int exitCode = run(Arrays.asList(args), System.out, System.err);
    if (exitCode != 0) {
      System.exit(exitCode);
    }
  }

  static int run(List<String> argList, PrintStream out, PrintStream err) {
    WorkflowArguments args;
    File engineJson;
    File modelDir;
    EngineConfig config;
    try {
      args = new WorkflowArguments(argList);
      if (args.help) {
        printUsage(err);
        return 0;
      }
      engineJson = new File(args.require(args.engineJson, "--engine-json"));
      modelDir = new File(args.require(args.modelDir, "--model-dir"));
      config = EngineConfig.load(engineJson);
    } catch (IllegalArgumentException e) {
      err.println("Error: " + e.getMessage());
      printUsage(err);
      return 1;
    } catch (IOException e) {
      err.println("Error: Cannot read the engine configuration: " + e.getMessage());
      return 1;
    }

    if (args.verbose) {
      err.println("Engine: " + config.getId() + " (" + config.getEngineFactory() + ")");
      err.println("Model directory: " + modelDir.getAbsolutePath());
    }

    try (JavaSparkContext sc = WorkflowContext.create("dase-train-" + config.getId(), args)) {
      train(sc, config, engineJson, modelDir);
    } catch (IOException | RuntimeException e) {
      LOG.error("Training of engine {} failed.", config.getId(), e);
      err.println("Error: Training failed: " + e.getMessage());
      return 1;
    }
    out.println("Models of engine " + config.getId() + " saved to " + modelDir.getAbsolutePath());
    return 0;
  }

  /**
   * Trains the configured engine, then saves its models and the configuration under the model
   * directory, which must be empty or not exist yet.
   */
  static void train(JavaSparkContext sc, EngineConfig config, File engineJson, File modelDir)
      throws IOException {
    if (modelDir.exists() && !modelDir.isDirectory()) {
      throw new IllegalArgumentException(String.format(
        "Model directory %s is not a directory.", modelDir.getAbsolutePath()));
    }
    String[] existing = modelDir.list();
    if (existing != null && existing.length > 0) {
      throw new IllegalArgumentException(String.format(
        "Model directory %s is not empty.", modelDir.getAbsolutePath()));
    }

    Engine<?, ?, ?, ?, ?> engine = config.createEngine();
    EngineParams params = config.toEngineParams(engine);
    LOG.info("Training engine {} with {}", config.getId(), params);
    EngineInstance<?, ?> instance = engine.train(sc, params);

    Files.createDirectories(modelDir.toPath());
    instance.save(sc, modelDir.getAbsolutePath());
    Files.copy(engineJson.toPath(), new File(modelDir, ENGINE_JSON).toPath());
    LOG.info("Saved {} model(s) to {}", instance.getModels().size(), modelDir.getAbsolutePath());
  }

  private static void printUsage(PrintStream err) {
    err.println(
      "Usage: CreateWorkflow --engine-json FILE --model-dir DIR [options]\n" +
      "\n" +
      "Options:\n" +
      "  --master URL      Spark master (Default: spark.master, or " +
        WorkflowContext.DEFAULT_MASTER + ").\n" +
      "  --conf K=V        Spark configuration property.\n" +
      "  --verbose, -v     Print the engine being trained.\n" +
      "  --help, -h        Print this help.");
  }

  private CreateWorkflow() { }

}
