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

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.spark.api.java.JavaSparkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.dase.controller.Engine;
import org.dase.controller.EngineInstance;
import org.dase.controller.EngineParams;

/**
 * Answers queries with the models saved by {@link CreateWorkflow}.
 * <p>
 * Usage: QueryWorkflow --model-dir DIR [--engine-json FILE] [--query JSON] [--master URL]
 * <p>
 * Without --query, every non-blank line of stdin is a JSON query, and the JSON result of each is
 * written to stdout on its own line. A query that cannot be answered is reported on stderr and
 * the following lines are still processed.
 */
public final class QueryWorkflow {

  private static final Logger LOG = LoggerFactory.getLogger(QueryWorkflow.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static void main(String[] args) {
    int exitCode = run(Arrays.asList(args), System.in, System.out, System.err);
    System.out.flush();
    if (exitCode != 0) {
      System.exit(exitCode);
    }
  }

  static int run(List<String> argList, InputStream in, PrintStream out, PrintStream err) {
    WorkflowArguments args;
    File modelDir;
    EngineConfig config;
    try {
      args = new WorkflowArguments(argList);
      if (args.help) {
        printUsage(err);
        return 0;
      }
      modelDir = new File(args.require(args.modelDir, "--model-dir"));
      File engineJson = args.engineJson != null
        ? new File(args.engineJson)
        : new File(modelDir, CreateWorkflow.ENGINE_JSON);
      config = EngineConfig.load(engineJson);
    } catch (IllegalArgumentException e) {
      err.println("Error: " + e.getMessage());
      printUsage(err);
      return 1;
    } catch (IOException e) {
      err.println("Error: Cannot read the engine configuration: " + e.getMessage());
      return 1;
    }

    Engine<?, ?, ?, ?, ?> engine;
    EngineParams params;
    try {
      engine = config.createEngine();
      params = config.toEngineParams(engine);
    } catch (IllegalArgumentException | IllegalStateException e) {
      err.println("Error: " + e.getMessage());
      return 1;
    }

    try (JavaSparkContext sc = WorkflowContext.create("dase-query-" + config.getId(), args)) {
      return serve(sc, engine, params, modelDir, args.query, in, out, err);
    } catch (IOException | RuntimeException e) {
      LOG.error("Serving of engine {} failed.", config.getId(), e);
      err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  private static <TD, PD, Q, P, A> int serve(
      JavaSparkContext sc,
      Engine<TD, PD, Q, P, A> engine,
      EngineParams params,
      File modelDir,
      String query,
      InputStream in,
      PrintStream out,
      PrintStream err) throws IOException {
    EngineInstance<Q, P> instance = engine.load(sc, params, modelDir.getAbsolutePath());
    if (query != null) {
      try {
        out.println(answer(instance, engine.getQueryClass(), query));
        return 0;
      } catch (IllegalArgumentException e) {
        err.println("Error: " + e.getMessage());
        return 1;
      }
    }

    BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    int failed = answerAll(instance, engine.getQueryClass(), reader, out, err);
    if (failed > 0) {
      LOG.warn("{} queries could not be answered.", failed);
    }
    return 0;
  }

  /**
   * Answers every non-blank line of the reader.
   *
   * @return The number of queries that could not be answered.
   */
  static <Q, P> int answerAll(
      EngineInstance<Q, P> instance,
      Class<Q> queryClass,
      BufferedReader in,
      PrintStream out,
      PrintStream err) throws IOException {
    int failed = 0;
    String line;
    while ((line = in.readLine()) != null) {
      if (line.trim().isEmpty()) {
        continue;
      }
      try {
        out.println(answer(instance, queryClass, line));
      } catch (IllegalArgumentException e) {
        LOG.debug("Cannot answer query {}", line, e);
        err.println("Error: " + e.getMessage());
        failed++;
      }
    }
    out.flush();
    return failed;
  }

  /**
   * @return The JSON result of a JSON query.
   * @throws IllegalArgumentException If the query is malformed or cannot be answered.
   */
  static <Q, P> String answer(EngineInstance<Q, P> instance, Class<Q> queryClass, String json) {
    Q query;
    try {
      query = MAPPER.readValue(json, queryClass);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(String.format("Invalid query '%s': %s", json,
        e.getOriginalMessage()), e);
    }

    P result;
    try {
      result = instance.predict(query);
    } catch (RuntimeException e) {
      throw new IllegalArgumentException(String.format("Cannot answer query '%s': %s", json,
        e.getMessage()), e);
    }

    try {
      return MAPPER.writeValueAsString(result);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize the result " + result, e);
    }
  }

  private static void printUsage(PrintStream err) {
    err.println(
      "Usage: QueryWorkflow --model-dir DIR [options]\n" +
      "\n" +
      "Reads one JSON query per line from stdin unless --query is given.\n" +
      "\n" +
      "Options:\n" +
      "  --engine-json FILE  Engine configuration (Default: the copy in the model directory).\n" +
      "  --query JSON        Answer a single query.\n" +
      "  --master URL        Spark master (Default: spark.master, or " +
        WorkflowContext.DEFAULT_MASTER + ").\n" +
      "  --conf K=V          Spark configuration property.\n" +
      "  --help, -h          Print this help.");
  }

  private QueryWorkflow() { }

}
