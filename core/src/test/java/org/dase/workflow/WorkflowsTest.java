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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import org.dase.controller.SumEngine;

import static org.junit.jupiter.api.Assertions.*;
import static org.dase.workflow.QueryWorkflowTest.newStream;

/**
 * Runs the workflows the way the command line does; each run starts and stops its own context.
 */
public class WorkflowsTest {

  @TempDir
  Path tempDir;

  private File engineJson;
  private File modelDir;
  private final ByteArrayOutputStream out = new ByteArrayOutputStream();
  private final ByteArrayOutputStream err = new ByteArrayOutputStream();

  @BeforeEach
  public void setUp() throws IOException {
    engineJson = tempDir.resolve("engine.json").toFile();
    Files.write(engineJson.toPath(),
      EngineConfigTest.SUM_ENGINE_JSON.getBytes(StandardCharsets.UTF_8));
    modelDir = tempDir.resolve("models").toFile();
  }

  @Test
  public void testTrainThenQuery() {
    assertEquals(0, train(), errors());
    assertTrue(new File(modelDir, "0-sum").isDirectory());
    assertTrue(new File(modelDir, "1-sum").isDirectory());
    assertTrue(new File(modelDir, CreateWorkflow.ENGINE_JSON).isFile());

    out.reset();
    ByteArrayInputStream in = new ByteArrayInputStream(
      "1\nnot a number\n2\n".getBytes(StandardCharsets.UTF_8));
    int exitCode = QueryWorkflow.run(
      Arrays.asList("--model-dir", modelDir.getAbsolutePath(), "--master", "local[2]"),
      in, newStream(out), newStream(err));

    // Offsets 1 and 0 over 1 + 2 + 3 + 4: the serving keeps 10 + q + 1.
    assertEquals(0, exitCode, errors());
    assertEquals(String.format("12%n13%n"), out.toString(StandardCharsets.UTF_8));
    assertTrue(errors().contains("not a number"), errors());
  }

  @Test
  public void testSingleQuery() {
    assertEquals(0, train(), errors());
    out.reset();
    int exitCode = QueryWorkflow.run(Arrays.asList("--model-dir", modelDir.getAbsolutePath(),
        "--engine-json", engineJson.getAbsolutePath(), "--query", "5", "--master", "local[2]"),
      new ByteArrayInputStream(new byte[0]), newStream(out), newStream(err));
    assertEquals(0, exitCode, errors());
    assertEquals(String.format("16%n"), out.toString(StandardCharsets.UTF_8));
  }

  @Test
  public void testTrainIntoNonEmptyModelDir() throws IOException {
    Files.createDirectories(modelDir.toPath());
    Files.write(modelDir.toPath().resolve("old"), new byte[0]);
    assertEquals(1, train());
    assertTrue(errors().contains("not empty"), errors());
  }

  @Test
  public void testTrainIntoRegularFile() throws IOException {
    Files.write(modelDir.toPath(), new byte[0]);
    assertEquals(1, train());
    assertTrue(errors().contains("is not a directory"), errors());
    assertTrue(modelDir.isFile());
  }

  @Test
  public void testMissingOptions() {
    assertEquals(1, CreateWorkflow.run(Arrays.asList("--engine-json", "engine.json"),
      newStream(out), newStream(err)));
    assertTrue(errors().contains("--model-dir"), errors());
    assertTrue(errors().contains("Usage: CreateWorkflow"), errors());

    assertEquals(1, QueryWorkflow.run(Collections.emptyList(),
      new ByteArrayInputStream(new byte[0]), newStream(out), newStream(err)));
    assertEquals(1, EvaluationWorkflow.run(Collections.emptyList(), newStream(out),
      newStream(err)));
    assertEquals(0, CreateWorkflow.run(Arrays.asList("--help"), newStream(out),
      newStream(err)));
  }

  @Test
  public void testQueryWithoutModels() {
    int exitCode = QueryWorkflow.run(Arrays.asList("--model-dir", modelDir.getAbsolutePath(),
        "--engine-json", engineJson.getAbsolutePath(), "--query", "1", "--master", "local[2]"),
      new ByteArrayInputStream(new byte[0]), newStream(out), newStream(err));
    assertEquals(1, exitCode);
    assertTrue(errors().contains("No model found"), errors());
  }

  @Test
  public void testEvaluation() {
    int exitCode = EvaluationWorkflow.run(Arrays.asList(
        "--evaluation", SumEngine.SumEvaluation.class.getName(), "--master", "local[2]"),
      newStream(out), newStream(err));
    assertEquals(0, exitCode, errors());
    String report = out.toString(StandardCharsets.UTF_8);
    assertTrue(report.contains("Best ExactMatch: 1.0 with " + SumEngine.params(4, 0)), report);
  }

  @Test
  public void testUnknownEvaluation() {
    assertEquals(1, EvaluationWorkflow.run(Arrays.asList("--evaluation", "no.Such"),
      newStream(out), newStream(err)));
    assertEquals(1, EvaluationWorkflow.run(Arrays.asList("--evaluation", "java.lang.Object"),
      newStream(out), newStream(err)));
  }

  private int train() {
    return CreateWorkflow.run(Arrays.asList("--engine-json", engineJson.getAbsolutePath(),
      "--model-dir", modelDir.getAbsolutePath(), "--master", "local[2]"),
      newStream(out), newStream(err));
  }

  private String errors() {
    return err.toString(StandardCharsets.UTF_8);
  }

}
