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

package org.dase.controller;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.api.java.JavaSparkContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import org.dase.SharedSparkContext;

import static org.junit.jupiter.api.Assertions.*;

public class EngineTest extends SharedSparkContext {

  @TempDir
  transient Path tempDir;

  private final transient Engine<JavaRDD<Integer>, JavaRDD<Integer>, Integer, Integer, Integer>
    engine = SumEngine.create();

  @Test
  public void testTrainAndPredict() {
    EngineInstance<Integer, Integer> instance = engine.train(jsc, SumEngine.params(4, 0, 2));
    assertEquals(List.of(10, 10), instance.getModels());
    // The serving picks the larger of 10 + 3 + 0 and 10 + 3 + 2.
    assertEquals(15, instance.predict(3));
  }

  @Test
  public void testUnknownAlgorithm() {
    EngineParams params = SumEngine.params(4).toBuilder()
      .addAlgorithmParams("bayes", EmptyParams.INSTANCE)
      .build();
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
      () -> engine.train(jsc, params));
    assertTrue(e.getMessage().contains("bayes"), e.getMessage());
  }

  @Test
  public void testNoAlgorithm() {
    assertThrows(IllegalArgumentException.class, () -> engine.train(jsc, SumEngine.params(4)));
  }

  @Test
  public void testEngineWithoutAlgorithms() {
    Map<String, Class<? extends Algorithm<JavaRDD<Integer>, ?, Integer, Integer>>> none =
      new HashMap<>();
    assertThrows(IllegalArgumentException.class, () -> new Engine<>(Integer.class,
      SumEngine.NumbersDataSource.class, SumEngine.PassThroughPreparator.class, none,
      SumEngine.MaxServing.class));
  }

  @Test
  public void testTrainingFailsFast() {
    EngineParams params = SumEngine.params(4, 0).toBuilder()
      .addAlgorithmParams("failing", EmptyParams.INSTANCE)
      .build();
    IllegalStateException e = assertThrows(IllegalStateException.class,
      () -> engine.train(jsc, params));
    assertEquals("Training failed on purpose.", e.getMessage());
  }

  @Test
  public void testSaveAndLoad() throws IOException {
    EngineParams params = SumEngine.params(5, 1);
    String modelDir = new File(tempDir.toFile(), "models").getAbsolutePath();
    engine.train(jsc, params).save(jsc, modelDir);
    assertTrue(new File(modelDir, "0-sum").isDirectory());

    EngineInstance<Integer, Integer> loaded = engine.load(jsc, params, modelDir);
    assertEquals(List.of(15), loaded.getModels());
    assertEquals(18, loaded.predict(2));
  }

  @Test
  public void testLoadMissingModel() {
    String modelDir = tempDir.toFile().getAbsolutePath();
    assertThrows(IOException.class, () -> engine.load(jsc, SumEngine.params(5, 1), modelDir));
  }

  @Test
  public void testEval() {
    List<JavaRDD<EvaluationRecord<Integer, Integer, Integer>>> folds =
      engine.eval(jsc, SumEngine.params(4, 0));
    assertEquals(2, folds.size());
    for (JavaRDD<EvaluationRecord<Integer, Integer, Integer>> fold : folds) {
      List<EvaluationRecord<Integer, Integer, Integer>> records = fold.collect();
      assertEquals(2, records.size());
      for (EvaluationRecord<Integer, Integer, Integer> r : records) {
        assertEquals(r.getActual(), r.getPredicted());
      }
    }
  }

  @Test
  public void testEvalWithoutFolds() {
    Map<String, Class<? extends Algorithm<JavaRDD<Integer>, ?, Integer, Integer>>> algorithms =
      new HashMap<>();
    algorithms.put("sum", SumEngine.SumAlgorithm.class);
    Engine<JavaRDD<Integer>, JavaRDD<Integer>, Integer, Integer, Integer> noEval = new Engine<>(
      Integer.class, TrainingOnlyDataSource.class, SumEngine.PassThroughPreparator.class,
      algorithms, SumEngine.MaxServing.class);
    assertThrows(IllegalStateException.class, () -> noEval.eval(jsc, SumEngine.params(4, 0)));
  }

  public static class TrainingOnlyDataSource extends SumEngine.NumbersDataSource {

    public TrainingOnlyDataSource(SumEngine.NumbersParams params) {
      super(params);
    }

    @Override
    public List<EvalFold<JavaRDD<Integer>, Integer, Integer>> readEval(JavaSparkContext sc) {
      return Collections.emptyList();
    }

  }

}
