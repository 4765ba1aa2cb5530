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

package org.dase.examples.classification;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import org.dase.controller.EngineInstance;
import org.dase.controller.EngineParams;
import org.dase.controller.MetricEvaluator;
import org.dase.workflow.EngineConfig;

import static org.junit.jupiter.api.Assertions.*;

public class ClassificationEngineTest extends ClassificationTestBase {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static EngineParams params(double lambda) {
    return EngineParams.builder()
      .dataSourceParams(new DataSourceParams(APP))
      .addAlgorithmParams(ClassificationEngine.NAIVE, new AlgorithmParams(lambda))
      .build();
  }

  @Test
  public void testTrainAndQuery() throws IOException {
    EngineInstance<Query, PredictedResult> instance =
      ClassificationEngine.create().train(jsc, params(1.0));

    Query query = MAPPER.readValue("{\"features\": [2, 0, 0]}", Query.class);
    PredictedResult result = instance.predict(query);
    assertEquals(0.0, result.getLabel());
    assertEquals("{\"label\":0.0}", MAPPER.writeValueAsString(result));

    assertEquals(1.0, instance.predict(new Query(new double[] { 0, 4, 1 })).getLabel());
    assertEquals(2.0, instance.predict(new Query(new double[] { 1, 0, 6 })).getLabel());
  }

  @Test
  public void testInvalidQuery() {
    assertThrows(IOException.class, () -> MAPPER.readValue("{\"features\": []}", Query.class));
    assertThrows(IOException.class, () -> MAPPER.readValue("{\"features\": \"x\"}", Query.class));
  }

  @Test
  public void testServingNeedsPredictions() {
    assertThrows(IllegalArgumentException.class, () -> new ClassificationServing().serve(
      new Query(new double[] { 1 }), Collections.emptyList()));
  }

  @Test
  public void testEvaluation() {
    AccuracyEvaluation evaluation = new AccuracyEvaluation(APP);
    assertEquals(3, evaluation.getCandidates().size());

    MetricEvaluator.Result result = new MetricEvaluator().evaluate(jsc, evaluation);
    assertEquals("Accuracy", result.getMetricHeader());
    assertEquals(3, result.getScores().size());
    for (double score : result.getScores()) {
      assertTrue(score >= 0.0 && score <= 1.0, String.valueOf(score));
    }
    assertTrue(result.getBestScore() >= 0.8, String.valueOf(result.getBestScore()));
  }

  @Test
  public void testBundledEngineJson() throws IOException {
    String json;
    try (InputStream in = getClass().getResourceAsStream("/classification/engine.json")) {
      assertNotNull(in);
      json = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
    EngineConfig config = EngineConfig.parse(json);
    EngineParams params = config.toEngineParams(config.createEngine());

    assertEquals(new DataSourceParams(AccuracyEvaluation.DEFAULT_APP_NAME),
      params.getDataSourceParams());
    assertEquals(new AlgorithmParams(1.0),
      params.getAlgorithmParamsList().get(0).getValue());
  }

}
