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

import java.util.ArrayList;
import java.util.List;

import org.dase.controller.EngineParams;
import org.dase.controller.Evaluation;

/**
 * Compares smoothing parameters of the naive Bayes algorithm by 5-fold accuracy.
 */
public class AccuracyEvaluation
    extends Evaluation<TrainingData, PreparedData, Query, PredictedResult, ActualResult> {

  public static final String DEFAULT_APP_NAME = "MyApp1";
  static final int EVAL_K = 5;
  static final double[] LAMBDAS = { 10.0, 100.0, 1000.0 };

  public AccuracyEvaluation() {
    this(DEFAULT_APP_NAME);
  }

  public AccuracyEvaluation(String appName) {
    super(ClassificationEngine.create(), new Accuracy(), candidates(appName));
  }

  static List<EngineParams> candidates(String appName) {
    List<EngineParams> candidates = new ArrayList<>();
    for (double lambda : LAMBDAS) {
      candidates.add(EngineParams.builder()
        .dataSourceParams(new DataSourceParams(appName, EVAL_K))
        .addAlgorithmParams(ClassificationEngine.NAIVE, new AlgorithmParams(lambda))
        .build());
    }
    return candidates;
  }

}
