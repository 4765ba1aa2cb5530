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

import java.util.LinkedHashMap;
import java.util.Map;

import org.dase.controller.Algorithm;
import org.dase.controller.Engine;
import org.dase.controller.EngineFactory;

/**
 * Classifies users into plans from their attributes. The only algorithm is "naive".
 */
public class ClassificationEngine implements EngineFactory {

  public static final String NAIVE = "naive";

  @Override
  public Engine<TrainingData, PreparedData, Query, PredictedResult, ActualResult> apply() {
    return create();
  }

  public static Engine<TrainingData, PreparedData, Query, PredictedResult, ActualResult> create() {
    Map<String, Class<? extends Algorithm<PreparedData, ?, Query, PredictedResult>>> algorithms =
      new LinkedHashMap<>();
    algorithms.put(NAIVE, NaiveBayesAlgorithm.class);
    return new Engine<>(Query.class, ClassificationDataSource.class,
      ClassificationPreparator.class, algorithms, ClassificationServing.class);
  }

}
