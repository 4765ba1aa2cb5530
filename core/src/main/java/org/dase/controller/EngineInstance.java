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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.spark.api.java.JavaSparkContext;

/**
 * A trained engine: the algorithms with their models, and the serving that combines their
 * predictions.
 */
public final class EngineInstance<Q, P> {

  private final List<String> algorithmNames;
  private final List<? extends Algorithm<?, Object, Q, P>> algorithms;
  private final List<Object> models;
  private final Serving<Q, P> serving;

  EngineInstance(
      List<String> algorithmNames,
      List<? extends Algorithm<?, Object, Q, P>> algorithms,
      List<Object> models,
      Serving<Q, P> serving) {
    this.algorithmNames = Collections.unmodifiableList(new ArrayList<>(algorithmNames));
    this.algorithms = algorithms;
    this.models = Collections.unmodifiableList(new ArrayList<>(models));
    this.serving = serving;
  }

  public List<Object> getModels() {
    return models;
  }

  /** Asks every algorithm for a prediction and lets the serving pick the result. */
  public P predict(Q query) {
    return predict(algorithms, models, serving, query);
  }

  /**
   * Saves every model under the given directory, one sub-directory per algorithm.
   */
  public void save(JavaSparkContext sc, String modelDir) throws IOException {
    for (int i = 0; i < algorithms.size(); i++) {
      String path = modelPath(modelDir, i, algorithmNames.get(i));
      algorithms.get(i).saveModel(sc, models.get(i), path);
    }
  }

  static <Q, P> P predict(
      List<? extends Algorithm<?, Object, Q, P>> algorithms,
      List<Object> models,
      Serving<Q, P> serving,
      Q query) {
    List<P> predictions = new ArrayList<>(algorithms.size());
    for (int i = 0; i < algorithms.size(); i++) {
      predictions.add(algorithms.get(i).predict(models.get(i), query));
    }
    return serving.serve(query, predictions);
  }

  static String modelPath(String modelDir, int index, String algorithmName) {
    return new File(modelDir, String.format("%d-%s", index, algorithmName)).getAbsolutePath();
  }

}
