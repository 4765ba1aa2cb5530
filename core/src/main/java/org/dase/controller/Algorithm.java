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

import java.io.IOException;
import java.io.Serializable;
import java.util.Collections;
import java.util.List;

import org.apache.spark.api.java.JavaSparkContext;

/**
 * Trains a model from prepared data and answers queries with it.
 * <p>
 * Models are persisted between the training and the query workflows. The default persistence
 * writes the model as a single-element Spark object file, which requires it to be serializable;
 * algorithms whose library ships its own format override {@link #saveModel} and
 * {@link #loadModel}.
 *
 * @param <PD> Prepared data class.
 * @param <M> Model class.
 * @param <Q> Query class.
 * @param <P> Predicted result class.
 */
public abstract class Algorithm<PD, M, Q, P> implements Serializable {

  private static final long serialVersionUID = 1L;

  public abstract M train(JavaSparkContext sc, PD preparedData);

  public abstract P predict(M model, Q query);

  /**
   * Saves a model trained by this algorithm under the given path, which must not exist yet.
   */
  public void saveModel(JavaSparkContext sc, M model, String path) throws IOException {
    sc.parallelize(Collections.singletonList(model), 1).saveAsObjectFile(path);
  }

  /**
   * Loads a model written by {@link #saveModel}.
   */
  public M loadModel(JavaSparkContext sc, String path) throws IOException {
    List<M> models = sc.<M>objectFile(path).collect();
    if (models.size() != 1) {
      throw new IOException(String.format("Expected a single model at %s, found %d.", path,
        models.size()));
    }
    return models.get(0);
  }

}
