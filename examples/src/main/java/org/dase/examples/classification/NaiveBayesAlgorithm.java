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

import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.mllib.classification.NaiveBayes;
import org.apache.spark.mllib.classification.NaiveBayesModel;
import org.apache.spark.mllib.linalg.Vectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.dase.controller.Algorithm;

/**
 * Multinomial naive Bayes from MLlib. Models are persisted in MLlib's own format.
 */
public class NaiveBayesAlgorithm
    extends Algorithm<PreparedData, NaiveBayesModel, Query, PredictedResult> {

  private static final long serialVersionUID = 1L;

  private static final Logger LOG = LoggerFactory.getLogger(NaiveBayesAlgorithm.class);

  private final AlgorithmParams params;

  public NaiveBayesAlgorithm(AlgorithmParams params) {
    this.params = params;
  }

  @Override
  public NaiveBayesModel train(JavaSparkContext sc, PreparedData data) {
    if (data.getLabeledPoints().isEmpty()) {
      throw new IllegalStateException(
        "No labeled points to train on; check that the data source reads the right app.");
    }
    LOG.info("Training naive Bayes with lambda {}", params.getLambda());
    return NaiveBayes.train(data.getLabeledPoints().rdd(), params.getLambda());
  }

  @Override
  public PredictedResult predict(NaiveBayesModel model, Query query) {
    return new PredictedResult(model.predict(Vectors.dense(query.getFeatures())));
  }

  @Override
  public void saveModel(JavaSparkContext sc, NaiveBayesModel model, String path)
      throws IOException {
    model.save(sc.sc(), path);
  }

  @Override
  public NaiveBayesModel loadModel(JavaSparkContext sc, String path) throws IOException {
    return NaiveBayesModel.load(sc.sc(), path);
  }

}
