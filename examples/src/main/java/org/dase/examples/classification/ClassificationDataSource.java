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
import java.util.Arrays;
import java.util.List;

import org.apache.spark.api.java.JavaPairRDD;
import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.mllib.linalg.Vectors;
import org.apache.spark.mllib.regression.LabeledPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scala.Tuple2;

import org.dase.controller.DataSource;
import org.dase.controller.EvalFold;
import org.dase.data.storage.PropertyMap;
import org.dase.data.storage.Storage;

/**
 * Reads the "user" entities of an application. Each user with a "plan" and the three attributes
 * "attr0", "attr1" and "attr2" becomes a labeled point: the plan is the label, the attributes are
 * the features.
 */
public class ClassificationDataSource extends DataSource<TrainingData, Query, ActualResult> {

  private static final long serialVersionUID = 1L;

  private static final Logger LOG = LoggerFactory.getLogger(ClassificationDataSource.class);

  static final String ENTITY_TYPE = "user";
  static final String LABEL = "plan";
  static final List<String> FEATURES = Arrays.asList("attr0", "attr1", "attr2");

  private final DataSourceParams params;

  public ClassificationDataSource(DataSourceParams params) {
    this.params = params;
  }

  @Override
  public TrainingData readTraining(JavaSparkContext sc) {
    List<String> required = new ArrayList<>();
    required.add(LABEL);
    required.addAll(FEATURES);

    JavaPairRDD<String, PropertyMap> users = Storage.eventStore(sc)
      .aggregateProperties(sc, params.getAppName(), ENTITY_TYPE, required);
    JavaRDD<LabeledPoint> points = users.map(ClassificationDataSource::toLabeledPoint).cache();
    return new TrainingData(points);
  }

  /**
   * Splits the training points into evalK folds by index: fold i queries the points whose index
   * is i modulo evalK, and trains on the others.
   */
  @Override
  public List<EvalFold<TrainingData, Query, ActualResult>> readEval(JavaSparkContext sc) {
    if (params.getEvalK() == null) {
      throw new IllegalArgumentException("DataSourceParams.evalK must not be empty.");
    }
    int k = params.getEvalK();
    JavaPairRDD<LabeledPoint, Long> indexed = readTraining(sc).getLabeledPoints()
      .zipWithIndex()
      .cache();

    List<EvalFold<TrainingData, Query, ActualResult>> folds = new ArrayList<>();
    for (int idx = 0; idx < k; idx++) {
      int fold = idx;
      JavaRDD<LabeledPoint> training = indexed.filter(p -> p._2() % k != fold).keys();
      JavaPairRDD<Query, ActualResult> testing = indexed.filter(p -> p._2() % k == fold).keys()
        .mapToPair(p -> new Tuple2<>(new Query(p.features().toArray()),
          new ActualResult(p.label())));
      folds.add(new EvalFold<>(new TrainingData(training), testing));
    }
    return folds;
  }

  private static LabeledPoint toLabeledPoint(Tuple2<String, PropertyMap> user) {
    PropertyMap properties = user._2();
    try {
      double[] features = new double[FEATURES.size()];
      for (int i = 0; i < features.length; i++) {
        features[i] = properties.getDouble(FEATURES.get(i));
      }
      return new LabeledPoint(properties.getDouble(LABEL), Vectors.dense(features));
    } catch (RuntimeException e) {
      LOG.error("Failed to get properties {} of user {}.", properties, user._1(), e);
      throw e;
    }
  }

}
