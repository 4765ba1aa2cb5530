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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.api.java.JavaSparkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A DASE engine: the classes of its data source, preparator, algorithms and serving, wired
 * together in a fixed pipeline.
 * <p>
 * Training runs the stages once each and in order: read the training data, prepare it, then
 * train every configured algorithm on the prepared data. Any failure aborts the run; no partial
 * set of models is ever returned.
 *
 * @param <TD> Training data class.
 * @param <PD> Prepared data class.
 * @param <Q> Query class.
 * @param <P> Predicted result class.
 * @param <A> Actual result class.
 */
public class Engine<TD, PD, Q, P, A> {

  private static final Logger LOG = LoggerFactory.getLogger(Engine.class);

  private final Class<Q> queryClass;
  private final Class<? extends DataSource<TD, Q, A>> dataSourceClass;
  private final Class<? extends Preparator<TD, PD>> preparatorClass;
  private final Map<String, Class<? extends Algorithm<PD, ?, Q, P>>> algorithmClasses;
  private final Class<? extends Serving<Q, P>> servingClass;

  public Engine(
      Class<Q> queryClass,
      Class<? extends DataSource<TD, Q, A>> dataSourceClass,
      Class<? extends Preparator<TD, PD>> preparatorClass,
      Map<String, Class<? extends Algorithm<PD, ?, Q, P>>> algorithmClasses,
      Class<? extends Serving<Q, P>> servingClass) {
    if (algorithmClasses.isEmpty()) {
      throw new IllegalArgumentException("An engine needs at least one algorithm.");
    }
    this.queryClass = queryClass;
    this.dataSourceClass = dataSourceClass;
    this.preparatorClass = preparatorClass;
    this.algorithmClasses = Collections.unmodifiableMap(new LinkedHashMap<>(algorithmClasses));
    this.servingClass = servingClass;
  }

  public Class<Q> getQueryClass() {
    return queryClass;
  }

  public Class<? extends DataSource<TD, Q, A>> getDataSourceClass() {
    return dataSourceClass;
  }

  public Class<? extends Preparator<TD, PD>> getPreparatorClass() {
    return preparatorClass;
  }

  public Map<String, Class<? extends Algorithm<PD, ?, Q, P>>> getAlgorithmClasses() {
    return algorithmClasses;
  }

  public Class<? extends Serving<Q, P>> getServingClass() {
    return servingClass;
  }

  /**
   * Trains every algorithm named in the parameters.
   *
   * @return The trained engine, ready to answer queries.
   */
  public EngineInstance<Q, P> train(JavaSparkContext sc, EngineParams params) {
    DataSource<TD, Q, A> dataSource = Components.create(dataSourceClass,
      params.getDataSourceParams());
    Preparator<TD, PD> preparator = Components.create(preparatorClass,
      params.getPreparatorParams());
    List<Algorithm<PD, Object, Q, P>> algorithms = createAlgorithms(params);

    LOG.info("Reading training data with {}", dataSourceClass.getName());
    TD trainingData = dataSource.readTraining(sc);
    PD preparedData = preparator.prepare(sc, trainingData);
    List<Object> models = trainAll(sc, algorithms, preparedData);

    return new EngineInstance<>(algorithmNames(params), algorithms, models, createServing(params));
  }

  /**
   * Loads the models saved from an instance trained with the same parameters.
   */
  public EngineInstance<Q, P> load(JavaSparkContext sc, EngineParams params, String modelDir)
      throws IOException {
    List<String> names = algorithmNames(params);
    List<Algorithm<PD, Object, Q, P>> algorithms = createAlgorithms(params);
    List<Object> models = new ArrayList<>();
    for (int i = 0; i < algorithms.size(); i++) {
      String path = EngineInstance.modelPath(modelDir, i, names.get(i));
      if (!new File(path).exists()) {
        throw new IOException("No model found at " + path);
      }
      LOG.info("Loading model of algorithm {} from {}", names.get(i), path);
      models.add(algorithms.get(i).loadModel(sc, path));
    }
    return new EngineInstance<>(names, algorithms, models, createServing(params));
  }

  /**
   * Runs every evaluation fold of the data source: trains on the fold's training data, then
   * predicts each held-out query.
   *
   * @return The records of each fold.
   * @throws IllegalStateException If the data source yields no folds.
   */
  public List<JavaRDD<EvaluationRecord<Q, P, A>>> eval(JavaSparkContext sc, EngineParams params) {
    DataSource<TD, Q, A> dataSource = Components.create(dataSourceClass,
      params.getDataSourceParams());
    Preparator<TD, PD> preparator = Components.create(preparatorClass,
      params.getPreparatorParams());
    List<Algorithm<PD, Object, Q, P>> algorithms = createAlgorithms(params);
    Serving<Q, P> serving = createServing(params);

    List<EvalFold<TD, Q, A>> folds = dataSource.readEval(sc);
    if (folds.isEmpty()) {
      throw new IllegalStateException(
        dataSourceClass.getName() + " did not return any evaluation fold.");
    }

    List<JavaRDD<EvaluationRecord<Q, P, A>>> results = new ArrayList<>();
    for (int i = 0; i < folds.size(); i++) {
      EvalFold<TD, Q, A> fold = folds.get(i);
      LOG.info("Evaluating fold {} of {}", i + 1, folds.size());
      PD preparedData = preparator.prepare(sc, fold.getTrainingData());
      List<Object> models = trainAll(sc, algorithms, preparedData);
      results.add(fold.getQueries().map(qa -> new EvaluationRecord<>(qa._1(),
        EngineInstance.predict(algorithms, models, serving, qa._1()), qa._2())));
    }
    return results;
  }

  private List<Object> trainAll(
      JavaSparkContext sc,
      List<Algorithm<PD, Object, Q, P>> algorithms,
      PD preparedData) {
    List<Object> models = new ArrayList<>();
    for (Algorithm<PD, Object, Q, P> algorithm : algorithms) {
      LOG.info("Training {}", algorithm.getClass().getName());
      models.add(algorithm.train(sc, preparedData));
    }
    return models;
  }

  @SuppressWarnings("unchecked")
  private List<Algorithm<PD, Object, Q, P>> createAlgorithms(EngineParams params) {
    List<Map.Entry<String, Params>> algorithmParams = params.getAlgorithmParamsList();
    if (algorithmParams.isEmpty()) {
      throw new IllegalArgumentException("The engine parameters name no algorithm.");
    }
    List<Algorithm<PD, Object, Q, P>> algorithms = new ArrayList<>();
    for (Map.Entry<String, Params> e : algorithmParams) {
      Class<? extends Algorithm<PD, ?, Q, P>> cls = algorithmClasses.get(e.getKey());
      if (cls == null) {
        throw new IllegalArgumentException(String.format(
          "Unknown algorithm '%s'; the engine defines %s.", e.getKey(), algorithmClasses.keySet()));
      }
      Algorithm<PD, ?, Q, P> algorithm = Components.create(cls, e.getValue());
      algorithms.add((Algorithm<PD, Object, Q, P>) algorithm);
    }
    return algorithms;
  }

  private Serving<Q, P> createServing(EngineParams params) {
    return Components.create(servingClass, params.getServingParams());
  }

  private static List<String> algorithmNames(EngineParams params) {
    List<String> names = new ArrayList<>();
    params.getAlgorithmParamsList().forEach(e -> names.add(e.getKey()));
    return names;
  }

}
