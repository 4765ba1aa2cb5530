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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.api.java.JavaSparkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an {@link Evaluation}: scores every candidate with the evaluation's metric and picks the
 * best one. A candidate scoring NaN never wins over a scored one.
 */
public class MetricEvaluator {

  private static final Logger LOG = LoggerFactory.getLogger(MetricEvaluator.class);

  public <TD, PD, Q, P, A> Result evaluate(
      JavaSparkContext sc,
      Evaluation<TD, PD, Q, P, A> evaluation) {
    Metric<Q, P, A> metric = evaluation.getMetric();
    List<EngineParams> candidates = evaluation.getCandidates();
    List<Double> scores = new ArrayList<>();

    int best = -1;
    for (int i = 0; i < candidates.size(); i++) {
      EngineParams params = candidates.get(i);
      List<JavaRDD<EvaluationRecord<Q, P, A>>> folds = evaluation.getEngine().eval(sc, params);
      double score = metric.calculate(sc, folds);
      LOG.info("Candidate {} of {}: {} = {} for {}", i + 1, candidates.size(), metric.header(),
        score, params);
      scores.add(score);

      if (!Double.isNaN(score) &&
          (best < 0 || metric.compare(score, scores.get(best)) > 0)) {
        best = i;
      }
    }

    if (best < 0) {
      throw new IllegalStateException("No candidate produced a score for " + metric.header());
    }
    LOG.info("Best {} = {} for {}", metric.header(), scores.get(best), candidates.get(best));
    return new Result(metric.header(), candidates, scores, best);
  }

  /** The scores of every candidate of an evaluation run. */
  public static final class Result {

    private final String metricHeader;
    private final List<EngineParams> candidates;
    private final List<Double> scores;
    private final int bestIndex;

    Result(String metricHeader, List<EngineParams> candidates, List<Double> scores, int bestIndex) {
      this.metricHeader = metricHeader;
      this.candidates = candidates;
      this.scores = Collections.unmodifiableList(scores);
      this.bestIndex = bestIndex;
    }

    public String getMetricHeader() {
      return metricHeader;
    }

    public List<EngineParams> getCandidates() {
      return candidates;
    }

    public List<Double> getScores() {
      return scores;
    }

    public EngineParams getBestParams() {
      return candidates.get(bestIndex);
    }

    public double getBestScore() {
      return scores.get(bestIndex);
    }

  }

}
