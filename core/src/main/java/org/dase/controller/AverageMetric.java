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

import java.util.List;

import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.util.StatCounter;

/**
 * A metric averaging a per-record score over the records of every fold. The score of a run
 * without records is NaN.
 */
public abstract class AverageMetric<Q, P, A> extends Metric<Q, P, A> {

  private static final long serialVersionUID = 1L;

  public abstract double calculate(Q query, P predicted, A actual);

  @Override
  public double calculate(JavaSparkContext sc, List<JavaRDD<EvaluationRecord<Q, P, A>>> folds) {
    double sum = 0.0;
    long count = 0L;
    for (JavaRDD<EvaluationRecord<Q, P, A>> fold : folds) {
      StatCounter stats = fold
        .mapToDouble(r -> calculate(r.getQuery(), r.getPredicted(), r.getActual()))
        .stats();
      sum += stats.sum();
      count += stats.count();
    }
    return count == 0 ? Double.NaN : sum / count;
  }

}
