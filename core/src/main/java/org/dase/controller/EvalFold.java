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

import org.apache.spark.api.java.JavaPairRDD;

/**
 * One fold of an evaluation: the training data of the fold, and the held-out queries paired with
 * the results they should produce.
 */
public final class EvalFold<TD, Q, A> {

  private final TD trainingData;
  private final JavaPairRDD<Q, A> queries;

  public EvalFold(TD trainingData, JavaPairRDD<Q, A> queries) {
    this.trainingData = trainingData;
    this.queries = queries;
  }

  public TD getTrainingData() {
    return trainingData;
  }

  public JavaPairRDD<Q, A> getQueries() {
    return queries;
  }

}
