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

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

import org.apache.spark.api.java.JavaSparkContext;

/**
 * Reads the data an engine trains and evaluates on.
 *
 * @param <TD> Training data class.
 * @param <Q> Query class.
 * @param <A> Actual result class.
 */
public abstract class DataSource<TD, Q, A> implements Serializable {

  private static final long serialVersionUID = 1L;

  /**
   * Reads the training data.
   *
   * @param sc Spark context of the training run.
   */
  public abstract TD readTraining(JavaSparkContext sc);

  /**
   * Reads the folds of an evaluation: for each fold, the data to train on and the held-out
   * queries paired with their actual results. Data sources that do not support evaluation
   * return no folds.
   */
  public List<EvalFold<TD, Q, A>> readEval(JavaSparkContext sc) {
    return Collections.emptyList();
  }

}
