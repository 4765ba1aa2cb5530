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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.dase.controller.Params;

/**
 * @see NaiveBayesAlgorithm
 */
public class AlgorithmParams implements Params {

  private static final long serialVersionUID = 1L;

  static final double DEFAULT_LAMBDA = 1.0;

  private final double lambda;

  /**
   * @param lambda Additive smoothing; defaults to {@value #DEFAULT_LAMBDA}.
   */
  @JsonCreator
  public AlgorithmParams(@JsonProperty("lambda") Double lambda) {
    double value = lambda != null ? lambda : DEFAULT_LAMBDA;
    if (Double.isNaN(value) || value < 0.0) {
      throw new IllegalArgumentException("lambda must be non-negative, got " + lambda);
    }
    this.lambda = value;
  }

  public double getLambda() {
    return lambda;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof AlgorithmParams &&
      Double.compare(lambda, ((AlgorithmParams) o).lambda) == 0;
  }

  @Override
  public int hashCode() {
    return Double.hashCode(lambda);
  }

  @Override
  public String toString() {
    return "AlgorithmParams(lambda=" + lambda + ")";
  }

}
