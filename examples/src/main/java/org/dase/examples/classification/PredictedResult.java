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

import java.io.Serializable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The predicted label of a query: {@code {"label": 1.0}}.
 */
public class PredictedResult implements Serializable {

  private static final long serialVersionUID = 1L;

  private final double label;

  @JsonCreator
  public PredictedResult(@JsonProperty("label") double label) {
    this.label = label;
  }

  @JsonProperty("label")
  public double getLabel() {
    return label;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PredictedResult &&
      Double.compare(label, ((PredictedResult) o).label) == 0;
  }

  @Override
  public int hashCode() {
    return Double.hashCode(label);
  }

  @Override
  public String toString() {
    return "PredictedResult(" + label + ")";
  }

}
