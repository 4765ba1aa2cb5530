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
import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A query: the feature values of the entity to classify, for example
 * {@code {"features": [2, 0, 0]}}.
 */
public class Query implements Serializable {

  private static final long serialVersionUID = 1L;

  private final double[] features;

  @JsonCreator
  public Query(@JsonProperty("features") double[] features) {
    if (features == null || features.length == 0) {
      throw new IllegalArgumentException("A query needs at least one feature.");
    }
    this.features = features.clone();
  }

  @JsonProperty("features")
  public double[] getFeatures() {
    return features.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Query && Arrays.equals(features, ((Query) o).features);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(features);
  }

  @Override
  public String toString() {
    return "Query(" + Arrays.toString(features) + ")";
  }

}
