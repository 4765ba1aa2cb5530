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
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The parameters of every stage of an engine: one set per data source, preparator and serving,
 * and an ordered list of (algorithm name, parameters) pairs. The same algorithm may appear more
 * than once with different parameters.
 */
public final class EngineParams implements Serializable {

  private static final long serialVersionUID = 1L;

  private final Params dataSourceParams;
  private final Params preparatorParams;
  private final List<Map.Entry<String, Params>> algorithmParamsList;
  private final Params servingParams;

  private EngineParams(Builder builder) {
    this.dataSourceParams = builder.dataSourceParams;
    this.preparatorParams = builder.preparatorParams;
    this.algorithmParamsList = Collections.unmodifiableList(
      new ArrayList<>(builder.algorithmParamsList));
    this.servingParams = builder.servingParams;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Params getDataSourceParams() {
    return dataSourceParams;
  }

  public Params getPreparatorParams() {
    return preparatorParams;
  }

  public List<Map.Entry<String, Params>> getAlgorithmParamsList() {
    return algorithmParamsList;
  }

  public Params getServingParams() {
    return servingParams;
  }

  /** Returns a builder initialized with these parameters. */
  public Builder toBuilder() {
    Builder b = new Builder()
      .dataSourceParams(dataSourceParams)
      .preparatorParams(preparatorParams)
      .servingParams(servingParams);
    algorithmParamsList.forEach(e -> b.addAlgorithmParams(e.getKey(), e.getValue()));
    return b;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EngineParams)) {
      return false;
    }
    EngineParams that = (EngineParams) o;
    return dataSourceParams.equals(that.dataSourceParams) &&
      preparatorParams.equals(that.preparatorParams) &&
      algorithmParamsList.equals(that.algorithmParamsList) &&
      servingParams.equals(that.servingParams);
  }

  @Override
  public int hashCode() {
    return Objects.hash(dataSourceParams, preparatorParams, algorithmParamsList, servingParams);
  }

  @Override
  public String toString() {
    return "EngineParams(dataSource=" + dataSourceParams + ", preparator=" + preparatorParams +
      ", algorithms=" + algorithmParamsList + ", serving=" + servingParams + ")";
  }

  public static final class Builder {

    private Params dataSourceParams = EmptyParams.INSTANCE;
    private Params preparatorParams = EmptyParams.INSTANCE;
    private final List<Map.Entry<String, Params>> algorithmParamsList = new ArrayList<>();
    private Params servingParams = EmptyParams.INSTANCE;

    private Builder() { }

    public Builder dataSourceParams(Params params) {
      this.dataSourceParams = Objects.requireNonNull(params, "params");
      return this;
    }

    public Builder preparatorParams(Params params) {
      this.preparatorParams = Objects.requireNonNull(params, "params");
      return this;
    }

    public Builder addAlgorithmParams(String name, Params params) {
      algorithmParamsList.add(new AbstractMap.SimpleImmutableEntry<>(
        Objects.requireNonNull(name, "name"), Objects.requireNonNull(params, "params")));
      return this;
    }

    /** Drops the algorithm parameters added so far. */
    public Builder clearAlgorithmParams() {
      algorithmParamsList.clear();
      return this;
    }

    public Builder servingParams(Params params) {
      this.servingParams = Objects.requireNonNull(params, "params");
      return this;
    }

    public EngineParams build() {
      return new EngineParams(this);
    }

  }

}
