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

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.dase.controller.Params;

/**
 * @see ClassificationDataSource
 */
public class DataSourceParams implements Params {

  private static final long serialVersionUID = 1L;

  private final String appName;
  private final Integer evalK;

  /**
   * @param appName The application whose events are read.
   * @param evalK Number of evaluation folds; only needed to evaluate the engine.
   */
  @JsonCreator
  public DataSourceParams(
      @JsonProperty("appName") String appName,
      @JsonProperty("evalK") Integer evalK) {
    if (appName == null || appName.isEmpty()) {
      throw new IllegalArgumentException("appName is required.");
    }
    if (evalK != null && evalK < 2) {
      throw new IllegalArgumentException("evalK must be at least 2, got " + evalK);
    }
    this.appName = appName;
    this.evalK = evalK;
  }

  public DataSourceParams(String appName) {
    this(appName, null);
  }

  public String getAppName() {
    return appName;
  }

  /** The number of evaluation folds, or null when not configured. */
  public Integer getEvalK() {
    return evalK;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof DataSourceParams)) {
      return false;
    }
    DataSourceParams that = (DataSourceParams) o;
    return appName.equals(that.appName) && Objects.equals(evalK, that.evalK);
  }

  @Override
  public int hashCode() {
    return Objects.hash(appName, evalK);
  }

  @Override
  public String toString() {
    return "DataSourceParams(appName=" + appName + ", evalK=" + evalK + ")";
  }

}
