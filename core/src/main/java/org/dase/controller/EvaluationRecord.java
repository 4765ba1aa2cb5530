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

/**
 * A held-out query with the result the engine predicted for it and the actual result.
 */
public final class EvaluationRecord<Q, P, A> implements Serializable {

  private static final long serialVersionUID = 1L;

  private final Q query;
  private final P predicted;
  private final A actual;

  public EvaluationRecord(Q query, P predicted, A actual) {
    this.query = query;
    this.predicted = predicted;
    this.actual = actual;
  }

  public Q getQuery() {
    return query;
  }

  public P getPredicted() {
    return predicted;
  }

  public A getActual() {
    return actual;
  }

  @Override
  public String toString() {
    return "EvaluationRecord(query=" + query + ", predicted=" + predicted + ", actual=" + actual +
      ")";
  }

}
