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

/**
 * An evaluation: the engine to evaluate, the metric that scores it, and the candidate
 * parameters to compare. Evaluations are run by class name, so subclasses need a public
 * no-argument constructor.
 */
public class Evaluation<TD, PD, Q, P, A> {

  private final Engine<TD, PD, Q, P, A> engine;
  private final Metric<Q, P, A> metric;
  private final List<EngineParams> candidates;

  public Evaluation(
      Engine<TD, PD, Q, P, A> engine,
      Metric<Q, P, A> metric,
      List<EngineParams> candidates) {
    if (candidates.isEmpty()) {
      throw new IllegalArgumentException("An evaluation needs at least one candidate.");
    }
    this.engine = engine;
    this.metric = metric;
    this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
  }

  public Engine<TD, PD, Q, P, A> getEngine() {
    return engine;
  }

  public Metric<Q, P, A> getMetric() {
    return metric;
  }

  public List<EngineParams> getCandidates() {
    return candidates;
  }

}
