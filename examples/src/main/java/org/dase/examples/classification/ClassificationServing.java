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

import java.util.List;

import org.dase.controller.Serving;

/** Serves the prediction of the first algorithm. */
public class ClassificationServing extends Serving<Query, PredictedResult> {

  private static final long serialVersionUID = 1L;

  @Override
  public PredictedResult serve(Query query, List<PredictedResult> predictions) {
    if (predictions.isEmpty()) {
      throw new IllegalArgumentException("No prediction to serve for " + query);
    }
    return predictions.get(0);
  }

}
