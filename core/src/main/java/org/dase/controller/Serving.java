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
import java.util.List;

/**
 * Combines the predictions of an engine's algorithms into the result returned for a query.
 *
 * @param <Q> Query class.
 * @param <P> Predicted result class.
 */
public abstract class Serving<Q, P> implements Serializable {

  private static final long serialVersionUID = 1L;

  /**
   * @param query The query being answered.
   * @param predictions One prediction per algorithm, in the order the algorithms are configured.
   */
  public abstract P serve(Q query, List<P> predictions);

}
