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

package org.dase.data.storage;

import java.util.List;

import org.apache.spark.api.java.JavaPairRDD;
import org.apache.spark.api.java.JavaSparkContext;

/**
 * Read access to the events recorded for an application.
 */
public interface EventStore {

  /**
   * Aggregates the properties of every entity of the given type.
   *
   * @param appName The application whose events are read.
   * @param entityType Only entities of this type are aggregated.
   * @param required Entities missing any of these properties are left out.
   * @return The properties of each entity, keyed by entity id.
   */
  JavaPairRDD<String, PropertyMap> aggregateProperties(
      JavaSparkContext sc,
      String appName,
      String entityType,
      List<String> required);

}
