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

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.spark.api.java.JavaPairRDD;
import org.apache.spark.api.java.JavaSparkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An event store backed by JSON-lines files on the local file system: the events of an
 * application are read from every {@code *.json} file directly under {@code <root>/<appName>}.
 */
public class LocalFileEventStore implements EventStore {

  private static final Logger LOG = LoggerFactory.getLogger(LocalFileEventStore.class);

  private final File root;

  public LocalFileEventStore(File root) {
    this.root = root;
  }

  public File getRoot() {
    return root;
  }

  /**
   * @throws IllegalStateException If the application has no event directory.
   * @throws IllegalArgumentException (when the result is computed) If a line is not a valid
   *         event.
   */
  @Override
  public JavaPairRDD<String, PropertyMap> aggregateProperties(
      JavaSparkContext sc,
      String appName,
      String entityType,
      List<String> required) {
    File appDir = new File(root, appName);
    if (!appDir.isDirectory()) {
      throw new IllegalStateException(String.format(
        "No events found for app '%s': %s is not a directory.", appName,
        appDir.getAbsolutePath()));
    }
    File[] files = appDir.listFiles((dir, name) -> name.endsWith(".json"));
    if (files == null || files.length == 0) {
      LOG.warn("No event files under {}", appDir.getAbsolutePath());
      return sc.parallelizePairs(Collections.emptyList());
    }

    String path = appDir.getAbsolutePath() + File.separator + "*.json";
    LOG.info("Aggregating {} properties of app {} from {}", entityType, appName, path);
    List<String> requiredFields = new ArrayList<>(required);
    return sc.textFile(path)
      .filter(line -> !line.trim().isEmpty())
      .map(EventJson::parse)
      .filter(e -> e.getEntityType().equals(entityType))
      .keyBy(Event::getEntityId)
      .groupByKey()
      .mapValues(events -> PropertyAggregator.aggregate(events).orElse(null))
      .filter(kv -> kv._2() != null && kv._2().keySet().containsAll(requiredFields));
  }

}
