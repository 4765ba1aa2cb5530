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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Folds the special events of one entity into its current properties.
 * <p>
 * Events are applied in event-time order. {@code $set} merges its properties into the current
 * ones, {@code $unset} removes the keys it names, and {@code $delete} drops the entity, so that a
 * later {@code $set} starts afresh. Other events do not change properties.
 */
public final class PropertyAggregator {

  /**
   * @return The aggregated properties, or empty if the entity was never set or was deleted last.
   */
  public static Optional<PropertyMap> aggregate(Iterable<Event> events) {
    List<Event> sorted = new ArrayList<>();
    for (Event e : events) {
      if (e.isSpecial()) {
        sorted.add(e);
      }
    }
    sorted.sort(Comparator.comparing(Event::getEventTime));

    Map<String, Object> fields = null;
    Instant firstUpdated = null;
    Instant lastUpdated = null;
    for (Event e : sorted) {
      switch (e.getEvent()) {
        case Event.SET:
          if (fields == null) {
            fields = new LinkedHashMap<>();
            firstUpdated = e.getEventTime();
          }
          fields.putAll(e.getProperties());
          lastUpdated = e.getEventTime();
          break;
        case Event.UNSET:
          if (fields != null) {
            fields.keySet().removeAll(e.getProperties().keySet());
            lastUpdated = e.getEventTime();
          }
          break;
        case Event.DELETE:
          fields = null;
          firstUpdated = null;
          lastUpdated = null;
          break;
        default:
          throw new IllegalStateException("Not a special event: " + e.getEvent());
      }
    }

    if (fields == null) {
      return Optional.empty();
    }
    return Optional.of(new PropertyMap(fields, firstUpdated, lastUpdated));
  }

  private PropertyAggregator() { }

}
