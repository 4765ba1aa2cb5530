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

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An event recorded against an entity. The special events {@code $set}, {@code $unset} and
 * {@code $delete} change the properties of the entity; any other event name is an
 * application-defined interaction.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonAutoDetect(getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE)
public final class Event implements Serializable {

  private static final long serialVersionUID = 1L;

  public static final String SET = "$set";
  public static final String UNSET = "$unset";
  public static final String DELETE = "$delete";

  private final String event;
  private final String entityType;
  private final String entityId;
  private final Map<String, Object> properties;
  private final Instant eventTime;

  public Event(
      String event,
      String entityType,
      String entityId,
      Map<String, Object> properties,
      Instant eventTime) {
    this.event = requireNonEmpty(event, "event");
    this.entityType = requireNonEmpty(entityType, "entityType");
    this.entityId = requireNonEmpty(entityId, "entityId");
    this.properties = properties == null
      ? Collections.emptyMap()
      : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    this.eventTime = Objects.requireNonNull(eventTime, "eventTime");
  }

  @JsonCreator
  static Event fromJson(
      @JsonProperty("event") String event,
      @JsonProperty("entityType") String entityType,
      @JsonProperty("entityId") String entityId,
      @JsonProperty("properties") Map<String, Object> properties,
      @JsonProperty("eventTime") String eventTime) {
    if (eventTime == null) {
      throw new IllegalArgumentException("Missing eventTime.");
    }
    return new Event(event, entityType, entityId, properties, EventJson.parseTime(eventTime));
  }

  @JsonProperty("event")
  public String getEvent() {
    return event;
  }

  @JsonProperty("entityType")
  public String getEntityType() {
    return entityType;
  }

  @JsonProperty("entityId")
  public String getEntityId() {
    return entityId;
  }

  @JsonProperty("properties")
  public Map<String, Object> getProperties() {
    return properties;
  }

  public Instant getEventTime() {
    return eventTime;
  }

  @JsonProperty("eventTime")
  String getEventTimeString() {
    return eventTime.toString();
  }

  public boolean isSpecial() {
    return SET.equals(event) || UNSET.equals(event) || DELETE.equals(event);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Event)) {
      return false;
    }
    Event that = (Event) o;
    return event.equals(that.event) && entityType.equals(that.entityType) &&
      entityId.equals(that.entityId) && properties.equals(that.properties) &&
      eventTime.equals(that.eventTime);
  }

  @Override
  public int hashCode() {
    return Objects.hash(event, entityType, entityId, properties, eventTime);
  }

  @Override
  public String toString() {
    return "Event(" + event + ", " + entityType + "/" + entityId + ", " + properties + ", " +
      eventTime + ")";
  }

  private static String requireNonEmpty(String value, String name) {
    if (value == null || value.isEmpty()) {
      throw new IllegalArgumentException("Missing " + name + ".");
    }
    return value;
  }

}
