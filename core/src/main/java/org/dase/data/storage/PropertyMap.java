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
import java.util.Set;

/**
 * The properties of an entity as aggregated from its special events, with the times of the
 * first and the last event that changed them.
 */
public final class PropertyMap implements Serializable {

  private static final long serialVersionUID = 1L;

  private final Map<String, Object> fields;
  private final Instant firstUpdated;
  private final Instant lastUpdated;

  public PropertyMap(Map<String, Object> fields, Instant firstUpdated, Instant lastUpdated) {
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    this.firstUpdated = Objects.requireNonNull(firstUpdated, "firstUpdated");
    this.lastUpdated = Objects.requireNonNull(lastUpdated, "lastUpdated");
  }

  public Map<String, Object> getFields() {
    return fields;
  }

  public Instant getFirstUpdated() {
    return firstUpdated;
  }

  public Instant getLastUpdated() {
    return lastUpdated;
  }

  public Set<String> keySet() {
    return fields.keySet();
  }

  public boolean contains(String name) {
    return fields.containsKey(name);
  }

  /**
   * @throws IllegalArgumentException If the field is missing or null.
   */
  public Object get(String name) {
    Object value = fields.get(name);
    if (value == null) {
      throw new IllegalArgumentException(String.format("The field %s is required.", name));
    }
    return value;
  }

  /**
   * @throws IllegalArgumentException If the field is missing or not a number.
   */
  public double getDouble(String name) {
    Object value = get(name);
    if (!(value instanceof Number)) {
      throw new IllegalArgumentException(String.format(
        "The field %s is not a number: %s.", name, value));
    }
    return ((Number) value).doubleValue();
  }

  /**
   * @throws IllegalArgumentException If the field is missing or not a string.
   */
  public String getString(String name) {
    Object value = get(name);
    if (!(value instanceof String)) {
      throw new IllegalArgumentException(String.format(
        "The field %s is not a string: %s.", name, value));
    }
    return (String) value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PropertyMap)) {
      return false;
    }
    PropertyMap that = (PropertyMap) o;
    return fields.equals(that.fields) && firstUpdated.equals(that.firstUpdated) &&
      lastUpdated.equals(that.lastUpdated);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fields, firstUpdated, lastUpdated);
  }

  @Override
  public String toString() {
    return "PropertyMap(" + fields + ", firstUpdated=" + firstUpdated + ", lastUpdated=" +
      lastUpdated + ")";
  }

}
