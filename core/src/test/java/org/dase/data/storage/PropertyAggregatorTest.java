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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PropertyAggregatorTest {

  private static final Instant T0 = Instant.parse("2014-09-09T10:00:00Z");

  private static Event event(String name, int minutes, Object... keyValues) {
    Map<String, Object> props = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      props.put((String) keyValues[i], keyValues[i + 1]);
    }
    return new Event(name, "user", "u1", props, T0.plusSeconds(60L * minutes));
  }

  @Test
  public void testSetMerges() {
    PropertyMap pm = PropertyAggregator.aggregate(Arrays.asList(
      event("$set", 0, "a", 1, "b", 2),
      event("$set", 1, "b", 3, "c", "x"))).get();
    assertEquals(1, pm.get("a"));
    assertEquals(3, pm.get("b"));
    assertEquals("x", pm.getString("c"));
    assertEquals(T0, pm.getFirstUpdated());
    assertEquals(T0.plusSeconds(60), pm.getLastUpdated());
  }

  @Test
  public void testAppliedInEventTimeOrder() {
    PropertyMap pm = PropertyAggregator.aggregate(Arrays.asList(
      event("$set", 5, "a", 2),
      event("$set", 0, "a", 1))).get();
    assertEquals(2.0, pm.getDouble("a"));
    assertEquals(T0, pm.getFirstUpdated());
  }

  @Test
  public void testUnsetRemovesKeys() {
    PropertyMap pm = PropertyAggregator.aggregate(Arrays.asList(
      event("$set", 0, "a", 1, "b", 2),
      event("$unset", 1, "a", null))).get();
    assertFalse(pm.contains("a"));
    assertTrue(pm.contains("b"));
    assertEquals(T0.plusSeconds(60), pm.getLastUpdated());
  }

  @Test
  public void testDeleteDropsEntity() {
    assertEquals(Optional.empty(), PropertyAggregator.aggregate(Arrays.asList(
      event("$set", 0, "a", 1),
      event("$delete", 1))));

    PropertyMap pm = PropertyAggregator.aggregate(Arrays.asList(
      event("$set", 0, "a", 1),
      event("$delete", 1),
      event("$set", 2, "b", 2))).get();
    assertEquals(Collections.singleton("b"), pm.keySet());
    assertEquals(T0.plusSeconds(120), pm.getFirstUpdated());
  }

  @Test
  public void testOtherEventsIgnored() {
    assertFalse(PropertyAggregator.aggregate(Arrays.asList(
      event("view", 0, "item", "i1"),
      event("$unset", 1, "a", null))).isPresent());

    PropertyMap pm = PropertyAggregator.aggregate(Arrays.asList(
      event("$set", 0, "a", 1),
      event("buy", 1, "a", 5))).get();
    assertEquals(1, pm.get("a"));
    assertEquals(T0, pm.getLastUpdated());
  }

  @Test
  public void testTypedGetters() {
    PropertyMap pm = PropertyAggregator.aggregate(Collections.singletonList(
      event("$set", 0, "n", 1.5, "s", "text"))).get();
    assertEquals(1.5, pm.getDouble("n"));
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
      () -> pm.getDouble("missing"));
    assertEquals("The field missing is required.", e.getMessage());
    assertThrows(IllegalArgumentException.class, () -> pm.getDouble("s"));
    assertThrows(IllegalArgumentException.class, () -> pm.getString("n"));
  }

}
