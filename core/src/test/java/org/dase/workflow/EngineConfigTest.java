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

package org.dase.workflow;

import org.junit.jupiter.api.Test;

import org.dase.controller.EmptyParams;
import org.dase.controller.Engine;
import org.dase.controller.EngineParams;
import org.dase.controller.SumEngine;

import static org.junit.jupiter.api.Assertions.*;

public class EngineConfigTest {

  static final String SUM_ENGINE_JSON = "{\n" +
    "  \"id\": \"sum\",\n" +
    "  \"description\": \"Sums numbers\",\n" +
    "  \"engineFactory\": \"org.dase.controller.SumEngine\",\n" +
    "  \"datasource\": { \"params\": { \"count\": 4 } },\n" +
    "  \"algorithms\": [\n" +
    "    { \"name\": \"sum\", \"params\": { \"offset\": 1 } },\n" +
    "    { \"name\": \"sum\" }\n" +
    "  ]\n" +
    "}";

  @Test
  public void testParse() {
    EngineConfig config = EngineConfig.parse(SUM_ENGINE_JSON);
    assertEquals("sum", config.getId());
    assertEquals("Sums numbers", config.getDescription());
    assertEquals("org.dase.controller.SumEngine", config.getEngineFactory());
    assertEquals(2, config.getAlgorithms().size());
    assertEquals("sum", config.getAlgorithms().get(1).getName());
  }

  @Test
  public void testToEngineParams() {
    EngineConfig config = EngineConfig.parse(SUM_ENGINE_JSON);
    Engine<?, ?, ?, ?, ?> engine = config.createEngine();
    assertEquals(Integer.class, engine.getQueryClass());

    EngineParams params = config.toEngineParams(engine);
    assertEquals(SumEngine.params(4, 1, 0), params);
    assertEquals(EmptyParams.INSTANCE, params.getServingParams());
  }

  @Test
  public void testDefaults() {
    EngineConfig config = EngineConfig.parse("{\"engineFactory\":\"x.Y\"," +
      "\"algorithms\":[{\"name\":\"a\"}]}");
    assertEquals("default", config.getId());
    assertEquals("", config.getDescription());
    assertTrue(config.getAlgorithms().get(0).getParams().isEmpty());
  }

  @Test
  public void testInvalidConfigs() {
    assertThrows(IllegalArgumentException.class, () -> EngineConfig.parse("[]"));
    assertThrows(IllegalArgumentException.class, () -> EngineConfig.parse("{\"id\":"));
    assertThrows(IllegalArgumentException.class,
      () -> EngineConfig.parse("{\"algorithms\":[{\"name\":\"a\"}]}"));
    assertThrows(IllegalArgumentException.class,
      () -> EngineConfig.parse("{\"engineFactory\":\"x.Y\",\"algorithms\":[]}"));
    assertThrows(IllegalArgumentException.class,
      () -> EngineConfig.parse("{\"engineFactory\":\"x.Y\",\"algorithms\":[{}]}"));
  }

  @Test
  public void testUnknownFactory() {
    EngineConfig missing = EngineConfig.parse(
      SUM_ENGINE_JSON.replace("controller.SumEngine", "NoSuchEngine"));
    assertThrows(IllegalArgumentException.class, missing::createEngine);

    EngineConfig notFactory = EngineConfig.parse(
      SUM_ENGINE_JSON.replace("org.dase.controller.SumEngine", "java.lang.String"));
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
      notFactory::createEngine);
    assertTrue(e.getMessage().contains("EngineFactory"), e.getMessage());
  }

  @Test
  public void testUnknownAlgorithm() {
    EngineConfig config = EngineConfig.parse(
      SUM_ENGINE_JSON.replace("{ \"name\": \"sum\" }", "{ \"name\": \"product\" }"));
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
      () -> config.toEngineParams(config.createEngine()));
    assertTrue(e.getMessage().contains("product"), e.getMessage());
  }

  @Test
  public void testInvalidParams() {
    EngineConfig config = EngineConfig.parse(
      SUM_ENGINE_JSON.replace("\"count\": 4", "\"count\": 0"));
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
      () -> config.toEngineParams(config.createEngine()));
    assertTrue(e.getMessage().contains("count must be positive"), e.getMessage());
  }

}
