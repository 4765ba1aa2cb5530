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

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import org.dase.controller.Components;
import org.dase.controller.EmptyParams;
import org.dase.controller.Engine;
import org.dase.controller.EngineFactory;
import org.dase.controller.EngineParams;
import org.dase.controller.Params;

/**
 * The engine configuration read from an "engine.json" file:
 * <pre>
 * {
 *   "id": "default",
 *   "description": "Default settings",
 *   "engineFactory": "org.example.MyEngine",
 *   "datasource": { "params": { "appName": "MyApp" } },
 *   "preparator": { "params": {} },
 *   "algorithms": [ { "name": "naive", "params": { "lambda": 1.0 } } ],
 *   "serving": { "params": {} }
 * }
 * </pre>
 * Only "engineFactory" and "algorithms" are required. The "params" objects are bound to the
 * {@link Params} class the matching component is constructed with.
 */
public final class EngineConfig {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final String id;
  private final String description;
  private final String engineFactory;
  private final JsonNode dataSourceParams;
  private final JsonNode preparatorParams;
  private final List<AlgorithmConfig> algorithms;
  private final JsonNode servingParams;

  private EngineConfig(JsonNode root) {
    this.id = root.path("id").asText("default");
    this.description = root.path("description").asText("");
    this.engineFactory = requiredText(root, "engineFactory");
    this.dataSourceParams = params(root.path("datasource"));
    this.preparatorParams = params(root.path("preparator"));
    this.servingParams = params(root.path("serving"));

    JsonNode algos = root.path("algorithms");
    if (!algos.isArray() || algos.size() == 0) {
      throw new IllegalArgumentException(
        "The engine configuration needs a non-empty \"algorithms\" array.");
    }
    List<AlgorithmConfig> list = new ArrayList<>();
    for (JsonNode algo : algos) {
      list.add(new AlgorithmConfig(requiredText(algo, "name"), params(algo)));
    }
    this.algorithms = Collections.unmodifiableList(list);
  }

  /**
   * @throws IllegalArgumentException If the file is not a valid engine configuration.
   */
  public static EngineConfig load(File file) throws IOException {
    JsonNode root;
    try {
      root = MAPPER.readTree(file);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(String.format("Invalid engine configuration %s: %s",
        file, e.getOriginalMessage()), e);
    }
    return fromTree(root);
  }

  /**
   * @throws IllegalArgumentException If the text is not a valid engine configuration.
   */
  public static EngineConfig parse(String json) {
    try {
      return fromTree(MAPPER.readTree(json));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid engine configuration: " +
        e.getOriginalMessage(), e);
    }
  }

  private static EngineConfig fromTree(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("The engine configuration must be a JSON object.");
    }
    return new EngineConfig(root);
  }

  public String getId() {
    return id;
  }

  public String getDescription() {
    return description;
  }

  public String getEngineFactory() {
    return engineFactory;
  }

  public List<AlgorithmConfig> getAlgorithms() {
    return algorithms;
  }

  /**
   * Creates the engine named by "engineFactory".
   *
   * @throws IllegalArgumentException If the class cannot be found or is not an engine factory.
   */
  public Engine<?, ?, ?, ?, ?> createEngine() {
    Class<? extends EngineFactory> factoryClass;
    try {
      Class<?> cls = Class.forName(engineFactory, true,
        Thread.currentThread().getContextClassLoader());
      if (!EngineFactory.class.isAssignableFrom(cls)) {
        throw new IllegalArgumentException(String.format("%s is not an %s.", engineFactory,
          EngineFactory.class.getSimpleName()));
      }
      factoryClass = cls.asSubclass(EngineFactory.class);
    } catch (ClassNotFoundException e) {
      throw new IllegalArgumentException("Engine factory not found: " + engineFactory, e);
    }
    EngineFactory factory = Components.create(factoryClass, EmptyParams.INSTANCE);
    return factory.apply();
  }

  /**
   * Binds the configured parameters to the parameter classes of the engine's components.
   *
   * @throws IllegalArgumentException If an algorithm is unknown to the engine, or some parameters
   *         do not fit their component.
   */
  public EngineParams toEngineParams(Engine<?, ?, ?, ?, ?> engine) {
    EngineParams.Builder builder = EngineParams.builder()
      .dataSourceParams(bind(dataSourceParams, engine.getDataSourceClass(), "datasource"))
      .preparatorParams(bind(preparatorParams, engine.getPreparatorClass(), "preparator"))
      .servingParams(bind(servingParams, engine.getServingClass(), "serving"));

    Map<String, ? extends Class<?>> classes = engine.getAlgorithmClasses();
    for (AlgorithmConfig algo : algorithms) {
      Class<?> cls = classes.get(algo.getName());
      if (cls == null) {
        throw new IllegalArgumentException(String.format(
          "Unknown algorithm '%s'; the engine defines %s.", algo.getName(), classes.keySet()));
      }
      builder.addAlgorithmParams(algo.getName(),
        bind(algo.getParams(), cls, "algorithm " + algo.getName()));
    }
    return builder.build();
  }

  private static Params bind(JsonNode node, Class<?> componentClass, String what) {
    Class<? extends Params> paramsClass = Components.paramsClassOf(componentClass);
    if (paramsClass == EmptyParams.class) {
      return EmptyParams.INSTANCE;
    }
    try {
      return MAPPER.treeToValue(node, paramsClass);
    } catch (JsonProcessingException e) {
      Throwable cause = e.getCause();
      String msg = cause instanceof IllegalArgumentException
        ? cause.getMessage()
        : e.getOriginalMessage();
      throw new IllegalArgumentException(String.format("Invalid %s params for %s: %s", what,
        paramsClass.getName(), msg), e);
    }
  }

  private static JsonNode params(JsonNode component) {
    JsonNode params = component.path("params");
    return params.isMissingNode() || params.isNull()
      ? JsonNodeFactory.instance.objectNode()
      : params;
  }

  private static String requiredText(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (!value.isTextual() || value.asText().isEmpty()) {
      throw new IllegalArgumentException(String.format(
        "Missing \"%s\" in the engine configuration.", field));
    }
    return value.asText();
  }

  /** One entry of the "algorithms" array. */
  public static final class AlgorithmConfig {

    private final String name;
    private final JsonNode params;

    AlgorithmConfig(String name, JsonNode params) {
      this.name = name;
      this.params = params;
    }

    public String getName() {
      return name;
    }

    public JsonNode getParams() {
      return params;
    }

  }

}
