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

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * Creates pipeline components by reflection.
 * <p>
 * A component either has a public constructor taking its parameters class (any subclass of
 * {@link Params}), or a public no-argument constructor when it takes no parameters.
 */
public final class Components {

  /**
   * Returns the parameters class a component is built with, or {@link EmptyParams} when it only
   * has a no-argument constructor.
   */
  public static Class<? extends Params> paramsClassOf(Class<?> componentClass) {
    Constructor<?> ctor = paramsConstructor(componentClass);
    if (ctor == null) {
      return EmptyParams.class;
    }
    return ctor.getParameterTypes()[0].asSubclass(Params.class);
  }

  /**
   * Instantiates a component with the given parameters.
   *
   * @throws IllegalArgumentException If the component cannot take the given parameters.
   * @throws IllegalStateException If the component cannot be instantiated.
   */
  public static <T> T create(Class<? extends T> componentClass, Params params) {
    Constructor<?> ctor = paramsConstructor(componentClass);
    try {
      if (ctor != null) {
        if (!ctor.getParameterTypes()[0].isInstance(params)) {
          throw new IllegalArgumentException(String.format(
            "%s takes %s, but was given %s.", componentClass.getName(),
            ctor.getParameterTypes()[0].getName(), params));
        }
        return componentClass.cast(ctor.newInstance(params));
      }
      return componentClass.getConstructor().newInstance();
    } catch (InvocationTargetException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new IllegalStateException("Failed to create " + componentClass.getName(), e.getCause());
    } catch (NoSuchMethodException e) {
      throw new IllegalStateException(String.format(
        "%s needs a public constructor taking its Params, or a public no-argument constructor.",
        componentClass.getName()), e);
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to create " + componentClass.getName(), e);
    }
  }

  private static Constructor<?> paramsConstructor(Class<?> componentClass) {
    for (Constructor<?> ctor : componentClass.getConstructors()) {
      if (ctor.getParameterCount() == 1 &&
          Params.class.isAssignableFrom(ctor.getParameterTypes()[0])) {
        return ctor;
      }
    }
    return null;
  }

  private Components() { }

}
