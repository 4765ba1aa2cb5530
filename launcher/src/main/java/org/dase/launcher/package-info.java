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

/**
 * Launcher for classes that run on the toolkit classpath.
 *
 * <p>
 * {@link org.dase.launcher.Main} is invoked by the "bin/dase-class" script. It locates the Java
 * runtime, checks that the Spark installation meets the minimum version, computes the classpath
 * and prints the final java command, which the script then executes in place of itself.
 * </p>
 *
 * <p>
 * The launcher has no dependencies outside the JDK since it runs before any classpath exists.
 * </p>
 */
package org.dase.launcher;
