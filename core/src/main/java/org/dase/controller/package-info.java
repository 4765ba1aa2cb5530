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
 * The DASE pipeline contract: a {@link org.dase.controller.DataSource} reads training data, a
 * {@link org.dase.controller.Preparator} transforms it, one or more
 * {@link org.dase.controller.Algorithm}s train models and predict from queries, and a
 * {@link org.dase.controller.Serving} reconciles their predictions into one result.
 * {@link org.dase.controller.Evaluation}s score an engine under candidate parameters with a
 * {@link org.dase.controller.Metric}.
 */
package org.dase.controller;
