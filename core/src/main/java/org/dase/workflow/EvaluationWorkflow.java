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

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

import org.apache.spark.api.java.JavaSparkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.dase.controller.Components;
import org.dase.controller.EmptyParams;
import org.dase.controller.Evaluation;
import org.dase.controller.MetricEvaluator;

/**
 * Scores every candidate of an {@link Evaluation} and reports the best parameters.
 * <p>
 * Usage: EvaluationWorkflow --evaluation CLASS [--master URL] [--conf K=V]
 */
public final class EvaluationWorkflow {

  private static final Logger LOG = LoggerFactory.getLogger(EvaluationWorkflow.class);

  public static void main(String[] args) {
    int exitCode = run(Arrays.asList(args), System.out, System.err);
    if (exitCode != 0) {
      System.exit(exitCode);
    }
  }

  static int run(List<String> argList, PrintStream out, PrintStream err) {
    WorkflowArguments args;
    Evaluation<?, ?, ?, ?, ?> evaluation;
    try {
      args = new WorkflowArguments(argList);
      if (args.help) {
        printUsage(err);
        return 0;
      }
      evaluation = createEvaluation(args.require(args.evaluationClass, "--evaluation"));
    } catch (IllegalArgumentException | IllegalStateException e) {
      err.println("Error: " + e.getMessage());
      printUsage(err);
      return 1;
    }

    String name = evaluation.getClass().getSimpleName();
    try (JavaSparkContext sc = WorkflowContext.create("dase-eval-" + name, args)) {
      MetricEvaluator.Result result = new MetricEvaluator().evaluate(sc, evaluation);
      report(result, out);
    } catch (RuntimeException e) {
      LOG.error("Evaluation {} failed.", name, e);
      err.println("Error: Evaluation failed: " + e.getMessage());
      return 1;
    }
    return 0;
  }

  /**
   * @throws IllegalArgumentException If the class cannot be found or is not an evaluation.
   */
  static Evaluation<?, ?, ?, ?, ?> createEvaluation(String className) {
    Class<?> cls;
    try {
      cls = Class.forName(className, true, Thread.currentThread().getContextClassLoader());
    } catch (ClassNotFoundException e) {
      throw new IllegalArgumentException("Evaluation not found: " + className, e);
    }
    if (!Evaluation.class.isAssignableFrom(cls)) {
      throw new IllegalArgumentException(String.format("%s is not an %s.", className,
        Evaluation.class.getSimpleName()));
    }
    return Components.create(cls.asSubclass(Evaluation.class), EmptyParams.INSTANCE);
  }

  static void report(MetricEvaluator.Result result, PrintStream out) {
    String header = result.getMetricHeader();
    for (int i = 0; i < result.getScores().size(); i++) {
      out.println(String.format("[%s] %s %s", header, result.getScores().get(i),
        result.getCandidates().get(i)));
    }
    out.println(String.format("Best %s: %s with %s", header, result.getBestScore(),
      result.getBestParams()));
  }

  private static void printUsage(PrintStream err) {
    err.println(
      "Usage: EvaluationWorkflow --evaluation CLASS [options]\n" +
      "\n" +
      "Options:\n" +
      "  --master URL      Spark master (Default: spark.master, or " +
        WorkflowContext.DEFAULT_MASTER + ").\n" +
      "  --conf K=V        Spark configuration property.\n" +
      "  --help, -h        Print this help.");
  }

  private EvaluationWorkflow() { }

}
