/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.graphrank.centrality;

import it.unimi.dsi.fastutil.ints.IntList;
import org.apache.graphrank.graph.GraphView;
import org.apache.graphrank.progress.NoOpProgressReporter;
import org.apache.graphrank.progress.ProgressReporter;
import org.apache.log4j.Logger;

import java.util.Arrays;

/**
 * PageRank of a directed graph, by power iteration over incoming edges.
 *
 * Runs a fixed number of iterations, there is no convergence check.
 * Rank of sink nodes is not redistributed, so the total mass shrinks
 * when the graph has sinks.
 */
public class PageRankCentrality extends AbstractCentralityAlgorithm {
  /** Class logger */
  private static final Logger LOG =
      Logger.getLogger(PageRankCentrality.class);

  /** Damping factor */
  private final double dampingFactor;
  /** Number of iterations */
  private final int iterations;

  /**
   * Constructor, without progress reporting
   *
   * @param dampingFactor Damping factor, in [0, 1]
   * @param iterations Number of iterations
   */
  public PageRankCentrality(double dampingFactor, int iterations) {
    this(dampingFactor, iterations, NoOpProgressReporter.INSTANCE);
  }

  /**
   * Constructor
   *
   * @param dampingFactor Damping factor, in [0, 1]
   * @param iterations Number of iterations
   * @param progress Progress sink, told once per iteration
   */
  public PageRankCentrality(double dampingFactor, int iterations,
      ProgressReporter progress) {
    super(progress);
    checkProbability("dampingFactor", dampingFactor);
    checkNonNegative("iterations", iterations);
    this.dampingFactor = dampingFactor;
    this.iterations = iterations;
  }

  @Override
  public CentralityResult compute(GraphView graph) {
    ProgressReporter progress = getProgressReporter();
    int n = graph.size();
    progress.start(iterations);
    if (n == 0) {
      progress.end();
      return CentralityResult.empty();
    }

    int[] outDegree = new int[n];
    for (int i = 0; i < n; i++) {
      outDegree[i] = graph.adjacent(i).size();
    }

    double[] value = new double[n];
    double[] newValue = new double[n];
    Arrays.fill(value, 1.0 / n);
    double base = (1.0 - dampingFactor) / n;
    for (int iteration = 0; iteration < iterations; iteration++) {
      for (int i = 0; i < n; i++) {
        double sum = 0.0;
        IntList incoming = graph.incoming(i);
        for (int j = 0; j < incoming.size(); j++) {
          int neighbor = incoming.getInt(j);
          if (outDegree[neighbor] > 0) {
            sum += value[neighbor] / outDegree[neighbor];
          }
        }
        newValue[i] = base + dampingFactor * sum;
      }
      double[] tmp = value;
      value = newValue;
      newValue = tmp;

      if (LOG.isDebugEnabled()) {
        LOG.debug("compute: Iteration " + (iteration + 1) + " of " +
            iterations + ", total rank " + sum(value));
      }
      progress.report(iteration + 1);
    }

    CentralityResult result = CentralityResult.fromScores(value);
    progress.end();
    return result;
  }

  /**
   * Sum of a vector
   *
   * @param vector Values
   * @return Sum of all values
   */
  private static double sum(double[] vector) {
    double total = 0;
    for (double v : vector) {
      total += v;
    }
    return total;
  }

  public double getDampingFactor() {
    return dampingFactor;
  }

  public int getIterations() {
    return iterations;
  }

  @Override
  public CentralityType getType() {
    return CentralityType.PAGERANK;
  }
}
