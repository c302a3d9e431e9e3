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

import org.apache.graphrank.graph.Edge;
import org.apache.graphrank.graph.GraphView;
import org.apache.graphrank.progress.NoOpProgressReporter;
import org.apache.graphrank.progress.ProgressReporter;
import org.apache.log4j.Logger;

import java.util.Arrays;
import java.util.List;

/**
 * Eigenvector centrality by power iteration, meant for undirected graphs
 * (each edge stored in both directions). Every node starts with 1.0 and
 * each iteration pushes a node's value to all its neighbors. Values are
 * not normalized between iterations; only the final vector is divided by
 * its sum. When the largest value passes {@link #RESCALE_THRESHOLD} the
 * whole vector is scaled down by a power of two, which is exact and leaves
 * the normalized result unchanged.
 *
 * When no value survives the iterations (no edges at all), every node
 * gets 1 / n.
 */
public class EigenvectorCentrality extends AbstractCentralityAlgorithm {
  /** Class logger */
  private static final Logger LOG =
      Logger.getLogger(EigenvectorCentrality.class);

  /** Largest value tolerated before the vector is scaled down */
  static final double RESCALE_THRESHOLD = Math.scalb(1.0, 512);

  /** Number of iterations */
  private final int iterations;

  /**
   * Constructor, without progress reporting
   *
   * @param iterations Number of iterations
   */
  public EigenvectorCentrality(int iterations) {
    this(iterations, NoOpProgressReporter.INSTANCE);
  }

  /**
   * Constructor
   *
   * @param iterations Number of iterations
   * @param progress Progress sink, told once per iteration
   */
  public EigenvectorCentrality(int iterations, ProgressReporter progress) {
    super(progress);
    checkNonNegative("iterations", iterations);
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

    double[] value = new double[n];
    double[] newValue = new double[n];
    Arrays.fill(value, 1.0);
    for (int iteration = 0; iteration < iterations; iteration++) {
      Arrays.fill(newValue, 0.0);
      for (int i = 0; i < n; i++) {
        List<Edge> edges = graph.adjacent(i);
        for (int j = 0; j < edges.size(); j++) {
          newValue[edges.get(j).getTargetNodeId()] += value[i];
        }
      }
      double[] tmp = value;
      value = newValue;
      newValue = tmp;
      rescaleIfLarge(value);
      progress.report(iteration + 1);
    }

    double total = 0;
    for (int i = 0; i < n; i++) {
      total += value[i];
    }
    if (total > 0) {
      for (int i = 0; i < n; i++) {
        value[i] /= total;
      }
    } else {
      if (LOG.isInfoEnabled()) {
        LOG.info("compute: All values vanished after " + iterations +
            " iterations, using uniform scores");
      }
      Arrays.fill(value, 1.0 / n);
    }

    CentralityResult result = CentralityResult.fromScores(value);
    progress.end();
    return result;
  }

  /**
   * Scale the values down by a power of two once the largest one passes
   * the threshold, keeping them away from infinity
   *
   * @param value Values, changed in place
   */
  private static void rescaleIfLarge(double[] value) {
    double max = 0;
    for (double v : value) {
      max = Math.max(max, v);
    }
    if (max > RESCALE_THRESHOLD) {
      int shift = -Math.getExponent(max);
      if (LOG.isDebugEnabled()) {
        LOG.debug("rescaleIfLarge: Scaling values by 2^" + shift);
      }
      for (int i = 0; i < value.length; i++) {
        value[i] = Math.scalb(value[i], shift);
      }
    }
  }

  public int getIterations() {
    return iterations;
  }

  @Override
  public CentralityType getType() {
    return CentralityType.EIGENVECTOR;
  }
}
