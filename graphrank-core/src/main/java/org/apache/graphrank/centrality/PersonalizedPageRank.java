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

import java.util.List;
import java.util.Random;

import com.google.common.base.Preconditions;

/**
 * Personalized PageRank estimated by a random walk around a center node.
 * The walk takes passes * number of nodes steps; at each step the current
 * node is counted, then the walk either follows a random outgoing edge,
 * with the continuation probability, or jumps back to the center.
 * Nodes without outgoing edges always jump back to the center.
 *
 * Scores are raw visit counts, not normalized. The continuation
 * probability is the complement of the teleport probability: a walk which
 * should teleport with probability t needs a continuation probability of
 * 1 - t.
 */
public class PersonalizedPageRank extends AbstractCentralityAlgorithm {
  /** Class logger */
  private static final Logger LOG =
      Logger.getLogger(PersonalizedPageRank.class);

  /** Node the walk starts from and returns to */
  private final int centerNode;
  /** Probability of following an edge */
  private final double continuationProbability;
  /** Number of steps per node */
  private final int passes;
  /** Source of randomness for the walk */
  private final Random random;

  /**
   * Constructor, with a non-deterministically seeded random source and
   * without progress reporting
   *
   * @param centerNode Center of the walk
   * @param continuationProbability Probability of following an edge
   * @param passes Number of steps per node
   */
  public PersonalizedPageRank(int centerNode, double continuationProbability,
      int passes) {
    this(centerNode, continuationProbability, passes, new Random(),
        NoOpProgressReporter.INSTANCE);
  }

  /**
   * Constructor
   *
   * @param centerNode Center of the walk
   * @param continuationProbability Probability of following an edge
   * @param passes Number of steps per node
   * @param random Random source, seed it for reproducible walks
   * @param progress Progress sink, told once per step
   */
  public PersonalizedPageRank(int centerNode, double continuationProbability,
      int passes, Random random, ProgressReporter progress) {
    super(progress);
    checkProbability("continuationProbability", continuationProbability);
    checkNonNegative("passes", passes);
    this.centerNode = centerNode;
    this.continuationProbability = continuationProbability;
    this.passes = passes;
    this.random = Preconditions.checkNotNull(random,
        "random must not be null");
  }

  @Override
  public CentralityResult compute(GraphView graph) {
    int n = graph.size();
    Preconditions.checkArgument(centerNode >= 0 && centerNode < n,
        "compute: Center node %s is not in [0, %s)", centerNode, n);
    ProgressReporter progress = getProgressReporter();
    long steps = (long) passes * n;
    if (LOG.isInfoEnabled()) {
      LOG.info("compute: Walking " + steps + " steps around node " +
          centerNode);
    }
    progress.start(steps);

    double[] visits = new double[n];
    int current = centerNode;
    for (long step = 0; step < steps; step++) {
      visits[current]++;
      current = nextNode(graph, current);
      progress.report(step + 1);
    }

    CentralityResult result = CentralityResult.fromScores(visits);
    progress.end();
    return result;
  }

  /**
   * Pick the node visited after the current one
   *
   * @param graph Graph walked on
   * @param current Current node
   * @return Next node
   */
  private int nextNode(GraphView graph, int current) {
    if (random.nextDouble() < continuationProbability) {
      List<Edge> edges = graph.adjacent(current);
      if (edges.isEmpty()) {
        return centerNode;
      }
      return edges.get(random.nextInt(edges.size())).getTargetNodeId();
    }
    return centerNode;
  }

  public int getCenterNode() {
    return centerNode;
  }

  public double getContinuationProbability() {
    return continuationProbability;
  }

  public int getPasses() {
    return passes;
  }

  @Override
  public CentralityType getType() {
    return CentralityType.PERSONALIZED_PAGERANK;
  }
}
