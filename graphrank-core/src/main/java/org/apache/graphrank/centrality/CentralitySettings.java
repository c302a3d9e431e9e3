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

import org.apache.graphrank.conf.EnumConfOption;
import org.apache.graphrank.conf.FloatConfOption;
import org.apache.graphrank.conf.IntConfOption;
import org.apache.graphrank.conf.LongConfOption;
import org.apache.hadoop.conf.Configuration;

import java.util.Random;

/**
 * Configuration options for centrality algorithms
 */
public class CentralitySettings {
  /** Algorithm to run */
  public static final EnumConfOption<CentralityType> CENTRALITY_TYPE =
      EnumConfOption.create("graphrank.centrality.type",
          CentralityType.class, CentralityType.PAGERANK,
          "Centrality algorithm to run");
  /** Number of PageRank iterations. */
  public static final IntConfOption PAGERANK_ITERATIONS = new IntConfOption(
      "graphrank.pagerank.iterations", 10, "Number of PageRank iterations");
  /** PageRank damping factor. */
  public static final FloatConfOption DAMPING_FACTOR = new FloatConfOption(
      "graphrank.pagerank.dampingFactor", 0.85f, "Damping factor");
  /** Center of the personalized PageRank walk */
  public static final IntConfOption CENTER_NODE = new IntConfOption(
      "graphrank.ppr.centerNode", 0,
      "Center node of the personalized PageRank walk");
  /** Probability of following an edge in the personalized PageRank walk */
  public static final FloatConfOption CONTINUATION_PROBABILITY =
      new FloatConfOption("graphrank.ppr.continuationProbability", 0.85f,
          "Probability of following an edge instead of returning to " +
              "the center");
  /** Walk steps per node */
  public static final IntConfOption PASSES = new IntConfOption(
      "graphrank.ppr.passes", 10,
      "Number of walk steps per node of the graph");
  /** Seed of the walk, the walk is not reproducible when unset */
  public static final LongConfOption RANDOM_SEED = new LongConfOption(
      "graphrank.ppr.randomSeed", 0,
      "Seed of the walk, a random seed is used when unset");
  /** Number of eigenvector centrality iterations */
  public static final IntConfOption EIGENVECTOR_ITERATIONS =
      new IntConfOption("graphrank.eigenvector.iterations", 10,
          "Number of eigenvector centrality iterations");

  /** Don't construct */
  protected CentralitySettings() { }

  /**
   * Get algorithm to run
   *
   * @param conf Configuration
   * @return Centrality type
   */
  public static CentralityType getCentralityType(Configuration conf) {
    return CENTRALITY_TYPE.get(conf);
  }

  /**
   * Get number of PageRank iterations
   *
   * @param conf Configuration
   * @return num iterations
   */
  public static int getPageRankIterations(Configuration conf) {
    return PAGERANK_ITERATIONS.get(conf);
  }

  /**
   * Get damping factor
   *
   * @param conf Configuration
   * @return damping factor
   */
  public static double getDampingFactor(Configuration conf) {
    return DAMPING_FACTOR.get(conf);
  }

  /**
   * Get center node of the walk
   *
   * @param conf Configuration
   * @return center node id
   */
  public static int getCenterNode(Configuration conf) {
    return CENTER_NODE.get(conf);
  }

  /**
   * Get continuation probability of the walk
   *
   * @param conf Configuration
   * @return continuation probability
   */
  public static double getContinuationProbability(Configuration conf) {
    return CONTINUATION_PROBABILITY.get(conf);
  }

  /**
   * Get number of walk steps per node
   *
   * @param conf Configuration
   * @return passes
   */
  public static int getPasses(Configuration conf) {
    return PASSES.get(conf);
  }

  /**
   * Create the random source of the walk, seeded if a seed is configured
   *
   * @param conf Configuration
   * @return Random source
   */
  public static Random createRandom(Configuration conf) {
    return RANDOM_SEED.contains(conf) ?
        new Random(RANDOM_SEED.get(conf)) : new Random();
  }

  /**
   * Get number of eigenvector iterations
   *
   * @param conf Configuration
   * @return num iterations
   */
  public static int getEigenvectorIterations(Configuration conf) {
    return EIGENVECTOR_ITERATIONS.get(conf);
  }
}
