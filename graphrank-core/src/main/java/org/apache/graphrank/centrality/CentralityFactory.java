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

import org.apache.graphrank.conf.GraphRankConstants;
import org.apache.graphrank.parallel.NodeRunner;
import org.apache.graphrank.parallel.SingleThreadNodeRunner;
import org.apache.graphrank.parallel.ThreadPoolNodeRunner;
import org.apache.graphrank.progress.LoggingProgressReporter;
import org.apache.graphrank.progress.ProgressReporter;
import org.apache.hadoop.conf.Configuration;
import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;

/**
 * Creates centrality algorithms from a configuration.
 */
public class CentralityFactory {
  /** Class logger */
  private static final Logger LOG = Logger.getLogger(CentralityFactory.class);

  /** Do not instantiate. */
  private CentralityFactory() { }

  /**
   * Create the algorithm selected in the configuration, reporting progress
   * to the log
   *
   * @param conf Configuration
   * @return Algorithm
   */
  public static CentralityAlgorithm createAlgorithm(Configuration conf) {
    CentralityType type = CentralitySettings.getCentralityType(conf);
    return createAlgorithm(type, conf, new LoggingProgressReporter(
        type.name().toLowerCase(),
        GraphRankConstants.PROGRESS_LOG_INTERVAL_MSECS.get(conf)));
  }

  /**
   * Create an algorithm with parameters from the configuration
   *
   * @param type Algorithm to create
   * @param conf Configuration
   * @param progress Progress sink
   * @return Algorithm
   */
  public static CentralityAlgorithm createAlgorithm(CentralityType type,
      Configuration conf, ProgressReporter progress) {
    if (LOG.isInfoEnabled()) {
      LOG.info("createAlgorithm: Creating " + type);
    }
    switch (type) {
    case DEGREE:
      return new DegreeCentrality(progress);
    case BETWEENNESS:
      return new BetweennessCentrality(createNodeRunner(conf), progress);
    case PAGERANK:
      return new PageRankCentrality(
          CentralitySettings.getDampingFactor(conf),
          CentralitySettings.getPageRankIterations(conf), progress);
    case PERSONALIZED_PAGERANK:
      return new PersonalizedPageRank(
          CentralitySettings.getCenterNode(conf),
          CentralitySettings.getContinuationProbability(conf),
          CentralitySettings.getPasses(conf),
          CentralitySettings.createRandom(conf), progress);
    case EIGENVECTOR:
      return new EigenvectorCentrality(
          CentralitySettings.getEigenvectorIterations(conf), progress);
    default:
      throw new IllegalStateException(
          "createAlgorithm: Unknown centrality type " + type);
    }
  }

  /**
   * Create the runner for parallel algorithms
   *
   * @param conf Configuration
   * @return Thread pool runner if more than one thread is configured
   */
  public static NodeRunner createNodeRunner(Configuration conf) {
    int numThreads = GraphRankConstants.NUM_COMPUTE_THREADS.get(conf);
    Preconditions.checkArgument(numThreads >= 1,
        "createNodeRunner: Number of compute threads must be >= 1, got %s",
        numThreads);
    if (numThreads > 1) {
      return new ThreadPoolNodeRunner(numThreads);
    }
    return new SingleThreadNodeRunner();
  }
}
