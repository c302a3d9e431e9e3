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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.apache.graphrank.conf.GraphRankConfiguration;
import org.apache.graphrank.graph.InMemoryGraph;
import org.apache.graphrank.graph.SmallGraphs;
import org.apache.graphrank.parallel.SingleThreadNodeRunner;
import org.apache.graphrank.parallel.ThreadPoolNodeRunner;
import org.junit.Test;

/**
 * Test CentralityFactory
 */
public class TestCentralityFactory {
  @Test
  public void testEveryType() {
    GraphRankConfiguration conf = new GraphRankConfiguration();
    for (CentralityType type : CentralityType.values()) {
      CentralitySettings.CENTRALITY_TYPE.set(conf, type);
      CentralityAlgorithm algorithm = CentralityFactory.createAlgorithm(conf);
      assertEquals(type, algorithm.getType());
    }
  }

  @Test
  public void testDefaultIsPageRank() {
    CentralityAlgorithm algorithm =
        CentralityFactory.createAlgorithm(new GraphRankConfiguration());
    assertTrue(algorithm instanceof PageRankCentrality);
    assertEquals(0.85, ((PageRankCentrality) algorithm).getDampingFactor(),
        1e-6);
    assertEquals(10, ((PageRankCentrality) algorithm).getIterations());
  }

  @Test
  public void testParametersAreRead() {
    GraphRankConfiguration conf = new GraphRankConfiguration();
    CentralitySettings.CENTRALITY_TYPE.set(conf,
        CentralityType.PERSONALIZED_PAGERANK);
    CentralitySettings.CENTER_NODE.set(conf, 2);
    CentralitySettings.CONTINUATION_PROBABILITY.set(conf, 0.25f);
    CentralitySettings.PASSES.set(conf, 3);
    PersonalizedPageRank walk =
        (PersonalizedPageRank) CentralityFactory.createAlgorithm(conf);
    assertEquals(2, walk.getCenterNode());
    assertEquals(0.25, walk.getContinuationProbability(), 0);
    assertEquals(3, walk.getPasses());

    CentralitySettings.CENTRALITY_TYPE.set(conf, CentralityType.EIGENVECTOR);
    CentralitySettings.EIGENVECTOR_ITERATIONS.set(conf, 4);
    assertEquals(4, ((EigenvectorCentrality)
        CentralityFactory.createAlgorithm(conf)).getIterations());
  }

  @Test
  public void testSeededWalkIsReproducible() {
    GraphRankConfiguration conf = new GraphRankConfiguration();
    CentralitySettings.CENTRALITY_TYPE.set(conf,
        CentralityType.PERSONALIZED_PAGERANK);
    CentralitySettings.RANDOM_SEED.set(conf, 1234L);
    InMemoryGraph graph = SmallGraphs.random(20, 4, 12L);
    assertArrayEquals(
        CentralityFactory.createAlgorithm(conf).compute(graph).toScoreArray(),
        CentralityFactory.createAlgorithm(conf).compute(graph).toScoreArray(),
        0);
  }

  @Test
  public void testNodeRunnerFollowsThreads() {
    GraphRankConfiguration conf = new GraphRankConfiguration();
    assertTrue(CentralityFactory.createNodeRunner(conf)
        instanceof SingleThreadNodeRunner);
    conf.setNumComputeThreads(4);
    assertTrue(CentralityFactory.createNodeRunner(conf)
        instanceof ThreadPoolNodeRunner);
    assertEquals(4, CentralityFactory.createNodeRunner(conf).getNumWorkers());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroThreads() {
    GraphRankConfiguration conf = new GraphRankConfiguration();
    conf.setNumComputeThreads(0);
    CentralityFactory.createNodeRunner(conf);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidDampingInConfiguration() {
    GraphRankConfiguration conf = new GraphRankConfiguration();
    CentralitySettings.DAMPING_FACTOR.set(conf, 1.5f);
    CentralityFactory.createAlgorithm(conf);
  }
}
