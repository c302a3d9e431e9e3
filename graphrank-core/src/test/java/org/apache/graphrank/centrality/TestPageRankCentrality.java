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
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import org.apache.graphrank.graph.InMemoryGraph;
import org.apache.graphrank.graph.SmallGraphs;
import org.apache.graphrank.progress.ProgressReporter;
import org.junit.Test;

/**
 * Test PageRankCentrality
 */
public class TestPageRankCentrality {
  private static final double PRECISION = 1e-9;

  @Test
  public void testMassFlowsAlongSingleEdge() {
    InMemoryGraph graph = new InMemoryGraph(2).addEdge(0, 1);
    CentralityResult result = new PageRankCentrality(0.85, 20).compute(graph);
    assertEquals(1, result.getNodeId(0));
    assertTrue(result.getScoreOf(1) > result.getScoreOf(0));
    // 0 only keeps the teleport share, 1 also receives all of 0
    assertEquals(0.075, result.getScoreOf(0), PRECISION);
    assertEquals(0.075 + 0.85 * 0.075, result.getScoreOf(1), PRECISION);
  }

  @Test
  public void testCycleKeepsUniformRank() {
    CentralityResult result =
        new PageRankCentrality(0.85, 30).compute(SmallGraphs.directedCycle(3));
    for (int i = 0; i < 3; i++) {
      assertEquals(1.0 / 3, result.getScoreOf(i), PRECISION);
    }
  }

  @Test
  public void testSinkMassIsDropped() {
    InMemoryGraph graph = new InMemoryGraph(3).addEdge(0, 1).addEdge(2, 1);
    double[] scores = new PageRankCentrality(0.85, 10).compute(graph)
        .toScoreArray();
    double total = scores[0] + scores[1] + scores[2];
    assertTrue("total " + total, total < 1.0);
  }

  @Test
  public void testZeroIterationsIsUniform() {
    double[] scores = new PageRankCentrality(0.85, 0)
        .compute(SmallGraphs.random(8, 3, 1L)).toScoreArray();
    for (double score : scores) {
      assertEquals(1.0 / 8, score, PRECISION);
    }
  }

  @Test
  public void testNoDampingIsUniform() {
    double[] scores = new PageRankCentrality(0.0, 5)
        .compute(SmallGraphs.random(10, 4, 2L)).toScoreArray();
    for (double score : scores) {
      assertEquals(0.1, score, PRECISION);
    }
  }

  @Test
  public void testInvalidDampingFailsBeforeWork() {
    ProgressReporter progress = mock(ProgressReporter.class);
    try {
      new PageRankCentrality(1.5, 10, progress);
      fail("Damping factor 1.5 should be rejected");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("dampingFactor"));
    }
    verifyNoInteractions(progress);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeDamping() {
    new PageRankCentrality(-0.1, 10);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeIterations() {
    new PageRankCentrality(0.85, -1);
  }

  @Test
  public void testProgressOncePerIteration() {
    ProgressReporter progress = mock(ProgressReporter.class);
    new PageRankCentrality(0.85, 5, progress)
        .compute(SmallGraphs.directedCycle(4));
    verify(progress).start(5);
    verify(progress, times(5)).report(anyLong());
    verify(progress).report(5);
    verify(progress).end();
  }

  @Test
  public void testRepeatedCallsGiveSameScores() {
    InMemoryGraph graph = SmallGraphs.random(40, 5, 9L);
    PageRankCentrality pageRank = new PageRankCentrality(0.85, 15);
    assertArrayEquals(pageRank.compute(graph).toScoreArray(),
        pageRank.compute(graph).toScoreArray(), 0);
  }

  @Test
  public void testEmptyGraph() {
    assertEquals(0,
        new PageRankCentrality(0.85, 10).compute(new InMemoryGraph(0)).size());
  }
}
