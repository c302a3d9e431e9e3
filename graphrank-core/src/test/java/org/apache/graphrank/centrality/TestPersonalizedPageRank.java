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
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import org.apache.graphrank.graph.InMemoryGraph;
import org.apache.graphrank.graph.SmallGraphs;
import org.apache.graphrank.progress.NoOpProgressReporter;
import org.apache.graphrank.progress.ProgressReporter;
import org.junit.Test;

import java.util.Random;

/**
 * Test PersonalizedPageRank
 */
public class TestPersonalizedPageRank {
  private static PersonalizedPageRank seeded(int center, double d,
      int passes, long seed) {
    return new PersonalizedPageRank(center, d, passes, new Random(seed),
        NoOpProgressReporter.INSTANCE);
  }

  @Test
  public void testNoContinuationStaysOnCenter() {
    InMemoryGraph graph = SmallGraphs.random(10, 4, 11L);
    CentralityResult result = seeded(3, 0.0, 5, 1L).compute(graph);
    assertEquals(3, result.getNodeId(0));
    assertEquals(50.0, result.getScoreOf(3), 0);
    for (int i = 0; i < 10; i++) {
      if (i != 3) {
        assertEquals(0.0, result.getScoreOf(i), 0);
      }
    }
  }

  @Test
  public void testFullContinuationAlternatesOnTwoCycle() {
    InMemoryGraph graph = SmallGraphs.directedCycle(2);
    CentralityResult result = seeded(0, 1.0, 7, 2L).compute(graph);
    assertEquals(7.0, result.getScoreOf(0), 0);
    assertEquals(7.0, result.getScoreOf(1), 0);
  }

  @Test
  public void testSinkReturnsToCenter() {
    InMemoryGraph graph = new InMemoryGraph(3).addEdge(0, 1);
    CentralityResult result = seeded(0, 1.0, 4, 3L).compute(graph);
    assertEquals(6.0, result.getScoreOf(0), 0);
    assertEquals(6.0, result.getScoreOf(1), 0);
    assertEquals(0.0, result.getScoreOf(2), 0);
  }

  @Test
  public void testVisitsAddUpToSteps() {
    InMemoryGraph graph = SmallGraphs.random(25, 5, 4L);
    double total = 0;
    for (NodeScore entry : seeded(0, 0.85, 8, 5L).compute(graph)) {
      total += entry.getScore();
    }
    assertEquals(25 * 8, total, 0);
  }

  @Test
  public void testSameSeedSameWalk() {
    InMemoryGraph graph = SmallGraphs.random(30, 5, 6L);
    assertArrayEquals(
        seeded(2, 0.85, 10, 99L).compute(graph).toScoreArray(),
        seeded(2, 0.85, 10, 99L).compute(graph).toScoreArray(), 0);
  }

  @Test
  public void testProgressOncePerStep() {
    ProgressReporter progress = mock(ProgressReporter.class);
    new PersonalizedPageRank(0, 0.5, 3, new Random(7L), progress)
        .compute(SmallGraphs.directedCycle(4));
    verify(progress).start(12);
    verify(progress, times(12)).report(anyLong());
    verify(progress).end();
  }

  @Test
  public void testCenterOutOfRangeFailsBeforeWork() {
    ProgressReporter progress = mock(ProgressReporter.class);
    PersonalizedPageRank walk =
        new PersonalizedPageRank(5, 0.5, 3, new Random(), progress);
    try {
      walk.compute(SmallGraphs.directedCycle(5));
    } catch (IllegalArgumentException e) {
      verifyNoInteractions(progress);
      return;
    }
    throw new AssertionError("Center node 5 should be rejected");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidContinuationProbability() {
    new PersonalizedPageRank(0, 1.5, 10);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativePasses() {
    new PersonalizedPageRank(0, 0.5, -1);
  }
}
