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

import org.junit.Test;

import java.util.List;

/**
 * Test CentralityResult
 */
public class TestCentralityResult {
  private static final double[] SCORES = {1.0, 3.0, 3.0, 0.5};

  @Test
  public void testSortedDescendingWithIdTieBreak() {
    CentralityResult result = CentralityResult.fromScores(SCORES);
    assertEquals(4, result.size());
    assertEquals(1, result.getNodeId(0));
    assertEquals(2, result.getNodeId(1));
    assertEquals(0, result.getNodeId(2));
    assertEquals(3, result.getNodeId(3));
    assertEquals(3.0, result.getScore(0), 0);
    assertEquals(0.5, result.getScore(3), 0);
  }

  @Test
  public void testLookupByNode() {
    CentralityResult result = CentralityResult.fromScores(SCORES);
    assertEquals(2, result.getRankOf(0));
    assertEquals(1.0, result.getScoreOf(0), 0);
    assertEquals(new NodeScore(3, 0.5), result.get(result.getRankOf(3)));
    assertArrayEquals(SCORES, result.toScoreArray(), 0);
  }

  @Test
  public void testTop() {
    CentralityResult result = CentralityResult.fromScores(SCORES);
    List<NodeScore> top = result.top(2);
    assertEquals(2, top.size());
    assertEquals(new NodeScore(1, 3.0), top.get(0));
    assertEquals(new NodeScore(2, 3.0), top.get(1));
    assertEquals(4, result.top(10).size());
    assertEquals(0, result.top(0).size());
  }

  @Test
  public void testIterationFollowsRank() {
    CentralityResult result = CentralityResult.fromScores(SCORES);
    int rank = 0;
    for (NodeScore entry : result) {
      assertEquals(result.getNodeId(rank), entry.getNodeId());
      assertEquals(result.getScore(rank), entry.getScore(), 0);
      rank++;
    }
    assertEquals(4, rank);
  }

  @Test
  public void testInputIsCopied() {
    double[] scores = {2.0, 1.0};
    CentralityResult result = CentralityResult.fromScores(scores);
    scores[1] = 10.0;
    assertEquals(0, result.getNodeId(0));
    assertEquals(1.0, result.getScoreOf(1), 0);
  }

  @Test
  public void testEmpty() {
    CentralityResult result = CentralityResult.fromScores(new double[0]);
    assertEquals(0, result.size());
    assertEquals("CentralityResult{}", result.toString());
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void testRankOutOfRange() {
    CentralityResult.fromScores(SCORES).getNodeId(4);
  }
}
