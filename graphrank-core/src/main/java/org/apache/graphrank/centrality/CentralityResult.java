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

import it.unimi.dsi.fastutil.ints.IntArrays;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * Scores of all nodes of a graph, ordered by descending score.
 * Nodes with equal scores are ordered by ascending node id.
 *
 * Immutable.
 */
public class CentralityResult implements Iterable<NodeScore> {
  /** Empty result */
  private static final CentralityResult EMPTY =
      new CentralityResult(new int[0], new double[0], new int[0]);

  /** Node ids, in rank order */
  private final int[] nodeIds;
  /** Scores, in rank order */
  private final double[] scores;
  /** Rank of each node, indexed by node id */
  private final int[] ranks;

  /**
   * Constructor
   *
   * @param nodeIds Node ids in rank order
   * @param scores Scores in rank order
   * @param ranks Rank per node id
   */
  private CentralityResult(int[] nodeIds, double[] scores, int[] ranks) {
    this.nodeIds = nodeIds;
    this.scores = scores;
    this.ranks = ranks;
  }

  /**
   * Create a result from scores indexed by node id. The array is copied.
   *
   * @param scoresByNode Score of each node, index is the node id
   * @return Sorted result
   */
  public static CentralityResult fromScores(final double[] scoresByNode) {
    Preconditions.checkNotNull(scoresByNode);
    int n = scoresByNode.length;
    if (n == 0) {
      return EMPTY;
    }
    final double[] values = Arrays.copyOf(scoresByNode, n);
    int[] order = new int[n];
    for (int i = 0; i < n; i++) {
      order[i] = i;
    }
    IntArrays.quickSort(order, (a, b) -> {
      int byScore = Double.compare(values[b], values[a]);
      return byScore != 0 ? byScore : Integer.compare(a, b);
    });

    double[] sorted = new double[n];
    int[] ranks = new int[n];
    for (int rank = 0; rank < n; rank++) {
      sorted[rank] = values[order[rank]];
      ranks[order[rank]] = rank;
    }
    return new CentralityResult(order, sorted, ranks);
  }

  /**
   * Get an empty result
   *
   * @return Result without entries
   */
  public static CentralityResult empty() {
    return EMPTY;
  }

  /**
   * Number of entries, equal to the number of nodes in the graph
   *
   * @return Number of entries
   */
  public int size() {
    return nodeIds.length;
  }

  /**
   * Get entry at a given rank
   *
   * @param rank Rank, 0 is the highest score
   * @return Entry
   */
  public NodeScore get(int rank) {
    return new NodeScore(getNodeId(rank), getScore(rank));
  }

  /**
   * Get node id at a given rank
   *
   * @param rank Rank, 0 is the highest score
   * @return Node id
   */
  public int getNodeId(int rank) {
    Preconditions.checkElementIndex(rank, nodeIds.length, "rank");
    return nodeIds[rank];
  }

  /**
   * Get score at a given rank
   *
   * @param rank Rank, 0 is the highest score
   * @return Score
   */
  public double getScore(int rank) {
    Preconditions.checkElementIndex(rank, scores.length, "rank");
    return scores[rank];
  }

  /**
   * Get rank of a node
   *
   * @param nodeId Node id
   * @return Rank, 0 is the highest score
   */
  public int getRankOf(int nodeId) {
    Preconditions.checkElementIndex(nodeId, ranks.length, "node id");
    return ranks[nodeId];
  }

  /**
   * Get score of a node
   *
   * @param nodeId Node id
   * @return Score of the node
   */
  public double getScoreOf(int nodeId) {
    return scores[getRankOf(nodeId)];
  }

  /**
   * Get the best entries
   *
   * @param k Maximum number of entries to return
   * @return Up to k entries with the highest scores, in rank order
   */
  public List<NodeScore> top(int k) {
    Preconditions.checkArgument(k >= 0, "top: k must be >= 0, got %s", k);
    int count = Math.min(k, size());
    List<NodeScore> best = Lists.newArrayListWithCapacity(count);
    for (int rank = 0; rank < count; rank++) {
      best.add(get(rank));
    }
    return best;
  }

  /**
   * Scores indexed by node id
   *
   * @return New array, index is the node id
   */
  public double[] toScoreArray() {
    double[] byNode = new double[scores.length];
    for (int rank = 0; rank < scores.length; rank++) {
      byNode[nodeIds[rank]] = scores[rank];
    }
    return byNode;
  }

  @Override
  public Iterator<NodeScore> iterator() {
    return new Iterator<NodeScore>() {
      /** Next rank to return */
      private int rank = 0;

      @Override
      public boolean hasNext() {
        return rank < nodeIds.length;
      }

      @Override
      public NodeScore next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return get(rank++);
      }
    };
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("CentralityResult{");
    for (int rank = 0; rank < nodeIds.length; rank++) {
      if (rank > 0) {
        sb.append(", ");
      }
      sb.append(nodeIds[rank]).append('=').append(scores[rank]);
    }
    return sb.append('}').toString();
  }
}
