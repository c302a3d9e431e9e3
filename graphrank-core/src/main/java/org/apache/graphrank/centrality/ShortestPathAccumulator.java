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

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.apache.graphrank.graph.Edge;
import org.apache.graphrank.graph.GraphView;

import java.util.Arrays;

import com.google.common.annotations.VisibleForTesting;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Single source step of Brandes' algorithm: breadth first search from the
 * source, then back-propagation of path dependencies. All arrays are owned
 * by one instance, which serves one source.
 */
@NotThreadSafe
class ShortestPathAccumulator {
  /** Distance label of nodes not reached yet */
  private static final int UNVISITED = -1;

  /** Graph being traversed */
  private final GraphView graph;
  /** Source node */
  private final int source;
  /** Dependency of the source on each node */
  private final double[] delta;
  /** Number of shortest paths from the source to each node */
  private final double[] sigma;
  /** Distance from the source */
  private final int[] distance;
  /** Predecessors on shortest paths, created when a node is reached */
  private final IntArrayList[] predecessors;
  /** Visited nodes in non-decreasing distance */
  private final IntArrayList visitOrder;

  /**
   * Constructor
   *
   * @param graph Graph to traverse
   * @param source Source node
   */
  ShortestPathAccumulator(GraphView graph, int source) {
    int n = graph.size();
    this.graph = graph;
    this.source = source;
    delta = new double[n];
    sigma = new double[n];
    distance = new int[n];
    predecessors = new IntArrayList[n];
    visitOrder = new IntArrayList();
    Arrays.fill(distance, UNVISITED);
  }

  /**
   * Run the traversal and the accumulation
   *
   * @return this
   */
  ShortestPathAccumulator accumulate() {
    traverse();
    backPropagate();
    return this;
  }

  /**
   * Breadth first search counting shortest paths
   */
  private void traverse() {
    IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
    distance[source] = 0;
    sigma[source] = 1;
    predecessors[source] = new IntArrayList(0);
    queue.enqueue(source);
    while (!queue.isEmpty()) {
      int v = queue.dequeueInt();
      visitOrder.add(v);
      for (Edge edge : graph.adjacent(v)) {
        int w = edge.getTargetNodeId();
        if (distance[w] == UNVISITED) {
          distance[w] = distance[v] + 1;
          predecessors[w] = new IntArrayList();
          queue.enqueue(w);
        }
        if (distance[w] == distance[v] + 1) {
          sigma[w] += sigma[v];
          predecessors[w].add(v);
        }
      }
    }
  }

  /**
   * Walk visited nodes farthest first, pushing dependencies to
   * predecessors
   */
  private void backPropagate() {
    for (int i = visitOrder.size() - 1; i >= 0; i--) {
      int w = visitOrder.getInt(i);
      IntArrayList preds = predecessors[w];
      for (int j = 0; j < preds.size(); j++) {
        int v = preds.getInt(j);
        delta[v] += (sigma[v] / sigma[w]) * (1 + delta[w]);
      }
    }
  }

  /**
   * Add the dependencies of this source to a result vector.
   * Caller is responsible for synchronization on the target.
   *
   * @param target Scores indexed by node id
   */
  void addTo(double[] target) {
    for (int i = 0; i < visitOrder.size(); i++) {
      int w = visitOrder.getInt(i);
      if (w != source) {
        target[w] += delta[w];
      }
    }
  }

  /**
   * Dependency of the source on a node
   *
   * @param node Node id
   * @return Accumulated dependency
   */
  @VisibleForTesting
  double getDependency(int node) {
    return delta[node];
  }

  /**
   * Number of shortest paths from the source to a node
   *
   * @param node Node id
   * @return Path count, 0 if not reachable
   */
  @VisibleForTesting
  double getPathCount(int node) {
    return sigma[node];
  }

  /**
   * Distance from the source
   *
   * @param node Node id
   * @return Number of hops, -1 if not reachable
   */
  @VisibleForTesting
  int getDistance(int node) {
    return distance[node];
  }
}
