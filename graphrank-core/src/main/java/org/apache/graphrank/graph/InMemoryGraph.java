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
package org.apache.graphrank.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntIterators;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * Adjacency list graph kept in memory, with a fixed number of nodes.
 * Keeps an incoming index next to the outgoing edges.
 *
 * Not thread-safe while edges are being added; concurrent reads are fine
 * once building is done.
 */
public class InMemoryGraph implements GraphView {
  /** Outgoing edges per node */
  private final List<List<Edge>> outEdges;
  /** Incoming neighbor ids per node */
  private final List<IntArrayList> inNeighbors;
  /** Number of directed edges added */
  private long numEdges = 0;

  /**
   * Constructor
   *
   * @param numNodes Number of nodes, ids will be [0, numNodes)
   */
  public InMemoryGraph(int numNodes) {
    Preconditions.checkArgument(numNodes >= 0,
        "InMemoryGraph: Number of nodes must be >= 0, got %s", numNodes);
    outEdges = Lists.newArrayListWithCapacity(numNodes);
    inNeighbors = Lists.newArrayListWithCapacity(numNodes);
    for (int i = 0; i < numNodes; i++) {
      outEdges.add(new ArrayList<Edge>());
      inNeighbors.add(new IntArrayList());
    }
  }

  /**
   * Add a directed edge with the default weight
   *
   * @param from Edge origin
   * @param to Edge destination
   * @return this
   */
  public InMemoryGraph addEdge(int from, int to) {
    return addEdge(from, to, EdgeFactory.DEFAULT_WEIGHT);
  }

  /**
   * Add a directed edge
   *
   * @param from Edge origin
   * @param to Edge destination
   * @param weight Edge weight
   * @return this
   */
  public InMemoryGraph addEdge(int from, int to, double weight) {
    checkNode(from);
    checkNode(to);
    outEdges.get(from).add(EdgeFactory.create(to, weight));
    inNeighbors.get(to).add(from);
    numEdges++;
    return this;
  }

  /**
   * Add an undirected edge, stored as two directed edges
   *
   * @param a One endpoint
   * @param b Other endpoint
   * @return this
   */
  public InMemoryGraph addUndirectedEdge(int a, int b) {
    return addUndirectedEdge(a, b, EdgeFactory.DEFAULT_WEIGHT);
  }

  /**
   * Add an undirected edge, stored as two directed edges
   *
   * @param a One endpoint
   * @param b Other endpoint
   * @param weight Edge weight
   * @return this
   */
  public InMemoryGraph addUndirectedEdge(int a, int b, double weight) {
    addEdge(a, b, weight);
    return addEdge(b, a, weight);
  }

  public long getNumEdges() {
    return numEdges;
  }

  @Override
  public int size() {
    return outEdges.size();
  }

  @Override
  public IntIterator nodes() {
    return IntIterators.fromTo(0, size());
  }

  @Override
  public List<Edge> adjacent(int id) {
    checkNode(id);
    return Collections.unmodifiableList(outEdges.get(id));
  }

  @Override
  public IntList incoming(int id) {
    checkNode(id);
    return IntLists.unmodifiable(inNeighbors.get(id));
  }

  /**
   * Check that a node id is in range
   *
   * @param id Node id
   */
  private void checkNode(int id) {
    Preconditions.checkElementIndex(id, size(), "node id");
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("nodes", size())
        .add("edges", numEdges)
        .add("outEdges", outEdges).toString();
  }
}
