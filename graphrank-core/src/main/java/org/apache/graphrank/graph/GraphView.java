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

import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.List;

/**
 * Read-only view of a graph, as consumed by the centrality algorithms.
 * Node ids are dense and lie in [0, {@link #size()}).
 *
 * Implementations must allow concurrent reads from several threads.
 */
public interface GraphView {
  /**
   * Number of nodes in the graph. Defines the valid node id range.
   *
   * @return Number of nodes
   */
  int size();

  /**
   * Iterate over all node ids, each exactly once.
   *
   * @return Node id iterator
   */
  IntIterator nodes();

  /**
   * Outgoing edges of a node. An empty list means a sink node.
   *
   * @param id Node id
   * @return Outgoing edges
   */
  List<Edge> adjacent(int id);

  /**
   * Ids of the nodes having an edge to the given node. Only needed for
   * directed PageRank.
   *
   * @param id Node id
   * @return Incoming neighbor ids
   */
  IntList incoming(int id);
}
