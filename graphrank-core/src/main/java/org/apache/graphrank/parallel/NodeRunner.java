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
package org.apache.graphrank.parallel;

import org.apache.graphrank.graph.GraphView;

import java.util.function.IntConsumer;

/**
 * Runs a per-node function across all nodes of a graph, possibly on
 * several workers. Returns once the function has completed for every
 * node; any failure of the function aborts the run and is rethrown.
 */
public interface NodeRunner {
  /**
   * Apply function to each node of the graph
   *
   * @param graph Graph whose nodes are visited
   * @param function Function called once with each node id
   */
  void forEachNode(GraphView graph, IntConsumer function);

  /**
   * Maximum number of nodes processed at the same time
   *
   * @return Number of workers
   */
  int getNumWorkers();
}
