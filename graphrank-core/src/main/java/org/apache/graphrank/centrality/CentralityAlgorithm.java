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

import org.apache.graphrank.graph.GraphView;

/**
 * Computes a score for every node of a graph.
 *
 * Implementations hold only their parameters, so one instance can be used
 * for several graphs and calls.
 */
public interface CentralityAlgorithm {
  /**
   * Compute scores of all nodes
   *
   * @param graph Graph to rank, not modified
   * @return One entry per node, sorted by descending score
   */
  CentralityResult compute(GraphView graph);

  /**
   * Which algorithm this is
   *
   * @return Algorithm type
   */
  CentralityType getType();
}
