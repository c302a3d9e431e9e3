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

import it.unimi.dsi.fastutil.ints.IntIterator;
import org.apache.graphrank.graph.GraphView;
import org.apache.graphrank.progress.NoOpProgressReporter;
import org.apache.graphrank.progress.ProgressReporter;

/**
 * Degree centrality: the score of a node is its number of outgoing edges.
 */
public class DegreeCentrality extends AbstractCentralityAlgorithm {
  /** Constructor, without progress reporting */
  public DegreeCentrality() {
    this(NoOpProgressReporter.INSTANCE);
  }

  /**
   * Constructor
   *
   * @param progress Progress sink
   */
  public DegreeCentrality(ProgressReporter progress) {
    super(progress);
  }

  @Override
  public CentralityResult compute(GraphView graph) {
    ProgressReporter progress = getProgressReporter();
    int n = graph.size();
    progress.start(n);
    double[] degrees = new double[n];
    IntIterator nodes = graph.nodes();
    while (nodes.hasNext()) {
      int node = nodes.nextInt();
      degrees[node] = graph.adjacent(node).size();
    }
    CentralityResult result = CentralityResult.fromScores(degrees);
    progress.end();
    return result;
  }

  @Override
  public CentralityType getType() {
    return CentralityType.DEGREE;
  }
}
