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

import com.google.common.base.MoreObjects;

/**
 * Score of a single node in a {@link CentralityResult}.
 */
public final class NodeScore {
  /** Node id */
  private final int nodeId;
  /** Score, meaning depends on the algorithm */
  private final double score;

  /**
   * Constructor
   *
   * @param nodeId Node id
   * @param score Score of the node
   */
  public NodeScore(int nodeId, double score) {
    this.nodeId = nodeId;
    this.score = score;
  }

  public int getNodeId() {
    return nodeId;
  }

  public double getScore() {
    return score;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NodeScore)) {
      return false;
    }
    NodeScore that = (NodeScore) o;
    return nodeId == that.nodeId &&
        Double.compare(score, that.score) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * nodeId + Double.hashCode(score);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("nodeId", nodeId)
        .add("score", score).toString();
  }
}
