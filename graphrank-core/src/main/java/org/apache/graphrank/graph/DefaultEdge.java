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

import java.util.Objects;

/**
 * Immutable edge, the target node and the edge weight.
 */
public class DefaultEdge implements Edge {
  /** Target node id */
  private final int targetNodeId;
  /** Edge weight */
  private final double weight;

  /**
   * Create the edge with final values
   *
   * @param targetNodeId Destination node id.
   * @param weight Weight of the edge.
   */
  public DefaultEdge(int targetNodeId, double weight) {
    this.targetNodeId = targetNodeId;
    this.weight = weight;
  }

  @Override
  public int getTargetNodeId() {
    return targetNodeId;
  }

  @Override
  public double getWeight() {
    return weight;
  }

  @Override
  public String toString() {
    return "(TargetNodeId = " + targetNodeId + ", " +
        "weight = " + weight + ")";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    DefaultEdge edge = (DefaultEdge) o;
    return targetNodeId == edge.targetNodeId &&
        Double.compare(weight, edge.weight) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(targetNodeId, weight);
  }
}
