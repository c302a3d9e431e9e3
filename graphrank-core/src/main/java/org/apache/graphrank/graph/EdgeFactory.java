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

/**
 * Factory for creating Edges
 */
public class EdgeFactory {
  /** Weight given to edges created without one */
  public static final double DEFAULT_WEIGHT = 1.0;

  /** Do not construct */
  private EdgeFactory() { }

  /**
   * Create an edge pointing to a given node with a value.
   *
   * @param target target node id
   * @param weight edge weight
   * @return Edge pointing to target with given weight
   */
  public static Edge create(int target, double weight) {
    return new DefaultEdge(target, weight);
  }

  /**
   * Create an edge pointing to a given node with the default weight.
   *
   * @param target target node id
   * @return Edge pointing to target
   */
  public static Edge create(int target) {
    return new DefaultEdge(target, DEFAULT_WEIGHT);
  }
}
