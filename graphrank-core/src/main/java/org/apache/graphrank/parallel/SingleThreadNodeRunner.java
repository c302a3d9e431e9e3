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

import it.unimi.dsi.fastutil.ints.IntIterator;
import org.apache.graphrank.graph.GraphView;

import java.util.function.IntConsumer;

/**
 * Runs the function in the calling thread, in node iteration order.
 */
public class SingleThreadNodeRunner implements NodeRunner {
  @Override
  public void forEachNode(GraphView graph, IntConsumer function) {
    IntIterator nodes = graph.nodes();
    while (nodes.hasNext()) {
      function.accept(nodes.nextInt());
    }
  }

  @Override
  public int getNumWorkers() {
    return 1;
  }
}
