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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.apache.graphrank.graph.InMemoryGraph;
import org.junit.Test;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicIntegerArray;

/**
 * Test node runners
 */
public class TestThreadPoolNodeRunner {
  @Test
  public void testEachNodeOnce() {
    InMemoryGraph graph = new InMemoryGraph(1000);
    final AtomicIntegerArray calls = new AtomicIntegerArray(graph.size());
    final Set<String> threads =
        Collections.newSetFromMap(new ConcurrentHashMap<String, Boolean>());
    new ThreadPoolNodeRunner(4).forEachNode(graph, node -> {
      calls.incrementAndGet(node);
      threads.add(Thread.currentThread().getName());
    });
    for (int i = 0; i < graph.size(); i++) {
      assertEquals(1, calls.get(i));
    }
    assertTrue(threads.size() <= 4);
    for (String name : threads) {
      assertTrue(name, name.startsWith("node-runner-"));
    }
  }

  @Test
  public void testWorkerFailureIsPropagated() {
    InMemoryGraph graph = new InMemoryGraph(100);
    try {
      new ThreadPoolNodeRunner(3).forEachNode(graph, node -> {
        if (node == 17) {
          throw new IllegalArgumentException("bad node " + node);
        }
      });
      fail("Worker failure should be rethrown");
    } catch (IllegalStateException e) {
      assertTrue(e.getCause() instanceof IllegalArgumentException);
      assertEquals("bad node 17", e.getCause().getMessage());
    }
  }

  @Test
  public void testEmptyGraph() {
    new ThreadPoolNodeRunner(2).forEachNode(new InMemoryGraph(0), node -> {
      fail("No node expected");
    });
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoThreads() {
    new ThreadPoolNodeRunner(0);
  }

  @Test
  public void testSingleThreadRunsInOrder() {
    final StringBuilder order = new StringBuilder();
    SingleThreadNodeRunner runner = new SingleThreadNodeRunner();
    runner.forEachNode(new InMemoryGraph(4), node -> order.append(node));
    assertEquals("0123", order.toString());
    assertEquals(1, runner.getNumWorkers());
  }
}
