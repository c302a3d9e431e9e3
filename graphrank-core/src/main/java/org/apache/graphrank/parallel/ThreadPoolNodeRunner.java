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

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.apache.graphrank.graph.GraphView;
import org.apache.log4j.Logger;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntConsumer;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import javax.annotation.concurrent.ThreadSafe;

/**
 * Runs the function on a fixed pool of threads. Nodes are handed out one
 * at a time from a shared cursor, so workers stay busy even when the cost
 * per node is very uneven. A new pool is used for every call.
 */
@ThreadSafe
public class ThreadPoolNodeRunner implements NodeRunner {
  /** Class logger */
  private static final Logger LOG =
      Logger.getLogger(ThreadPoolNodeRunner.class);

  /** Number of threads to use */
  private final int numThreads;

  /**
   * Constructor
   *
   * @param numThreads Number of threads to use
   */
  public ThreadPoolNodeRunner(int numThreads) {
    Preconditions.checkArgument(numThreads >= 1,
        "ThreadPoolNodeRunner: Number of threads must be >= 1, got %s",
        numThreads);
    this.numThreads = numThreads;
  }

  @Override
  public void forEachNode(GraphView graph, final IntConsumer function) {
    Preconditions.checkNotNull(function);
    final IntArrayList nodes = new IntArrayList(graph.nodes());
    int workers = Math.min(numThreads, nodes.size());
    if (workers == 0) {
      return;
    }

    ExecutorService executor = Executors.newFixedThreadPool(workers,
        new ThreadFactoryBuilder().setNameFormat("node-runner-%d")
            .setDaemon(true).build());
    final AtomicInteger cursor = new AtomicInteger();
    final CountDownLatch latch = new CountDownLatch(workers);
    final AtomicReference<Throwable> exception = new AtomicReference<>();
    try {
      for (int i = 0; i < workers; i++) {
        executor.execute(new Runnable() {
          @Override
          public void run() {
            try {
              int index;
              while (exception.get() == null &&
                  (index = cursor.getAndIncrement()) < nodes.size()) {
                function.accept(nodes.getInt(index));
              }
            // CHECKSTYLE: stop IllegalCatch
            // Need to propagate all exceptions to the calling thread
            } catch (Throwable t) {
            // CHECKSTYLE: resume IllegalCatch
              LOG.error("run: Worker failed", t);
              exception.compareAndSet(null, t);
            } finally {
              latch.countDown();
            }
          }
        });
      }

      try {
        latch.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("forEachNode: " +
            "InterruptedException occurred while waiting for workers", e);
      }
    } finally {
      executor.shutdownNow();
    }

    if (exception.get() != null) {
      throw new IllegalStateException("forEachNode: Worker failed",
          exception.get());
    }
  }

  @Override
  public int getNumWorkers() {
    return numThreads;
  }
}
