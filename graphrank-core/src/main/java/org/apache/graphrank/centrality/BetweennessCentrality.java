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
import org.apache.graphrank.parallel.NodeRunner;
import org.apache.graphrank.parallel.SingleThreadNodeRunner;
import org.apache.graphrank.progress.NoOpProgressReporter;
import org.apache.graphrank.progress.ProgressReporter;
import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;

import javax.annotation.concurrent.GuardedBy;

/**
 * Betweenness centrality with Brandes' algorithm. Every node is used as a
 * source once; sources are processed by the given {@link NodeRunner}, each
 * with its own {@link ShortestPathAccumulator}, and their dependencies are
 * summed into a shared vector.
 *
 * Sums are not halved for undirected graphs: an undirected edge is seen as
 * two directed edges, so every unordered pair of endpoints contributes
 * twice. The order in which sources are added is not fixed, scores can
 * differ in the last bits between runs.
 */
public class BetweennessCentrality extends AbstractCentralityAlgorithm {
  /** Class logger */
  private static final Logger LOG =
      Logger.getLogger(BetweennessCentrality.class);

  /** Distributes sources over workers */
  private final NodeRunner nodeRunner;

  /** Constructor, single threaded and without progress reporting */
  public BetweennessCentrality() {
    this(new SingleThreadNodeRunner(), NoOpProgressReporter.INSTANCE);
  }

  /**
   * Constructor
   *
   * @param nodeRunner Distributes sources over workers
   * @param progress Progress sink, told once per finished source
   */
  public BetweennessCentrality(NodeRunner nodeRunner,
      ProgressReporter progress) {
    super(progress);
    this.nodeRunner = Preconditions.checkNotNull(nodeRunner,
        "node runner must not be null");
  }

  @Override
  public CentralityResult compute(final GraphView graph) {
    int n = graph.size();
    long startMsecs = System.currentTimeMillis();
    if (LOG.isInfoEnabled()) {
      LOG.info("compute: Starting betweenness on " + n + " nodes with " +
          nodeRunner.getNumWorkers() + " workers");
    }
    getProgressReporter().start(n);

    final Accumulation accumulation =
        new Accumulation(n, getProgressReporter());
    nodeRunner.forEachNode(graph, source -> accumulation.add(
        new ShortestPathAccumulator(graph, source).accumulate()));

    CentralityResult result =
        CentralityResult.fromScores(accumulation.getScores());
    getProgressReporter().end();
    if (LOG.isInfoEnabled()) {
      LOG.info("compute: Finished betweenness in " +
          (System.currentTimeMillis() - startMsecs) + " msecs");
    }
    return result;
  }

  @Override
  public CentralityType getType() {
    return CentralityType.BETWEENNESS;
  }

  /**
   * State shared by the workers of one computation. Committing a source
   * and counting it use different locks, so a worker reporting progress
   * never waits on a commit of another worker.
   */
  private static class Accumulation {
    /** Guards scores */
    private final Object calculationLock = new Object();
    /** Guards done */
    private final Object progressLock = new Object();
    /** Sum of dependencies over all sources, indexed by node id */
    @GuardedBy("calculationLock")
    private final double[] scores;
    /** Number of sources finished */
    @GuardedBy("progressLock")
    private long done = 0;
    /** Progress sink */
    private final ProgressReporter progress;

    /**
     * Constructor
     *
     * @param numNodes Number of nodes
     * @param progress Progress sink
     */
    Accumulation(int numNodes, ProgressReporter progress) {
      scores = new double[numNodes];
      this.progress = progress;
    }

    /**
     * Commit the contribution of one source
     *
     * @param accumulator Finished single source accumulator
     */
    void add(ShortestPathAccumulator accumulator) {
      synchronized (calculationLock) {
        accumulator.addTo(scores);
      }
      synchronized (progressLock) {
        done++;
        progress.report(done);
      }
    }

    /**
     * Get summed scores, only valid once all workers are done
     *
     * @return Scores indexed by node id
     */
    double[] getScores() {
      synchronized (calculationLock) {
        return scores;
      }
    }
  }
}
