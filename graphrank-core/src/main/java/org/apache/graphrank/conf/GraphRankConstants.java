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
package org.apache.graphrank.conf;

/**
 * Constants used all over GraphRank for configuration.
 */
// CHECKSTYLE: stop InterfaceIsTypeCheck
public interface GraphRankConstants {
  /** Number of threads used by parallel centrality computations */
  IntConfOption NUM_COMPUTE_THREADS =
      new IntConfOption("graphrank.numComputeThreads", 1,
          "Number of threads used by parallel centrality computations");

  /** Minimum number of msecs between two progress log lines */
  IntConfOption PROGRESS_LOG_INTERVAL_MSECS =
      new IntConfOption("graphrank.progressLogIntervalMsecs", 15 * 1000,
          "Minimum number of msecs between two progress log lines");
}
// CHECKSTYLE: resume InterfaceIsTypeCheck
