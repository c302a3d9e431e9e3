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

import org.apache.hadoop.conf.Configuration;

/**
 * Adds user methods specific to GraphRank on top of a Hadoop
 * {@link Configuration}.
 */
public class GraphRankConfiguration extends Configuration
    implements GraphRankConstants {
  /**
   * Constructor that creates the configuration without loading
   * the Hadoop default resources
   */
  public GraphRankConfiguration() {
    super(false);
  }

  /**
   * Constructor.
   *
   * @param conf Configuration
   */
  public GraphRankConfiguration(Configuration conf) {
    super(conf);
  }

  /**
   * Get the number of compute threads
   *
   * @return Number of compute threads
   */
  public int getNumComputeThreads() {
    return NUM_COMPUTE_THREADS.get(this);
  }

  /**
   * Set the number of compute threads
   *
   * @param numComputeThreads Number of compute threads to use
   */
  public void setNumComputeThreads(int numComputeThreads) {
    NUM_COMPUTE_THREADS.set(this, numComputeThreads);
  }

  /**
   * Get the minimum interval between two progress log lines
   *
   * @return Interval in msecs
   */
  public int getProgressLogIntervalMsecs() {
    return PROGRESS_LOG_INTERVAL_MSECS.get(this);
  }
}
