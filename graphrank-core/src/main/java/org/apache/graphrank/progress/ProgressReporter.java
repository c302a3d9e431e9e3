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
package org.apache.graphrank.progress;

/**
 * Sink for progress of a single centrality computation. Calls are purely
 * observational and never change results.
 *
 * {@link #report(long)} may be called from several threads at once by
 * parallel computations; implementations must tolerate that.
 */
public interface ProgressReporter {
  /**
   * Called once before any unit of work is done.
   *
   * @param total Total number of units that will be reported
   */
  void start(long total);

  /**
   * Report that a number of units are done.
   *
   * @param current Number of units done so far
   */
  void report(long current);

  /**
   * Called once after the result is complete.
   */
  void end();
}
