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

import org.apache.graphrank.progress.ProgressReporter;

import com.google.common.base.Preconditions;

/**
 * Base class of centrality algorithms, keeps the progress sink.
 */
public abstract class AbstractCentralityAlgorithm
    implements CentralityAlgorithm {
  /** Where progress is reported */
  private final ProgressReporter progress;

  /**
   * Constructor
   *
   * @param progress Progress sink
   */
  protected AbstractCentralityAlgorithm(ProgressReporter progress) {
    this.progress = Preconditions.checkNotNull(progress,
        "progress reporter must not be null");
  }

  public ProgressReporter getProgressReporter() {
    return progress;
  }

  /**
   * Check a probability parameter
   *
   * @param name Parameter name, for the error message
   * @param value Value to check
   */
  protected static void checkProbability(String name, double value) {
    Preconditions.checkArgument(value >= 0 && value <= 1,
        "%s must be in [0, 1], got %s", name, value);
  }

  /**
   * Check a count parameter
   *
   * @param name Parameter name, for the error message
   * @param value Value to check
   */
  protected static void checkNonNegative(String name, int value) {
    Preconditions.checkArgument(value >= 0,
        "%s must be >= 0, got %s", name, value);
  }
}
