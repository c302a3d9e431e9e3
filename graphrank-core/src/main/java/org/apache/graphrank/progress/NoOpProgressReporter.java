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
 * Progress reporter which ignores everything.
 */
public final class NoOpProgressReporter implements ProgressReporter {
  /** Singleton instance */
  public static final NoOpProgressReporter INSTANCE =
      new NoOpProgressReporter();

  /** Use {@link #INSTANCE} */
  private NoOpProgressReporter() { }

  @Override
  public void start(long total) {
  }

  @Override
  public void report(long current) {
  }

  @Override
  public void end() {
  }
}
