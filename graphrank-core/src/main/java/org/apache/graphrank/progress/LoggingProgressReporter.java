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

import org.apache.graphrank.utils.TimedLogger;
import org.apache.log4j.Logger;

import javax.annotation.concurrent.ThreadSafe;
import java.text.DecimalFormat;

/**
 * Progress reporter writing "N of total done" lines to the log, at most
 * once per configured interval. Start and end are always logged.
 */
@ThreadSafe
public class LoggingProgressReporter implements ProgressReporter {
  /** Class logger */
  private static final Logger LOG =
      Logger.getLogger(LoggingProgressReporter.class);
  /** Decimal format which rounds numbers to two decimal places */
  private static final DecimalFormat DECIMAL_FORMAT =
      new DecimalFormat("#.##");

  /** Name of the task being reported */
  private final String taskName;
  /** Rate limited logger for intermediate reports */
  private final TimedLogger timedLogger;
  /** Total number of units, set in start */
  private volatile long total = -1;
  /** Start time in msecs */
  private volatile long startMsecs;

  /**
   * Constructor
   *
   * @param taskName Name of the task, used as log prefix
   * @param intervalMsecs Minimum msecs between two intermediate log lines
   */
  public LoggingProgressReporter(String taskName, int intervalMsecs) {
    this.taskName = taskName;
    this.timedLogger = new TimedLogger(intervalMsecs, LOG);
  }

  @Override
  public void start(long total) {
    this.total = total;
    startMsecs = System.currentTimeMillis();
    if (LOG.isInfoEnabled()) {
      LOG.info(taskName + ": Starting, " + total + " units of work");
    }
  }

  @Override
  public void report(long current) {
    timedLogger.info(() -> taskName + ": " + current + " of " + total +
        " done (" + percentage(current) + "%)");
  }

  @Override
  public void end() {
    if (LOG.isInfoEnabled()) {
      LOG.info(taskName + ": Finished in " +
          (System.currentTimeMillis() - startMsecs) + " msecs");
    }
  }

  /**
   * Percentage of work done
   *
   * @param current Units done
   * @return Formatted percentage
   */
  private String percentage(long current) {
    if (total <= 0) {
      return "100";
    }
    synchronized (DECIMAL_FORMAT) {
      return DECIMAL_FORMAT.format(100.0 * current / total);
    }
  }
}
