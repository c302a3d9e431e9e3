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
package org.apache.graphrank.utils;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.apache.log4j.Logger;
import org.junit.Test;

import java.util.function.Supplier;

/**
 * Test TimedLogger
 */
public class TestTimedLogger {
  private static final Logger LOG = Logger.getLogger(TestTimedLogger.class);

  @SuppressWarnings("unchecked")
  private static Supplier<String> mockMessage() {
    Supplier<String> msg = mock(Supplier.class);
    when(msg.get()).thenReturn("message");
    return msg;
  }

  @Test
  public void testZeroIntervalAlwaysPrints() {
    TimedLogger logger = new TimedLogger(0, LOG);
    assertTrue(logger.isPrintable());
    assertTrue(logger.isPrintable());
  }

  @Test
  public void testLongIntervalSuppresses() {
    TimedLogger logger = new TimedLogger(60 * 60 * 1000, LOG);
    assertFalse(logger.isPrintable());
    assertFalse(logger.info(() -> "suppressed"));
  }

  @Test
  public void testSuppressedMessageIsNotBuilt() {
    TimedLogger logger = new TimedLogger(60 * 60 * 1000, LOG);
    Supplier<String> msg = mockMessage();
    for (int i = 0; i < 100; i++) {
      assertFalse(logger.info(msg));
    }
    verifyNoInteractions(msg);
  }

  @Test
  public void testPrintedMessageIsBuiltOnce() {
    TimedLogger logger = new TimedLogger(0, LOG);
    Supplier<String> msg = mockMessage();
    assertTrue(logger.info(msg));
    verify(msg, times(1)).get();
  }
}
