/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.dlt.common.runtime;

import io.dlt.exception.SignalReceivedException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cooperative cancellation token shared between the process that receives a stop signal and
 * the normalizers that check it at bounded intervals.
 */
public class Signals {

  private static final Logger LOG = LoggerFactory.getLogger(Signals.class);

  private static final int NO_SIGNAL = 0;

  private final AtomicInteger signalReceived = new AtomicInteger(NO_SIGNAL);

  /**
   * Records the signal. Work in progress stops at the next checkpoint.
   */
  public void signal(int signalNumber) {
    LOG.info("Signal {} received", signalNumber);
    signalReceived.compareAndSet(NO_SIGNAL, signalNumber);
  }

  public boolean isSignalled() {
    return signalReceived.get() != NO_SIGNAL;
  }

  /**
   * @throws SignalReceivedException if a signal was recorded
   */
  public void raiseIfSignalled() {
    int signalNumber = signalReceived.get();
    if (signalNumber != NO_SIGNAL) {
      throw new SignalReceivedException(signalNumber);
    }
  }

  public void reset() {
    signalReceived.set(NO_SIGNAL);
  }
}
