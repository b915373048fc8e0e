// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.hbaserpc.client;

import java.util.concurrent.TimeUnit;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import org.apache.yetus.audience.InterfaceAudience;

/**
 * Deadline of a single call, measured from the moment the tracker is built.
 * A timeout of 0 means the call never expires.
 */
@InterfaceAudience.Private
final class TimeoutTracker {
  private final Stopwatch stopwatch;
  private volatile long timeoutMs;

  TimeoutTracker() {
    this(Stopwatch.createUnstarted());
  }

  /**
   * @param stopwatch the clock to measure elapsed time with, restarted here
   */
  TimeoutTracker(Stopwatch stopwatch) {
    this.stopwatch = stopwatch.reset().start();
  }

  boolean hasTimeout() {
    return timeoutMs != 0;
  }

  long getTimeout() {
    return timeoutMs;
  }

  void setTimeout(long timeoutMs) {
    Preconditions.checkArgument(timeoutMs >= 0, "negative timeout: %s", timeoutMs);
    this.timeoutMs = timeoutMs;
  }

  long getElapsedMillis() {
    return stopwatch.elapsed(TimeUnit.MILLISECONDS);
  }

  /** True once a deadline is set and the elapsed time has reached it. */
  boolean timedOut() {
    return hasTimeout() && getElapsedMillis() >= timeoutMs;
  }

  /**
   * Time left before the deadline. Never less than 1 since the value goes on the wire,
   * where 0 stands for "no deadline".
   * @throws IllegalStateException if no deadline is set
   */
  long getMillisBeforeTimeout() {
    Preconditions.checkState(hasTimeout(), "no timeout set");
    return Math.max(1, timeoutMs - getElapsedMillis());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("timeout", timeoutMs)
        .add("elapsed", getElapsedMillis())
        .toString();
  }
}
