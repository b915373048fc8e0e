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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * Settings of a {@link RegionClient}, shared by all the connections of an
 * {@link AsyncHBaseClient}.
 */
@InterfaceAudience.Private
@InterfaceStability.Unstable
public final class RegionClientConfig {

  private final int rpcQueueSize;
  private final long flushIntervalMs;
  private final String effectiveUser;
  private final long connectTimeoutMs;

  /**
   * @param rpcQueueSize number of queued RPCs above which the sender is woken up right away
   * @param flushIntervalMs the longest an RPC waits in the queue before being sent
   * @param effectiveUser the user sent to the server in the connection header
   * @param connectTimeoutMs how long to wait for the TCP connection to be established
   */
  public RegionClientConfig(int rpcQueueSize,
                            long flushIntervalMs,
                            String effectiveUser,
                            long connectTimeoutMs) {
    Preconditions.checkArgument(rpcQueueSize >= 0, "invalid RPC queue size: %s", rpcQueueSize);
    Preconditions.checkArgument(flushIntervalMs > 0,
        "invalid flush interval: %s", flushIntervalMs);
    Preconditions.checkArgument(connectTimeoutMs > 0 && connectTimeoutMs <= Integer.MAX_VALUE,
        "invalid connect timeout: %s", connectTimeoutMs);
    this.rpcQueueSize = rpcQueueSize;
    this.flushIntervalMs = flushIntervalMs;
    this.effectiveUser = Preconditions.checkNotNull(effectiveUser);
    this.connectTimeoutMs = connectTimeoutMs;
  }

  public int getRpcQueueSize() {
    return rpcQueueSize;
  }

  public long getFlushIntervalMs() {
    return flushIntervalMs;
  }

  public String getEffectiveUser() {
    return effectiveUser;
  }

  public long getConnectTimeoutMs() {
    return connectTimeoutMs;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("rpcQueueSize", rpcQueueSize)
                      .add("flushIntervalMs", flushIntervalMs)
                      .add("effectiveUser", effectiveUser)
                      .add("connectTimeoutMs", connectTimeoutMs)
                      .toString();
  }
}
