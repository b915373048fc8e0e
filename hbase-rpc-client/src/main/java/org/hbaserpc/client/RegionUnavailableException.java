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

import javax.annotation.Nullable;

import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * A server-side exception telling that the region the RPC was addressed to isn't available on
 * that RegionServer right now: it isn't served there, it moved away, or it is still opening.
 * The RPC should be sent again once the region's location has been looked up anew.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@SuppressWarnings("serial")
public class RegionUnavailableException extends RecoverableException {

  private final String exceptionClassName;
  private final String remoteStackTrace;
  @Nullable
  private final HostAndPort newLocation;

  RegionUnavailableException(Status status,
                             String exceptionClassName,
                             String remoteStackTrace,
                             @Nullable HostAndPort newLocation) {
    super(status);
    this.exceptionClassName = exceptionClassName;
    this.remoteStackTrace = remoteStackTrace;
    this.newLocation = newLocation;
  }

  /** @return the fully qualified name of the Java exception thrown on the server */
  public String getExceptionClassName() {
    return exceptionClassName;
  }

  /** @return the stack trace of the exception, as formatted by the server */
  public String getRemoteStackTrace() {
    return remoteStackTrace;
  }

  /**
   * The server the region moved to, as reported by a {@code RegionMovedException}.
   * <p>
   * {@link AsyncHBaseClient} only drops the stale location from its cache; it doesn't connect
   * to this server by itself, since errbacks run on I/O threads and connecting blocks. A caller
   * re-resolving the region may use it as a hint, passing it along with the region to
   * {@link AsyncHBaseClient#cacheRegion(RegionInfo, HostAndPort)} from its own thread.
   *
   * @return the server the region moved to, or {@code null} if the server didn't tell
   */
  @Nullable
  public HostAndPort getNewLocation() {
    return newLocation;
  }
}
