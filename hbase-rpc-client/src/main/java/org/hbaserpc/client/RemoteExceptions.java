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

import com.google.common.collect.ImmutableSet;
import org.apache.yetus.audience.InterfaceAudience;

import org.hbaserpc.rpc.RpcHeader;

/**
 * Turns the exceptions reported by RegionServers into client exceptions.
 */
@InterfaceAudience.Private
final class RemoteExceptions {

  /**
   * Server-side exceptions after which the RPC should be sent again, potentially through a
   * different RegionServer.
   */
  static final ImmutableSet<String> RETRYABLE_EXCEPTIONS = ImmutableSet.of(
      "org.apache.hadoop.hbase.NotServingRegionException",
      "org.apache.hadoop.hbase.exceptions.RegionMovedException",
      "org.apache.hadoop.hbase.exceptions.RegionOpeningException");

  private RemoteExceptions() {
  }

  /**
   * Builds the exception to hand to the RPC that failed on the server.
   * @param exception the exception sent back by the server
   * @return a {@link RegionUnavailableException} if the RPC can be retried,
   * a {@link RemoteException} otherwise
   */
  static HBaseRpcException fromPB(RpcHeader.ExceptionResponse exception) {
    final String className = exception.getExceptionClassName();
    final String stackTrace = exception.getStackTrace();
    final String message = "HBase Java exception " + className + ":\n" + stackTrace;
    if (isRetryable(exception)) {
      HostAndPort newLocation = null;
      if (exception.hasHostname() && exception.hasPort()) {
        newLocation = new HostAndPort(exception.getHostname(), exception.getPort());
      }
      return new RegionUnavailableException(Status.ServiceUnavailable(message),
                                            className, stackTrace, newLocation);
    }
    return new RemoteException(Status.RemoteError(message), className, stackTrace);
  }

  /**
   * @return true if the server-side exception is a transient one and the server didn't ask us
   * not to retry
   */
  static boolean isRetryable(RpcHeader.ExceptionResponse exception) {
    return !exception.getDoNotRetry() &&
        RETRYABLE_EXCEPTIONS.contains(exception.getExceptionClassName());
  }
}
