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

import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * An exception thrown on the RegionServer while processing an RPC, and sent back in place of the
 * response. Only the RPC that triggered it is affected.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@SuppressWarnings("serial")
public class RemoteException extends NonRecoverableException {

  private final String exceptionClassName;
  private final String remoteStackTrace;

  RemoteException(Status status, String exceptionClassName, String remoteStackTrace) {
    super(status);
    this.exceptionClassName = exceptionClassName;
    this.remoteStackTrace = remoteStackTrace;
  }

  /** @return the fully qualified name of the Java exception thrown on the server */
  public String getExceptionClassName() {
    return exceptionClassName;
  }

  /** @return the stack trace of the exception, as formatted by the server */
  public String getRemoteStackTrace() {
    return remoteStackTrace;
  }
}
