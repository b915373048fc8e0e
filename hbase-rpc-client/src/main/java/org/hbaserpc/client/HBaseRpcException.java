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

import java.io.IOException;

import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * The parent class of all exceptions delivered by this client, either thrown directly or passed
 * to the errback of an RPC's {@link com.stumbleupon.async.Deferred}.
 * <p>
 * The concrete subclass tells the caller what to do next:
 * <ul>
 *   <li>{@link RecoverableException}: the RPC may be sent again, possibly to another server.</li>
 *   <li>{@link NonRecoverableException}: the RPC failed for good.</li>
 *   <li>{@link UnrecoverableException}: the connection the RPC was sent over is dead and has to
 *   be replaced before sending the RPC again.</li>
 * </ul>
 * Each instance carries a {@link Status} which gives more information about the error.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@SuppressWarnings("serial")
public abstract class HBaseRpcException extends IOException {

  private final Status status;

  /**
   * Constructor.
   * @param status object containing the reason for the exception
   */
  HBaseRpcException(Status status) {
    super(status.getMessage());
    this.status = status;
  }

  /**
   * Constructor.
   * @param status object containing the reason for the exception
   * @param cause the exception that caused this one to be thrown
   */
  HBaseRpcException(Status status, Throwable cause) {
    super(status.getMessage(), cause);
    this.status = status;
  }

  /**
   * Get the Status object for this exception.
   * @return a status object indicating the reason for the exception
   */
  public Status getStatus() {
    return status;
  }
}
