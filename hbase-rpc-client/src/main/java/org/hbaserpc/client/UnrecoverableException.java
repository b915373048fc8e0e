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
 * An exception signaling that the {@link RegionClient} an RPC was queued on or sent through can't
 * be used anymore: writing to or reading from the socket failed, or the server sent something
 * that doesn't make sense. Every RPC pending or in flight on that connection receives one.
 * <p>
 * The cause of this exception is the error that terminated the connection. The RPC itself may be
 * sent again once a new connection has been opened.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
@SuppressWarnings("serial")
public class UnrecoverableException extends HBaseRpcException {

  UnrecoverableException(Status status) {
    super(status);
  }

  UnrecoverableException(Status status, Throwable cause) {
    super(status, cause);
  }
}
