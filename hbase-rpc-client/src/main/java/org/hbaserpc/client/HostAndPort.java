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

import java.net.InetSocketAddress;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;

/**
 * The address of a RegionServer. Wraps an unresolved {@link InetSocketAddress} so that no DNS
 * lookup happens until a connection is actually opened.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public class HostAndPort {

  private final InetSocketAddress address;

  public HostAndPort(String host, int port) {
    Preconditions.checkArgument(port > 0 && port <= 0xFFFF, "invalid port: %s", port);
    // Using createUnresolved ensures no lookups will occur.
    this.address = InetSocketAddress.createUnresolved(host, port);
  }

  /**
   * Parses a "host:port" pair, with IPv6 hosts in brackets ("[::1]:16020").
   * @param hostPort the string to parse
   * @return the parsed address
   * @throws IllegalArgumentException if the string has no port or can't be parsed
   */
  public static HostAndPort fromString(String hostPort) {
    com.google.common.net.HostAndPort parsed =
        com.google.common.net.HostAndPort.fromString(hostPort);
    Preconditions.checkArgument(parsed.hasPort(), "no port in %s", hostPort);
    return new HostAndPort(parsed.getHost(), parsed.getPort());
  }

  public String getHost() {
    // Use getHostString to ensure no reverse lookup is done.
    return address.getHostString();
  }

  public int getPort() {
    return address.getPort();
  }

  public InetSocketAddress getAddress() {
    return address;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HostAndPort)) {
      return false;
    }
    HostAndPort that = (HostAndPort) o;
    return Objects.equal(address, that.address);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(address);
  }

  @Override
  public String toString() {
    return com.google.common.net.HostAndPort.fromParts(getHost(), getPort()).toString();
  }
}
