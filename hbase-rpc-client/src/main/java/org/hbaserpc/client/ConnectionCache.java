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

import java.util.HashMap;
import java.util.List;
import javax.annotation.concurrent.GuardedBy;

import com.google.common.collect.ImmutableList;
import io.netty.channel.EventLoopGroup;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The ConnectionCache is responsible for managing connections to RegionServers. There should
 * only be one instance of ConnectionCache per client, and it should not be shared between
 * clients.
 * <p>
 * Terminated instances of {@link RegionClient} are replaced in the cache with new ones when
 * {@link #getRegionClient(HostAndPort)} is called with the same destination.
 * <p>
 * Connections are opened while holding the cache's lock, so a slow server delays lookups of
 * the other servers for at most the connect timeout.
 *
 * This class is thread-safe.
 */
@InterfaceAudience.Private
@InterfaceStability.Unstable
class ConnectionCache {
  private static final Logger LOG = LoggerFactory.getLogger(ConnectionCache.class);

  private final RegionClientConfig config;

  /** The event loop group running the I/O of every connection. */
  private final EventLoopGroup eventLoopGroup;

  @GuardedBy("clientsByAddress")
  private final HashMap<HostAndPort, RegionClient> clientsByAddress = new HashMap<>();

  ConnectionCache(RegionClientConfig config, EventLoopGroup eventLoopGroup) {
    this.config = config;
    this.eventLoopGroup = eventLoopGroup;
  }

  /**
   * Get the connection to the specified server. If no connection exists or the existing one is
   * terminated, a new connection is opened.
   *
   * @param serverInfo the server end-point to connect to
   * @return a connection to the server
   * @throws RecoverableException if a new connection had to be opened and that failed
   */
  public RegionClient getRegionClient(final HostAndPort serverInfo) throws RecoverableException {
    synchronized (clientsByAddress) {
      RegionClient client = clientsByAddress.get(serverInfo);
      if (client != null && !client.isTerminated()) {
        return client;
      }
      if (client != null) {
        // Lazy recycling of the terminated connections.
        LOG.debug("Replacing terminated connection {}", client);
        clientsByAddress.remove(serverInfo);
      }
      client = RegionClient.open(serverInfo, config, eventLoopGroup);
      clientsByAddress.put(serverInfo, client);
      return client;
    }
  }

  /** Terminate every connection. This fails all the pending and in-flight RPCs. */
  void disconnectEverything() {
    synchronized (clientsByAddress) {
      for (RegionClient client : clientsByAddress.values()) {
        client.close();
      }
      clientsByAddress.clear();
    }
  }

  /**
   * Return a copy of the all-connections-list, so tests can get access to the underlying
   * elements of the cache.
   *
   * @return a copy of the list of all connections in the connection cache
   */
  @InterfaceAudience.LimitedPrivate("Test")
  List<RegionClient> getRegionClientListCopy() {
    synchronized (clientsByAddress) {
      return ImmutableList.copyOf(clientsByAddress.values());
    }
  }
}
