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

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.util.List;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.protobuf.Message;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import io.netty.util.TimerTask;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.hbaserpc.util.Bytes;

/**
 * A fully asynchronous and thread-safe client for HBase RegionServers.
 * <p>
 * This client routes each RPC to the RegionServer serving the row it targets, as known from its
 * {@link RegionLocationCache}, and sends it over the single connection it keeps to that server.
 * Region locations are supplied through {@link #cacheRegion(RegionInfo, HostAndPort)}; looking
 * them up in the meta table is left to the caller.
 * <p>
 * This client doesn't retry anything. The class of the exception an RPC fails with tells what
 * happened:
 * <ul>
 *   <li>{@link RecoverableException}: the RPC can be sent again, possibly after refreshing the
 *   location of its region. A {@link Status#isNotFound() not found} status means no region is
 *   cached for the row; a {@link RegionUnavailableException} means the region moved, and its
 *   location was dropped from the cache. Its
 *   {@link RegionUnavailableException#getNewLocation() new location}, when known, can be
 *   cached again by the caller.</li>
 *   <li>{@link UnrecoverableException}: the connection to the server died. Every region served
 *   through it was dropped from the cache, a new connection is opened when a region is cached
 *   again for that server.</li>
 *   <li>{@link NonRecoverableException}: the RPC itself is at fault, the server rejected it,
 *   or its timeout passed before a response came back ({@link Status#isTimedOut() timed
 *   out} status).</li>
 * </ul>
 * <p>
 * {@link #shutdown()} must be called when the client is no longer needed, in order to release
 * its connections and threads.
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public class AsyncHBaseClient implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(AsyncHBaseClient.class);

  public static final int DEFAULT_RPC_QUEUE_SIZE = 100;
  public static final long DEFAULT_FLUSH_INTERVAL_MS = 20;
  public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10000;
  public static final long DEFAULT_OPERATION_TIMEOUT_MS = 30000;

  private final EventLoopGroup eventLoopGroup;

  /** Fails RPCs whose timeout passes before they complete. */
  private final HashedWheelTimer timer;

  private final RegionLocationCache regionCache = new RegionLocationCache();

  private final ConnectionCache connectionCache;

  private final long defaultOperationTimeoutMs;

  private volatile boolean closed;

  private AsyncHBaseClient(AsyncHBaseClientBuilder b) {
    this.eventLoopGroup = new NioEventLoopGroup(
        b.workerCount,
        new ThreadFactoryBuilder().setNameFormat("hbase-rpc-nio-%d").setDaemon(true).build());
    this.timer = new HashedWheelTimer(
        new ThreadFactoryBuilder().setNameFormat("hbase-rpc-timer-%d").setDaemon(true).build(),
        20, MILLISECONDS);
    this.connectionCache = new ConnectionCache(
        new RegionClientConfig(b.rpcQueueSize, b.flushIntervalMs, b.effectiveUser,
                               b.connectTimeoutMs),
        eventLoopGroup);
    this.defaultOperationTimeoutMs = b.defaultOperationTimeoutMs;
  }

  /**
   * Records that a region is served by the given RegionServer, connecting to it if needed.
   * The region replaces any cached region with the same table and start key.
   *
   * @param region the region
   * @param server the address of the RegionServer serving it
   * @throws RecoverableException if no connection to the server could be established
   */
  public void cacheRegion(RegionInfo region, HostAndPort server) throws RecoverableException {
    Preconditions.checkState(!closed, "client is closed");
    final RegionClient client = connectionCache.getRegionClient(server);
    regionCache.cacheRegion(region, client);
  }

  /**
   * Sends an RPC to the RegionServer serving its row.
   * <p>
   * If the RPC has no timeout, the default operation timeout is applied to it. An RPC still
   * waiting for its response once its timeout has passed is failed with a
   * {@link NonRecoverableException} carrying a timed out status; a response arriving later
   * is dropped.
   *
   * @param rpc the RPC to send
   * @return the Deferred of the RPC, called back with its response or with the exception it
   * failed with
   */
  public <R extends Message> Deferred<R> sendRpc(final HBaseRpc<R> rpc) {
    if (closed) {
      rpc.errback(new UnrecoverableException(Status.Aborted("client is closed")));
      return rpc.getDeferred();
    }
    if (!rpc.timeoutTracker.hasTimeout() && defaultOperationTimeoutMs > 0) {
      rpc.setTimeoutMillis(defaultOperationTimeoutMs);
    }

    final RegionLocationCache.Entry entry = regionCache.get(rpc.getTable(), rpc.getKey());
    if (entry == null) {
      rpc.errback(new RecoverableException(Status.NotFound(
          "no cached region for table " + Bytes.pretty(rpc.getTable()) + " and key " +
          Bytes.pretty(rpc.getKey()))));
      return rpc.getDeferred();
    }

    final RegionInfo region = entry.getRegion();
    final RegionClient client = entry.getClient();
    rpc.setRegion(region);
    rpc.getDeferred().addErrback(new InvalidateOnError(region, client));
    if (rpc.timeoutTracker.hasTimeout()) {
      final Timeout timeout = newTimeout(timer, new RpcTimeoutTask(rpc),
                                         rpc.timeoutTracker.getMillisBeforeTimeout());
      if (timeout != null) {
        rpc.getDeferred().addBoth(new CancelTimeout<>(timeout));
      }
    }
    try {
      client.sendRpc(rpc);
    } catch (UnrecoverableException e) {
      rpc.errback(e);
    }
    return rpc.getDeferred();
  }

  /**
   * Fails an RPC once its timeout has passed. A queued RPC is then skipped by its connection,
   * and the response of one already sent is dropped.
   */
  private static final class RpcTimeoutTask implements TimerTask {
    private final HBaseRpc<?> rpc;

    RpcTimeoutTask(HBaseRpc<?> rpc) {
      this.rpc = rpc;
    }

    @Override
    public void run(Timeout timeout) {
      if (rpc.isDone()) {
        return;
      }
      final Status statusTimedOut = Status.TimedOut("cannot complete before timeout: " + rpc);
      if (rpc.errback(new NonRecoverableException(statusTimedOut))) {
        LOG.debug("Cannot continue with RPC because of: {}", statusTimedOut);
      }
    }
  }

  /** Releases the timeout of an RPC once it completes, passing its result on. */
  private static final class CancelTimeout<T> implements Callback<T, T> {
    private final Timeout timeout;

    CancelTimeout(Timeout timeout) {
      this.timeout = timeout;
    }

    @Override
    public T call(T arg) {
      timeout.cancel();
      return arg;
    }

    @Override
    public String toString() {
      return "cancel RPC timeout";
    }
  }

  /**
   * Registers a task on the timer, to run after the given number of milliseconds.
   * @return a handle to cancel the task, or null if the timer is already stopped
   */
  @Nullable
  static Timeout newTimeout(final Timer timer,
                            final TimerTask task,
                            final long timeoutMillis) {
    Preconditions.checkNotNull(timer);
    try {
      return timer.newTimeout(task, timeoutMillis, MILLISECONDS);
    } catch (IllegalStateException e) {
      // shutdown() stopped the timer concurrently; the connections fail the RPC instead.
      LOG.warn("Failed to schedule timer. Ignore this if we're shutting down.", e);
    }
    return null;
  }

  /**
   * Drops the cached knowledge an RPC failure proves stale, then passes the failure on.
   */
  private final class InvalidateOnError implements Callback<Exception, Exception> {
    private final RegionInfo region;
    private final RegionClient client;

    InvalidateOnError(RegionInfo region, RegionClient client) {
      this.region = region;
      this.client = client;
    }

    @Override
    public Exception call(Exception e) {
      if (e instanceof RegionUnavailableException) {
        if (regionCache.invalidate(region)) {
          LOG.debug("Invalidated region {} after: {}", region, e.getMessage());
        }
      } else if (e instanceof UnrecoverableException) {
        regionCache.removeRegionsServedBy(client);
      }
      return e;
    }

    @Override
    public String toString() {
      return "invalidate region cache on error";
    }
  }

  /**
   * Closes every connection, failing the RPCs they were carrying, and releases the client's
   * threads. The client can't be used afterwards.
   */
  public void shutdown() {
    if (closed) {
      return;
    }
    closed = true;
    connectionCache.disconnectEverything();
    regionCache.clear();
    timer.stop();
    eventLoopGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
    LOG.debug("Client shut down");
  }

  @Override
  public void close() {
    shutdown();
  }

  @VisibleForTesting
  RegionLocationCache getRegionLocationCache() {
    return regionCache;
  }

  @InterfaceAudience.LimitedPrivate("Test")
  List<RegionClient> getRegionClientListCopy() {
    return connectionCache.getRegionClientListCopy();
  }

  /**
   * Builder class to use in order to connect to HBase.
   * All the parameters beyond those in the constructors are optional.
   */
  @InterfaceAudience.Public
  @InterfaceStability.Evolving
  public static final class AsyncHBaseClientBuilder {
    private static final int DEFAULT_WORKER_COUNT = 2 * Runtime.getRuntime().availableProcessors();

    private int rpcQueueSize = DEFAULT_RPC_QUEUE_SIZE;
    private long flushIntervalMs = DEFAULT_FLUSH_INTERVAL_MS;
    private String effectiveUser = System.getProperty("user.name", "unknown");
    private long connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
    private long defaultOperationTimeoutMs = DEFAULT_OPERATION_TIMEOUT_MS;
    private int workerCount = DEFAULT_WORKER_COUNT;

    public AsyncHBaseClientBuilder() {
    }

    /**
     * Sets how many RPCs may wait in a connection's queue before they're sent right away.
     * Optional.
     * If not provided, defaults to 100.
     * @param size a number of RPCs
     * @return this builder
     */
    public AsyncHBaseClientBuilder rpcQueueSize(int size) {
      Preconditions.checkArgument(size >= 0, "rpcQueueSize should not be negative");
      this.rpcQueueSize = size;
      return this;
    }

    /**
     * Sets the longest an RPC waits in a connection's queue before being sent.
     * Optional.
     * If not provided, defaults to 20ms.
     * @param intervalMs an interval in milliseconds
     * @return this builder
     */
    public AsyncHBaseClientBuilder flushIntervalMs(long intervalMs) {
      Preconditions.checkArgument(intervalMs > 0, "flushIntervalMs should be greater than 0");
      this.flushIntervalMs = intervalMs;
      return this;
    }

    /**
     * Sets the user the connections run as.
     * Optional.
     * If not provided, the user running the JVM is used.
     * @param user a user name
     * @return this builder
     */
    public AsyncHBaseClientBuilder effectiveUser(String user) {
      this.effectiveUser = Preconditions.checkNotNull(user);
      return this;
    }

    /**
     * Sets how long to wait for a connection to a RegionServer to be established.
     * Optional.
     * If not provided, defaults to 10s.
     * @param timeoutMs a timeout in milliseconds
     * @return this builder
     */
    public AsyncHBaseClientBuilder connectTimeoutMs(long timeoutMs) {
      Preconditions.checkArgument(timeoutMs > 0, "connectTimeoutMs should be greater than 0");
      this.connectTimeoutMs = timeoutMs;
      return this;
    }

    /**
     * Sets the default timeout used for RPCs that don't have one.
     * Optional.
     * If not provided, defaults to 30s.
     * A value of 0 disables the timeout.
     * @param timeoutMs a timeout in milliseconds
     * @return this builder
     */
    public AsyncHBaseClientBuilder defaultOperationTimeoutMs(long timeoutMs) {
      Preconditions.checkArgument(timeoutMs >= 0,
          "defaultOperationTimeoutMs should not be negative");
      this.defaultOperationTimeoutMs = timeoutMs;
      return this;
    }

    /**
     * Set the maximum number of worker threads.
     * Optional.
     * If not provided, (2 * the number of available processors) is used.
     */
    public AsyncHBaseClientBuilder workerCount(int workerCount) {
      Preconditions.checkArgument(workerCount > 0, "workerCount should be greater than 0");
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Creates a new client that connects to RegionServers as regions get cached.
     * @return a new asynchronous HBase client
     */
    public AsyncHBaseClient build() {
      return new AsyncHBaseClient(this);
    }
  }
}
