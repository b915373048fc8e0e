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
import java.nio.channels.ClosedChannelException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.hbaserpc.rpc.RpcHeader;

/**
 * A connection from the client to a single RegionServer, over which any number of RPCs are
 * multiplexed.
 * <p>
 * RPCs handed to {@link #sendRpc(HBaseRpc)} are queued, and a dedicated sender thread writes
 * them to the wire in batches: whenever more than {@link RegionClientConfig#getRpcQueueSize()}
 * RPCs are waiting, or after {@link RegionClientConfig#getFlushIntervalMs()} otherwise. Each RPC
 * is assigned a call ID when it's sent, and kept in a registry until the response carrying the
 * same call ID comes back. Responses are read by the Netty pipeline of the channel, and may
 * arrive in any order.
 * <p>
 * Any error that leaves the connection in an unknown state (the socket failing, the server
 * closing it, a response that can't be matched to an RPC...) terminates the connection for
 * good: every RPC queued or awaiting a response is failed with an
 * {@link UnrecoverableException}, and so is every later call to {@link #sendRpc(HBaseRpc)}.
 * It's up to the caller to open a new connection.
 * <p>
 * Two locks protect the state of this object, one for the queue of RPCs waiting to be sent and
 * one for the registry of RPCs waiting for a response. They're never held at the same time, and
 * RPCs are never completed while holding either of them.
 */
@ThreadSafe
@InterfaceAudience.Private
@InterfaceStability.Unstable
public class RegionClient extends ChannelInboundHandlerAdapter {

  private static final Logger LOG = LoggerFactory.getLogger(RegionClient.class);

  /** Sent by the client upon connection establishment, ahead of the connection header. */
  @VisibleForTesting
  static final byte[] PREAMBLE = new byte[] {'H', 'B', 'a', 's',
      0,     // RPC version.
      0x50   // SIMPLE authentication.
  };

  /** The service all the RPCs sent through this connection are for. */
  @VisibleForTesting
  static final String SERVICE_NAME = "ClientService";

  /** Largest response frame accepted from the server. */
  @VisibleForTesting
  static final int MAX_RPC_SIZE = 256 * 1024 * 1024;

  private final HostAndPort serverInfo;

  private final RegionClientConfig config;

  /** The underlying Netty channel, set once connected. */
  @Nullable
  private volatile Channel channel;

  /** Set once, when the connection fails. Nothing gets written to the channel afterwards. */
  private final AtomicReference<UnrecoverableException> terminalError = new AtomicReference<>();

  /** Lock guarding the queue of RPCs waiting to be sent. */
  private final ReentrantLock queueLock = new ReentrantLock();

  /** Signalled to wake the sender up before the end of the flush interval. */
  private final Condition flushCondition = queueLock.newCondition();

  /** RPCs accepted but not sent yet; null once the connection is terminated. */
  @GuardedBy("queueLock")
  private ArrayList<HBaseRpc<?>> pending = new ArrayList<>();

  /** Whether the sender was asked to drain the queue without waiting. */
  @GuardedBy("queueLock")
  private boolean flushRequested;

  /** Lock guarding the registry of RPCs awaiting a response. */
  private final ReentrantLock registryLock = new ReentrantLock();

  /** Call ID to RPC sent and awaiting a response; null once the connection is terminated. */
  @GuardedBy("registryLock")
  private HashMap<Integer, HBaseRpc<?>> inflight = new HashMap<>();

  /** Next call ID to assign. Only ever accessed by the sender thread. */
  private int nextCallId = 0;

  private final Thread sender;

  private RegionClient(HostAndPort serverInfo, RegionClientConfig config) {
    this.serverInfo = serverInfo;
    this.config = config;
    this.sender = new ThreadFactoryBuilder()
        .setNameFormat("hbase-rpc-sender-" + serverInfo)
        .setDaemon(true)
        .build()
        .newThread(this::runSender);
  }

  /**
   * Connects to a RegionServer and performs the connection handshake. Blocks until both are
   * done, so it must not be called from an event loop thread.
   *
   * @param serverInfo the address of the RegionServer
   * @param config the settings of the connection
   * @param eventLoopGroup the event loop group running the channel's I/O
   * @return a connection ready to accept RPCs
   * @throws RecoverableException with a network error status if the connection couldn't be
   * established or the handshake couldn't be written
   */
  public static RegionClient open(HostAndPort serverInfo,
                                  RegionClientConfig config,
                                  EventLoopGroup eventLoopGroup) throws RecoverableException {
    final RegionClient client = new RegionClient(serverInfo, config);
    final Bootstrap bootstrap = new Bootstrap()
        .group(eventLoopGroup)
        .channel(NioSocketChannel.class)
        .option(ChannelOption.TCP_NODELAY, true)
        .option(ChannelOption.SO_KEEPALIVE, true)
        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.getConnectTimeoutMs())
        .handler(new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) {
            ch.pipeline().addLast("frame-decoder",
                                  new LengthFieldBasedFrameDecoder(MAX_RPC_SIZE, 0, 4, 0, 4));
            ch.pipeline().addLast("response-decoder", new CallResponse.Decoder());
            ch.pipeline().addLast("region-client", client);
          }
        });

    final ChannelFuture connectFuture = bootstrap.connect(
        new InetSocketAddress(serverInfo.getHost(), serverInfo.getPort()));
    connectFuture.awaitUninterruptibly();
    if (!connectFuture.isSuccess()) {
      connectFuture.channel().close();
      String message = "Failed to connect to peer " + serverInfo + ": " +
          connectFuture.cause().getMessage();
      LOG.info(message);
      throw new RecoverableException(Status.NetworkError(message), connectFuture.cause());
    }

    final Channel ch = connectFuture.channel();
    client.channel = ch;
    final ChannelFuture handshakeFuture = ch.writeAndFlush(client.handshake(ch));
    if (!handshakeFuture.awaitUninterruptibly(config.getConnectTimeoutMs()) ||
        !handshakeFuture.isSuccess()) {
      ch.close();
      String message = client.getLogPrefix() + " failed to send the connection header";
      if (handshakeFuture.cause() != null) {
        message += ": " + handshakeFuture.cause().getMessage();
      }
      LOG.info(message);
      throw new RecoverableException(Status.NetworkError(message), handshakeFuture.cause());
    }

    client.sender.start();
    LOG.debug("{} connected with {}", client.getLogPrefix(), config);
    return client;
  }

  /** The preamble followed by the length-prefixed connection header. */
  private ByteBuf handshake(Channel ch) {
    final RpcHeader.ConnectionHeader header = RpcHeader.ConnectionHeader.newBuilder()
        .setUserInfo(RpcHeader.UserInformation.newBuilder()
                         .setEffectiveUser(config.getEffectiveUser()))
        .setServiceName(SERVICE_NAME)
        .build();
    final byte[] headerBytes = header.toByteArray();
    final ByteBuf buf = ch.alloc().buffer(PREAMBLE.length + 4 + headerBytes.length);
    buf.writeBytes(PREAMBLE);
    buf.writeInt(headerBytes.length);
    buf.writeBytes(headerBytes);
    return buf;
  }

  /**
   * Queues an RPC to be sent to the server. Its outcome is delivered through its Deferred.
   *
   * @param rpc the RPC to send
   * @throws UnrecoverableException if the connection is terminated, in which case the RPC
   * isn't queued and its Deferred isn't touched
   */
  public void sendRpc(HBaseRpc<?> rpc) throws UnrecoverableException {
    Preconditions.checkNotNull(rpc);
    UnrecoverableException error = terminalError.get();
    if (error == null) {
      queueLock.lock();
      try {
        if (pending != null) {
          pending.add(rpc);
          if (pending.size() > config.getRpcQueueSize() && !flushRequested) {
            flushRequested = true;
            flushCondition.signal();
          }
          return;
        }
      } finally {
        queueLock.unlock();
      }
      // The queue is closed after the terminal error is set.
      error = terminalError.get();
    }
    throw new UnrecoverableException(error.getStatus(), error);
  }

  /**
   * Terminates the connection, failing every RPC queued or awaiting a response. Does nothing if
   * the connection is already terminated.
   */
  public void close() {
    failConnection(new UnrecoverableException(
        Status.Aborted(getLogPrefix() + " connection closed by the client")));
  }

  /** The sender thread's main loop. */
  private void runSender() {
    try {
      while (true) {
        final ArrayList<HBaseRpc<?>> batch;
        queueLock.lock();
        try {
          if (pending == null) {
            return;
          }
          if (!flushRequested) {
            flushCondition.awaitNanos(TimeUnit.MILLISECONDS.toNanos(config.getFlushIntervalMs()));
          }
          if (pending == null) {
            return;
          }
          flushRequested = false;
          if (pending.isEmpty()) {
            continue;
          }
          batch = pending;
          pending = new ArrayList<>();
        } finally {
          queueLock.unlock();
        }
        if (!sendBatch(batch)) {
          return;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      failConnection(new UnrecoverableException(
          Status.Aborted(getLogPrefix() + " sender thread interrupted"), e));
    } catch (RuntimeException e) {
      String message = getLogPrefix() + " unexpected exception in the sender thread";
      LOG.error(message, e);
      failConnection(new UnrecoverableException(Status.IllegalState(message), e));
    } finally {
      LOG.debug("{} sender thread exiting", getLogPrefix());
    }
  }

  /**
   * Writes a batch of RPCs, in order, and flushes the channel once they're all written.
   * @return false if the connection got terminated, in which case the sender must stop
   */
  private boolean sendBatch(List<HBaseRpc<?>> batch) {
    final Channel ch = channel;
    int written = 0;
    for (int i = 0; i < batch.size(); i++) {
      final HBaseRpc<?> rpc = batch.get(i);
      if (rpc.isCancelled()) {
        LOG.debug("{} not sending cancelled RPC {}", getLogPrefix(), rpc);
        continue;
      }

      final byte[] payload;
      try {
        payload = rpc.serialize();
      } catch (NonRecoverableException e) {
        LOG.warn("{} failed to serialize RPC {}", getLogPrefix(), rpc, e);
        rpc.errback(e);
        continue;
      }

      if (ch == null || !ch.isActive()) {
        requeueOrFail(batch.subList(i, batch.size()));
        failConnection(new UnrecoverableException(
            Status.NetworkError(getLogPrefix() + " connection closed while sending")));
        break;
      }

      final int callId = nextCallId++;
      final ByteBuf frame = HBaseRpc.toByteBuf(rpc.buildHeader(callId), payload);
      if (!register(callId, rpc)) {
        // The connection was terminated since this batch was detached from the queue.
        frame.release();
        requeueOrFail(batch.subList(i, batch.size()));
        break;
      }
      if (LOG.isTraceEnabled()) {
        LOG.trace("{} sending call {}: {}", getLogPrefix(), callId, rpc);
      }
      ch.write(frame).addListener(new ChannelFutureListener() {
        @Override
        public void operationComplete(ChannelFuture future) {
          if (!future.isSuccess()) {
            String message = getLogPrefix() + " failed to write call " + callId;
            LOG.info(message, future.cause());
            failConnection(new UnrecoverableException(Status.NetworkError(message),
                                                      future.cause()));
          }
        }
      });
      written++;
    }
    if (written > 0 && ch != null) {
      ch.flush();
    }
    return terminalError.get() == null;
  }

  /** @return false if the registry is closed, in which case the RPC wasn't registered */
  private boolean register(int callId, HBaseRpc<?> rpc) {
    registryLock.lock();
    try {
      if (inflight == null) {
        return false;
      }
      final HBaseRpc<?> previous = inflight.put(callId, rpc);
      Preconditions.checkState(previous == null, "call ID %s already in use by %s",
                               callId, previous);
      return true;
    } finally {
      registryLock.unlock();
    }
  }

  /**
   * Puts RPCs that couldn't be sent back at the head of the queue, so that the failure of the
   * connection reaches them along with the rest of the queue. Fails them right away if the queue
   * is already closed.
   */
  private void requeueOrFail(List<HBaseRpc<?>> unsent) {
    boolean requeued = false;
    queueLock.lock();
    try {
      if (pending != null) {
        pending.addAll(0, unsent);
        requeued = true;
      }
    } finally {
      queueLock.unlock();
    }
    if (!requeued) {
      final UnrecoverableException error = terminalError.get();
      Preconditions.checkState(error != null, "queue closed without a terminal error");
      failAll(unsent, error);
    }
  }

  /**
   * Terminates the connection. Only the first call has any effect: it closes the queue and the
   * registry, fails every RPC they held with {@code error}, and closes the channel.
   */
  @VisibleForTesting
  void failConnection(UnrecoverableException error) {
    if (!terminalError.compareAndSet(null, error)) {
      LOG.trace("{} already terminated, ignoring: {}", getLogPrefix(), error.getMessage());
      return;
    }
    LOG.debug("{} terminating connection due to: {}", getLogPrefix(), error.getMessage());

    final List<HBaseRpc<?>> queued;
    queueLock.lock();
    try {
      queued = pending;
      pending = null;
      flushCondition.signalAll();
    } finally {
      queueLock.unlock();
    }

    final HashMap<Integer, HBaseRpc<?>> sent;
    registryLock.lock();
    try {
      sent = inflight;
      inflight = null;
    } finally {
      registryLock.unlock();
    }

    failAll(sent.values(), error);
    failAll(queued, error);

    final Channel ch = channel;
    if (ch != null) {
      ch.close();
    }
  }

  private void failAll(Iterable<HBaseRpc<?>> rpcs, UnrecoverableException error) {
    for (HBaseRpc<?> rpc : rpcs) {
      try {
        rpc.errback(error);
      } catch (RuntimeException e) {
        LOG.warn("{} exception while aborting RPC {}", getLogPrefix(), rpc, e);
      }
    }
  }

  @Override
  public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
    if (!(msg instanceof CallResponse)) {
      ctx.fireChannelRead(msg);
      return;
    }
    final CallResponse response = (CallResponse) msg;
    try {
      handleResponse(response);
    } finally {
      response.release();
    }
  }

  private void handleResponse(CallResponse response) {
    final RpcHeader.ResponseHeader header = response.getHeader();
    if (!header.hasCallId()) {
      final String msg = getLogPrefix() + " RPC response (size: " +
          response.getTotalResponseSize() + ") doesn't have a call ID: " + header;
      LOG.error(msg);
      failConnection(new UnrecoverableException(Status.Incomplete(msg)));
      return;
    }

    final int callId = header.getCallId();
    final HBaseRpc<?> rpc;
    registryLock.lock();
    try {
      if (inflight == null) {
        // Terminated, the RPC was already failed.
        return;
      }
      rpc = inflight.remove(callId);
    } finally {
      registryLock.unlock();
    }

    if (rpc == null) {
      final String msg = getLogPrefix() + " invalid call ID: " + callId;
      LOG.error(msg);
      // If we get a bad call ID back, we are probably somehow misaligned from
      // the server. So, we disconnect the connection.
      failConnection(new UnrecoverableException(Status.IllegalState(msg)));
      return;
    }

    if (header.hasException()) {
      final HBaseRpcException error = RemoteExceptions.fromPB(header.getException());
      LOG.debug("{} call {} failed on the server: {}", getLogPrefix(), callId,
                header.getException().getExceptionClassName());
      rpc.errback(error);
      return;
    }
    deliverResponse(rpc, response);
  }

  private <R extends Message> void deliverResponse(HBaseRpc<R> rpc, CallResponse response) {
    final R result;
    try {
      result = response.parseBody(rpc.responseParser());
    } catch (InvalidProtocolBufferException e) {
      final String msg = getLogPrefix() + " failed to parse the response of " + rpc + ": " +
          e.getMessage();
      LOG.warn(msg);
      rpc.errback(new NonRecoverableException(Status.Corruption(msg), e));
      return;
    }
    if (LOG.isTraceEnabled()) {
      LOG.trace("{} received response for {}", getLogPrefix(), rpc);
    }
    rpc.callback(result);
  }

  @Override
  public void channelInactive(ChannelHandlerContext ctx) throws Exception {
    failConnection(new UnrecoverableException(
        Status.NetworkError(getLogPrefix() + " connection closed")));
    super.channelInactive(ctx);
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    final String message;
    final Status status;
    if (cause instanceof DecoderException) {
      message = getLogPrefix() + " failed to decode a response: " + cause.getMessage();
      status = Status.Corruption(message);
      LOG.error(message, cause);
    } else if (cause instanceof ClosedChannelException) {
      message = getLogPrefix() + " lost connection to peer";
      status = Status.NetworkError(message);
      LOG.info(message);
    } else {
      message = getLogPrefix() + " unexpected exception from downstream on " + ctx.channel();
      status = Status.NetworkError(message);
      LOG.error(message, cause);
    }
    failConnection(new UnrecoverableException(status, cause));
  }

  /** Getter for the peer's end-point information */
  public HostAndPort getServerInfo() {
    return serverInfo;
  }

  /** @return true once the connection is terminated */
  public boolean isTerminated() {
    return terminalError.get() != null;
  }

  /** @return the error that terminated the connection, or null if it's alive */
  @Nullable
  public UnrecoverableException getTerminalError() {
    return terminalError.get();
  }

  /** @return the number of RPCs awaiting a response */
  @VisibleForTesting
  int getInflightCount() {
    registryLock.lock();
    try {
      return inflight == null ? 0 : inflight.size();
    } finally {
      registryLock.unlock();
    }
  }

  @VisibleForTesting
  Thread getSenderThread() {
    return sender;
  }

  String getLogPrefix() {
    return "[peer " + serverInfo + "]";
  }

  @Override
  public String toString() {
    return "RegionClient@" + Integer.toHexString(hashCode()) + "(" + serverInfo +
        (isTerminated() ? ", terminated" : "") + ")";
  }
}
