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
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;

import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.Message;
import com.google.protobuf.Parser;
import com.stumbleupon.async.Deferred;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.apache.yetus.audience.InterfaceAudience;
import org.apache.yetus.audience.InterfaceStability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.hbaserpc.rpc.RpcHeader;
import org.hbaserpc.util.Bytes;

/**
 * Abstract base class for all RPC requests going out to a RegionServer.
 * <p>
 * Concrete operations (get, put, scan...) extend this class to provide the name of the remote
 * method, the request to send and the type of the response to expect. The outcome of the RPC is
 * delivered through the {@link Deferred} returned by {@link #getDeferred()}: it is called back
 * exactly once, either with the de-serialized response or with an {@link HBaseRpcException}.
 *
 * <h1>A note on passing {@code byte} arrays in argument</h1>
 * None of the method that receive a {@code byte[]} in argument will copy it.
 * If you change the contents of any byte array you give to an instance of
 * this class, you <em>may</em> affect the behavior of the request in an
 * <strong>unpredictable</strong> way.
 *
 * @param <R> the type of the response message
 */
@InterfaceAudience.Public
@InterfaceStability.Evolving
public abstract class HBaseRpc<R extends Message> {

  private static final Logger LOG = LoggerFactory.getLogger(HBaseRpc.class);

  private final byte[] table;

  private final byte[] key;

  private final Deferred<R> deferred = new Deferred<>();

  /** Flipped by whoever delivers the result, so that only one result is ever delivered. */
  private final AtomicBoolean completed = new AtomicBoolean();

  private final AtomicBoolean cancelled = new AtomicBoolean();

  final TimeoutTracker timeoutTracker = new TimeoutTracker();

  /** The region this RPC was routed to, set by the dispatcher before sending. */
  @Nullable
  private volatile RegionInfo region;

  /**
   * @param table the table this RPC is for
   * @param key the row key this RPC is for, used to find the region serving it
   */
  protected HBaseRpc(byte[] table, byte[] key) {
    this.table = table;
    this.key = key;
  }

  /**
   * @return the name of the remote method to invoke, e.g. "Get"
   */
  protected abstract String method();

  /**
   * Builds the request message. Called once, by the connection's sender thread, right before
   * the RPC goes out to the wire. Any exception thrown here fails this RPC only.
   */
  protected abstract Message createRequestPB();

  /**
   * @return the parser for the response of this RPC, used to de-serialize the response body
   */
  protected abstract Parser<R> responseParser();

  /**
   * Serializes the request of this RPC.
   * @return the bytes to send as the request parameter
   * @throws NonRecoverableException if the request couldn't be built or serialized
   */
  final byte[] serialize() throws NonRecoverableException {
    try {
      return createRequestPB().toByteArray();
    } catch (RuntimeException e) {
      throw new NonRecoverableException(
          Status.InvalidArgument("failed to serialize RPC " + method() + ": " + e.getMessage()),
          e);
    }
  }

  /**
   * Builds the header that precedes the request of this RPC on the wire.
   * @param callId the ID the connection assigned to this RPC
   */
  RpcHeader.RequestHeader buildHeader(int callId) {
    final RpcHeader.RequestHeader.Builder builder = RpcHeader.RequestHeader.newBuilder()
        .setCallId(callId)
        .setMethodName(method())
        .setRequestParam(true);
    if (timeoutTracker.hasTimeout()) {
      builder.setTimeout((int) Math.min(Integer.MAX_VALUE,
                                        timeoutTracker.getMillisBeforeTimeout()));
    }
    return builder.build();
  }

  /**
   * Frames a request: a 4-byte length, then the header and the payload, each preceded by its
   * varint-encoded length.
   */
  static ByteBuf toByteBuf(RpcHeader.RequestHeader header, byte[] payload) {
    final int headerSize = header.getSerializedSize();
    final int totalSize = CodedOutputStream.computeUInt32SizeNoTag(headerSize) + headerSize +
        CodedOutputStream.computeUInt32SizeNoTag(payload.length) + payload.length;
    final byte[] buf = new byte[totalSize + 4];
    final ByteBuf byteBuf = Unpooled.wrappedBuffer(buf);
    byteBuf.clear();
    byteBuf.writeInt(totalSize);
    final CodedOutputStream out = CodedOutputStream.newInstance(buf, 4, totalSize);
    try {
      out.writeUInt32NoTag(headerSize);
      header.writeTo(out);

      out.writeUInt32NoTag(payload.length);
      out.writeRawBytes(payload);
      out.checkNoSpaceLeft();
    } catch (IOException e) {
      throw new IllegalStateException("Cannot serialize the request with header " + header, e);
    }
    byteBuf.writerIndex(buf.length);
    return byteBuf;
  }

  public byte[] getTable() {
    return table;
  }

  public byte[] getKey() {
    return key;
  }

  @Nullable
  public RegionInfo getRegion() {
    return region;
  }

  void setRegion(RegionInfo region) {
    this.region = region;
  }

  /**
   * Sets how long the caller is willing to wait for this RPC, counted from the creation of this
   * object. Past that point the RPC is no longer sent, and the remaining time is propagated to
   * the server when it is.
   * @param timeoutMs a timeout in milliseconds, 0 meaning no timeout
   */
  public void setTimeoutMillis(long timeoutMs) {
    timeoutTracker.setTimeout(timeoutMs);
  }

  public long getTimeoutMillis() {
    return timeoutTracker.getTimeout();
  }

  /**
   * Tells the connection not to bother sending this RPC. An RPC that has already been written to
   * the wire is not recalled: its response, or the failure of its connection, still completes it.
   * <p>
   * A cancelled RPC that is skipped is never completed by the connection; the caller is expected
   * to have stopped waiting for it.
   */
  public void cancel() {
    cancelled.set(true);
  }

  /**
   * @return true if {@link #cancel()} was called or the timeout of this RPC has passed
   */
  public boolean isCancelled() {
    return cancelled.get() || timeoutTracker.timedOut();
  }

  /**
   * @return the Deferred that will be called back with the outcome of this RPC
   */
  public final Deferred<R> getDeferred() {
    return deferred;
  }

  /**
   * @return true if a result was delivered to this RPC
   */
  public boolean isDone() {
    return completed.get();
  }

  /**
   * Completes this RPC with its response.
   * @return false if this RPC had already been completed, in which case nothing happens
   */
  final boolean callback(final R result) {
    return handleCallback(result);
  }

  /**
   * Same as callback, except that it accepts an Exception.
   */
  final boolean errback(final Exception e) {
    return handleCallback(e);
  }

  private boolean handleCallback(final Object result) {
    if (!completed.compareAndSet(false, true)) {
      LOG.debug("Dropping result {} of RPC {}: already completed", result, this);
      return false;
    }
    deferred.callback(result);
    return true;
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    buf.append("HBaseRpc(method=").append(method());
    buf.append(", table=");
    Bytes.pretty(buf, table);
    buf.append(", key=");
    Bytes.pretty(buf, key);
    final RegionInfo r = region;
    buf.append(", region=");
    if (r == null) {
      buf.append("null");
    } else {
      Bytes.pretty(buf, r.getRegionName());
    }
    buf.append(", ").append(timeoutTracker);
    buf.append(')');
    return buf.toString();
  }
}
