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
import java.util.List;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.Parser;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufInputStream;
import io.netty.buffer.DefaultByteBufHolder;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.MessageToMessageDecoder;
import org.apache.yetus.audience.InterfaceAudience;

import org.hbaserpc.rpc.RpcHeader;

/**
 * A response frame received from a RegionServer, with its length prefix already stripped: the
 * varint-delimited {@link RpcHeader.ResponseHeader} followed, when the call succeeded, by the
 * varint-delimited response body.
 */
@InterfaceAudience.Private
final class CallResponse extends DefaultByteBufHolder {
  private final ByteBuf buf;
  private final RpcHeader.ResponseHeader header;
  private final int totalResponseSize;

  /**
   * Parses the header out of {@code buf}, leaving the reader index on the body. Assumes that
   * {@code buf} has not been read from yet, and will only be accessed by this class.
   * @param buf the frame, without its length prefix
   * @throws IOException if the header can't be parsed
   */
  CallResponse(final ByteBuf buf) throws IOException {
    super(buf);
    this.buf = buf;
    this.totalResponseSize = buf.readableBytes();
    final RpcHeader.ResponseHeader parsed =
        RpcHeader.ResponseHeader.parseDelimitedFrom(new ByteBufInputStream(buf));
    if (parsed == null) {
      throw new CorruptedFrameException("empty RPC response frame");
    }
    this.header = parsed;
  }

  /**
   * @return the parsed header
   */
  RpcHeader.ResponseHeader getHeader() {
    return header;
  }

  /**
   * @return the size of the frame, without its length prefix
   */
  int getTotalResponseSize() {
    return totalResponseSize;
  }

  /**
   * De-serializes the body following the header. Only meaningful if the header doesn't carry an
   * exception, and can only be called once.
   * @param parser the parser of the expected response type
   * @return the response
   * @throws InvalidProtocolBufferException if the body is missing, truncated or malformed
   */
  <R extends Message> R parseBody(Parser<R> parser) throws InvalidProtocolBufferException {
    if (!buf.isReadable()) {
      throw new InvalidProtocolBufferException("response of call " + header.getCallId() +
          " has no body");
    }
    final R body = parser.parseDelimitedFrom(new ByteBufInputStream(buf));
    if (body == null) {
      throw new InvalidProtocolBufferException("truncated response of call " +
          header.getCallId());
    }
    return body;
  }

  @Override
  public String toString() {
    return "CallResponse(size=" + totalResponseSize + ", header=" +
        header.toString().replace('\n', ' ').trim() + ")";
  }

  /**
   * Netty decoder which receives incoming frames (ByteBuf)
   * and constructs CallResponse objects. Every frame is decoded, empty ones included.
   */
  static class Decoder extends MessageToMessageDecoder<ByteBuf> {

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf msg, List<Object> out)
        throws IOException {
      // The frame is released once decoded; CallResponse holds onto it until the handler
      // releases it in turn.
      // https://netty.io/wiki/reference-counted-objects.html
      msg.retain();
      try {
        out.add(new CallResponse(msg));
      } catch (IOException | RuntimeException e) {
        msg.release();
        throw e;
      }
    }
  }
}
