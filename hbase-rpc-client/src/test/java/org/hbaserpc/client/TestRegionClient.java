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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.Closeable;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.protobuf.StringValue;
import com.stumbleupon.async.Callback;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;

import org.hbaserpc.rpc.RpcHeader;
import org.hbaserpc.test.CapturingLogAppender;
import org.hbaserpc.test.junit.RetryRule;

public class TestRegionClient {
  private static final long JOIN_TIMEOUT_MS = 10000;
  private static final String NOT_SERVING =
      "org.apache.hadoop.hbase.NotServingRegionException";

  @Rule
  public RetryRule retryRule = new RetryRule();

  private EventLoopGroup eventLoopGroup;
  private FakeRegionServer server;
  private RegionClient client;

  @Before
  public void setUp() throws Exception {
    eventLoopGroup = new NioEventLoopGroup(1);
    server = new FakeRegionServer();
  }

  @After
  public void tearDown() throws Exception {
    if (client != null) {
      client.close();
    }
    server.close();
    eventLoopGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
  }

  private RegionClient openClient(int rpcQueueSize, long flushIntervalMs) throws Exception {
    client = RegionClient.open(server.getAddress(),
                               new RegionClientConfig(rpcQueueSize, flushIntervalMs,
                                                      "test-user", 5000),
                               eventLoopGroup);
    return client;
  }

  private RegionClient openClient() throws Exception {
    return openClient(100, 5);
  }

  /** Waits for the outcome of an RPC that's expected to fail. */
  private static Exception joinFailure(HBaseRpc<?> rpc) throws Exception {
    try {
      Object result = rpc.getDeferred().join(JOIN_TIMEOUT_MS);
      fail("expected a failure, got " + result);
      return null;
    } catch (HBaseRpcException e) {
      return e;
    }
  }

  private static String joinValue(EchoRpc rpc) throws Exception {
    return rpc.getDeferred().join(JOIN_TIMEOUT_MS).getValue();
  }

  @Test(timeout = 30000)
  public void testHandshake() throws Exception {
    openClient();
    FakeRegionServer.ServerConnection conn = server.awaitHandshake();
    assertArrayEquals(new byte[] {'H', 'B', 'a', 's', 0, 0x50}, conn.getPreamble());
    RpcHeader.ConnectionHeader header = conn.getConnectionHeader();
    assertEquals("ClientService", header.getServiceName());
    assertEquals("test-user", header.getUserInfo().getEffectiveUser());
    assertFalse(client.isTerminated());
  }

  @Test(timeout = 30000)
  public void testEcho() throws Exception {
    openClient();
    EchoRpc rpc = new EchoRpc("hello");
    client.sendRpc(rpc);

    FakeRegionServer.ReceivedCall call = server.takeCall();
    assertEquals(0, call.getCallId());
    assertEquals(EchoRpc.METHOD, call.getHeader().getMethodName());
    assertTrue(call.getHeader().getRequestParam());
    assertFalse(call.getHeader().hasTimeout());
    assertEquals("hello", call.getValue());

    call.respond(StringValue.newBuilder().setValue("hello").build());
    assertEquals("hello", joinValue(rpc));
    assertTrue(rpc.isDone());
    assertEquals(0, client.getInflightCount());
  }

  @Test(timeout = 30000)
  public void testTimeoutIsPropagated() throws Exception {
    openClient();
    EchoRpc rpc = new EchoRpc("with-timeout");
    rpc.setTimeoutMillis(20000);
    client.sendRpc(rpc);

    RpcHeader.RequestHeader header = server.takeCall().getHeader();
    assertTrue(header.hasTimeout());
    assertTrue(header.getTimeout() > 0);
    assertTrue(header.getTimeout() <= 20000);
  }

  @Test(timeout = 30000)
  public void testCallsAreSentInOrder() throws Exception {
    openClient();
    List<EchoRpc> rpcs = new ArrayList<>();
    for (String value : new String[] {"a", "b", "c"}) {
      EchoRpc rpc = new EchoRpc(value);
      rpcs.add(rpc);
      client.sendRpc(rpc);
    }
    for (int i = 0; i < rpcs.size(); i++) {
      FakeRegionServer.ReceivedCall call = server.takeCall();
      assertEquals(i, call.getCallId());
      assertEquals(rpcs.get(i).getValue(), call.getValue());
    }
  }

  @Test(timeout = 30000)
  public void testResponsesInAnyOrder() throws Exception {
    openClient();
    EchoRpc first = new EchoRpc("first");
    EchoRpc second = new EchoRpc("second");
    client.sendRpc(first);
    client.sendRpc(second);
    FakeRegionServer.ReceivedCall firstCall = server.takeCall();
    FakeRegionServer.ReceivedCall secondCall = server.takeCall();

    secondCall.respond(StringValue.newBuilder().setValue("second response").build());
    assertEquals("second response", joinValue(second));
    assertFalse(first.isDone());

    firstCall.respond(StringValue.newBuilder().setValue("first response").build());
    assertEquals("first response", joinValue(first));
  }

  @Test(timeout = 30000)
  public void testThresholdFlushesWithoutWaiting() throws Exception {
    // The flush interval is long enough for the test to time out if it were waited for.
    openClient(2, 60000);
    for (int i = 0; i < 3; i++) {
      client.sendRpc(new EchoRpc("rpc-" + i));
    }
    for (int i = 0; i < 3; i++) {
      assertEquals("rpc-" + i, server.takeCall().getValue());
    }
  }

  @Test(timeout = 30000)
  public void testCancelledRpcIsNotSent() throws Exception {
    openClient();
    EchoRpc cancelled = new EchoRpc("cancelled");
    cancelled.cancel();
    EchoRpc sent = new EchoRpc("sent");
    client.sendRpc(cancelled);
    client.sendRpc(sent);

    assertEquals("sent", server.takeCall().getValue());
    assertNull(server.pollCall(200));
    assertFalse(cancelled.isDone());
  }

  @Test(timeout = 30000)
  public void testTimedOutRpcIsNotSent() throws Exception {
    openClient(100, 200);
    EchoRpc rpc = new EchoRpc("late");
    rpc.setTimeoutMillis(1);
    Thread.sleep(10);
    client.sendRpc(rpc);
    assertNull(server.pollCall(500));
    assertFalse(rpc.isDone());
  }

  @Test(timeout = 30000)
  public void testSerializationFailureOnlyFailsThatRpc() throws Exception {
    openClient();
    EchoRpc broken = EchoRpc.unserializable("broken");
    EchoRpc good = new EchoRpc("good");
    client.sendRpc(broken);
    client.sendRpc(good);

    Exception e = joinFailure(broken);
    assertTrue(e instanceof NonRecoverableException);
    assertTrue(((HBaseRpcException) e).getStatus().isInvalidArgument());

    FakeRegionServer.ReceivedCall call = server.takeCall();
    assertEquals("good", call.getValue());
    call.respond(StringValue.newBuilder().setValue("good").build());
    assertEquals("good", joinValue(good));
    assertFalse(client.isTerminated());
  }

  @Test(timeout = 30000)
  public void testRetryableRemoteException() throws Exception {
    openClient();
    EchoRpc rpc = new EchoRpc("moved");
    client.sendRpc(rpc);
    server.takeCall().respondWithException(RpcHeader.ExceptionResponse.newBuilder()
        .setExceptionClassName("org.apache.hadoop.hbase.exceptions.RegionMovedException")
        .setStackTrace("Region moved to: hostname=rs2 port=16020")
        .setHostname("rs2")
        .setPort(16020)
        .build());

    Exception e = joinFailure(rpc);
    assertTrue(e instanceof RegionUnavailableException);
    RegionUnavailableException rue = (RegionUnavailableException) e;
    assertTrue(rue.getStatus().isServiceUnavailable());
    assertEquals("org.apache.hadoop.hbase.exceptions.RegionMovedException",
                 rue.getExceptionClassName());
    assertEquals(new HostAndPort("rs2", 16020), rue.getNewLocation());
    assertFalse(client.isTerminated());
  }

  @Test(timeout = 30000)
  public void testDoNotRetryOverridesRetryableClass() throws Exception {
    openClient();
    EchoRpc rpc = new EchoRpc("do-not-retry");
    client.sendRpc(rpc);
    server.takeCall().respondWithException(NOT_SERVING, true);

    Exception e = joinFailure(rpc);
    assertTrue(e instanceof RemoteException);
    assertEquals(NOT_SERVING, ((RemoteException) e).getExceptionClassName());
  }

  @Test(timeout = 30000)
  public void testRemoteExceptionKeepsConnection() throws Exception {
    openClient();
    EchoRpc failing = new EchoRpc("failing");
    client.sendRpc(failing);
    server.takeCall().respondWithException("java.io.IOException", false);

    Exception e = joinFailure(failing);
    assertTrue(e instanceof RemoteException);
    assertTrue(((RemoteException) e).getStatus().isRemoteError());
    assertTrue(e.getMessage().contains("java.io.IOException"));

    server.setEcho(true);
    EchoRpc next = new EchoRpc("next");
    client.sendRpc(next);
    assertEquals("next", joinValue(next));
  }

  @Test(timeout = 30000)
  public void testCorruptBodyOnlyFailsThatRpc() throws Exception {
    openClient();
    EchoRpc rpc = new EchoRpc("corrupt");
    client.sendRpc(rpc);
    FakeRegionServer.ReceivedCall call = server.takeCall();
    // Body announced as 5 bytes long, only 2 follow.
    byte[] header = FakeRegionServer.delimited(FakeRegionServer.responseHeader(call.getCallId()));
    byte[] frame = new byte[header.length + 3];
    System.arraycopy(header, 0, frame, 0, header.length);
    frame[header.length] = 5;
    frame[header.length + 1] = 0x0a;
    frame[header.length + 2] = 0x01;
    call.getConnection().sendFrame(frame);

    Exception e = joinFailure(rpc);
    assertTrue(e instanceof NonRecoverableException);
    assertTrue(((HBaseRpcException) e).getStatus().isCorruption());

    server.setEcho(true);
    EchoRpc next = new EchoRpc("next");
    client.sendRpc(next);
    assertEquals("next", joinValue(next));
  }

  @Test(timeout = 30000)
  public void testUnknownCallIdIsFatal() throws Exception {
    openClient();
    EchoRpc rpc = new EchoRpc("pending");
    client.sendRpc(rpc);
    FakeRegionServer.ReceivedCall call = server.takeCall();

    CapturingLogAppender cla = new CapturingLogAppender();
    try (Closeable c = cla.attach()) {
      call.getConnection().sendFrame(FakeRegionServer.delimited(
          FakeRegionServer.responseHeader(999), StringValue.getDefaultInstance()));
      Exception e = joinFailure(rpc);
      assertTrue(e instanceof UnrecoverableException);
      assertTrue(((HBaseRpcException) e).getStatus().isIllegalState());
    }
    assertTrue(cla.getAppendedText(), cla.getAppendedText().contains("invalid call ID: 999"));
    assertTrue(client.isTerminated());

    try {
      client.sendRpc(new EchoRpc("rejected"));
      fail("sendRpc should fail on a terminated connection");
    } catch (UnrecoverableException e) {
      assertTrue(e.getStatus().isIllegalState());
    }
  }

  @Test(timeout = 30000)
  public void testMissingCallIdIsFatal() throws Exception {
    openClient();
    EchoRpc rpc = new EchoRpc("pending");
    client.sendRpc(rpc);
    FakeRegionServer.ReceivedCall call = server.takeCall();
    call.getConnection().sendFrame(FakeRegionServer.delimited(
        RpcHeader.ResponseHeader.getDefaultInstance(), StringValue.getDefaultInstance()));

    Exception e = joinFailure(rpc);
    assertTrue(e instanceof UnrecoverableException);
    assertTrue(((HBaseRpcException) e).getStatus().isIncomplete());
    assertTrue(client.isTerminated());
  }

  /** Sends two RPCs and waits for the server to receive both. */
  private List<EchoRpc> sendTwoInflight() throws Exception {
    List<EchoRpc> rpcs = new ArrayList<>();
    rpcs.add(new EchoRpc("first"));
    rpcs.add(new EchoRpc("second"));
    for (EchoRpc rpc : rpcs) {
      client.sendRpc(rpc);
    }
    server.takeCall();
    server.takeCall();
    assertEquals(2, client.getInflightCount());
    return rpcs;
  }

  private void assertAllFailedAndTerminated(List<EchoRpc> rpcs) throws Exception {
    for (EchoRpc rpc : rpcs) {
      Exception e = joinFailure(rpc);
      assertTrue(e instanceof UnrecoverableException);
      assertSame(client.getTerminalError(), e);
    }
    assertTrue(client.isTerminated());
    assertEquals(0, client.getInflightCount());
    try {
      client.sendRpc(new EchoRpc("rejected"));
      fail("sendRpc should fail on a terminated connection");
    } catch (UnrecoverableException e) {
      assertSame(client.getTerminalError(), e.getCause());
    }
  }

  @Test(timeout = 30000)
  public void testUndecodableResponseHeaderIsFatal() throws Exception {
    openClient();
    List<EchoRpc> rpcs = sendTwoInflight();
    FakeRegionServer.ServerConnection conn = server.awaitHandshake();

    // A 5-byte header made of varint continuation bytes only.
    conn.sendFrame(new byte[] {5, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF,
                               (byte) 0xFF});
    assertAllFailedAndTerminated(rpcs);
    assertTrue(client.getTerminalError().getStatus().isCorruption());
  }

  @Test(timeout = 30000)
  public void testConnectionClosedMidFrameIsFatal() throws Exception {
    openClient();
    List<EchoRpc> rpcs = sendTwoInflight();
    FakeRegionServer.ServerConnection conn = server.awaitHandshake();

    // Announce a 100-byte frame, send 10 bytes of it, then hang up.
    conn.sendRaw(new byte[] {0, 0, 0, 100, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10});
    server.disconnectAll();
    assertAllFailedAndTerminated(rpcs);
    assertTrue(client.getTerminalError().getStatus().isNetworkError());
  }

  @Test(timeout = 30000)
  public void testServerDisconnectFailsInflightRpcs() throws Exception {
    openClient();
    EchoRpc first = new EchoRpc("first");
    EchoRpc second = new EchoRpc("second");
    client.sendRpc(first);
    client.sendRpc(second);
    server.takeCall();
    server.takeCall();
    assertEquals(2, client.getInflightCount());

    server.disconnectAll();
    Exception e1 = joinFailure(first);
    Exception e2 = joinFailure(second);
    assertTrue(e1 instanceof UnrecoverableException);
    assertSame(e1, e2);
    assertTrue(client.isTerminated());
    assertEquals(0, client.getInflightCount());

    try {
      client.sendRpc(new EchoRpc("rejected"));
      fail("sendRpc should fail on a terminated connection");
    } catch (UnrecoverableException e) {
      assertSame(client.getTerminalError(), e.getCause());
    }
    client.getSenderThread().join(JOIN_TIMEOUT_MS);
    assertFalse(client.getSenderThread().isAlive());
  }

  @Test(timeout = 30000)
  public void testCloseFailsQueuedRpcs() throws Exception {
    // Nothing gets flushed on its own during the test.
    openClient(100, 60000);
    EchoRpc queued = new EchoRpc("queued");
    client.sendRpc(queued);
    client.close();

    Exception e = joinFailure(queued);
    assertTrue(e instanceof UnrecoverableException);
    assertTrue(((HBaseRpcException) e).getStatus().isAborted());
    assertNull(server.pollCall(200));
  }

  @Test(timeout = 30000)
  public void testResultIsDeliveredOnce() throws Exception {
    openClient();
    EchoRpc rpc = new EchoRpc("once");
    client.sendRpc(rpc);
    server.takeCall().respond(StringValue.newBuilder().setValue("once").build());
    assertEquals("once", joinValue(rpc));

    // Neither a late failure nor a second response can change the outcome.
    client.close();
    assertFalse(rpc.errback(new UnrecoverableException(Status.Aborted("late"))));
    assertFalse(rpc.callback(StringValue.getDefaultInstance()));
    assertEquals("once", joinValue(rpc));
  }

  @Test(timeout = 30000)
  public void testOpenFailure() throws Exception {
    int port;
    try (ServerSocket socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    try {
      RegionClient.open(new HostAndPort("127.0.0.1", port),
                        new RegionClientConfig(100, 5, "test-user", 5000),
                        eventLoopGroup);
      fail("open should fail when nothing listens on the port");
    } catch (RecoverableException e) {
      assertTrue(e.getStatus().isNetworkError());
      assertTrue(e.getMessage().contains(String.valueOf(port)));
    }
  }

  /**
   * Many threads enqueueing around the flush threshold, with a short flush interval, while the
   * server echoes everything: every RPC must be sent once and completed once.
   */
  @Test(timeout = 60000)
  public void testConcurrentSenders() throws Exception {
    final int threads = 8;
    final int rpcsPerThread = 250;
    server.setEcho(true);
    openClient(5, 1);

    final AtomicInteger successes = new AtomicInteger();
    final AtomicInteger failures = new AtomicInteger();
    final List<EchoRpc> rpcs = new ArrayList<>();
    final CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<List<EchoRpc>>> futures = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        final int thread = t;
        futures.add(pool.submit(() -> {
          List<EchoRpc> mine = new ArrayList<>();
          start.await();
          for (int i = 0; i < rpcsPerThread; i++) {
            EchoRpc rpc = new EchoRpc(thread + "-" + i);
            rpc.getDeferred().addCallbacks(
                new Callback<Object, StringValue>() {
                  @Override
                  public Object call(StringValue value) {
                    successes.incrementAndGet();
                    return value;
                  }
                },
                new Callback<Object, Exception>() {
                  @Override
                  public Object call(Exception e) {
                    failures.incrementAndGet();
                    return e;
                  }
                });
            client.sendRpc(rpc);
            mine.add(rpc);
          }
          return mine;
        }));
      }
      start.countDown();
      for (Future<List<EchoRpc>> f : futures) {
        rpcs.addAll(f.get(JOIN_TIMEOUT_MS, TimeUnit.MILLISECONDS));
      }
    } finally {
      pool.shutdownNow();
    }

    for (EchoRpc rpc : rpcs) {
      assertEquals(rpc.getValue(), joinValue(rpc));
    }
    assertEquals(threads * rpcsPerThread, rpcs.size());
    assertEquals(threads * rpcsPerThread, successes.get());
    assertEquals(0, failures.get());
    assertEquals(threads * rpcsPerThread, server.getCallCount());
    assertFalse(client.isTerminated());
  }

  /**
   * The connection dies while RPCs are being sent and queued: each of them must get exactly one
   * result, whichever task notices the failure first.
   */
  @Test(timeout = 60000)
  public void testEveryRpcCompletedOnceOnFailure() throws Exception {
    openClient(3, 1);
    server.awaitHandshake();
    final int count = 500;
    final AtomicInteger completions = new AtomicInteger();
    List<EchoRpc> rpcs = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      if (i == count / 2) {
        server.disconnectAll();
      }
      EchoRpc rpc = new EchoRpc("rpc-" + i);
      rpc.getDeferred().addCallbacks(
          new Callback<Object, StringValue>() {
            @Override
            public Object call(StringValue value) {
              completions.incrementAndGet();
              return value;
            }
          },
          new Callback<Object, Exception>() {
            @Override
            public Object call(Exception e) {
              completions.incrementAndGet();
              return e;
            }
          });
      try {
        client.sendRpc(rpc);
        rpcs.add(rpc);
      } catch (UnrecoverableException e) {
        // Rejected RPCs are never completed by the connection.
        assertFalse(rpc.isDone());
      }
    }
    for (EchoRpc rpc : rpcs) {
      assertTrue(joinFailure(rpc) instanceof UnrecoverableException);
    }
    assertEquals(rpcs.size(), completions.get());
    assertTrue(client.isTerminated());
    assertNotNull(client.getTerminalError());
  }
}
