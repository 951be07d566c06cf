package com.questrail.instrument.protocol.oncrpc;

import com.questrail.instrument.protocol.oncrpc.codec.XdrDecoder;
import com.questrail.instrument.protocol.oncrpc.model.AuthStatus;

import org.junit.jupiter.api.Test;

import java.net.SocketException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class RpcClientTest
{
    // ---------------------------------------------------------------------
    // Transaction ids and call composition
    // ---------------------------------------------------------------------

    @Test
    void xidStartsAtZeroAndIncrementsBeforeEachCall()
    {
        RpcClient client = new RpcClient("localhost");
        assertEquals(0, client.xid());

        client.init(100000, 2, 3);
        assertEquals(1, client.xid());
        client.init(100000, 2, 3);
        assertEquals(2, client.xid());
    }

    @Test
    void xidWrapsFromMaxUnsignedToZero()
    {
        RpcClient client = new RpcClient("localhost", 0xFFFFFFFE);

        client.init(1, 1, 1);
        assertEquals("4294967295", Integer.toUnsignedString(client.xid()));
        client.init(1, 1, 1);
        assertEquals(0, client.xid());
    }

    @Test
    void initWritesCallHeaderIntoClearedBuffer() throws Exception
    {
        RpcClient client = new RpcClient("localhost");
        client.init(0x0607AF, 1, 10);
        client.appendInt(99);
        client.init(0x0607AF, 1, 11);

        XdrDecoder in = new XdrDecoder(client.buffer());
        assertEquals(2, in.readInt());          // xid
        assertEquals(0, in.readInt());          // CALL
        assertEquals(2, in.readInt());          // RPC version
        assertEquals(0x0607AF, in.readInt());
        assertEquals(1, in.readInt());
        assertEquals(11, in.readInt());
        for (int i = 0; i < 4; i++) {
            assertEquals(0, in.readInt());      // AUTH_NONE credentials and verifier
        }
        assertEquals(0, in.remaining());
    }

    @Test
    void toMillisMapsNullToBlockingAndNeverReturnsZeroForFiniteTimeouts()
    {
        assertEquals(0, RpcClient.toMillis(null));
        assertEquals(1, RpcClient.toMillis(Duration.ZERO));
        assertEquals(1500, RpcClient.toMillis(Duration.ofMillis(1500)));
        assertEquals(Integer.MAX_VALUE, RpcClient.toMillis(Duration.ofDays(100)));
    }

    @Test
    void setTimeoutOnDisconnectedClientFails()
    {
        RpcClient client = new RpcClient("localhost");
        SocketException e = assertThrows(SocketException.class, () -> client.setTimeout(Duration.ofSeconds(1)));
        assertEquals("The socket is disconnected", e.getMessage());
    }

    @Test
    void closeIsIdempotent() throws Exception
    {
        RpcClient client = new RpcClient("localhost");
        client.close();
        client.close();
        assertFalse(client.isConnected());
    }

    // ---------------------------------------------------------------------
    // Reply classification
    // ---------------------------------------------------------------------

    private static RpcClient afterOneCall()
    {
        RpcClient client = new RpcClient("localhost");
        client.init(100000, 2, 3);
        return client;
    }

    @Test
    void successReplyYieldsPayload() throws Exception
    {
        RpcClient client = afterOneCall();
        Optional<byte[]> payload = client.checkReply(ScriptedRpcServer.success(1, 1024));
        assertArrayEquals(ScriptedRpcServer.ints(1024), payload.orElseThrow());
    }

    @Test
    void mismatchedXidIsNotAnError() throws Exception
    {
        RpcClient client = afterOneCall();
        assertTrue(client.checkReply(ScriptedRpcServer.success(7, 1024)).isEmpty());
    }

    @Test
    void nonReplyMessageTypeIsRejected()
    {
        RpcClient client = afterOneCall();
        byte[] call = ScriptedRpcServer.ints(1, 0, 0);
        RpcProtocolException e = assertThrows(RpcProtocolException.class, () -> client.checkReply(call));
        assertEquals(RpcFailure.WRONG_MESSAGE_TYPE, e.failure());
    }

    @Test
    void unknownReplyStatusIsRejected()
    {
        RpcClient client = afterOneCall();
        RpcProtocolException e = assertThrows(RpcProtocolException.class,
            () -> client.checkReply(ScriptedRpcServer.ints(1, 1, 2)));
        assertEquals(RpcFailure.UNKNOWN_REPLY_STATUS, e.failure());
    }

    @Test
    void deniedRpcMismatchCarriesVersionBounds()
    {
        RpcClient client = afterOneCall();
        RpcProtocolException e = assertThrows(RpcProtocolException.class,
            () -> client.checkReply(ScriptedRpcServer.denied(1, 0, 2, 4)));
        assertEquals(RpcFailure.RPC_MISMATCH, e.failure());
        assertEquals(2, e.low().orElseThrow());
        assertEquals(4, e.high().orElseThrow());
    }

    @Test
    void deniedAuthErrorCarriesAuthStatus()
    {
        RpcClient client = afterOneCall();
        RpcProtocolException e = assertThrows(RpcProtocolException.class,
            () -> client.checkReply(ScriptedRpcServer.denied(1, 1, 2)));
        assertEquals(RpcFailure.AUTH_ERROR, e.failure());
        assertEquals(2, e.authStatusCode().orElseThrow());
        assertEquals(Optional.of(AuthStatus.AUTH_REJECTEDCRED), e.authStatus());
    }

    @Test
    void unknownRejectStatusIsRejected()
    {
        RpcClient client = afterOneCall();
        RpcProtocolException e = assertThrows(RpcProtocolException.class,
            () -> client.checkReply(ScriptedRpcServer.denied(1, 5)));
        assertEquals(RpcFailure.UNKNOWN_REJECT_STATUS, e.failure());
        assertEquals("RPC MSG_DENIED reply status is not RPC_MISMATCH nor AUTH_ERROR, got 5", e.getMessage());
    }

    @Test
    void acceptedFailuresMapToTheirKinds()
    {
        RpcClient client = afterOneCall();

        assertEquals(RpcFailure.PROG_UNAVAIL, assertThrows(RpcProtocolException.class,
            () -> client.checkReply(ScriptedRpcServer.accepted(1, 1))).failure());
        assertEquals(RpcFailure.PROC_UNAVAIL, assertThrows(RpcProtocolException.class,
            () -> client.checkReply(ScriptedRpcServer.accepted(1, 3))).failure());
        assertEquals(RpcFailure.GARBAGE_ARGS, assertThrows(RpcProtocolException.class,
            () -> client.checkReply(ScriptedRpcServer.accepted(1, 4))).failure());
        assertEquals(RpcFailure.SYSTEM_ERR, assertThrows(RpcProtocolException.class,
            () -> client.checkReply(ScriptedRpcServer.accepted(1, 5))).failure());
        assertEquals(RpcFailure.UNKNOWN_ACCEPT_STATUS, assertThrows(RpcProtocolException.class,
            () -> client.checkReply(ScriptedRpcServer.accepted(1, 9))).failure());
    }

    @Test
    void programMismatchCarriesVersionBounds()
    {
        RpcClient client = afterOneCall();
        RpcProtocolException e = assertThrows(RpcProtocolException.class,
            () -> client.checkReply(ScriptedRpcServer.accepted(1, 2, 1, 3)));
        assertEquals(RpcFailure.PROG_MISMATCH, e.failure());
        assertEquals(1, e.low().orElseThrow());
        assertEquals(3, e.high().orElseThrow());
    }

    // ---------------------------------------------------------------------
    // Over a socket
    // ---------------------------------------------------------------------

    @Test
    void readSkipsStrayRepliesAndReassemblesFragments() throws Exception
    {
        AtomicInteger strays = new AtomicInteger();
        try (ScriptedRpcServer server = new ScriptedRpcServer(call -> List.of(
                ScriptedRpcServer.success(call.xid() + 100, 1),
                ScriptedRpcServer.success(call.xid(), 42, 43)));
             RpcClient client = new RpcClient("127.0.0.1") {
                 @Override
                 protected void onStrayReply(int expectedXid, byte[] message)
                 {
                     strays.incrementAndGet();
                 }
             }) {
            server.setFragmentSize(5);
            client.connect(server.port(), Duration.ofSeconds(5));
            client.init(100000, 2, 0);
            client.write();

            XdrDecoder in = new XdrDecoder(client.read());
            assertEquals(42, in.readInt());
            assertEquals(43, in.readInt());
            assertEquals(1, strays.get());
            assertEquals(5000, client.timeoutMillis());
        }
    }
}
