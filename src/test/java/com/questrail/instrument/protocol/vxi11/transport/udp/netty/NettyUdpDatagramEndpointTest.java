package com.questrail.instrument.protocol.vxi11.transport.udp.netty;

import com.questrail.instrument.protocol.vxi11.transport.DatagramEndpointListener;

import org.junit.jupiter.api.Test;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Arrays;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyUdpDatagramEndpointTest
 * -----------------------------------------------------------------------------
 * Exchanges real datagrams over loopback between the Netty endpoint and a
 * plain {@link DatagramSocket} peer.
 */
final class NettyUdpDatagramEndpointTest
{
    private static final class Listener implements DatagramEndpointListener
    {
        final CountDownLatch up = new CountDownLatch(1);
        final BlockingQueue<byte[]> received = new LinkedBlockingQueue<>();
        volatile SocketAddress lastSender;

        @Override
        public void onTransportUp()
        {
            up.countDown();
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload)
        {
            lastSender = remote;
            received.add(payload);
        }
    }

    @Test
    void sendsAndReceivesDatagramsOverLoopback() throws Exception
    {
        InetAddress loopback = InetAddress.getLoopbackAddress();
        Listener listener = new Listener();
        NettyUdpDatagramEndpoint endpoint =
            new NettyUdpDatagramEndpoint(new InetSocketAddress(loopback, 0), false);
        endpoint.setListener(listener);

        try (DatagramSocket peer = new DatagramSocket(0, loopback)) {
            peer.setSoTimeout(5000);
            endpoint.start();
            assertTrue(listener.up.await(5, TimeUnit.SECONDS), "endpoint did not bind");

            endpoint.send(new InetSocketAddress(loopback, peer.getLocalPort()), new byte[] {1, 2, 3});

            DatagramPacket inbound = new DatagramPacket(new byte[64], 64);
            peer.receive(inbound);
            assertArrayEquals(new byte[] {1, 2, 3},
                Arrays.copyOf(inbound.getData(), inbound.getLength()));

            byte[] reply = {9, 8, 7, 6, 5};
            peer.send(new DatagramPacket(reply, reply.length, inbound.getSocketAddress()));

            byte[] got = listener.received.poll(5, TimeUnit.SECONDS);
            assertNotNull(got, "no datagram delivered to listener");
            assertArrayEquals(reply, got);
            assertEquals(peer.getLocalPort(), ((InetSocketAddress) listener.lastSender).getPort());
        }
        finally {
            endpoint.stop();
        }
    }

    @Test
    void startWithoutListenerIsRejected()
    {
        NettyUdpDatagramEndpoint endpoint =
            new NettyUdpDatagramEndpoint(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), false);
        try {
            assertThrows(IllegalStateException.class, endpoint::start);
        }
        finally {
            endpoint.stop();
        }
    }

    @Test
    void sendBeforeStartIsDropped()
    {
        NettyUdpDatagramEndpoint endpoint =
            new NettyUdpDatagramEndpoint(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), false);
        try {
            assertDoesNotThrow(() -> endpoint.send(new InetSocketAddress("127.0.0.1", 9), new byte[] {1}));
        }
        finally {
            endpoint.stop();
        }
    }
}
