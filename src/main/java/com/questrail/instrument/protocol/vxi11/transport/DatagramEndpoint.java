package com.questrail.instrument.protocol.vxi11.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a UDP socket, used by broadcast discovery.
 *
 * <p>Implementations may be backed by Netty or a test harness. The endpoint
 * only moves bytes; building and interpreting RPC messages is the caller's
 * job.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Binds the socket and begins receiving datagrams.
     *
     * <p>On success the listener is notified via
     * {@link DatagramEndpointListener#onTransportUp()}; {@link #send} may be
     * called from that callback.</p>
     */
    void start();

    /**
     * Closes the socket and releases all transport resources.
     */
    void stop();

    /**
     * Sends one datagram. Silently dropped if the endpoint is not up.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Must be called before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);
}
