package com.questrail.instrument.protocol.vxi11.transport;

import java.net.SocketAddress;

/**
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks are delivered serially. Netty endpoints deliver them on the
 * channel's event loop.</p>
 */
public interface DatagramEndpointListener
{
    void onTransportUp();

    /**
     * @param cause the failure, or {@code null} for an orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called once per received datagram with a private copy of its payload.
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
