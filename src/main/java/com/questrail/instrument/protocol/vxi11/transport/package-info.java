/**
 * Datagram Transport Ports
 * =============================================================================
 *
 * Framework-agnostic UDP boundary used by VXI-11 broadcast discovery. Netty is
 * used in production without its types leaking above this package: callers see
 * only {@code byte[]} payloads, {@link java.net.SocketAddress} peers and up/down
 * notifications.
 *
 * <h2>Architectural constraints</h2>
 * Implementations:
 * <ul>
 *   <li>perform transport I/O only</li>
 *   <li>do not build or decode RPC messages</li>
 *   <li>do not schedule timeouts</li>
 * </ul>
 */
package com.questrail.instrument.protocol.vxi11.transport;
