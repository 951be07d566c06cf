package com.questrail.instrument.protocol.vxi11.state;

/**
 * Lifecycle of a VXI-11 link.
 *
 * <pre>
 *   DISCONNECTED --create_link--> LINKED --destroy_link--> DESTROYED
 * </pre>
 *
 * {@code DESTROYED} is terminal: reconnecting requires a new session.
 */
public enum LinkState
{
    DISCONNECTED,
    LINKED,
    DESTROYED
}
