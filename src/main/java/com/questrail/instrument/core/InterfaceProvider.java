package com.questrail.instrument.core;

import com.questrail.instrument.api.MessageBasedInterface;
import com.questrail.instrument.config.ConnectionConfig;

/**
 * A backend that can serve addresses of one grammar (VXI-11, raw socket, ...).
 */
public interface InterfaceProvider
{
    /**
     * Short backend name used in diagnostics, e.g. {@code "VXI-11"}.
     */
    String name();

    /**
     * Returns true if {@code address} matches this backend's address grammar.
     */
    boolean supports(String address);

    /**
     * Creates an unconnected interface for {@code config}.
     *
     * @throws IllegalArgumentException if the address is not supported
     */
    MessageBasedInterface create(ConnectionConfig config);
}
