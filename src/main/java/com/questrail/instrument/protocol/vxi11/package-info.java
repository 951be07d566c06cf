/**
 * VXI-11 instrument control over ONC RPC.
 *
 * <p>{@link com.questrail.instrument.protocol.vxi11.Vxi11Interface} is the
 * entry point; {@link com.questrail.instrument.protocol.vxi11.discovery.Vxi11Discovery}
 * finds servers on the local networks.</p>
 */
package com.questrail.instrument.protocol.vxi11;
