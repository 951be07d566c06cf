/**
 * Public, transport-neutral surface of the instrument toolkit.
 *
 * <p>This package contains the {@link com.questrail.instrument.api.MessageBasedInterface}
 * contract and the checked exception taxonomy rooted at
 * {@link com.questrail.instrument.api.InstrumentException}. Nothing here knows
 * about ONC RPC, VXI-11 or sockets.</p>
 */
package com.questrail.instrument.api;
