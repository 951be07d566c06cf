package com.questrail.instrument.protocol.vxi11.client;

import com.questrail.instrument.protocol.vxi11.model.Vxi11Program;
import com.questrail.instrument.protocol.vxi11.observability.Vxi11ObservabilitySink;

import java.io.IOException;

/**
 * Client of the VXI-11 abort channel ({@code DEVICE_ASYNC}).
 *
 * <p>Connected to the {@code abort_port} returned by {@code create_link}. It is
 * a separate connection from the core channel and may be driven by a second
 * thread while the first blocks on a core channel reply.</p>
 */
public final class AbortChannelClient extends Vxi11ChannelClient
{
    public AbortChannelClient(String host, Vxi11ObservabilitySink sink)
    {
        super(host, sink);
    }

    /**
     * Stops the in-progress core channel call on link {@code lid}.
     */
    public void deviceAbort(int lid) throws IOException
    {
        init(Vxi11Program.DEVICE_ASYNC, Vxi11Program.DEVICE_ASYNC_VERSION, Vxi11Program.DEVICE_ABORT);
        appendInt(lid);
        call();
    }
}
