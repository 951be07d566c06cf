package com.questrail.instrument.protocol.vxi11.client;

import com.questrail.instrument.protocol.oncrpc.RpcClient;
import com.questrail.instrument.protocol.oncrpc.codec.XdrDecoder;
import com.questrail.instrument.protocol.vxi11.observability.StrayReplyEvent;
import com.questrail.instrument.protocol.vxi11.observability.Vxi11ObservabilitySink;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;

/**
 * Common base of the VXI-11 channel clients.
 *
 * <p>Every VXI-11 reply starts with a {@code Device_ErrorCode}. A non-zero code
 * is raised as {@link Vxi11DeviceException}; otherwise the remaining reply is
 * handed to the procedure as an {@link XdrDecoder}.</p>
 */
public abstract class Vxi11ChannelClient extends RpcClient
{
    private final Vxi11ObservabilitySink sink;

    protected Vxi11ChannelClient(String host, Vxi11ObservabilitySink sink)
    {
        super(host);
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Sends the composed call and returns its reply positioned after the
     * error code.
     *
     * @throws Vxi11DeviceException if the error code is non-zero
     */
    protected final XdrDecoder call() throws IOException
    {
        write();
        return readReply();
    }

    protected final XdrDecoder readReply() throws IOException
    {
        XdrDecoder in = new XdrDecoder(read());
        int error = in.readInt();
        if (error != 0) {
            throw new Vxi11DeviceException(error);
        }
        return in;
    }

    @Override
    protected void onStrayReply(int expectedXid, byte[] message)
    {
        sink.onStrayReply(new StrayReplyEvent(Instant.now(), host(), expectedXid, message.length));
    }
}
