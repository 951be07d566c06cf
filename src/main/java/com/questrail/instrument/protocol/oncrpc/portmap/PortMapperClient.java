package com.questrail.instrument.protocol.oncrpc.portmap;

import com.questrail.instrument.protocol.oncrpc.RpcClient;
import com.questrail.instrument.protocol.oncrpc.codec.XdrDecoder;
import com.questrail.instrument.protocol.oncrpc.codec.XdrEncoder;
import com.questrail.instrument.protocol.oncrpc.model.RpcCallHeader;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * PortMapperClient
 * -----------------------------------------------------------------------------
 * Resolves the TCP port serving an RPC program on a remote host through the
 * Port Mapper {@code GETPORT} procedure.
 *
 * <p>Each lookup opens its own connection to the Port Mapper and closes it
 * before returning, whether or not the lookup succeeded.</p>
 */
public final class PortMapperClient
{
    private final String host;
    private final int port;

    public PortMapperClient(String host)
    {
        this(host, PortMapper.DEFAULT_PORT);
    }

    /**
     * @param port the Port Mapper port on {@code host}, normally 111
     */
    public PortMapperClient(String host, int port)
    {
        this.host = Objects.requireNonNull(host, "host");
        if (port < 1 || port > 0xFFFF) {
            throw new IllegalArgumentException("Invalid Port Mapper port " + port);
        }
        this.port = port;
    }

    /**
     * Looks up the port of {@code program}/{@code version} over {@code protocol}.
     *
     * @param protocol {@link PortMapping#IPPROTO_TCP} or {@link PortMapping#IPPROTO_UDP}
     * @param timeout  connect and reply timeout; {@code null} for blocking
     * @throws PortMapperException if the program is not registered (port 0)
     */
    public int getPort(int program, int version, int protocol, Duration timeout) throws IOException
    {
        long resolved;
        try (RpcClient client = new RpcClient(host)) {
            client.connect(port, timeout);
            client.init(PortMapper.PROGRAM, PortMapper.VERSION, PortMapper.PROC_GETPORT);
            XdrEncoder args = new XdrEncoder();
            PortMapping.query(program, version, protocol).encodeTo(args);
            client.append(args.toByteArray());
            client.write();
            resolved = new XdrDecoder(client.read()).readUnsignedInt();
        }

        if (resolved == 0) {
            throw new PortMapperException("Could not determine the port from the Port Mapper procedure");
        }
        return (int) resolved;
    }

    /**
     * Builds the un-framed {@code GETPORT} call used for UDP broadcast discovery.
     */
    public static byte[] getPortCall(int xid, int program, int version, int protocol)
    {
        XdrEncoder out = new XdrEncoder();
        new RpcCallHeader(xid, PortMapper.PROGRAM, PortMapper.VERSION, PortMapper.PROC_GETPORT).encodeTo(out);
        PortMapping.query(program, version, protocol).encodeTo(out);
        return out.toByteArray();
    }
}
