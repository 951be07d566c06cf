package com.questrail.instrument.protocol.oncrpc.portmap;

import com.questrail.instrument.protocol.oncrpc.codec.XdrEncoder;

/**
 * Port Mapper {@code mapping} structure (RFC 1057, Appendix A).
 *
 * <p>Used as the argument of {@code GETPORT}, where {@code port} is ignored
 * by the server and sent as 0.</p>
 */
public record PortMapping(int program, int version, int protocol, int port)
{
    public static final int IPPROTO_TCP = 6;
    public static final int IPPROTO_UDP = 17;

    public static PortMapping query(int program, int version, int protocol)
    {
        return new PortMapping(program, version, protocol, 0);
    }

    public void encodeTo(XdrEncoder encoder)
    {
        encoder.appendInt(program);
        encoder.appendInt(version);
        encoder.appendInt(protocol);
        encoder.appendInt(port);
    }

    @Override
    public String toString()
    {
        return String.format("(PortMapping-%d:%d:%d:%d)", program, version, protocol, port);
    }
}
