package com.questrail.instrument.protocol.oncrpc.model;

import com.questrail.instrument.protocol.oncrpc.codec.XdrEncoder;

/**
 * Header of an ONC RPC call message.
 *
 * <pre>
 * xid | msg_type=CALL | rpcvers=2 | prog | vers | proc | cred(AUTH_NONE, 0) | verf(AUTH_NONE, 0)
 * </pre>
 *
 * <p>{@code xid}, {@code program}, {@code version} and {@code procedure} are
 * unsigned 32-bit values carried in Java {@code int}s.</p>
 */
public record RpcCallHeader(int xid, int program, int version, int procedure)
{
    public static final int RPC_VERSION = 2;

    /** {@code AUTH_NONE} flavor. VXI-11 does not use authentication. */
    public static final int AUTH_NONE = 0;

    public void encodeTo(XdrEncoder encoder)
    {
        encoder.appendInt(xid);
        encoder.appendInt(MessageType.CALL.code());
        encoder.appendInt(RPC_VERSION);
        encoder.appendInt(program);
        encoder.appendInt(version);
        encoder.appendInt(procedure);
        // credentials, then verifier: flavor + zero-length body each
        encoder.appendInt(AUTH_NONE);
        encoder.appendInt(0);
        encoder.appendInt(AUTH_NONE);
        encoder.appendInt(0);
    }
}
