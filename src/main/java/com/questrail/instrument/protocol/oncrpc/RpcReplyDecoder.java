package com.questrail.instrument.protocol.oncrpc;

import com.questrail.instrument.protocol.oncrpc.codec.XdrDecodeException;
import com.questrail.instrument.protocol.oncrpc.codec.XdrDecoder;
import com.questrail.instrument.protocol.oncrpc.codec.XdrEncoder;
import com.questrail.instrument.protocol.oncrpc.model.AcceptStatus;
import com.questrail.instrument.protocol.oncrpc.model.MessageType;
import com.questrail.instrument.protocol.oncrpc.model.RejectStatus;
import com.questrail.instrument.protocol.oncrpc.model.ReplyStatus;
import com.questrail.instrument.protocol.oncrpc.model.RpcReply;

import java.util.Optional;

/**
 * RpcReplyDecoder
 * -----------------------------------------------------------------------------
 * Parses and classifies a reassembled ONC RPC reply message (RFC 1057,
 * Section 8).
 *
 * <pre>
 * xid | msg_type=REPLY | reply_stat
 *   MSG_ACCEPTED: verf(flavor, opaque) | accept_stat | [results | low high]
 *   MSG_DENIED:   reject_stat | [low high | auth_stat]
 * </pre>
 *
 * <h2>Outcomes</h2>
 * <ul>
 *   <li>{@code Optional.empty()}: the {@code xid} does not match. The caller
 *       discards the message and reads again.</li>
 *   <li>An {@link RpcReply} variant for every well-formed accept/deny case.</li>
 *   <li>{@link RpcProtocolException} for a non-REPLY message type and for
 *       reply, reject or accept statuses that RFC 1057 does not define.</li>
 * </ul>
 *
 * <p>Stateless.</p>
 */
public final class RpcReplyDecoder
{
    private RpcReplyDecoder() {}

    public static Optional<RpcReply> decode(byte[] message, int expectedXid)
            throws RpcProtocolException, XdrDecodeException
    {
        XdrDecoder in = new XdrDecoder(message);

        int xid = in.readInt();
        if (xid != expectedXid) {
            return Optional.empty();
        }

        int messageType = in.readInt();
        if (messageType != MessageType.REPLY.code()) {
            throw RpcProtocolException.of(RpcFailure.WRONG_MESSAGE_TYPE,
                "got " + Integer.toUnsignedString(messageType));
        }

        int replyStatus = in.readInt();
        if (replyStatus == ReplyStatus.MSG_ACCEPTED.code()) {
            return Optional.of(decodeAccepted(in));
        }
        if (replyStatus == ReplyStatus.MSG_DENIED.code()) {
            return Optional.of(decodeDenied(in));
        }
        throw RpcProtocolException.of(RpcFailure.UNKNOWN_REPLY_STATUS,
            "got " + Integer.toUnsignedString(replyStatus));
    }

    private static RpcReply decodeAccepted(XdrDecoder in)
            throws RpcProtocolException, XdrDecodeException
    {
        // verifier: flavor, then an opaque body (empty for AUTH_NONE)
        in.readInt();
        long verifierLength = in.readUnsignedInt();
        if (verifierLength > in.remaining()) {
            throw new XdrDecodeException("verifier length " + verifierLength + " exceeds the reply");
        }
        int skip = (int) verifierLength;
        in.skip(skip + Math.min(XdrEncoder.padding(skip), in.remaining() - skip));

        int acceptStatus = in.readInt();
        AcceptStatus status = AcceptStatus.fromCode(acceptStatus).orElseThrow(() ->
            RpcProtocolException.of(RpcFailure.UNKNOWN_ACCEPT_STATUS,
                "got " + Integer.toUnsignedString(acceptStatus)));

        return switch (status) {
            case SUCCESS -> new RpcReply.Accepted(in.readRemaining());
            case PROG_UNAVAIL -> new RpcReply.AcceptedProgUnavailable();
            case PROG_MISMATCH -> new RpcReply.AcceptedMismatch(in.readUnsignedInt(), in.readUnsignedInt());
            case PROC_UNAVAIL -> new RpcReply.AcceptedProcUnavailable();
            case GARBAGE_ARGS -> new RpcReply.AcceptedGarbageArgs();
            case SYSTEM_ERR -> new RpcReply.AcceptedSystemError();
        };
    }

    private static RpcReply decodeDenied(XdrDecoder in)
            throws RpcProtocolException, XdrDecodeException
    {
        int rejectStatus = in.readInt();
        if (rejectStatus == RejectStatus.RPC_MISMATCH.code()) {
            return new RpcReply.DeniedRpcMismatch(in.readUnsignedInt(), in.readUnsignedInt());
        }
        if (rejectStatus == RejectStatus.AUTH_ERROR.code()) {
            return new RpcReply.DeniedAuthError(in.readInt());
        }
        throw RpcProtocolException.of(RpcFailure.UNKNOWN_REJECT_STATUS,
            "got " + Integer.toUnsignedString(rejectStatus));
    }
}
