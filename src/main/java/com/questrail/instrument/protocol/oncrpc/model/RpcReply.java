package com.questrail.instrument.protocol.oncrpc.model;

import java.util.Objects;

/**
 * Classified outcome of an ONC RPC reply whose {@code xid} matched the call.
 *
 * <p>Only {@link Accepted} carries a procedure payload. Every other variant is
 * fatal for the call it answers.</p>
 */
public sealed interface RpcReply
        permits RpcReply.Accepted,
                RpcReply.AcceptedProgUnavailable,
                RpcReply.AcceptedMismatch,
                RpcReply.AcceptedProcUnavailable,
                RpcReply.AcceptedGarbageArgs,
                RpcReply.AcceptedSystemError,
                RpcReply.DeniedRpcMismatch,
                RpcReply.DeniedAuthError
{
    /** {@code MSG_ACCEPTED / SUCCESS}: the procedure-specific result. */
    record Accepted(byte[] payload) implements RpcReply
    {
        public Accepted {
            Objects.requireNonNull(payload, "payload");
        }
    }

    record AcceptedProgUnavailable() implements RpcReply {}

    /** {@code MSG_ACCEPTED / PROG_MISMATCH}: supported program versions. */
    record AcceptedMismatch(long low, long high) implements RpcReply {}

    record AcceptedProcUnavailable() implements RpcReply {}

    record AcceptedGarbageArgs() implements RpcReply {}

    record AcceptedSystemError() implements RpcReply {}

    /** {@code MSG_DENIED / RPC_MISMATCH}: supported RPC protocol versions. */
    record DeniedRpcMismatch(long low, long high) implements RpcReply {}

    /** {@code MSG_DENIED / AUTH_ERROR}; {@code authStatus} is the raw wire value. */
    record DeniedAuthError(int authStatus) implements RpcReply {}
}
