package com.questrail.instrument.protocol.oncrpc.model;

import java.util.Optional;

/**
 * ONC RPC {@code reject_stat} of a denied reply.
 */
public enum RejectStatus
{
    RPC_MISMATCH(0),
    AUTH_ERROR(1);

    private final int code;

    RejectStatus(int code)
    {
        this.code = code;
    }

    public int code()
    {
        return code;
    }

    public static Optional<RejectStatus> fromCode(int code)
    {
        return switch (code) {
            case 0 -> Optional.of(RPC_MISMATCH);
            case 1 -> Optional.of(AUTH_ERROR);
            default -> Optional.empty();
        };
    }
}
