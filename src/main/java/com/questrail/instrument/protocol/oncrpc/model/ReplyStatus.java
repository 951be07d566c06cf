package com.questrail.instrument.protocol.oncrpc.model;

import java.util.Optional;

/**
 * ONC RPC {@code reply_stat}: whether a call was accepted or denied.
 */
public enum ReplyStatus
{
    MSG_ACCEPTED(0),
    MSG_DENIED(1);

    private final int code;

    ReplyStatus(int code)
    {
        this.code = code;
    }

    public int code()
    {
        return code;
    }

    public static Optional<ReplyStatus> fromCode(int code)
    {
        return switch (code) {
            case 0 -> Optional.of(MSG_ACCEPTED);
            case 1 -> Optional.of(MSG_DENIED);
            default -> Optional.empty();
        };
    }
}
