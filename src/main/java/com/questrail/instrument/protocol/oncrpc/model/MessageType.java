package com.questrail.instrument.protocol.oncrpc.model;

import java.util.Optional;

/**
 * ONC RPC {@code msg_type} discriminant.
 */
public enum MessageType
{
    CALL(0),
    REPLY(1);

    private final int code;

    MessageType(int code)
    {
        this.code = code;
    }

    public int code()
    {
        return code;
    }

    public static Optional<MessageType> fromCode(int code)
    {
        return switch (code) {
            case 0 -> Optional.of(CALL);
            case 1 -> Optional.of(REPLY);
            default -> Optional.empty();
        };
    }
}
