package com.questrail.instrument.protocol.oncrpc.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * ONC RPC {@code accept_stat} of an accepted reply.
 */
public enum AcceptStatus
{
    SUCCESS(0),
    PROG_UNAVAIL(1),
    PROG_MISMATCH(2),
    PROC_UNAVAIL(3),
    GARBAGE_ARGS(4),
    SYSTEM_ERR(5);

    private static final Map<Integer, AcceptStatus> BY_CODE = new HashMap<>();

    static {
        for (AcceptStatus value : values()) {
            BY_CODE.put(value.code, value);
        }
    }

    private final int code;

    AcceptStatus(int code)
    {
        this.code = code;
    }

    public int code()
    {
        return code;
    }

    public static Optional<AcceptStatus> fromCode(int code)
    {
        return Optional.ofNullable(BY_CODE.get(code));
    }
}
