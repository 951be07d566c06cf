package com.questrail.instrument.protocol.oncrpc.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * ONC RPC {@code auth_stat} carried by an {@code AUTH_ERROR} rejection.
 */
public enum AuthStatus
{
    AUTH_BADCRED(1),
    AUTH_REJECTEDCRED(2),
    AUTH_BADVERF(3),
    AUTH_REJECTEDVERF(4),
    AUTH_TOOWEAK(5);

    private static final Map<Integer, AuthStatus> BY_CODE = new HashMap<>();

    static {
        for (AuthStatus value : values()) {
            BY_CODE.put(value.code, value);
        }
    }

    private final int code;

    AuthStatus(int code)
    {
        this.code = code;
    }

    public int code()
    {
        return code;
    }

    public static Optional<AuthStatus> fromCode(int code)
    {
        return Optional.ofNullable(BY_CODE.get(code));
    }
}
