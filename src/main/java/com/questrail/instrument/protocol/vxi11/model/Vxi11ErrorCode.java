package com.questrail.instrument.protocol.vxi11.model;

import java.util.HashMap;
import java.util.Map;

/**
 * VXI-11 {@code Device_ErrorCode} values (Table B.2).
 *
 * <p>Codes not in the table map to {@link #UNDEFINED}; the numeric code is
 * always preserved separately by the caller.</p>
 */
public enum Vxi11ErrorCode
{
    NO_ERROR(0, "No error"),
    SYNTAX_ERROR(1, "Syntax error"),
    DEVICE_NOT_ACCESSIBLE(3, "Device not accessible"),
    INVALID_LINK_IDENTIFIER(4, "Invalid link identifier"),
    PARAMETER_ERROR(5, "Parameter error"),
    CHANNEL_NOT_ESTABLISHED(6, "Channel not established"),
    OPERATION_NOT_SUPPORTED(8, "Operation not supported"),
    OUT_OF_RESOURCES(9, "Out of resources"),
    DEVICE_LOCKED_BY_ANOTHER_LINK(11, "Device locked by another link"),
    NO_LOCK_HELD_BY_THIS_LINK(12, "No lock held by this link"),
    IO_TIMEOUT(15, "I/O timeout"),
    IO_ERROR(17, "I/O error"),
    INVALID_ADDRESS(21, "Invalid address"),
    ABORT(23, "Abort"),
    CHANNEL_ALREADY_ESTABLISHED(29, "Channel already established"),
    UNDEFINED(-1, "Undefined error");

    private static final Map<Integer, Vxi11ErrorCode> BY_CODE = new HashMap<>();

    static {
        for (Vxi11ErrorCode value : values()) {
            if (value != UNDEFINED) {
                BY_CODE.put(value.code, value);
            }
        }
    }

    private final int code;
    private final String text;

    Vxi11ErrorCode(int code, String text)
    {
        this.code = code;
        this.text = text;
    }

    public int code()
    {
        return code;
    }

    public String text()
    {
        return text;
    }

    public static Vxi11ErrorCode fromCode(int code)
    {
        return BY_CODE.getOrDefault(code, UNDEFINED);
    }

    /**
     * Human-readable message for a raw code: {@code "{text} [error={code}]"}.
     */
    public static String describe(int code)
    {
        return fromCode(code).text + " [error=" + Integer.toUnsignedString(code) + "]";
    }
}
