package com.questrail.instrument.protocol.vxi11.client;

import com.questrail.instrument.api.InstrumentException;
import com.questrail.instrument.protocol.vxi11.model.Vxi11ErrorCode;

/**
 * A non-zero {@code Device_ErrorCode} returned by a VXI-11 procedure.
 *
 * <p>The message is {@code "{text} [error={code}]"}. Device errors are raised
 * immediately and never retried.</p>
 */
public final class Vxi11DeviceException extends InstrumentException
{
    private final int code;

    public Vxi11DeviceException(int code)
    {
        super(Category.DEVICE, Vxi11ErrorCode.describe(code));
        this.code = code;
    }

    /**
     * The raw error code as sent by the server.
     */
    public int code()
    {
        return code;
    }

    public Vxi11ErrorCode errorCode()
    {
        return Vxi11ErrorCode.fromCode(code);
    }

    /**
     * True for error 15, the server-side {@code io_timeout} expiring.
     */
    public boolean isTimeout()
    {
        return errorCode() == Vxi11ErrorCode.IO_TIMEOUT;
    }
}
