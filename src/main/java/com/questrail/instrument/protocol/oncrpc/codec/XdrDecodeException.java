package com.questrail.instrument.protocol.oncrpc.codec;

import com.questrail.instrument.api.InstrumentException;

/**
 * Raised when XDR or record-marked data does not fit the sizes it declares.
 */
public final class XdrDecodeException extends InstrumentException
{
    public XdrDecodeException(String message)
    {
        super(Category.PROTOCOL, message);
    }
}
