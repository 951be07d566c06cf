package com.questrail.instrument.protocol.oncrpc.portmap;

import com.questrail.instrument.api.InstrumentException;

/**
 * Raised when the Port Mapper answers {@code GETPORT} with port 0, i.e. the
 * requested program is not registered on the host.
 */
public final class PortMapperException extends InstrumentException
{
    public PortMapperException(String message)
    {
        super(Category.PROTOCOL, message);
    }
}
