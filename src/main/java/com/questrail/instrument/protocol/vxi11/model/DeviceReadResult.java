package com.questrail.instrument.protocol.vxi11.model;

import java.util.Objects;

/**
 * Result of one {@code device_read}: the {@link ReadReason} bits and the data.
 */
public record DeviceReadResult(int reason, byte[] data)
{
    public DeviceReadResult {
        Objects.requireNonNull(data, "data");
    }

    public boolean isMessageComplete()
    {
        return ReadReason.isMessageComplete(reason);
    }
}
