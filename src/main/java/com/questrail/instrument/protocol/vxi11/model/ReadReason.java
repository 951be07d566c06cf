package com.questrail.instrument.protocol.vxi11.model;

/**
 * Bits of the {@code reason} field returned by {@code device_read}.
 */
public final class ReadReason
{
    /** The requested number of bytes was transferred. */
    public static final int RX_REQCNT = 0x01;

    /** The termination character was transferred. */
    public static final int RX_CHR = 0x02;

    /** The device signalled the end of the message. */
    public static final int RX_END = 0x04;

    private ReadReason() {}

    /**
     * True if no further {@code device_read} is needed to complete the message.
     */
    public static boolean isMessageComplete(int reason)
    {
        return (reason & (RX_END | RX_CHR)) != 0;
    }
}
