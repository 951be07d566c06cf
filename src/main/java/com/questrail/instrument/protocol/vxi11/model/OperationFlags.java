package com.questrail.instrument.protocol.vxi11.model;

/**
 * Bit flags of the VXI-11 {@code Device_Flags} argument (Section B.5.3).
 */
public final class OperationFlags
{
    public static final int NULL = 0x00;

    /** Wait up to {@code lock_timeout} for a lock held by another link. */
    public static final int WAITLOCK = 0x01;

    /** The data of this {@code device_write} ends the message. */
    public static final int END = 0x08;

    /** {@code term_char} of this {@code device_read} is valid. */
    public static final int TERMCHRSET = 0x80;

    private OperationFlags() {}
}
