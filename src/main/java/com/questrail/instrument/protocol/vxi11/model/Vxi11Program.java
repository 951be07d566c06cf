package com.questrail.instrument.protocol.vxi11.model;

/**
 * VXI-11 RPC program, version and procedure numbers (VXI-11 Rev 1.0, Appendix B).
 */
public final class Vxi11Program
{
    public static final int DEVICE_CORE = 0x0607AF;
    public static final int DEVICE_ASYNC = 0x0607B0;
    public static final int DEVICE_INTR = 0x0607B1;

    public static final int DEVICE_CORE_VERSION = 1;
    public static final int DEVICE_ASYNC_VERSION = 1;
    public static final int DEVICE_INTR_VERSION = 1;

    // Abort channel (DEVICE_ASYNC)
    public static final int DEVICE_ABORT = 1;

    // Core channel (DEVICE_CORE)
    public static final int CREATE_LINK = 10;
    public static final int DEVICE_WRITE = 11;
    public static final int DEVICE_READ = 12;
    public static final int DEVICE_READSTB = 13;
    public static final int DEVICE_TRIGGER = 14;
    public static final int DEVICE_CLEAR = 15;
    public static final int DEVICE_REMOTE = 16;
    public static final int DEVICE_LOCAL = 17;
    public static final int DEVICE_LOCK = 18;
    public static final int DEVICE_UNLOCK = 19;
    public static final int DEVICE_ENABLE_SRQ = 20;
    public static final int DEVICE_DOCMD = 22;
    public static final int DESTROY_LINK = 23;
    public static final int CREATE_INTR_CHAN = 25;
    public static final int DESTROY_INTR_CHAN = 26;

    // Interrupt channel (DEVICE_INTR)
    public static final int DEVICE_INTR_SRQ = 30;

    private Vxi11Program() {}
}
