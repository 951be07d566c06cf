package com.questrail.instrument.protocol.oncrpc.portmap;

/**
 * Port Mapper program constants (RFC 1057, Appendix A).
 */
public final class PortMapper
{
    public static final int PROGRAM = 100000;
    public static final int VERSION = 2;

    /** Well-known Port Mapper port. */
    public static final int DEFAULT_PORT = 111;

    public static final int PROC_NULL = 0;
    public static final int PROC_SET = 1;
    public static final int PROC_UNSET = 2;
    public static final int PROC_GETPORT = 3;
    public static final int PROC_DUMP = 4;
    public static final int PROC_CALLIT = 5;

    private PortMapper() {}
}
