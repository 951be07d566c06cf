package com.questrail.instrument.protocol.vxi11.address;

import java.util.Objects;

/**
 * A parsed VXI-11 resource address, {@code TCPIP[board]::host[::name][::INSTR]}.
 *
 * @param board the board number, {@code 0} when omitted
 * @param host  host name or IP address of the instrument or gateway
 * @param name  the LAN device name, {@code inst0} when omitted
 */
public record Vxi11Address(int board, String host, String name)
{
    public static final String DEFAULT_DEVICE_NAME = "inst0";

    public Vxi11Address {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(name, "name");
        if (board < 0) {
            throw new IllegalArgumentException("board must be >= 0, got " + board);
        }
    }

    @Override
    public String toString()
    {
        return "TCPIP" + board + "::" + host + "::" + name + "::INSTR";
    }
}
