package com.questrail.instrument.protocol.vxi11.discovery;

import java.net.InetAddress;
import java.util.List;
import java.util.Objects;

/**
 * A VXI-11 server that answered a discovery broadcast.
 *
 * @param ipAddress   the address the reply came from
 * @param addresses   VXI-11 resource strings for the device
 * @param webserver   URL of the device's web interface
 * @param description human-readable description
 */
public record Vxi11Device(InetAddress ipAddress, List<String> addresses, String webserver, String description)
{
    public static final String UNKNOWN_DESCRIPTION = "Unknown LXI device";

    public Vxi11Device {
        Objects.requireNonNull(ipAddress, "ipAddress");
        addresses = List.copyOf(addresses);
        Objects.requireNonNull(webserver, "webserver");
        Objects.requireNonNull(description, "description");
    }

    /**
     * The entry used for a device that answered the Port Mapper query.
     */
    public static Vxi11Device of(InetAddress ipAddress)
    {
        String ip = ipAddress.getHostAddress();
        return new Vxi11Device(ipAddress,
            List.of("TCPIP::" + ip + "::inst0::INSTR"),
            "http://" + ip,
            UNKNOWN_DESCRIPTION);
    }
}
