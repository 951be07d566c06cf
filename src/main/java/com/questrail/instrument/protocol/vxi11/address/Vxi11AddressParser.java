package com.questrail.instrument.protocol.vxi11.address;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Vxi11AddressParser
 * -----------------------------------------------------------------------------
 * Recognizes VXI-11 resource strings, case-insensitively:
 *
 * <pre>
 *   TCPIP[board]::host[::name][::INSTR]
 * </pre>
 *
 * <p>{@code name} must end in a digit, optionally followed by a bracketed
 * suffix (USB or GPIB gateways, e.g. {@code usb0[1234::5678::SERIAL::0]}).
 * Comma-separated gateway names such as {@code gpib,5} are accepted as well.
 * HiSLIP addresses ({@code ::hislip...}) are rejected.</p>
 */
public final class Vxi11AddressParser
{
    private static final Pattern ADDRESS = Pattern.compile(
        "TCPIP(?<board>\\d*)::(?<host>[^\\s:]+)(::(?!hislip)(?<name>([^\\s:]+\\d+(\\[.+])?)))?(::INSTR)?$",
        Pattern.CASE_INSENSITIVE);

    private Vxi11AddressParser() {}

    /**
     * @return the parsed address, or empty if {@code address} is not a VXI-11 address
     */
    public static Optional<Vxi11Address> parse(String address)
    {
        if (address == null) {
            return Optional.empty();
        }
        Matcher m = ADDRESS.matcher(address);
        if (!m.lookingAt()) {
            return Optional.empty();
        }

        String board = m.group("board");
        int boardNumber = 0;
        if (!board.isEmpty()) {
            try {
                boardNumber = Integer.parseInt(board);
            }
            catch (NumberFormatException e) {
                // board number does not fit in an int
                return Optional.empty();
            }
        }
        String name = m.group("name");
        return Optional.of(new Vxi11Address(
            boardNumber,
            m.group("host"),
            name == null ? Vxi11Address.DEFAULT_DEVICE_NAME : name));
    }

    public static boolean isVxi11Address(String address)
    {
        return parse(address).isPresent();
    }
}
