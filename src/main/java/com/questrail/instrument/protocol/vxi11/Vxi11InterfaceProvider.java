package com.questrail.instrument.protocol.vxi11;

import com.questrail.instrument.config.ConnectionConfig;
import com.questrail.instrument.core.InterfaceProvider;
import com.questrail.instrument.internal.time.SystemMonotonicClock;
import com.questrail.instrument.protocol.vxi11.address.Vxi11AddressParser;
import com.questrail.instrument.protocol.vxi11.config.Vxi11Config;
import com.questrail.instrument.protocol.vxi11.observability.Slf4jVxi11ObservabilitySink;
import com.questrail.instrument.protocol.vxi11.observability.Vxi11ObservabilitySink;

import java.util.Objects;

/**
 * Serves {@code TCPIP[board]::host[::name][::INSTR]} addresses with a
 * {@link Vxi11Interface}.
 */
public final class Vxi11InterfaceProvider implements InterfaceProvider
{
    private final Vxi11Config vxi11Config;
    private final Vxi11ObservabilitySink sink;

    public Vxi11InterfaceProvider()
    {
        this(Vxi11Config.defaults(), new Slf4jVxi11ObservabilitySink());
    }

    public Vxi11InterfaceProvider(Vxi11Config vxi11Config, Vxi11ObservabilitySink sink)
    {
        this.vxi11Config = Objects.requireNonNull(vxi11Config, "vxi11Config");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public String name()
    {
        return "VXI-11";
    }

    @Override
    public boolean supports(String address)
    {
        return Vxi11AddressParser.isVxi11Address(address);
    }

    @Override
    public Vxi11Interface create(ConnectionConfig config)
    {
        return new Vxi11Interface(config, vxi11Config, sink, SystemMonotonicClock.INSTANCE);
    }
}
