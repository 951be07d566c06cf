package com.questrail.instrument.core;

import com.questrail.instrument.api.InstrumentException;
import com.questrail.instrument.api.MessageBasedInterface;
import com.questrail.instrument.config.ConnectionConfig;
import com.questrail.instrument.protocol.vxi11.Vxi11InterfaceProvider;

import java.util.List;
import java.util.Objects;

/**
 * InterfaceFactory
 * -----------------------------------------------------------------------------
 * Selects a {@link MessageBasedInterface} backend from the address string.
 *
 * <p>Providers are consulted in registration order; the first one whose
 * grammar matches the address wins. The factory holds no mutable state, so
 * one instance may be shared freely.</p>
 */
public final class InterfaceFactory
{
    private final List<InterfaceProvider> providers;

    public InterfaceFactory(List<InterfaceProvider> providers)
    {
        this.providers = List.copyOf(Objects.requireNonNull(providers, "providers"));
    }

    /**
     * A factory with every built-in backend registered using default settings.
     */
    public static InterfaceFactory defaults()
    {
        return new InterfaceFactory(List.of(new Vxi11InterfaceProvider()));
    }

    /**
     * Creates an unconnected interface for {@code config}.
     *
     * @throws IllegalArgumentException if no registered backend accepts the address
     */
    public MessageBasedInterface create(ConnectionConfig config)
    {
        Objects.requireNonNull(config, "config");
        for (InterfaceProvider provider : providers) {
            if (provider.supports(config.address())) {
                return provider.create(config);
            }
        }
        throw new IllegalArgumentException("No interface supports the address " + config.address());
    }

    /**
     * Creates an interface for {@code config} and connects it.
     */
    public MessageBasedInterface open(ConnectionConfig config) throws InstrumentException
    {
        MessageBasedInterface iface = create(config);
        iface.connect();
        return iface;
    }
}
