package com.questrail.instrument.core;

import com.questrail.instrument.api.MessageBasedInterface;
import com.questrail.instrument.config.ConnectionConfig;
import com.questrail.instrument.protocol.vxi11.Vxi11Interface;
import com.questrail.instrument.protocol.vxi11.Vxi11InterfaceProvider;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class InterfaceFactoryTest
{
    @Test
    void vxi11AddressSelectsVxi11Backend()
    {
        MessageBasedInterface iface = InterfaceFactory.defaults()
            .create(ConnectionConfig.of("TCPIP0::192.168.1.50::inst0::INSTR"));

        Vxi11Interface vxi = assertInstanceOf(Vxi11Interface.class, iface);
        assertEquals("192.168.1.50", vxi.host());
        assertFalse(vxi.isConnected());
        assertEquals("Vxi11Interface<TCPIP0::192.168.1.50::inst0::INSTR>", vxi.toString());
    }

    @Test
    void unsupportedAddressIsRejected()
    {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> InterfaceFactory.defaults().create(ConnectionConfig.of("ASRL/dev/ttyUSB0::INSTR")));
        assertEquals("No interface supports the address ASRL/dev/ttyUSB0::INSTR", e.getMessage());
    }

    @Test
    void providersAreConsultedInOrder()
    {
        InterfaceProvider catchAll = new InterfaceProvider() {
            @Override
            public String name()
            {
                return "catch-all";
            }

            @Override
            public boolean supports(String address)
            {
                return true;
            }

            @Override
            public MessageBasedInterface create(ConnectionConfig config)
            {
                throw new UnsupportedOperationException("catch-all");
            }
        };

        InterfaceFactory factory = new InterfaceFactory(List.of(
            new Vxi11InterfaceProvider(), catchAll));

        assertInstanceOf(Vxi11Interface.class, factory.create(ConnectionConfig.of("TCPIP::10.0.0.1")));
        assertThrows(UnsupportedOperationException.class, () -> factory.create(ConnectionConfig.of("GPIB::23")));
    }
}
