package com.questrail.instrument.core;

import com.questrail.instrument.api.InstrumentConnectionException;
import com.questrail.instrument.api.InstrumentException;
import com.questrail.instrument.api.InstrumentTimeoutException;
import com.questrail.instrument.config.ConnectionConfig;

import org.junit.jupiter.api.Test;

import java.io.EOFException;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractMessageBasedInterfaceTest
{
    /**
     * Backend that replays queued messages and records writes.
     */
    private static final class LoopbackInterface extends AbstractMessageBasedInterface
    {
        final Deque<Object> replies = new ArrayDeque<>();
        final List<byte[]> written = new ArrayList<>();
        final List<OptionalInt> requestedSizes = new ArrayList<>();
        int timeoutChanges;

        LoopbackInterface(ConnectionConfig config)
        {
            super(config);
        }

        @Override
        protected byte[] doRead(OptionalInt size) throws IOException
        {
            requestedSizes.add(size);
            Object next = replies.poll();
            if (next instanceof IOException e) {
                throw e;
            }
            return (byte[]) next;
        }

        @Override
        protected int doWrite(byte[] message)
        {
            written.add(message);
            return message.length;
        }

        @Override
        protected void onTimeoutChanged()
        {
            timeoutChanges++;
        }

        @Override
        public void connect()
        {
        }

        @Override
        public boolean isConnected()
        {
            return true;
        }

        @Override
        public void disconnect()
        {
        }
    }

    private static LoopbackInterface loopback(ConnectionConfig.Builder builder)
    {
        return new LoopbackInterface(builder.withAddress("LOOP::1").build());
    }

    private static byte[] ascii(String s)
    {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    // ---------------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------------

    @Test
    void rstripRemovesTrailingWhitespaceOnly()
    {
        assertArrayEquals(ascii("  1.0"), AbstractMessageBasedInterface.stripTrailingWhitespace(ascii("  1.0 \r\n\t")));
        assertArrayEquals(new byte[0], AbstractMessageBasedInterface.stripTrailingWhitespace(ascii(" \n")));
    }

    @Test
    void readAppliesRstripWhenEnabled() throws Exception
    {
        LoopbackInterface iface = loopback(ConnectionConfig.builder().withRstrip(true));
        iface.replies.add(ascii("+9.9E37\n"));

        assertEquals("+9.9E37", iface.readString());
    }

    @Test
    void sizedReadLargerThanMaxReadSizeIsRejectedBeforeIo()
    {
        LoopbackInterface iface = loopback(ConnectionConfig.builder().withMaxReadSize(8));

        InstrumentConnectionException e = assertThrows(InstrumentConnectionException.class, () -> iface.read(9));
        assertEquals("LoopbackInterface<LOOP::1>: max_read_size is 8 bytes, requesting 9 bytes", e.getMessage());
        assertTrue(iface.requestedSizes.isEmpty());
    }

    @Test
    void sizedReadMustReturnExactlyTheRequestedBytes()
    {
        LoopbackInterface iface = loopback(ConnectionConfig.builder());
        iface.replies.add(ascii("abc"));

        InstrumentConnectionException e = assertThrows(InstrumentConnectionException.class, () -> iface.read(4));
        assertTrue(e.getMessage().endsWith("received 3 bytes, requested 4 bytes"));
    }

    @Test
    void negativeSizeIsRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> loopback(ConnectionConfig.builder()).read(-1));
    }

    // ---------------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------------

    @Test
    void writeTerminationIsAppendedOnce() throws Exception
    {
        LoopbackInterface iface = loopback(ConnectionConfig.builder().withWriteTermination("\r\n"));

        assertEquals(7, iface.write("*IDN?"));
        assertEquals(7, iface.write("*IDN?\r\n"));
        assertArrayEquals(ascii("*IDN?\r\n"), iface.written.get(0));
        assertArrayEquals(ascii("*IDN?\r\n"), iface.written.get(1));
    }

    @Test
    void queryWritesThenReads() throws Exception
    {
        LoopbackInterface iface = loopback(ConnectionConfig.builder().withTermination("\n").withRstrip(true));
        iface.replies.add(ascii("OK\n"));

        assertEquals("OK", iface.query("SYST:ERR?"));
        assertArrayEquals(ascii("SYST:ERR?\n"), iface.written.get(0));
    }

    // ---------------------------------------------------------------------
    // Error translation and timeouts
    // ---------------------------------------------------------------------

    @Test
    void socketTimeoutBecomesInstrumentTimeout()
    {
        LoopbackInterface iface = loopback(ConnectionConfig.builder().withTimeout(Duration.ofMillis(2500)));
        iface.replies.add(new SocketTimeoutException("Read timed out"));

        InstrumentTimeoutException e = assertThrows(InstrumentTimeoutException.class, iface::read);
        assertEquals("LoopbackInterface<LOOP::1>: Timeout occurred after 2.5 second(s)", e.getMessage());
    }

    @Test
    void otherIoFailuresBecomeConnectionErrors()
    {
        LoopbackInterface iface = loopback(ConnectionConfig.builder());
        iface.replies.add(new EOFException("The RPC reply header is < 4 bytes"));

        InstrumentConnectionException e = assertThrows(InstrumentConnectionException.class, iface::read);
        assertEquals(InstrumentException.Category.TRANSPORT, e.category());
        assertInstanceOf(EOFException.class, e.getCause());
    }

    @Test
    void negativeOrNullTimeoutMeansBlocking()
    {
        LoopbackInterface iface = loopback(ConnectionConfig.builder().withTimeout(Duration.ofSeconds(1)));
        assertEquals(Duration.ofSeconds(1), iface.timeout().orElseThrow());

        iface.setTimeout(Duration.ofSeconds(-3));
        assertTrue(iface.timeout().isEmpty());
        iface.setTimeout(null);
        assertTrue(iface.timeout().isEmpty());
        assertEquals(2, iface.timeoutChanges);
    }

    @Test
    void printableEscapesControlBytes()
    {
        assertEquals("'a\\r\\n\\x00\\xff'", AbstractMessageBasedInterface.printable(new byte[] {'a', '\r', '\n', 0, (byte) 0xFF}));
    }
}
