package com.questrail.instrument.protocol.vxi11.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Vxi11ModelTest {

    // ---------------------------------------------------------------------
    // Error codes
    // ---------------------------------------------------------------------

    @Test
    void describeKnownCodes() {
        assertEquals("Device not accessible [error=3]", Vxi11ErrorCode.describe(3));
        assertEquals("I/O timeout [error=15]", Vxi11ErrorCode.describe(15));
        assertEquals("Channel already established [error=29]", Vxi11ErrorCode.describe(29));
    }

    @Test
    void unknownCodeIsUndefinedButKeepsNumber() {
        assertEquals(Vxi11ErrorCode.UNDEFINED, Vxi11ErrorCode.fromCode(2));
        assertEquals("Undefined error [error=2]", Vxi11ErrorCode.describe(2));
        assertEquals(Vxi11ErrorCode.UNDEFINED, Vxi11ErrorCode.fromCode(-1));
    }

    // ---------------------------------------------------------------------
    // Read reasons
    // ---------------------------------------------------------------------

    @Test
    void messageIsCompleteOnEndOrTermChar() {
        assertTrue(ReadReason.isMessageComplete(ReadReason.RX_END));
        assertTrue(ReadReason.isMessageComplete(ReadReason.RX_CHR));
        assertTrue(ReadReason.isMessageComplete(ReadReason.RX_REQCNT | ReadReason.RX_END));
        assertFalse(ReadReason.isMessageComplete(ReadReason.RX_REQCNT));
        assertFalse(ReadReason.isMessageComplete(0));
    }

    // ---------------------------------------------------------------------
    // Link
    // ---------------------------------------------------------------------

    @Test
    void writeChunkSizeIsCappedAt64KiB() {
        assertEquals(1024, new Link(1, 619, 1024).writeChunkSize());
        assertEquals(65536, new Link(1, 619, 0xFFFFFFFFL).writeChunkSize());
        assertEquals(1, new Link(1, 619, 0).writeChunkSize());
    }

    @Test
    void linkRejectsOutOfRangeFields() {
        assertThrows(IllegalArgumentException.class, () -> new Link(1, 70000, 1024));
        assertThrows(IllegalArgumentException.class, () -> new Link(1, 619, -1));
    }
}
