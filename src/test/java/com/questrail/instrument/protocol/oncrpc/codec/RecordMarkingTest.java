package com.questrail.instrument.protocol.oncrpc.codec;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;

import static org.junit.jupiter.api.Assertions.*;

final class RecordMarkingTest
{
    @Test
    void writeRecordSetsLastFragmentBitAndLength() throws Exception
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        RecordMarking.writeRecord(out, new byte[] {1, 2, 3, 4, 5});

        assertArrayEquals(new byte[] {(byte) 0x80, 0, 0, 5, 1, 2, 3, 4, 5}, out.toByteArray());
    }

    @Test
    void headerHelpers()
    {
        int header = RecordMarking.header(300, true);
        assertTrue(RecordMarking.isLastFragment(header));
        assertEquals(300, RecordMarking.fragmentLength(header));

        int partial = RecordMarking.header(300, false);
        assertFalse(RecordMarking.isLastFragment(partial));
        assertEquals(300, RecordMarking.fragmentLength(partial));
    }

    @Test
    void readRecordConcatenatesFragments() throws Exception
    {
        byte[] stream = {
            0, 0, 0, 2, 'a', 'b',
            0, 0, 0, 1, 'c',
            (byte) 0x80, 0, 0, 3, 'd', 'e', 'f'
        };

        byte[] record = RecordMarking.readRecord(new ByteArrayInputStream(stream), 4096);
        assertArrayEquals("abcdef".getBytes(), record);
    }

    @Test
    void readRecordWithSmallChunkSizeStillReadsWholeFragment() throws Exception
    {
        byte[] payload = new byte[1000];
        for (int i = 0; i < payload.length; i++) {
            payload[i] = (byte) i;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        RecordMarking.writeRecord(out, payload);

        byte[] record = RecordMarking.readRecord(new ByteArrayInputStream(out.toByteArray()), 7);
        assertArrayEquals(payload, record);
    }

    @Test
    void shortHeaderIsEof()
    {
        EOFException e = assertThrows(EOFException.class,
            () -> RecordMarking.readRecord(new ByteArrayInputStream(new byte[] {(byte) 0x80, 0}), 4096));
        assertEquals("The RPC reply header is < 4 bytes", e.getMessage());
    }

    @Test
    void truncatedFragmentIsEof()
    {
        byte[] stream = {(byte) 0x80, 0, 0, 10, 1, 2, 3};
        assertThrows(EOFException.class,
            () -> RecordMarking.readRecord(new ByteArrayInputStream(stream), 4096));
    }

    @Test
    void streamEndingAfterNonLastFragmentIsEof()
    {
        byte[] stream = {0, 0, 0, 1, 'x'};
        assertThrows(EOFException.class,
            () -> RecordMarking.readRecord(new ByteArrayInputStream(stream), 4096));
    }

    @Test
    void hugeDeclaredLengthWithFewBytesIsEof()
    {
        byte[] stream = {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xF0, 1, 2, 3};
        EOFException e = assertThrows(EOFException.class,
            () -> RecordMarking.readRecord(new ByteArrayInputStream(stream), 4096));
        assertEquals("The RPC reply fragment ended after 3 of 2147483632 bytes", e.getMessage());
    }

    @Test
    void lengthsSummingPastIntRangeAreEof()
    {
        byte[] stream = {
            0, 0, 0, 4, 1, 2, 3, 4,
            (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF
        };
        assertThrows(EOFException.class,
            () -> RecordMarking.readRecord(new ByteArrayInputStream(stream), 4096));
    }
}
