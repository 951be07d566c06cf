package com.questrail.instrument.protocol.oncrpc.codec;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * XdrEncoder
 * -----------------------------------------------------------------------------
 * Growable outgoing buffer for one XDR-encoded message (RFC 1014).
 *
 * <p>All integers are written big-endian in 4-byte units. Variable-length
 * opaque data is written as a 4-byte length, the data, and 0-3 zero bytes so
 * the appended length is a multiple of four.</p>
 *
 * <p>Empty opaque data appends <em>nothing</em>: no zero-length field is
 * written. Callers composing argument lists must account for that.</p>
 *
 * <p>Not thread-safe; owned by a single RPC client.</p>
 */
public final class XdrEncoder
{
    private static final int INITIAL_CAPACITY = 64;

    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int length;

    /**
     * Discards the current contents.
     */
    public void clear()
    {
        length = 0;
    }

    public int length()
    {
        return length;
    }

    public void appendInt(int value)
    {
        ensureCapacity(4);
        buffer[length++] = (byte) (value >>> 24);
        buffer[length++] = (byte) (value >>> 16);
        buffer[length++] = (byte) (value >>> 8);
        buffer[length++] = (byte) value;
    }

    /**
     * Appends an XDR unsigned int.
     *
     * @param value a value in {@code [0, 0xFFFFFFFF]}
     */
    public void appendUnsignedInt(long value)
    {
        if (value < 0 || value > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("value out of unsigned 32-bit range: " + value);
        }
        appendInt((int) value);
    }

    public void appendBoolean(boolean value)
    {
        appendInt(value ? 1 : 0);
    }

    /**
     * Appends raw bytes without a length prefix or padding.
     */
    public void append(byte[] data)
    {
        Objects.requireNonNull(data, "data");
        append(data, 0, data.length);
    }

    public void append(byte[] data, int offset, int count)
    {
        Objects.checkFromIndexSize(offset, count, data.length);
        ensureCapacity(count);
        System.arraycopy(data, offset, buffer, length, count);
        length += count;
    }

    /**
     * Appends variable-length opaque data. A no-op for empty input.
     */
    public void appendOpaque(byte[] data)
    {
        Objects.requireNonNull(data, "data");
        appendOpaque(data, 0, data.length);
    }

    public void appendOpaque(byte[] data, int offset, int count)
    {
        Objects.checkFromIndexSize(offset, count, data.length);
        if (count == 0) {
            return;
        }
        appendInt(count);
        append(data, offset, count);
        int pad = padding(count);
        ensureCapacity(pad);
        for (int i = 0; i < pad; i++) {
            buffer[length++] = 0;
        }
    }

    /**
     * Appends an ASCII string as opaque data. A no-op for an empty string.
     */
    public void appendOpaque(String text)
    {
        Objects.requireNonNull(text, "text");
        appendOpaque(text.getBytes(StandardCharsets.US_ASCII));
    }

    public byte[] toByteArray()
    {
        return Arrays.copyOf(buffer, length);
    }

    /**
     * Number of zero bytes needed to align {@code length} to a multiple of four.
     */
    public static int padding(int length)
    {
        return (4 - (length & 3)) & 3;
    }

    private void ensureCapacity(int extra)
    {
        int required = length + extra;
        if (required > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
        }
    }
}
