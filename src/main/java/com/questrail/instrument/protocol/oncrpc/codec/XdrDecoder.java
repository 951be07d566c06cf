package com.questrail.instrument.protocol.oncrpc.codec;

import java.util.Arrays;
import java.util.Objects;

/**
 * XdrDecoder
 * -----------------------------------------------------------------------------
 * Forward-only cursor over an XDR-encoded byte array.
 *
 * <p>Every read validates that the bytes it needs are present; a truncated
 * message raises {@link XdrDecodeException} instead of yielding partial
 * values. Opaque data whose declared length exceeds the remaining bytes is
 * therefore always rejected.</p>
 */
public final class XdrDecoder
{
    private final byte[] data;
    private int position;

    public XdrDecoder(byte[] data)
    {
        this(data, 0);
    }

    public XdrDecoder(byte[] data, int offset)
    {
        this.data = Objects.requireNonNull(data, "data");
        if (offset < 0 || offset > data.length) {
            throw new IndexOutOfBoundsException("offset " + offset + " outside [0, " + data.length + "]");
        }
        this.position = offset;
    }

    public int position()
    {
        return position;
    }

    public int remaining()
    {
        return data.length - position;
    }

    public int readInt() throws XdrDecodeException
    {
        require(4, "int");
        int value = ((data[position] & 0xFF) << 24)
            | ((data[position + 1] & 0xFF) << 16)
            | ((data[position + 2] & 0xFF) << 8)
            | (data[position + 3] & 0xFF);
        position += 4;
        return value;
    }

    public long readUnsignedInt() throws XdrDecodeException
    {
        return readInt() & 0xFFFFFFFFL;
    }

    public boolean readBoolean() throws XdrDecodeException
    {
        return readInt() != 0;
    }

    /**
     * Reads variable-length opaque data and skips its alignment padding.
     * Padding missing at the very end of the message is tolerated.
     */
    public byte[] readOpaque() throws XdrDecodeException
    {
        long n = readUnsignedInt();
        if (n > remaining()) {
            throw new XdrDecodeException(
                "opaque length " + n + " exceeds the " + remaining() + " remaining bytes");
        }
        int count = (int) n;
        byte[] out = Arrays.copyOfRange(data, position, position + count);
        position += count;
        position += Math.min(XdrEncoder.padding(count), remaining());
        return out;
    }

    public void skip(int count) throws XdrDecodeException
    {
        require(count, "skip");
        position += count;
    }

    /**
     * Returns every byte not yet consumed and moves the cursor to the end.
     */
    public byte[] readRemaining()
    {
        byte[] out = Arrays.copyOfRange(data, position, data.length);
        position = data.length;
        return out;
    }

    /**
     * Reads the opaque element at the start of {@code data}.
     *
     * <p>Empty input yields an empty result, mirroring the no-op encoding of
     * empty opaque data by {@link XdrEncoder#appendOpaque(byte[])}.</p>
     */
    public static byte[] unpackOpaque(byte[] data) throws XdrDecodeException
    {
        Objects.requireNonNull(data, "data");
        if (data.length == 0) {
            return new byte[0];
        }
        return new XdrDecoder(data).readOpaque();
    }

    private void require(int count, String what) throws XdrDecodeException
    {
        if (count > remaining()) {
            throw new XdrDecodeException(String.format(
                "truncated XDR data reading %s: need %d bytes at offset %d, have %d",
                what, count, position, remaining()));
        }
    }
}
