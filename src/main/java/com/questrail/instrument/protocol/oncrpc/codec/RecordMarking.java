package com.questrail.instrument.protocol.oncrpc.codec;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * RecordMarking
 * -----------------------------------------------------------------------------
 * ONC RPC record marking over a byte stream (RFC 1057, Section 10).
 *
 * <p>A record is sent as one or more fragments. Each fragment is preceded by
 * a 4-byte big-endian header:</p>
 * <ul>
 *   <li>bit 31: set on the last fragment of the record</li>
 *   <li>bits 0-30: fragment length in bytes</li>
 * </ul>
 *
 * <p>This class only frames and reassembles bytes. It has no knowledge of
 * call or reply headers.</p>
 */
public final class RecordMarking
{
    public static final int HEADER_LENGTH = 4;

    public static final int LAST_FRAGMENT = 0x80000000;

    public static final int MAX_FRAGMENT_LENGTH = 0x7FFFFFFF;

    /** Largest reassembled record; stays below the VM array size limit. */
    public static final int MAX_RECORD_LENGTH = Integer.MAX_VALUE - 8;

    private RecordMarking() {}

    public static int header(int fragmentLength, boolean last)
    {
        if (fragmentLength < 0) {
            throw new IllegalArgumentException("fragmentLength must be non-negative");
        }
        return last ? (fragmentLength | LAST_FRAGMENT) : fragmentLength;
    }

    public static boolean isLastFragment(int header)
    {
        return (header & LAST_FRAGMENT) != 0;
    }

    public static int fragmentLength(int header)
    {
        return header & MAX_FRAGMENT_LENGTH;
    }

    /**
     * Writes {@code message} as a single last fragment: header and payload
     * go out in one write.
     */
    public static void writeRecord(OutputStream out, byte[] message) throws IOException
    {
        int h = header(message.length, true);
        byte[] frame = new byte[HEADER_LENGTH + message.length];
        frame[0] = (byte) (h >>> 24);
        frame[1] = (byte) (h >>> 16);
        frame[2] = (byte) (h >>> 8);
        frame[3] = (byte) h;
        System.arraycopy(message, 0, frame, HEADER_LENGTH, message.length);
        out.write(frame);
        out.flush();
    }

    /**
     * Reads fragments until one carries the last-fragment bit and returns
     * their concatenated payloads.
     *
     * <p>Fragment lengths come from the peer, so the record grows only as
     * payload bytes actually arrive.</p>
     *
     * @param chunkSize maximum number of bytes requested per stream read
     * @throws EOFException if the stream ends before a complete header or fragment
     * @throws XdrDecodeException if the record grows past {@link #MAX_RECORD_LENGTH}
     */
    public static byte[] readRecord(InputStream in, int chunkSize) throws IOException
    {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1, got " + chunkSize);
        }

        byte[] header = new byte[HEADER_LENGTH];
        byte[] chunk = new byte[chunkSize];
        ByteArrayOutputStream record = new ByteArrayOutputStream();
        boolean last = false;
        while (!last) {
            if (readFully(in, header, 0, HEADER_LENGTH) < HEADER_LENGTH) {
                throw new EOFException("The RPC reply header is < 4 bytes");
            }
            int h = ((header[0] & 0xFF) << 24)
                | ((header[1] & 0xFF) << 16)
                | ((header[2] & 0xFF) << 8)
                | (header[3] & 0xFF);
            last = isLastFragment(h);
            int length = fragmentLength(h);

            int got = 0;
            while (got < length) {
                int n = in.read(chunk, 0, Math.min(chunkSize, length - got));
                if (n < 0) {
                    throw new EOFException(String.format(
                        "The RPC reply fragment ended after %d of %d bytes", got, length));
                }
                if (n > MAX_RECORD_LENGTH - record.size()) {
                    throw new XdrDecodeException("RPC record exceeds " + MAX_RECORD_LENGTH + " bytes");
                }
                record.write(chunk, 0, n);
                got += n;
            }
        }
        return record.toByteArray();
    }

    private static int readFully(InputStream in, byte[] buf, int offset, int length) throws IOException
    {
        int total = 0;
        while (total < length) {
            int n = in.read(buf, offset + total, length - total);
            if (n < 0) {
                break;
            }
            total += n;
        }
        return total;
    }
}
