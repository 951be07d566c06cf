package com.questrail.instrument.protocol.vxi11.model;

/**
 * Server-assigned session handle returned by {@code create_link}.
 *
 * <p>A link is owned by exactly one core channel client; every subsequent
 * Core Channel request is keyed on {@code linkId}. Link ids are not reusable
 * across reconnects.</p>
 *
 * @param linkId      the {@code Device_Link} handle
 * @param abortPort   TCP port of the abort channel on the same host
 * @param maxRecvSize largest {@code device_write} payload the server accepts
 */
public record Link(int linkId, int abortPort, long maxRecvSize)
{
    /** Upper bound applied to {@code maxRecvSize} when chunking writes. */
    public static final int MAX_WRITE_CHUNK = 65536;

    public Link {
        if (abortPort < 0 || abortPort > 0xFFFF) {
            throw new IllegalArgumentException("abortPort out of range: " + abortPort);
        }
        if (maxRecvSize < 0 || maxRecvSize > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("maxRecvSize out of range: " + maxRecvSize);
        }
    }

    /**
     * The number of bytes sent per {@code device_write}.
     */
    public int writeChunkSize()
    {
        return (int) Math.max(1, Math.min(maxRecvSize, MAX_WRITE_CHUNK));
    }
}
