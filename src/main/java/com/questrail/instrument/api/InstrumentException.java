package com.questrail.instrument.api;

import java.io.IOException;
import java.util.Objects;

/**
 * InstrumentException
 * -----------------------------------------------------------------------------
 * Root of the checked exception taxonomy raised by every public I/O operation
 * of a {@link MessageBasedInterface}.
 *
 * <p>Each instance carries a {@link Category} so that callers can distinguish
 * "network unreachable", "server incompatible" and "device errored" without
 * parsing the message text. Subtypes add the structured fields that belong to
 * their category (RPC sub-kind and version bounds, VXI-11 error code, ...).</p>
 */
public abstract class InstrumentException extends IOException
{
    /**
     * Coarse classification of a failed operation.
     */
    public enum Category
    {
        /** Connection refused/reset, premature end of stream, not connected. */
        TRANSPORT,

        /** A socket or device I/O timeout expired. */
        TIMEOUT,

        /** The peer violated, or is incompatible with, the RPC protocol. */
        PROTOCOL,

        /** The instrument server reported a device-level error. */
        DEVICE
    }

    private final Category category;

    protected InstrumentException(Category category, String message)
    {
        super(message);
        this.category = Objects.requireNonNull(category, "category");
    }

    protected InstrumentException(Category category, String message, Throwable cause)
    {
        super(message, cause);
        this.category = Objects.requireNonNull(category, "category");
    }

    public Category category()
    {
        return category;
    }
}
