package com.questrail.instrument.api;

/**
 * Raised when the connection to an instrument cannot be established, is lost,
 * or yields data that violates a local limit (for example {@code maxReadSize}).
 */
public class InstrumentConnectionException extends InstrumentException
{
    public InstrumentConnectionException(String message)
    {
        super(Category.TRANSPORT, message);
    }

    public InstrumentConnectionException(String message, Throwable cause)
    {
        super(Category.TRANSPORT, message, cause);
    }
}
