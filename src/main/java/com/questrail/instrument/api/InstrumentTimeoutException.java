package com.questrail.instrument.api;

/**
 * Raised when a read, write or connect operation does not complete within the
 * configured timeout.
 */
public class InstrumentTimeoutException extends InstrumentException
{
    public InstrumentTimeoutException(String message)
    {
        super(Category.TIMEOUT, message);
    }

    public InstrumentTimeoutException(String message, Throwable cause)
    {
        super(Category.TIMEOUT, message, cause);
    }
}
