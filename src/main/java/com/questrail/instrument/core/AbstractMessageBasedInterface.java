package com.questrail.instrument.core;

import com.questrail.instrument.api.InstrumentConnectionException;
import com.questrail.instrument.api.InstrumentException;
import com.questrail.instrument.api.InstrumentTimeoutException;
import com.questrail.instrument.api.MessageBasedInterface;
import com.questrail.instrument.config.ConnectionConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * AbstractMessageBasedInterface
 * =============================================================================
 * Skeletal {@link MessageBasedInterface} holding the state every message-based
 * backend shares: encoding, read/write termination, {@code maxReadSize},
 * trailing-whitespace stripping and the read/write timeout.
 *
 * <h2>Template methods</h2>
 * Subclasses implement the raw transfer only:
 * <ul>
 *   <li>{@link #doRead(OptionalInt)}: returns the bytes of one message</li>
 *   <li>{@link #doWrite(byte[])}: sends an already terminated message</li>
 *   <li>{@link #onTimeoutChanged()}: pushes a new timeout to the backend</li>
 * </ul>
 *
 * <h2>Error translation</h2>
 * Raw {@link IOException}s thrown by the template methods are translated once,
 * here: {@link SocketTimeoutException} becomes an
 * {@link InstrumentTimeoutException}; any other plain {@code IOException}
 * becomes an {@link InstrumentConnectionException}. Exceptions that are
 * already {@link InstrumentException}s (RPC protocol or device errors)
 * propagate unchanged.
 *
 * <h2>Logging</h2>
 * Every payload read or written is logged at {@code DEBUG}.
 */
public abstract class AbstractMessageBasedInterface implements MessageBasedInterface
{
    private static final Logger log = LoggerFactory.getLogger(AbstractMessageBasedInterface.class);

    private final String address;

    private Charset encoding;
    private byte[] readTermination;
    private byte[] writeTermination;
    private int maxReadSize;
    private boolean rstrip;
    private Duration timeout;

    protected AbstractMessageBasedInterface(ConnectionConfig config)
    {
        Objects.requireNonNull(config, "config");
        this.address = config.address();
        this.encoding = config.encoding();
        this.readTermination = encode(config.readTermination(), encoding);
        this.writeTermination = encode(config.writeTermination(), encoding);
        this.maxReadSize = config.maxReadSize();
        this.rstrip = config.rstrip();
        this.timeout = config.timeout();
    }

    /**
     * Reads one message from the backend.
     *
     * @param size the exact number of bytes requested, or empty to read until
     *             the end of the message
     */
    protected abstract byte[] doRead(OptionalInt size) throws IOException;

    /**
     * Writes {@code message} to the backend.
     *
     * @return the number of bytes written
     */
    protected abstract int doWrite(byte[] message) throws IOException;

    /**
     * Called after {@link #setTimeout(Duration)} so the backend can apply it.
     */
    protected void onTimeoutChanged()
    {
    }

    @Override
    public final String address()
    {
        return address;
    }

    @Override
    public final byte[] read() throws InstrumentException
    {
        return read(OptionalInt.empty());
    }

    @Override
    public final byte[] read(int size) throws InstrumentException
    {
        if (size < 0) {
            throw new IllegalArgumentException("size must be non-negative, got " + size);
        }
        return read(OptionalInt.of(size));
    }

    @Override
    public final String readString() throws InstrumentException
    {
        return new String(read(), encoding);
    }

    private byte[] read(OptionalInt size) throws InstrumentException
    {
        if (size.isPresent() && size.getAsInt() > maxReadSize) {
            throw new InstrumentConnectionException(String.format(
                "%s: max_read_size is %d bytes, requesting %d bytes", this, maxReadSize, size.getAsInt()));
        }

        byte[] message;
        try {
            message = doRead(size);
        }
        catch (IOException e) {
            throw translate(e);
        }

        if (size.isPresent()) {
            if (message.length != size.getAsInt()) {
                throw new InstrumentConnectionException(String.format(
                    "%s: received %d bytes, requested %d bytes", this, message.length, size.getAsInt()));
            }
            if (log.isDebugEnabled()) {
                log.debug("{}.read(size={}) -> {}", this, size.getAsInt(), printable(message));
            }
        }
        else if (log.isDebugEnabled()) {
            log.debug("{}.read() -> {}", this, printable(message));
        }

        return rstrip ? stripTrailingWhitespace(message) : message;
    }

    @Override
    public final int write(byte[] message) throws InstrumentException
    {
        Objects.requireNonNull(message, "message");

        byte[] payload = message;
        if (writeTermination != null && !endsWith(payload, writeTermination)) {
            payload = Arrays.copyOf(message, message.length + writeTermination.length);
            System.arraycopy(writeTermination, 0, payload, message.length, writeTermination.length);
        }

        if (log.isDebugEnabled()) {
            log.debug("{}.write({})", this, printable(payload));
        }

        try {
            return doWrite(payload);
        }
        catch (IOException e) {
            throw translate(e);
        }
    }

    @Override
    public final int write(String message) throws InstrumentException
    {
        return write(message.getBytes(encoding));
    }

    @Override
    public final String query(String message) throws InstrumentException
    {
        write(message);
        return readString();
    }

    @Override
    public final Optional<Duration> timeout()
    {
        return Optional.ofNullable(timeout);
    }

    @Override
    public final void setTimeout(Duration timeout)
    {
        this.timeout = (timeout == null || timeout.isNegative()) ? null : timeout;
        onTimeoutChanged();
    }

    public final Charset encoding()
    {
        return encoding;
    }

    public final void setEncoding(Charset encoding)
    {
        this.encoding = Objects.requireNonNull(encoding, "encoding");
    }

    public final Optional<byte[]> readTermination()
    {
        return Optional.ofNullable(readTermination).map(byte[]::clone);
    }

    public void setReadTermination(String termination)
    {
        this.readTermination = encode(termination, encoding);
    }

    public final Optional<byte[]> writeTermination()
    {
        return Optional.ofNullable(writeTermination).map(byte[]::clone);
    }

    public void setWriteTermination(String termination)
    {
        this.writeTermination = encode(termination, encoding);
    }

    public final int maxReadSize()
    {
        return maxReadSize;
    }

    public final void setMaxReadSize(int maxReadSize)
    {
        if (maxReadSize < 1) {
            throw new IllegalArgumentException(
                "The maximum number of bytes to read must be >= 1, got " + maxReadSize);
        }
        this.maxReadSize = maxReadSize;
    }

    public final boolean rstrip()
    {
        return rstrip;
    }

    public final void setRstrip(boolean rstrip)
    {
        this.rstrip = rstrip;
    }

    /**
     * Translates a raw transport failure into the public exception taxonomy.
     */
    protected final InstrumentException translate(IOException e)
    {
        if (e instanceof InstrumentException ie) {
            return ie;
        }
        if (e instanceof SocketTimeoutException) {
            return timeoutException(e);
        }
        return new InstrumentConnectionException(
            this + ": " + e.getClass().getSimpleName() + ": " + e.getMessage(), e);
    }

    protected final InstrumentTimeoutException timeoutException(Throwable cause)
    {
        String after = timeout == null
            ? "blocking mode"
            : (timeout.toMillis() / 1000.0) + " second(s)";
        return new InstrumentTimeoutException(this + ": Timeout occurred after " + after, cause);
    }

    @Override
    public String toString()
    {
        return getClass().getSimpleName() + "<" + address + ">";
    }

    private static byte[] encode(String text, Charset encoding)
    {
        return (text == null || text.isEmpty()) ? null : text.getBytes(encoding);
    }

    private static boolean endsWith(byte[] data, byte[] suffix)
    {
        if (suffix.length > data.length) {
            return false;
        }
        int offset = data.length - suffix.length;
        for (int i = 0; i < suffix.length; i++) {
            if (data[offset + i] != suffix[i]) {
                return false;
            }
        }
        return true;
    }

    static byte[] stripTrailingWhitespace(byte[] data)
    {
        int end = data.length;
        while (end > 0 && isWhitespace(data[end - 1])) {
            end--;
        }
        return end == data.length ? data : Arrays.copyOf(data, end);
    }

    private static boolean isWhitespace(byte b)
    {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r' || b == 0x0B || b == 0x0C;
    }

    static String printable(byte[] data)
    {
        StringBuilder sb = new StringBuilder(data.length + 2).append('\'');
        for (byte b : data) {
            int v = b & 0xFF;
            switch (v) {
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                default -> {
                    if (v >= 0x20 && v < 0x7F) {
                        sb.append((char) v);
                    }
                    else {
                        sb.append(String.format("\\x%02x", v));
                    }
                }
            }
        }
        return sb.append('\'').toString();
    }
}
