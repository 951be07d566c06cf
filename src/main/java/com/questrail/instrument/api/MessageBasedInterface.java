package com.questrail.instrument.api;

import java.time.Duration;
import java.util.Optional;

/**
 * MessageBasedInterface
 * -----------------------------------------------------------------------------
 * {@code MessageBasedInterface} is the uniform contract shared by every
 * transport backend that exchanges opaque command/response byte payloads with
 * a piece of laboratory equipment.
 *
 * <h2>Capability set</h2>
 * <ul>
 *   <li>{@link #connect()} / {@link #disconnect()}: lifecycle</li>
 *   <li>{@link #write(byte[])} and {@link #read()}: one message each</li>
 *   <li>{@link #query(String)}: a write followed by a read</li>
 *   <li>{@link #setTimeout(Duration)}: bound on every blocking operation</li>
 * </ul>
 *
 * <h2>What this interface is not</h2>
 * It carries no command semantics. SCPI or vendor-specific meaning of the
 * payloads belongs to the caller.
 *
 * <h2>Threading</h2>
 * Implementations are synchronous and blocking. A single instance must not be
 * used concurrently by more than one thread unless an implementation documents
 * a specific exception (for example an out-of-band abort).
 *
 * <h2>Selection</h2>
 * Backends are chosen from the address string by
 * {@link com.questrail.instrument.core.InterfaceFactory}, never by inspecting
 * runtime types.
 */
public interface MessageBasedInterface extends AutoCloseable
{
    /**
     * The resource address this interface was configured with.
     */
    String address();

    /**
     * Opens the communication channel. Calling {@code connect()} on an already
     * connected interface is a no-op.
     */
    void connect() throws InstrumentException;

    boolean isConnected();

    /**
     * Reads one message. Reading stops when the equipment signals the end of
     * the message or the read termination is detected.
     */
    byte[] read() throws InstrumentException;

    /**
     * Reads exactly {@code size} bytes.
     */
    byte[] read(int size) throws InstrumentException;

    /**
     * Reads one message and decodes it with the configured encoding.
     */
    String readString() throws InstrumentException;

    /**
     * Writes a message, appending the write termination if it is not already
     * present.
     *
     * @return the number of bytes written
     */
    int write(byte[] message) throws InstrumentException;

    int write(String message) throws InstrumentException;

    /**
     * Writes {@code message} and returns the decoded reply.
     */
    String query(String message) throws InstrumentException;

    /**
     * The timeout for read and write operations; empty means blocking.
     */
    Optional<Duration> timeout();

    /**
     * Sets the timeout for read and write operations. A {@code null} or
     * negative value selects blocking mode.
     */
    void setTimeout(Duration timeout);

    /**
     * Releases the channel. Never throws; failures while tearing down are
     * reported through the implementation's logging/observability path.
     */
    void disconnect();

    @Override
    default void close()
    {
        disconnect();
    }
}
