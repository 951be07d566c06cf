package com.questrail.instrument.protocol.vxi11;

import com.questrail.instrument.api.InstrumentConnectionException;
import com.questrail.instrument.api.InstrumentException;
import com.questrail.instrument.config.ConnectionConfig;
import com.questrail.instrument.core.AbstractMessageBasedInterface;
import com.questrail.instrument.internal.time.MonotonicClock;
import com.questrail.instrument.internal.time.SystemMonotonicClock;
import com.questrail.instrument.protocol.oncrpc.portmap.PortMapperClient;
import com.questrail.instrument.protocol.oncrpc.portmap.PortMapping;
import com.questrail.instrument.protocol.vxi11.address.Vxi11Address;
import com.questrail.instrument.protocol.vxi11.address.Vxi11AddressParser;
import com.questrail.instrument.protocol.vxi11.client.CoreChannelClient;
import com.questrail.instrument.protocol.vxi11.client.Vxi11DeviceException;
import com.questrail.instrument.protocol.vxi11.config.Vxi11Config;
import com.questrail.instrument.protocol.vxi11.config.Vxi11TimeoutPolicy;
import com.questrail.instrument.protocol.vxi11.model.Link;
import com.questrail.instrument.protocol.vxi11.model.Vxi11Program;
import com.questrail.instrument.protocol.vxi11.observability.Slf4jVxi11ObservabilitySink;
import com.questrail.instrument.protocol.vxi11.observability.TransportObservabilityEvent;
import com.questrail.instrument.protocol.vxi11.observability.Vxi11ErrorEvent;
import com.questrail.instrument.protocol.vxi11.observability.Vxi11ObservabilitySink;
import com.questrail.instrument.protocol.vxi11.state.LinkState;
import com.questrail.instrument.protocol.vxi11.state.Vxi11LinkSession;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Vxi11Interface
 * =============================================================================
 * {@link com.questrail.instrument.api.MessageBasedInterface} over a VXI-11
 * Core Channel.
 *
 * <h2>Connect sequence</h2>
 * <pre>
 *   parse address -> Port Mapper GETPORT (unless a port is configured)
 *                 -> TCP connect -> create_link
 * </pre>
 * The Port Mapper lookup and the TCP connect use the connection timeout.
 * Once connected the socket timeout is {@code 1 s + io_timeout + lock_timeout},
 * where {@code io_timeout} is the read/write timeout and {@code lock_timeout}
 * comes from {@link Vxi11Config}; either is one day when blocking.
 *
 * <h2>Terminations</h2>
 * The read termination, if any, must be a single byte and is sent as the
 * VXI-11 {@code term_char}. There is no write termination by default.
 *
 * <h2>Errors</h2>
 * Device error 15 ({@code I/O timeout}) during a read or write is reported as
 * {@link com.questrail.instrument.api.InstrumentTimeoutException}; every other
 * device error propagates as a {@link Vxi11DeviceException}.
 *
 * <h2>Threading</h2>
 * One caller at a time, except {@link #abort()} which may be called from a
 * second thread while a read or write is blocked.
 */
public class Vxi11Interface extends AbstractMessageBasedInterface
{
    private static final Logger log = LoggerFactory.getLogger(Vxi11Interface.class);

    private final Vxi11Address target;
    private final Vxi11Config vxi11Config;
    private final Vxi11ObservabilitySink sink;
    private final MonotonicClock clock;

    private volatile Duration lockTimeout;
    private volatile Vxi11LinkSession session;
    private volatile int corePort;

    public Vxi11Interface(ConnectionConfig config)
    {
        this(config, Vxi11Config.defaults());
    }

    public Vxi11Interface(ConnectionConfig config, Vxi11Config vxi11Config)
    {
        this(config, vxi11Config, new Slf4jVxi11ObservabilitySink(), SystemMonotonicClock.INSTANCE);
    }

    /**
     * @throws IllegalArgumentException if the address is not a VXI-11 address
     *         or the read termination is longer than one byte
     */
    public Vxi11Interface(ConnectionConfig config,
                          Vxi11Config vxi11Config,
                          Vxi11ObservabilitySink sink,
                          MonotonicClock clock)
    {
        super(config);
        this.target = Vxi11AddressParser.parse(config.address()).orElseThrow(() ->
            new IllegalArgumentException("Invalid VXI-11 address " + config.address()));
        this.vxi11Config = Objects.requireNonNull(vxi11Config, "vxi11Config");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lockTimeout = vxi11Config.lockTimeout();
        this.corePort = vxi11Config.port().orElse(0);
        checkReadTermination(readTermination().orElse(null));
    }

    public Vxi11Address target()
    {
        return target;
    }

    public String host()
    {
        return target.host();
    }

    /**
     * The Core Channel port, once known.
     */
    public OptionalInt port()
    {
        int p = corePort;
        return p == 0 ? OptionalInt.empty() : OptionalInt.of(p);
    }

    /**
     * The link established by {@code create_link}, while connected.
     */
    public Optional<Link> link()
    {
        Vxi11LinkSession s = session;
        return s == null ? Optional.empty() : s.link();
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Override
    public synchronized void connect() throws InstrumentException
    {
        if (isConnected()) {
            return;
        }

        Duration connectTimeout = timeout().orElse(null);
        Vxi11TimeoutPolicy policy = timeoutPolicy();
        CoreChannelClient core = new CoreChannelClient(target.host(), sink);
        try {
            int port = resolveCorePort(connectTimeout);
            core.setChunkSize(vxi11Config.bufferSize());
            core.connect(port, connectTimeout);
            sink.onTransportEvent(new TransportObservabilityEvent(
                Instant.now(), target.host(), port, TransportObservabilityEvent.Kind.CORE_CONNECTED));
            core.setTimeout(policy.socketTimeout());

            Vxi11LinkSession s = new Vxi11LinkSession(core, target.name(), policy, sink, clock);
            s.createLink(vxi11Config.lockDevice());
            session = s;
        }
        catch (IOException e) {
            closeQuietly(core);
            throw translate(e);
        }
        catch (RuntimeException e) {
            closeQuietly(core);
            throw e;
        }
        log.debug("Connected to {}", this);
    }

    /**
     * Discards the current link and connection, then connects again.
     *
     * @param maxAttempts the number of connect attempts; {@code < 1} keeps
     *                    trying until a connection succeeds
     * @throws InstrumentException the last failure once {@code maxAttempts}
     *         attempts have failed
     */
    public synchronized void reconnect(int maxAttempts) throws InstrumentException
    {
        disconnect();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                connect();
                return;
            }
            catch (InstrumentException e) {
                if (0 < maxAttempts && maxAttempts <= attempt) {
                    throw e;
                }
                log.debug("{}: reconnect attempt {} failed: {}", this, attempt, e.getMessage());
            }
        }
    }

    @Override
    public boolean isConnected()
    {
        Vxi11LinkSession s = session;
        return s != null && s.state() == LinkState.LINKED;
    }

    /**
     * Closes the abort channel, sends {@code destroy_link} and closes the Core
     * Channel. Failures are logged and reported to the observability sink.
     */
    @Override
    public synchronized void disconnect()
    {
        Vxi11LinkSession s = session;
        session = null;
        if (s == null) {
            return;
        }
        s.close();
        log.debug("Disconnected from {}", this);
    }

    // -------------------------------------------------------------------------
    // Message transfer
    // -------------------------------------------------------------------------

    @Override
    protected byte[] doRead(OptionalInt size) throws IOException
    {
        int termChar = readTermination().map(t -> t[0] & 0xFF).orElse(-1);
        try {
            return requireSession().read(size, vxi11Config.bufferSize(), termChar, maxReadSize());
        }
        catch (Vxi11DeviceException e) {
            throw e.isTimeout() ? timeoutException(e) : e;
        }
    }

    @Override
    protected int doWrite(byte[] message) throws IOException
    {
        try {
            return requireSession().write(message);
        }
        catch (Vxi11DeviceException e) {
            throw e.isTimeout() ? timeoutException(e) : e;
        }
    }

    /**
     * @throws IllegalArgumentException if {@code termination} encodes to more than one byte
     */
    @Override
    public void setReadTermination(String termination)
    {
        super.setReadTermination(termination);
        checkReadTermination(readTermination().orElse(null));
    }

    @Override
    protected void onTimeoutChanged()
    {
        applyTimeouts();
    }

    // -------------------------------------------------------------------------
    // Lock timeout
    // -------------------------------------------------------------------------

    /**
     * Time to wait for a device lock; one day when blocking.
     */
    public Duration lockTimeout()
    {
        return Duration.ofMillis(timeoutPolicy().lockTimeoutMillis());
    }

    /**
     * @param lockTimeout {@code null} or negative to wait one day
     */
    public void setLockTimeout(Duration lockTimeout)
    {
        this.lockTimeout = lockTimeout == null ? Duration.ofMillis(-1) : lockTimeout;
        applyTimeouts();
    }

    public Vxi11TimeoutPolicy timeoutPolicy()
    {
        return Vxi11TimeoutPolicy.of(timeout().orElse(null), lockTimeout);
    }

    // -------------------------------------------------------------------------
    // Device control
    // -------------------------------------------------------------------------

    /**
     * Stops an in-progress read or write through the abort channel.
     */
    public void abort() throws InstrumentException
    {
        try {
            requireSession().abort();
        }
        catch (IOException e) {
            throw translate(e);
        }
    }

    public int readStatusByte() throws InstrumentException
    {
        try {
            return requireSession().readStatusByte();
        }
        catch (IOException e) {
            throw translate(e);
        }
    }

    public void trigger() throws InstrumentException
    {
        try {
            requireSession().trigger();
        }
        catch (IOException e) {
            throw translate(e);
        }
    }

    /**
     * Sends the device clear command.
     */
    public void clear() throws InstrumentException
    {
        try {
            requireSession().clear();
        }
        catch (IOException e) {
            throw translate(e);
        }
    }

    /**
     * Places the device in the remote state, disabling its local controls.
     */
    public void remote() throws InstrumentException
    {
        try {
            requireSession().remote();
        }
        catch (IOException e) {
            throw translate(e);
        }
    }

    public void local() throws InstrumentException
    {
        try {
            requireSession().local();
        }
        catch (IOException e) {
            throw translate(e);
        }
    }

    /**
     * Acquires the device lock, waiting up to the lock timeout.
     */
    public void lock() throws InstrumentException
    {
        try {
            requireSession().lock();
        }
        catch (IOException e) {
            throw translate(e);
        }
    }

    public void unlock() throws InstrumentException
    {
        try {
            requireSession().unlock();
        }
        catch (IOException e) {
            throw translate(e);
        }
    }

    /**
     * @param handle at most 40 bytes, echoed in {@code device_intr_srq}
     */
    public void enableSrq(boolean enable, byte[] handle) throws InstrumentException
    {
        try {
            requireSession().enableSrq(enable, handle);
        }
        catch (IOException e) {
            throw translate(e);
        }
    }

    /**
     * Executes a device-specific command.
     *
     * @param dataSize the size of each element in {@code data}
     * @return the command's output data
     */
    public byte[] docmd(int cmd, int dataSize, byte[] data) throws InstrumentException
    {
        try {
            return requireSession().docmd(cmd, dataSize, data);
        }
        catch (IOException e) {
            throw translate(e);
        }
    }

    public void createInterruptChannel(long hostAddr, int hostPort, int progFamily) throws InstrumentException
    {
        try {
            requireSession().createInterruptChannel(hostAddr, hostPort,
                Vxi11Program.DEVICE_INTR, Vxi11Program.DEVICE_INTR_VERSION, progFamily);
        }
        catch (IOException e) {
            throw translate(e);
        }
    }

    public void destroyInterruptChannel() throws InstrumentException
    {
        try {
            requireSession().destroyInterruptChannel();
        }
        catch (IOException e) {
            throw translate(e);
        }
    }

    // -------------------------------------------------------------------------

    private int resolveCorePort(Duration timeout) throws IOException
    {
        if (corePort != 0) {
            return corePort;
        }
        PortMapperClient portMapper = new PortMapperClient(target.host(), vxi11Config.portMapperPort());
        int port = portMapper.getPort(Vxi11Program.DEVICE_CORE, Vxi11Program.DEVICE_CORE_VERSION,
            PortMapping.IPPROTO_TCP, timeout);
        sink.onTransportEvent(new TransportObservabilityEvent(
            Instant.now(), target.host(), port, TransportObservabilityEvent.Kind.PORT_RESOLVED));
        corePort = port;
        return port;
    }

    private void applyTimeouts()
    {
        Vxi11LinkSession s = session;
        if (s == null) {
            return;
        }
        try {
            s.setTimeouts(timeoutPolicy());
        }
        catch (IOException e) {
            sink.onError(new Vxi11ErrorEvent(Instant.now(), this + ": could not apply the socket timeout", e));
        }
    }

    private Vxi11LinkSession requireSession() throws InstrumentConnectionException
    {
        Vxi11LinkSession s = session;
        if (s == null) {
            throw new InstrumentConnectionException(this + ": not connected");
        }
        return s;
    }

    private void closeQuietly(CoreChannelClient core)
    {
        try {
            core.close();
        }
        catch (IOException e) {
            sink.onError(new Vxi11ErrorEvent(Instant.now(), this + ": closing core channel", e));
        }
    }

    private static void checkReadTermination(byte[] termination)
    {
        if (termination != null && termination.length > 1) {
            throw new IllegalArgumentException(
                "A VXI-11 read termination must be a single byte, got " + termination.length);
        }
    }
}
