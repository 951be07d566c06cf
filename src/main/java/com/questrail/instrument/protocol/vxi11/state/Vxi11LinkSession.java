package com.questrail.instrument.protocol.vxi11.state;

import com.questrail.instrument.api.InstrumentConnectionException;
import com.questrail.instrument.internal.time.MonotonicClock;
import com.questrail.instrument.protocol.vxi11.client.AbortChannelClient;
import com.questrail.instrument.protocol.vxi11.client.CoreChannelClient;
import com.questrail.instrument.protocol.vxi11.config.Vxi11TimeoutPolicy;
import com.questrail.instrument.protocol.vxi11.model.DeviceReadResult;
import com.questrail.instrument.protocol.vxi11.model.Link;
import com.questrail.instrument.protocol.vxi11.model.OperationFlags;
import com.questrail.instrument.protocol.vxi11.observability.LinkStateTransitionEvent;
import com.questrail.instrument.protocol.vxi11.observability.TransportObservabilityEvent;
import com.questrail.instrument.protocol.vxi11.observability.Vxi11ErrorEvent;
import com.questrail.instrument.protocol.vxi11.observability.Vxi11ObservabilitySink;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

/**
 * Vxi11LinkSession
 * =============================================================================
 * The VXI-11 link state machine for one device on one connected core channel.
 *
 * <pre>
 *   DISCONNECTED --createLink()--> LINKED --destroyLink()/close()--> DESTROYED
 * </pre>
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Owns the {@link Link} and the {@link CoreChannelClient} that created it</li>
 *   <li>Splits long writes into {@code max_recv_size} chunks, {@code END} on the last</li>
 *   <li>Repeats {@code device_read} until {@code RX_END}/{@code RX_CHR} or the
 *       requested size, shrinking {@code io_timeout} by the time already spent</li>
 *   <li>Applies the {@link Vxi11TimeoutPolicy} to every call and socket</li>
 *   <li>Opens the abort channel lazily for {@link #abort()}</li>
 * </ul>
 *
 * <h2>Failure semantics</h2>
 * Device and RPC errors propagate unchanged; nothing is retried here.
 * {@link #close()} always attempts {@code destroy_link} while a link exists,
 * even after a failed operation, and never throws.
 *
 * <h2>Threading</h2>
 * Core channel operations must be serialized by the caller. {@link #abort()}
 * may be called from a second thread while another blocks in a core call.
 */
public final class Vxi11LinkSession implements AutoCloseable
{
    private final CoreChannelClient core;
    private final String device;
    private final Vxi11ObservabilitySink sink;
    private final MonotonicClock clock;

    private final Object abortLock = new Object();
    private AbortChannelClient abortClient;

    private volatile LinkState state = LinkState.DISCONNECTED;
    private volatile Link link;
    private volatile Vxi11TimeoutPolicy timeouts;

    /**
     * @param core     a connected core channel client; ownership passes to this session
     * @param device   the device name sent in {@code create_link}, e.g. {@code inst0}
     */
    public Vxi11LinkSession(CoreChannelClient core,
                            String device,
                            Vxi11TimeoutPolicy timeouts,
                            Vxi11ObservabilitySink sink,
                            MonotonicClock clock)
    {
        this.core = Objects.requireNonNull(core, "core");
        this.device = Objects.requireNonNull(device, "device");
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public LinkState state()
    {
        return state;
    }

    public Optional<Link> link()
    {
        return Optional.ofNullable(link);
    }

    public Vxi11TimeoutPolicy timeouts()
    {
        return timeouts;
    }

    /**
     * Replaces the timeout policy and applies the derived socket timeout to
     * the core channel and, if open, the abort channel.
     */
    public void setTimeouts(Vxi11TimeoutPolicy policy) throws IOException
    {
        this.timeouts = Objects.requireNonNull(policy, "policy");
        if (core.isConnected()) {
            core.setTimeout(policy.socketTimeout());
        }
        synchronized (abortLock) {
            if (abortClient != null && abortClient.isConnected()) {
                abortClient.setTimeout(policy.socketTimeout());
            }
        }
    }

    // -------------------------------------------------------------------------
    // Link lifecycle
    // -------------------------------------------------------------------------

    /**
     * {@code create_link}. On a device error no link is recorded and the
     * session stays {@code DISCONNECTED}.
     */
    public Link createLink(boolean lockDevice) throws IOException
    {
        if (state != LinkState.DISCONNECTED) {
            throw new IllegalStateException("create_link requires DISCONNECTED, state is " + state);
        }
        Link created = core.createLink(device, lockDevice, timeouts.lockTimeout());
        link = created;
        transition(LinkState.LINKED);
        return created;
    }

    /**
     * {@code destroy_link}. The session is {@code DESTROYED} afterwards even if
     * the call failed.
     */
    public void destroyLink() throws IOException
    {
        Link l = requireLinked();
        try {
            core.destroyLink(l.linkId());
        }
        finally {
            transition(LinkState.DESTROYED);
        }
    }

    /**
     * Tears the session down: closes the abort channel, attempts
     * {@code destroy_link} if linked, then closes the core channel. Failures
     * are reported to the observability sink.
     */
    @Override
    public void close()
    {
        closeAbortChannel();

        if (state == LinkState.LINKED) {
            int lid = link.linkId();
            try {
                destroyLink();
            }
            catch (IOException e) {
                sink.onError(new Vxi11ErrorEvent(Instant.now(),
                    "destroy_link failed for " + core.host() + " lid=" + lid, e));
            }
        }
        else {
            transition(LinkState.DESTROYED);
        }

        try {
            core.close();
            sink.onTransportEvent(new TransportObservabilityEvent(
                Instant.now(), core.host(), -1, TransportObservabilityEvent.Kind.CORE_CLOSED));
        }
        catch (IOException e) {
            sink.onError(new Vxi11ErrorEvent(Instant.now(), "closing core channel to " + core.host(), e));
        }
    }

    // -------------------------------------------------------------------------
    // Data transfer
    // -------------------------------------------------------------------------

    /**
     * Writes {@code message} in {@link Link#writeChunkSize()} pieces.
     *
     * @return the number of bytes written
     * @throws InstrumentConnectionException if the server accepts fewer bytes than sent
     */
    public int write(byte[] message) throws IOException
    {
        Objects.requireNonNull(message, "message");
        Link l = requireLinked();
        Vxi11TimeoutPolicy t = timeouts;

        int chunk = l.writeChunkSize();
        int flags = initialFlags(t);
        int offset = 0;
        int remaining = message.length;
        while (remaining > 0) {
            int n = Math.min(chunk, remaining);
            if (remaining <= chunk) {
                flags |= OperationFlags.END;
            }

            long size = core.deviceWrite(l.linkId(), t.ioTimeout(), t.lockTimeout(), flags, message, offset, n);
            if (size < n) {
                throw new InstrumentConnectionException("The number of bytes written is less than expected");
            }

            offset += n;
            remaining -= n;
        }
        return offset;
    }

    /**
     * Reads one message, or exactly {@code size} bytes.
     *
     * @param bufferSize   largest single {@code device_read} request
     * @param termChar     termination character, or {@code -1} for none
     * @param maxReadSize  fail once more than this many bytes have accumulated
     */
    public byte[] read(OptionalInt size, int bufferSize, int termChar, int maxReadSize) throws IOException
    {
        Link l = requireLinked();
        Vxi11TimeoutPolicy t = timeouts;

        int requestSize = size.isPresent() ? Math.min(size.getAsInt(), bufferSize) : bufferSize;
        int remaining = size.orElse(0);

        int flags = initialFlags(t);
        int term = 0;
        if (termChar >= 0) {
            term = termChar;
            flags |= OperationFlags.TERMCHRSET;
        }

        ByteArrayOutputStream message = new ByteArrayOutputStream();
        int ioTimeout = t.ioTimeout();
        long start = clock.nowNanos();
        while (true) {
            DeviceReadResult result = core.deviceRead(l.linkId(), requestSize, ioTimeout, t.lockTimeout(), flags, term);
            message.write(result.data(), 0, result.data().length);

            if (size.isPresent()) {
                remaining -= result.data().length;
                if (remaining <= 0) {
                    break;
                }
                requestSize = Math.min(remaining, bufferSize);
            }

            if (message.size() > maxReadSize) {
                throw new InstrumentConnectionException(String.format(
                    "len(message) [%d] > max_read_size [%d]", message.size(), maxReadSize));
            }

            if (result.isMessageComplete()) {
                break;
            }

            // the total time across all chunks must stay within io_timeout
            if (t.ioTimeoutMillis() > 0) {
                long elapsed = TimeUnit.NANOSECONDS.toMillis(clock.nowNanos() - start);
                ioTimeout = (int) Math.max(0, t.ioTimeoutMillis() - elapsed);
            }
        }
        return message.toByteArray();
    }

    // -------------------------------------------------------------------------
    // Device control
    // -------------------------------------------------------------------------

    public int readStatusByte() throws IOException
    {
        Link l = requireLinked();
        Vxi11TimeoutPolicy t = timeouts;
        return core.deviceReadStb(l.linkId(), initialFlags(t), t.lockTimeout(), t.ioTimeout());
    }

    public void trigger() throws IOException
    {
        Link l = requireLinked();
        Vxi11TimeoutPolicy t = timeouts;
        core.deviceTrigger(l.linkId(), initialFlags(t), t.lockTimeout(), t.ioTimeout());
    }

    public void clear() throws IOException
    {
        Link l = requireLinked();
        Vxi11TimeoutPolicy t = timeouts;
        core.deviceClear(l.linkId(), initialFlags(t), t.lockTimeout(), t.ioTimeout());
    }

    public void remote() throws IOException
    {
        Link l = requireLinked();
        Vxi11TimeoutPolicy t = timeouts;
        core.deviceRemote(l.linkId(), initialFlags(t), t.lockTimeout(), t.ioTimeout());
    }

    public void local() throws IOException
    {
        Link l = requireLinked();
        Vxi11TimeoutPolicy t = timeouts;
        core.deviceLocal(l.linkId(), initialFlags(t), t.lockTimeout(), t.ioTimeout());
    }

    public void lock() throws IOException
    {
        Link l = requireLinked();
        Vxi11TimeoutPolicy t = timeouts;
        core.deviceLock(l.linkId(), initialFlags(t), t.lockTimeout());
    }

    public void unlock() throws IOException
    {
        core.deviceUnlock(requireLinked().linkId());
    }

    public void enableSrq(boolean enable, byte[] handle) throws IOException
    {
        core.deviceEnableSrq(requireLinked().linkId(), enable, handle);
    }

    /**
     * {@code device_docmd} with network byte order.
     *
     * @param dataSize size of each data element in {@code data}
     */
    public byte[] docmd(int cmd, int dataSize, byte[] data) throws IOException
    {
        Link l = requireLinked();
        Vxi11TimeoutPolicy t = timeouts;
        return core.deviceDocmd(l.linkId(), initialFlags(t), t.ioTimeout(), t.lockTimeout(),
            cmd, true, dataSize, data);
    }

    public void createInterruptChannel(long hostAddr, int hostPort, int progNum, int progVers, int progFamily)
            throws IOException
    {
        requireLinked();
        core.createIntrChan(hostAddr, hostPort, progNum, progVers, progFamily);
    }

    public void destroyInterruptChannel() throws IOException
    {
        requireLinked();
        core.destroyIntrChan();
    }

    /**
     * Sends {@code device_abort} on the abort channel, connecting it first if
     * needed. Safe to call while another thread blocks on the core channel.
     */
    public void abort() throws IOException
    {
        Link l = requireLinked();
        synchronized (abortLock) {
            if (abortClient == null) {
                AbortChannelClient client = new AbortChannelClient(core.host(), sink);
                client.connect(l.abortPort(), timeouts.socketTimeout());
                abortClient = client;
                sink.onTransportEvent(new TransportObservabilityEvent(
                    Instant.now(), core.host(), l.abortPort(), TransportObservabilityEvent.Kind.ABORT_CONNECTED));
            }
            abortClient.deviceAbort(l.linkId());
        }
    }

    // -------------------------------------------------------------------------

    private void closeAbortChannel()
    {
        synchronized (abortLock) {
            AbortChannelClient client = abortClient;
            abortClient = null;
            if (client == null) {
                return;
            }
            try {
                client.close();
                sink.onTransportEvent(new TransportObservabilityEvent(
                    Instant.now(), core.host(), -1, TransportObservabilityEvent.Kind.ABORT_CLOSED));
            }
            catch (IOException e) {
                sink.onError(new Vxi11ErrorEvent(Instant.now(), "closing abort channel to " + core.host(), e));
            }
        }
    }

    private static int initialFlags(Vxi11TimeoutPolicy t)
    {
        return t.waitsForLock() ? OperationFlags.WAITLOCK : OperationFlags.NULL;
    }

    private Link requireLinked() throws InstrumentConnectionException
    {
        Link l = link;
        if (state != LinkState.LINKED || l == null) {
            throw new InstrumentConnectionException("not connected to VXI-11 device (link is " + state + ")");
        }
        return l;
    }

    private void transition(LinkState next)
    {
        LinkState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        sink.onStateTransition(new LinkStateTransitionEvent(
            Instant.now(), core.host(), device, previous, next, link));
    }
}
