package com.questrail.instrument.protocol.vxi11.client;

import com.questrail.instrument.protocol.oncrpc.codec.XdrDecodeException;
import com.questrail.instrument.protocol.oncrpc.codec.XdrDecoder;
import com.questrail.instrument.protocol.vxi11.model.DeviceReadResult;
import com.questrail.instrument.protocol.vxi11.model.Link;
import com.questrail.instrument.protocol.vxi11.model.Vxi11Program;
import com.questrail.instrument.protocol.vxi11.observability.NullObservabilitySink;
import com.questrail.instrument.protocol.vxi11.observability.Vxi11ObservabilitySink;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * CoreChannelClient
 * -----------------------------------------------------------------------------
 * One method per {@code DEVICE_CORE} procedure. Each method issues exactly one
 * RPC call and blocks for its reply.
 *
 * <p>Timeouts are in milliseconds as carried on the wire. {@code flags} is a
 * combination of {@link com.questrail.instrument.protocol.vxi11.model.OperationFlags}.
 * Argument order follows the XDR structures of VXI-11 Appendix B; note that
 * {@code Device_GenericParms} puts {@code lock_timeout} before
 * {@code io_timeout} while {@code Device_DocmdParms} does the opposite.</p>
 *
 * <p>This class does no chunking, looping or state tracking; see
 * {@link com.questrail.instrument.protocol.vxi11.state.Vxi11LinkSession}.</p>
 */
public final class CoreChannelClient extends Vxi11ChannelClient
{
    /** Largest {@code handle} accepted by {@code device_enable_srq}. */
    public static final int MAX_SRQ_HANDLE_LENGTH = 40;

    public CoreChannelClient(String host)
    {
        this(host, NullObservabilitySink.INSTANCE);
    }

    public CoreChannelClient(String host, Vxi11ObservabilitySink sink)
    {
        super(host, sink);
    }

    /**
     * {@code create_link}: opens a link to {@code device}.
     *
     * @throws Vxi11DeviceException if the server refuses; no link exists then
     * @throws XdrDecodeException if the reply carries an abort port outside 0-65535
     */
    public Link createLink(String device, boolean lockDevice, int lockTimeout) throws IOException
    {
        Objects.requireNonNull(device, "device");
        init(Vxi11Program.DEVICE_CORE, Vxi11Program.DEVICE_CORE_VERSION, Vxi11Program.CREATE_LINK);
        appendInt(ThreadLocalRandom.current().nextInt() & 0x7FFFFFFF);
        appendBoolean(lockDevice);
        appendInt(lockTimeout);
        appendOpaque(device);
        XdrDecoder in = call();
        int lid = in.readInt();
        long abortPort = in.readUnsignedInt();
        long maxRecvSize = in.readUnsignedInt();
        if (abortPort > 0xFFFF) {
            throw new XdrDecodeException("create_link returned an invalid abort port: " + abortPort);
        }
        return new Link(lid, (int) abortPort, maxRecvSize);
    }

    /**
     * {@code device_write}: sends {@code length} bytes of {@code data}.
     *
     * @return the number of bytes the server accepted
     */
    public long deviceWrite(int lid, int ioTimeout, int lockTimeout, int flags,
                            byte[] data, int offset, int length) throws IOException
    {
        init(Vxi11Program.DEVICE_CORE, Vxi11Program.DEVICE_CORE_VERSION, Vxi11Program.DEVICE_WRITE);
        appendInt(lid);
        appendInt(ioTimeout);
        appendInt(lockTimeout);
        appendInt(flags);
        appendOpaque(data, offset, length);
        return call().readUnsignedInt();
    }

    /**
     * {@code device_read}: requests up to {@code requestSize} bytes.
     *
     * @param termChar termination character, only honoured with {@code TERMCHRSET}
     */
    public DeviceReadResult deviceRead(int lid, int requestSize, int ioTimeout, int lockTimeout,
                                       int flags, int termChar) throws IOException
    {
        init(Vxi11Program.DEVICE_CORE, Vxi11Program.DEVICE_CORE_VERSION, Vxi11Program.DEVICE_READ);
        appendInt(lid);
        appendInt(requestSize);
        appendInt(ioTimeout);
        appendInt(lockTimeout);
        appendInt(flags);
        appendInt(termChar);
        XdrDecoder in = call();
        int reason = in.readInt();
        byte[] data = in.remaining() == 0 ? new byte[0] : in.readOpaque();
        return new DeviceReadResult(reason, data);
    }

    /**
     * {@code device_readstb}: reads the status byte.
     */
    public int deviceReadStb(int lid, int flags, int lockTimeout, int ioTimeout) throws IOException
    {
        genericCall(Vxi11Program.DEVICE_READSTB, lid, flags, lockTimeout, ioTimeout);
        return (int) readReply().readUnsignedInt();
    }

    public void deviceTrigger(int lid, int flags, int lockTimeout, int ioTimeout) throws IOException
    {
        genericCall(Vxi11Program.DEVICE_TRIGGER, lid, flags, lockTimeout, ioTimeout);
        readReply();
    }

    public void deviceClear(int lid, int flags, int lockTimeout, int ioTimeout) throws IOException
    {
        genericCall(Vxi11Program.DEVICE_CLEAR, lid, flags, lockTimeout, ioTimeout);
        readReply();
    }

    public void deviceRemote(int lid, int flags, int lockTimeout, int ioTimeout) throws IOException
    {
        genericCall(Vxi11Program.DEVICE_REMOTE, lid, flags, lockTimeout, ioTimeout);
        readReply();
    }

    public void deviceLocal(int lid, int flags, int lockTimeout, int ioTimeout) throws IOException
    {
        genericCall(Vxi11Program.DEVICE_LOCAL, lid, flags, lockTimeout, ioTimeout);
        readReply();
    }

    public void deviceLock(int lid, int flags, int lockTimeout) throws IOException
    {
        init(Vxi11Program.DEVICE_CORE, Vxi11Program.DEVICE_CORE_VERSION, Vxi11Program.DEVICE_LOCK);
        appendInt(lid);
        appendInt(flags);
        appendInt(lockTimeout);
        call();
    }

    public void deviceUnlock(int lid) throws IOException
    {
        init(Vxi11Program.DEVICE_CORE, Vxi11Program.DEVICE_CORE_VERSION, Vxi11Program.DEVICE_UNLOCK);
        appendInt(lid);
        call();
    }

    /**
     * {@code device_enable_srq}: enables or disables service requests.
     *
     * @param handle host specific data echoed back in {@code device_intr_srq}
     */
    public void deviceEnableSrq(int lid, boolean enable, byte[] handle) throws IOException
    {
        Objects.requireNonNull(handle, "handle");
        if (handle.length > MAX_SRQ_HANDLE_LENGTH) {
            throw new IllegalArgumentException(
                "The handle must be <= " + MAX_SRQ_HANDLE_LENGTH + " bytes, got " + handle.length);
        }
        init(Vxi11Program.DEVICE_CORE, Vxi11Program.DEVICE_CORE_VERSION, Vxi11Program.DEVICE_ENABLE_SRQ);
        appendInt(lid);
        appendBoolean(enable);
        appendOpaque(handle);
        call();
    }

    /**
     * {@code device_docmd}: executes a device-specific command.
     *
     * @return the command's {@code data_out}
     */
    public byte[] deviceDocmd(int lid, int flags, int ioTimeout, int lockTimeout, int cmd,
                              boolean networkOrder, int dataSize, byte[] dataIn) throws IOException
    {
        Objects.requireNonNull(dataIn, "dataIn");
        init(Vxi11Program.DEVICE_CORE, Vxi11Program.DEVICE_CORE_VERSION, Vxi11Program.DEVICE_DOCMD);
        appendInt(lid);
        appendInt(flags);
        appendInt(ioTimeout);
        appendInt(lockTimeout);
        appendInt(cmd);
        appendBoolean(networkOrder);
        appendInt(dataSize);
        appendOpaque(dataIn);
        return XdrDecoder.unpackOpaque(call().readRemaining());
    }

    public void destroyLink(int lid) throws IOException
    {
        init(Vxi11Program.DEVICE_CORE, Vxi11Program.DEVICE_CORE_VERSION, Vxi11Program.DESTROY_LINK);
        appendInt(lid);
        call();
    }

    /**
     * {@code create_intr_chan}: asks the server to open an interrupt channel
     * back to {@code hostAddr:hostPort}.
     *
     * @param progFamily {@code 6} for TCP or {@code 17} for UDP
     */
    public void createIntrChan(long hostAddr, int hostPort, int progNum, int progVers, int progFamily)
            throws IOException
    {
        init(Vxi11Program.DEVICE_CORE, Vxi11Program.DEVICE_CORE_VERSION, Vxi11Program.CREATE_INTR_CHAN);
        appendUnsignedInt(hostAddr);
        appendUnsignedInt(hostPort);
        appendUnsignedInt(Integer.toUnsignedLong(progNum));
        appendUnsignedInt(Integer.toUnsignedLong(progVers));
        appendUnsignedInt(progFamily);
        call();
    }

    public void destroyIntrChan() throws IOException
    {
        init(Vxi11Program.DEVICE_CORE, Vxi11Program.DEVICE_CORE_VERSION, Vxi11Program.DESTROY_INTR_CHAN);
        call();
    }

    private void genericCall(int procedure, int lid, int flags, int lockTimeout, int ioTimeout)
            throws IOException
    {
        init(Vxi11Program.DEVICE_CORE, Vxi11Program.DEVICE_CORE_VERSION, procedure);
        appendInt(lid);
        appendInt(flags);
        appendInt(lockTimeout);
        appendInt(ioTimeout);
        write();
    }
}
