package com.questrail.instrument.protocol.oncrpc;

import com.questrail.instrument.protocol.oncrpc.codec.RecordMarking;
import com.questrail.instrument.protocol.oncrpc.codec.XdrDecodeException;
import com.questrail.instrument.protocol.oncrpc.codec.XdrEncoder;
import com.questrail.instrument.protocol.oncrpc.model.RpcCallHeader;
import com.questrail.instrument.protocol.oncrpc.model.RpcReply;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * RpcClient
 * =============================================================================
 * Blocking ONC RPC client over one TCP connection using record marking.
 *
 * <h2>Call sequence</h2>
 * <pre>
 *   init(prog, vers, proc)   // xid + 1, call header into the outgoing buffer
 *   appendXxx(...)           // procedure arguments, XDR encoded
 *   write()                  // one record: header + buffer
 *   read()                   // reassembled, checked reply payload
 * </pre>
 *
 * <h2>Transaction ids</h2>
 * {@code xid} starts at 0 and is incremented before every call. It is an
 * unsigned 32-bit counter and wraps from {@code 0xFFFFFFFF} to {@code 0}.
 * A reply whose {@code xid} does not match the most recent call is discarded
 * and {@link #read()} keeps reading; {@link #onStrayReply(int, byte[])} is
 * notified for each discarded message.
 *
 * <h2>Ownership</h2>
 * The socket, the {@code xid} counter and the outgoing buffer belong to this
 * instance alone. Calls must be serialized by the caller.
 */
public class RpcClient implements AutoCloseable
{
    public static final int DEFAULT_CHUNK_SIZE = 4096;

    private final String host;
    private final XdrEncoder buffer = new XdrEncoder();

    private Socket socket;
    private int xid;
    private int chunkSize = DEFAULT_CHUNK_SIZE;

    public RpcClient(String host)
    {
        this(host, 0);
    }

    RpcClient(String host, int initialXid)
    {
        this.host = Objects.requireNonNull(host, "host");
        this.xid = initialXid;
    }

    public String host()
    {
        return host;
    }

    /**
     * Opens a new connection, closing any existing one first.
     *
     * @param timeout connect and socket read timeout; {@code null} for blocking
     */
    public void connect(int port, Duration timeout) throws IOException
    {
        close();
        Socket s = new Socket();
        try {
            s.setTcpNoDelay(true);
            s.setSoTimeout(toMillis(timeout));
            s.connect(new InetSocketAddress(host, port), toMillis(timeout));
        }
        catch (IOException e) {
            s.close();
            throw e;
        }
        socket = s;
    }

    public boolean isConnected()
    {
        Socket s = socket;
        return s != null && !s.isClosed();
    }

    /**
     * Updates the read timeout of the live socket.
     *
     * @param timeout the new timeout; {@code null} for blocking
     * @throws SocketException if the socket is not connected
     */
    public void setTimeout(Duration timeout) throws IOException
    {
        requireSocket().setSoTimeout(toMillis(timeout));
    }

    /**
     * Socket read timeout in milliseconds; {@code 0} means blocking.
     */
    public int timeoutMillis() throws IOException
    {
        return requireSocket().getSoTimeout();
    }

    public int chunkSize()
    {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize)
    {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1, got " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    /**
     * The transaction id of the most recent call.
     */
    public int xid()
    {
        return xid;
    }

    /**
     * Starts a new call message: increments {@code xid} and writes the call
     * header into a cleared outgoing buffer.
     */
    public void init(int program, int version, int procedure)
    {
        xid++;
        buffer.clear();
        new RpcCallHeader(xid, program, version, procedure).encodeTo(buffer);
    }

    public void append(byte[] data)
    {
        buffer.append(data);
    }

    public void appendInt(int value)
    {
        buffer.appendInt(value);
    }

    public void appendUnsignedInt(long value)
    {
        buffer.appendUnsignedInt(value);
    }

    public void appendBoolean(boolean value)
    {
        buffer.appendBoolean(value);
    }

    public void appendOpaque(byte[] data)
    {
        buffer.appendOpaque(data);
    }

    public void appendOpaque(byte[] data, int offset, int count)
    {
        buffer.appendOpaque(data, offset, count);
    }

    public void appendOpaque(String text)
    {
        buffer.appendOpaque(text);
    }

    /**
     * A copy of the message composed since the last {@link #init}.
     */
    public byte[] buffer()
    {
        return buffer.toByteArray();
    }

    /**
     * Sends the outgoing buffer as a single record.
     */
    public void write() throws IOException
    {
        Socket s = requireSocket();
        RecordMarking.writeRecord(s.getOutputStream(), buffer.toByteArray());
    }

    /**
     * Reads records until one answers the current call and returns its
     * procedure-specific payload.
     *
     * @throws java.io.EOFException if the peer closes mid-record
     * @throws java.net.SocketTimeoutException if the socket timeout expires
     * @throws RpcProtocolException if the reply is a fatal RPC outcome
     */
    public byte[] read() throws IOException
    {
        Socket s = requireSocket();
        while (true) {
            byte[] message = RecordMarking.readRecord(s.getInputStream(), chunkSize);
            Optional<byte[]> payload = checkReply(message);
            if (payload.isPresent()) {
                return payload.get();
            }
            onStrayReply(xid, message);
        }
    }

    /**
     * Classifies {@code message} against the current {@code xid}.
     *
     * @return the payload of a successful reply, or empty if the {@code xid}
     *         does not match
     * @throws RpcProtocolException for every fatal reply outcome
     */
    public Optional<byte[]> checkReply(byte[] message) throws RpcProtocolException, XdrDecodeException
    {
        Optional<RpcReply> reply = RpcReplyDecoder.decode(message, xid);
        if (reply.isEmpty()) {
            return Optional.empty();
        }
        if (reply.get() instanceof RpcReply.Accepted accepted) {
            return Optional.of(accepted.payload());
        }
        throw RpcProtocolException.from(reply.get());
    }

    /**
     * Called for every reply discarded because its {@code xid} did not match,
     * typically a late reply or an interrupt. The default does nothing.
     */
    protected void onStrayReply(int expectedXid, byte[] message)
    {
    }

    /**
     * Closes the connection. Safe to call repeatedly.
     */
    @Override
    public void close() throws IOException
    {
        Socket s = socket;
        socket = null;
        if (s != null) {
            s.close();
        }
    }

    private Socket requireSocket() throws SocketException
    {
        Socket s = socket;
        if (s == null || s.isClosed()) {
            throw new SocketException("The socket is disconnected");
        }
        return s;
    }

    static int toMillis(Duration timeout)
    {
        if (timeout == null) {
            return 0;
        }
        long ms = timeout.toMillis();
        if (ms <= 0) {
            // zero would mean "blocking" to java.net.Socket
            return 1;
        }
        return (int) Math.min(ms, Integer.MAX_VALUE);
    }
}
