package com.questrail.instrument.protocol.vxi11;

import com.questrail.instrument.protocol.oncrpc.ScriptedRpcServer;
import com.questrail.instrument.protocol.oncrpc.codec.XdrDecoder;
import com.questrail.instrument.protocol.oncrpc.codec.XdrEncoder;
import com.questrail.instrument.protocol.oncrpc.portmap.PortMapper;
import com.questrail.instrument.protocol.vxi11.model.ReadReason;
import com.questrail.instrument.protocol.vxi11.model.Vxi11Program;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * FakeVxi11Device
 * -----------------------------------------------------------------------------
 * Scripted VXI-11 Core Channel (and Port Mapper) behaviour for
 * {@link ScriptedRpcServer}.
 *
 * <ul>
 *   <li>{@code create_link} answers {@code (0, linkId, abortPort, maxRecvSize)}</li>
 *   <li>{@code device_write} accepts up to {@link #acceptAtMost(int)} bytes per call</li>
 *   <li>{@code device_read} pops the next queued result, or an empty {@code RX_END} read</li>
 *   <li>a procedure configured with {@link #failWith(int, int)} answers that error code</li>
 *   <li>Port Mapper {@code GETPORT} answers {@link #corePort(int)}</li>
 * </ul>
 */
public final class FakeVxi11Device implements ScriptedRpcServer.Responder {

    /** One decoded {@code device_write} call. */
    public record Write(int lid, int ioTimeout, int lockTimeout, int flags, byte[] data) {}

    /** One decoded {@code device_read} call. */
    public record Read(int lid, int requestSize, int ioTimeout, int lockTimeout, int flags, int termChar) {}

    private volatile int linkId = 1;
    private volatile int abortPort = 619;
    private volatile long maxRecvSize = 1024;
    private volatile int acceptAtMost = Integer.MAX_VALUE;
    private volatile int corePort;
    private volatile int statusByte;
    private volatile Consumer<ScriptedRpcServer.Call> beforeReply = call -> {};

    private final Map<Integer, Integer> errors = new ConcurrentHashMap<>();
    private final Queue<byte[]> reads = new ConcurrentLinkedQueue<>();
    private final List<Write> writes = new CopyOnWriteArrayList<>();
    private final List<Read> readCalls = new CopyOnWriteArrayList<>();

    public FakeVxi11Device link(int linkId, int abortPort, long maxRecvSize) {
        this.linkId = linkId;
        this.abortPort = abortPort;
        this.maxRecvSize = maxRecvSize;
        return this;
    }

    public FakeVxi11Device acceptAtMost(int bytes) {
        this.acceptAtMost = bytes;
        return this;
    }

    public FakeVxi11Device corePort(int port) {
        this.corePort = port;
        return this;
    }

    public FakeVxi11Device statusByte(int stb) {
        this.statusByte = stb;
        return this;
    }

    public FakeVxi11Device failWith(int procedure, int errorCode) {
        errors.put(procedure, errorCode);
        return this;
    }

    public FakeVxi11Device queueRead(int reason, byte[] data) {
        reads.add(ScriptedRpcServer.readResult(reason, data));
        return this;
    }

    public FakeVxi11Device beforeReply(Consumer<ScriptedRpcServer.Call> hook) {
        this.beforeReply = hook;
        return this;
    }

    public List<Write> writes() {
        return new ArrayList<>(writes);
    }

    public List<Read> reads() {
        return new ArrayList<>(readCalls);
    }

    @Override
    public List<byte[]> respond(ScriptedRpcServer.Call call) throws IOException {
        beforeReply.accept(call);
        return Collections.singletonList(reply(call));
    }

    private byte[] reply(ScriptedRpcServer.Call call) throws IOException {
        int xid = call.xid();

        if (call.program() == PortMapper.PROGRAM) {
            return ScriptedRpcServer.success(xid, corePort);
        }

        Integer error = errors.get(call.procedure());
        if (error != null) {
            return ScriptedRpcServer.success(xid, error);
        }

        XdrDecoder args = call.arguments();
        switch (call.procedure()) {
            case Vxi11Program.CREATE_LINK:
                return ScriptedRpcServer.success(xid, 0, linkId, abortPort, (int) maxRecvSize);

            case Vxi11Program.DEVICE_WRITE: {
                Write w = new Write(args.readInt(), args.readInt(), args.readInt(), args.readInt(),
                    args.remaining() == 0 ? new byte[0] : args.readOpaque());
                writes.add(w);
                return ScriptedRpcServer.success(xid, 0, Math.min(w.data().length, acceptAtMost));
            }

            case Vxi11Program.DEVICE_READ: {
                readCalls.add(new Read(args.readInt(), args.readInt(), args.readInt(),
                    args.readInt(), args.readInt(), args.readInt()));
                byte[] next = reads.poll();
                return ScriptedRpcServer.success(xid,
                    next != null ? next : ScriptedRpcServer.readResult(ReadReason.RX_END, new byte[0]));
            }

            case Vxi11Program.DEVICE_READSTB:
                return ScriptedRpcServer.success(xid, 0, statusByte);

            case Vxi11Program.DEVICE_DOCMD: {
                for (int i = 0; i < 7; i++) {
                    args.readInt();
                }
                byte[] dataIn = args.remaining() == 0 ? new byte[0] : args.readOpaque();
                XdrEncoder out = new XdrEncoder();
                out.appendInt(0);
                out.appendOpaque(dataIn);
                return ScriptedRpcServer.success(xid, out.toByteArray());
            }

            default:
                return ScriptedRpcServer.success(xid, 0);
        }
    }
}
