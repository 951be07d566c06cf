package com.questrail.instrument.protocol.vxi11.discovery;

import com.questrail.instrument.internal.time.MonotonicClock;
import com.questrail.instrument.internal.time.SystemMonotonicClock;
import com.questrail.instrument.protocol.oncrpc.RpcProtocolException;
import com.questrail.instrument.protocol.oncrpc.RpcReplyDecoder;
import com.questrail.instrument.protocol.oncrpc.codec.XdrDecodeException;
import com.questrail.instrument.protocol.oncrpc.codec.XdrDecoder;
import com.questrail.instrument.protocol.oncrpc.model.RpcReply;
import com.questrail.instrument.protocol.oncrpc.portmap.PortMapper;
import com.questrail.instrument.protocol.oncrpc.portmap.PortMapperClient;
import com.questrail.instrument.protocol.oncrpc.portmap.PortMapping;
import com.questrail.instrument.protocol.vxi11.model.Vxi11Program;
import com.questrail.instrument.protocol.vxi11.transport.DatagramEndpoint;
import com.questrail.instrument.protocol.vxi11.transport.DatagramEndpointListener;
import com.questrail.instrument.protocol.vxi11.transport.udp.netty.NettyUdpDatagramEndpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.SocketAddress;
import java.net.SocketException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Vxi11Discovery
 * =============================================================================
 * Finds VXI-11 servers on the local networks.
 *
 * <h2>Procedure</h2>
 * For each local IPv4 address a UDP socket is bound and one un-framed Port
 * Mapper {@code GETPORT(DEVICE_CORE, 1, TCP)} call is broadcast to
 * {@code 255.255.255.255:111}. Replies are collected until the timeout
 * elapses. A reply is ignored if it:
 * <ul>
 *   <li>does not come from port 111</li>
 *   <li>carries a different {@code xid}</li>
 *   <li>cannot be decoded or is not a successful reply</li>
 *   <li>reports port 0</li>
 * </ul>
 *
 * <p>The result holds one {@link Vxi11Device} per responding IP address,
 * sorted by address. LXI identification of the devices is not attempted.</p>
 */
public final class Vxi11Discovery
{
    private static final Logger log = LoggerFactory.getLogger(Vxi11Discovery.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(1);

    private static final InetSocketAddress BROADCAST =
        new InetSocketAddress("255.255.255.255", PortMapper.DEFAULT_PORT);

    private static final long POLL_MILLIS = 10;

    private final Function<InetSocketAddress, DatagramEndpoint> endpoints;
    private final MonotonicClock clock;

    public Vxi11Discovery()
    {
        this(bind -> new NettyUdpDatagramEndpoint(bind, true), SystemMonotonicClock.INSTANCE);
    }

    /**
     * @param endpoints creates an unstarted endpoint bound to the given local address
     */
    public Vxi11Discovery(Function<InetSocketAddress, DatagramEndpoint> endpoints, MonotonicClock clock)
    {
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Broadcasts on every local IPv4 address.
     */
    public List<Vxi11Device> find(Duration timeout) throws SocketException, InterruptedException
    {
        return find(localIpv4Addresses(), timeout);
    }

    /**
     * Broadcasts from each of {@code interfaces} and waits {@code timeout} for replies.
     */
    public List<Vxi11Device> find(List<InetAddress> interfaces, Duration timeout) throws InterruptedException
    {
        Objects.requireNonNull(interfaces, "interfaces");
        Objects.requireNonNull(timeout, "timeout");
        log.debug("find VXI-11 devices: interfaces={}, timeout={}", interfaces, timeout);

        int xid = ThreadLocalRandom.current().nextInt() & 0x7FFFFFFF;
        byte[] call = PortMapperClient.getPortCall(xid, Vxi11Program.DEVICE_CORE,
            Vxi11Program.DEVICE_CORE_VERSION, PortMapping.IPPROTO_TCP);

        Map<byte[], Vxi11Device> found = new ConcurrentSkipListMap<>(ADDRESS_ORDER);
        List<DatagramEndpoint> started = new ArrayList<>();
        try {
            for (InetAddress local : interfaces) {
                DatagramEndpoint endpoint = endpoints.apply(new InetSocketAddress(local, 0));
                endpoint.setListener(new Collector(endpoint, local, call, xid, found));
                endpoint.start();
                started.add(endpoint);
            }

            long deadline = clock.nowNanos() + timeout.toNanos();
            long remaining;
            while ((remaining = deadline - clock.nowNanos()) > 0) {
                Thread.sleep(Math.min(POLL_MILLIS, Math.max(1, TimeUnit.NANOSECONDS.toMillis(remaining))));
            }
        }
        finally {
            started.forEach(DatagramEndpoint::stop);
        }

        List<Vxi11Device> devices = new ArrayList<>(found.values());
        log.debug("found {} VXI-11 device(s)", devices.size());
        return Collections.unmodifiableList(devices);
    }

    /**
     * Classifies one discovery reply.
     *
     * @return the device, or empty if the reply is to be ignored
     */
    static Optional<Vxi11Device> parseReply(SocketAddress sender, byte[] payload, int xid)
    {
        if (!(sender instanceof InetSocketAddress inet) || inet.getPort() != PortMapper.DEFAULT_PORT) {
            return Optional.empty();
        }
        try {
            Optional<RpcReply> reply = RpcReplyDecoder.decode(payload, xid);
            if (reply.isEmpty() || !(reply.get() instanceof RpcReply.Accepted accepted)) {
                return Optional.empty();
            }
            long port = new XdrDecoder(accepted.payload()).readUnsignedInt();
            if (port == 0 || inet.getAddress() == null) {
                return Optional.empty();
            }
            return Optional.of(Vxi11Device.of(inet.getAddress()));
        }
        catch (RpcProtocolException | XdrDecodeException e) {
            log.debug("ignoring malformed discovery reply from {}: {}", sender, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * IPv4 addresses of every interface that is up, excluding loopback.
     */
    public static List<InetAddress> localIpv4Addresses() throws SocketException
    {
        List<InetAddress> addresses = new ArrayList<>();
        for (NetworkInterface ni : Collections.list(NetworkInterface.getNetworkInterfaces())) {
            if (!ni.isUp() || ni.isLoopback()) {
                continue;
            }
            for (InetAddress address : Collections.list(ni.getInetAddresses())) {
                if (address instanceof Inet4Address) {
                    addresses.add(address);
                }
            }
        }
        return addresses;
    }

    private static final Comparator<byte[]> ADDRESS_ORDER = (a, b) -> {
        int n = Math.min(a.length, b.length);
        for (int i = 0; i < n; i++) {
            int c = Integer.compare(a[i] & 0xFF, b[i] & 0xFF);
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.length, b.length);
    };

    /**
     * Sends the broadcast once the endpoint is up and records each valid reply.
     */
    private static final class Collector implements DatagramEndpointListener
    {
        private final DatagramEndpoint endpoint;
        private final InetAddress local;
        private final byte[] call;
        private final int xid;
        private final Map<byte[], Vxi11Device> found;

        Collector(DatagramEndpoint endpoint, InetAddress local, byte[] call, int xid, Map<byte[], Vxi11Device> found)
        {
            this.endpoint = endpoint;
            this.local = local;
            this.call = call;
            this.xid = xid;
            this.found = found;
        }

        @Override
        public void onTransportUp()
        {
            endpoint.send(BROADCAST, call);
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            if (cause != null) {
                log.warn("discovery socket on {} failed: {}", local.getHostAddress(), cause.toString());
            }
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload)
        {
            parseReply(remote, payload, xid).ifPresent(device -> {
                if (found.putIfAbsent(device.ipAddress().getAddress(), device) == null) {
                    log.debug("found VXI-11 device at {}", device.ipAddress().getHostAddress());
                }
            });
        }
    }
}
