package com.questrail.instrument.protocol.vxi11.config;

import com.questrail.instrument.protocol.oncrpc.RpcClient;
import com.questrail.instrument.protocol.oncrpc.portmap.PortMapper;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * VXI-11 specific connection settings.
 *
 * <ul>
 *   <li><b>bufferSize</b>: largest {@code device_read} request, also the socket read chunk</li>
 *   <li><b>lockTimeout</b>: time to wait for a device lock; negative means one day</li>
 *   <li><b>port</b>: fixed core channel port; when present the Port Mapper is not consulted</li>
 *   <li><b>portMapperPort</b>: Port Mapper port on the instrument, normally 111</li>
 *   <li><b>lockDevice</b>: request an exclusive lock in {@code create_link}</li>
 * </ul>
 */
public record Vxi11Config(
    int bufferSize,
    Duration lockTimeout,
    OptionalInt port,
    int portMapperPort,
    boolean lockDevice
) {
    public Vxi11Config {
        Objects.requireNonNull(lockTimeout, "lockTimeout");
        Objects.requireNonNull(port, "port");
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be >= 1, got " + bufferSize);
        }
        if (port.isPresent() && (port.getAsInt() < 1 || port.getAsInt() > 0xFFFF)) {
            throw new IllegalArgumentException("Invalid port " + port.getAsInt());
        }
        if (portMapperPort < 1 || portMapperPort > 0xFFFF) {
            throw new IllegalArgumentException("Invalid Port Mapper port " + portMapperPort);
        }
    }

    public static Vxi11Config defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int bufferSize = RpcClient.DEFAULT_CHUNK_SIZE;
        private Duration lockTimeout = Duration.ZERO;
        private OptionalInt port = OptionalInt.empty();
        private int portMapperPort = PortMapper.DEFAULT_PORT;
        private boolean lockDevice;

        public Builder withBufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        /**
         * @param lockTimeout {@code null} or negative to wait one day
         */
        public Builder withLockTimeout(Duration lockTimeout) {
            this.lockTimeout = (lockTimeout == null) ? Duration.ofMillis(-1) : lockTimeout;
            return this;
        }

        public Builder withPort(int port) {
            this.port = OptionalInt.of(port);
            return this;
        }

        public Builder withPortMapperPort(int portMapperPort) {
            this.portMapperPort = portMapperPort;
            return this;
        }

        public Builder withLockDevice(boolean lockDevice) {
            this.lockDevice = lockDevice;
            return this;
        }

        public Vxi11Config build() {
            return new Vxi11Config(bufferSize, lockTimeout, port, portMapperPort, lockDevice);
        }
    }
}
