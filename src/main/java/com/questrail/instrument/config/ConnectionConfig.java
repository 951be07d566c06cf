package com.questrail.instrument.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Transport-neutral configuration of a message-based connection.
 *
 * <ul>
 *   <li><b>address</b>: resource string, e.g. {@code TCPIP::10.0.0.5::inst0::INSTR}</li>
 *   <li><b>timeout</b>: read/write timeout; {@code null} means blocking</li>
 *   <li><b>encoding</b>: used for string reads and writes</li>
 *   <li><b>readTermination</b> / <b>writeTermination</b>: optional, {@code null} when unused</li>
 *   <li><b>maxReadSize</b>: upper bound on the bytes accepted by a single read</li>
 *   <li><b>rstrip</b>: strip trailing whitespace from every read</li>
 * </ul>
 */
public record ConnectionConfig(
    String address,
    Duration timeout,
    Charset encoding,
    String readTermination,
    String writeTermination,
    int maxReadSize,
    boolean rstrip
) {
    public static final int DEFAULT_MAX_READ_SIZE = 1 << 20;

    public ConnectionConfig {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(encoding, "encoding");
        if (timeout != null && timeout.isNegative()) {
            timeout = null;
        }
        if (maxReadSize < 1) {
            throw new IllegalArgumentException(
                "The maximum number of bytes to read must be >= 1, got " + maxReadSize);
        }
    }

    public static ConnectionConfig of(String address) {
        return builder().withAddress(address).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String address;
        private Duration timeout;
        private Charset encoding = StandardCharsets.UTF_8;
        private String readTermination;
        private String writeTermination;
        private int maxReadSize = DEFAULT_MAX_READ_SIZE;
        private boolean rstrip;

        public Builder withAddress(String address) {
            this.address = address;
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withEncoding(Charset encoding) {
            this.encoding = encoding;
            return this;
        }

        public Builder withReadTermination(String readTermination) {
            this.readTermination = readTermination;
            return this;
        }

        public Builder withWriteTermination(String writeTermination) {
            this.writeTermination = writeTermination;
            return this;
        }

        /**
         * Sets both the read and the write termination.
         */
        public Builder withTermination(String termination) {
            this.readTermination = termination;
            this.writeTermination = termination;
            return this;
        }

        public Builder withMaxReadSize(int maxReadSize) {
            this.maxReadSize = maxReadSize;
            return this;
        }

        public Builder withRstrip(boolean rstrip) {
            this.rstrip = rstrip;
            return this;
        }

        public ConnectionConfig build() {
            return new ConnectionConfig(address, timeout, encoding, readTermination,
                writeTermination, maxReadSize, rstrip);
        }
    }
}
