package com.questrail.hamgateway.config;

import io.netty.util.NetUtil;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Bind configuration for a single TCP or UDP listener.
 *
 * <p>Instances are immutable and validated on construction: the address must
 * be an IPv4 or IPv6 literal (no name resolution is attempted) and the port
 * must lie in 1-65535. A listener built from a {@code ServerConfig} therefore
 * never fails on configuration at {@code start()}.</p>
 *
 * @param address                   IP literal to bind to
 * @param port                      port, 1-65535
 * @param bufferSize                receive buffer size in bytes, or {@code null}
 *                                  for the protocol default
 * @param reuseAddress              whether {@code SO_REUSEADDR} is set
 * @param requestsPerMinutePerSource UDP only: datagrams accepted per source
 *                                  address per minute
 * @param readTimeout               TCP only: how long a connection may stay
 *                                  silent before its read sequence ends
 */
public record ServerConfig(
    String address,
    int port,
    Integer bufferSize,
    boolean reuseAddress,
    int requestsPerMinutePerSource,
    Duration readTimeout
) {
    public static final String DEFAULT_ADDRESS = "::1";
    public static final int DEFAULT_REQUESTS_PER_MINUTE = 60;
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);

    public ServerConfig {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(readTimeout, "readTimeout");

        if (parseAddress(address) == null) {
            throw new IllegalArgumentException("Invalid IP address: '" + address + "'");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port number must be between 1 and 65535, was " + port);
        }
        if (bufferSize != null && bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be > 0, was " + bufferSize);
        }
        if (requestsPerMinutePerSource <= 0) {
            throw new IllegalArgumentException(
                "requestsPerMinutePerSource must be > 0, was " + requestsPerMinutePerSource);
        }
        if (readTimeout.isNegative() || readTimeout.isZero()) {
            throw new IllegalArgumentException("readTimeout must be positive");
        }
    }

    /**
     * Resolves the validated address literal and port into a bindable address.
     */
    public InetSocketAddress bindAddress() {
        return new InetSocketAddress(parseAddress(address), port);
    }

    /**
     * Returns the configured buffer size, or {@code protocolDefault} when none
     * was configured.
     */
    public int bufferSizeOr(int protocolDefault) {
        return bufferSize != null ? bufferSize : protocolDefault;
    }

    private static InetAddress parseAddress(String literal) {
        // Literal-only parsing: returns null instead of falling back to DNS.
        return NetUtil.createInetAddressFromIpAddressString(literal);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String address = DEFAULT_ADDRESS;
        private int port;
        private Integer bufferSize;
        private boolean reuseAddress = true;
        private int requestsPerMinutePerSource = DEFAULT_REQUESTS_PER_MINUTE;
        private Duration readTimeout = DEFAULT_READ_TIMEOUT;

        public Builder withAddress(String address) {
            this.address = address;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withBufferSize(Integer bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        public Builder withReuseAddress(boolean reuseAddress) {
            this.reuseAddress = reuseAddress;
            return this;
        }

        public Builder withRequestsPerMinutePerSource(int requestsPerMinute) {
            this.requestsPerMinutePerSource = requestsPerMinute;
            return this;
        }

        public Builder withReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(address, port, bufferSize, reuseAddress,
                requestsPerMinutePerSource, readTimeout);
        }
    }
}
