package com.questrail.telerelay.config;

import com.questrail.telerelay.api.Role;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for one field agent.
 *
 * <ul>
 *   <li><b>reportInterval</b>: measurement agents only; period between telemetry packets.</li>
 *   <li><b>reconnectDelay</b>: wait after a lost or refused connection.</li>
 *   <li><b>positionRefresh</b>: period of the position provider.</li>
 * </ul>
 */
public record AgentConfig(
        Role role,
        String agentId,
        InetSocketAddress relayAddress,
        Duration reportInterval,
        Duration reconnectDelay,
        Duration connectTimeout,
        Duration positionRefresh,
        int maxFrameLength
) {
    public AgentConfig {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(relayAddress, "relayAddress");
        requirePositive(reportInterval, "reportInterval");
        requirePositive(reconnectDelay, "reconnectDelay");
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(positionRefresh, "positionRefresh");

        if (agentId.isBlank()) {
            throw new IllegalArgumentException("agentId must not be blank");
        }
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be > 0");
        }
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public static Builder builder(Role role) {
        return new Builder(role);
    }

    public static final class Builder {
        private final Role role;
        private String agentId;
        private InetSocketAddress relayAddress;
        private Duration reportInterval = Duration.ofMillis(500);
        private Duration reconnectDelay = Duration.ofSeconds(5);
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration positionRefresh = Duration.ofSeconds(3);
        private int maxFrameLength = RelayConfig.DEFAULT_MAX_FRAME_LENGTH;

        private Builder(Role role) {
            this.role = Objects.requireNonNull(role, "role");
            this.agentId = role.wireName() + "-agent";
            this.relayAddress = new InetSocketAddress("127.0.0.1",
                    role == Role.MEASUREMENT ? RelayConfig.DEFAULT_MEASUREMENT_PORT : RelayConfig.DEFAULT_ACTUATION_PORT);
        }

        public Builder withAgentId(String agentId) {
            this.agentId = agentId;
            return this;
        }

        public Builder withRelayAddress(InetSocketAddress relayAddress) {
            this.relayAddress = relayAddress;
            return this;
        }

        public Builder withReportInterval(Duration reportInterval) {
            this.reportInterval = reportInterval;
            return this;
        }

        public Builder withReconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = reconnectDelay;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withPositionRefresh(Duration positionRefresh) {
            this.positionRefresh = positionRefresh;
            return this;
        }

        public Builder withMaxFrameLength(int maxFrameLength) {
            this.maxFrameLength = maxFrameLength;
            return this;
        }

        public AgentConfig build() {
            return new AgentConfig(role, agentId, relayAddress, reportInterval, reconnectDelay,
                    connectTimeout, positionRefresh, maxFrameLength);
        }
    }
}
