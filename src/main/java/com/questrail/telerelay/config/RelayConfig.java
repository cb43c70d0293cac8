package com.questrail.telerelay.config;

import com.questrail.telerelay.core.relay.RelayTimingPolicy;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for the relay process.
 *
 * <ul>
 *   <li><b>measurementBind</b> / <b>actuationBind</b>: listening addresses,
 *       one per agent role (defaults {@code 0.0.0.0:65430} and {@code 0.0.0.0:65431}).</li>
 *   <li><b>maxFrameLength</b>: largest accepted message body in bytes.</li>
 *   <li><b>dispatchThreads</b>: listener threads per acceptor.</li>
 *   <li><b>reportDirectory</b>: where daily CSV reports go; absent disables them.</li>
 *   <li><b>reportZone</b>: time zone used to render report timestamps.</li>
 * </ul>
 */
public record RelayConfig(
        InetSocketAddress measurementBind,
        InetSocketAddress actuationBind,
        RelayTimingPolicy timingPolicy,
        int maxFrameLength,
        int dispatchThreads,
        Optional<Path> reportDirectory,
        ZoneId reportZone
) {
    public static final int DEFAULT_MEASUREMENT_PORT = 65430;
    public static final int DEFAULT_ACTUATION_PORT = 65431;
    public static final int DEFAULT_MAX_FRAME_LENGTH = 64 * 1024;

    public RelayConfig {
        Objects.requireNonNull(measurementBind, "measurementBind");
        Objects.requireNonNull(actuationBind, "actuationBind");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(reportDirectory, "reportDirectory");
        Objects.requireNonNull(reportZone, "reportZone");

        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be > 0");
        }
        if (dispatchThreads <= 0) {
            throw new IllegalArgumentException("dispatchThreads must be > 0");
        }
        if (measurementBind.getPort() != 0 && measurementBind.equals(actuationBind)) {
            throw new IllegalArgumentException("measurement and actuation listeners need distinct addresses");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress measurementBind = new InetSocketAddress(DEFAULT_MEASUREMENT_PORT);
        private InetSocketAddress actuationBind = new InetSocketAddress(DEFAULT_ACTUATION_PORT);
        private RelayTimingPolicy timingPolicy = RelayTimingPolicy.defaults();
        private int maxFrameLength = DEFAULT_MAX_FRAME_LENGTH;
        private int dispatchThreads = 1;
        private Path reportDirectory;
        private ZoneId reportZone = ZoneId.systemDefault();

        public Builder withMeasurementBind(InetSocketAddress address) {
            this.measurementBind = address;
            return this;
        }

        public Builder withActuationBind(InetSocketAddress address) {
            this.actuationBind = address;
            return this;
        }

        public Builder withTimingPolicy(RelayTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withMaxFrameLength(int maxFrameLength) {
            this.maxFrameLength = maxFrameLength;
            return this;
        }

        public Builder withDispatchThreads(int dispatchThreads) {
            this.dispatchThreads = dispatchThreads;
            return this;
        }

        public Builder withReportDirectory(Path reportDirectory) {
            this.reportDirectory = reportDirectory;
            return this;
        }

        public Builder withReportZone(ZoneId reportZone) {
            this.reportZone = reportZone;
            return this;
        }

        public RelayConfig build() {
            return new RelayConfig(measurementBind, actuationBind, timingPolicy, maxFrameLength,
                    dispatchThreads, Optional.ofNullable(reportDirectory), reportZone);
        }
    }
}
