package work.lcod.buildbackend.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of a backend server process.
 *
 * @param port serve over loopback TCP on this port; stdio when empty
 */
public record BackendRunConfiguration(Optional<Integer> port, LogLevel logLevel) {
    public BackendRunConfiguration {
        Objects.requireNonNull(port, "port");
        Objects.requireNonNull(logLevel, "logLevel");
        port.ifPresent(value -> {
            if (value < 0 || value > 65535) {
                throw new IllegalArgumentException("port out of range: " + value);
            }
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Optional<Integer> port = Optional.empty();
        private LogLevel logLevel = LogLevel.DEFAULT;

        public Builder port(Optional<Integer> port) {
            this.port = port;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public BackendRunConfiguration build() {
            return new BackendRunConfiguration(port, logLevel);
        }
    }
}
