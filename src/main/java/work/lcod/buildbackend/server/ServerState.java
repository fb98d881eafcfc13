package work.lcod.buildbackend.server;

import java.util.Objects;
import work.lcod.buildbackend.protocol.Protocol;
import work.lcod.buildbackend.protocol.ProtocolFactory;

/**
 * Lifecycle of one server: waiting for initialize, then bound to a backend for good.
 */
public sealed interface ServerState permits ServerState.Uninitialized, ServerState.Initialized {

    record Uninitialized(ProtocolFactory<?> factory) implements ServerState {
        public Uninitialized {
            Objects.requireNonNull(factory, "factory");
        }
    }

    record Initialized(Protocol protocol) implements ServerState {
        public Initialized {
            Objects.requireNonNull(protocol, "protocol");
        }
    }
}
