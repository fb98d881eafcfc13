package work.lcod.buildbackend.protocol;

import java.util.Objects;

public record Initialized<P extends Protocol>(P protocol, InitializeResult result) {
    public Initialized {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(result, "result");
    }
}
