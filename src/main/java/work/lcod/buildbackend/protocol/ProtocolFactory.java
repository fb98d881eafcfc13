package work.lcod.buildbackend.protocol;

/**
 * Builds the backend for one connection from its initialize request.
 */
@FunctionalInterface
public interface ProtocolFactory<P extends Protocol> {
    Initialized<P> initialize(InitializeParams params);
}
