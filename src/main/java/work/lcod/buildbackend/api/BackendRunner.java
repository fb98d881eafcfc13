package work.lcod.buildbackend.api;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.buildbackend.protocol.ProtocolFactory;
import work.lcod.buildbackend.server.Server;
import work.lcod.buildbackend.server.SocketTransport;
import work.lcod.buildbackend.server.StdioTransport;

/**
 * Public entry point for embedding a backend server.
 */
public final class BackendRunner {
    private static final Logger log = LoggerFactory.getLogger(BackendRunner.class);

    /**
     * Serves until stdin closes, or forever when listening on a port. Binding failures are thrown
     * to the caller.
     */
    public void run(BackendRunConfiguration configuration, ProtocolFactory<?> factory) throws IOException {
        ExecutorService workers = Server.newWorkerPool();
        try {
            if (configuration.port().isPresent()) {
                try (var transport = SocketTransport.bind(configuration.port().get(), factory, workers)) {
                    transport.serve();
                }
            } else {
                log.debug("Serving JSON-RPC over stdio");
                StdioTransport.serve(factory, workers);
            }
        } finally {
            workers.shutdownNow();
        }
    }
}
