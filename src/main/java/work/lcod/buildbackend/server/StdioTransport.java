package work.lcod.buildbackend.server;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import work.lcod.buildbackend.protocol.ProtocolFactory;

/**
 * Serves a single session over the process' stdin and stdout.
 */
public final class StdioTransport {
    private StdioTransport() {}

    public static void serve(ProtocolFactory<?> factory, ExecutorService executor) throws IOException {
        new JsonRpcSession(new Server(factory, executor), System.in, System.out).run();
    }
}
