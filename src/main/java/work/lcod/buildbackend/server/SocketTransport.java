package work.lcod.buildbackend.server;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.buildbackend.protocol.ProtocolFactory;

/**
 * Loopback TCP listener. Every accepted connection gets its own {@link Server}, and with it its
 * own initialize-once state.
 */
public final class SocketTransport implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(SocketTransport.class);

    private final ServerSocket socket;
    private final ProtocolFactory<?> factory;
    private final ExecutorService executor;

    private SocketTransport(ServerSocket socket, ProtocolFactory<?> factory, ExecutorService executor) {
        this.socket = socket;
        this.factory = factory;
        this.executor = executor;
    }

    /**
     * Binds to {@code port} on the loopback interface; port 0 picks a free one.
     */
    public static SocketTransport bind(int port, ProtocolFactory<?> factory, ExecutorService executor) throws IOException {
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(executor, "executor");
        var socket = new ServerSocket(port, 50, InetAddress.getLoopbackAddress());
        log.info("Listening on {}:{}", socket.getInetAddress().getHostAddress(), socket.getLocalPort());
        return new SocketTransport(socket, factory, executor);
    }

    public int port() {
        return socket.getLocalPort();
    }

    /**
     * Accepts connections until {@link #close()} is called.
     */
    public void serve() throws IOException {
        while (!socket.isClosed()) {
            Socket client;
            try {
                client = socket.accept();
            } catch (SocketException ex) {
                if (socket.isClosed()) {
                    return;
                }
                throw ex;
            }
            executor.execute(() -> serveConnection(client));
        }
    }

    private void serveConnection(Socket client) {
        log.debug("Accepted connection from {}", client.getRemoteSocketAddress());
        try (client) {
            new JsonRpcSession(new Server(factory, executor), client.getInputStream(), client.getOutputStream()).run();
        } catch (IOException ex) {
            log.warn("Connection from {} ended with an error: {}", client.getRemoteSocketAddress(), ex.getMessage());
        }
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
