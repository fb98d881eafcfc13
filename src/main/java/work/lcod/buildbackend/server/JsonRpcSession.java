package work.lcod.buildbackend.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds newline-delimited JSON-RPC messages from a stream to a {@link Server} and writes each
 * response as one line as soon as it is ready. Responses may leave in a different order than
 * their requests arrived.
 */
public final class JsonRpcSession {
    private static final Logger log = LoggerFactory.getLogger(JsonRpcSession.class);

    private final Server server;
    private final InputStream input;
    private final OutputStream output;

    public JsonRpcSession(Server server, InputStream input, OutputStream output) {
        this.server = Objects.requireNonNull(server, "server");
        this.input = Objects.requireNonNull(input, "input");
        this.output = Objects.requireNonNull(output, "output");
    }

    /**
     * Serves until the input ends and every pending response has been written.
     */
    public void run() throws IOException {
        var reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        List<CompletableFuture<Void>> pending = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            JsonNode message;
            try {
                message = JsonRpc.MAPPER.readTree(line);
            } catch (JsonProcessingException ex) {
                log.warn("Discarding unparseable message: {}", ex.getOriginalMessage());
                write(JsonRpc.failure(NullNode.getInstance(), JsonRpcException.parseError(ex.getOriginalMessage())));
                continue;
            }
            pending.removeIf(CompletableFuture::isDone);
            pending.add(server.handle(message).thenAccept(response -> {
                if (response != null) {
                    write(response);
                }
            }));
        }
        log.debug("Input closed, waiting for {} pending responses", pending.size());
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0])).join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof UncheckedIOException io) {
                throw io.getCause();
            }
            throw ex;
        }
    }

    private synchronized void write(JsonNode response) {
        try {
            output.write(JsonRpc.MAPPER.writeValueAsBytes(response));
            output.write('\n');
            output.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to write response", ex);
        }
    }
}
