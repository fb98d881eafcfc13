package work.lcod.buildbackend.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.buildbackend.protocol.CondaBuildParams;
import work.lcod.buildbackend.protocol.CondaMetadataParams;
import work.lcod.buildbackend.protocol.InitializeParams;
import work.lcod.buildbackend.protocol.Procedures;
import work.lcod.buildbackend.protocol.Protocol;
import work.lcod.buildbackend.protocol.ProtocolFactory;

/**
 * Transport independent JSON-RPC dispatcher. The first successful {@code initialize} binds the
 * server to a backend; it can never be initialized again. Initialize runs under the write lock,
 * every other procedure under the read lock, so procedures run concurrently with each other but
 * never alongside an initialize. Requests received after an initialize start only once it has
 * completed.
 */
public final class Server {
    private static final Logger log = LoggerFactory.getLogger(Server.class);

    private final ExecutorService executor;
    private final MethodRegistry methods;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private ServerState state;
    private final Object dispatchLock = new Object();
    // completes once the most recently received initialize has finished, successfully or not
    private CompletableFuture<?> initializeBarrier = CompletableFuture.completedFuture(null);
    // completes once every request received so far has finished
    private CompletableFuture<?> received = CompletableFuture.completedFuture(null);

    public Server(ProtocolFactory<?> factory, ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.state = new ServerState.Uninitialized(factory);
        this.methods = new MethodRegistry()
            .register(Procedures.INITIALIZE, this::initialize)
            .register(Procedures.CONDA_METADATA, params -> {
                var request = decode(params, CondaMetadataParams.class);
                return withProtocol(protocol -> protocol.getCondaMetadata(request));
            })
            .register(Procedures.CONDA_BUILD, params -> {
                var request = decode(params, CondaBuildParams.class);
                return withProtocol(protocol -> protocol.buildConda(request));
            });
    }

    /**
     * Daemon worker threads for request handling and connections.
     */
    public static ExecutorService newWorkerPool() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "build-backend-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public boolean isInitialized() {
        lock.readLock().lock();
        try {
            return state instanceof ServerState.Initialized;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Handles a request, notification or batch. Completes with the response to send, or with
     * {@code null} when nothing is to be sent back.
     */
    public CompletableFuture<JsonNode> handle(JsonNode message) {
        if (message != null && message.isArray()) {
            return handleBatch((ArrayNode) message);
        }
        return handleSingle(message);
    }

    private CompletableFuture<JsonNode> handleBatch(ArrayNode batch) {
        if (batch.isEmpty()) {
            return CompletableFuture.completedFuture(
                JsonRpc.failure(NullNode.getInstance(), JsonRpcException.invalidRequest("empty batch")));
        }
        List<CompletableFuture<JsonNode>> responses = new ArrayList<>();
        for (JsonNode request : batch) {
            responses.add(handleSingle(request));
        }
        return CompletableFuture.allOf(responses.toArray(new CompletableFuture<?>[0])).thenApply(ignored -> {
            ArrayNode out = JsonRpc.MAPPER.createArrayNode();
            for (CompletableFuture<JsonNode> response : responses) {
                JsonNode node = response.join();
                if (node != null) {
                    out.add(node);
                }
            }
            return out.isEmpty() ? null : out;
        });
    }

    private CompletableFuture<JsonNode> handleSingle(JsonNode request) {
        if (request == null || !request.isObject()) {
            return CompletableFuture.completedFuture(
                JsonRpc.failure(NullNode.getInstance(), JsonRpcException.invalidRequest("message must be an object")));
        }
        JsonNode id = request.get("id");
        boolean notification = !request.has("id");
        if (id != null && !(id.isNull() || id.isTextual() || id.isNumber())) {
            return CompletableFuture.completedFuture(
                JsonRpc.failure(NullNode.getInstance(), JsonRpcException.invalidRequest("id must be a string or a number")));
        }
        if (!JsonRpc.VERSION.equals(request.path("jsonrpc").asText())
            || !request.path("method").isTextual()) {
            return CompletableFuture.completedFuture(
                JsonRpc.failure(id, JsonRpcException.invalidRequest("not a JSON-RPC 2.0 request")));
        }
        String name = request.get("method").asText();
        JsonNode params = request.get("params");
        RpcMethod method = methods.get(name);
        if (method == null) {
            log.warn("Unknown method {}", name);
            return CompletableFuture.completedFuture(
                notification ? null : JsonRpc.failure(id, JsonRpcException.methodNotFound(name)));
        }
        return dispatch(name, method, params)
            .handle((result, error) -> {
                if (error != null) {
                    JsonRpcException rpcError = ErrorReports.toJsonRpc(error);
                    log.warn("{} failed: {}", name, rpcError.getMessage());
                    log.debug("{} failure details", name, error);
                    return notification ? null : JsonRpc.failure(id, rpcError);
                }
                return notification ? null : JsonRpc.success(id, result);
            });
    }

    /**
     * Orders calls the way a fair read/write lock queues them: an initialize starts after every
     * earlier request, any other request after every earlier initialize. A request sent right
     * behind an initialize on the same stream therefore sees the initialized backend. Must be
     * called in arrival order.
     */
    private CompletableFuture<Object> dispatch(String name, RpcMethod method, JsonNode params) {
        synchronized (dispatchLock) {
            boolean initialize = Procedures.INITIALIZE.equals(name);
            CompletableFuture<?> after = initialize ? received : initializeBarrier;
            CompletableFuture<Object> call = after.thenApplyAsync(ignored -> invoke(method, params), executor);
            CompletableFuture<Object> settled = call.handle((result, error) -> null);
            if (initialize) {
                initializeBarrier = settled;
            }
            received = received.isDone() ? settled : CompletableFuture.allOf(received, settled);
            return call;
        }
    }

    private static Object invoke(RpcMethod method, JsonNode params) {
        try {
            return method.invoke(params);
        } catch (RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new CompletionException(ex);
        }
    }

    private Object initialize(JsonNode params) {
        InitializeParams request = decode(params, InitializeParams.class);
        if (request.manifestPath() == null) {
            throw JsonRpcException.invalidParams("manifestPath is required");
        }
        lock.writeLock().lock();
        try {
            ServerState current = state;
            if (current instanceof ServerState.Initialized) {
                throw JsonRpcException.invalidRequest("the backend is already initialized");
            }
            if (current instanceof ServerState.Uninitialized uninitialized) {
                var initialized = uninitialized.factory().initialize(request);
                state = new ServerState.Initialized(initialized.protocol());
                log.info("Initialized backend for {}", request.manifestPath());
                return initialized.result();
            }
            throw new IllegalStateException("unknown server state " + current);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T withProtocol(Function<Protocol, T> call) {
        lock.readLock().lock();
        try {
            ServerState current = state;
            if (current instanceof ServerState.Uninitialized) {
                throw JsonRpcException.invalidRequest("the backend is not initialized yet");
            }
            if (current instanceof ServerState.Initialized initialized) {
                return call.apply(initialized.protocol());
            }
            throw new IllegalStateException("unknown server state " + current);
        } finally {
            lock.readLock().unlock();
        }
    }

    private static <T> T decode(JsonNode params, Class<T> type) {
        if (params == null || !params.isObject()) {
            throw JsonRpcException.invalidParams("params must be an object");
        }
        try {
            return JsonRpc.MAPPER.treeToValue(params, type);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw JsonRpcException.invalidParams(ex.getMessage());
        }
    }
}
