package work.lcod.buildbackend.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.buildbackend.shared.BackendException;

class ServerTest {
    private ExecutorService executor;
    private StubProtocol protocol;
    private AtomicInteger initializations;
    private Server server;

    @BeforeEach
    void setUp() {
        executor = Server.newWorkerPool();
        protocol = new StubProtocol();
        initializations = new AtomicInteger();
        server = new Server(StubProtocol.factory(protocol, initializations), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private JsonNode call(String json) throws Exception {
        return server.handle(JsonRpc.MAPPER.readTree(json)).get(5, TimeUnit.SECONDS);
    }

    private JsonNode initialize(int id) throws Exception {
        return call("{\"jsonrpc\":\"2.0\",\"id\":" + id
            + ",\"method\":\"initialize\",\"params\":{\"manifestPath\":\"project/pixi.toml\",\"capabilities\":{}}}");
    }

    private static final String PIPELINED_INITIALIZE =
        "{\"jsonrpc\":\"2.0\",\"id\":%d,\"method\":\"initialize\",\"params\":{\"manifestPath\":\"pixi.toml\"}}";
    private static final String METADATA = "{\"jsonrpc\":\"2.0\",\"id\":%d,\"method\":\"conda/getMetadata\",\"params\":{}}";

    @Test
    void initializeReturnsCapabilities() throws Exception {
        JsonNode response = initialize(1);

        assertEquals(1, response.get("id").asInt());
        assertTrue(response.at("/result/capabilities/providesCondaMetadata").asBoolean());
        assertFalse(response.at("/result/capabilities/providesCondaBuild").asBoolean());
        assertTrue(server.isInitialized());
    }

    @Test
    void secondInitializeIsRejected() throws Exception {
        initialize(1);
        JsonNode response = initialize(2);

        assertEquals(JsonRpcException.INVALID_REQUEST, response.at("/error/code").asInt());
        assertTrue(response.at("/error/message").asText().contains("already initialized"));
        assertEquals(1, initializations.get());
    }

    @Test
    void proceduresRequireInitialize() throws Exception {
        JsonNode response = call(String.format(METADATA, 7));

        assertEquals(7, response.get("id").asInt());
        assertEquals(JsonRpcException.INVALID_REQUEST, response.at("/error/code").asInt());
        assertEquals(0, protocol.metadataCalls.get());
    }

    @Test
    void failedInitializeLeavesServerUninitialized() throws Exception {
        JsonNode failed = call(
            "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{\"manifestPath\":\"broken/pixi.toml\"}}");

        assertEquals(JsonRpcException.SERVER_ERROR, failed.at("/error/code").asInt());
        assertEquals("lcod::configuration", failed.at("/error/data/code").asText());
        assertFalse(server.isInitialized());
        assertTrue(initialize(2).has("result"));
    }

    @Test
    void unknownMethod() throws Exception {
        JsonNode response = call("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"conda/publish\",\"params\":{}}");

        assertEquals(JsonRpcException.METHOD_NOT_FOUND, response.at("/error/code").asInt());
    }

    @Test
    void invalidParams() throws Exception {
        JsonNode missingPath = call("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{}}");
        assertEquals(JsonRpcException.INVALID_PARAMS, missingPath.at("/error/code").asInt());

        JsonNode notAnObject = call("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"initialize\",\"params\":[1]}");
        assertEquals(JsonRpcException.INVALID_PARAMS, notAnObject.at("/error/code").asInt());

        initialize(3);
        JsonNode badPlatform = call(
            "{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"conda/getMetadata\",\"params\":{\"hostPlatform\":{\"platform\":\"amiga-68k\"}}}");
        assertEquals(JsonRpcException.INVALID_PARAMS, badPlatform.at("/error/code").asInt());
    }

    @Test
    void backendFailureCarriesDiagnostic() throws Exception {
        initialize(1);
        protocol.failure = BackendException.engine("rattler-build exited with code 1");

        JsonNode response = call(String.format(METADATA, 2));

        assertEquals(JsonRpcException.SERVER_ERROR, response.at("/error/code").asInt());
        assertEquals("rattler-build exited with code 1", response.at("/error/message").asText());
        assertEquals("lcod::engine", response.at("/error/data/code").asText());
        assertEquals("error", response.at("/error/data/severity").asText());
        assertTrue(response.at("/error/data/causes").isArray());
    }

    @Test
    void unexpectedFailureIsReportedToo() throws Exception {
        initialize(1);
        protocol.failure = new IllegalStateException("boom");

        JsonNode response = call(String.format(METADATA, 2));

        assertEquals(JsonRpcException.SERVER_ERROR, response.at("/error/code").asInt());
        assertEquals("unexpected_error", response.at("/error/data/code").asText());
    }

    @Test
    void unsupportedProcedureIsInvalidRequest() throws Exception {
        initialize(1);

        JsonNode response = call("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"conda/build\",\"params\":{}}");

        assertEquals(JsonRpcException.INVALID_REQUEST, response.at("/error/code").asInt());
        assertTrue(response.at("/error/message").asText().contains("conda/build"));
    }

    @Test
    void proceduresRunConcurrently() throws Exception {
        initialize(1);
        protocol.barrier = new CountDownLatch(2);

        CompletableFuture<JsonNode> first = server.handle(JsonRpc.MAPPER.readTree(String.format(METADATA, 2)));
        CompletableFuture<JsonNode> second = server.handle(JsonRpc.MAPPER.readTree(String.format(METADATA, 3)));

        assertEquals("stub", first.get(10, TimeUnit.SECONDS).at("/result/packages/0/name").asText());
        assertEquals("stub", second.get(10, TimeUnit.SECONDS).at("/result/packages/0/name").asText());
    }

    @Test
    void requestsBehindInitializeSeeTheBackend() throws Exception {
        for (int round = 0; round < 200; round++) {
            var fresh = new Server(StubProtocol.factory(new StubProtocol(), new AtomicInteger()), executor);
            CompletableFuture<JsonNode> init = fresh.handle(JsonRpc.MAPPER.readTree(String.format(PIPELINED_INITIALIZE, 1)));
            CompletableFuture<JsonNode> metadata = fresh.handle(JsonRpc.MAPPER.readTree(String.format(METADATA, 2)));

            assertTrue(init.get(5, TimeUnit.SECONDS).has("result"));
            JsonNode response = metadata.get(5, TimeUnit.SECONDS);
            assertTrue(response.has("result"), "round " + round + ": " + response);
        }
    }

    @Test
    void requestsAheadOfInitializeAreRejected() throws Exception {
        for (int round = 0; round < 200; round++) {
            var stub = new StubProtocol();
            var fresh = new Server(StubProtocol.factory(stub, new AtomicInteger()), executor);
            CompletableFuture<JsonNode> metadata = fresh.handle(JsonRpc.MAPPER.readTree(String.format(METADATA, 1)));
            CompletableFuture<JsonNode> init = fresh.handle(JsonRpc.MAPPER.readTree(String.format(PIPELINED_INITIALIZE, 2)));

            JsonNode response = metadata.get(5, TimeUnit.SECONDS);
            assertEquals(JsonRpcException.INVALID_REQUEST, response.at("/error/code").asInt(), "round " + round);
            assertTrue(init.get(5, TimeUnit.SECONDS).has("result"));
            assertEquals(0, stub.metadataCalls.get());
        }
    }

    @Test
    void notificationsGetNoResponse() throws Exception {
        initialize(1);

        assertNull(call("{\"jsonrpc\":\"2.0\",\"method\":\"conda/getMetadata\",\"params\":{}}"));
        assertNull(call("{\"jsonrpc\":\"2.0\",\"method\":\"conda/unknown\"}"));
        assertEquals(1, protocol.metadataCalls.get());
    }

    @Test
    void batchesAnswerEachRequest() throws Exception {
        initialize(1);

        JsonNode response = call("[" + String.format(METADATA, 2) + ",{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"nope\"}]");

        assertTrue(response.isArray());
        assertEquals(2, response.size());
        List<Integer> ids = List.of(response.get(0).get("id").asInt(), response.get(1).get("id").asInt());
        assertTrue(ids.containsAll(List.of(2, 3)));
    }

    @Test
    void malformedRequests() throws Exception {
        assertEquals(JsonRpcException.INVALID_REQUEST, call("{\"id\":1,\"method\":\"initialize\"}").at("/error/code").asInt());
        assertEquals(JsonRpcException.INVALID_REQUEST, call("42").at("/error/code").asInt());
        assertEquals(JsonRpcException.INVALID_REQUEST, call("[]").at("/error/code").asInt());
    }
}
