package work.lcod.buildbackend.server;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Handler of one JSON-RPC method. The returned value is serialized as the result.
 */
@FunctionalInterface
public interface RpcMethod {
    Object invoke(JsonNode params) throws Exception;
}
