package work.lcod.buildbackend.server;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A failure reported to the client as a JSON-RPC error object.
 */
public final class JsonRpcException extends RuntimeException {
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int SERVER_ERROR = -32000;

    private final int code;
    private final JsonNode data;

    public JsonRpcException(int code, String message, JsonNode data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public static JsonRpcException parseError(String detail) {
        return new JsonRpcException(PARSE_ERROR, "Parse error: " + detail, null);
    }

    public static JsonRpcException invalidRequest(String detail) {
        return new JsonRpcException(INVALID_REQUEST, "Invalid request: " + detail, null);
    }

    public static JsonRpcException methodNotFound(String method) {
        return new JsonRpcException(METHOD_NOT_FOUND, "Method not found: " + method, null);
    }

    public static JsonRpcException invalidParams(String detail) {
        return new JsonRpcException(INVALID_PARAMS, "Invalid params: " + detail, null);
    }

    public int code() {
        return code;
    }

    public JsonNode data() {
        return data;
    }
}
