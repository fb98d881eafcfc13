package work.lcod.buildbackend.server;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores the JSON-RPC methods a server answers.
 */
public final class MethodRegistry {
    private final Map<String, RpcMethod> methods = new ConcurrentHashMap<>();

    public MethodRegistry register(String name, RpcMethod method) {
        methods.put(name, method);
        return this;
    }

    public RpcMethod get(String name) {
        return name == null ? null : methods.get(name);
    }
}
