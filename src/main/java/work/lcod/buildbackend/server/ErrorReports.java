package work.lcod.buildbackend.server;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import work.lcod.buildbackend.protocol.UnsupportedProcedureException;
import work.lcod.buildbackend.shared.BackendException;

/**
 * Maps failures to JSON-RPC errors. Backend failures carry a diagnostic report as error data.
 */
final class ErrorReports {
    static final String UNEXPECTED = "unexpected_error";

    private ErrorReports() {}

    static JsonRpcException toJsonRpc(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof JsonRpcException rpc) {
            return rpc;
        }
        if (cause instanceof UnsupportedProcedureException unsupported) {
            return JsonRpcException.invalidRequest(unsupported.getMessage());
        }
        return new JsonRpcException(JsonRpcException.SERVER_ERROR, messageOf(cause), diagnostic(cause));
    }

    /**
     * {@code {message, code, severity, causes, related}} plus {@code data} when the failure carries some.
     */
    static ObjectNode diagnostic(Throwable error) {
        ObjectNode report = JsonRpc.MAPPER.createObjectNode();
        report.put("message", messageOf(error));
        if (error instanceof BackendException backend) {
            report.put("code", backend.kind().code());
        } else {
            report.put("code", UNEXPECTED);
        }
        report.put("severity", "error");
        ArrayNode causes = report.putArray("causes");
        Throwable cause = error == null ? null : error.getCause();
        while (cause != null && cause != cause.getCause()) {
            causes.add(messageOf(cause));
            cause = cause.getCause();
        }
        report.putArray("related");
        if (error instanceof BackendException backend && backend.data() != null) {
            report.set("data", JsonRpc.MAPPER.valueToTree(backend.data()));
        }
        return report;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable error) {
        if (error == null || error.getMessage() == null || error.getMessage().isBlank()) {
            return "Unexpected error";
        }
        return error.getMessage();
    }
}
