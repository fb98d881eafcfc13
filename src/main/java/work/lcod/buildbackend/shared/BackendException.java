package work.lcod.buildbackend.shared;

import java.util.Objects;

/**
 * Exception carrying an {@link ErrorKind} (and optional structured data) for backend failures.
 */
public class BackendException extends RuntimeException {
    private final ErrorKind kind;
    private final Object data;

    public BackendException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public BackendException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public BackendException(ErrorKind kind, String message, Object data, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.data = data;
    }

    public static BackendException configuration(String message) {
        return new BackendException(ErrorKind.CONFIGURATION, message);
    }

    public static BackendException configuration(String message, Throwable cause) {
        return new BackendException(ErrorKind.CONFIGURATION, message, cause);
    }

    public static BackendException artifactIo(String message, Throwable cause) {
        return new BackendException(ErrorKind.ARTIFACT_IO, message, cause);
    }

    public static BackendException engine(String message) {
        return new BackendException(ErrorKind.ENGINE, message);
    }

    public static BackendException engine(String message, Throwable cause) {
        return new BackendException(ErrorKind.ENGINE, message, cause);
    }

    public ErrorKind kind() {
        return kind;
    }

    public Object data() {
        return data;
    }
}
