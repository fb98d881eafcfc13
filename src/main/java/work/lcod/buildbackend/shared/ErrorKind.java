package work.lcod.buildbackend.shared;

/**
 * Failure classes a backend reports; each maps to a stable diagnostic code.
 */
public enum ErrorKind {
    CONFIGURATION("lcod::configuration"),
    DEPENDENCY("lcod::dependency"),
    ARTIFACT_IO("lcod::artifact_io"),
    ENGINE("lcod::engine");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
