package work.lcod.buildbackend.protocol;

/**
 * JSON-RPC method names of the build backend protocol.
 */
public final class Procedures {
    public static final String INITIALIZE = "initialize";
    public static final String CONDA_METADATA = "conda/getMetadata";
    public static final String CONDA_BUILD = "conda/build";

    private Procedures() {}
}
