package work.lcod.buildbackend.manifest;

/**
 * The phase a dependency is needed in.
 */
public enum SpecType {
    BUILD("build-dependencies"),
    HOST("host-dependencies"),
    RUN("dependencies");

    private final String tableName;

    SpecType(String tableName) {
        this.tableName = tableName;
    }

    /**
     * Name of the manifest table the dependencies of this phase are declared in.
     */
    public String tableName() {
        return tableName;
    }
}
