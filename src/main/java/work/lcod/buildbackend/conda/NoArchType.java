package work.lcod.buildbackend.conda;

/**
 * Whether a package is platform independent, and if so which kind.
 */
public enum NoArchType {
    NONE(null),
    GENERIC("generic"),
    PYTHON("python");

    private final String value;

    NoArchType(String value) {
        this.value = value;
    }

    /**
     * Recipe and metadata value, {@code null} for architecture specific packages.
     */
    public String value() {
        return value;
    }

    public boolean isNoArch() {
        return this != NONE;
    }
}
