package work.lcod.buildbackend.backend.python;

import work.lcod.buildbackend.dependencies.ClassifiedDependencies;

/**
 * Tool that installs the project into the host prefix.
 */
public enum Installer {
    UV("uv"),
    PIP("pip");

    private final String packageName;

    Installer(String packageName) {
        this.packageName = packageName;
    }

    public String packageName() {
        return packageName;
    }

    /**
     * uv when the project declares it in any phase, pip otherwise.
     */
    public static Installer detect(ClassifiedDependencies dependencies) {
        return dependencies.declares(UV.packageName) ? UV : PIP;
    }
}
