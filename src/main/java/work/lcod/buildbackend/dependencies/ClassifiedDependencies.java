package work.lcod.buildbackend.dependencies;

import java.util.Objects;
import work.lcod.buildbackend.manifest.DependencySet;

/**
 * The build, host and run dependency sets of one recipe construction.
 */
public record ClassifiedDependencies(DependencySet build, DependencySet host, DependencySet run) {
    public ClassifiedDependencies {
        Objects.requireNonNull(build, "build");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(run, "run");
    }

    /**
     * True when {@code name} is declared in any of the three phases.
     */
    public boolean declares(String name) {
        return build.containsKey(name) || host.containsKey(name) || run.containsKey(name);
    }
}
