package work.lcod.buildbackend.engine;

import java.util.List;
import java.util.Objects;

/**
 * Result of solving a recipe: the final build string and the run requirements as match spec text.
 */
public record ResolvedDependencies(String buildString, List<String> depends, List<String> constraints) {
    public ResolvedDependencies {
        Objects.requireNonNull(buildString, "buildString");
        depends = List.copyOf(depends);
        constraints = List.copyOf(constraints);
    }
}
