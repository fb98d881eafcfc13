package work.lcod.buildbackend.recipe;

import java.util.List;
import java.util.Objects;
import work.lcod.buildbackend.conda.Version;

/**
 * Engine agnostic description of how to build one package. Instances are never modified; a
 * different configuration means a new recipe.
 */
public record Recipe(
    String name,
    Version version,
    List<Source> sources,
    BuildSection build,
    Requirements requirements,
    About about
) {
    public Recipe {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        sources = List.copyOf(sources);
        Objects.requireNonNull(build, "build");
        Objects.requireNonNull(requirements, "requirements");
        Objects.requireNonNull(about, "about");
    }
}
