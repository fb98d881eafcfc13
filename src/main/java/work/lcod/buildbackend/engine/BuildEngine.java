package work.lcod.buildbackend.engine;

import java.nio.file.Path;
import java.util.List;
import work.lcod.buildbackend.recipe.BuildConfiguration;

/**
 * The external tool that solves and builds rendered recipes. Failures are reported as
 * {@link work.lcod.buildbackend.shared.BackendException} of kind ENGINE and are passed on to the
 * frontend without rewording.
 */
public interface BuildEngine {
    ResolvedDependencies resolveDependencies(BuildConfiguration configuration, Path recipeFile);

    /**
     * Builds the recipe and returns the paths of the produced package archives.
     */
    List<Path> build(BuildConfiguration configuration, Path recipeFile);
}
