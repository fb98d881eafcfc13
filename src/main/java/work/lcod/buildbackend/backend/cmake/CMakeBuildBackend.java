package work.lcod.buildbackend.backend.cmake;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import work.lcod.buildbackend.backend.AbstractBuildBackend;
import work.lcod.buildbackend.conda.NoArchType;
import work.lcod.buildbackend.conda.Platform;
import work.lcod.buildbackend.dependencies.ClassifiedDependencies;
import work.lcod.buildbackend.dependencies.HostToolPolicy;
import work.lcod.buildbackend.engine.BuildEngine;
import work.lcod.buildbackend.manifest.ProjectManifest;
import work.lcod.buildbackend.recipe.RecipeTemplate;

/**
 * Builds native CMake projects for the host platform. The source directory is referenced from
 * the build script, so the recipe has no source entries.
 */
public final class CMakeBuildBackend extends AbstractBuildBackend {
    static final List<String> INPUT_GLOBS = List.of(
        "**/*.{c,cc,cxx,cpp,h,hpp,hxx}",
        "**/*.{cmake,cmake.in}",
        "**/CMakeFiles.txt"
    );
    private static final HostToolPolicy BUILD_TOOLS = HostToolPolicy.fixed("cmake", "ninja");

    public CMakeBuildBackend(ProjectManifest manifest, BuildEngine engine, Optional<Path> cacheDirectory) {
        super(manifest, engine, cacheDirectory);
    }

    @Override
    protected HostToolPolicy hostToolPolicy() {
        return BUILD_TOOLS;
    }

    @Override
    protected RecipeTemplate recipeTemplate(ClassifiedDependencies dependencies, Platform hostPlatform, Platform buildPlatform) {
        Path root = manifest().root();
        return new RecipeTemplate(
            NoArchType.NONE,
            List.of(),
            CMakeBuildScript.render(root, buildPlatform.isWindows()),
            CMakeLanguages.detect(root),
            true
        );
    }

    @Override
    protected Platform targetPlatform(Platform hostPlatform) {
        return hostPlatform;
    }

    @Override
    protected List<String> inputGlobs() {
        return INPUT_GLOBS;
    }
}
