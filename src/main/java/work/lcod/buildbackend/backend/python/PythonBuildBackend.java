package work.lcod.buildbackend.backend.python;

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
import work.lcod.buildbackend.recipe.Source;

/**
 * Builds pure Python projects into {@code noarch: python} packages with pip or uv.
 */
public final class PythonBuildBackend extends AbstractBuildBackend {
    static final List<String> INPUT_GLOBS = List.of(
        "**/*.py",
        "**/*.pyx",
        "**/*.c",
        "**/*.cpp",
        "**/*.sh",
        "**/*.json",
        "**/*.yaml",
        "**/*.yml",
        "**/*.txt",
        "setup.py",
        "setup.cfg",
        "pyproject.toml",
        "requirements*.txt",
        "Pipfile",
        "Pipfile.lock",
        "poetry.lock",
        "tox.ini",
        "Makefile",
        "MANIFEST.in",
        "tests/**/*.py",
        "docs/**/*.rst",
        "docs/**/*.md",
        "VERSION",
        "version.py"
    );

    public PythonBuildBackend(ProjectManifest manifest, BuildEngine engine, Optional<Path> cacheDirectory) {
        super(manifest, engine, cacheDirectory);
    }

    @Override
    protected HostToolPolicy hostToolPolicy() {
        return dependencies -> List.of(Installer.detect(dependencies).packageName(), "python");
    }

    @Override
    protected RecipeTemplate recipeTemplate(ClassifiedDependencies dependencies, Platform hostPlatform, Platform buildPlatform) {
        Installer installer = Installer.detect(dependencies);
        return new RecipeTemplate(
            NoArchType.PYTHON,
            List.of(new Source.PathSource(manifest().root(), true)),
            PythonBuildScript.render(installer, buildPlatform.isWindows()),
            List.of(),
            true
        );
    }

    @Override
    protected Platform targetPlatform(Platform hostPlatform) {
        return Platform.NOARCH;
    }

    @Override
    protected List<String> inputGlobs() {
        return INPUT_GLOBS;
    }
}
