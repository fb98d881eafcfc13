package work.lcod.buildbackend.recipe;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import work.lcod.buildbackend.shared.BackendException;

/**
 * Directory layout of one build.
 *
 * @param recipeDir directory of the manifest the recipe was derived from
 * @param outputDir where built archives are written
 * @param buildDir per-build scratch directory below {@code outputDir/bld}
 * @param workDir source and rendered recipe directory inside {@code buildDir}
 */
public record Directories(Path recipeDir, Path outputDir, Path buildDir, Path workDir) {
    public Directories {
        Objects.requireNonNull(recipeDir, "recipeDir");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(buildDir, "buildDir");
        Objects.requireNonNull(workDir, "workDir");
    }

    /**
     * Computes and creates the layout. With {@code noBuildId} the build directory name does not
     * carry the timestamp, so repeated builds reuse it.
     */
    public static Directories setup(String name, Path manifestPath, Path outputDir, boolean noBuildId, Instant timestamp) {
        Path output = outputDir.toAbsolutePath().normalize();
        String dirName = noBuildId
            ? "rattler-build_" + name
            : "rattler-build_" + name + "_" + timestamp.toEpochMilli();
        Path buildDir = output.resolve("bld").resolve(dirName);
        Path workDir = buildDir.resolve("work");
        try {
            Files.createDirectories(workDir);
        } catch (IOException ex) {
            throw BackendException.artifactIo("failed to create build directory " + workDir, ex);
        }
        Path recipeDir = manifestPath.toAbsolutePath().normalize().getParent();
        return new Directories(recipeDir == null ? output : recipeDir, output, buildDir, workDir);
    }
}
