package work.lcod.buildbackend.recipe;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.buildbackend.shared.BackendException;

/**
 * A rendered recipe written to the build's work directory for the duration of one engine
 * operation. The file is removed when the operation succeeds and left in place when it fails so
 * it can be inspected.
 */
public final class TemporaryRenderedRecipe {
    private static final Logger log = LoggerFactory.getLogger(TemporaryRenderedRecipe.class);

    private final Path path;

    private TemporaryRenderedRecipe(Path path) {
        this.path = path;
    }

    /**
     * Renders the configuration's recipe into a new, uniquely named file below its work directory.
     */
    public static TemporaryRenderedRecipe create(BuildConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        Path workDir = configuration.directories().workDir();
        String content = RecipeRenderer.render(configuration.recipe());
        try {
            Files.createDirectories(workDir);
            Path file = Files.createTempFile(workDir, "rendered-recipe-", ".yaml");
            Files.writeString(file, content);
            log.debug("Wrote rendered recipe to {}", file);
            return new TemporaryRenderedRecipe(file);
        } catch (IOException ex) {
            throw BackendException.artifactIo("failed to write rendered recipe to " + workDir, ex);
        }
    }

    public Path path() {
        return path;
    }

    /**
     * Runs {@code operation} with the recipe path. Failures propagate unchanged and keep the
     * file; success deletes it before the result is returned.
     */
    public <T> T runWithin(Function<Path, T> operation) {
        T result;
        try {
            result = operation.apply(path);
        } catch (RuntimeException ex) {
            log.warn("Keeping rendered recipe {} for inspection", path);
            throw ex;
        }
        release();
        return result;
    }

    /**
     * Deletes the file. Safe to call when it is already gone.
     */
    public void release() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            throw BackendException.artifactIo("failed to delete rendered recipe " + path, ex);
        }
    }
}
