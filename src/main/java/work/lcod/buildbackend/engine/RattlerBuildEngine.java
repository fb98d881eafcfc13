package work.lcod.buildbackend.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.buildbackend.conda.GenericVirtualPackage;
import work.lcod.buildbackend.recipe.BuildConfiguration;
import work.lcod.buildbackend.shared.BackendException;

/**
 * {@link BuildEngine} running the {@code rattler-build} executable as a child process. The
 * child's stdout is captured; its stderr is forwarded to ours so stdout stays free for protocol
 * traffic.
 */
public final class RattlerBuildEngine implements BuildEngine {
    private static final Logger log = LoggerFactory.getLogger(RattlerBuildEngine.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    public static final String EXECUTABLE_ENV = "RATTLER_BUILD";
    private static final Map<String, String> OVERRIDE_VARIABLES = Map.of(
        "__glibc", "CONDA_OVERRIDE_GLIBC",
        "__cuda", "CONDA_OVERRIDE_CUDA",
        "__osx", "CONDA_OVERRIDE_OSX",
        "__linux", "CONDA_OVERRIDE_LINUX"
    );

    private final String executable;

    public RattlerBuildEngine(String executable) {
        this.executable = Objects.requireNonNull(executable, "executable");
    }

    /**
     * Uses {@code $RATTLER_BUILD} when set, else {@code rattler-build} from the PATH.
     */
    public static RattlerBuildEngine fromEnvironment() {
        String configured = System.getenv(EXECUTABLE_ENV);
        return new RattlerBuildEngine(configured == null || configured.isBlank() ? "rattler-build" : configured);
    }

    @Override
    public ResolvedDependencies resolveDependencies(BuildConfiguration configuration, Path recipeFile) {
        List<String> command = baseCommand(configuration, recipeFile);
        command.add("--render-only");
        command.add("--with-solve");
        String output = run(command, configuration);
        try {
            return parseRenderOutput(JSON.readTree(output), configuration.recipe().name());
        } catch (IOException ex) {
            throw BackendException.engine("rattler-build produced unreadable render output: " + ex.getMessage(), ex);
        }
    }

    @Override
    public List<Path> build(BuildConfiguration configuration, Path recipeFile) {
        FileTime started = FileTime.from(Instant.now().truncatedTo(ChronoUnit.SECONDS));
        run(baseCommand(configuration, recipeFile), configuration);
        try {
            List<Path> archives = PackageArchives.findSince(configuration.directories().outputDir(), started);
            if (archives.isEmpty()) {
                throw BackendException.engine(
                    "rattler-build finished without producing a package in " + configuration.directories().outputDir());
            }
            return archives;
        } catch (IOException ex) {
            throw BackendException.artifactIo("failed to list built packages: " + ex.getMessage(), ex);
        }
    }

    List<String> baseCommand(BuildConfiguration configuration, Path recipeFile) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("build");
        command.add("--recipe");
        command.add(recipeFile.toString());
        command.add("--output-dir");
        command.add(configuration.directories().outputDir().toString());
        command.add("--target-platform");
        command.add(configuration.targetPlatform().subdir());
        command.add("--host-platform");
        command.add(configuration.hostPlatform().platform().subdir());
        command.add("--build-platform");
        command.add(configuration.buildPlatform().platform().subdir());
        for (URI channel : configuration.channels()) {
            command.add("--channel");
            command.add(channel.toString());
        }
        return command;
    }

    private String run(List<String> command, BuildConfiguration configuration) {
        log.info("Running {}", String.join(" ", command));
        var builder = new ProcessBuilder(command)
            .directory(configuration.directories().workDir().toFile())
            .redirectError(ProcessBuilder.Redirect.INHERIT);
        for (GenericVirtualPackage pkg : configuration.hostPlatform().virtualPackages()) {
            String variable = OVERRIDE_VARIABLES.get(pkg.name());
            if (variable != null) {
                builder.environment().put(variable, pkg.version());
            }
        }
        configuration.cacheDirectory()
            .ifPresent(cache -> builder.environment().put("RATTLER_CACHE_DIR", cache.toString()));
        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw BackendException.engine("failed to start " + executable + ": " + ex.getMessage(), ex);
        }
        try (InputStream stdout = process.getInputStream()) {
            String output = new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw BackendException.engine(executable + " exited with code " + exitCode + tail(output));
            }
            return output;
        } catch (IOException ex) {
            process.destroyForcibly();
            throw BackendException.engine("failed to read output of " + executable + ": " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw BackendException.engine("interrupted while waiting for " + executable, ex);
        }
    }

    /**
     * Reads the JSON printed by {@code --render-only --with-solve}: an array with one entry per
     * output, each carrying the resolved build string and the finalized run dependencies.
     */
    static ResolvedDependencies parseRenderOutput(JsonNode root, String packageName) {
        JsonNode output = root.isArray() ? selectOutput(root, packageName) : root;
        if (output == null || output.isMissingNode()) {
            throw BackendException.engine("rattler-build did not render an output for " + packageName);
        }
        String buildString = output.path("recipe").path("build").path("string").asText("");
        if (buildString.isEmpty()) {
            throw BackendException.engine("rattler-build did not resolve a build string for " + packageName);
        }
        JsonNode run = output.path("finalized_dependencies").path("run");
        return new ResolvedDependencies(buildString, specs(run.path("depends")), specs(run.path("constraints")));
    }

    private static JsonNode selectOutput(JsonNode outputs, String packageName) {
        for (JsonNode output : outputs) {
            if (packageName.equals(output.path("recipe").path("package").path("name").asText())) {
                return output;
            }
        }
        return outputs.size() > 0 ? outputs.get(0) : null;
    }

    private static List<String> specs(JsonNode array) {
        List<String> specs = new ArrayList<>();
        for (JsonNode entry : array) {
            if (entry.isTextual()) {
                specs.add(entry.asText());
            } else if (entry.has("spec")) {
                specs.add(entry.get("spec").asText());
            } else if (entry.has("pin_subpackage")) {
                specs.add(entry.get("pin_subpackage").asText());
            }
        }
        return specs;
    }

    private static String tail(String output) {
        String trimmed = output.strip();
        if (trimmed.isEmpty()) {
            return "";
        }
        return ": " + (trimmed.length() > 2000 ? trimmed.substring(trimmed.length() - 2000) : trimmed);
    }
}
