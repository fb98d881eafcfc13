package work.lcod.buildbackend.recipe;

import java.net.URI;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.buildbackend.conda.Platform;
import work.lcod.buildbackend.conda.PlatformWithVirtualPackages;

/**
 * Everything a build engine needs besides the rendered recipe file.
 */
public record BuildConfiguration(
    Recipe recipe,
    Directories directories,
    List<URI> channels,
    Platform targetPlatform,
    PlatformWithVirtualPackages hostPlatform,
    PlatformWithVirtualPackages buildPlatform,
    Instant timestamp,
    Optional<Path> cacheDirectory
) {
    public BuildConfiguration {
        Objects.requireNonNull(recipe, "recipe");
        Objects.requireNonNull(directories, "directories");
        channels = List.copyOf(channels);
        Objects.requireNonNull(targetPlatform, "targetPlatform");
        Objects.requireNonNull(hostPlatform, "hostPlatform");
        Objects.requireNonNull(buildPlatform, "buildPlatform");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(cacheDirectory, "cacheDirectory");
    }
}
