package work.lcod.buildbackend.manifest;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.buildbackend.conda.ChannelConfig;
import work.lcod.buildbackend.conda.Platform;
import work.lcod.buildbackend.conda.Version;

/**
 * Immutable view of a project manifest ({@code pixi.toml}).
 */
public record ProjectManifest(
    Path path,
    Optional<String> name,
    Optional<Version> version,
    Optional<String> description,
    Optional<String> license,
    Optional<String> homepage,
    Optional<String> repository,
    List<String> channels,
    List<Platform> platforms,
    Feature defaultFeature,
    Map<String, Feature> features
) {
    /**
     * Version used for projects that do not declare one, so they remain buildable.
     */
    public static final Version DEFAULT_VERSION = Version.parse("0dev0");

    public ProjectManifest {
        path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(license, "license");
        Objects.requireNonNull(homepage, "homepage");
        Objects.requireNonNull(repository, "repository");
        channels = List.copyOf(channels);
        platforms = List.copyOf(platforms);
        Objects.requireNonNull(defaultFeature, "defaultFeature");
        features = Map.copyOf(features);
    }

    public static Builder builder(Path path) {
        return new Builder(path);
    }

    /**
     * Directory containing the manifest; the project's source root.
     */
    public Path root() {
        Path parent = path.getParent();
        if (parent == null) {
            throw new IllegalStateException("manifest path should have a parent: " + path);
        }
        return parent;
    }

    public Version versionOrDefault() {
        return version.orElse(DEFAULT_VERSION);
    }

    /**
     * An empty platform list places no restriction on the target platform.
     */
    public boolean supportsTargetPlatform(Platform platform) {
        return platforms.isEmpty() || platforms.contains(platform);
    }

    public List<URI> resolvedChannels(ChannelConfig channelConfig) {
        List<URI> resolved = new ArrayList<>(channels.size());
        for (String channel : channels) {
            resolved.add(channelConfig.resolveChannel(channel));
        }
        return resolved;
    }

    public static final class Builder {
        private final Path path;
        private String name;
        private Version version;
        private String description;
        private String license;
        private String homepage;
        private String repository;
        private final List<String> channels = new ArrayList<>();
        private final List<Platform> platforms = new ArrayList<>();
        private Feature defaultFeature = Feature.empty(Feature.DEFAULT_NAME);
        private final Map<String, Feature> features = new LinkedHashMap<>();

        private Builder(Path path) {
            this.path = path;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(Version version) {
            this.version = version;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder license(String license) {
            this.license = license;
            return this;
        }

        public Builder homepage(String homepage) {
            this.homepage = homepage;
            return this;
        }

        public Builder repository(String repository) {
            this.repository = repository;
            return this;
        }

        public Builder channel(String channel) {
            this.channels.add(channel);
            return this;
        }

        public Builder platform(Platform platform) {
            this.platforms.add(platform);
            return this;
        }

        public Builder defaultFeature(Feature feature) {
            this.defaultFeature = feature;
            return this;
        }

        public Builder feature(Feature feature) {
            this.features.put(feature.name(), feature);
            return this;
        }

        public ProjectManifest build() {
            return new ProjectManifest(
                path,
                Optional.ofNullable(name),
                Optional.ofNullable(version),
                Optional.ofNullable(description),
                Optional.ofNullable(license),
                Optional.ofNullable(homepage),
                Optional.ofNullable(repository),
                channels,
                platforms,
                defaultFeature,
                features
            );
        }
    }
}
