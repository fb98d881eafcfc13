package work.lcod.buildbackend.manifest;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import work.lcod.buildbackend.conda.VersionSpec;

/**
 * How a dependency is declared in the manifest: a binary package constraint, a direct archive,
 * or a source tree (local path, git repository or source archive URL).
 */
public sealed interface DependencySpec
    permits DependencySpec.Binary, DependencySpec.BinaryFile, DependencySpec.PathSource,
        DependencySpec.GitSource, DependencySpec.UrlSource {

    static DependencySpec any() {
        return new Binary(VersionSpec.ANY, null, null);
    }

    static DependencySpec version(String constraint) {
        return new Binary(VersionSpec.parse(constraint), null, null);
    }

    default boolean isSource() {
        return this instanceof PathSource || this instanceof GitSource || this instanceof UrlSource;
    }

    /**
     * A package resolved from channels, optionally pinned to a build string or channel.
     */
    record Binary(VersionSpec version, String build, String channel) implements DependencySpec {
        public Binary {
            version = version == null ? VersionSpec.ANY : version;
        }

        public Optional<String> buildString() {
            return Optional.ofNullable(build);
        }

        public Optional<String> channelName() {
            return Optional.ofNullable(channel);
        }
    }

    /**
     * A prebuilt {@code .conda} / {@code .tar.bz2} archive given by path or URL.
     */
    record BinaryFile(String location) implements DependencySpec {
        public BinaryFile {
            Objects.requireNonNull(location, "location");
        }
    }

    record PathSource(String path) implements DependencySpec {
        public PathSource {
            Objects.requireNonNull(path, "path");
        }
    }

    record GitSource(URI url, String reference) implements DependencySpec {
        public GitSource {
            Objects.requireNonNull(url, "url");
        }
    }

    record UrlSource(URI url) implements DependencySpec {
        public UrlSource {
            Objects.requireNonNull(url, "url");
        }
    }
}
