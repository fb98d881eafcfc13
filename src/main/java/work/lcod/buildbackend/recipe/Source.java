package work.lcod.buildbackend.recipe;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Where the sources of a recipe come from.
 */
public sealed interface Source permits Source.PathSource, Source.GitSource, Source.UrlSource {

    record PathSource(Path path, boolean useGitignore) implements Source {
        public PathSource {
            path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
        }
    }

    record GitSource(URI url, String rev) implements Source {
        public GitSource {
            Objects.requireNonNull(url, "url");
        }

        public Optional<String> revision() {
            return Optional.ofNullable(rev);
        }
    }

    record UrlSource(URI url, String sha256) implements Source {
        public UrlSource {
            Objects.requireNonNull(url, "url");
        }

        public Optional<String> checksum() {
            return Optional.ofNullable(sha256);
        }
    }
}
