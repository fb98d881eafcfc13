package work.lcod.buildbackend.engine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Helpers for conda package archives ({@code name-version-build.conda} or {@code .tar.bz2}).
 */
public final class PackageArchives {
    public static final List<String> EXTENSIONS = List.of(".conda", ".tar.bz2");

    private PackageArchives() {}

    public record ArchiveIdentity(String name, String version, String build) {
        public ArchiveIdentity {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(version, "version");
            Objects.requireNonNull(build, "build");
        }
    }

    public static boolean isArchive(Path path) {
        String fileName = path.getFileName().toString();
        return EXTENSIONS.stream().anyMatch(fileName::endsWith);
    }

    /**
     * Splits an archive file name into name, version and build string. Package names may
     * contain dashes; version and build string may not.
     */
    public static ArchiveIdentity identify(Path archive) {
        String fileName = archive.getFileName().toString();
        String stem = null;
        for (String extension : EXTENSIONS) {
            if (fileName.endsWith(extension)) {
                stem = fileName.substring(0, fileName.length() - extension.length());
                break;
            }
        }
        if (stem == null) {
            throw new IllegalArgumentException("not a package archive: " + fileName);
        }
        int buildDash = stem.lastIndexOf('-');
        int versionDash = buildDash > 0 ? stem.lastIndexOf('-', buildDash - 1) : -1;
        if (versionDash <= 0) {
            throw new IllegalArgumentException("archive name '" + fileName + "' is not of the form name-version-build");
        }
        return new ArchiveIdentity(
            stem.substring(0, versionDash),
            stem.substring(versionDash + 1, buildDash),
            stem.substring(buildDash + 1)
        );
    }

    /**
     * Archives below {@code outputDir} (one level of subdir directories) modified at or after
     * {@code since}.
     */
    public static List<Path> findSince(Path outputDir, FileTime since) throws IOException {
        List<Path> found = new ArrayList<>();
        if (!Files.isDirectory(outputDir)) {
            return found;
        }
        try (Stream<Path> files = Files.walk(outputDir, 2)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                if (Files.isRegularFile(file)
                    && isArchive(file)
                    && Files.getLastModifiedTime(file).compareTo(since) >= 0) {
                    found.add(file);
                }
            }
        }
        found.sort(null);
        return found;
    }
}
