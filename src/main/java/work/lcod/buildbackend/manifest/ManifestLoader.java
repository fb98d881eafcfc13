package work.lcod.buildbackend.manifest;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.buildbackend.conda.Platform;
import work.lcod.buildbackend.conda.Version;
import work.lcod.buildbackend.conda.VersionSpec;
import work.lcod.buildbackend.shared.BackendException;

/**
 * Reads {@code pixi.toml} style manifests into {@link ProjectManifest} instances.
 */
public final class ManifestLoader {
    private static final List<String> PROJECT_TABLES = List.of("project", "workspace");

    private ManifestLoader() {}

    public static ProjectManifest load(Path manifestPath) {
        if (manifestPath == null) {
            throw BackendException.configuration("no manifest path given");
        }
        Path path = manifestPath.toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw BackendException.configuration("failed to parse manifest from " + path + ": file does not exist");
        }
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException ex) {
            throw BackendException.configuration("failed to read manifest from " + path, ex);
        }
        try {
            return parse(path, content);
        } catch (IllegalArgumentException | TomlInvalidTypeException ex) {
            throw BackendException.configuration("failed to parse manifest from " + path + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Parses manifest text; {@code path} only anchors the project root.
     */
    public static ProjectManifest parse(Path path, String content) {
        TomlParseResult toml = Toml.parse(content);
        if (toml.hasErrors()) {
            String errors = toml.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("invalid TOML: " + errors);
        }

        TomlTable project = null;
        for (String table : PROJECT_TABLES) {
            if (toml.isTable(table)) {
                project = toml.getTable(table);
                break;
            }
        }
        if (project == null) {
            throw new IllegalArgumentException("missing [project] table");
        }

        var builder = ProjectManifest.builder(path)
            .name(project.getString("name"))
            .description(project.getString("description"))
            .license(project.getString("license"))
            .homepage(project.getString("homepage"))
            .repository(project.getString("repository"));
        String version = project.getString("version");
        if (version != null) {
            builder.version(Version.parse(version));
        }
        readChannels(project.getArray("channels")).forEach(builder::channel);
        readPlatforms(project.getArray("platforms")).forEach(builder::platform);

        builder.defaultFeature(readFeature(Feature.DEFAULT_NAME, toml));
        TomlTable features = toml.getTable("feature");
        if (features != null) {
            for (String featureName : features.keySet()) {
                TomlTable featureTable = features.getTable(List.of(featureName));
                if (featureTable != null) {
                    builder.feature(readFeature(featureName, featureTable));
                }
            }
        }
        return builder.build();
    }

    private static List<String> readChannels(TomlArray array) {
        if (array == null) {
            return List.of();
        }
        List<String> channels = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            Object value = array.get(i);
            if (value instanceof String channel) {
                channels.add(channel);
            } else if (value instanceof TomlTable table && table.getString("channel") != null) {
                channels.add(table.getString("channel"));
            } else {
                throw new IllegalArgumentException("channels[" + i + "] must be a string or a table with a 'channel' key");
            }
        }
        return channels;
    }

    private static List<Platform> readPlatforms(TomlArray array) {
        if (array == null) {
            return List.of();
        }
        List<Platform> platforms = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            Object value = array.get(i);
            if (!(value instanceof String raw)) {
                throw new IllegalArgumentException("platforms[" + i + "] must be a string");
            }
            platforms.add(Platform.parse(raw));
        }
        return platforms;
    }

    private static Feature readFeature(String name, TomlTable table) {
        Map<SpecType, DependencySet> dependencies = readDependencyTables(table);
        Map<Platform, Map<SpecType, DependencySet>> targets = new LinkedHashMap<>();
        TomlTable targetTable = table.getTable("target");
        if (targetTable != null) {
            for (String selector : targetTable.keySet()) {
                TomlTable perTarget = targetTable.getTable(List.of(selector));
                if (perTarget != null) {
                    targets.put(Platform.parse(selector), readDependencyTables(perTarget));
                }
            }
        }
        return new Feature(name, dependencies, targets);
    }

    private static Map<SpecType, DependencySet> readDependencyTables(TomlTable table) {
        Map<SpecType, DependencySet> result = new EnumMap<>(SpecType.class);
        for (SpecType type : SpecType.values()) {
            TomlTable dependencies = table.getTable(List.of(type.tableName()));
            if (dependencies == null) {
                continue;
            }
            var set = new DependencySet();
            for (String packageName : dependencies.keySet()) {
                set.put(packageName, readSpec(packageName, dependencies.get(List.of(packageName))));
            }
            result.put(type, set);
        }
        return result;
    }

    static DependencySpec readSpec(String packageName, Object value) {
        try {
            if (value instanceof String constraint) {
                return DependencySpec.version(constraint);
            }
            if (value instanceof TomlTable table) {
                return readTableSpec(table);
            }
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("dependency '" + packageName + "': " + ex.getMessage(), ex);
        }
        throw new IllegalArgumentException("dependency '" + packageName + "' must be a string or a table");
    }

    private static DependencySpec readTableSpec(TomlTable table) {
        String path = table.getString("path");
        if (path != null) {
            return isArchive(path) ? new DependencySpec.BinaryFile(path) : new DependencySpec.PathSource(path);
        }
        String git = table.getString("git");
        if (git != null) {
            String reference = firstNonNull(table.getString("rev"), table.getString("tag"), table.getString("branch"));
            return new DependencySpec.GitSource(URI.create(git), reference);
        }
        String url = table.getString("url");
        if (url != null) {
            return isArchive(url) ? new DependencySpec.BinaryFile(url) : new DependencySpec.UrlSource(URI.create(url));
        }
        String version = table.getString("version");
        return new DependencySpec.Binary(
            version == null ? VersionSpec.ANY : VersionSpec.parse(version),
            table.getString("build"),
            table.getString("channel")
        );
    }

    private static boolean isArchive(String location) {
        String lower = location.toLowerCase(Locale.ROOT);
        return lower.endsWith(".conda") || lower.endsWith(".tar.bz2");
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
