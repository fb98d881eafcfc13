package work.lcod.buildbackend.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.buildbackend.conda.Platform;
import work.lcod.buildbackend.shared.BackendException;
import work.lcod.buildbackend.shared.ErrorKind;

class ManifestLoaderTest {
    @Test
    void loadsFixtureWithoutVersion() {
        var path = Path.of("src", "test", "resources", "manifests", "python-demo", "pixi.toml").toAbsolutePath();
        ProjectManifest manifest = ManifestLoader.load(path);

        assertEquals("demo", manifest.name().orElseThrow());
        assertTrue(manifest.version().isEmpty());
        assertEquals("0dev0", manifest.versionOrDefault().toString());
        assertEquals(List.of("conda-forge"), manifest.channels());
        assertEquals("MIT", manifest.license().orElseThrow());
        assertEquals(path.getParent().normalize(), manifest.root());
        var run = manifest.defaultFeature().dependencies(SpecType.RUN, Platform.LINUX_64).orElseThrow();
        assertEquals(DependencySpec.version(">=1.0"), run.get("numpy").orElseThrow());
    }

    @Test
    void readsEveryDependencyForm() throws Exception {
        Path manifest = write("""
            [workspace]
            name = "forms"
            version = "2.0"
            channels = ["conda-forge", "bioconda"]
            platforms = ["linux-64", "win-64"]

            [dependencies]
            plain = "*"
            pinned = { version = ">=1.2", build = "py_0", channel = "conda-forge" }
            local = { path = "../local" }
            archive = { path = "./pkgs/archive-1.0-0.conda" }
            repo = { git = "https://github.com/example/repo.git", tag = "v1" }
            tarball = { url = "https://example.com/src.tar.gz" }

            [host-dependencies]
            python = "3.12.*"

            [build-dependencies]
            ninja = "*"
            """);
        ProjectManifest loaded = ManifestLoader.load(manifest);

        assertEquals(List.of("conda-forge", "bioconda"), loaded.channels());
        assertEquals(List.of(Platform.LINUX_64, Platform.WIN_64), loaded.platforms());
        var run = loaded.defaultFeature().dependencies(SpecType.RUN, Platform.LINUX_64).orElseThrow();
        assertEquals(6, run.size());
        var pinned = assertInstanceOf(DependencySpec.Binary.class, run.get("pinned").orElseThrow());
        assertEquals(">=1.2", pinned.version().toString());
        assertEquals("py_0", pinned.buildString().orElseThrow());
        assertEquals("conda-forge", pinned.channelName().orElseThrow());
        assertInstanceOf(DependencySpec.PathSource.class, run.get("local").orElseThrow());
        assertInstanceOf(DependencySpec.BinaryFile.class, run.get("archive").orElseThrow());
        var repo = assertInstanceOf(DependencySpec.GitSource.class, run.get("repo").orElseThrow());
        assertEquals("v1", repo.reference());
        assertInstanceOf(DependencySpec.UrlSource.class, run.get("tarball").orElseThrow());
        assertTrue(loaded.defaultFeature().dependencies(SpecType.HOST, Platform.LINUX_64).orElseThrow().containsKey("python"));
        assertTrue(loaded.defaultFeature().dependencies(SpecType.BUILD, Platform.LINUX_64).orElseThrow().containsKey("ninja"));
    }

    @Test
    void targetTablesOnlyApplyToTheirPlatform() throws Exception {
        Path manifest = write("""
            [project]
            name = "targets"

            [dependencies]
            numpy = ">=1.0"

            [target.win-64.dependencies]
            pywin32 = "*"
            numpy = ">=1.5"
            """);
        var feature = ManifestLoader.load(manifest).defaultFeature();

        var linux = feature.dependencies(SpecType.RUN, Platform.LINUX_64).orElseThrow();
        assertFalse(linux.containsKey("pywin32"));
        assertEquals(DependencySpec.version(">=1.0"), linux.get("numpy").orElseThrow());

        var windows = feature.dependencies(SpecType.RUN, Platform.WIN_64).orElseThrow();
        assertTrue(windows.containsKey("pywin32"));
        assertEquals(DependencySpec.version(">=1.5"), windows.get("numpy").orElseThrow());
        assertTrue(feature.dependencies(SpecType.HOST, Platform.WIN_64).isEmpty());
    }

    @Test
    void readsNamedFeatures() throws Exception {
        Path manifest = write("""
            [project]
            name = "features"

            [feature.test.dependencies]
            pytest = "*"
            """);
        var loaded = ManifestLoader.load(manifest);
        assertTrue(loaded.features().containsKey("test"));
        assertTrue(loaded.defaultFeature().dependencies(SpecType.RUN, Platform.LINUX_64).isEmpty());
    }

    @Test
    void missingFileIsAConfigurationError() throws Exception {
        Path missing = Files.createTempDirectory("lcod-test").resolve("pixi.toml");
        var error = assertThrows(BackendException.class, () -> ManifestLoader.load(missing));
        assertEquals(ErrorKind.CONFIGURATION, error.kind());
        assertTrue(error.getMessage().contains("failed to parse manifest"));
    }

    @Test
    void invalidContentIsAConfigurationError() throws Exception {
        var broken = assertThrows(BackendException.class, () -> ManifestLoader.load(write("[project\nname = ")));
        assertEquals(ErrorKind.CONFIGURATION, broken.kind());

        var noProject = assertThrows(BackendException.class, () -> ManifestLoader.load(write("[dependencies]\nnumpy = \"*\"\n")));
        assertTrue(noProject.getMessage().contains("[project]"));

        var badSpec = assertThrows(BackendException.class, () -> ManifestLoader.load(write("""
            [project]
            name = "bad"

            [dependencies]
            numpy = ">=one..two"
            """)));
        assertTrue(badSpec.getMessage().contains("dependency 'numpy'"));
    }

    private static Path write(String content) throws Exception {
        Path dir = Files.createTempDirectory("lcod-test");
        Path manifest = dir.resolve("pixi.toml");
        Files.writeString(manifest, content);
        return manifest;
    }
}
