package work.lcod.buildbackend.backend.python;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.buildbackend.conda.ChannelConfig;
import work.lcod.buildbackend.conda.MatchSpec;
import work.lcod.buildbackend.conda.NoArchType;
import work.lcod.buildbackend.conda.Platform;
import work.lcod.buildbackend.protocol.CondaBuildParams;
import work.lcod.buildbackend.protocol.CondaMetadataParams;
import work.lcod.buildbackend.protocol.CondaOutputIdentifier;
import work.lcod.buildbackend.protocol.InitializeParams;
import work.lcod.buildbackend.shared.BackendException;
import work.lcod.buildbackend.shared.ErrorKind;
import work.lcod.buildbackend.support.RecordingEngine;

class PythonBuildBackendTest {
    private static final Path MANIFEST = Path.of("src", "test", "resources", "manifests", "python-demo", "pixi.toml");

    private RecordingEngine engine;
    private Path workDirectory;

    @BeforeEach
    void setUp() throws Exception {
        engine = new RecordingEngine();
        workDirectory = Files.createTempDirectory("lcod-test");
    }

    private PythonBuildBackend backend() {
        return new PythonBuildBackendFactory(engine)
            .initialize(new InitializeParams(MANIFEST, null, null))
            .protocol();
    }

    @Test
    void reportsNoarchPythonMetadata() {
        var result = backend().getCondaMetadata(new CondaMetadataParams(null, null, null, null, workDirectory));

        assertEquals(1, result.packages().size());
        var metadata = result.packages().get(0);
        assertEquals("demo", metadata.name());
        assertEquals("0dev0", metadata.version());
        assertEquals("pyh4616a5c_0", metadata.build());
        assertEquals(0, metadata.buildNumber());
        assertEquals(Platform.NOARCH, metadata.subdir());
        assertEquals("python", metadata.noarch());
        assertEquals("MIT", metadata.license());
        assertEquals(List.of("numpy >=1.0"), metadata.depends());
        assertEquals(PythonBuildBackend.INPUT_GLOBS, result.inputGlobs());
    }

    @Test
    void recipeAddsInstallerAndPythonToHost() {
        var recipe = backend().recipe(Platform.LINUX_64, Platform.LINUX_64, ChannelConfig.defaultWithRootDir(MANIFEST.getParent()));

        List<String> host = recipe.requirements().host().stream().map(MatchSpec::name).toList();
        assertTrue(host.containsAll(List.of("pip", "python")));
        assertEquals(List.of(MatchSpec.parse("numpy >=1.0")), recipe.requirements().run());
        assertEquals(List.of(), recipe.requirements().build());
        assertEquals(NoArchType.PYTHON, recipe.build().noarch());
        assertEquals(PythonBuildScript.render(Installer.PIP, false), recipe.build().script());
    }

    @Test
    void rendersRecipeIntoWorkDirectoryAndRemovesIt() {
        backend().getCondaMetadata(new CondaMetadataParams(null, null, null, null, workDirectory));

        Path recipeFile = engine.recipeFiles.get(0);
        assertTrue(recipeFile.startsWith(workDirectory.toAbsolutePath().normalize()));
        assertTrue(engine.recipeContents.get(0).contains("noarch: python"));
        assertFalse(Files.exists(recipeFile));
    }

    @Test
    void keepsRenderedRecipeWhenEngineFails() {
        engine.failingWith("solver gave up");
        var backend = backend();

        var error = assertThrows(BackendException.class,
            () -> backend.getCondaMetadata(new CondaMetadataParams(null, null, null, null, workDirectory)));
        assertEquals(ErrorKind.ENGINE, error.kind());
        assertTrue(Files.exists(engine.recipeFiles.get(0)));
    }

    @Test
    void buildsNoarchArchive() {
        var result = backend().buildConda(new CondaBuildParams(List.of(), null, null, null, null, workDirectory));

        assertEquals(1, result.packages().size());
        var built = result.packages().get(0);
        assertEquals("demo", built.name());
        assertEquals("0dev0", built.version());
        assertEquals(Platform.NOARCH, built.subdir());
        assertTrue(Files.exists(built.outputFile()));
        assertEquals(Platform.NOARCH, engine.configurations.get(0).targetPlatform());
    }

    @Test
    void rejectsOutputsOfOtherPackages() {
        var backend = backend();
        var outputs = List.of(new CondaOutputIdentifier("other", null, null, null));

        var error = assertThrows(BackendException.class,
            () -> backend.buildConda(new CondaBuildParams(List.of(), null, null, null, outputs, workDirectory)));
        assertEquals(ErrorKind.CONFIGURATION, error.kind());
        assertTrue(engine.configurations.isEmpty());
    }

    @Test
    void channelOverrideReplacesManifestChannels() {
        var channels = List.of(URI.create("https://example.org/my-channel/"));
        backend().getCondaMetadata(new CondaMetadataParams(null, null, channels, null, workDirectory));

        assertEquals(channels, engine.configurations.get(0).channels());
    }

    @Test
    void usesManifestChannels() {
        backend().getCondaMetadata(new CondaMetadataParams(null, null, null, null, workDirectory));

        assertEquals(
            List.of(URI.create("https://conda.anaconda.org/conda-forge/")),
            engine.configurations.get(0).channels()
        );
    }

    @Test
    void factoryRequiresName() {
        var factory = new PythonBuildBackendFactory(engine);
        var params = new InitializeParams(Path.of("src", "test", "resources", "manifests", "no-name", "pixi.toml"), null, null);

        var error = assertThrows(BackendException.class, () -> factory.initialize(params));
        assertEquals(ErrorKind.CONFIGURATION, error.kind());
        assertTrue(error.getMessage().contains("'name'"));
    }

    @Test
    void factoryAdvertisesBothProcedures() {
        var initialized = new PythonBuildBackendFactory(engine).initialize(new InitializeParams(MANIFEST, null, Path.of("cache")));

        assertEquals(Boolean.TRUE, initialized.result().capabilities().providesCondaMetadata());
        assertEquals(Boolean.TRUE, initialized.result().capabilities().providesCondaBuild());
        assertEquals("demo", initialized.protocol().manifest().name().orElseThrow());
    }

    @Test
    void installerFollowsDeclaredDependencies() throws Exception {
        Path project = Files.createTempDirectory("lcod-test");
        Path manifest = Files.writeString(project.resolve("pixi.toml"), """
            [project]
            name = "fast"
            channels = ["conda-forge"]
            platforms = []

            [host-dependencies]
            uv = "*"
            """);
        var recipe = new PythonBuildBackendFactory(engine)
            .initialize(new InitializeParams(manifest, null, null))
            .protocol()
            .recipe(Platform.WIN_64, Platform.WIN_64, ChannelConfig.defaultWithRootDir(project));

        assertEquals(PythonBuildScript.render(Installer.UV, true), recipe.build().script());
        List<String> host = recipe.requirements().host().stream().map(MatchSpec::name).toList();
        assertTrue(host.contains("uv"));
        assertFalse(host.contains("pip"));
    }

    @Test
    void scriptsPerInstaller() {
        assertEquals(
            List.of("$PYTHON -m pip install --ignore-installed -vv --no-deps --no-build-isolation ."),
            PythonBuildScript.render(Installer.PIP, false)
        );
        assertEquals(
            List.of("uv pip install --python %PYTHON% -vv --no-deps --no-build-isolation .", "if errorlevel 1 exit 1"),
            PythonBuildScript.render(Installer.UV, true)
        );
    }

    @Test
    void cacheDirectoryReachesEngine() {
        new PythonBuildBackendFactory(engine)
            .initialize(new InitializeParams(MANIFEST, null, Path.of("cache")))
            .protocol()
            .getCondaMetadata(new CondaMetadataParams(null, null, null, null, workDirectory));

        assertEquals(Optional.of(Path.of("cache")), engine.configurations.get(0).cacheDirectory());
    }
}
