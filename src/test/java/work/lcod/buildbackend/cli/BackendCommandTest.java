package work.lcod.buildbackend.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import work.lcod.buildbackend.backend.python.PythonBuildBackendFactory;
import work.lcod.buildbackend.support.RecordingEngine;

class BackendCommandTest {
    private static final Path MANIFESTS = Path.of("src", "test", "resources", "manifests");

    private record Run(int exitCode, String out, String err) {}

    private static Run run(CommandLine commandLine, String... args) {
        var out = new StringWriter();
        var err = new StringWriter();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        int exitCode = commandLine.execute(args);
        return new Run(exitCode, out.toString(), err.toString());
    }

    @Test
    void getMetadataPrintsYaml() {
        var engine = new RecordingEngine();
        var commandLine = BackendCommand.commandLine("pixi-build-python", new PythonBuildBackendFactory(engine));

        var result = run(commandLine, "-q", "get-metadata", MANIFESTS.resolve("python-demo").resolve("pixi.toml").toString());

        assertEquals(0, result.exitCode(), result.err());
        assertTrue(result.out().contains("name: demo"), result.out());
        assertTrue(result.out().contains("subdir: noarch"), result.out());
        assertTrue(result.out().contains("inputGlobs:"), result.out());
        assertEquals(1, engine.configurations.size());
    }

    @Test
    void buildReportsArchives() {
        var engine = new RecordingEngine();
        var commandLine = BackendCommand.commandLine("pixi-build-python", new PythonBuildBackendFactory(engine));

        var result = run(commandLine, "-q", "conda-build", MANIFESTS.resolve("python-demo").resolve("pixi.toml").toString());

        assertEquals(0, result.exitCode(), result.err());
        assertTrue(result.err().contains("Successfully built '"), result.err());
        assertTrue(result.err().contains("demo-0dev0-pyh4616a5c_0.conda"), result.err());
        assertTrue(result.err().contains("  input: pyproject.toml"), result.err());
    }

    @Test
    void missingManifestFailsWithShortMessage() {
        var commandLine = BackendCommand.commandLine("pixi-build-python", new PythonBuildBackendFactory(new RecordingEngine()));

        var result = run(commandLine, "-q", "get-metadata", MANIFESTS.resolve("absent").resolve("pixi.toml").toString());

        assertEquals(1, result.exitCode());
        assertTrue(result.err().contains("lcod::configuration: failed to parse manifest"), result.err());
    }

    @Test
    void rejectsNegativePort() {
        var commandLine = BackendCommand.commandLine("pixi-build-python", new PythonBuildBackendFactory(new RecordingEngine()));

        var result = run(commandLine, "--port", "-1");

        assertEquals(1, result.exitCode());
        assertTrue(result.err().contains("port out of range"), result.err());
    }

    @Test
    void versionNamesTheProject() {
        var commandLine = BackendCommand.commandLine("pixi-build-python", new PythonBuildBackendFactory(new RecordingEngine()));

        var result = run(commandLine, "--version");

        assertEquals(0, result.exitCode());
        assertTrue(result.out().startsWith("lcod-build-backend (java) "), result.out());
    }
}
