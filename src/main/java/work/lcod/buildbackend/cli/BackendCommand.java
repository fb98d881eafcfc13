package work.lcod.buildbackend.cli;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.buildbackend.api.BackendRunConfiguration;
import work.lcod.buildbackend.api.BackendRunner;
import work.lcod.buildbackend.api.LogLevel;
import work.lcod.buildbackend.conda.ChannelConfig;
import work.lcod.buildbackend.protocol.ChannelConfiguration;
import work.lcod.buildbackend.protocol.CondaBuildParams;
import work.lcod.buildbackend.protocol.CondaBuildResult;
import work.lcod.buildbackend.protocol.CondaBuiltPackage;
import work.lcod.buildbackend.protocol.CondaMetadataParams;
import work.lcod.buildbackend.protocol.CondaMetadataResult;
import work.lcod.buildbackend.protocol.FrontendCapabilities;
import work.lcod.buildbackend.protocol.InitializeParams;
import work.lcod.buildbackend.protocol.Protocol;
import work.lcod.buildbackend.protocol.ProtocolFactory;

/**
 * Command line of a backend executable. Without a subcommand it serves JSON-RPC over stdio, or
 * over loopback TCP with {@code --port}; the subcommands run one procedure directly against a
 * manifest.
 */
@CommandLine.Command(
    description = "Conda build backend speaking JSON-RPC over stdio or a local port.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class BackendCommand implements Callable<Integer> {
    private static final ObjectMapper YAML = new ObjectMapper(
        new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
    ).setSerializationInclusion(JsonInclude.Include.NON_NULL);
    private static final String MANIFEST_DEFAULT = "${env:PIXI_PROJECT_MANIFEST:-pixi.toml}";

    private final ProtocolFactory<?> factory;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = "--port",
        description = "Serve JSON-RPC on this loopback port instead of stdin/stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer port;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "More logging; repeat for more.")
    private boolean[] verbose = new boolean[0];

    @CommandLine.Option(names = {"-q", "--quiet"}, description = "Less logging; repeat for less.")
    private boolean[] quiet = new boolean[0];

    BackendCommand(ProtocolFactory<?> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    static int execute(String name, ProtocolFactory<?> factory, String... args) {
        return commandLine(name, factory).execute(args);
    }

    static CommandLine commandLine(String name, ProtocolFactory<?> factory) {
        return new CommandLine(new BackendCommand(factory))
            .setCommandName(name)
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }

    @Override
    public Integer call() throws Exception {
        var configuration = BackendRunConfiguration.builder()
            .port(Optional.ofNullable(port))
            .logLevel(logLevel())
            .build();
        Logging.configure(configuration.logLevel());
        new BackendRunner().run(configuration, factory);
        return 0;
    }

    @CommandLine.Command(
        name = "get-metadata",
        aliases = "get-conda-metadata",
        description = "Print the package metadata of a project as YAML."
    )
    int getMetadata(
        @CommandLine.Parameters(arity = "0..1", paramLabel = "MANIFEST", defaultValue = MANIFEST_DEFAULT,
            description = "Project manifest.") Path manifestPath
    ) throws Exception {
        Logging.configure(logLevel());
        Protocol protocol = initialize(manifestPath);
        CondaMetadataResult result = protocol.getCondaMetadata(
            new CondaMetadataParams(null, null, null, defaultChannelConfiguration(), null));
        PrintWriter out = spec.commandLine().getOut();
        out.print(YAML.writeValueAsString(result));
        out.flush();
        return 0;
    }

    @CommandLine.Command(
        name = "build",
        aliases = "conda-build",
        description = "Build the package of a project."
    )
    int build(
        @CommandLine.Parameters(arity = "0..1", paramLabel = "MANIFEST", defaultValue = MANIFEST_DEFAULT,
            description = "Project manifest.") Path manifestPath
    ) throws Exception {
        Logging.configure(logLevel());
        Protocol protocol = initialize(manifestPath);
        CondaBuildResult result = protocol.buildConda(
            new CondaBuildParams(null, null, null, defaultChannelConfiguration(), null, null));
        PrintWriter err = spec.commandLine().getErr();
        for (CondaBuiltPackage pkg : result.packages()) {
            err.println("Successfully built '" + pkg.outputFile() + "'");
            for (String glob : pkg.inputGlobs()) {
                err.println("  input: " + glob);
            }
        }
        err.flush();
        return 0;
    }

    private Protocol initialize(Path manifestPath) {
        var params = new InitializeParams(manifestPath.toAbsolutePath().normalize(), new FrontendCapabilities(), null);
        return factory.initialize(params).protocol();
    }

    private static ChannelConfiguration defaultChannelConfiguration() {
        return new ChannelConfiguration(ChannelConfig.DEFAULT_CHANNEL_ALIAS);
    }

    private LogLevel logLevel() {
        return LogLevel.fromVerbosity(verbose.length, quiet.length);
    }
}
