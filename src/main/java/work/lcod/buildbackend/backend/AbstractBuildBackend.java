package work.lcod.buildbackend.backend;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.buildbackend.conda.ChannelConfig;
import work.lcod.buildbackend.conda.GenericVirtualPackage;
import work.lcod.buildbackend.conda.Platform;
import work.lcod.buildbackend.conda.PlatformWithVirtualPackages;
import work.lcod.buildbackend.dependencies.ClassifiedDependencies;
import work.lcod.buildbackend.dependencies.DependencyClassifier;
import work.lcod.buildbackend.dependencies.HostToolPolicy;
import work.lcod.buildbackend.engine.BuildEngine;
import work.lcod.buildbackend.engine.PackageArchives;
import work.lcod.buildbackend.engine.ResolvedDependencies;
import work.lcod.buildbackend.manifest.ProjectManifest;
import work.lcod.buildbackend.protocol.BackendCapabilities;
import work.lcod.buildbackend.protocol.ChannelConfiguration;
import work.lcod.buildbackend.protocol.CondaBuildParams;
import work.lcod.buildbackend.protocol.CondaBuildResult;
import work.lcod.buildbackend.protocol.CondaBuiltPackage;
import work.lcod.buildbackend.protocol.CondaMetadataParams;
import work.lcod.buildbackend.protocol.CondaMetadataResult;
import work.lcod.buildbackend.protocol.CondaOutputIdentifier;
import work.lcod.buildbackend.protocol.CondaPackageMetadata;
import work.lcod.buildbackend.protocol.FrontendCapabilities;
import work.lcod.buildbackend.protocol.PlatformAndVirtualPackages;
import work.lcod.buildbackend.protocol.Protocol;
import work.lcod.buildbackend.recipe.BuildConfiguration;
import work.lcod.buildbackend.recipe.Directories;
import work.lcod.buildbackend.recipe.Recipe;
import work.lcod.buildbackend.recipe.RecipeBuilder;
import work.lcod.buildbackend.recipe.RecipeTemplate;
import work.lcod.buildbackend.recipe.TemporaryRenderedRecipe;
import work.lcod.buildbackend.shared.BackendException;

/**
 * Metadata and build procedures shared by all ecosystems. Subclasses provide the ecosystem
 * policy: which host tools are implied, what the recipe's script, sources and compilers are, and
 * which platform the package targets.
 */
public abstract class AbstractBuildBackend implements Protocol {
    private static final Logger log = LoggerFactory.getLogger(AbstractBuildBackend.class);

    private final ProjectManifest manifest;
    private final BuildEngine engine;
    private final Optional<Path> cacheDirectory;

    protected AbstractBuildBackend(ProjectManifest manifest, BuildEngine engine, Optional<Path> cacheDirectory) {
        this.manifest = Objects.requireNonNull(manifest, "manifest");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.cacheDirectory = Objects.requireNonNull(cacheDirectory, "cacheDirectory");
    }

    public ProjectManifest manifest() {
        return manifest;
    }

    /**
     * Both procedures are implemented, whatever the frontend announces.
     */
    public BackendCapabilities capabilities(FrontendCapabilities frontend) {
        return new BackendCapabilities(true, true);
    }

    protected abstract HostToolPolicy hostToolPolicy();

    protected abstract RecipeTemplate recipeTemplate(
        ClassifiedDependencies dependencies,
        Platform hostPlatform,
        Platform buildPlatform
    );

    protected abstract Platform targetPlatform(Platform hostPlatform);

    /**
     * Globs, relative to the project root, of the files the built package depends on.
     */
    protected abstract List<String> inputGlobs();

    /**
     * Derives a fresh recipe for the given platforms. Nothing is cached between calls.
     */
    public Recipe recipe(Platform hostPlatform, Platform buildPlatform, ChannelConfig channelConfig) {
        ClassifiedDependencies dependencies = new DependencyClassifier(hostToolPolicy()).classify(manifest, hostPlatform);
        RecipeTemplate template = recipeTemplate(dependencies, hostPlatform, buildPlatform);
        return new RecipeBuilder(channelConfig).build(manifest, dependencies, hostPlatform, template);
    }

    @Override
    public CondaMetadataResult getCondaMetadata(CondaMetadataParams params) {
        ChannelConfig channelConfig = channelConfig(params.channelConfiguration());
        List<URI> channels = channels(params.channelBaseUrls(), channelConfig);
        PlatformWithVirtualPackages host = platformOrCurrent(params.hostPlatform());
        PlatformWithVirtualPackages build = platformOrCurrent(params.buildPlatform());
        requireSupported(host.platform());

        Recipe recipe = recipe(host.platform(), build.platform(), channelConfig);
        BuildConfiguration configuration = configuration(recipe, channels, host, build, params.workDirectory());
        log.info("Resolving dependencies of {} {} for {}", recipe.name(), recipe.version(), host.platform());
        ResolvedDependencies resolved = TemporaryRenderedRecipe.create(configuration)
            .runWithin(recipeFile -> engine.resolveDependencies(configuration, recipeFile));

        var metadata = new CondaPackageMetadata(
            recipe.name(),
            recipe.version().toString(),
            resolved.buildString(),
            recipe.build().number(),
            configuration.targetPlatform(),
            resolved.depends(),
            resolved.constraints(),
            recipe.about().license().orElse(null),
            recipe.about().licenseFamily().orElse(null),
            recipe.build().noarch().value()
        );
        return new CondaMetadataResult(List.of(metadata), inputGlobs());
    }

    @Override
    public CondaBuildResult buildConda(CondaBuildParams params) {
        ChannelConfig channelConfig = channelConfig(params.channelConfiguration());
        List<URI> channels = channels(params.channelBaseUrls(), channelConfig);
        PlatformWithVirtualPackages host = platformOrCurrent(params.hostPlatform());
        PlatformWithVirtualPackages build = params.buildPlatformVirtualPackages() == null
            ? PlatformWithVirtualPackages.detect()
            : new PlatformWithVirtualPackages(Platform.current(), params.buildPlatformVirtualPackages());
        requireSupported(host.platform());

        Recipe recipe = recipe(host.platform(), build.platform(), channelConfig);
        requireSelected(recipe, params.outputs());
        BuildConfiguration configuration = configuration(recipe, channels, host, build, params.workDirectory());
        log.info("Building {} {} for {}", recipe.name(), recipe.version(), configuration.targetPlatform());
        List<Path> archives = TemporaryRenderedRecipe.create(configuration)
            .runWithin(recipeFile -> engine.build(configuration, recipeFile));

        List<CondaBuiltPackage> packages = new ArrayList<>(archives.size());
        for (Path archive : archives) {
            var identity = PackageArchives.identify(archive);
            packages.add(new CondaBuiltPackage(
                archive,
                inputGlobs(),
                identity.name(),
                identity.version(),
                identity.build(),
                configuration.targetPlatform()
            ));
        }
        return new CondaBuildResult(packages);
    }

    private ChannelConfig channelConfig(ChannelConfiguration configuration) {
        URI alias = configuration == null ? null : configuration.baseUrl();
        return new ChannelConfig(alias, manifest.root());
    }

    private List<URI> channels(List<URI> override, ChannelConfig channelConfig) {
        if (override != null) {
            return override;
        }
        try {
            return manifest.resolvedChannels(channelConfig);
        } catch (IllegalArgumentException ex) {
            throw BackendException.configuration("failed to determine channels from the manifest: " + ex.getMessage(), ex);
        }
    }

    private static PlatformWithVirtualPackages platformOrCurrent(PlatformAndVirtualPackages requested) {
        if (requested == null || requested.platform() == null) {
            return PlatformWithVirtualPackages.detect();
        }
        if (requested.virtualPackages() == null) {
            List<GenericVirtualPackage> detected = PlatformWithVirtualPackages.detect().virtualPackages();
            return new PlatformWithVirtualPackages(requested.platform(), requested.platform() == Platform.current() ? detected : List.of());
        }
        return requested.toPlatformWithVirtualPackages();
    }

    private void requireSupported(Platform hostPlatform) {
        if (!manifest.supportsTargetPlatform(hostPlatform)) {
            throw BackendException.configuration("the project does not support the target platform (" + hostPlatform + ")");
        }
    }

    private static void requireSelected(Recipe recipe, List<CondaOutputIdentifier> outputs) {
        if (outputs == null || outputs.isEmpty()) {
            return;
        }
        for (CondaOutputIdentifier output : outputs) {
            if (output.name() == null || output.name().equalsIgnoreCase(recipe.name())) {
                return;
            }
        }
        throw BackendException.configuration("none of the requested outputs is produced by this project (it builds '" + recipe.name() + "')");
    }

    private BuildConfiguration configuration(
        Recipe recipe,
        List<URI> channels,
        PlatformWithVirtualPackages host,
        PlatformWithVirtualPackages build,
        Path workDirectory
    ) {
        Instant timestamp = Instant.now();
        Path outputDir = workDirectory == null ? temporaryWorkDirectory() : workDirectory;
        Directories directories = Directories.setup(recipe.name(), manifest.path(), outputDir, false, timestamp);
        return new BuildConfiguration(
            recipe,
            directories,
            channels,
            targetPlatform(host.platform()),
            host,
            build,
            timestamp,
            cacheDirectory
        );
    }

    private static Path temporaryWorkDirectory() {
        try {
            return Files.createTempDirectory("lcod-build-backend-");
        } catch (IOException ex) {
            throw BackendException.artifactIo("failed to create temporary directory", ex);
        }
    }
}
