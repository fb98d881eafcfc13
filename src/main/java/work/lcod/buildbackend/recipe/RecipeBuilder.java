package work.lcod.buildbackend.recipe;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.buildbackend.conda.ChannelConfig;
import work.lcod.buildbackend.conda.MatchSpec;
import work.lcod.buildbackend.conda.PackageNames;
import work.lcod.buildbackend.conda.Platform;
import work.lcod.buildbackend.dependencies.ClassifiedDependencies;
import work.lcod.buildbackend.dependencies.MatchSpecExtractor;
import work.lcod.buildbackend.manifest.ProjectManifest;
import work.lcod.buildbackend.shared.BackendException;

/**
 * Turns a manifest and its classified dependencies into a {@link Recipe}.
 */
public final class RecipeBuilder {
    private static final Logger log = LoggerFactory.getLogger(RecipeBuilder.class);

    private final ChannelConfig channelConfig;

    public RecipeBuilder(ChannelConfig channelConfig) {
        this.channelConfig = Objects.requireNonNull(channelConfig, "channelConfig");
    }

    /**
     * Builds the recipe for {@code hostPlatform}. Fails with a configuration error before doing
     * anything else when the manifest has no name.
     */
    public Recipe build(
        ProjectManifest manifest,
        ClassifiedDependencies dependencies,
        Platform hostPlatform,
        RecipeTemplate template
    ) {
        String name = packageName(manifest);

        var extractor = new MatchSpecExtractor(channelConfig).withIgnoreSelf(template.ignoreSelf());
        var requirements = new Requirements(
            extractor.extract(dependencies.build()),
            extractor.extract(dependencies.host()),
            extractor.extract(dependencies.run())
        );
        List<MatchSpec> compilers = new ArrayList<>();
        for (String language : template.compilerLanguages()) {
            Compilers.compilerPackage(hostPlatform, language).ifPresent(compilers::add);
        }
        if (!compilers.isEmpty()) {
            log.debug("Adding compilers {} to build requirements of {}", compilers, name);
            requirements = requirements.withAdditionalBuild(compilers);
        }

        return new Recipe(
            name,
            manifest.versionOrDefault(),
            template.sources(),
            new BuildSection(0, template.script(), template.noarch()),
            requirements,
            About.from(manifest)
        );
    }

    private static String packageName(ProjectManifest manifest) {
        String raw = manifest.name()
            .orElseThrow(() -> BackendException.configuration("a 'name' field is required in the project manifest"));
        try {
            return PackageNames.normalize(raw);
        } catch (IllegalArgumentException ex) {
            throw BackendException.configuration("invalid package name in the project manifest: " + ex.getMessage(), ex);
        }
    }
}
