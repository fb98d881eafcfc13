package work.lcod.buildbackend.dependencies;

import java.util.List;
import java.util.Objects;
import work.lcod.buildbackend.conda.Platform;
import work.lcod.buildbackend.manifest.DependencySet;
import work.lcod.buildbackend.manifest.DependencySpec;
import work.lcod.buildbackend.manifest.Feature;
import work.lcod.buildbackend.manifest.ProjectManifest;
import work.lcod.buildbackend.manifest.SpecType;

/**
 * Groups the declared dependencies of a manifest by phase for one target platform and makes sure
 * the ecosystem's implicit host tools are present.
 */
public final class DependencyClassifier {
    private final HostToolPolicy hostTools;

    public DependencyClassifier(HostToolPolicy hostTools) {
        this.hostTools = Objects.requireNonNull(hostTools, "hostTools");
    }

    /**
     * Classifies the dependencies of the manifest's default feature. Every call returns fresh
     * sets; the manifest is never modified.
     */
    public ClassifiedDependencies classify(ProjectManifest manifest, Platform platform) {
        return classify(List.of(manifest.defaultFeature()), platform);
    }

    public ClassifiedDependencies classify(List<Feature> features, Platform platform) {
        var declared = new ClassifiedDependencies(
            collect(features, SpecType.BUILD, platform),
            collect(features, SpecType.HOST, platform),
            collect(features, SpecType.RUN, platform)
        );
        return ensureHostTools(declared, hostTools.requiredHostPackages(declared));
    }

    /**
     * Adds each required package to the host set unless it is already there: the run
     * specification is copied when the project declares one, otherwise the package is left
     * unconstrained.
     */
    static ClassifiedDependencies ensureHostTools(ClassifiedDependencies dependencies, List<String> required) {
        DependencySet host = dependencies.host().copy();
        for (String name : required) {
            if (host.containsKey(name)) {
                continue;
            }
            DependencySpec spec = dependencies.run().get(name).orElseGet(DependencySpec::any);
            host.put(name, spec);
        }
        return new ClassifiedDependencies(dependencies.build().copy(), host, dependencies.run().copy());
    }

    private static DependencySet collect(List<Feature> features, SpecType type, Platform platform) {
        var result = new DependencySet();
        for (Feature feature : features) {
            feature.dependencies(type, platform).ifPresent(result::putAll);
        }
        return result;
    }
}
