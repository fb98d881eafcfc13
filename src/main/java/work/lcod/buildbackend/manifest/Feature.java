package work.lcod.buildbackend.manifest;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.buildbackend.conda.Platform;

/**
 * Dependency declarations of one manifest feature, per phase and optionally per target platform.
 */
public final class Feature {
    public static final String DEFAULT_NAME = "default";

    private final String name;
    private final Map<SpecType, DependencySet> dependencies;
    private final Map<Platform, Map<SpecType, DependencySet>> targets;

    public Feature(String name, Map<SpecType, DependencySet> dependencies, Map<Platform, Map<SpecType, DependencySet>> targets) {
        this.name = Objects.requireNonNull(name, "name");
        this.dependencies = new EnumMap<>(SpecType.class);
        if (dependencies != null) {
            dependencies.forEach((type, set) -> this.dependencies.put(type, set.copy()));
        }
        this.targets = new LinkedHashMap<>();
        if (targets != null) {
            targets.forEach((platform, perType) -> {
                Map<SpecType, DependencySet> copy = new EnumMap<>(SpecType.class);
                perType.forEach((type, set) -> copy.put(type, set.copy()));
                this.targets.put(platform, copy);
            });
        }
    }

    public static Feature empty(String name) {
        return new Feature(name, Map.of(), Map.of());
    }

    public String name() {
        return name;
    }

    /**
     * Dependencies of the given phase that apply to {@code platform}: the platform independent
     * declarations overlaid with the ones under {@code [target.<platform>]}. Empty when the feature
     * declares nothing for that phase.
     */
    public Optional<DependencySet> dependencies(SpecType type, Platform platform) {
        DependencySet base = dependencies.get(type);
        DependencySet targeted = platform == null
            ? null
            : targets.getOrDefault(platform, Map.of()).get(type);
        if (base == null && targeted == null) {
            return Optional.empty();
        }
        var merged = new DependencySet();
        if (base != null) {
            merged.putAll(base);
        }
        if (targeted != null) {
            merged.putAll(targeted);
        }
        return Optional.of(merged);
    }
}
