package work.lcod.buildbackend.manifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.lcod.buildbackend.conda.PackageNames;

/**
 * Dependencies of one phase keyed by normalized package name.
 */
public final class DependencySet {
    private final Map<String, DependencySpec> specs = new LinkedHashMap<>();

    public DependencySet() {}

    public DependencySet(Map<String, DependencySpec> initial) {
        initial.forEach(this::put);
    }

    public DependencySet put(String name, DependencySpec spec) {
        specs.put(PackageNames.normalize(name), Objects.requireNonNull(spec, "spec"));
        return this;
    }

    /**
     * Adds every entry of {@code other}, replacing entries with the same name.
     */
    public DependencySet putAll(DependencySet other) {
        specs.putAll(other.specs);
        return this;
    }

    public Optional<DependencySpec> get(String name) {
        return Optional.ofNullable(specs.get(PackageNames.normalize(name)));
    }

    public boolean containsKey(String name) {
        return specs.containsKey(PackageNames.normalize(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(specs.keySet());
    }

    public Map<String, DependencySpec> asMap() {
        return Collections.unmodifiableMap(specs);
    }

    public boolean isEmpty() {
        return specs.isEmpty();
    }

    public int size() {
        return specs.size();
    }

    public DependencySet copy() {
        var copy = new DependencySet();
        copy.specs.putAll(specs);
        return copy;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DependencySet other && specs.equals(other.specs);
    }

    @Override
    public int hashCode() {
        return specs.hashCode();
    }

    @Override
    public String toString() {
        return specs.toString();
    }
}
