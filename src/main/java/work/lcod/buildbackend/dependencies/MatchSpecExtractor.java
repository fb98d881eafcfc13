package work.lcod.buildbackend.dependencies;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.buildbackend.conda.ChannelConfig;
import work.lcod.buildbackend.conda.MatchSpec;
import work.lcod.buildbackend.manifest.DependencySet;
import work.lcod.buildbackend.manifest.DependencySpec;
import work.lcod.buildbackend.shared.BackendException;
import work.lcod.buildbackend.shared.ErrorKind;

/**
 * Converts dependency declarations into match specs using a channel configuration.
 */
public final class MatchSpecExtractor {
    private static final Logger log = LoggerFactory.getLogger(MatchSpecExtractor.class);

    private final ChannelConfig channelConfig;
    private final boolean ignoreSelf;

    public MatchSpecExtractor(ChannelConfig channelConfig) {
        this(channelConfig, false);
    }

    private MatchSpecExtractor(ChannelConfig channelConfig, boolean ignoreSelf) {
        this.channelConfig = Objects.requireNonNull(channelConfig, "channelConfig");
        this.ignoreSelf = ignoreSelf;
    }

    /**
     * When {@code ignoreSelf} is set, path dependencies that point at the project root are
     * skipped instead of rejected.
     */
    public MatchSpecExtractor withIgnoreSelf(boolean ignoreSelf) {
        return new MatchSpecExtractor(channelConfig, ignoreSelf);
    }

    public List<MatchSpec> extract(DependencySet dependencies) {
        List<MatchSpec> specs = new ArrayList<>(dependencies.size());
        for (Map.Entry<String, DependencySpec> entry : dependencies.asMap().entrySet()) {
            String name = entry.getKey();
            DependencySpec spec = entry.getValue();
            if (spec instanceof DependencySpec.PathSource source && ignoreSelf && pointsAtRoot(source)) {
                log.debug("Skipping self-referencing dependency '{}'", name);
                continue;
            }
            if (spec.isSource()) {
                throw new BackendException(
                    ErrorKind.DEPENDENCY,
                    "recursive source dependencies are not yet supported (dependency '" + name + "')",
                    Map.of("dependency", name),
                    null
                );
            }
            specs.add(toMatchSpec(name, spec));
        }
        return specs;
    }

    private boolean pointsAtRoot(DependencySpec.PathSource source) {
        Path resolved = channelConfig.resolvePath(source.path());
        return resolved.equals(channelConfig.rootDir());
    }

    private MatchSpec toMatchSpec(String name, DependencySpec spec) {
        try {
            if (spec instanceof DependencySpec.Binary binary) {
                URI channel = binary.channelName().map(channelConfig::resolveChannel).orElse(null);
                return MatchSpec.of(name, binary.version(), binary.build(), channel);
            }
            if (spec instanceof DependencySpec.BinaryFile file) {
                String location = file.location();
                URI url = location.contains("://")
                    ? URI.create(location)
                    : channelConfig.resolvePath(location).toUri();
                return MatchSpec.ofUrl(name, url);
            }
        } catch (IllegalArgumentException ex) {
            throw new BackendException(
                ErrorKind.DEPENDENCY,
                "failed to convert dependency '" + name + "' into a match spec: " + ex.getMessage(),
                Map.of("dependency", name),
                ex
            );
        }
        throw new IllegalStateException("unhandled dependency specification " + spec.getClass().getSimpleName());
    }
}
