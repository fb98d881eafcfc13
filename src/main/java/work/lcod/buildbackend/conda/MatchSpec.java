package work.lcod.buildbackend.conda;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/**
 * A named package requirement understood by the solver: {@code [channel::]name [version [build]]}
 * or {@code name @ url} for a direct archive reference.
 */
public final class MatchSpec {
    private final String name;
    private final VersionSpec version;
    private final String build;
    private final URI channel;
    private final URI url;

    private MatchSpec(String name, VersionSpec version, String build, URI channel, URI url) {
        this.name = PackageNames.normalize(name);
        this.version = version == null ? VersionSpec.ANY : version;
        this.build = build == null || build.isBlank() ? null : build.trim();
        this.channel = channel;
        this.url = url;
    }

    public static MatchSpec of(String name) {
        return new MatchSpec(name, VersionSpec.ANY, null, null, null);
    }

    public static MatchSpec of(String name, VersionSpec version) {
        return new MatchSpec(name, version, null, null, null);
    }

    public static MatchSpec of(String name, VersionSpec version, String build, URI channel) {
        return new MatchSpec(name, version, build, channel, null);
    }

    public static MatchSpec ofUrl(String name, URI url) {
        return new MatchSpec(name, VersionSpec.ANY, null, null, Objects.requireNonNull(url, "url"));
    }

    /**
     * Parses the textual forms produced by {@link #toString()} as well as the compact
     * {@code name>=1.0} form.
     */
    @JsonCreator
    public static MatchSpec parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("match spec must not be empty");
        }
        String text = raw.trim();
        int at = text.indexOf(" @ ");
        if (at > 0) {
            return ofUrl(text.substring(0, at), URI.create(text.substring(at + 3).trim()));
        }
        URI channel = null;
        int separator = text.lastIndexOf("::");
        if (separator > 0) {
            channel = URI.create(text.substring(0, separator));
            text = text.substring(separator + 2);
        }
        int nameEnd = 0;
        while (nameEnd < text.length() && " <>=!~".indexOf(text.charAt(nameEnd)) < 0) {
            nameEnd++;
        }
        String name = text.substring(0, nameEnd);
        String remainder = text.substring(nameEnd).trim();
        if (remainder.isEmpty()) {
            return new MatchSpec(name, VersionSpec.ANY, null, channel, null);
        }
        // "name >= 1.0 build" is written with the operator detached from its version
        String[] parts = remainder.replaceAll("([<>=!~]+)\\s+", "$1").split("\\s+");
        if (parts.length > 2) {
            throw new IllegalArgumentException("invalid match spec '" + raw + "'");
        }
        String build = parts.length == 2 ? parts[1] : null;
        return new MatchSpec(name, VersionSpec.parse(parts[0]), build, channel, null);
    }

    public String name() {
        return name;
    }

    public VersionSpec version() {
        return version;
    }

    public Optional<String> build() {
        return Optional.ofNullable(build);
    }

    public Optional<URI> channel() {
        return Optional.ofNullable(channel);
    }

    public Optional<URI> url() {
        return Optional.ofNullable(url);
    }

    @JsonValue
    @Override
    public String toString() {
        if (url != null) {
            return name + " @ " + url;
        }
        StringBuilder out = new StringBuilder();
        if (channel != null) {
            out.append(channel).append("::");
        }
        out.append(name);
        if (!version.isAny() || build != null) {
            out.append(' ').append(version);
        }
        if (build != null) {
            out.append(' ').append(build);
        }
        return out.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof MatchSpec other)) {
            return false;
        }
        return name.equals(other.name)
            && version.equals(other.version)
            && Objects.equals(build, other.build)
            && Objects.equals(channel, other.channel)
            && Objects.equals(url, other.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version, build, channel, url);
    }
}
