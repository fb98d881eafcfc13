package work.lcod.buildbackend.conda;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * A system feature exposed to the solver as a package, e.g. {@code __glibc=2.35=0}.
 */
public record GenericVirtualPackage(
    @JsonProperty("name") String name,
    @JsonProperty("version") String version,
    @JsonProperty("buildString") String buildString
) {
    @JsonCreator
    public GenericVirtualPackage {
        Objects.requireNonNull(name, "name");
        version = version == null || version.isBlank() ? "0" : version;
        buildString = buildString == null || buildString.isBlank() ? "0" : buildString;
    }

    @Override
    public String toString() {
        return name + "=" + version + "=" + buildString;
    }
}
