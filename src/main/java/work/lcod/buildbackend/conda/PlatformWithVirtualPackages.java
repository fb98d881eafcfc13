package work.lcod.buildbackend.conda;

import java.util.List;
import java.util.Objects;

/**
 * A platform together with the virtual packages the solver should assume for it.
 */
public record PlatformWithVirtualPackages(Platform platform, List<GenericVirtualPackage> virtualPackages) {
    public PlatformWithVirtualPackages {
        Objects.requireNonNull(platform, "platform");
        virtualPackages = virtualPackages == null ? List.of() : List.copyOf(virtualPackages);
    }

    /**
     * Describes the machine this process runs on, honouring {@code CONDA_OVERRIDE_*} variables.
     */
    public static PlatformWithVirtualPackages detect() {
        Platform platform = Platform.current();
        return new PlatformWithVirtualPackages(platform, VirtualPackages.detect(platform, System.getenv()));
    }
}
