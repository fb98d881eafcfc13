package work.lcod.buildbackend.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import work.lcod.buildbackend.conda.GenericVirtualPackage;
import work.lcod.buildbackend.conda.Platform;
import work.lcod.buildbackend.conda.PlatformWithVirtualPackages;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlatformAndVirtualPackages(Platform platform, List<GenericVirtualPackage> virtualPackages) {
    public PlatformWithVirtualPackages toPlatformWithVirtualPackages() {
        return new PlatformWithVirtualPackages(platform, virtualPackages);
    }
}
