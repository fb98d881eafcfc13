package work.lcod.buildbackend.recipe;

import java.util.Optional;
import work.lcod.buildbackend.manifest.ProjectManifest;

public record About(
    Optional<String> license,
    Optional<String> licenseFamily,
    Optional<String> homepage,
    Optional<String> repository,
    Optional<String> summary
) {
    public static About empty() {
        return new About(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static About from(ProjectManifest manifest) {
        return new About(
            manifest.license(),
            Optional.empty(),
            manifest.homepage(),
            manifest.repository(),
            manifest.description()
        );
    }
}
