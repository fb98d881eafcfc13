package work.lcod.buildbackend.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import work.lcod.buildbackend.conda.Platform;

/**
 * Metadata of one package the backend can produce.
 *
 * @param noarch {@code python} or {@code generic}; absent for architecture specific packages
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CondaPackageMetadata(
    String name,
    String version,
    String build,
    int buildNumber,
    Platform subdir,
    List<String> depends,
    List<String> constraints,
    String license,
    String licenseFamily,
    String noarch
) {}
